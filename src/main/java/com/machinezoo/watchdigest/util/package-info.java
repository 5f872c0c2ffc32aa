// Part of Watchdigest
/**
 * Diagnostic helpers.
 */
package com.machinezoo.watchdigest.util;
