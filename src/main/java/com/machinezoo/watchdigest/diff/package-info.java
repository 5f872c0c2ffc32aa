// Part of Watchdigest
/**
 * Structural diffs of collections and maps under identity comparison.
 * Differs are usable on their own, but they are normally owned by watch records.
 */
package com.machinezoo.watchdigest.diff;
