// Part of Watchdigest
/**
 * Recording of observed key/data pairs and their export into playback data document.
 * This package does not depend on the change detector.
 */
package com.machinezoo.watchdigest.playback;
