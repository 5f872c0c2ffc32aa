// Part of Watchdigest
/**
 * Watchdigest is an identity-based change detector organized as a tree of watch groups.
 * Besides plain values, it can watch collections and maps and report structural diffs of them.
 * <p>
 * The main package {@link com.machinezoo.watchdigest} contains the detector and watch groups.
 * Package {@link com.machinezoo.watchdigest.diff} contains collection and map differs.
 * Package {@link com.machinezoo.watchdigest.playback} contains unrelated recorder of playback data.
 */
module com.machinezoo.watchdigest {
	exports com.machinezoo.watchdigest;
	exports com.machinezoo.watchdigest.diff;
	exports com.machinezoo.watchdigest.playback;
	exports com.machinezoo.watchdigest.util;
	requires com.machinezoo.stagean;
	/*
	 * NoException's ExceptionHandler appears in DigestExceptionHandler API.
	 */
	requires transitive com.machinezoo.noexception;
	requires com.machinezoo.closeablescope;
	/*
	 * SLF4J Logger can be passed to DigestExceptionHandler.log(Logger).
	 */
	requires transitive org.slf4j;
	requires com.google.common;
	requires io.opentracing.api;
	requires io.opentracing.util;
	requires it.unimi.dsi.fastutil;
	requires micrometer.core;
	/*
	 * ObjectMapper can be passed to PlaybackRecorder's constructor.
	 */
	requires transitive com.fasterxml.jackson.databind;
}
