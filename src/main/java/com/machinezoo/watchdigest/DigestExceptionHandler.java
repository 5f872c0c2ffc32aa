// Part of Watchdigest
package com.machinezoo.watchdigest;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.noexception.*;

/**
 * Receives failures of individual watches during {@link ChangeDetector#collectChanges(DigestExceptionHandler)}.
 * Digest continues with the next watch after the handler returns.
 * If the handler throws, the digest is aborted and the exception propagates to the caller.
 */
@FunctionalInterface
public interface DigestExceptionHandler {
	/**
	 * Handles failure of one watch.
	 *
	 * @param exception
	 *            exception thrown while checking the watch
	 * @param record
	 *            watch that failed
	 */
	void handle(Throwable exception, Binding<?> record);
	/**
	 * Creates handler that logs failures at error level and lets the digest continue.
	 *
	 * @param logger
	 *            SLF4J logger to write to
	 * @return logging handler
	 */
	static DigestExceptionHandler log(Logger logger) {
		Objects.requireNonNull(logger);
		return (exception, record) -> logger.error("Failed to check {}.", record, exception);
	}
	static DigestExceptionHandler log() {
		return log(LoggerFactory.getLogger(ChangeDetector.class));
	}
	/**
	 * Adapts NoException's {@link ExceptionHandler}.
	 * Exceptions the handler reports as handled let the digest continue.
	 * Unhandled exceptions abort the digest.
	 *
	 * @param handler
	 *            NoException handler to delegate to
	 * @return adapted handler
	 */
	static DigestExceptionHandler of(ExceptionHandler handler) {
		Objects.requireNonNull(handler);
		return (exception, record) -> {
			if (!handler.handle(exception))
				throw Failures.propagate(exception);
		};
	}
}
