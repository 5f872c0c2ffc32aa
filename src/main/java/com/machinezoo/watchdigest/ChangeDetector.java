// Part of Watchdigest
package com.machinezoo.watchdigest;

import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import com.machinezoo.watchdigest.util.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Change detector is the root watch group plus the digest loop.
 * Applications can have several detectors, each checking a different part of the application state.
 *
 * Digest simply walks the group's linked list. Markers of groups are skipped.
 * The list is already in the required order (own records first, then child groups in creation order),
 * so no tree traversal is needed.
 *
 * Failure policy:
 * - With exception handler, every failing record is reported to the handler and the digest continues.
 * - Without handler, the first failure propagates unchanged and changes collected so far are discarded.
 *   Records checked before the failure have already advanced their current value, so their changes are lost.
 *
 * Detector is single-threaded. Digest marks itself as running and all tree mutations check the mark.
 * Mutations are rejected, not queued. See DigestInProgressException.
 */
/**
 * Root of a watch group tree that can detect changes in all watches of the tree.
 * Changes are detected by identity comparison, not by calling {@link Object#equals(Object)}.
 * <p>
 * This class is not thread-safe.
 *
 * @param <H>
 *            type of the opaque handler attached to watches
 */
@StubDocs
public class ChangeDetector<H> extends WatchGroup<H> {
	private static final Timer timer = Metrics.timer("watchdigest.digest.passes");
	private static final Counter changeCount = Metrics.counter("watchdigest.digest.changes");
	private static final Counter exceptionCount = Metrics.counter("watchdigest.digest.exceptions");
	public ChangeDetector() {
		super(null);
		OwnerTrace.of(this).alias("detector");
	}
	private DigestExceptionHandler exceptionHandler;
	public DigestExceptionHandler exceptionHandler() {
		return exceptionHandler;
	}
	/**
	 * Configures exception handler used by {@link #collectChanges()}.
	 * Default is {@code null}, which makes any failing watch abort the digest.
	 *
	 * @param exceptionHandler
	 *            default exception handler or {@code null}
	 * @return {@code this} (fluent method)
	 */
	public ChangeDetector<H> exceptionHandler(DigestExceptionHandler exceptionHandler) {
		ensureIdle();
		this.exceptionHandler = exceptionHandler;
		return this;
	}
	private boolean digesting;
	/**
	 * @return {@code true} while {@link #collectChanges()} is running
	 */
	public boolean digesting() {
		return digesting;
	}
	void ensureIdle() {
		if (digesting)
			throw new DigestInProgressException();
	}
	private CloseableScope digest() {
		if (digesting)
			throw new DigestInProgressException("Digest is already in progress.");
		digesting = true;
		return () -> digesting = false;
	}
	/**
	 * Checks all watches using the configured {@link #exceptionHandler()}.
	 *
	 * @return first detected change or {@code null} if nothing changed
	 * @see #collectChanges(DigestExceptionHandler)
	 */
	public ChangeRecord<H> collectChanges() {
		return collectChanges(exceptionHandler);
	}
	/**
	 * Checks all watches and links detected changes into a list in registration order.
	 * Group's own watches come before watches of its child groups and child groups are visited in creation order.
	 *
	 * @param handler
	 *            receives failures of individual watches, {@code null} to abort the digest on first failure
	 * @return first detected change or {@code null} if nothing changed
	 * @throws DigestInProgressException
	 *             if called from within running digest of this detector
	 */
	@SuppressWarnings("unchecked")
	public ChangeRecord<H> collectChanges(DigestExceptionHandler handler) {
		try (CloseableScope pass = digest()) {
			if (removed())
				return null;
			Span span = GlobalTracer.get().buildSpan("watchdigest.digest")
				.withTag("component", "watchdigest")
				.start();
			OwnerTrace.of(this).fill(span);
			Timer.Sample sample = Timer.start(Clock.SYSTEM);
			try (Scope trace = GlobalTracer.get().activateSpan(span)) {
				ChangeRecord<H> head = null;
				ChangeRecord<H> last = null;
				int count = 0;
				for (WatchNode<H> node = marker.next; node != null; node = node.next) {
					if (!(node instanceof WatchRecord))
						continue;
					WatchRecord<H> record = (WatchRecord<H>)node;
					ChangeRecord<H> change;
					try {
						change = record.check();
					} catch (Throwable ex) {
						exceptionCount.increment();
						if (handler == null)
							throw ex;
						handler.handle(ex, record);
						continue;
					}
					if (change != null) {
						if (last != null)
							last.next(change);
						else
							head = change;
						last = change;
						++count;
					}
				}
				changeCount.increment(count);
				return head;
			} finally {
				sample.stop(timer);
				span.finish();
			}
		}
	}
}
