// Part of Watchdigest
package com.machinezoo.watchdigest;

/*
 * Mutations are rejected, not queued. The watch tree is left exactly as it was before the rejected call.
 */
/**
 * Thrown when the watch tree is modified or a nested digest is started while {@link ChangeDetector#collectChanges()} is running.
 */
public class DigestInProgressException extends IllegalStateException {
	private static final long serialVersionUID = 1L;
	public DigestInProgressException() {
		super("Cannot modify watches while digest is in progress.");
	}
	public DigestInProgressException(String message) {
		super(message);
	}
}
