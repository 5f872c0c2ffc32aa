// Part of Watchdigest
package com.machinezoo.watchdigest;

/**
 * Thrown when {@link FieldSelector} cannot be applied to the watched object.
 * Selectors are validated when the watch is registered or retargeted, never during digest.
 *
 * @see WatchGroup#watch(Object, FieldSelector, Object)
 * @see WatchRecord#object(Object)
 */
public class InvalidFieldSelectorException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;
	private final transient FieldSelector selector;
	public FieldSelector selector() {
		return selector;
	}
	public InvalidFieldSelectorException(FieldSelector selector, String message) {
		super(message);
		this.selector = selector;
	}
	public InvalidFieldSelectorException(FieldSelector selector, String message, Throwable cause) {
		super(message, cause);
		this.selector = selector;
	}
}
