// Part of Watchdigest
package com.machinezoo.watchdigest;

import com.machinezoo.watchdigest.diff.*;

/**
 * Watched binding state shared by live {@link WatchRecord}s and {@link ChangeRecord} snapshots.
 *
 * @param <H>
 *            type of the opaque handler
 */
public interface Binding<H> {
	/**
	 * Returns the observed object.
	 *
	 * @return observed object, may be {@code null} for {@link FieldSelector.Kind#IDENTITY} watches
	 */
	Object object();
	FieldSelector selector();
	/**
	 * Returns application-provided handler. It is never interpreted by the change detector.
	 *
	 * @return handler passed to {@link WatchGroup#watch(Object, FieldSelector, Object)}
	 */
	H handler();
	/**
	 * Returns current value of the watched selector.
	 * For {@link FieldSelector.Kind#ITEMS} this is {@link CollectionChangeRecord}
	 * and for {@link FieldSelector.Kind#ENTRIES} it is {@link MapChangeRecord}.
	 *
	 * @return latest observed value
	 */
	Object currentValue();
	/**
	 * Returns the value observed before {@link #currentValue()}.
	 * Always {@code null} for {@link FieldSelector.Kind#ITEMS} and {@link FieldSelector.Kind#ENTRIES}.
	 *
	 * @return previously observed value
	 */
	Object previousValue();
}
