// Part of Watchdigest
package com.machinezoo.watchdigest.diff;

import java.util.*;

/**
 * Position of one item before and after {@link CollectionDiffer#diff(Iterable)}.
 *
 * @param <T>
 *            type of collection items
 */
public class CollectionChangeItem<T> {
	/**
	 * Index value used for missing positions.
	 */
	public static final int NONE = -1;
	private final int previousIndex;
	/**
	 * @return index in the previous snapshot or {@link #NONE} for additions
	 */
	public int previousIndex() {
		return previousIndex;
	}
	private final int currentIndex;
	/**
	 * @return index in the current iteration or {@link #NONE} for removals
	 */
	public int currentIndex() {
		return currentIndex;
	}
	private final T item;
	public T item() {
		return item;
	}
	public CollectionChangeItem(int previousIndex, int currentIndex, T item) {
		if (previousIndex < NONE || currentIndex < NONE)
			throw new IllegalArgumentException();
		this.previousIndex = previousIndex;
		this.currentIndex = currentIndex;
		this.item = item;
	}
	public boolean added() {
		return previousIndex == NONE;
	}
	public boolean removed() {
		return currentIndex == NONE;
	}
	/*
	 * Items are compared by identity everywhere else, so equality here is identity of the item plus both positions.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof CollectionChangeItem))
			return false;
		CollectionChangeItem<?> other = (CollectionChangeItem<?>)obj;
		return previousIndex == other.previousIndex && currentIndex == other.currentIndex && item == other.item;
	}
	@Override
	public int hashCode() {
		return Objects.hash(previousIndex, currentIndex, System.identityHashCode(item));
	}
	@Override
	public String toString() {
		if (previousIndex == currentIndex)
			return String.valueOf(item);
		return item + "[" + (previousIndex == NONE ? "null" : previousIndex) + "->" + (currentIndex == NONE ? "null" : currentIndex) + "]";
	}
}
