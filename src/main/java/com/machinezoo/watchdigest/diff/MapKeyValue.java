// Part of Watchdigest
package com.machinezoo.watchdigest.diff;

import java.util.*;

/**
 * One map key with its value before and after {@link MapDiffer#diff(Map)}.
 * Additions have {@code null} previous value and removals have {@code null} current value.
 * Use {@link #added()} and {@link #removed()} to tell these apart from {@code null} values stored in the map.
 *
 * @param <K>
 *            type of map keys
 * @param <V>
 *            type of map values
 */
public class MapKeyValue<K, V> {
	private final K key;
	public K key() {
		return key;
	}
	private final V previousValue;
	public V previousValue() {
		return previousValue;
	}
	private final V currentValue;
	public V currentValue() {
		return currentValue;
	}
	private final boolean added;
	public boolean added() {
		return added;
	}
	private final boolean removed;
	public boolean removed() {
		return removed;
	}
	MapKeyValue(K key, V previousValue, V currentValue, boolean added, boolean removed) {
		this.key = key;
		this.previousValue = previousValue;
		this.currentValue = currentValue;
		this.added = added;
		this.removed = removed;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof MapKeyValue))
			return false;
		MapKeyValue<?, ?> other = (MapKeyValue<?, ?>)obj;
		return Objects.equals(key, other.key)
			&& previousValue == other.previousValue
			&& currentValue == other.currentValue
			&& added == other.added
			&& removed == other.removed;
	}
	@Override
	public int hashCode() {
		return Objects.hash(key, System.identityHashCode(previousValue), System.identityHashCode(currentValue));
	}
	@Override
	public String toString() {
		if (added)
			return key + "[null->" + currentValue + "]";
		if (removed)
			return key + "[" + previousValue + "->null]";
		if (previousValue == currentValue)
			return key + "[" + currentValue + "]";
		return key + "[" + previousValue + "->" + currentValue + "]";
	}
}
