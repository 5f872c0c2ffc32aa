// Part of Watchdigest
package com.machinezoo.watchdigest.diff;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/**
 * Changes of a {@link Map} since the previous {@link MapDiffer#diff(Map)}.
 * Entries, changes, and additions follow the map's current iteration order.
 * Removals follow iteration order of the previous snapshot.
 *
 * @param <K>
 *            type of map keys
 * @param <V>
 *            type of map values
 */
@StubDocs
public class MapChangeRecord<K, V> {
	private final Map<? extends K, ? extends V> map;
	public Map<? extends K, ? extends V> map() {
		return map;
	}
	private final List<MapKeyValue<K, V>> entries;
	public List<MapKeyValue<K, V>> entries() {
		return entries;
	}
	private final List<MapKeyValue<K, V>> changes;
	public List<MapKeyValue<K, V>> changes() {
		return changes;
	}
	private final List<MapKeyValue<K, V>> additions;
	public List<MapKeyValue<K, V>> additions() {
		return additions;
	}
	private final List<MapKeyValue<K, V>> removals;
	public List<MapKeyValue<K, V>> removals() {
		return removals;
	}
	MapChangeRecord(
		Map<? extends K, ? extends V> map,
		List<MapKeyValue<K, V>> entries,
		List<MapKeyValue<K, V>> changes,
		List<MapKeyValue<K, V>> additions,
		List<MapKeyValue<K, V>> removals) {
		this.map = map;
		this.entries = Collections.unmodifiableList(entries);
		this.changes = Collections.unmodifiableList(changes);
		this.additions = Collections.unmodifiableList(additions);
		this.removals = Collections.unmodifiableList(removals);
	}
	/**
	 * @return {@code true} if there is at least one change, addition, or removal
	 */
	public boolean changed() {
		return !changes.isEmpty() || !additions.isEmpty() || !removals.isEmpty();
	}
	public void forEachChange(Consumer<? super MapKeyValue<K, V>> action) {
		changes.forEach(action);
	}
	public void forEachAddition(Consumer<? super MapKeyValue<K, V>> action) {
		additions.forEach(action);
	}
	public void forEachRemoval(Consumer<? super MapKeyValue<K, V>> action) {
		removals.forEach(action);
	}
	@Override
	public String toString() {
		return "map: " + entries + "\n"
			+ "changes: " + changes + "\n"
			+ "additions: " + additions + "\n"
			+ "removals: " + removals;
	}
}
