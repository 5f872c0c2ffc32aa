// Part of Watchdigest
package com.machinezoo.watchdigest.diff;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Keys are stable identifiers, so there is no notion of a move.
 * Keys are matched with equals() like the map itself does it, but values are compared by identity.
 *
 * The snapshot is a LinkedHashMap copy. We don't query the watched map for removed keys,
 * because that would run the watched map's own lookup logic a second time per key.
 */
/**
 * Stateful differ that compares every state of a map with the previous one.
 * A fresh differ has empty snapshot, so the first diff reports all entries as additions.
 *
 * @param <K>
 *            type of map keys
 * @param <V>
 *            type of map values
 */
@StubDocs
public class MapDiffer<K, V> {
	private Map<K, V> snapshot = Collections.emptyMap();
	public MapChangeRecord<K, V> diff(Map<? extends K, ? extends V> map) {
		Objects.requireNonNull(map);
		Map<K, V> current = new LinkedHashMap<>();
		List<MapKeyValue<K, V>> entries = new ArrayList<>(map.size());
		List<MapKeyValue<K, V>> changes = new ArrayList<>();
		List<MapKeyValue<K, V>> additions = new ArrayList<>();
		for (Map.Entry<? extends K, ? extends V> entry : map.entrySet()) {
			K key = entry.getKey();
			V value = entry.getValue();
			current.put(key, value);
			MapKeyValue<K, V> kv;
			if (!snapshot.containsKey(key)) {
				kv = new MapKeyValue<>(key, null, value, true, false);
				additions.add(kv);
			} else {
				V previous = snapshot.get(key);
				kv = new MapKeyValue<>(key, previous, value, false, false);
				if (previous != value)
					changes.add(kv);
			}
			entries.add(kv);
		}
		List<MapKeyValue<K, V>> removals = new ArrayList<>();
		for (Map.Entry<K, V> entry : snapshot.entrySet())
			if (!current.containsKey(entry.getKey()))
				removals.add(new MapKeyValue<>(entry.getKey(), entry.getValue(), null, false, true));
		snapshot = current;
		return new MapChangeRecord<>(map, entries, changes, additions, removals);
	}
	@Override
	public String toString() {
		return "MapDiffer: " + snapshot;
	}
}
