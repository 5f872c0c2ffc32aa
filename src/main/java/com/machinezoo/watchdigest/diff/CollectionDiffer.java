// Part of Watchdigest
package com.machinezoo.watchdigest.diff;

import java.util.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.ints.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Structural diff of ordered collections under identity comparison.
 *
 * Items of the previous snapshot are bucketed by identity. Every bucket is a FIFO queue of previous indices,
 * so when the same object occurs several times, the first occurrence in the new iteration
 * is paired with the first unconsumed occurrence in the old one. Duplicates that merely shuffle
 * among themselves are then reported as moves at worst, never as removal plus addition.
 *
 * Moves are minimal. Shifting caused by insertions and removals is not a move.
 * Paired items whose previous indices form the longest increasing subsequence (in current order)
 * kept their relative order and are left alone. Every other paired item is reported as moved.
 * The subsequence is found by patience sorting in O(n log n).
 */
/**
 * Stateful differ that compares every iteration of a collection with the previous one.
 * A fresh differ has empty snapshot, so the first diff reports all items as additions.
 *
 * @param <T>
 *            type of collection items
 */
@StubDocs
public class CollectionDiffer<T> {
	private List<T> snapshot = Collections.emptyList();
	public CollectionChangeRecord<T> diff(Iterable<? extends T> iterable) {
		Objects.requireNonNull(iterable);
		List<T> current = new ArrayList<>();
		for (T item : iterable)
			current.add(item);
		Reference2ObjectMap<Object, IntArrayFIFOQueue> buckets = new Reference2ObjectOpenHashMap<>();
		for (int i = 0; i < snapshot.size(); ++i) {
			IntArrayFIFOQueue bucket = buckets.get(snapshot.get(i));
			if (bucket == null) {
				bucket = new IntArrayFIFOQueue();
				buckets.put(snapshot.get(i), bucket);
			}
			bucket.enqueue(i);
		}
		int[] origins = new int[current.size()];
		boolean[] survivors = new boolean[snapshot.size()];
		for (int i = 0; i < current.size(); ++i) {
			IntArrayFIFOQueue bucket = buckets.get(current.get(i));
			if (bucket != null && !bucket.isEmpty()) {
				origins[i] = bucket.dequeueInt();
				survivors[origins[i]] = true;
			} else
				origins[i] = CollectionChangeItem.NONE;
		}
		boolean[] stable = stable(origins);
		List<CollectionChangeItem<T>> items = new ArrayList<>(current.size());
		List<CollectionChangeItem<T>> additions = new ArrayList<>();
		List<CollectionChangeItem<T>> moves = new ArrayList<>();
		for (int i = 0; i < current.size(); ++i) {
			CollectionChangeItem<T> item = new CollectionChangeItem<>(origins[i], i, current.get(i));
			items.add(item);
			if (origins[i] == CollectionChangeItem.NONE)
				additions.add(item);
			else if (!stable[i])
				moves.add(item);
		}
		List<CollectionChangeItem<T>> removals = new ArrayList<>();
		for (int i = 0; i < snapshot.size(); ++i)
			if (!survivors[i])
				removals.add(new CollectionChangeItem<>(i, CollectionChangeItem.NONE, snapshot.get(i)));
		snapshot = current;
		return new CollectionChangeRecord<>(iterable, items, additions, moves, removals);
	}
	/*
	 * Marks current positions that belong to the longest run of paired items with increasing previous index.
	 * Previous indices are unique, so strict comparison is sufficient.
	 */
	private static boolean[] stable(int[] origins) {
		int[] tails = new int[origins.length];
		int[] links = new int[origins.length];
		int length = 0;
		for (int i = 0; i < origins.length; ++i) {
			if (origins[i] == CollectionChangeItem.NONE)
				continue;
			int low = 0;
			int high = length;
			while (low < high) {
				int middle = (low + high) >>> 1;
				if (origins[tails[middle]] < origins[i])
					low = middle + 1;
				else
					high = middle;
			}
			links[i] = low > 0 ? tails[low - 1] : -1;
			tails[low] = i;
			if (low == length)
				++length;
		}
		boolean[] stable = new boolean[origins.length];
		for (int i = length > 0 ? tails[length - 1] : -1; i >= 0; i = links[i])
			stable[i] = true;
		return stable;
	}
	@Override
	public String toString() {
		return "CollectionDiffer: " + snapshot;
	}
}
