// Part of Watchdigest
package com.machinezoo.watchdigest.diff;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Every diff produces a fresh record. Handlers may keep a record around after the next digest
 * without seeing it change underneath them.
 */
/**
 * Structural changes of an {@link Iterable} since the previous {@link CollectionDiffer#diff(Iterable)}.
 * All lists are in iteration order of the collection, except {@link #removals()},
 * which follow order of the previous snapshot.
 *
 * @param <T>
 *            type of collection items
 */
@StubDocs
public class CollectionChangeRecord<T> {
	private final Iterable<? extends T> iterable;
	public Iterable<? extends T> iterable() {
		return iterable;
	}
	private final List<CollectionChangeItem<T>> items;
	/**
	 * @return all current items including positions in the previous snapshot
	 */
	public List<CollectionChangeItem<T>> items() {
		return items;
	}
	private final List<CollectionChangeItem<T>> additions;
	public List<CollectionChangeItem<T>> additions() {
		return additions;
	}
	private final List<CollectionChangeItem<T>> moves;
	public List<CollectionChangeItem<T>> moves() {
		return moves;
	}
	private final List<CollectionChangeItem<T>> removals;
	public List<CollectionChangeItem<T>> removals() {
		return removals;
	}
	CollectionChangeRecord(
		Iterable<? extends T> iterable,
		List<CollectionChangeItem<T>> items,
		List<CollectionChangeItem<T>> additions,
		List<CollectionChangeItem<T>> moves,
		List<CollectionChangeItem<T>> removals) {
		this.iterable = iterable;
		this.items = Collections.unmodifiableList(items);
		this.additions = Collections.unmodifiableList(additions);
		this.moves = Collections.unmodifiableList(moves);
		this.removals = Collections.unmodifiableList(removals);
	}
	/**
	 * @return {@code true} if there is at least one addition, move, or removal
	 */
	public boolean changed() {
		return !additions.isEmpty() || !moves.isEmpty() || !removals.isEmpty();
	}
	public void forEachAddition(Consumer<? super CollectionChangeItem<T>> action) {
		additions.forEach(action);
	}
	public void forEachMove(Consumer<? super CollectionChangeItem<T>> action) {
		moves.forEach(action);
	}
	public void forEachRemoval(Consumer<? super CollectionChangeItem<T>> action) {
		removals.forEach(action);
	}
	@Override
	public String toString() {
		return "collection: " + items + "\n"
			+ "additions: " + additions + "\n"
			+ "moves: " + moves + "\n"
			+ "removals: " + removals;
	}
}
