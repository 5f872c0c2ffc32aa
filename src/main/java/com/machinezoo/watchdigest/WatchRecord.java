// Part of Watchdigest
package com.machinezoo.watchdigest;

import java.util.*;
import com.google.common.primitives.*;
import com.machinezoo.stagean.*;
import com.machinezoo.watchdigest.diff.*;
import com.machinezoo.watchdigest.util.*;

/*
 * The initial value is captured when the record is created. A digest right after registration thus reports nothing,
 * and the first reported change is always a real change since registration.
 *
 * Values are compared by reference. Callers who want equality semantics can watch an immutable object
 * that is replaced on change. The only exception are boxed primitives. Accessors returning primitives
 * produce a fresh box on every read, so two boxes of the same wrapper type are compared by value.
 */
/**
 * Single watched binding of an object and a {@link FieldSelector}.
 * Records are created by {@link WatchGroup#watch(Object, FieldSelector, Object)}.
 *
 * @param <H>
 *            type of the opaque handler
 */
@DraftDocs("document typical handler patterns")
public class WatchRecord<H> extends WatchNode<H> implements Binding<H> {
	private final WatchGroup<H> group;
	public WatchGroup<H> group() {
		return group;
	}
	private Object object;
	@Override
	public Object object() {
		return object;
	}
	private final FieldSelector selector;
	@Override
	public FieldSelector selector() {
		return selector;
	}
	private final H handler;
	@Override
	public H handler() {
		return handler;
	}
	private Object currentValue;
	@Override
	public Object currentValue() {
		return currentValue;
	}
	private Object previousValue;
	@Override
	public Object previousValue() {
		return previousValue;
	}
	private FieldReader reader;
	/*
	 * Only one of the differs is ever created, depending on selector kind.
	 */
	private CollectionDiffer<Object> items;
	private MapDiffer<Object, Object> entries;
	WatchRecord(WatchGroup<H> group, Object object, FieldSelector selector, H handler) {
		this.group = group;
		this.selector = selector;
		this.handler = handler;
		this.object = object;
		reader = FieldReader.of(selector, object);
		switch (selector.kind()) {
		case ITEMS:
			items = new CollectionDiffer<>();
			currentValue = items.diff((Iterable<?>)reader.read(object));
			break;
		case ENTRIES:
			entries = new MapDiffer<>();
			currentValue = entries.diff((Map<?, ?>)reader.read(object));
			break;
		default:
			currentValue = reader.read(object);
			break;
		}
		OwnerTrace.of(this)
			.alias("watch")
			.parent(group)
			.tag("selector", selector.toString());
	}
	/**
	 * Points this watch at another object.
	 * The selector is validated against the new object immediately.
	 * The next {@link #check()} compares the new object's value with the last value observed on the old object.
	 *
	 * @param object
	 *            new object to watch
	 * @throws InvalidFieldSelectorException
	 *             if {@link #selector()} cannot be applied to {@code object}
	 * @throws DigestInProgressException
	 *             if digest is running
	 */
	public void object(Object object) {
		group.detector().ensureIdle();
		reader = FieldReader.of(selector, object);
		this.object = object;
	}
	/**
	 * Re-reads the watched value and compares it with the last observed value.
	 * This is normally called by {@link ChangeDetector#collectChanges()}, but it can be also called directly.
	 *
	 * @return snapshot of this record if a change was detected, {@code null} otherwise
	 */
	public ChangeRecord<H> check() {
		switch (selector.kind()) {
		case ITEMS: {
			CollectionChangeRecord<Object> diff = items.diff((Iterable<?>)reader.read(object));
			currentValue = diff;
			return diff.changed() ? new ChangeRecord<>(this) : null;
		}
		case ENTRIES: {
			MapChangeRecord<Object, Object> diff = entries.diff((Map<?, ?>)reader.read(object));
			currentValue = diff;
			return diff.changed() ? new ChangeRecord<>(this) : null;
		}
		default: {
			Object value = reader.read(object);
			if (same(value, currentValue))
				return null;
			previousValue = currentValue;
			currentValue = value;
			return new ChangeRecord<>(this);
		}
		}
	}
	private static boolean same(Object left, Object right) {
		if (left == right)
			return true;
		if (left == null || right == null || left.getClass() != right.getClass())
			return false;
		return Primitives.isWrapperType(left.getClass()) && left.equals(right);
	}
	private boolean removed;
	/**
	 * Returns {@code true} if this record or any of its ancestor groups has been removed.
	 *
	 * @return {@code true} if this record no longer participates in digests
	 */
	public boolean removed() {
		return removed || group.removed();
	}
	/**
	 * Removes this record from its group. Sibling records and groups are not affected.
	 * Calling this method on already removed record has no effect.
	 *
	 * @throws DigestInProgressException
	 *             if digest is running
	 */
	public void remove() {
		if (removed)
			return;
		group.detector().ensureIdle();
		group.unlink(this);
		removed = true;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + currentValue;
	}
}
