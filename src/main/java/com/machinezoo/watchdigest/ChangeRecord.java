// Part of Watchdigest
package com.machinezoo.watchdigest;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Change records of one digest pass form a singly linked list in registration order.
 * The link is written exactly once by ChangeDetector before the head is handed out,
 * so from the caller's point of view the whole record is immutable.
 */
/**
 * Snapshot of a {@link WatchRecord} taken when {@link WatchRecord#check()} detected a change.
 *
 * @param <H>
 *            type of the opaque handler
 * @see ChangeDetector#collectChanges()
 */
@StubDocs
public class ChangeRecord<H> implements Binding<H> {
	private final Object object;
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
	private final Object currentValue;
	@Override
	public Object currentValue() {
		return currentValue;
	}
	private final Object previousValue;
	@Override
	public Object previousValue() {
		return previousValue;
	}
	ChangeRecord(Binding<H> source) {
		object = source.object();
		selector = source.selector();
		handler = source.handler();
		currentValue = source.currentValue();
		previousValue = source.previousValue();
	}
	private ChangeRecord<H> next;
	/**
	 * Returns the following change detected in the same digest pass.
	 *
	 * @return next change in registration order or {@code null} if this is the last one
	 */
	public ChangeRecord<H> next() {
		return next;
	}
	void next(ChangeRecord<H> next) {
		if (this.next != null)
			throw new IllegalStateException("Change record is already linked.");
		this.next = next;
	}
	/**
	 * Collects this record and all records following it.
	 *
	 * @return list starting with this record
	 */
	public List<ChangeRecord<H>> list() {
		List<ChangeRecord<H>> list = new ArrayList<>();
		for (ChangeRecord<H> change = this; change != null; change = change.next)
			list.add(change);
		return list;
	}
	@Override
	public String toString() {
		return selector + " on " + object + ": " + previousValue + " -> " + currentValue;
	}
}
