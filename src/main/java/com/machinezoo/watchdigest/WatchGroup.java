// Part of Watchdigest
package com.machinezoo.watchdigest;

import java.util.*;
import com.machinezoo.stagean.*;
import com.machinezoo.watchdigest.util.*;

/*
 * All records of a ChangeDetector live in one doubly linked list ordered exactly like a digest visits them:
 * group's marker, group's own records, then every child group's run in creation order.
 * Group's records and all of its descendants' records thus form one contiguous run of the list.
 *
 * Every group remembers two boundaries of its run:
 * - ownTail is the last of its own records (or the marker if it has none), new records go right after it
 * - tail is the last node of the whole run including descendants, new child groups go right after it
 *
 * Removing a group unlinks its run by rewiring the two neighbors of the run, which is O(1) in the size of the subtree.
 * Ancestors whose run ended with the removed run have their tail moved back, which costs O(depth).
 * Appending behaves the same way: ancestors sharing the old tail move their tail forward.
 *
 * Removed group is cut off from its parent. Descendants keep their parent pointers,
 * so they can find out they are removed by walking up to the removed ancestor.
 */
/**
 * Group of watches that are reported in registration order and can be removed together.
 *
 * @param <H>
 *            type of the opaque handler attached to watches
 * @see ChangeDetector
 */
@StubDocs
public class WatchGroup<H> {
	private final ChangeDetector<H> detector;
	/**
	 * Returns root of the group tree this group belongs to.
	 *
	 * @return {@link ChangeDetector} that digests this group
	 */
	public ChangeDetector<H> detector() {
		return detector;
	}
	private WatchGroup<H> parent;
	/**
	 * @return parent group or {@code null} if this is the root or the group was removed
	 */
	public WatchGroup<H> parent() {
		return parent;
	}
	final WatchNode<H> marker = new WatchNode<>();
	private WatchNode<H> ownTail = marker;
	private WatchNode<H> tail = marker;
	private WatchGroup<H> firstChild;
	private WatchGroup<H> lastChild;
	private WatchGroup<H> previousSibling;
	private WatchGroup<H> nextSibling;
	private boolean detached;
	@SuppressWarnings("unchecked")
	WatchGroup(WatchGroup<H> parent) {
		this.parent = parent;
		detector = parent != null ? parent.detector : (ChangeDetector<H>)this;
		OwnerTrace.of(this)
			.alias("group")
			.parent(parent)
			.generateId();
	}
	/**
	 * Watches {@code selector} on {@code object}.
	 * The watch is reported after all watches previously registered in this group
	 * and before watches of this group's child groups.
	 *
	 * @param object
	 *            object to watch, which must be compatible with {@code selector}
	 * @param selector
	 *            what to watch on the object
	 * @param handler
	 *            opaque object passed through to {@link ChangeRecord#handler()}
	 * @return new {@link WatchRecord}
	 * @throws InvalidFieldSelectorException
	 *             if {@code selector} cannot be applied to {@code object}
	 * @throws IllegalStateException
	 *             if this group was removed
	 * @throws DigestInProgressException
	 *             if digest is running
	 */
	public WatchRecord<H> watch(Object object, FieldSelector selector, H handler) {
		Objects.requireNonNull(selector);
		detector.ensureIdle();
		if (removed())
			throw new IllegalStateException("Watch group was already removed.");
		WatchRecord<H> record = new WatchRecord<>(this, object, selector, handler);
		insert(ownTail, record);
		ownTail = record;
		return record;
	}
	/**
	 * Watches a selector given in string syntax.
	 *
	 * @param object
	 *            object to watch
	 * @param field
	 *            selector string as accepted by {@link FieldSelector#parse(String)}
	 * @param handler
	 *            opaque handler
	 * @return new {@link WatchRecord}
	 * @see #watch(Object, FieldSelector, Object)
	 */
	public WatchRecord<H> watch(Object object, String field, H handler) {
		return watch(object, FieldSelector.parse(field), handler);
	}
	/**
	 * Creates child group. Its watches are reported after watches of all previously created child groups.
	 *
	 * @return new child group
	 * @throws IllegalStateException
	 *             if this group was removed
	 * @throws DigestInProgressException
	 *             if digest is running
	 */
	public WatchGroup<H> newGroup() {
		detector.ensureIdle();
		if (removed())
			throw new IllegalStateException("Watch group was already removed.");
		WatchGroup<H> child = new WatchGroup<>(this);
		insert(tail, child.marker);
		child.previousSibling = lastChild;
		if (lastChild != null)
			lastChild.nextSibling = child;
		else
			firstChild = child;
		lastChild = child;
		return child;
	}
	/**
	 * Removes this group together with all its watches and all descendant groups.
	 * Calling this method on already removed group has no effect.
	 *
	 * @throws DigestInProgressException
	 *             if digest is running
	 */
	public void remove() {
		if (removed())
			return;
		detector.ensureIdle();
		WatchNode<H> before = marker.previous;
		WatchNode<H> after = tail.next;
		if (before != null)
			before.next = after;
		if (after != null)
			after.previous = before;
		marker.previous = null;
		tail.next = null;
		for (WatchGroup<H> ancestor = parent; ancestor != null && ancestor.tail == tail; ancestor = ancestor.parent)
			ancestor.tail = before;
		if (parent != null) {
			if (previousSibling != null)
				previousSibling.nextSibling = nextSibling;
			else
				parent.firstChild = nextSibling;
			if (nextSibling != null)
				nextSibling.previousSibling = previousSibling;
			else
				parent.lastChild = previousSibling;
		}
		previousSibling = null;
		nextSibling = null;
		parent = null;
		detached = true;
	}
	/**
	 * Returns {@code true} if this group or any of its ancestors has been removed.
	 *
	 * @return {@code true} if watches of this group no longer participate in digests
	 */
	public boolean removed() {
		for (WatchGroup<H> group = this; group != null; group = group.parent)
			if (group.detached)
				return true;
		return false;
	}
	/**
	 * @return snapshot of records registered directly in this group in registration order
	 */
	@SuppressWarnings("unchecked")
	public List<WatchRecord<H>> records() {
		List<WatchRecord<H>> records = new ArrayList<>();
		if (ownTail != marker) {
			for (WatchNode<H> node = marker.next;; node = node.next) {
				records.add((WatchRecord<H>)node);
				if (node == ownTail)
					break;
			}
		}
		return records;
	}
	/**
	 * @return snapshot of direct child groups in creation order
	 */
	public List<WatchGroup<H>> groups() {
		List<WatchGroup<H>> groups = new ArrayList<>();
		for (WatchGroup<H> child = firstChild; child != null; child = child.nextSibling)
			groups.add(child);
		return groups;
	}
	private void insert(WatchNode<H> anchor, WatchNode<H> node) {
		node.previous = anchor;
		node.next = anchor.next;
		if (anchor.next != null)
			anchor.next.previous = node;
		anchor.next = node;
		for (WatchGroup<H> group = this; group != null && group.tail == anchor; group = group.parent)
			group.tail = node;
	}
	void unlink(WatchRecord<H> record) {
		WatchNode<H> before = record.previous;
		WatchNode<H> after = record.next;
		before.next = after;
		if (after != null)
			after.previous = before;
		record.previous = null;
		record.next = null;
		if (ownTail == record)
			ownTail = before;
		for (WatchGroup<H> group = this; group != null && group.tail == record; group = group.parent)
			group.tail = before;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
