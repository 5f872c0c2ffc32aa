// Part of Watchdigest
package com.machinezoo.watchdigest.diff;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.stream.*;
import org.junit.jupiter.api.*;

public class CollectionDifferTest {
	private final CollectionDiffer<Object> differ = new CollectionDiffer<>();
	private final Object a = new Named("a");
	private final Object b = new Named("b");
	private final Object c = new Named("c");
	private final Object d = new Named("d");
	private final Object e = new Named("e");
	private static class Named {
		final String name;
		Named(String name) {
			this.name = name;
		}
		@Override
		public String toString() {
			return name;
		}
	}
	private CollectionChangeRecord<Object> diff(Object... items) {
		return differ.diff(Arrays.asList(items));
	}
	private static List<Object> items(List<CollectionChangeItem<Object>> list) {
		return list.stream().map(CollectionChangeItem::item).collect(Collectors.toList());
	}
	@Test
	public void initial() {
		CollectionChangeRecord<Object> r = diff(a, b);
		// Fresh differ reports everything as added.
		assertThat(items(r.additions()), contains(a, b));
		assertThat(r.moves(), is(empty()));
		assertThat(r.removals(), is(empty()));
		assertTrue(r.changed());
		assertTrue(r.additions().get(0).added());
		assertEquals(CollectionChangeItem.NONE, r.additions().get(1).previousIndex());
		assertEquals(1, r.additions().get(1).currentIndex());
	}
	@Test
	public void unchanged() {
		diff(a, b, c);
		List<Object> list = Arrays.asList(a, b, c);
		CollectionChangeRecord<Object> r = differ.diff(list);
		assertFalse(r.changed());
		assertSame(list, r.iterable());
		assertThat(items(r.items()), contains(a, b, c));
		for (CollectionChangeItem<Object> item : r.items())
			assertEquals(item.previousIndex(), item.currentIndex());
	}
	@Test
	public void append() {
		diff(a, b, c);
		CollectionChangeRecord<Object> r = diff(a, b, c, d);
		assertEquals(1, r.additions().size());
		CollectionChangeItem<Object> added = r.additions().get(0);
		assertSame(d, added.item());
		assertEquals(CollectionChangeItem.NONE, added.previousIndex());
		assertEquals(3, added.currentIndex());
		assertThat(r.moves(), is(empty()));
		assertThat(r.removals(), is(empty()));
	}
	@Test
	public void insertInTheMiddle() {
		diff(a, b, c);
		CollectionChangeRecord<Object> r = diff(a, d, b, c);
		assertThat(items(r.additions()), contains(d));
		// Items shifted by the insertion are not moves.
		assertThat(r.moves(), is(empty()));
		assertThat(r.removals(), is(empty()));
		assertEquals(1, r.items().get(2).previousIndex());
		assertEquals(2, r.items().get(2).currentIndex());
	}
	@Test
	public void removeFromTheMiddle() {
		diff(a, b, c, d);
		CollectionChangeRecord<Object> r = diff(a, c, d);
		assertThat(r.additions(), is(empty()));
		assertThat(r.moves(), is(empty()));
		assertEquals(1, r.removals().size());
		CollectionChangeItem<Object> removed = r.removals().get(0);
		assertSame(b, removed.item());
		assertEquals(1, removed.previousIndex());
		assertEquals(CollectionChangeItem.NONE, removed.currentIndex());
		assertTrue(removed.removed());
	}
	@Test
	public void swap() {
		diff(a, b, c, d);
		CollectionChangeRecord<Object> r = diff(b, a, c, d);
		assertThat(r.additions(), is(empty()));
		assertThat(r.removals(), is(empty()));
		// Only one of the swapped items has to move.
		assertEquals(1, r.moves().size());
		assertThat(r.moves().get(0).item(), is(anyOf(sameInstance(a), sameInstance(b))));
	}
	@Test
	public void rotate() {
		diff(a, b, c, d, e);
		CollectionChangeRecord<Object> r = diff(b, c, d, e, a);
		assertThat(items(r.moves()), contains(a));
		CollectionChangeItem<Object> moved = r.moves().get(0);
		assertEquals(0, moved.previousIndex());
		assertEquals(4, moved.currentIndex());
	}
	@Test
	public void reverse() {
		diff(a, b, c, d);
		CollectionChangeRecord<Object> r = diff(d, c, b, a);
		// Only one item can keep its place, all others move.
		assertEquals(3, r.moves().size());
		assertThat(r.additions(), is(empty()));
		assertThat(r.removals(), is(empty()));
	}
	@Test
	public void mixed() {
		diff(a, b, c, d);
		CollectionChangeRecord<Object> r = diff(e, c, a, d);
		assertThat(items(r.additions()), contains(e));
		assertThat(items(r.removals()), contains(b));
		assertEquals(1, r.moves().size());
		assertThat(items(r.items()), contains(e, c, a, d));
		// Moves, additions, and removals are disjoint.
		assertThat(r.moves().get(0).item(), is(anyOf(sameInstance(a), sameInstance(c))));
	}
	@Test
	public void duplicates() {
		Object one = new Named("1");
		Object two = new Named("2");
		diff(one, one, two);
		CollectionChangeRecord<Object> r = diff(one, two, one);
		// Reordering among duplicates never produces additions or removals.
		assertThat(r.additions(), is(empty()));
		assertThat(r.removals(), is(empty()));
		assertEquals(1, r.moves().size());
		// Occurrences are paired first-in first-out.
		assertEquals(0, r.items().get(0).previousIndex());
		assertEquals(2, r.items().get(1).previousIndex());
		assertEquals(1, r.items().get(2).previousIndex());
	}
	@Test
	public void removeDuplicate() {
		diff(a, a, a);
		CollectionChangeRecord<Object> r = diff(a, a);
		// The surplus occurrence is the last one.
		assertEquals(1, r.removals().size());
		assertEquals(2, r.removals().get(0).previousIndex());
		assertThat(r.moves(), is(empty()));
	}
	@Test
	public void addDuplicate() {
		diff(a, b);
		CollectionChangeRecord<Object> r = diff(a, b, a);
		assertEquals(1, r.additions().size());
		assertEquals(2, r.additions().get(0).currentIndex());
		assertThat(r.moves(), is(empty()));
	}
	@Test
	public void identityNotEquality() {
		diff(new String("x"));
		CollectionChangeRecord<Object> r = diff(new String("x"));
		// Equal strings are different items.
		assertEquals(1, r.additions().size());
		assertEquals(1, r.removals().size());
	}
	@Test
	public void nulls() {
		diff(null, a);
		CollectionChangeRecord<Object> r = diff(a, null);
		assertEquals(1, r.moves().size());
		assertThat(r.additions(), is(empty()));
		assertThat(r.removals(), is(empty()));
	}
	@Test
	public void clear() {
		diff(a, b);
		CollectionChangeRecord<Object> r = diff();
		assertThat(items(r.removals()), contains(a, b));
		assertThat(r.items(), is(empty()));
	}
	@Test
	public void recordsAreImmutable() {
		CollectionChangeRecord<Object> first = diff(a);
		diff(a, b);
		// Older record is not affected by later diffs.
		assertThat(items(first.items()), contains(a));
		assertThrows(UnsupportedOperationException.class, () -> first.additions().clear());
	}
	@Test
	public void forEach() {
		diff(a, b, c);
		CollectionChangeRecord<Object> r = diff(c, a, d);
		List<Object> seen = new ArrayList<>();
		r.forEachAddition(i -> seen.add(i.item()));
		r.forEachMove(i -> seen.add(i.item()));
		r.forEachRemoval(i -> seen.add(i.item()));
		assertThat(seen, contains(d, c, b));
	}
}
