// Part of Watchdigest
package com.machinezoo.watchdigest;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * The kind is decided once when the selector is created and watch records branch on the enum.
 * String syntax with magic values ("[]", "{}", ".") is accepted by parse() and produced by toString().
 */
/**
 * Describes what a {@link WatchRecord} observes on its object.
 *
 * @see WatchGroup#watch(Object, FieldSelector, Object)
 */
@StubDocs
public final class FieldSelector {
	/**
	 * Closed set of selector kinds.
	 */
	public static enum Kind {
		/**
		 * Named property of the object, or a key if the object is a {@link Map}.
		 */
		FIELD,
		/**
		 * All items of an {@link Iterable} or object array, diffed structurally.
		 */
		ITEMS,
		/**
		 * All entries of a {@link Map}, diffed structurally.
		 */
		ENTRIES,
		/**
		 * Identity of the watched object itself.
		 */
		IDENTITY
	}
	private final Kind kind;
	public Kind kind() {
		return kind;
	}
	private final String name;
	/**
	 * Name of the watched field.
	 *
	 * @return field name for {@link Kind#FIELD} selectors, {@code null} for all other kinds
	 */
	public String name() {
		return name;
	}
	private FieldSelector(Kind kind, String name) {
		this.kind = kind;
		this.name = name;
	}
	private static final FieldSelector ITEMS = new FieldSelector(Kind.ITEMS, null);
	private static final FieldSelector ENTRIES = new FieldSelector(Kind.ENTRIES, null);
	private static final FieldSelector IDENTITY = new FieldSelector(Kind.IDENTITY, null);
	public static FieldSelector field(String name) {
		Objects.requireNonNull(name);
		if (name.isEmpty())
			throw new IllegalArgumentException("Field name cannot be empty.");
		return new FieldSelector(Kind.FIELD, name);
	}
	public static FieldSelector items() {
		return ITEMS;
	}
	public static FieldSelector entries() {
		return ENTRIES;
	}
	public static FieldSelector identity() {
		return IDENTITY;
	}
	/**
	 * Parses string selector syntax.
	 * String {@code "[]"} selects all items, {@code "{}"} all map entries, {@code "."} object identity.
	 * Any other non-empty string is a field name.
	 *
	 * @param selector
	 *            selector string
	 * @return parsed selector
	 * @throws IllegalArgumentException
	 *             if {@code selector} is empty
	 */
	public static FieldSelector parse(String selector) {
		Objects.requireNonNull(selector);
		switch (selector) {
		case "[]":
			return ITEMS;
		case "{}":
			return ENTRIES;
		case ".":
			return IDENTITY;
		default:
			return field(selector);
		}
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FieldSelector))
			return false;
		FieldSelector other = (FieldSelector)obj;
		return kind == other.kind && Objects.equals(name, other.name);
	}
	@Override
	public int hashCode() {
		return Objects.hash(kind, name);
	}
	@Override
	public String toString() {
		switch (kind) {
		case ITEMS:
			return "[]";
		case ENTRIES:
			return "{}";
		case IDENTITY:
			return ".";
		default:
			return name;
		}
	}
}
