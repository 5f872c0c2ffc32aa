// Part of Watchdigest
package com.machinezoo.watchdigest.util;

import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Watch groups and records form a tree, but the tree is invisible in debugger output and in traces.
 * Every object that wants to be identifiable registers an alias, a few tags, and its owner here.
 * The resulting chain (detector.group.group2.watch) is then used in toString() and to tag tracing spans.
 *
 * Trace data is kept outside of the traced objects in a map with weak keys, so that any object can be traced
 * without carrying an extra field. Guava's weakKeys() compares keys by reference, which is what we want here,
 * because watched objects and records may override equals().
 */
/**
 * Alias, tags, and ownership chain of an object for use in {@code toString()} and tracing.
 */
@StubDocs
public class OwnerTrace<T> {
	private static final LoadingCache<Object, TraceData> registry = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(TraceData::new));
	public static <T> OwnerTrace<T> of(T target) {
		Objects.requireNonNull(target);
		return new OwnerTrace<>(target, registry.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	/*
	 * The builder is short-lived. Data lives in the registry and must not point back at the target,
	 * otherwise the weak key would never be released.
	 */
	private final TraceData data;
	private OwnerTrace(T target, TraceData data) {
		this.target = target;
		this.data = data;
	}
	private static class TraceData {
		volatile String alias;
		volatile Map<String, Object> tags = Collections.emptyMap();
		volatile TraceData owner;
		TraceData(Object target) {
			alias = target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	/*
	 * Tags are rarely written, so copy-on-write keeps reads lock-free.
	 * Null values are ignored to spare callers a null check.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value != null) {
			synchronized (data) {
				Map<String, Object> copy = new LinkedHashMap<>(data.tags);
				copy.put(key, value);
				data.tags = copy;
			}
		}
		return this;
	}
	private static final AtomicLong ids = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", ids.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object owner) {
		if (owner == null)
			data.owner = null;
		else if (owner instanceof OwnerTrace)
			data.owner = ((OwnerTrace<?>)owner).data;
		else
			data.owner = registry.getUnchecked(owner);
		return this;
	}
	/*
	 * Flattened view of the owner chain. Ancestors are listed root first.
	 * Repeated aliases get numbered (group, group2, group3), so that tags of different ancestors do not collide.
	 */
	private static class Flattened {
		final List<String> path = new ArrayList<>();
		final SortedMap<String, Object> tags = new TreeMap<>();
		String owner() {
			return String.join(".", path);
		}
	}
	private Flattened flatten() {
		Deque<TraceData> ancestors = new ArrayDeque<>();
		for (TraceData ancestor = data; ancestor != null; ancestor = ancestor.owner)
			ancestors.push(ancestor);
		Object2IntMap<String> seen = new Object2IntOpenHashMap<>();
		Flattened flattened = new Flattened();
		for (TraceData ancestor : ancestors) {
			int count = seen.getInt(ancestor.alias) + 1;
			seen.put(ancestor.alias, count);
			String namespace = count == 1 ? ancestor.alias : ancestor.alias + count;
			flattened.path.add(namespace);
			ancestor.tags.forEach((key, value) -> flattened.tags.put(namespace + "." + key, value));
		}
		return flattened;
	}
	/*
	 * Numeric tags stay numeric in the span. Everything else, including our selector strings, is a string tag.
	 */
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		Flattened flattened = flatten();
		span.setTag("owner", flattened.owner());
		flattened.tags.forEach((key, value) -> {
			if (value instanceof Number)
				span.setTag(key, (Number)value);
			else
				span.setTag(key, String.valueOf(value));
		});
		return span;
	}
	@Override
	public String toString() {
		Flattened flattened = flatten();
		return flattened.owner() + flattened.tags;
	}
}
