// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether.utils;

import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import io.opentracing.*;

/*
 * Stores own queues and reactive state, queues own tasks. When a span is opened deep in this hierarchy,
 * it should still say which store it belongs to. Objects therefore declare their owner and a few identifying tags.
 * Spans and toString() then include tags of the whole ownership chain.
 * 
 * Trace data is kept in a weak-key cache rather than in fields, so that any object can be traced.
 * Guava's weak keys compare by identity, which is what we want for objects with custom equals().
 * Trace data must never reference the traced object, otherwise the weak key would never be collected.
 */
/**
 * Ownership and tag information attached to arbitrary objects for diagnostics.
 * 
 * @param <T>
 *            type of the traced object
 */
public class OwnerTrace<T> {
	private static final LoadingCache<Object, Data> registry = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(Data::new));
	private static final AtomicLong ids = new AtomicLong();
	private final T target;
	public T target() {
		return target;
	}
	private final Data data;
	private OwnerTrace(T target) {
		Objects.requireNonNull(target);
		this.target = target;
		data = registry.getUnchecked(target);
	}
	public static <T> OwnerTrace<T> of(T target) {
		return new OwnerTrace<>(target);
	}
	/*
	 * Fields are volatile and tags are an immutable list that is replaced on every write.
	 * Reads are lock-free. Concurrent writes may lose a tag, which is harmless for diagnostics.
	 */
	private static class Data {
		volatile String alias;
		volatile List<Map.Entry<String, Object>> tags = Collections.emptyList();
		volatile Data parent;
		Data(Object target) {
			alias = target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		data.alias = Objects.requireNonNull(alias);
		return this;
	}
	public String alias() {
		return data.alias;
	}
	/**
	 * Sets or replaces a tag. Null values are ignored.
	 * 
	 * @param key
	 *            tag name
	 * @param value
	 *            tag value, usually string, number, or boolean
	 * @return {@code this} (fluent method)
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value == null)
			return this;
		List<Map.Entry<String, Object>> updated = new ArrayList<>();
		for (Map.Entry<String, Object> tag : data.tags)
			if (!tag.getKey().equals(key))
				updated.add(tag);
		updated.add(new AbstractMap.SimpleImmutableEntry<>(key, value));
		data.tags = Collections.unmodifiableList(updated);
		return this;
	}
	public OwnerTrace<T> generateId() {
		return tag("id", ids.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		Objects.requireNonNull(parent);
		data.parent = parent instanceof OwnerTrace ? ((OwnerTrace<?>)parent).data : registry.getUnchecked(parent);
		return this;
	}
	/*
	 * Own tags are unprefixed. Ancestor tags are prefixed with ancestor alias.
	 * Ancestors without tags contribute a boolean marker, so that the chain is visible in the trace.
	 */
	private Map<String, Object> flatten() {
		Map<String, Object> flat = new TreeMap<>();
		for (Map.Entry<String, Object> tag : data.tags)
			flat.put(tag.getKey(), tag.getValue());
		for (Data ancestor = data.parent; ancestor != null; ancestor = ancestor.parent) {
			List<Map.Entry<String, Object>> tags = ancestor.tags;
			if (tags.isEmpty())
				flat.putIfAbsent(ancestor.alias, true);
			for (Map.Entry<String, Object> tag : tags)
				flat.putIfAbsent(ancestor.alias + "." + tag.getKey(), tag.getValue());
		}
		return flat;
	}
	public Span fill(Span span) {
		for (Map.Entry<String, Object> tag : flatten().entrySet()) {
			Object value = tag.getValue();
			if (value instanceof Number)
				span.setTag(tag.getKey(), (Number)value);
			else if (value instanceof Boolean)
				span.setTag(tag.getKey(), (Boolean)value);
			else
				span.setTag(tag.getKey(), value.toString());
		}
		return span;
	}
	@Override
	public String toString() {
		return data.alias + flatten();
	}
}
