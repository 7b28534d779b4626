// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;

/**
 * Immutable map from {@link StateKey} to value. Null values are allowed and distinct from missing keys.
 * Iteration follows insertion order.
 */
public final class StateSnapshot {
	private static final StateSnapshot empty = new StateSnapshot(new LinkedHashMap<>());
	private final Map<StateKey<?>, Object> values;
	private StateSnapshot(LinkedHashMap<StateKey<?>, Object> values) {
		this.values = Collections.unmodifiableMap(values);
	}
	public static StateSnapshot empty() {
		return empty;
	}
	public static <T> StateSnapshot of(StateKey<T> key, T value) {
		return builder().put(key, value).build();
	}
	public static <A, B> StateSnapshot of(StateKey<A> key1, A value1, StateKey<B> key2, B value2) {
		return builder().put(key1, value1).put(key2, value2).build();
	}
	public static StateSnapshot copyOf(Map<StateKey<?>, ?> values) {
		return new StateSnapshot(new LinkedHashMap<>(values));
	}
	public <T> T get(StateKey<T> key) {
		return key.cast(values.get(key));
	}
	public <T> T getOrDefault(StateKey<T> key, T fallback) {
		return values.containsKey(key) ? get(key) : fallback;
	}
	public boolean contains(StateKey<?> key) {
		return values.containsKey(key);
	}
	public Set<StateKey<?>> keys() {
		return values.keySet();
	}
	public Map<StateKey<?>, Object> toMap() {
		return values;
	}
	public int size() {
		return values.size();
	}
	public boolean isEmpty() {
		return values.isEmpty();
	}
	public <T> StateSnapshot with(StateKey<T> key, T value) {
		LinkedHashMap<StateKey<?>, Object> copy = new LinkedHashMap<>(values);
		copy.put(key, value);
		return new StateSnapshot(copy);
	}
	/**
	 * Shallow merge. Entries of {@code other} replace entries of this snapshot with the same key.
	 * 
	 * @param other
	 *            snapshot to merge into this one
	 * @return merged snapshot
	 */
	public StateSnapshot merge(StateSnapshot other) {
		Objects.requireNonNull(other);
		if (other.isEmpty())
			return this;
		if (isEmpty())
			return other;
		LinkedHashMap<StateKey<?>, Object> copy = new LinkedHashMap<>(values);
		copy.putAll(other.values);
		return new StateSnapshot(copy);
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof StateSnapshot && values.equals(((StateSnapshot)obj).values);
	}
	@Override
	public int hashCode() {
		return values.hashCode();
	}
	@Override
	public String toString() {
		return values.toString();
	}
	public static Builder builder() {
		return new Builder();
	}
	public static class Builder {
		private final LinkedHashMap<StateKey<?>, Object> values = new LinkedHashMap<>();
		public <T> Builder put(StateKey<T> key, T value) {
			Objects.requireNonNull(key);
			values.put(key, value);
			return this;
		}
		public Builder putAll(StateSnapshot snapshot) {
			values.putAll(snapshot.values);
			return this;
		}
		public StateSnapshot build() {
			return new StateSnapshot(new LinkedHashMap<>(values));
		}
	}
}
