// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;

/**
 * Typed key into {@link ReactiveState} and {@link StateSnapshot}.
 * Keys are identified by name alone. Two keys with the same name but different type parameters
 * refer to the same state entry, so features sharing a key must agree on its type.
 * 
 * @param <T>
 *            type of values stored under this key
 */
public final class StateKey<T> {
	private final String name;
	public String name() {
		return name;
	}
	private StateKey(String name) {
		Objects.requireNonNull(name);
		this.name = name;
	}
	public static <T> StateKey<T> of(String name) {
		return new StateKey<>(name);
	}
	@SuppressWarnings("unchecked")
	public T cast(Object value) {
		return (T)value;
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof StateKey && ((StateKey<?>)obj).name.equals(name);
	}
	@Override
	public int hashCode() {
		return name.hashCode();
	}
	@Override
	public String toString() {
		return name;
	}
}
