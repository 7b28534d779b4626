// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;

/**
 * Value derived from selected keys of {@link ReactiveState}.
 * It is recomputed whenever one of the keys changes, but its listeners run only when the derived value changes.
 * 
 * @param <R>
 *            type of the derived value
 */
@StubDocs
public class ComputedValue<R> implements AutoCloseable {
	private final ReactiveState state;
	private final List<StateKey<?>> keys;
	private final Function<StateSnapshot, R> derivation;
	private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
	private final CloseableScope subscription;
	private boolean initialized;
	private R cached;
	public ComputedValue(ReactiveState state, Collection<? extends StateKey<?>> keys, Function<StateSnapshot, R> derivation) {
		Objects.requireNonNull(state);
		Objects.requireNonNull(derivation);
		this.state = state;
		this.keys = new ArrayList<>(keys);
		this.derivation = derivation;
		subscription = state.subscribe(this.keys, () -> {
			if (recompute())
				for (Runnable listener : listeners)
					listener.run();
		});
	}
	/*
	 * Derivation sees only the selected keys, which keeps it honest about its dependencies.
	 */
	private boolean recompute() {
		StateSnapshot.Builder selected = StateSnapshot.builder();
		StateSnapshot current = state.snapshot();
		for (StateKey<?> key : keys)
			if (current.contains(key))
				copy(current, key, selected);
		R next = derivation.apply(selected.build());
		synchronized (this) {
			boolean changed = !initialized || !Objects.equals(cached, next);
			cached = next;
			initialized = true;
			return changed;
		}
	}
	private static <T> void copy(StateSnapshot from, StateKey<T> key, StateSnapshot.Builder to) {
		to.put(key, from.get(key));
	}
	public R get() {
		synchronized (this) {
			if (initialized)
				return cached;
		}
		recompute();
		synchronized (this) {
			return cached;
		}
	}
	public CloseableScope subscribe(Runnable listener) {
		Objects.requireNonNull(listener);
		listeners.add(listener);
		return () -> listeners.remove(listener);
	}
	@Override
	public void close() {
		subscription.close();
		listeners.clear();
	}
}
