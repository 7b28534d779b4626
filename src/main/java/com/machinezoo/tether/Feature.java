// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Features are plain immutable data. Stores interpret them. The same feature instance can be used by any number of stores,
 * so it must not keep per-store or per-target state outside of the abort-scoped subscription.
 */
/**
 * Reusable unit of state and behavior for targets of type {@code T}.
 * It declares initial state, how to read state from the target, how to observe the target for changes,
 * and which requests it handles.
 * 
 * @param <T>
 *            type of the target
 * 
 * @see Store
 * @see StoreConfig
 */
@DraftDocs("example feature")
public final class Feature<T> {
	/**
	 * Reads the feature's part of state from the target.
	 */
	@FunctionalInterface
	public interface SnapshotFunction<T> {
		StateSnapshot snapshot(T target, StateSnapshot initial);
	}
	/**
	 * Registers change sources on the target. Everything registered must be released when the signal is aborted.
	 */
	@FunctionalInterface
	public interface SubscribeFunction<T> {
		void subscribe(T target, Runnable update, AbortSignal signal);
	}
	private final String name;
	public String name() {
		return name;
	}
	private final StateSnapshot initialState;
	public StateSnapshot initialState() {
		return initialState;
	}
	private final SnapshotFunction<T> snapshot;
	private final SubscribeFunction<T> subscription;
	private final Map<String, RequestConfig<T, ?, ?>> requests;
	public Map<String, RequestConfig<T, ?, ?>> requests() {
		return requests;
	}
	private Feature(Builder<T> builder) {
		name = builder.name;
		initialState = builder.initialState.build();
		snapshot = builder.snapshot;
		subscription = builder.subscription;
		requests = Collections.unmodifiableMap(new LinkedHashMap<>(builder.requests));
	}
	public StateSnapshot snapshot(T target) {
		StateSnapshot fragment = snapshot.snapshot(target, initialState);
		return fragment != null ? fragment : StateSnapshot.empty();
	}
	public void subscribe(T target, Runnable update, AbortSignal signal) {
		subscription.subscribe(target, update, signal);
	}
	public static <T> Builder<T> builder(String name) {
		return new Builder<>(name);
	}
	@Override
	public String toString() {
		return "Feature(" + name + ")";
	}
	public static class Builder<T> {
		private final String name;
		private final StateSnapshot.Builder initialState = StateSnapshot.builder();
		private SnapshotFunction<T> snapshot = (target, initial) -> StateSnapshot.empty();
		private SubscribeFunction<T> subscription = (target, update, signal) -> {
		};
		private final Map<String, RequestConfig<T, ?, ?>> requests = new LinkedHashMap<>();
		private Builder(String name) {
			this.name = Objects.requireNonNull(name);
		}
		public <V> Builder<T> state(StateKey<V> key, V initial) {
			initialState.put(key, initial);
			return this;
		}
		public Builder<T> state(StateSnapshot initial) {
			initialState.putAll(initial);
			return this;
		}
		public Builder<T> snapshot(SnapshotFunction<T> snapshot) {
			this.snapshot = Objects.requireNonNull(snapshot);
			return this;
		}
		public Builder<T> subscribe(SubscribeFunction<T> subscription) {
			this.subscription = Objects.requireNonNull(subscription);
			return this;
		}
		public Builder<T> request(String name, RequestConfig<T, ?, ?> config) {
			Objects.requireNonNull(name);
			Objects.requireNonNull(config);
			requests.put(name, config);
			return this;
		}
		public <I, O> Builder<T> request(Request<I, O> request, RequestConfig<T, I, O> config) {
			return request(request.name(), config);
		}
		public Feature<T> build() {
			return new Feature<>(this);
		}
	}
}
