// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.tether.loop.*;

/**
 * Mutable configuration of {@link Store}. The store copies what it needs in its constructor,
 * so the configuration can be reused and modified afterwards.
 * 
 * @param <T>
 *            type of the target
 */
public class StoreConfig<T> {
	private List<Feature<T>> features = new ArrayList<>();
	public List<Feature<T>> features() {
		return Collections.unmodifiableList(features);
	}
	public StoreConfig<T> features(List<Feature<T>> features) {
		Objects.requireNonNull(features);
		this.features = new ArrayList<>(features);
		return this;
	}
	public StoreConfig<T> feature(Feature<T> feature) {
		Objects.requireNonNull(feature);
		features.add(feature);
		return this;
	}
	private Consumer<SetupContext<T>> onSetup;
	public Consumer<SetupContext<T>> onSetup() {
		return onSetup;
	}
	public StoreConfig<T> onSetup(Consumer<SetupContext<T>> onSetup) {
		this.onSetup = onSetup;
		return this;
	}
	private Consumer<AttachContext<T>> onAttach;
	public Consumer<AttachContext<T>> onAttach() {
		return onAttach;
	}
	public StoreConfig<T> onAttach(Consumer<AttachContext<T>> onAttach) {
		this.onAttach = onAttach;
		return this;
	}
	private Consumer<ErrorContext<T>> onError;
	public Consumer<ErrorContext<T>> onError() {
		return onError;
	}
	/**
	 * Sets the hook receiving all errors. Without it, errors are logged.
	 * 
	 * @param onError
	 *            error hook or {@code null} to log errors
	 * @return {@code this} (fluent method)
	 */
	public StoreConfig<T> onError(Consumer<ErrorContext<T>> onError) {
		this.onError = onError;
		return this;
	}
	private Supplier<TaskQueue> queue;
	public Supplier<TaskQueue> queue() {
		return queue;
	}
	public StoreConfig<T> queue(Supplier<TaskQueue> queue) {
		this.queue = queue;
		return this;
	}
	private Function<StateSnapshot, ReactiveState> state;
	public Function<StateSnapshot, ReactiveState> state() {
		return state;
	}
	/**
	 * Sets factory for the store's reactive state. It receives merged initial state of all features.
	 * 
	 * @param state
	 *            state factory or {@code null} for the default
	 * @return {@code this} (fluent method)
	 */
	public StoreConfig<T> state(Function<StateSnapshot, ReactiveState> state) {
		this.state = state;
		return this;
	}
	private EventLoop loop;
	public EventLoop loop() {
		return loop;
	}
	public StoreConfig<T> loop(EventLoop loop) {
		this.loop = loop;
		return this;
	}
	private Logger logger;
	public Logger logger() {
		return logger;
	}
	public StoreConfig<T> logger(Logger logger) {
		this.logger = logger;
		return this;
	}
	/**
	 * Merges two configurations into a new one.
	 * Features are concatenated and deduplicated by identity, keeping the later occurrence.
	 * Hooks are composed so that the base hook runs first. Factories, loop, and logger of the extension win if set.
	 * 
	 * @param base
	 *            configuration being extended
	 * @param extension
	 *            additions and overrides, possibly {@code null}
	 * @return merged configuration, or {@code base} itself if {@code extension} is {@code null}
	 */
	public static <T> StoreConfig<T> extend(StoreConfig<T> base, StoreConfig<T> extension) {
		Objects.requireNonNull(base);
		if (extension == null)
			return base;
		List<Feature<T>> all = new ArrayList<>(base.features);
		all.addAll(extension.features);
		List<Feature<T>> features = new ArrayList<>();
		for (int i = 0; i < all.size(); ++i) {
			boolean later = false;
			for (int j = i + 1; j < all.size(); ++j)
				if (all.get(j) == all.get(i))
					later = true;
			if (!later)
				features.add(all.get(i));
		}
		return new StoreConfig<T>()
			.features(features)
			.onSetup(compose(base.onSetup, extension.onSetup))
			.onAttach(compose(base.onAttach, extension.onAttach))
			.onError(compose(base.onError, extension.onError))
			.queue(extension.queue != null ? extension.queue : base.queue)
			.state(extension.state != null ? extension.state : base.state)
			.loop(extension.loop != null ? extension.loop : base.loop)
			.logger(extension.logger != null ? extension.logger : base.logger);
	}
	private static <C> Consumer<C> compose(Consumer<C> first, Consumer<C> second) {
		if (first == null)
			return second;
		if (second == null)
			return first;
		return context -> {
			first.accept(context);
			second.accept(context);
		};
	}
}
