// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;
import com.machinezoo.tether.loop.*;

/*
 * Immutable, so that features holding it can be shared by any number of stores.
 * Every modifier returns a modified copy.
 */
/**
 * Resolved configuration of one request: key, mode, scheduler, guards, cancel list, and handler.
 * 
 * @param <T>
 *            type of the target
 * @param <I>
 *            type of request input
 * @param <O>
 *            type of request output
 */
@StubDocs
public final class RequestConfig<T, I, O> {
	private final Function<? super I, String> key;
	private final TaskMode mode;
	private final Scheduler schedule;
	private final List<Guard<T>> guards;
	private final Function<? super I, List<String>> cancel;
	private final boolean cancelAll;
	private final RequestHandler<T, I, O> handler;
	private RequestConfig(Function<? super I, String> key, TaskMode mode, Scheduler schedule, List<Guard<T>> guards, Function<? super I, List<String>> cancel, boolean cancelAll, RequestHandler<T, I, O> handler) {
		this.key = key;
		this.mode = mode;
		this.schedule = schedule;
		this.guards = guards;
		this.cancel = cancel;
		this.cancelAll = cancelAll;
		this.handler = handler;
	}
	public static <T, I, O> RequestConfig<T, I, O> of(RequestHandler<T, I, O> handler) {
		Objects.requireNonNull(handler);
		return new RequestConfig<>(null, TaskMode.EXCLUSIVE, null, Collections.emptyList(), null, false, handler);
	}
	public static <T, I, O> RequestConfig<T, I, O> sync(BiFunction<I, RequestContext<T>, O> handler) {
		return of(RequestHandler.sync(handler));
	}
	public RequestHandler<T, I, O> handler() {
		return handler;
	}
	/**
	 * Resolves the key for the given input.
	 * 
	 * @param name
	 *            request name, which is the key when no key is configured
	 * @param input
	 *            request input
	 * @return exclusivity key
	 */
	public String resolveKey(String name, I input) {
		return key != null ? Objects.requireNonNull(key.apply(input), "Key function returned null.") : name;
	}
	public RequestConfig<T, I, O> key(String key) {
		Objects.requireNonNull(key);
		return key(input -> key);
	}
	public RequestConfig<T, I, O> key(Function<? super I, String> key) {
		Objects.requireNonNull(key);
		return new RequestConfig<>(key, mode, schedule, guards, cancel, cancelAll, handler);
	}
	public TaskMode mode() {
		return mode;
	}
	public RequestConfig<T, I, O> mode(TaskMode mode) {
		Objects.requireNonNull(mode);
		return new RequestConfig<>(key, mode, schedule, guards, cancel, cancelAll, handler);
	}
	public RequestConfig<T, I, O> shared() {
		return mode(TaskMode.SHARED);
	}
	public Optional<Scheduler> schedule() {
		return Optional.ofNullable(schedule);
	}
	public RequestConfig<T, I, O> schedule(Scheduler schedule) {
		return new RequestConfig<>(key, mode, schedule, guards, cancel, cancelAll, handler);
	}
	public List<Guard<T>> guards() {
		return guards;
	}
	public RequestConfig<T, I, O> guard(Guard<T> guard) {
		Objects.requireNonNull(guard);
		List<Guard<T>> extended = new ArrayList<>(guards);
		extended.add(guard);
		return new RequestConfig<>(key, mode, schedule, Collections.unmodifiableList(extended), cancel, cancelAll, handler);
	}
	public List<String> cancelKeys(I input) {
		if (cancel == null)
			return Collections.emptyList();
		List<String> keys = cancel.apply(input);
		return keys != null ? keys : Collections.emptyList();
	}
	public RequestConfig<T, I, O> cancel(String... keys) {
		List<String> list = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(keys)));
		return cancel(input -> list);
	}
	public RequestConfig<T, I, O> cancel(Function<? super I, List<String>> keys) {
		Objects.requireNonNull(keys);
		return new RequestConfig<>(key, mode, schedule, guards, keys, cancelAll, handler);
	}
	public boolean cancelAll() {
		return cancelAll;
	}
	/**
	 * Makes the request abort every queued and running task before it is enqueued, for example when the media source changes.
	 * 
	 * @return modified copy
	 */
	public RequestConfig<T, I, O> cancelEverything() {
		return new RequestConfig<>(key, mode, schedule, guards, cancel, true, handler);
	}
}
