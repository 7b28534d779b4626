// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;

/**
 * Everything a request handler needs besides its input.
 * Handlers must check {@link #signal()} before mutating the target.
 * 
 * @param <T>
 *            type of the target
 */
public class RequestContext<T> {
	private final T target;
	public T target() {
		return target;
	}
	private final AbortSignal signal;
	public AbortSignal signal() {
		return signal;
	}
	private final RequestMeta meta;
	public Optional<RequestMeta> meta() {
		return Optional.ofNullable(meta);
	}
	private final ReactiveState state;
	/*
	 * Always reads current state, not the state at the time the request was issued.
	 */
	public StateSnapshot state() {
		return state.snapshot();
	}
	RequestContext(T target, AbortSignal signal, RequestMeta meta, ReactiveState state) {
		this.target = target;
		this.signal = signal;
		this.meta = meta;
		this.state = state;
	}
}
