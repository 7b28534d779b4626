// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

/**
 * Passed to the attach hook. The signal is aborted when this attachment ends.
 */
public class AttachContext<T> {
	private final Store<T> store;
	public Store<T> store() {
		return store;
	}
	private final T target;
	public T target() {
		return target;
	}
	private final AbortSignal signal;
	public AbortSignal signal() {
		return signal;
	}
	AttachContext(Store<T> store, T target, AbortSignal signal) {
		this.store = store;
		this.target = target;
		this.signal = signal;
	}
}
