// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

/**
 * Passed to the setup hook. The signal is aborted when the store is destroyed.
 */
public class SetupContext<T> {
	private final Store<T> store;
	public Store<T> store() {
		return store;
	}
	private final AbortSignal signal;
	public AbortSignal signal() {
		return signal;
	}
	SetupContext(Store<T> store, AbortSignal signal) {
		this.store = store;
		this.signal = signal;
	}
}
