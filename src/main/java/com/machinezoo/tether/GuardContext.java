// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

public class GuardContext<T> {
	private final T target;
	public T target() {
		return target;
	}
	private final AbortSignal signal;
	public AbortSignal signal() {
		return signal;
	}
	public GuardContext(T target, AbortSignal signal) {
		this.target = target;
		this.signal = signal;
	}
}
