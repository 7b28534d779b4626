// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

/**
 * What {@link TaskHandler} gets to see about its task.
 * 
 * @param <I>
 *            type of task input
 */
public class TaskContext<I> {
	private final I input;
	public I input() {
		return input;
	}
	private final AbortSignal signal;
	public AbortSignal signal() {
		return signal;
	}
	TaskContext(I input, AbortSignal signal) {
		this.input = input;
		this.signal = signal;
	}
}
