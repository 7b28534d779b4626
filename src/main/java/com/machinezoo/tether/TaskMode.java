// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

/**
 * How a task treats other tasks under the same key.
 */
public enum TaskMode {
	/**
	 * Starting the task cancels scheduled tasks and aborts running tasks under the same key.
	 */
	EXCLUSIVE,
	/**
	 * Tasks under the same key run side by side. Used for operations that are safe to overlap.
	 */
	SHARED
}
