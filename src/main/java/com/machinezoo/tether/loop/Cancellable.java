// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether.loop;

/**
 * Handle to a deferred callback that has not necessarily run yet.
 * Cancelling guarantees the callback will not run if it has not started already.
 * Cancelling twice or cancelling after the callback ran has no effect.
 */
@FunctionalInterface
public interface Cancellable {
	void cancel();
	/*
	 * Returned by schedulers that run the callback synchronously, so there is nothing to cancel.
	 */
	static Cancellable none() {
		return () -> {};
	}
}
