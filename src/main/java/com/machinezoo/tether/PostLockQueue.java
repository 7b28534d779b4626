// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import java.util.function.*;

/*
 * Futures, listeners, and abort callbacks must never run while holding our monitors,
 * because they are foreign code that may call back into the queue or the store.
 * Code under the lock posts such side effects here and they run once the lock is released, in posting order.
 * One instance serves one locked section.
 */
class PostLockQueue {
	private final Object lock;
	private final List<Runnable> posted = new ArrayList<>();
	PostLockQueue(Object lock) {
		this.lock = lock;
	}
	void post(Runnable effect) {
		posted.add(effect);
	}
	void run(Runnable section) {
		eval(() -> {
			section.run();
			return null;
		});
	}
	/*
	 * All posted effects run even if some of them throw. The first exception is rethrown afterwards.
	 */
	<T> T eval(Supplier<T> section) {
		T result;
		synchronized (lock) {
			result = section.get();
		}
		RuntimeException failure = null;
		for (Runnable effect : posted) {
			try {
				effect.run();
			} catch (RuntimeException ex) {
				if (failure == null)
					failure = ex;
				else
					failure.addSuppressed(ex);
			}
		}
		posted.clear();
		if (failure != null)
			throw failure;
		return result;
	}
}
