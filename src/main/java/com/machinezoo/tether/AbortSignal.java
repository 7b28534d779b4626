// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;

/*
 * Cancellation is cooperative. Nothing is interrupted. Code holding the signal is expected to check it
 * before mutating the target and to release its resources from abort listeners.
 */
/**
 * One-shot cancellation token passed to feature subscriptions, guards, and request handlers.
 * 
 * @see AbortController
 */
public class AbortSignal {
	private static final Logger logger = LoggerFactory.getLogger(AbortSignal.class);
	private boolean aborted;
	private RuntimeException reason;
	private List<Runnable> listeners = new ArrayList<>();
	AbortSignal() {
	}
	public synchronized boolean aborted() {
		return aborted;
	}
	/**
	 * Returns the exception passed to {@link AbortController#abort(RuntimeException)}.
	 * 
	 * @return abort reason or {@code null} if the signal was not aborted yet
	 */
	public synchronized RuntimeException reason() {
		return reason;
	}
	public void throwIfAborted() {
		RuntimeException reason = reason();
		if (reason != null)
			throw reason;
	}
	/**
	 * Registers abort listener. If the signal is already aborted, the listener runs immediately.
	 * Exceptions thrown by listeners are logged.
	 * 
	 * @param listener
	 *            callback to run on abort
	 * @return scope that removes the listener when closed
	 */
	public CloseableScope onAbort(Runnable listener) {
		Objects.requireNonNull(listener);
		Runnable entry = ExceptionLogging.log(logger).runnable(listener);
		synchronized (this) {
			if (!aborted) {
				listeners.add(entry);
				return () -> {
					synchronized (AbortSignal.this) {
						if (listeners != null)
							listeners.remove(entry);
					}
				};
			}
		}
		entry.run();
		return () -> {
		};
	}
	boolean abort(RuntimeException reason) {
		Objects.requireNonNull(reason);
		List<Runnable> fired;
		synchronized (this) {
			if (aborted)
				return false;
			aborted = true;
			this.reason = reason;
			fired = listeners;
			listeners = null;
		}
		for (Runnable listener : fired)
			listener.run();
		return true;
	}
	@Override
	public synchronized String toString() {
		return aborted ? "AbortSignal(aborted: " + reason.getMessage() + ")" : "AbortSignal";
	}
}
