// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.concurrent.*;

/**
 * Classification of failures reported by {@link Store} and {@link TaskQueue}.
 * 
 * @see StoreException
 */
public enum StoreError {
	/**
	 * Operation was attempted on a destroyed {@link Store} or {@link TaskQueue}.
	 */
	DESTROYED,
	/**
	 * Request was issued while no target was attached.
	 */
	NO_TARGET,
	/**
	 * One of the request's guards returned {@code false} or failed.
	 */
	REJECTED,
	/**
	 * Task was replaced by a later exclusive task under the same key.
	 */
	SUPERSEDED,
	/**
	 * Task was aborted explicitly, by detach, or by another request's cancel list.
	 */
	ABORTED,
	/**
	 * Guard did not settle in time.
	 */
	TIMEOUT,
	/**
	 * Exception thrown by the request handler itself. Such exceptions are propagated unwrapped,
	 * so this code is only ever returned by {@link #classify(Throwable)}.
	 */
	HANDLER;
	public boolean cancellation() {
		return this == SUPERSEDED || this == ABORTED;
	}
	/**
	 * Strips {@link CompletionException} and {@link ExecutionException} wrappers added by futures.
	 * 
	 * @param exception
	 *            exception to unwrap, possibly {@code null}
	 * @return innermost exception that is not a future wrapper
	 */
	public static Throwable unwrap(Throwable exception) {
		while ((exception instanceof CompletionException || exception instanceof ExecutionException) && exception.getCause() != null)
			exception = exception.getCause();
		return exception;
	}
	public static StoreError classify(Throwable exception) {
		Throwable unwrapped = unwrap(exception);
		if (unwrapped instanceof StoreException)
			return ((StoreException)unwrapped).error();
		return HANDLER;
	}
	public static boolean cancellation(Throwable exception) {
		return exception != null && classify(exception).cancellation();
	}
}
