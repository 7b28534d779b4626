// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;

/**
 * Failure raised by the store or its task queue, as opposed to failures thrown by request handlers.
 */
@SuppressWarnings("serial")
public class StoreException extends RuntimeException {
	private final StoreError error;
	public StoreError error() {
		return error;
	}
	public StoreException(StoreError error, String message) {
		super(message != null ? message : Objects.requireNonNull(error).name());
		this.error = Objects.requireNonNull(error);
	}
	public StoreException(StoreError error) {
		this(error, null);
	}
	public boolean cancellation() {
		return error.cancellation();
	}
}
