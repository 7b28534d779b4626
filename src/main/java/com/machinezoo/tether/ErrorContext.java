// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;

/**
 * Describes an error routed to the store's error hook.
 */
public class ErrorContext<T> {
	public enum Source {
		SETUP,
		ATTACH,
		SUBSCRIBE,
		SNAPSHOT,
		REQUEST
	}
	private final Store<T> store;
	public Store<T> store() {
		return store;
	}
	private final Throwable error;
	public Throwable error() {
		return error;
	}
	private final Source source;
	public Source source() {
		return source;
	}
	/*
	 * Name of the failed request or of the feature whose subscription or snapshot failed.
	 */
	private final String origin;
	public Optional<String> origin() {
		return Optional.ofNullable(origin);
	}
	ErrorContext(Store<T> store, Throwable error, Source source, String origin) {
		this.store = store;
		this.error = error;
		this.source = source;
		this.origin = origin;
	}
	public StoreError code() {
		return StoreError.classify(error);
	}
	@Override
	public String toString() {
		return "ErrorContext(" + source + (origin != null ? " " + origin : "") + ": " + error + ")";
	}
}
