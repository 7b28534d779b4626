// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;

/**
 * Typed name of a request. Type parameters only exist to type-check calls to {@link Store#request(Request, Object)}.
 * Requests are equal if their names are equal.
 * 
 * @param <I>
 *            type of request input
 * @param <O>
 *            type of request output
 */
public final class Request<I, O> {
	private final String name;
	public String name() {
		return name;
	}
	private Request(String name) {
		this.name = Objects.requireNonNull(name);
	}
	public static <I, O> Request<I, O> of(String name) {
		return new Request<>(name);
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof Request && ((Request<?, ?>)obj).name.equals(name);
	}
	@Override
	public int hashCode() {
		return name.hashCode();
	}
	@Override
	public String toString() {
		return name;
	}
}
