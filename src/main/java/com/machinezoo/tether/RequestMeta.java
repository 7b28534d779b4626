// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.time.*;
import java.util.*;

/**
 * Provenance of a request, for example whether it was triggered by the user or by the system.
 * Meta is attached to the {@link Task} record and passed to the handler in {@link RequestContext}.
 */
public class RequestMeta {
	private final String source;
	public Optional<String> source() {
		return Optional.ofNullable(source);
	}
	private final String reason;
	public Optional<String> reason() {
		return Optional.ofNullable(reason);
	}
	private final Instant timestamp;
	public Instant timestamp() {
		return timestamp;
	}
	private final Object context;
	public Optional<Object> context() {
		return Optional.ofNullable(context);
	}
	private RequestMeta(String source, String reason, Instant timestamp, Object context) {
		this.source = source;
		this.reason = reason;
		this.timestamp = Objects.requireNonNull(timestamp);
		this.context = context;
	}
	public static RequestMeta of(String source, String reason) {
		return new RequestMeta(source, reason, Instant.now(), null);
	}
	public static RequestMeta user(String reason) {
		return of("user", reason);
	}
	public static RequestMeta system(String reason) {
		return of("system", reason);
	}
	public RequestMeta timestamp(Instant timestamp) {
		return new RequestMeta(source, reason, timestamp, context);
	}
	public RequestMeta context(Object context) {
		return new RequestMeta(source, reason, timestamp, context);
	}
	@Override
	public String toString() {
		StringBuilder text = new StringBuilder("RequestMeta(");
		text.append(source != null ? source : "unknown");
		if (reason != null)
			text.append(", ").append(reason);
		return text.append(")").toString();
	}
}
