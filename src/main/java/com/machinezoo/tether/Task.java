// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.time.*;
import java.util.*;
import com.machinezoo.stagean.*;

/**
 * Immutable record of one tracked invocation in {@link TaskQueue}.
 * Every status transition produces a new record.
 */
@StubDocs
public final class Task {
	private final long id;
	public long id() {
		return id;
	}
	private final String name;
	public String name() {
		return name;
	}
	private final String key;
	public String key() {
		return key;
	}
	private final Object input;
	public Object input() {
		return input;
	}
	private final RequestMeta meta;
	public Optional<RequestMeta> meta() {
		return Optional.ofNullable(meta);
	}
	private final TaskStatus status;
	public TaskStatus status() {
		return status;
	}
	private final Instant started;
	public Instant started() {
		return started;
	}
	private final Instant settled;
	public Optional<Instant> settled() {
		return Optional.ofNullable(settled);
	}
	private final Object output;
	public Object output() {
		return output;
	}
	private final Throwable error;
	public Optional<Throwable> error() {
		return Optional.ofNullable(error);
	}
	/*
	 * Set when the task's abort signal fired, which covers both supersession and explicit abort.
	 */
	private final boolean cancelled;
	public boolean cancelled() {
		return cancelled;
	}
	private Task(long id, String name, String key, Object input, RequestMeta meta, TaskStatus status, Instant started, Instant settled, Object output, Throwable error, boolean cancelled) {
		this.id = id;
		this.name = name;
		this.key = key;
		this.input = input;
		this.meta = meta;
		this.status = status;
		this.started = started;
		this.settled = settled;
		this.output = output;
		this.error = error;
		this.cancelled = cancelled;
	}
	static Task pending(long id, String name, String key, Object input, RequestMeta meta, Instant started) {
		return new Task(id, name, key, input, meta, TaskStatus.PENDING, started, null, null, null, false);
	}
	Task succeed(Instant at, Object output) {
		return new Task(id, name, key, input, meta, TaskStatus.SUCCESS, started, at, output, null, false);
	}
	Task fail(Instant at, Throwable error, boolean cancelled) {
		return new Task(id, name, key, input, meta, TaskStatus.ERROR, started, at, null, error, cancelled);
	}
	public Optional<Duration> duration() {
		return settled().map(s -> Duration.between(started, s));
	}
	@Override
	public String toString() {
		return "Task(" + name + "#" + id + ", key " + key + ", " + status + (cancelled ? ", cancelled" : "") + ")";
	}
}
