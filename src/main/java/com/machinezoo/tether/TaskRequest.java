// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import com.machinezoo.tether.loop.*;

/**
 * Description of one task to be enqueued in {@link TaskQueue}.
 * Key defaults to the name and mode defaults to {@link TaskMode#EXCLUSIVE}.
 * 
 * @param <I>
 *            type of task input
 * @param <O>
 *            type of task output
 */
public class TaskRequest<I, O> {
	private final String name;
	public String name() {
		return name;
	}
	private final TaskHandler<I, O> handler;
	public TaskHandler<I, O> handler() {
		return handler;
	}
	public TaskRequest(String name, TaskHandler<I, O> handler) {
		Objects.requireNonNull(name);
		Objects.requireNonNull(handler);
		this.name = name;
		this.handler = handler;
		key = name;
	}
	private String key;
	public String key() {
		return key;
	}
	public TaskRequest<I, O> key(String key) {
		Objects.requireNonNull(key);
		this.key = key;
		return this;
	}
	private I input;
	public I input() {
		return input;
	}
	public TaskRequest<I, O> input(I input) {
		this.input = input;
		return this;
	}
	private RequestMeta meta;
	public Optional<RequestMeta> meta() {
		return Optional.ofNullable(meta);
	}
	public TaskRequest<I, O> meta(RequestMeta meta) {
		this.meta = meta;
		return this;
	}
	private TaskMode mode = TaskMode.EXCLUSIVE;
	public TaskMode mode() {
		return mode;
	}
	public TaskRequest<I, O> mode(TaskMode mode) {
		Objects.requireNonNull(mode);
		this.mode = mode;
		return this;
	}
	/*
	 * Null means the queue's default scheduler.
	 */
	private Scheduler schedule;
	public Optional<Scheduler> schedule() {
		return Optional.ofNullable(schedule);
	}
	public TaskRequest<I, O> schedule(Scheduler schedule) {
		this.schedule = schedule;
		return this;
	}
	private final List<TaskGuard> guards = new ArrayList<>();
	public List<TaskGuard> guards() {
		return Collections.unmodifiableList(guards);
	}
	public TaskRequest<I, O> guard(TaskGuard guard) {
		Objects.requireNonNull(guard);
		guards.add(guard);
		return this;
	}
	@Override
	public String toString() {
		return "TaskRequest(" + name + ", key " + key + ", " + mode + ")";
	}
}
