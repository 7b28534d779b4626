// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.closeablescope.CloseableScope;
import com.machinezoo.noexception.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;
import com.machinezoo.tether.loop.*;
import com.machinezoo.tether.utils.*;
import io.micrometer.core.instrument.*;

/*
 * Every task goes through three stages: queued (waiting for its scheduler), running (guards and handler),
 * and settled. Exclusivity is scoped by key. Task records are indexed by name, because callers ask
 * "what is the status of setVolume", while several names may contend for one key.
 * 
 * Aborting a running task settles it immediately. The handler keeps running if it ignores its signal,
 * but its eventual result is discarded, because the task is already settled.
 * 
 * All state is guarded by the queue's monitor. Futures, abort signals, and listeners are completed after the monitor
 * is released, in this order: abort signal, future, listeners.
 */
/**
 * Executes named asynchronous tasks with key-scoped cancellation and supersession.
 * 
 * @see TaskRequest
 * @see Task
 * @see Store
 */
@DraftDocs("ordering guarantees")
public class TaskQueue {
	private static final Logger logger = LoggerFactory.getLogger(TaskQueue.class);
	private static final AtomicLong ids = new AtomicLong();
	private final EventLoop loop;
	public EventLoop loop() {
		return loop;
	}
	private final Scheduler scheduler;
	public TaskQueue(EventLoop loop, Scheduler scheduler) {
		Objects.requireNonNull(loop);
		Objects.requireNonNull(scheduler);
		this.loop = loop;
		this.scheduler = scheduler;
		OwnerTrace.of(this).generateId();
	}
	/**
	 * Creates queue that starts tasks in a microtask, so that back-to-back enqueues under the same key
	 * supersede each other before any handler runs.
	 * 
	 * @param loop
	 *            loop that runs guards, handlers, and completions
	 */
	public TaskQueue(EventLoop loop) {
		this(loop, Scheduler.microtask(loop));
	}
	public TaskQueue() {
		this(EventLoop.currentOrCommon());
	}
	private static class Entry<I, O> {
		final long id = ids.incrementAndGet();
		final TaskRequest<I, O> request;
		final CompletableFuture<O> future = new CompletableFuture<>();
		final AbortController controller = new AbortController();
		Cancellable schedule;
		Task task;
		long started;
		boolean settled;
		Entry(TaskRequest<I, O> request) {
			this.request = request;
		}
	}
	private final List<Entry<?, ?>> queued = new ArrayList<>();
	private final List<Entry<?, ?>> running = new ArrayList<>();
	private final Map<String, Task> tasks = new LinkedHashMap<>();
	private final List<Consumer<Map<String, Task>>> listeners = new CopyOnWriteArrayList<>();
	private boolean destroyed;
	public synchronized boolean destroyed() {
		return destroyed;
	}
	/**
	 * Enqueues the task. Exclusive tasks cancel queued tasks and abort running tasks under the same key.
	 * 
	 * @param request
	 *            task to run
	 * @return future that completes with handler's output or fails with handler's exception or {@link StoreException}
	 */
	public <I, O> CompletableFuture<O> enqueue(TaskRequest<I, O> request) {
		Objects.requireNonNull(request);
		Entry<I, O> entry = new Entry<>(request);
		PostLockQueue postlock = new PostLockQueue(this);
		boolean accepted = postlock.eval(() -> {
			if (destroyed) {
				postlock.post(() -> entry.future.completeExceptionally(new StoreException(StoreError.DESTROYED, "Task queue was destroyed.")));
				return false;
			}
			if (request.mode() == TaskMode.EXCLUSIVE)
				cancel(request.key(), StoreError.SUPERSEDED, postlock);
			queued.add(entry);
			return true;
		});
		if (accepted) {
			Cancellable handle = request.schedule().orElse(scheduler).schedule(() -> start(entry));
			if (handle == null)
				handle = Cancellable.none();
			boolean waiting;
			synchronized (this) {
				waiting = queued.contains(entry);
				if (waiting)
					entry.schedule = handle;
			}
			if (!waiting)
				handle.cancel();
		}
		return entry.future;
	}
	/*
	 * Null key matches everything.
	 */
	private void cancel(String key, StoreError reason, PostLockQueue postlock) {
		for (Iterator<Entry<?, ?>> iterator = queued.iterator(); iterator.hasNext();) {
			Entry<?, ?> entry = iterator.next();
			if (key == null || key.equals(entry.request.key())) {
				iterator.remove();
				entry.settled = true;
				Cancellable schedule = entry.schedule;
				StoreException error = new StoreException(reason, "Task " + entry.request.name() + " was cancelled before it started.");
				postlock.post(() -> {
					if (schedule != null)
						schedule.cancel();
					entry.controller.abort(error);
					entry.future.completeExceptionally(error);
				});
			}
		}
		for (Entry<?, ?> entry : new ArrayList<>(running))
			if (key == null || key.equals(entry.request.key()))
				abort(entry, new StoreException(reason, "Task " + entry.request.name() + " was " + (reason == StoreError.SUPERSEDED ? "superseded." : "aborted.")), postlock);
	}
	private void abort(Entry<?, ?> entry, StoreException error, PostLockQueue postlock) {
		if (entry.settled)
			return;
		entry.settled = true;
		running.remove(entry);
		postlock.post(() -> entry.controller.abort(error));
		postlock.post(() -> entry.future.completeExceptionally(error));
		record(entry, entry.task.fail(Instant.now(), error, true), postlock);
	}
	/*
	 * Terminal record replaces the pending one only if no later task with the same name took its place.
	 */
	private void record(Entry<?, ?> entry, Task terminal, PostLockQueue postlock) {
		Metrics.timer("tether.queue.tasks", "status", terminal.status().name().toLowerCase(Locale.ROOT))
			.record(System.nanoTime() - entry.started, TimeUnit.NANOSECONDS);
		if (tasks.get(terminal.name()) == entry.task) {
			tasks.put(terminal.name(), terminal);
			publish(postlock);
		}
	}
	private void publish(PostLockQueue postlock) {
		Map<String, Task> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
		postlock.post(() -> {
			for (Consumer<Map<String, Task>> listener : listeners)
				ExceptionLogging.log(logger).run(() -> listener.accept(snapshot));
		});
	}
	private <I, O> void start(Entry<I, O> entry) {
		PostLockQueue postlock = new PostLockQueue(this);
		boolean started = postlock.eval(() -> {
			if (!queued.remove(entry))
				return false;
			TaskRequest<I, O> request = entry.request;
			entry.started = System.nanoTime();
			entry.task = Task.pending(entry.id, request.name(), request.key(), request.input(), request.meta().orElse(null), Instant.now());
			running.add(entry);
			tasks.put(request.name(), entry.task);
			publish(postlock);
			return true;
		});
		if (started)
			admit(entry);
	}
	/*
	 * Guards run one after another. Evaluation stops at the first guard that does not pass or when the task is aborted.
	 */
	private <I, O> void admit(Entry<I, O> entry) {
		AbortSignal signal = entry.controller.signal();
		CompletableFuture<Boolean> gate = CompletableFuture.completedFuture(true);
		for (TaskGuard guard : entry.request.guards()) {
			gate = gate.thenCompose(passed -> {
				if (!passed || signal.aborted())
					return CompletableFuture.completedFuture(false);
				CompletionStage<Boolean> check = Exceptions.sneak().get(() -> guard.check(signal));
				return check;
			});
		}
		gate.whenComplete((passed, exception) -> loop.dispatch(() -> {
			if (exception != null)
				settle(entry, null, rejection(entry, StoreError.unwrap(exception)));
			else if (!Boolean.TRUE.equals(passed))
				settle(entry, null, new StoreException(StoreError.REJECTED, "Task " + entry.request.name() + " was rejected by its guard."));
			else
				execute(entry);
		}));
	}
	/*
	 * Guards failing with our own exception (timeouts) keep their error code. Anything else becomes a rejection.
	 */
	private static StoreException rejection(Entry<?, ?> entry, Throwable exception) {
		if (exception instanceof StoreException)
			return (StoreException)exception;
		StoreException rejection = new StoreException(StoreError.REJECTED, "Guard of task " + entry.request.name() + " failed.");
		rejection.initCause(exception);
		return rejection;
	}
	private <I, O> void execute(Entry<I, O> entry) {
		AbortSignal signal = entry.controller.signal();
		if (signal.aborted())
			return;
		CompletionStage<O> stage;
		try {
			stage = entry.request.handler().run(new TaskContext<>(entry.request.input(), signal));
			Objects.requireNonNull(stage, "Task handler returned null.");
		} catch (Throwable ex) {
			settle(entry, null, ex);
			return;
		}
		stage.whenComplete((output, exception) -> loop.dispatch(() -> settle(entry, output, exception)));
	}
	private <I, O> void settle(Entry<I, O> entry, O output, Throwable exception) {
		Throwable failure = StoreError.unwrap(exception);
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> {
			if (entry.settled)
				return;
			entry.settled = true;
			running.remove(entry);
			if (failure == null) {
				postlock.post(() -> entry.future.complete(output));
				record(entry, entry.task.succeed(Instant.now(), output), postlock);
			} else {
				postlock.post(() -> entry.future.completeExceptionally(failure));
				record(entry, entry.task.fail(Instant.now(), failure, false), postlock);
			}
		});
	}
	/**
	 * Aborts queued and running tasks under the key. Their futures fail with {@link StoreError#ABORTED}.
	 * 
	 * @param key
	 *            key of the tasks to abort
	 */
	public void abort(String key) {
		Objects.requireNonNull(key);
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> cancel(key, StoreError.ABORTED, postlock));
	}
	public void abortAll() {
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> cancel(null, StoreError.ABORTED, postlock));
	}
	/**
	 * Forgets settled record of the named task, returning its status to {@link TaskStatus#IDLE}.
	 * Running tasks are not affected.
	 * 
	 * @param name
	 *            name of the task
	 */
	public void reset(String name) {
		Objects.requireNonNull(name);
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> {
			Task task = tasks.get(name);
			if (task != null && task.status().settled()) {
				tasks.remove(name);
				publish(postlock);
			}
		});
	}
	public void reset() {
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> {
			if (tasks.values().removeIf(t -> t.status().settled()))
				publish(postlock);
		});
	}
	public synchronized Map<String, Task> tasks() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
	}
	public synchronized Optional<Task> task(String name) {
		return Optional.ofNullable(tasks.get(name));
	}
	public synchronized TaskStatus status(String name) {
		Task task = tasks.get(name);
		return task != null ? task.status() : TaskStatus.IDLE;
	}
	/*
	 * Includes queued tasks that have no record yet.
	 */
	public synchronized int pending() {
		return queued.size() + running.size();
	}
	/**
	 * Registers listener called with a snapshot of all task records after every status transition.
	 * Listener exceptions are logged and do not affect the queue.
	 * 
	 * @param listener
	 *            callback receiving task records keyed by name
	 * @return scope that unsubscribes when closed
	 */
	public CloseableScope subscribe(Consumer<Map<String, Task>> listener) {
		Objects.requireNonNull(listener);
		listeners.add(listener);
		return () -> listeners.remove(listener);
	}
	/**
	 * Aborts all tasks, clears all records and listeners, and makes later enqueues fail. Calling it again does nothing.
	 */
	public void destroy() {
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> {
			if (destroyed)
				return;
			destroyed = true;
			cancel(null, StoreError.ABORTED, postlock);
			tasks.clear();
			listeners.clear();
		});
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
