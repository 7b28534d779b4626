// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether.loop;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;

/*
 * Stores, queues, and reactive state all assume a single writer. The event loop is that writer.
 * It mirrors the execution model of browser event loops, because that is what features written
 * against media elements expect: macrotasks, microtasks drained after every macrotask,
 * timers, frame callbacks, and idle callbacks that run only when there is nothing else to do.
 * 
 * Subclasses decide which thread drives the loop and where time comes from.
 * All queues are guarded by the loop's monitor. Callbacks always run with the monitor released.
 */
/**
 * Single logical thread of execution with microtask, timer, frame, and idle queues.
 * 
 * @see ThreadEventLoop
 * @see ManualEventLoop
 * @see Scheduler
 */
@StubDocs
public abstract class EventLoop implements Executor {
	private static final Logger logger = LoggerFactory.getLogger(EventLoop.class);
	private static final ThreadLocal<EventLoop> running = new ThreadLocal<>();
	/**
	 * Returns the loop whose callback is running on the current thread.
	 * 
	 * @return current loop or {@code null} if no loop callback is running on this thread
	 */
	public static EventLoop current() {
		return running.get();
	}
	/*
	 * Shared loop is created lazily, so that merely loading this class does not start a thread.
	 */
	private static class CommonHolder {
		static final ThreadEventLoop instance = new ThreadEventLoop("tether-loop");
	}
	public static EventLoop common() {
		return CommonHolder.instance;
	}
	/*
	 * Loop used by components that were not given one explicitly.
	 */
	public static EventLoop currentOrCommon() {
		EventLoop current = current();
		return current != null ? current : common();
	}
	private final ArrayDeque<Runnable> tasks = new ArrayDeque<>();
	private final ArrayDeque<Runnable> microtasks = new ArrayDeque<>();
	private final PriorityQueue<Deferred> timers = new PriorityQueue<>();
	private List<Deferred> frames = new ArrayList<>();
	private final List<Deferred> idlers = new ArrayList<>();
	private static final AtomicLong counter = new AtomicLong();
	private class Deferred implements Cancellable, Comparable<Deferred> {
		final long deadline;
		final long order = counter.incrementAndGet();
		final Runnable runnable;
		boolean done;
		Deferred(long deadline, Runnable runnable) {
			this.deadline = deadline;
			this.runnable = runnable;
		}
		@Override
		public void cancel() {
			synchronized (EventLoop.this) {
				if (!done) {
					done = true;
					timers.remove(this);
					frames.remove(this);
					idlers.remove(this);
				}
			}
		}
		void fire() {
			synchronized (EventLoop.this) {
				if (done)
					return;
				done = true;
			}
			ExceptionLogging.log(logger).run(runnable);
		}
		@Override
		public int compareTo(Deferred other) {
			if (deadline != other.deadline)
				return Long.compare(deadline, other.deadline);
			return Long.compare(order, other.order);
		}
	}
	/**
	 * Returns {@code true} if the calling thread is the one driving this loop.
	 * 
	 * @return {@code true} if called from this loop's thread
	 */
	public abstract boolean inLoop();
	/*
	 * Monotonic time in nanoseconds. Manual loops return virtual time.
	 */
	protected abstract long nanoTime();
	protected abstract boolean frameDue();
	protected abstract long frameDeadline();
	protected void frameStarted() {
	}
	protected void wake() {
	}
	@Override
	public void execute(Runnable task) {
		Objects.requireNonNull(task);
		synchronized (this) {
			tasks.add(task);
		}
		wake();
	}
	/**
	 * Queues a microtask. Microtasks run after the currently running callback and before the next macrotask.
	 * Outside of the loop, microtasks degrade to ordinary tasks.
	 * 
	 * @param task
	 *            callback to run
	 */
	public void microtask(Runnable task) {
		Objects.requireNonNull(task);
		if (!inLoop()) {
			execute(task);
			return;
		}
		synchronized (this) {
			microtasks.add(task);
		}
	}
	/*
	 * Completion callbacks of asynchronous work use this to get back onto the loop without an extra turn when possible.
	 */
	public void dispatch(Runnable task) {
		Objects.requireNonNull(task);
		if (inLoop())
			task.run();
		else
			execute(task);
	}
	public Cancellable timer(Duration delay, Runnable task) {
		Objects.requireNonNull(delay);
		Objects.requireNonNull(task);
		Deferred deferred = new Deferred(nanoTime() + Math.max(0, delay.toNanos()), task);
		synchronized (this) {
			timers.add(deferred);
		}
		wake();
		return deferred;
	}
	public Cancellable frame(Runnable task) {
		Objects.requireNonNull(task);
		Deferred deferred = new Deferred(0, task);
		synchronized (this) {
			frames.add(deferred);
		}
		wake();
		return deferred;
	}
	public Cancellable idle(Runnable task) {
		Objects.requireNonNull(task);
		Deferred deferred = new Deferred(0, task);
		synchronized (this) {
			idlers.add(deferred);
		}
		wake();
		return deferred;
	}
	/*
	 * Picks the next unit of work in priority order: leftover microtasks, tasks, due timers, frame, idle callback.
	 */
	private synchronized Runnable take() {
		Runnable micro = microtasks.poll();
		if (micro != null)
			return micro;
		Runnable task = tasks.poll();
		if (task != null)
			return task;
		Deferred timer = timers.peek();
		if (timer != null && timer.deadline <= nanoTime()) {
			timers.poll();
			return timer::fire;
		}
		if (!frames.isEmpty() && frameDue()) {
			List<Deferred> due = frames;
			frames = new ArrayList<>();
			frameStarted();
			return () -> {
				for (Deferred deferred : due)
					deferred.fire();
			};
		}
		if (!idlers.isEmpty())
			return idlers.remove(0)::fire;
		return null;
	}
	/**
	 * Runs one unit of work followed by all microtasks it queued.
	 * 
	 * @return {@code false} if there was nothing ready to run
	 */
	protected boolean pump() {
		Runnable task = take();
		if (task == null)
			return false;
		EventLoop outer = running.get();
		running.set(this);
		try {
			ExceptionLogging.log(logger).run(task);
			while (true) {
				Runnable micro;
				synchronized (this) {
					micro = microtasks.poll();
				}
				if (micro == null)
					break;
				ExceptionLogging.log(logger).run(micro);
			}
		} finally {
			if (outer != null)
				running.set(outer);
			else
				running.remove();
		}
		return true;
	}
	/*
	 * How long the driving thread may sleep before some work becomes due. Must be called with the monitor held.
	 */
	protected long nanosUntilWork() {
		if (!tasks.isEmpty() || !microtasks.isEmpty() || !idlers.isEmpty())
			return 0;
		long now = nanoTime();
		long wait = Long.MAX_VALUE;
		Deferred timer = timers.peek();
		if (timer != null)
			wait = Math.max(0, timer.deadline - now);
		if (!frames.isEmpty())
			wait = Math.min(wait, Math.max(0, frameDeadline() - now));
		return wait;
	}
	protected synchronized OptionalLong nextTimer() {
		Deferred timer = timers.peek();
		return timer != null ? OptionalLong.of(timer.deadline) : OptionalLong.empty();
	}
	/**
	 * Counts callbacks of all kinds that are waiting to run.
	 * 
	 * @return number of queued callbacks
	 */
	public synchronized int backlog() {
		return tasks.size() + microtasks.size() + timers.size() + frames.size() + idlers.size();
	}
}
