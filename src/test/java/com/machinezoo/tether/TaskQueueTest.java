// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import com.machinezoo.tether.loop.*;

public class TaskQueueTest extends TestBase {
	ManualEventLoop loop = new ManualEventLoop();
	TaskQueue queue = new TaskQueue(loop);
	List<String> log = new ArrayList<>();
	static <I, O> TaskRequest<I, O> sync(String name, java.util.function.Function<I, O> body) {
		return new TaskRequest<>(name, context -> CompletableFuture.completedFuture(body.apply(context.input())));
	}
	@Test
	public void success() {
		CompletableFuture<Integer> future = queue.enqueue(TaskQueueTest.<Integer, Integer>sync("double", n -> 2 * n).input(21));
		// Tasks start in a microtask.
		assertFalse(future.isDone());
		assertEquals(TaskStatus.IDLE, queue.status("double"));
		loop.runUntilIdle();
		assertEquals(42, future.join());
		Task task = queue.task("double").get();
		assertEquals(TaskStatus.SUCCESS, task.status());
		assertEquals(42, task.output());
		assertEquals(21, task.input());
		assertEquals("double", task.key());
		assertTrue(task.settled().isPresent());
		assertFalse(task.cancelled());
	}
	@Test
	public void supersedeQueued() {
		double[] volume = new double[1];
		CompletableFuture<Double> first = queue.enqueue(TaskQueueTest.<Double, Double>sync("setVolume", v -> {
			log.add("first");
			return volume[0] = v;
		}).input(0.3));
		CompletableFuture<Double> second = queue.enqueue(TaskQueueTest.<Double, Double>sync("setVolume", v -> {
			log.add("second");
			return volume[0] = v;
		}).input(0.7));
		// Superseded task fails before it starts and its handler never runs.
		assertEquals(StoreError.SUPERSEDED, failure(first));
		loop.runUntilIdle();
		assertEquals(0.7, second.join());
		assertEquals(0.7, volume[0]);
		assertEquals(List.of("second"), log);
	}
	@Test
	public void supersedeRunning() {
		CompletableFuture<String> pending = new CompletableFuture<>();
		CompletableFuture<String> first = queue.enqueue(new TaskRequest<String, String>("load", context -> {
			context.signal().onAbort(() -> log.add("signal"));
			return pending;
		}).key("source"));
		first.whenComplete((r, ex) -> log.add("future"));
		loop.runUntilIdle();
		assertEquals(TaskStatus.PENDING, queue.status("load"));
		// Another name under the same key supersedes the running task.
		CompletableFuture<String> second = queue.enqueue(TaskQueueTest.<String, String>sync("reload", s -> "reloaded").key("source"));
		// Abort signal fires strictly before the future fails.
		assertEquals(List.of("signal", "future"), log);
		assertEquals(StoreError.SUPERSEDED, failure(first));
		Task record = queue.task("load").get();
		assertEquals(TaskStatus.ERROR, record.status());
		assertTrue(record.cancelled());
		loop.runUntilIdle();
		assertEquals("reloaded", second.join());
		// Handler ignoring its signal completes later, but its result is discarded.
		pending.complete("late");
		loop.runUntilIdle();
		assertEquals(StoreError.SUPERSEDED, failure(first));
		assertEquals(TaskStatus.ERROR, queue.status("load"));
	}
	@Test
	public void shared() {
		List<CompletableFuture<String>> handlers = new ArrayList<>();
		List<CompletableFuture<String>> futures = new ArrayList<>();
		for (int i = 0; i < 3; ++i) {
			CompletableFuture<String> handler = new CompletableFuture<>();
			handlers.add(handler);
			futures.add(queue.enqueue(new TaskRequest<Void, String>("play", context -> handler).mode(TaskMode.SHARED)));
		}
		loop.runUntilIdle();
		// Shared tasks never cancel each other.
		for (int i = 0; i < 3; ++i)
			handlers.get(i).complete("played " + i);
		loop.runUntilIdle();
		for (int i = 0; i < 3; ++i)
			assertEquals("played " + i, futures.get(i).join());
	}
	@Test
	public void startOrder() {
		for (String name : List.of("a", "b", "c"))
			queue.enqueue(TaskQueueTest.<Void, Void>sync(name, v -> {
				log.add(name);
				return null;
			}).key("k").mode(TaskMode.SHARED));
		loop.runUntilIdle();
		assertEquals(List.of("a", "b", "c"), log);
	}
	@Test
	public void guards() {
		AtomicBoolean ran = new AtomicBoolean();
		CompletableFuture<Void> rejected = queue.enqueue(new TaskRequest<Void, Void>("seek", context -> {
			ran.set(true);
			return CompletableFuture.completedFuture(null);
		})
			.guard(signal -> {
				log.add("first");
				return CompletableFuture.completedFuture(false);
			})
			.guard(signal -> {
				log.add("second");
				return CompletableFuture.completedFuture(true);
			}));
		loop.runUntilIdle();
		assertEquals(StoreError.REJECTED, failure(rejected));
		assertFalse(ran.get());
		// Evaluation stops at the first guard that does not pass.
		assertEquals(List.of("first"), log);
		assertEquals(TaskStatus.ERROR, queue.status("seek"));
	}
	@Test
	public void failingGuard() {
		CompletableFuture<Void> rejected = queue.enqueue(new TaskRequest<Void, Void>("seek", context -> CompletableFuture.completedFuture(null))
			.guard(signal -> {
				throw new IllegalStateException("guard");
			}));
		loop.runUntilIdle();
		assertEquals(StoreError.REJECTED, failure(rejected));
		Throwable error = queue.task("seek").get().error().get();
		assertThat(error.getCause(), instanceOf(IllegalStateException.class));
	}
	@Test
	public void asyncGuard() {
		CompletableFuture<Boolean> gate = new CompletableFuture<>();
		CompletableFuture<String> future = queue.enqueue(TaskQueueTest.<Void, String>sync("play", v -> "playing").guard(signal -> gate));
		loop.runUntilIdle();
		assertFalse(future.isDone());
		gate.complete(true);
		loop.runUntilIdle();
		assertEquals("playing", future.join());
	}
	@Test
	public void handlerErrors() {
		IllegalStateException thrown = new IllegalStateException("sync");
		CompletableFuture<Void> sync = queue.enqueue(new TaskRequest<Void, Void>("a", context -> {
			throw thrown;
		}));
		RuntimeException failed = new RuntimeException("async");
		CompletableFuture<Void> async = queue.enqueue(new TaskRequest<Void, Void>("b", context -> CompletableFuture.failedFuture(failed)));
		loop.runUntilIdle();
		// Handler exceptions are propagated as they are.
		assertSame(thrown, assertThrows(CompletionException.class, sync::join).getCause());
		assertSame(failed, assertThrows(CompletionException.class, async::join).getCause());
		assertEquals(StoreError.HANDLER, StoreError.classify(assertThrows(CompletionException.class, async::join)));
		assertSame(failed, queue.task("b").get().error().get());
		assertFalse(queue.task("b").get().cancelled());
	}
	@Test
	public void abortByKey() {
		CompletableFuture<Void> running = queue.enqueue(new TaskRequest<Void, Void>("seek", context -> new CompletableFuture<>()));
		loop.runUntilIdle();
		CompletableFuture<Void> queued = queue.enqueue(new TaskRequest<Void, Void>("seek", context -> new CompletableFuture<>()).mode(TaskMode.SHARED));
		CompletableFuture<Void> other = queue.enqueue(new TaskRequest<Void, Void>("play", context -> new CompletableFuture<>()));
		queue.abort("seek");
		assertEquals(StoreError.ABORTED, failure(running));
		assertEquals(StoreError.ABORTED, failure(queued));
		assertFalse(other.isDone());
		queue.abortAll();
		assertEquals(StoreError.ABORTED, failure(other));
		assertEquals(0, queue.pending());
	}
	@Test
	public void customSchedule() {
		CompletableFuture<String> first = queue.enqueue(TaskQueueTest.<Void, String>sync("render", v -> {
			log.add("first");
			return "first";
		}).schedule(Scheduler.frame(loop)));
		CompletableFuture<String> second = queue.enqueue(TaskQueueTest.<Void, String>sync("render", v -> "second").schedule(Scheduler.frame(loop)));
		// Superseded frame callback is cancelled.
		assertEquals(StoreError.SUPERSEDED, failure(first));
		loop.runUntilIdle();
		assertEquals("second", second.join());
		assertThat(log, empty());
	}
	@Test
	public void immediateScheduler() {
		TaskQueue immediate = new TaskQueue(loop, Scheduler.immediate());
		CompletableFuture<String> future = immediate.enqueue(TaskQueueTest.<Void, String>sync("now", v -> "done"));
		assertEquals("done", future.join());
	}
	@Test
	public void reset() {
		queue.enqueue(TaskQueueTest.<Void, String>sync("done", v -> "ok"));
		CompletableFuture<String> pending = new CompletableFuture<>();
		queue.enqueue(new TaskRequest<Void, String>("pending", context -> pending));
		loop.runUntilIdle();
		assertEquals(TaskStatus.SUCCESS, queue.status("done"));
		queue.reset("done");
		assertEquals(TaskStatus.IDLE, queue.status("done"));
		// Running tasks are not affected.
		queue.reset("pending");
		queue.reset();
		assertEquals(TaskStatus.PENDING, queue.status("pending"));
		pending.complete("finished");
		loop.runUntilIdle();
		assertEquals(TaskStatus.SUCCESS, queue.status("pending"));
		queue.reset();
		assertThat(queue.tasks().keySet(), empty());
	}
	@Test
	public void subscribe() {
		List<TaskStatus> transitions = new ArrayList<>();
		queue.subscribe(tasks -> transitions.add(tasks.get("play").status()));
		queue.subscribe(tasks -> {
			throw new IllegalStateException("listener");
		});
		CompletableFuture<String> future = queue.enqueue(TaskQueueTest.<Void, String>sync("play", v -> "ok"));
		loop.runUntilIdle();
		// Failing listener does not disturb the queue or other listeners.
		assertEquals("ok", future.join());
		assertEquals(List.of(TaskStatus.PENDING, TaskStatus.SUCCESS), transitions);
	}
	@Test
	public void tasksAreReadOnly() {
		queue.enqueue(TaskQueueTest.<Void, String>sync("play", v -> "ok"));
		loop.runUntilIdle();
		Map<String, Task> tasks = queue.tasks();
		assertThrows(UnsupportedOperationException.class, () -> tasks.remove("play"));
	}
	@Test
	public void destroy() {
		AtomicInteger notifications = new AtomicInteger();
		queue.subscribe(tasks -> notifications.incrementAndGet());
		CompletableFuture<Void> running = queue.enqueue(new TaskRequest<Void, Void>("seek", context -> new CompletableFuture<>()));
		loop.runUntilIdle();
		notifications.set(0);
		queue.destroy();
		assertTrue(queue.destroyed());
		assertEquals(StoreError.ABORTED, failure(running));
		assertThat(queue.tasks().keySet(), empty());
		assertEquals(0, notifications.get());
		// Destroying again is harmless.
		queue.destroy();
		assertEquals(StoreError.DESTROYED, failure(queue.enqueue(TaskQueueTest.<Void, Void>sync("late", v -> null))));
	}
	@Test
	public void meta() {
		RequestMeta meta = RequestMeta.user("click");
		queue.enqueue(TaskQueueTest.<Void, Void>sync("play", v -> null).meta(meta));
		loop.runUntilIdle();
		assertSame(meta, queue.task("play").get().meta().get());
	}
}
