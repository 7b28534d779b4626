// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether.loop;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;

public class ManualEventLoopTest {
	ManualEventLoop loop = new ManualEventLoop();
	List<String> log = new ArrayList<>();
	@Test
	public void microtasksRunBeforeNextTask() {
		loop.execute(() -> {
			log.add("a");
			loop.microtask(() -> log.add("b"));
		});
		loop.execute(() -> log.add("c"));
		// Nothing runs until the loop is pumped.
		assertThat(log, empty());
		loop.runUntilIdle();
		assertEquals(List.of("a", "b", "c"), log);
		assertEquals(0, loop.backlog());
	}
	@Test
	public void timers() {
		Cancellable cancelled = loop.timer(Duration.ofMillis(50), () -> log.add("cancelled"));
		loop.timer(Duration.ofMillis(200), () -> log.add("late"));
		loop.timer(Duration.ofMillis(100), () -> log.add("early"));
		cancelled.cancel();
		// Timers are not due before virtual time advances.
		loop.runUntilIdle();
		assertThat(log, empty());
		loop.advance(Duration.ofMillis(99));
		assertThat(log, empty());
		loop.advance(Duration.ofMillis(1));
		assertEquals(List.of("early"), log);
		// Timers fire in deadline order, not registration order.
		loop.advance(Duration.ofSeconds(1));
		assertEquals(List.of("early", "late"), log);
		assertEquals(Duration.ofMillis(1100), loop.elapsed());
	}
	@Test
	public void timersScheduledByTimers() {
		loop.timer(Duration.ofMillis(10), () -> {
			log.add("first");
			loop.timer(Duration.ofMillis(10), () -> log.add("second"));
		});
		// Timer registered while advancing still fires if it falls within the advanced interval.
		loop.advance(Duration.ofMillis(30));
		assertEquals(List.of("first", "second"), log);
	}
	@Test
	public void framesOncePerPump() {
		AtomicInteger frames = new AtomicInteger();
		Runnable[] repeat = new Runnable[1];
		repeat[0] = () -> {
			frames.incrementAndGet();
			loop.frame(repeat[0]);
		};
		loop.frame(repeat[0]);
		loop.runUntilIdle();
		assertEquals(1, frames.get());
		loop.runUntilIdle();
		assertEquals(2, frames.get());
	}
	@Test
	public void idleRunsLast() {
		loop.idle(() -> log.add("idle"));
		loop.execute(() -> log.add("task"));
		loop.frame(() -> log.add("frame"));
		loop.runUntilIdle();
		assertEquals(List.of("task", "frame", "idle"), log);
	}
	@Test
	public void cancelIdle() {
		loop.idle(() -> log.add("idle")).cancel();
		loop.runUntilIdle();
		assertThat(log, empty());
	}
	@Test
	public void exceptionsDoNotStopLoop() {
		loop.execute(() -> {
			throw new IllegalStateException("expected");
		});
		loop.execute(() -> log.add("after"));
		loop.runUntilIdle();
		assertEquals(List.of("after"), log);
	}
	@Test
	public void current() {
		assertNull(EventLoop.current());
		AtomicReference<EventLoop> seen = new AtomicReference<>();
		loop.execute(() -> seen.set(EventLoop.current()));
		loop.runUntilIdle();
		assertSame(loop, seen.get());
		assertNull(EventLoop.current());
	}
	@Test
	public void dispatch() {
		// Owner thread counts as being in the loop, so dispatch runs inline.
		loop.dispatch(() -> log.add("inline"));
		assertEquals(List.of("inline"), log);
	}
	@Test
	public void ownerOnly() {
		CompletableFuture<Void> foreign = CompletableFuture.runAsync(loop::runUntilIdle);
		ExecutionException ex = assertThrows(ExecutionException.class, foreign::get);
		assertThat(ex.getCause(), instanceOf(IllegalStateException.class));
	}
}
