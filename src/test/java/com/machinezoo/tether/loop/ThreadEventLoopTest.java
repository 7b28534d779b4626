// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether.loop;

import static org.awaitility.Awaitility.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import org.junitpioneer.jupiter.*;
import com.machinezoo.noexception.*;
import com.machinezoo.tether.*;

public class ThreadEventLoopTest extends TestBase {
	ThreadEventLoop loop = new ThreadEventLoop("test-loop");
	@AfterEach
	public void close() {
		loop.close();
	}
	@Test
	public void execute() {
		AtomicReference<Thread> thread = new AtomicReference<>();
		loop.execute(() -> thread.set(Thread.currentThread()));
		await().untilAtomic(thread, notNullValue());
		assertNotSame(Thread.currentThread(), thread.get());
		assertEquals("test-loop", thread.get().getName());
		assertTrue(thread.get().isDaemon());
	}
	@Test
	public void microtaskFromOutside() {
		// Outside of the loop, microtasks degrade to ordinary tasks.
		AtomicBoolean inside = new AtomicBoolean();
		loop.microtask(() -> inside.set(loop.inLoop()));
		await().untilTrue(inside);
	}
	@RetryingTest(10)
	public void timer() {
		AtomicLong fired = new AtomicLong();
		long start = System.nanoTime();
		loop.timer(Duration.ofMillis(50), () -> fired.set(System.nanoTime()));
		await().untilAtomic(fired, greaterThan(0L));
		assertThat(fired.get() - start, greaterThanOrEqualTo(Duration.ofMillis(50).toNanos()));
	}
	@Test
	public void frame() {
		AtomicInteger frames = new AtomicInteger();
		loop.frame(frames::incrementAndGet);
		await().untilAtomic(frames, equalTo(1));
	}
	@Test
	public void survivesExceptions() {
		AtomicBoolean after = new AtomicBoolean();
		loop.execute(() -> {
			throw new IllegalStateException("expected");
		});
		loop.execute(() -> after.set(true));
		await().untilTrue(after);
	}
	@Test
	public void closed() {
		loop.close();
		assertTrue(loop.closed());
		assertThrows(RejectedExecutionException.class, () -> loop.execute(() -> {
		}));
	}
	@Test
	public void closeDropsQueued() {
		AtomicBoolean closing = new AtomicBoolean();
		AtomicBoolean dropped = new AtomicBoolean();
		CountDownLatch queued = new CountDownLatch(1);
		loop.execute(() -> {
			Exceptions.sneak().run(queued::await);
			loop.close();
			closing.set(true);
		});
		loop.execute(() -> dropped.set(true));
		queued.countDown();
		await().untilTrue(closing);
		sleep(100);
		assertFalse(dropped.get());
	}
	@Test
	public void interrupted() {
		// Interrupt flag survives the callback and stops the thread at its next wait.
		loop.execute(() -> Thread.currentThread().interrupt());
		await().until(loop::closed);
		assertThrows(RejectedExecutionException.class, () -> loop.execute(() -> {
		}));
	}
	@Test
	public void interval() {
		assertThrows(IllegalArgumentException.class, () -> new ThreadEventLoop("bad", Duration.ZERO));
	}
}
