// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether.loop;

import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.*;

/**
 * Decides when a deferred flush runs. Used by task queues to delay the start of tasks.
 * Cancelling the returned handle before the flush runs guarantees the flush never runs.
 */
@FunctionalInterface
public interface Scheduler {
	Cancellable schedule(Runnable flush);
	static Scheduler immediate() {
		return flush -> {
			flush.run();
			return Cancellable.none();
		};
	}
	/*
	 * Microtasks have no native cancellation, so we just flag the flush as dead.
	 */
	static Scheduler microtask(EventLoop loop) {
		Objects.requireNonNull(loop);
		return flush -> {
			AtomicBoolean cancelled = new AtomicBoolean();
			loop.microtask(() -> {
				if (!cancelled.get())
					flush.run();
			});
			return () -> cancelled.set(true);
		};
	}
	static Scheduler frame(EventLoop loop) {
		Objects.requireNonNull(loop);
		return loop::frame;
	}
	static Scheduler idle(EventLoop loop) {
		Objects.requireNonNull(loop);
		return loop::idle;
	}
	static Scheduler delay(EventLoop loop, Duration delay) {
		Objects.requireNonNull(loop);
		Objects.requireNonNull(delay);
		return flush -> loop.timer(delay, flush);
	}
}
