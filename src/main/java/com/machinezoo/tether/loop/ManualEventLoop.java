// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether.loop;

import java.time.*;
import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Hosts that already own a thread (UI toolkits, game loops, tests) pump this loop themselves.
 * Time is virtual. It only moves when advance() is called, which makes timer-driven behavior deterministic.
 */
/**
 * {@link EventLoop} pumped explicitly by the thread that created it.
 */
@DraftApi("ownership transfer to another thread")
public class ManualEventLoop extends EventLoop {
	private final Thread owner = Thread.currentThread();
	private long now;
	/*
	 * Only one round of frame callbacks per pump, so that callbacks re-registering themselves every frame do not spin forever.
	 */
	private boolean frameBudget;
	@Override
	public boolean inLoop() {
		return Thread.currentThread() == owner;
	}
	@Override
	protected synchronized long nanoTime() {
		return now;
	}
	@Override
	protected synchronized boolean frameDue() {
		return frameBudget;
	}
	@Override
	protected synchronized long frameDeadline() {
		return now;
	}
	@Override
	protected synchronized void frameStarted() {
		frameBudget = false;
	}
	private void ensureOwner() {
		if (!inLoop())
			throw new IllegalStateException("Manual event loop can be pumped only by the thread that created it.");
	}
	/**
	 * Runs callbacks until nothing is ready to run. Timers that are not due yet stay queued.
	 * 
	 * @return {@code this} (fluent method)
	 */
	public ManualEventLoop runUntilIdle() {
		ensureOwner();
		synchronized (this) {
			frameBudget = true;
		}
		while (pump())
			;
		return this;
	}
	/**
	 * Moves virtual time forward, running every timer that becomes due in deadline order.
	 * 
	 * @param duration
	 *            non-negative amount of virtual time to add
	 * @return {@code this} (fluent method)
	 */
	public ManualEventLoop advance(Duration duration) {
		Objects.requireNonNull(duration);
		if (duration.isNegative())
			throw new IllegalArgumentException();
		ensureOwner();
		runUntilIdle();
		long target;
		synchronized (this) {
			target = now + duration.toNanos();
		}
		while (true) {
			OptionalLong next = nextTimer();
			if (next.isEmpty() || next.getAsLong() > target)
				break;
			synchronized (this) {
				now = Math.max(now, next.getAsLong());
			}
			runUntilIdle();
		}
		synchronized (this) {
			now = target;
		}
		return runUntilIdle();
	}
	public synchronized Duration elapsed() {
		return Duration.ofNanos(now);
	}
	@Override
	public String toString() {
		return "ManualEventLoop(" + owner.getName() + ")";
	}
}
