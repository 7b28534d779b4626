// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether.loop;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/**
 * {@link EventLoop} driven by its own daemon thread.
 * Frame callbacks are run at fixed frame intervals, 16ms by default.
 */
@StubDocs
public class ThreadEventLoop extends EventLoop implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ThreadEventLoop.class);
	private final Thread thread;
	private final long frameNanos;
	private long nextFrame;
	private boolean closed;
	public ThreadEventLoop(String name, Duration frameInterval) {
		Objects.requireNonNull(name);
		Objects.requireNonNull(frameInterval);
		if (frameInterval.isNegative() || frameInterval.isZero())
			throw new IllegalArgumentException("Frame interval must be positive.");
		frameNanos = frameInterval.toNanos();
		nextFrame = System.nanoTime() + frameNanos;
		thread = new Thread(this::loop, name);
		/*
		 * Loop thread must not keep the process alive. Applications that need it alive keep their own threads.
		 */
		thread.setDaemon(true);
		thread.start();
		Metrics.gauge("tether.loop.backlog", Tags.of("loop", name), this, EventLoop::backlog);
	}
	public ThreadEventLoop(String name) {
		this(name, Duration.ofMillis(16));
	}
	@Override
	public boolean inLoop() {
		return Thread.currentThread() == thread;
	}
	@Override
	protected long nanoTime() {
		return System.nanoTime();
	}
	@Override
	protected synchronized boolean frameDue() {
		return nanoTime() >= nextFrame;
	}
	@Override
	protected synchronized long frameDeadline() {
		return nextFrame;
	}
	@Override
	protected synchronized void frameStarted() {
		long now = nanoTime();
		while (nextFrame <= now)
			nextFrame += frameNanos;
	}
	@Override
	protected void wake() {
		synchronized (this) {
			notifyAll();
		}
	}
	@Override
	public void execute(Runnable task) {
		synchronized (this) {
			if (closed)
				throw new RejectedExecutionException("Event loop was closed.");
		}
		super.execute(task);
	}
	private void loop() {
		while (true) {
			synchronized (this) {
				if (closed)
					return;
			}
			if (pump())
				continue;
			synchronized (this) {
				if (closed)
					return;
				long wait = nanosUntilWork();
				if (wait > 0) {
					try {
						TimeUnit.NANOSECONDS.timedWait(this, wait);
					} catch (InterruptedException ex) {
						logger.debug("Event loop thread {} interrupted, stopping.", thread.getName());
						closed = true;
						Thread.currentThread().interrupt();
						return;
					}
				}
			}
		}
	}
	public synchronized boolean closed() {
		return closed;
	}
	/*
	 * Callbacks still in the queues are dropped. Callback that is running at the moment completes normally.
	 */
	@Override
	public void close() {
		synchronized (this) {
			closed = true;
			notifyAll();
		}
	}
	@Override
	public String toString() {
		return "ThreadEventLoop(" + thread.getName() + ")";
	}
}
