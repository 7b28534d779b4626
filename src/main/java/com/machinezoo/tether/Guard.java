// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import com.machinezoo.tether.loop.*;

/**
 * Predicate that must pass before request handler runs.
 * Guard completing with {@code false} or failing rejects the request without invoking the handler.
 * 
 * @param <T>
 *            type of the target
 */
@FunctionalInterface
@DraftApi("guards receiving request input")
public interface Guard<T> {
	CompletionStage<Boolean> check(GuardContext<T> context) throws Exception;
	static <T> Guard<T> of(Predicate<GuardContext<T>> predicate) {
		Objects.requireNonNull(predicate);
		return context -> CompletableFuture.completedFuture(predicate.test(context));
	}
	static <T> Guard<T> target(Predicate<T> predicate) {
		Objects.requireNonNull(predicate);
		return of(context -> predicate.test(context.target()));
	}
	/**
	 * Combines guards that must all pass. They are evaluated in order and evaluation stops at the first one that does not pass.
	 * 
	 * @param guards
	 *            guards to combine
	 * @return combined guard
	 */
	static <T> Guard<T> all(List<Guard<T>> guards) {
		List<Guard<T>> copy = new ArrayList<>(guards);
		return context -> {
			CompletableFuture<Boolean> result = CompletableFuture.completedFuture(true);
			for (Guard<T> guard : copy) {
				result = result.thenCompose(passed -> {
					if (!passed)
						return CompletableFuture.completedFuture(false);
					try {
						return guard.check(context);
					} catch (Exception ex) {
						return CompletableFuture.failedFuture(ex);
					}
				});
			}
			return result;
		};
	}
	@SafeVarargs
	static <T> Guard<T> all(Guard<T>... guards) {
		return all(Arrays.asList(guards));
	}
	/**
	 * Combines guards of which at least one must pass. All guards are evaluated concurrently.
	 * First passing guard completes the result. If no guard passes, the result is {@code false}.
	 * Failure of any guard before some guard passes fails the result.
	 * 
	 * @param guards
	 *            guards to combine
	 * @return combined guard
	 */
	static <T> Guard<T> any(List<Guard<T>> guards) {
		List<Guard<T>> copy = new ArrayList<>(guards);
		return context -> {
			if (copy.isEmpty())
				return CompletableFuture.completedFuture(false);
			CompletableFuture<Boolean> result = new CompletableFuture<>();
			AtomicInteger remaining = new AtomicInteger(copy.size());
			for (Guard<T> guard : copy) {
				CompletionStage<Boolean> stage;
				try {
					stage = guard.check(context);
				} catch (Exception ex) {
					result.completeExceptionally(ex);
					break;
				}
				stage.whenComplete((passed, exception) -> {
					if (exception != null)
						result.completeExceptionally(exception);
					else if (Boolean.TRUE.equals(passed))
						result.complete(true);
					else if (remaining.decrementAndGet() == 0)
						result.complete(false);
				});
			}
			return result;
		};
	}
	@SafeVarargs
	static <T> Guard<T> any(Guard<T>... guards) {
		return any(Arrays.asList(guards));
	}
	/**
	 * Fails with {@link StoreError#TIMEOUT} if the guard does not complete in time.
	 * The timer is cancelled when the guard completes or when the request is aborted.
	 * 
	 * @param guard
	 *            guard to limit
	 * @param timeout
	 *            how long to wait for the guard
	 * @param loop
	 *            loop running the timer
	 * @return guard with time limit
	 */
	static <T> Guard<T> timeout(Guard<T> guard, Duration timeout, EventLoop loop) {
		Objects.requireNonNull(guard);
		Objects.requireNonNull(timeout);
		Objects.requireNonNull(loop);
		return context -> {
			CompletionStage<Boolean> stage = guard.check(context);
			CompletableFuture<Boolean> result = new CompletableFuture<>();
			Cancellable timer = loop.timer(timeout, () -> result.completeExceptionally(new StoreException(StoreError.TIMEOUT, "Guard did not complete within " + timeout + ".")));
			CloseableScope abort = context.signal().onAbort(timer::cancel);
			stage.whenComplete((passed, exception) -> {
				timer.cancel();
				abort.close();
				if (exception != null)
					result.completeExceptionally(exception);
				else
					result.complete(passed);
			});
			return result;
		};
	}
}
