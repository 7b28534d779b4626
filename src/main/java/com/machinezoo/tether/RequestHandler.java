// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;

@FunctionalInterface
public interface RequestHandler<T, I, O> {
	CompletionStage<O> handle(I input, RequestContext<T> context) throws Exception;
	/**
	 * Wraps synchronous function. Exceptions it throws fail the request.
	 * 
	 * @param function
	 *            synchronous handler body
	 * @return handler returning already completed stage
	 */
	static <T, I, O> RequestHandler<T, I, O> sync(BiFunction<I, RequestContext<T>, O> function) {
		Objects.requireNonNull(function);
		return (input, context) -> CompletableFuture.completedFuture(function.apply(input, context));
	}
}
