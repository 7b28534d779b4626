// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.concurrent.*;

/**
 * Body of a task. Exceptions thrown synchronously are treated the same way as exceptionally completed stages.
 * 
 * @param <I>
 *            type of task input
 * @param <O>
 *            type of task output
 */
@FunctionalInterface
public interface TaskHandler<I, O> {
	CompletionStage<O> run(TaskContext<I> context) throws Exception;
}
