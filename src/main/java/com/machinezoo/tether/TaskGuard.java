// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.concurrent.*;

/**
 * Queue-level guard. {@link Store} adapts target-aware {@link Guard} instances to this interface.
 */
@FunctionalInterface
public interface TaskGuard {
	CompletionStage<Boolean> check(AbortSignal signal) throws Exception;
}
