// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

/**
 * Owner side of an {@link AbortSignal}. Whoever holds the controller can abort, everyone else can only observe.
 */
public class AbortController {
	private final AbortSignal signal = new AbortSignal();
	public AbortSignal signal() {
		return signal;
	}
	/**
	 * Aborts the signal with the given reason. Only the first call has any effect.
	 * Abort listeners run synchronously on the calling thread before this method returns.
	 * 
	 * @param reason
	 *            reason reported by {@link AbortSignal#reason()}
	 * @return {@code true} if this call aborted the signal, {@code false} if it was already aborted
	 */
	public boolean abort(RuntimeException reason) {
		return signal.abort(reason);
	}
	public boolean abort() {
		return abort(new StoreException(StoreError.ABORTED));
	}
	@Override
	public String toString() {
		return "AbortController(" + signal + ")";
	}
}
