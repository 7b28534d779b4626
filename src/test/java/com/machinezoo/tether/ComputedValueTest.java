// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import com.machinezoo.tether.loop.*;

public class ComputedValueTest {
	static final StateKey<Double> VOLUME = StateKey.of("volume");
	static final StateKey<Boolean> MUTED = StateKey.of("muted");
	static final StateKey<String> TITLE = StateKey.of("title");
	ManualEventLoop loop = new ManualEventLoop();
	ReactiveState state = new ReactiveState(loop, StateSnapshot.builder()
		.put(VOLUME, 1.0)
		.put(MUTED, false)
		.put(TITLE, "intro")
		.build());
	@Test
	public void derive() {
		try (ComputedValue<Double> effective = new ComputedValue<>(state, List.of(VOLUME, MUTED), s -> s.get(MUTED) ? 0.0 : s.get(VOLUME))) {
			assertEquals(1.0, effective.get());
			AtomicInteger changes = new AtomicInteger();
			effective.subscribe(changes::incrementAndGet);
			state.set(VOLUME, 0.5);
			loop.runUntilIdle();
			assertEquals(0.5, effective.get());
			assertEquals(1, changes.get());
			state.set(MUTED, true);
			loop.runUntilIdle();
			assertEquals(0.0, effective.get());
			assertEquals(2, changes.get());
			// Input changed but derived value did not.
			state.set(VOLUME, 0.3);
			loop.runUntilIdle();
			assertEquals(2, changes.get());
			// Unrelated keys do not trigger recomputation.
			state.set(TITLE, "outro");
			loop.runUntilIdle();
			assertEquals(2, changes.get());
		}
	}
	@Test
	public void selectedKeysOnly() {
		try (ComputedValue<Set<StateKey<?>>> keys = new ComputedValue<>(state, List.of(VOLUME), StateSnapshot::keys)) {
			assertEquals(Set.of(VOLUME), keys.get());
		}
	}
	@Test
	public void close() {
		ComputedValue<Double> volume = new ComputedValue<>(state, List.of(VOLUME), s -> s.get(VOLUME));
		AtomicInteger changes = new AtomicInteger();
		volume.subscribe(changes::incrementAndGet);
		volume.close();
		state.set(VOLUME, 0.1);
		loop.runUntilIdle();
		assertEquals(0, changes.get());
	}
}
