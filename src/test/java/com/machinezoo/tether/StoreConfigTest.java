// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import org.slf4j.*;
import com.machinezoo.tether.loop.*;

public class StoreConfigTest {
	Feature<MediaTarget> audio = MediaTarget.audio();
	Feature<MediaTarget> extra = Feature.<MediaTarget>builder("extra").build();
	@Test
	public void nullExtension() {
		StoreConfig<MediaTarget> base = new StoreConfig<MediaTarget>().feature(audio);
		assertSame(base, StoreConfig.extend(base, null));
	}
	@Test
	public void features() {
		StoreConfig<MediaTarget> base = new StoreConfig<MediaTarget>().feature(audio).feature(extra);
		StoreConfig<MediaTarget> extension = new StoreConfig<MediaTarget>().feature(audio);
		// Duplicates are removed, keeping the later occurrence.
		assertEquals(List.of(extra, audio), StoreConfig.extend(base, extension).features());
		// Equal-looking features are still distinct.
		Feature<MediaTarget> another = MediaTarget.audio();
		assertEquals(List.of(audio, extra, another), StoreConfig.extend(base, new StoreConfig<MediaTarget>().feature(another)).features());
	}
	@Test
	public void hooks() {
		List<String> log = new ArrayList<>();
		StoreConfig<MediaTarget> base = new StoreConfig<MediaTarget>()
			.onSetup(c -> log.add("base setup"))
			.onError(c -> log.add("base error"));
		StoreConfig<MediaTarget> extension = new StoreConfig<MediaTarget>()
			.onSetup(c -> log.add("extension setup"))
			.onAttach(c -> log.add("extension attach"));
		StoreConfig<MediaTarget> merged = StoreConfig.extend(base, extension);
		// Hook present on one side only is taken as is.
		assertSame(extension.onAttach(), merged.onAttach());
		assertSame(base.onError(), merged.onError());
		merged.onSetup().accept(null);
		assertEquals(List.of("base setup", "extension setup"), log);
		assertNull(StoreConfig.extend(new StoreConfig<MediaTarget>(), new StoreConfig<MediaTarget>()).onSetup());
	}
	@Test
	public void overrides() {
		ManualEventLoop first = new ManualEventLoop();
		ManualEventLoop second = new ManualEventLoop();
		Logger logger = LoggerFactory.getLogger(StoreConfigTest.class);
		StoreConfig<MediaTarget> base = new StoreConfig<MediaTarget>().loop(first).logger(logger);
		StoreConfig<MediaTarget> merged = StoreConfig.extend(base, new StoreConfig<MediaTarget>().loop(second));
		assertSame(second, merged.loop());
		assertSame(logger, merged.logger());
	}
	@Test
	public void customQueueAndState() {
		ManualEventLoop loop = new ManualEventLoop();
		TaskQueue queue = new TaskQueue(loop);
		List<StateSnapshot> initials = new ArrayList<>();
		Store<MediaTarget> store = new Store<>(new StoreConfig<MediaTarget>()
			.loop(loop)
			.feature(audio)
			.queue(() -> queue)
			.state(initial -> {
				initials.add(initial);
				return new ReactiveState(loop, initial);
			}));
		assertSame(queue, store.queue());
		assertSame(loop, store.reactive().loop());
		assertEquals(List.of(store.initialState()), initials);
	}
}
