// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;
import com.machinezoo.tether.loop.*;
import com.machinezoo.tether.utils.*;
import io.opentracing.*;
import io.opentracing.tag.*;
import io.opentracing.util.*;

/*
 * Store combines features over one target. It owns its reactive state and task queue. It never owns the target.
 * 
 * Every attachment has its own abort signal. Feature subscriptions are scoped to it,
 * so aborting it releases everything registered against the previous target before anything is registered against the next one.
 * Updates arriving through an aborted attachment are ignored.
 * 
 * Errors never escape through lifecycle methods. They are routed to the error hook or logged.
 * Request futures fail independently of that, so callers can handle failures locally too.
 */
/**
 * Binds a target to observable state and cancellable requests defined by a list of {@link Feature}s.
 * 
 * @param <T>
 *            type of the target
 * 
 * @see StoreConfig
 * @see Feature
 */
@DraftDocs("lifecycle, error routing, example")
public class Store<T> {
	private static final Logger logger = LoggerFactory.getLogger(Store.class);
	private final List<Feature<T>> features;
	public List<Feature<T>> features() {
		return features;
	}
	private final Map<String, RequestConfig<T, ?, ?>> requests;
	public Set<String> requests() {
		return requests.keySet();
	}
	private final StateSnapshot initial;
	public StateSnapshot initialState() {
		return initial;
	}
	private final EventLoop loop;
	public EventLoop loop() {
		return loop;
	}
	private final ReactiveState state;
	public ReactiveState reactive() {
		return state;
	}
	private final TaskQueue queue;
	public TaskQueue queue() {
		return queue;
	}
	private final Consumer<AttachContext<T>> onAttach;
	private final Consumer<ErrorContext<T>> onError;
	private final Logger errors;
	private final AbortController setup = new AbortController();
	private T target;
	private AbortController attachment;
	private boolean destroyed;
	/**
	 * Creates the store and runs the setup hook.
	 * Initial state is the union of initial states of all features. When several features declare the same request,
	 * the one listed last wins.
	 * 
	 * @param config
	 *            store configuration
	 */
	public Store(StoreConfig<T> config) {
		Objects.requireNonNull(config);
		features = Collections.unmodifiableList(new ArrayList<>(config.features()));
		StateSnapshot.Builder defaults = StateSnapshot.builder();
		Map<String, RequestConfig<T, ?, ?>> merged = new LinkedHashMap<>();
		for (Feature<T> feature : features) {
			defaults.putAll(feature.initialState());
			merged.putAll(feature.requests());
		}
		initial = defaults.build();
		requests = Collections.unmodifiableMap(merged);
		loop = config.loop() != null ? config.loop() : EventLoop.currentOrCommon();
		state = config.state() != null ? config.state().apply(initial) : new ReactiveState(loop, initial);
		queue = config.queue() != null ? config.queue().get() : new TaskQueue(loop);
		onAttach = config.onAttach();
		onError = config.onError();
		errors = config.logger() != null ? config.logger() : logger;
		OwnerTrace.of(this).generateId();
		OwnerTrace.of(state).parent(this);
		OwnerTrace.of(queue).parent(this);
		if (config.onSetup() != null) {
			try {
				config.onSetup().accept(new SetupContext<>(this, setup.signal()));
			} catch (Throwable ex) {
				report(ex, ErrorContext.Source.SETUP, null);
			}
		}
	}
	public StateSnapshot state() {
		return state.snapshot();
	}
	public <V> V get(StateKey<V> key) {
		return state.get(key);
	}
	public CloseableScope subscribe(Runnable listener) {
		return state.subscribe(listener);
	}
	public CloseableScope subscribe(Collection<? extends StateKey<?>> keys, Runnable listener) {
		return state.subscribe(keys, listener);
	}
	public synchronized Optional<T> target() {
		return Optional.ofNullable(target);
	}
	public synchronized boolean attached() {
		return target != null;
	}
	public synchronized boolean destroyed() {
		return destroyed;
	}
	public TaskStatus status(String name) {
		return queue.status(name);
	}
	/**
	 * Attaches the target, replacing any previous one.
	 * Subscriptions of the previous attachment are released first. State is then reset to defaults,
	 * features subscribe to the target, and their snapshots are merged into state, all in one notification round.
	 * Failures of individual features are reported and do not affect other features.
	 * 
	 * @param target
	 *            target to attach
	 * @return scope that detaches this attachment when closed, unless it was already replaced
	 * @throws StoreException
	 *             with {@link StoreError#DESTROYED} if the store was destroyed
	 */
	public CloseableScope attach(T target) {
		Objects.requireNonNull(target);
		AbortController current = new AbortController();
		AbortController previous;
		synchronized (this) {
			if (destroyed)
				throw new StoreException(StoreError.DESTROYED, "Cannot attach destroyed store.");
			previous = attachment;
			attachment = current;
			this.target = target;
		}
		if (previous != null)
			previous.abort();
		AbortSignal signal = current.signal();
		state.batch(() -> {
			state.replace(initial);
			for (Feature<T> feature : features) {
				try {
					feature.subscribe(target, () -> loop.dispatch(() -> refresh(feature, target, signal)), signal);
				} catch (Throwable ex) {
					report(ex, ErrorContext.Source.SUBSCRIBE, feature.name());
				}
			}
			for (Feature<T> feature : features)
				refresh(feature, target, signal);
		});
		if (onAttach != null && !signal.aborted()) {
			try {
				onAttach.accept(new AttachContext<>(this, target, signal));
			} catch (Throwable ex) {
				report(ex, ErrorContext.Source.ATTACH, null);
			}
		}
		return () -> detach(current);
	}
	private void refresh(Feature<T> feature, T target, AbortSignal signal) {
		if (signal.aborted())
			return;
		StateSnapshot fragment;
		try {
			fragment = feature.snapshot(target);
		} catch (Throwable ex) {
			report(ex, ErrorContext.Source.SNAPSHOT, feature.name());
			return;
		}
		state.patch(fragment);
	}
	/**
	 * Releases the target: aborts feature subscriptions, aborts all tasks, and resets state to defaults.
	 * Does nothing if no target is attached.
	 */
	public void detach() {
		detach(null);
	}
	private void detach(AbortController expected) {
		AbortController current;
		synchronized (this) {
			if (attachment == null || expected != null && attachment != expected)
				return;
			current = attachment;
			attachment = null;
			target = null;
		}
		current.abort();
		queue.abortAll();
		state.replace(initial);
	}
	/**
	 * Detaches, aborts the setup signal, and destroys the queue. Later attach attempts throw and later requests fail.
	 * Calling it again does nothing.
	 */
	public void destroy() {
		synchronized (this) {
			if (destroyed)
				return;
			destroyed = true;
		}
		detach();
		setup.abort();
		queue.destroy();
	}
	public <I, O> CompletableFuture<O> request(Request<I, O> request, I input) {
		return request(request, input, null);
	}
	public <I, O> CompletableFuture<O> request(Request<I, O> request, I input, RequestMeta meta) {
		Objects.requireNonNull(request);
		return submit(request.name(), input, meta);
	}
	public CompletableFuture<Object> request(String name, Object input) {
		return request(name, input, null);
	}
	/**
	 * Issues request by name. Key, cancel list, and guards are resolved from the request's configuration.
	 * 
	 * @param name
	 *            request name
	 * @param input
	 *            request input, possibly {@code null}
	 * @param meta
	 *            provenance of the request, possibly {@code null}
	 * @return future completing with handler's output
	 * @throws IllegalArgumentException
	 *             if no feature declares the request
	 */
	public CompletableFuture<Object> request(String name, Object input, RequestMeta meta) {
		Objects.requireNonNull(name);
		return submit(name, input, meta);
	}
	@SuppressWarnings("unchecked")
	private <I, O> CompletableFuture<O> submit(String name, I input, RequestMeta meta) {
		RequestConfig<T, I, O> config = (RequestConfig<T, I, O>)requests.get(name);
		if (config == null)
			throw new IllegalArgumentException("Unknown request: " + name);
		StoreException refusal = null;
		synchronized (this) {
			if (destroyed)
				refusal = new StoreException(StoreError.DESTROYED, "Store was destroyed.");
			else if (target == null)
				refusal = new StoreException(StoreError.NO_TARGET, "No target is attached.");
		}
		if (refusal != null) {
			report(refusal, ErrorContext.Source.REQUEST, name);
			return CompletableFuture.failedFuture(refusal);
		}
		String key = config.resolveKey(name, input);
		if (config.cancelAll())
			queue.abortAll();
		else {
			for (String cancelled : config.cancelKeys(input))
				queue.abort(cancelled);
		}
		TaskRequest<I, O> task = new TaskRequest<I, O>(name, context -> config.handler().handle(context.input(), new RequestContext<>(running(name), context.signal(), meta, state)))
			.key(key)
			.input(input)
			.meta(meta)
			.mode(config.mode())
			.schedule(config.schedule().orElse(null));
		for (Guard<T> guard : config.guards())
			task.guard(signal -> guard.check(new GuardContext<>(running(name), signal)));
		Span span = OwnerTrace.of(this).fill(GlobalTracer.get().buildSpan("tether.request")
			.withTag("request", name)
			.withTag("key", key)
			.start());
		CompletableFuture<O> future = queue.enqueue(task);
		future.whenComplete((output, exception) -> {
			if (exception != null) {
				Tags.ERROR.set(span, true);
				report(exception, ErrorContext.Source.REQUEST, name);
			}
			span.finish();
		});
		return future;
	}
	/*
	 * Tasks may start long after they were requested. They always run against the target attached at that moment.
	 */
	private synchronized T running(String name) {
		if (target == null)
			throw new StoreException(StoreError.NO_TARGET, "No target is attached for request " + name + ".");
		return target;
	}
	/*
	 * Cancellations are routine (every supersession produces one), so they are logged at debug level only.
	 */
	private void report(Throwable exception, ErrorContext.Source source, String origin) {
		Throwable error = StoreError.unwrap(exception);
		if (onError != null) {
			try {
				onError.accept(new ErrorContext<>(this, error, source, origin));
			} catch (Throwable ex) {
				ExceptionLogging.log(errors).handle(ex);
			}
		} else if (StoreError.cancellation(error))
			errors.debug("{} {} was cancelled: {}", source, origin, error.getMessage());
		else
			ExceptionLogging.log(errors).handle(error);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
