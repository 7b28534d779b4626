// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import com.machinezoo.tether.loop.*;
import com.machinezoo.tether.utils.*;

/*
 * Writes are applied immediately, so reads are never stale. Notifications are deferred to a microtask
 * or to the end of the outermost batch, which coalesces any number of writes into one notification round.
 * 
 * Change detection is net: for every key written since the last flush we remember the value it had at that flush.
 * The key is reported only if the current value differs from the remembered one.
 * Writing a value and then writing the original value back therefore produces no notification.
 * 
 * Nested containers keep a back-reference to the container holding them. All containers in a tree
 * flush together from the root, children first. A child with net changes marks the parent's key as changed
 * even though the parent still holds the same child reference.
 */
/**
 * Observable key-value container with batched change notification.
 * 
 * @see StateKey
 * @see StateSnapshot
 * @see ComputedValue
 */
@DraftDocs("nested state, flush timing")
public class ReactiveState {
	private static final Object absent = new Object();
	private final EventLoop loop;
	public EventLoop loop() {
		return loop;
	}
	private final LinkedHashMap<StateKey<?>, Object> values = new LinkedHashMap<>();
	/*
	 * Value of every dirty key as of the last flush. Missing keys are represented by the absent marker.
	 */
	private final Map<StateKey<?>, Object> baseline = new HashMap<>();
	/*
	 * Keys holding children that reported changes.
	 */
	private final Set<StateKey<?>> forced = new HashSet<>();
	private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
	private int depth;
	private boolean scheduled;
	private ReactiveState parent;
	private StateKey<?> parentKey;
	public ReactiveState(EventLoop loop, StateSnapshot initial) {
		Objects.requireNonNull(loop);
		Objects.requireNonNull(initial);
		this.loop = loop;
		for (Map.Entry<StateKey<?>, Object> entry : initial.toMap().entrySet()) {
			if (entry.getValue() instanceof ReactiveState)
				((ReactiveState)entry.getValue()).adopt(this, entry.getKey());
			values.put(entry.getKey(), entry.getValue());
		}
		OwnerTrace.of(this).generateId();
	}
	public ReactiveState(StateSnapshot initial) {
		this(EventLoop.currentOrCommon(), initial);
	}
	public ReactiveState() {
		this(StateSnapshot.empty());
	}
	private volatile boolean equality = true;
	public boolean equality() {
		return equality;
	}
	/**
	 * Chooses between full equality via {@link Object#equals(Object)} (the default) and reference equality.
	 * 
	 * @param equality
	 *            {@code true} for full equality, {@code false} for reference equality
	 * @return {@code this} (fluent method)
	 */
	public ReactiveState equality(boolean equality) {
		this.equality = equality;
		return this;
	}
	private boolean same(Object left, Object right) {
		if (left == right)
			return true;
		if (left == absent || right == absent)
			return false;
		return equality && Objects.equals(left, right);
	}
	public synchronized <T> T get(StateKey<T> key) {
		return key.cast(values.get(key));
	}
	public synchronized boolean contains(StateKey<?> key) {
		return values.containsKey(key);
	}
	public synchronized Set<StateKey<?>> keys() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(values.keySet()));
	}
	/**
	 * Returns shallow copy of current contents. Nested containers are included by reference.
	 * 
	 * @return immutable copy of current state
	 */
	public synchronized StateSnapshot snapshot() {
		return StateSnapshot.copyOf(values);
	}
	public <T> ReactiveState set(StateKey<T> key, T value) {
		Objects.requireNonNull(key);
		write(key, value);
		return this;
	}
	public ReactiveState remove(StateKey<?> key) {
		Objects.requireNonNull(key);
		write(key, absent);
		return this;
	}
	/**
	 * Merges all entries of the snapshot into this state. Keys not present in the snapshot are left alone.
	 * 
	 * @param partial
	 *            entries to write
	 * @return {@code this} (fluent method)
	 */
	public ReactiveState patch(StateSnapshot partial) {
		Objects.requireNonNull(partial);
		for (Map.Entry<StateKey<?>, Object> entry : partial.toMap().entrySet())
			write(entry.getKey(), entry.getValue());
		return this;
	}
	/**
	 * Makes contents equal to the snapshot, removing keys the snapshot does not have.
	 * 
	 * @param contents
	 *            new contents of this state
	 * @return {@code this} (fluent method)
	 */
	public ReactiveState replace(StateSnapshot contents) {
		Objects.requireNonNull(contents);
		for (StateKey<?> key : keys())
			if (!contents.contains(key))
				write(key, absent);
		return patch(contents);
	}
	private void write(StateKey<?> key, Object value) {
		if (value instanceof ReactiveState)
			((ReactiveState)value).adopt(this, key);
		ReactiveState released = null;
		synchronized (this) {
			Object previous = values.containsKey(key) ? values.get(key) : absent;
			if (previous == value)
				return;
			if (!baseline.containsKey(key))
				baseline.put(key, previous);
			if (value == absent)
				values.remove(key);
			else
				values.put(key, value);
			if (previous instanceof ReactiveState)
				released = (ReactiveState)previous;
		}
		if (released != null)
			released.release(this, key);
		requestFlush();
	}
	private void adopt(ReactiveState owner, StateKey<?> key) {
		for (ReactiveState ancestor = owner; ancestor != null; ancestor = ancestor.parent())
			if (ancestor == this)
				throw new IllegalArgumentException("Reactive state cannot contain itself.");
		synchronized (this) {
			if (parent == null) {
				parent = owner;
				parentKey = key;
				OwnerTrace.of(this).parent(owner).tag("key", key.name());
			} else if (parent != owner || !parentKey.equals(key))
				throw new IllegalStateException("Reactive state is already nested in another container.");
		}
	}
	/*
	 * Released child becomes its own root. Writes it made since the last flush of the old tree are flushed on its own.
	 */
	private void release(ReactiveState owner, StateKey<?> key) {
		boolean dirty;
		synchronized (this) {
			if (parent != owner || !parentKey.equals(key))
				return;
			parent = null;
			parentKey = null;
			dirty = !baseline.isEmpty() || !forced.isEmpty();
		}
		if (dirty)
			requestFlush();
	}
	private synchronized ReactiveState parent() {
		return parent;
	}
	private ReactiveState root() {
		ReactiveState current = this;
		while (true) {
			ReactiveState up = current.parent();
			if (up == null)
				return current;
			current = up;
		}
	}
	private void requestFlush() {
		ReactiveState root = root();
		synchronized (root) {
			if (root.depth > 0 || root.scheduled)
				return;
			root.scheduled = true;
		}
		root.loop.microtask(root::scheduledFlush);
	}
	private void scheduledFlush() {
		synchronized (this) {
			scheduled = false;
		}
		flush();
	}
	/**
	 * Delivers pending notifications synchronously. Listener exceptions propagate to the caller.
	 * Flushing a nested container flushes the whole tree it belongs to.
	 */
	public void flush() {
		ReactiveState root = root();
		if (root != this)
			root.flush();
		else
			flushTree();
	}
	private void flushTree() {
		List<ReactiveState> children = new ArrayList<>();
		synchronized (this) {
			for (Object value : values.values())
				if (value instanceof ReactiveState)
					children.add((ReactiveState)value);
		}
		for (ReactiveState child : children)
			child.flushTree();
		Set<StateKey<?>> changed = new LinkedHashSet<>();
		ReactiveState up;
		StateKey<?> upKey;
		synchronized (this) {
			for (Map.Entry<StateKey<?>, Object> entry : baseline.entrySet()) {
				Object current = values.containsKey(entry.getKey()) ? values.get(entry.getKey()) : absent;
				if (!same(entry.getValue(), current))
					changed.add(entry.getKey());
			}
			changed.addAll(forced);
			baseline.clear();
			forced.clear();
			up = parent;
			upKey = parentKey;
		}
		if (changed.isEmpty())
			return;
		if (up != null)
			up.childChanged(upKey);
		Set<StateKey<?>> delivered = Collections.unmodifiableSet(changed);
		for (Subscription subscription : subscriptions)
			if (subscription.active && subscription.matches(delivered))
				subscription.listener.run();
	}
	private synchronized void childChanged(StateKey<?> key) {
		forced.add(key);
	}
	public <R> R batch(Supplier<R> section) {
		Objects.requireNonNull(section);
		ReactiveState root = root();
		synchronized (root) {
			++root.depth;
		}
		try {
			return section.get();
		} finally {
			boolean outermost;
			synchronized (root) {
				outermost = --root.depth == 0;
			}
			if (outermost)
				root.flush();
		}
	}
	/**
	 * Runs the section with notifications suspended. When the outermost batch completes,
	 * all changes are delivered synchronously as a single round.
	 * 
	 * @param section
	 *            code performing the writes
	 */
	public void batch(Runnable section) {
		Objects.requireNonNull(section);
		batch(() -> {
			section.run();
			return null;
		});
	}
	private static class Subscription {
		final Set<StateKey<?>> keys;
		final Runnable listener;
		volatile boolean active = true;
		Subscription(Set<StateKey<?>> keys, Runnable listener) {
			this.keys = keys;
			this.listener = listener;
		}
		boolean matches(Set<StateKey<?>> changed) {
			if (keys == null)
				return true;
			for (StateKey<?> key : keys)
				if (changed.contains(key))
					return true;
			return false;
		}
	}
	private CloseableScope register(Subscription subscription) {
		subscriptions.add(subscription);
		return () -> {
			subscription.active = false;
			subscriptions.remove(subscription);
		};
	}
	/**
	 * Registers listener that runs once per notification round with any change.
	 * 
	 * @param listener
	 *            callback to run
	 * @return scope that unsubscribes when closed
	 */
	public CloseableScope subscribe(Runnable listener) {
		Objects.requireNonNull(listener);
		return register(new Subscription(null, listener));
	}
	/**
	 * Registers listener that runs once per notification round in which at least one of the keys changed.
	 * 
	 * @param keys
	 *            keys to watch
	 * @param listener
	 *            callback to run
	 * @return scope that unsubscribes when closed
	 */
	public CloseableScope subscribe(Collection<? extends StateKey<?>> keys, Runnable listener) {
		Objects.requireNonNull(keys);
		Objects.requireNonNull(listener);
		return register(new Subscription(new HashSet<>(keys), listener));
	}
	public int subscriptions() {
		return subscriptions.size();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
