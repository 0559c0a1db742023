package com.gpstracker.tracker.stream;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle for one registered {@link SubscriberSink}.
 *
 * <p>Carries the sink's bounded outbound queue, its lifecycle state and its liveness flag.
 * Messages are only delivered while the state is {@link State#OPEN}.
 */
public final class Subscription {

  /** Lifecycle of a subscriber connection. */
  public enum State {
    CONNECTING,
    OPEN,
    CLOSED
  }

  private final SubscriberSink sink;
  private final BlockingQueue<String> outbound;
  private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);
  private final AtomicBoolean draining = new AtomicBoolean();
  private volatile boolean alive = true;

  Subscription(SubscriberSink sink, int queueCapacity) {
    this.sink = sink;
    this.outbound = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
  }

  public SubscriberSink sink() {
    return sink;
  }

  public State state() {
    return state.get();
  }

  boolean isOpen() {
    return state.get() == State.OPEN;
  }

  boolean isClosed() {
    return state.get() == State.CLOSED;
  }

  void open() {
    state.compareAndSet(State.CONNECTING, State.OPEN);
  }

  /** Returns {@code true} only for the call that actually closed the subscription. */
  boolean markClosed() {
    State previous = state.getAndSet(State.CLOSED);
    if (previous == State.CLOSED) {
      return false;
    }
    outbound.clear();
    return true;
  }

  boolean offer(String payload) {
    return outbound.offer(payload);
  }

  String poll() {
    return outbound.poll();
  }

  boolean hasPending() {
    return !outbound.isEmpty();
  }

  boolean startDraining() {
    return draining.compareAndSet(false, true);
  }

  void stopDraining() {
    draining.set(false);
  }

  void markAlive() {
    alive = true;
  }

  /** Clears the liveness flag ahead of a new ping and returns its previous value. */
  boolean resetAlive() {
    boolean previous = alive;
    alive = false;
    return previous;
  }
}
