package com.postbox.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Minimal multicast notification primitive.
 * <p>
 * Values passed to {@link #emit(Object)} are delivered synchronously, on the emitting thread, to every
 * observer subscribed at that moment, in subscription order. Observers are trusted callbacks:
 * an exception thrown by one propagates to the emitter and the remaining observers are not called.
 *
 * @param <E> the type of emitted values
 */
public class EventStream<E> {

    private final List<Observer<E>> observers = new CopyOnWriteArrayList<>();

    /**
     * Subscribes an observer to future emissions.
     *
     * @param observer the callback invoked once per emitted value
     * @return a subscription that stops delivery when closed
     */
    public Subscription subscribe(Consumer<? super E> observer) {
        Objects.requireNonNull(observer, "observer cannot be null");
        Observer<E> entry = new Observer<>(observer);
        observers.add(entry);
        return () -> observers.remove(entry);
    }

    /**
     * Delivers a value to every current observer.
     *
     * @param value the value to deliver
     */
    public void emit(E value) {
        for (Observer<E> observer : observers) {
            observer.callback.accept(value);
        }
    }

    public int subscriberCount() {
        return observers.size();
    }

    // identity-compared so the same consumer can subscribe twice
    private static final class Observer<E> {
        private final Consumer<? super E> callback;

        private Observer(Consumer<? super E> callback) {
            this.callback = callback;
        }
    }
}
