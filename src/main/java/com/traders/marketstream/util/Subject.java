package com.traders.marketstream.util;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

@Slf4j
public class Subject<T> {
    private final List<Consumer<T>> observers = new CopyOnWriteArrayList<>();

    /**
     * @return a handle that removes the observer again
     */
    public Runnable subscribe(Consumer<T> observer) {
        observers.add(observer);
        return () -> observers.remove(observer);
    }

    public void notifyObservers(T event) {
        observers.forEach(observer -> {
            try {
                observer.accept(event);
            } catch (RuntimeException e) {
                log.warn("Observer failed for {}: {}", event, e.getMessage(), e);
            }
        });
    }

    public int observerCount() {
        return observers.size();
    }
}
