package com.parley.core.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process channel carrying {@link OutboundAction}s from the router to their handlers.
 * Every subscriber sees every action; a failing subscriber does not affect the others.
 */
public class ActionChannel {

    private static final Logger log = LoggerFactory.getLogger(ActionChannel.class);

    private final CopyOnWriteArrayList<Consumer<OutboundAction>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(OutboundAction action) {
        log.debug("Action {} for {}", action.getClass().getSimpleName(), action.conversationKey());
        for (Consumer<OutboundAction> subscriber : subscribers) {
            deliverSafely(subscriber, action);
        }
    }

    public Subscription subscribe(Consumer<OutboundAction> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    private void deliverSafely(Consumer<OutboundAction> subscriber, OutboundAction action) {
        try {
            subscriber.accept(action);
        } catch (Exception e) {
            log.error("Action handler failed for {}: {}", action.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
