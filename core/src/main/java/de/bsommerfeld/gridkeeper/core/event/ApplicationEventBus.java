package de.bsommerfeld.gridkeeper.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's EventBus. Background workers (checkpoint timer,
 * startup migrations) report their results here instead of sharing mutable
 * state with the threads that consume them. A failing listener is logged and
 * does not affect the poster.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus((exception, context) -> LOG.error("Listener {} failed on {}",
                context.getSubscriberMethod().getName(), context.getEvent().getClass().getSimpleName(), exception));
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
