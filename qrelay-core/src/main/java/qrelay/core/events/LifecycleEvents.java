package qrelay.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class LifecycleEvents {
    private static final Logger logger = LoggerFactory.getLogger(LifecycleEvents.class);

    private LifecycleEvents() {
    }

    public static void fire(LifecycleListener listener, List<LifecycleEvent> events) {
        for (LifecycleEvent event : events) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Lifecycle listener failed on {} for message {}: {}", event.type(), event.messageId(), e.getMessage(), e);
            }
        }
    }
}
