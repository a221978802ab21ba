package qrelay.core.events;

/**
 * Fire-and-forget sink for message state transitions (metrics, auditing).
 * Listeners are invoked after the queue lock is released. A listener that throws is
 * logged and otherwise ignored, it never affects the outcome of the operation.
 */
@FunctionalInterface
public interface LifecycleListener {

    void onEvent(LifecycleEvent event);
}
