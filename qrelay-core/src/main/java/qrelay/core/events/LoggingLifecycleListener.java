package qrelay.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingLifecycleListener implements LifecycleListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingLifecycleListener.class);

    @Override
    public void onEvent(LifecycleEvent event) {
        if (logger.isDebugEnabled()) {
            logger.debug("{} queue={} message={} deliveries={}{}", event.type(), event.queueId(), event.messageId(),
                    event.deliveryCount(), event.detail() != null ? " (" + event.detail() + ")" : "");
        }
    }
}
