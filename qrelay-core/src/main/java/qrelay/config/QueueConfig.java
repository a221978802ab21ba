package qrelay.config;

import qrelay.core.exceptions.ValidationException;
import qrelay.core.model.DeliveryMode;

/**
 * Limits and delivery settings of a queue.
 *
 * @param maxSize maximum number of live (pending plus in-flight) messages
 * @param ttlSeconds lifetime of a message from the moment it is sent
 * @param visibilityTimeoutSeconds how long a delivered message stays hidden without an ack
 * @param maxRetries deliveries allowed after the first one before dead-lettering
 * @param deliveryMode delivery guarantee
 * @param delaySeconds delay applied to sends that do not specify one
 */
public record QueueConfig(int maxSize, int ttlSeconds, int visibilityTimeoutSeconds, int maxRetries,
                          DeliveryMode deliveryMode, int delaySeconds) {

    public static final int DEFAULT_MAX_SIZE = 10000;
    public static final int DEFAULT_TTL_SECONDS = 86400;
    public static final int DEFAULT_VISIBILITY_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_MAX_RETRIES = 3;

    public static QueueConfig defaults() {
        return new Builder().build();
    }

    public void validate() throws ValidationException {
        if (maxSize <= 0) {
            throw new ValidationException("max size must be positive: " + maxSize, "maxSize");
        }
        if (ttlSeconds <= 0) {
            throw new ValidationException("ttl must be positive: " + ttlSeconds, "ttlSeconds");
        }
        if (visibilityTimeoutSeconds <= 0) {
            throw new ValidationException("visibility timeout must be positive: " + visibilityTimeoutSeconds, "visibilityTimeoutSeconds");
        }
        if (maxRetries < 0) {
            throw new ValidationException("max retries must not be negative: " + maxRetries, "maxRetries");
        }
        if (delaySeconds < 0) {
            throw new ValidationException("delay must not be negative: " + delaySeconds, "delaySeconds");
        }
        if (deliveryMode == null) {
            throw new ValidationException("delivery mode is required", "deliveryMode");
        }
    }

    public static class Builder {
        private Integer maxSize;
        private Integer ttlSeconds;
        private Integer visibilityTimeoutSeconds;
        private Integer maxRetries;
        private DeliveryMode deliveryMode;
        private Integer delaySeconds;

        public Builder MaxSize(Integer maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder TtlSeconds(Integer ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        public Builder VisibilityTimeoutSeconds(Integer visibilityTimeoutSeconds) {
            this.visibilityTimeoutSeconds = visibilityTimeoutSeconds;
            return this;
        }

        public Builder MaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder DeliveryMode(DeliveryMode deliveryMode) {
            this.deliveryMode = deliveryMode;
            return this;
        }

        public Builder DelaySeconds(Integer delaySeconds) {
            this.delaySeconds = delaySeconds;
            return this;
        }

        public QueueConfig build() {
            return new QueueConfig(
                    maxSize != null ? maxSize : DEFAULT_MAX_SIZE,
                    ttlSeconds != null ? ttlSeconds : DEFAULT_TTL_SECONDS,
                    visibilityTimeoutSeconds != null ? visibilityTimeoutSeconds : DEFAULT_VISIBILITY_TIMEOUT_SECONDS,
                    maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES,
                    deliveryMode != null ? deliveryMode : qrelay.core.model.DeliveryMode.AT_LEAST_ONCE,
                    delaySeconds != null ? delaySeconds : 0);
        }
    }
}
