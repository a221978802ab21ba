package qrelay.core.model;

import java.util.Map;

/**
 * Parameters of a single send. Only the body is required.
 */
public record SendRequest(String body, Map<String, String> attributes, Integer priority, Integer delaySeconds,
                          String dedupId, String groupId) {

    public SendRequest {
        attributes = attributes == null ? Map.of() : attributes;
    }

    public static SendRequest of(String body) {
        return new Builder().Body(body).build();
    }

    public static SendRequest of(String body, Map<String, String> attributes) {
        return new Builder().Body(body).Attributes(attributes).build();
    }

    public static class Builder {
        private String body;
        private Map<String, String> attributes;
        private Integer priority;
        private Integer delaySeconds;
        private String dedupId;
        private String groupId;

        public Builder Body(String body) {
            this.body = body;
            return this;
        }

        public Builder Attributes(Map<String, String> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder Priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder DelaySeconds(Integer delaySeconds) {
            this.delaySeconds = delaySeconds;
            return this;
        }

        public Builder DedupId(String dedupId) {
            this.dedupId = dedupId;
            return this;
        }

        public Builder GroupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public SendRequest build() {
            return new SendRequest(body, attributes, priority, delaySeconds, dedupId, groupId);
        }
    }
}
