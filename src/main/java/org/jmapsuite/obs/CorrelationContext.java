package org.jmapsuite.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event.
 */
public final class CorrelationContext {
    private final String requestId;
    private final String methodName;
    private final String callId;
    private final String accountId;

    private CorrelationContext(Builder builder) {
        this.requestId = requireText(builder.requestId, "requestId");
        this.methodName = requireText(builder.methodName, "methodName");
        this.callId = normalize(builder.callId);
        this.accountId = normalize(builder.accountId);
    }

    public static CorrelationContext of(String requestId, String methodName) {
        return builder(requestId, methodName).build();
    }

    public static Builder builder(String requestId, String methodName) {
        return new Builder(requestId, methodName);
    }

    public String requestId() {
        return requestId;
    }

    public String methodName() {
        return methodName;
    }

    public Optional<String> callId() {
        return Optional.ofNullable(callId);
    }

    public Optional<String> accountId() {
        return Optional.ofNullable(accountId);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("requestId", requestId);
        fields.put("methodName", methodName);
        if (callId != null) {
            fields.put("callId", callId);
        }
        if (accountId != null) {
            fields.put("accountId", accountId);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String requestId;
        private final String methodName;
        private String callId;
        private String accountId;

        private Builder(String requestId, String methodName) {
            this.requestId = Objects.requireNonNull(requestId, "requestId");
            this.methodName = Objects.requireNonNull(methodName, "methodName");
        }

        public Builder callId(String callId) {
            this.callId = callId;
            return this;
        }

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
