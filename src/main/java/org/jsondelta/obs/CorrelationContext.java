package org.jsondelta.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Correlation metadata emitted with every structured log event of one comparison.
 */
public final class CorrelationContext {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String comparisonId;
    private final String operation;
    private final String leftSource;
    private final String rightSource;

    private CorrelationContext(Builder builder) {
        this.comparisonId = requireText(builder.comparisonId, "comparisonId");
        this.operation = requireText(builder.operation, "operation");
        this.leftSource = normalize(builder.leftSource);
        this.rightSource = normalize(builder.rightSource);
    }

    public static CorrelationContext of(String comparisonId, String operation) {
        return builder(comparisonId, operation).build();
    }

    /**
     * Context with a process-unique id such as {@code cmp-42}.
     */
    public static CorrelationContext next(String operation) {
        return of("cmp-" + SEQUENCE.incrementAndGet(), operation);
    }

    public static Builder builder(String comparisonId, String operation) {
        return new Builder(comparisonId, operation);
    }

    public String comparisonId() {
        return comparisonId;
    }

    public String operation() {
        return operation;
    }

    public Optional<String> leftSource() {
        return Optional.ofNullable(leftSource);
    }

    public Optional<String> rightSource() {
        return Optional.ofNullable(rightSource);
    }

    public CorrelationContext withSources(String left, String right) {
        return builder(comparisonId, operation).leftSource(left).rightSource(right).build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("comparisonId", comparisonId);
        fields.put("operation", operation);
        if (leftSource != null) {
            fields.put("leftSource", leftSource);
        }
        if (rightSource != null) {
            fields.put("rightSource", rightSource);
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
        private final String comparisonId;
        private final String operation;
        private String leftSource;
        private String rightSource;

        private Builder(String comparisonId, String operation) {
            this.comparisonId = Objects.requireNonNull(comparisonId, "comparisonId");
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder leftSource(String leftSource) {
            this.leftSource = leftSource;
            return this;
        }

        public Builder rightSource(String rightSource) {
            this.rightSource = rightSource;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
