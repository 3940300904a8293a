package org.jsondelta.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tuning of identity-key detection.
 *
 * @param minArraySize arrays smaller than this on both sides are compared by index
 * @param minOverlapRatio share of key values found on both sides, relative to the smaller side,
 *     needed for a key to qualify when neither side is empty
 * @param preferredKeys field names tried first, in this order
 * @param maxCompositeSize largest number of fields combined into one key
 * @param compositeCandidateLimit only the first this-many candidate fields take part in composites
 */
public record DetectorSettings(
    int minArraySize,
    double minOverlapRatio,
    List<String> preferredKeys,
    int maxCompositeSize,
    int compositeCandidateLimit
) {
    private static final DetectorSettings DEFAULTS = new DetectorSettings(2, 0.5, List.of(), 3, 8);

    public DetectorSettings {
        if (minArraySize < 1) {
            throw new IllegalArgumentException("minArraySize must be at least 1");
        }
        if (Double.isNaN(minOverlapRatio) || minOverlapRatio < 0.0 || minOverlapRatio > 1.0) {
            throw new IllegalArgumentException("minOverlapRatio must be within [0, 1]");
        }
        preferredKeys = List.copyOf(Objects.requireNonNull(preferredKeys, "preferredKeys"));
        if (maxCompositeSize < 1) {
            throw new IllegalArgumentException("maxCompositeSize must be at least 1");
        }
        if (compositeCandidateLimit < maxCompositeSize) {
            throw new IllegalArgumentException("compositeCandidateLimit must not be below maxCompositeSize");
        }
    }

    public static DetectorSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder(DEFAULTS);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private int minArraySize;
        private double minOverlapRatio;
        private final List<String> preferredKeys = new ArrayList<>();
        private int maxCompositeSize;
        private int compositeCandidateLimit;

        private Builder(DetectorSettings base) {
            this.minArraySize = base.minArraySize;
            this.minOverlapRatio = base.minOverlapRatio;
            this.preferredKeys.addAll(base.preferredKeys);
            this.maxCompositeSize = base.maxCompositeSize;
            this.compositeCandidateLimit = base.compositeCandidateLimit;
        }

        public Builder minArraySize(int value) {
            this.minArraySize = value;
            return this;
        }

        public Builder minOverlapRatio(double value) {
            this.minOverlapRatio = value;
            return this;
        }

        public Builder preferredKeys(List<String> keys) {
            this.preferredKeys.clear();
            this.preferredKeys.addAll(Objects.requireNonNull(keys, "keys"));
            return this;
        }

        public Builder maxCompositeSize(int value) {
            this.maxCompositeSize = value;
            return this;
        }

        public Builder compositeCandidateLimit(int value) {
            this.compositeCandidateLimit = value;
            return this;
        }

        public DetectorSettings build() {
            return new DetectorSettings(
                minArraySize, minOverlapRatio, preferredKeys, maxCompositeSize, compositeCandidateLimit);
        }
    }
}
