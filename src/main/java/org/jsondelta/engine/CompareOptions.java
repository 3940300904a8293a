package org.jsondelta.engine;

import java.util.Objects;

public record CompareOptions(DetectorSettings detector, OneSidedMode oneSidedMode, KeyScope keyScope) {
    private static final CompareOptions DEFAULTS =
        new CompareOptions(DetectorSettings.defaults(), OneSidedMode.WHOLE_VALUE, KeyScope.LOCATION);

    public CompareOptions {
        Objects.requireNonNull(detector, "detector");
        Objects.requireNonNull(oneSidedMode, "oneSidedMode");
        Objects.requireNonNull(keyScope, "keyScope");
    }

    public static CompareOptions defaults() {
        return DEFAULTS;
    }

    public CompareOptions withDetector(DetectorSettings value) {
        return new CompareOptions(value, oneSidedMode, keyScope);
    }

    public CompareOptions withOneSidedMode(OneSidedMode value) {
        return new CompareOptions(detector, value, keyScope);
    }

    public CompareOptions withKeyScope(KeyScope value) {
        return new CompareOptions(detector, oneSidedMode, value);
    }
}
