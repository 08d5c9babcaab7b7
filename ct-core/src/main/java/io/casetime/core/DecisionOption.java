package io.casetime.core;

import java.util.Objects;

public record DecisionOption(String label, String description) {
    public DecisionOption {
        Objects.requireNonNull(label);
    }
}
