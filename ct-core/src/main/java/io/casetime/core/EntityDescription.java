package io.casetime.core;

import java.util.List;
import java.util.Objects;

/**
 * Human-readable view of an owning entity as supplied by an {@link EntityResolver}.
 * Options, selected option and ethical principles are only populated for decisions.
 */
public record EntityDescription(
        String description,
        String actorId,
        List<DecisionOption> options,
        String selectedOption,
        List<String> ethicalPrinciples
) {
    public EntityDescription {
        Objects.requireNonNull(description);
        options = options == null ? List.of() : List.copyOf(options);
        ethicalPrinciples = ethicalPrinciples == null ? List.of() : List.copyOf(ethicalPrinciples);
    }

    public static EntityDescription of(String description, String actorId) {
        return new EntityDescription(description, actorId, List.of(), null, List.of());
    }

    public boolean isSelected(DecisionOption option) {
        return selectedOption != null && selectedOption.equals(option.label());
    }
}
