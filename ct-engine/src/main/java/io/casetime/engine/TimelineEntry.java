package io.casetime.engine;

import io.casetime.core.DecisionOption;
import io.casetime.core.FactId;

import java.time.Instant;
import java.util.List;

/** One fact of a timeline merged with its owner's description. */
public record TimelineEntry(
        FactId id,
        String entityId,
        Instant start,
        Instant end,
        String description,
        String actorId,
        String relationSummary,
        List<DecisionOption> options,
        String selectedOption,
        List<String> ethicalPrinciples
) {}
