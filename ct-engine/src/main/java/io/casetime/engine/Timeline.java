package io.casetime.engine;

import java.util.List;

public record Timeline(
        String scopeId,
        List<TimelineEntry> events,
        List<TimelineEntry> actions,
        List<TimelineEntry> decisions
) {}
