package io.casetime.engine;

import io.casetime.core.*;
import io.casetime.store.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the temporal engine. Components are handed in at construction time;
 * {@link #create} wires the default set over a fact store and an entity resolver.
 */
public class TimelineService {
    private static final Logger log = LoggerFactory.getLogger(TimelineService.class);

    private final TemporalStore store;
    private final RelationGraph graph;
    private final InferenceEngine inference;
    private final Segmenter segmenter;
    private final Narrator narrator;

    public TimelineService(TemporalStore store, RelationGraph graph, InferenceEngine inference,
                           Segmenter segmenter, Narrator narrator) {
        this.store = Objects.requireNonNull(store);
        this.graph = Objects.requireNonNull(graph);
        this.inference = Objects.requireNonNull(inference);
        this.segmenter = Objects.requireNonNull(segmenter);
        this.narrator = Objects.requireNonNull(narrator);
    }

    public static TimelineService create(FactStore facts, EntityResolver resolver, EngineSettings settings) {
        var store = new TemporalStore(facts, resolver);
        return new TimelineService(
                store,
                new RelationGraph(store),
                new InferenceEngine(store, settings.inferenceConfidence()),
                new Segmenter(store, resolver, settings.gapThreshold(), settings.batchSize()),
                new Narrator(store, resolver));
    }

    /* ---------- facts ---------- */

    public FactId upsertFact(OwnerRef owner, String scopeId, RegionType region, Instant start, Instant end,
                             Granularity granularity, double confidence) {
        return store.upsertFact(owner, scopeId, region, start, end, granularity, confidence);
    }

    /** An event is an instant, or an interval when a positive duration is given. */
    public TemporalFact enhanceEvent(String scopeId, String eventId, Instant time,
                                     Integer durationMinutes, Granularity granularity) {
        return enhance(OwnerRef.event(eventId), scopeId, time, durationMinutes, granularity);
    }

    /** Like {@link #enhanceEvent}; decisions are always instants. */
    public TemporalFact enhanceAction(String scopeId, String actionId, Instant time,
                                      Integer durationMinutes, boolean decision, Granularity granularity) {
        var owner = decision ? OwnerRef.decision(actionId) : OwnerRef.action(actionId);
        return enhance(owner, scopeId, time, decision ? null : durationMinutes, granularity);
    }

    private TemporalFact enhance(OwnerRef owner, String scopeId, Instant time,
                                 Integer durationMinutes, Granularity granularity) {
        Objects.requireNonNull(time, "time");
        var g = granularity == null ? Granularity.MINUTES : granularity;
        FactId id;
        if (durationMinutes != null && durationMinutes > 0) {
            id = store.upsertFact(owner, scopeId, RegionType.INTERVAL, time,
                    time.plus(Duration.ofMinutes(durationMinutes)), g);
        } else {
            id = store.upsertFact(owner, scopeId, RegionType.INSTANT, time, null, g);
        }
        return store.get(id);
    }

    public TemporalFact findFact(FactId id) {
        return store.get(id);
    }

    public List<TemporalFact> findInTimeframe(String scopeId, Instant start, Instant end, EntityKind kind) {
        return store.findInTimeframe(scopeId, start, end, kind);
    }

    public List<TemporalFact> findSequence(String scopeId, EntityKind kind, Integer limit) {
        return store.findSequence(scopeId, kind, limit);
    }

    public int deleteScope(String scopeId) {
        int n = store.deleteScope(scopeId);
        log.info("Deleted scope {} ({} fact(s))", scopeId, n);
        return n;
    }

    /* ---------- relations ---------- */

    public TemporalFact createRelation(FactId from, FactId to, String relationType) {
        return graph.createRelation(from, to, relationType);
    }

    public List<TemporalFact> findRelated(FactId factId, String relationType) {
        return graph.findRelated(factId, relationType);
    }

    public List<TemporalFact> inferRelations(String scopeId) {
        return inference.inferRelations(scopeId);
    }

    public Map<FactId, Integer> recomputeTimelineOrder(String scopeId) {
        return inference.recomputeTimelineOrder(scopeId);
    }

    /* ---------- presentation ---------- */

    public Map<String, List<TemporalFact>> group(String scopeId, SegmentStrategy strategy, Duration gapThreshold) {
        return segmenter.group(scopeId, strategy, gapThreshold);
    }

    public Timeline buildTimeline(String scopeId) {
        return narrator.buildTimeline(scopeId);
    }

    public String getContext(String scopeId, boolean includeConfidence, boolean includeCausal) {
        return narrator.getContext(scopeId, includeConfidence, includeCausal);
    }
}
