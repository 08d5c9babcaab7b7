package io.casetime.engine;

import io.casetime.core.EntityDescription;
import io.casetime.core.EntityKind;
import io.casetime.core.EntityResolver;
import io.casetime.core.TemporalFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

/**
 * Partitions a scope's facts into named segments. Facts are walked in timeline order, so the
 * result is deterministic once the order has been recomputed; segment keys keep first-seen order.
 */
public class Segmenter {
    private static final Logger log = LoggerFactory.getLogger(Segmenter.class);

    static final String UNASSIGNED = "unassigned";

    private final TemporalStore store;
    private final EntityResolver resolver;
    private final Duration defaultGap;
    private final int batchSize;

    public Segmenter(TemporalStore store, EntityResolver resolver, Duration defaultGap, int batchSize) {
        this.store = Objects.requireNonNull(store);
        this.resolver = Objects.requireNonNull(resolver);
        this.defaultGap = Objects.requireNonNull(defaultGap);
        if (batchSize < 1) throw new IllegalArgumentException("batch size must be positive");
        this.batchSize = batchSize;
    }

    public Map<String, List<TemporalFact>> group(String scopeId, SegmentStrategy strategy) {
        return group(scopeId, strategy, defaultGap);
    }

    /** {@code gapThreshold} only applies to {@link SegmentStrategy#BY_GAP}. */
    public Map<String, List<TemporalFact>> group(String scopeId, SegmentStrategy strategy, Duration gapThreshold) {
        var facts = store.readTimeline(scopeId);

        return switch (strategy) {
            case BY_ACTOR -> byActor(facts);
            case BY_GAP -> byGap(facts, gapThreshold == null ? defaultGap : gapThreshold);
            case BY_KIND -> byKind(facts);
            case AUTO -> batches(facts);
        };
    }

    private Map<String, List<TemporalFact>> byActor(List<TemporalFact> facts) {
        var out = new LinkedHashMap<String, List<TemporalFact>>();
        for (var f : facts) {
            var actor = resolver.resolve(f.owner())
                    .map(EntityDescription::actorId)
                    .filter(a -> !a.isBlank())
                    .orElse(UNASSIGNED);
            out.computeIfAbsent(actor, k -> new ArrayList<>()).add(f);
        }
        return out;
    }

    private Map<String, List<TemporalFact>> byGap(List<TemporalFact> facts, Duration threshold) {
        var out = new LinkedHashMap<String, List<TemporalFact>>();
        List<TemporalFact> segment = null;
        TemporalFact previous = null;
        for (var f : facts) {
            if (previous == null || Duration.between(previous.start(), f.start()).compareTo(threshold) > 0) {
                segment = new ArrayList<>();
                out.put("segment-" + (out.size() + 1), segment);
            }
            segment.add(f);
            previous = f;
        }
        log.debug("Split {} fact(s) into {} segment(s) at gap {}", facts.size(), out.size(), threshold);
        return out;
    }

    private Map<String, List<TemporalFact>> byKind(List<TemporalFact> facts) {
        var out = new LinkedHashMap<String, List<TemporalFact>>();
        for (var k : EntityKind.values()) out.put(k.bucket(), new ArrayList<>());
        facts.forEach(f -> out.get(f.kind().bucket()).add(f));
        return out;
    }

    private Map<String, List<TemporalFact>> batches(List<TemporalFact> facts) {
        var out = new LinkedHashMap<String, List<TemporalFact>>();
        for (int i = 0; i < facts.size(); i += batchSize) {
            out.put("batch-" + (i / batchSize + 1),
                    new ArrayList<>(facts.subList(i, Math.min(i + batchSize, facts.size()))));
        }
        return out;
    }
}
