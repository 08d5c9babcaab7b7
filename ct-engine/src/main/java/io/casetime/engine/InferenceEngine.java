package io.casetime.engine;

import io.casetime.core.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Derives relations between chronologically adjacent facts and assigns the dense
 * timeline order. Both operations hold the scope lock for their whole run.
 *
 * <p>For an adjacent pair (A, B), A starting no later than B, the first matching rule wins:
 * <ol>
 *   <li>A ends no later than B starts, or A is an instant in an earlier bucket than B: {@code precedes}</li>
 *   <li>A and B intersect (touching does not count): {@code overlaps}</li>
 *   <li>A and B start in the same bucket: {@code coincidesWith}</li>
 * </ol>
 * Buckets use the coarser granularity of the pair.
 */
public class InferenceEngine {
    private static final Logger log = LoggerFactory.getLogger(InferenceEngine.class);

    private final TemporalStore store;
    private final ScopeLocks locks;
    private final double confidence;

    public InferenceEngine(TemporalStore store, double confidence) {
        this.store = Objects.requireNonNull(store);
        this.locks = store.locks();
        if (confidence < 0.0 || confidence >= 1.0) {
            throw new IllegalArgumentException("inferred confidence must be within [0,1): " + confidence);
        }
        this.confidence = confidence;
    }

    /**
     * Fills in relations for adjacent pairs whose earlier fact holds none. An existing edge
     * is never replaced: the inverse lands on B only while B holds no relation.
     *
     * @return the facts that received a new outgoing relation, in chronological order
     */
    public List<TemporalFact> inferRelations(String scopeId) {
        return locks.withLock(scopeId, () -> {
            var sequence = store.findSequence(scopeId, null, null);
            var current = new LinkedHashMap<FactId, TemporalFact>();
            sequence.forEach(f -> current.put(f.id(), f));

            record Pair(FactId a, FactId b, RelationType type) {}
            var pairs = new ArrayList<Pair>();
            for (int i = 0; i + 1 < sequence.size(); i++) {
                var a = sequence.get(i);
                var b = sequence.get(i + 1);
                if (a.hasRelation()) continue;
                classify(a, b).ifPresent(t -> pairs.add(new Pair(a.id(), b.id(), t)));
            }

            // latest pair first, so an inverse never lands on a fact about to get its own edge
            var changed = new LinkedHashSet<FactId>();
            for (int i = pairs.size() - 1; i >= 0; i--) {
                var p = pairs.get(i);
                var a = current.get(p.a());
                var b = current.get(p.b());
                current.put(a.id(), a.withRelation(new FactRelation(p.type(), b.id(), confidence)));
                changed.add(a.id());
                var inverse = p.type().inverse();
                if (inverse.isPresent() && !b.hasRelation()) {
                    current.put(b.id(), b.withRelation(new FactRelation(inverse.get(), a.id(), confidence)));
                    changed.add(b.id());
                }
            }

            if (!changed.isEmpty()) {
                store.write(changed.stream().map(current::get).toList());
            }
            log.info("Inferred {} relation(s) in scope {}", pairs.size(), scopeId);
            return pairs.stream().map(p -> current.get(p.a())).toList();
        });
    }

    /**
     * Assigns 0..n-1 to the scope's facts in ascending (start, id) order. Only facts whose
     * order changed are written, so a repeated call without new facts writes nothing.
     */
    public Map<FactId, Integer> recomputeTimelineOrder(String scopeId) {
        return locks.withLock(scopeId, () -> {
            var facts = new ArrayList<>(store.readScope(scopeId));
            facts.sort(TemporalFact.CHRONOLOGICAL);

            var order = new LinkedHashMap<FactId, Integer>();
            var changed = new ArrayList<TemporalFact>();
            for (int i = 0; i < facts.size(); i++) {
                var f = facts.get(i);
                order.put(f.id(), i);
                if (!Integer.valueOf(i).equals(f.timelineOrder())) {
                    changed.add(f.withTimelineOrder(i));
                }
            }
            store.write(changed);
            log.info("Timeline order of scope {}: {} fact(s), {} reassigned", scopeId, facts.size(), changed.size());
            return order;
        });
    }

    /** Relation for an adjacent pair, {@code a} starting no later than {@code b}. */
    static Optional<RelationType> classify(TemporalFact a, TemporalFact b) {
        var g = Granularity.coarser(a.granularity(), b.granularity());
        var bucketA = g.truncate(a.start());
        var bucketB = g.truncate(b.start());

        if (a.isInstant()) {
            if (bucketA.isBefore(bucketB)) return Optional.of(RelationType.PRECEDES);
        } else if (a.end() != null && !a.end().isAfter(b.start())) {
            return Optional.of(RelationType.PRECEDES);
        }
        if (intersects(a, b)) return Optional.of(RelationType.OVERLAPS);
        if (bucketA.equals(bucketB)) return Optional.of(RelationType.COINCIDES_WITH);
        return Optional.empty();
    }

    static boolean intersects(TemporalFact a, TemporalFact b) {
        var aEnd = a.isInstant() ? a.start() : a.end();
        var bEnd = b.isInstant() ? b.start() : b.end();
        return (aEnd == null || b.start().isBefore(aEnd))
                && (bEnd == null || a.start().isBefore(bEnd));
    }
}
