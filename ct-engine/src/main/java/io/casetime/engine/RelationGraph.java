package io.casetime.engine;

import io.casetime.core.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed relations between facts. Each fact holds a single outgoing relation; creating a
 * relation also writes the inverse (when the type defines one) onto the target, replacing
 * whatever the target held before. Last write wins.
 */
public class RelationGraph {
    private static final Logger log = LoggerFactory.getLogger(RelationGraph.class);

    private final TemporalStore store;

    public RelationGraph(TemporalStore store) {
        this.store = Objects.requireNonNull(store);
    }

    public TemporalFact createRelation(FactId from, FactId to, String relationType) {
        var source = store.get(from);
        RelationType type;
        try {
            type = RelationType.parse(relationType);
        } catch (InvalidRelationTypeException e) {
            throw new InvalidRelationTypeException(e.getMessage(), source.scopeId(), from);
        }
        return createRelation(from, to, type, FactRelation.ASSERTED);
    }

    public TemporalFact createRelation(FactId from, FactId to, RelationType type) {
        return createRelation(from, to, type, FactRelation.ASSERTED);
    }

    public TemporalFact createRelation(FactId from, FactId to, RelationType type, double confidence) {
        Objects.requireNonNull(type, "type");
        var scopeId = store.get(from).scopeId();
        return store.locks().withLock(scopeId, () -> relate(from, to, type, confidence));
    }

    private TemporalFact relate(FactId from, FactId to, RelationType type, double confidence) {
        var source = store.get(from);
        var target = store.get(to);
        if (!target.scopeId().equals(source.scopeId())) {
            throw new NotFoundException("Temporal fact " + to + " not found in scope " + source.scopeId(),
                    source.scopeId(), to);
        }
        if (from.equals(to)) {
            throw new IllegalArgumentException("Fact " + from + " cannot relate to itself");
        }

        var updatedSource = source.withRelation(new FactRelation(type, to, confidence));
        var writes = new ArrayList<TemporalFact>();
        writes.add(updatedSource);
        type.inverse().ifPresent(inv -> {
            if (target.hasRelation()) {
                log.debug("Inverse {} replaces {} on fact {}", inv, target.relation(), to);
            }
            writes.add(target.withRelation(new FactRelation(inv, from, confidence)));
        });
        store.write(writes);
        log.debug("Related {} -{}-> {} in scope {}", from, type, to, source.scopeId());
        return updatedSource;
    }

    /**
     * Facts linked to {@code factId} by {@code type}: every fact {@code f} of the scope with
     * {@code f.relation = (type, factId)}, plus the target of the fact's own edge when that
     * edge has the same type. A linear scan of the scope; empty when nothing matches.
     */
    public List<TemporalFact> findRelated(FactId factId, RelationType type) {
        var fact = store.get(factId);
        var own = fact.hasRelation() && fact.relation().type() == type ? fact.relation().target() : null;
        return store.readScope(fact.scopeId()).stream()
                .filter(f -> f.id().equals(own)
                        || (f.hasRelation()
                            && f.relation().type() == type
                            && f.relation().target().equals(factId)))
                .toList();
    }

    public List<TemporalFact> findRelated(FactId factId, String relationType) {
        var fact = store.get(factId);
        RelationType type;
        try {
            type = RelationType.parse(relationType);
        } catch (InvalidRelationTypeException e) {
            throw new InvalidRelationTypeException(e.getMessage(), fact.scopeId(), factId);
        }
        return findRelated(factId, type);
    }
}
