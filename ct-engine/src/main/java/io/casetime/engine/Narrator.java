package io.casetime.engine;

import io.casetime.core.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Read-only rendering of a scope as a structured timeline or as narrative text.
 *
 * <p>Rendering never aborts on a missing entity or a dangling relation target: the element
 * is logged at WARN and skipped, and the rest of the scope is still rendered.
 */
public class Narrator {
    private static final Logger log = LoggerFactory.getLogger(Narrator.class);

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final TemporalStore store;
    private final EntityResolver resolver;

    public Narrator(TemporalStore store, EntityResolver resolver) {
        this.store = Objects.requireNonNull(store);
        this.resolver = Objects.requireNonNull(resolver);
    }

    public Timeline buildTimeline(String scopeId) {
        var render = new Render(scopeId);
        var events = new ArrayList<TimelineEntry>();
        var actions = new ArrayList<TimelineEntry>();
        var decisions = new ArrayList<TimelineEntry>();

        for (var f : render.facts) {
            var d = render.describe(f);
            if (d.isEmpty()) continue;
            var entry = new TimelineEntry(
                    f.id(),
                    f.owner().entityId(),
                    f.start(),
                    f.end(),
                    d.get().description(),
                    d.get().actorId(),
                    f.hasRelation() ? render.sentence(f, f.relation()).orElse(null) : null,
                    d.get().options(),
                    d.get().selectedOption(),
                    d.get().ethicalPrinciples()
            );
            switch (f.kind()) {
                case EVENT -> events.add(entry);
                case ACTION -> actions.add(entry);
                case DECISION -> decisions.add(entry);
            }
        }
        return new Timeline(scopeId, events, actions, decisions);
    }

    public String getContext(String scopeId, boolean includeConfidence, boolean includeCausal) {
        var render = new Render(scopeId);
        var sb = new StringBuilder("TIMELINE:\n\n");

        for (var f : render.facts) {
            var d = render.describe(f);
            if (d.isEmpty()) continue;
            sb.append(f.kind().tag()).append(" [").append(when(f)).append("]: ")
              .append(d.get().description()).append('\n');
            if (f.kind() == EntityKind.DECISION) appendDecision(sb, d.get());
            sb.append('\n');
        }

        var lines = render.relationLines(includeConfidence);

        sb.append("TEMPORAL RELATIONSHIPS:\n\n");
        lines.forEach(l -> sb.append("- ").append(l.text()).append('\n'));

        if (includeCausal) {
            sb.append("\nCAUSAL RELATIONSHIPS:\n\n");
            lines.stream()
                 .filter(l -> l.type().causal())
                 .forEach(l -> sb.append("- ").append(l.text()).append('\n'));
        }
        return sb.toString();
    }

    private static void appendDecision(StringBuilder sb, EntityDescription d) {
        if (!d.options().isEmpty()) {
            sb.append("  Options:\n");
            for (var o : d.options()) {
                sb.append("    - ").append(o.label());
                if (d.isSelected(o)) sb.append(" (SELECTED)");
                sb.append(": ").append(o.description() == null || o.description().isBlank()
                        ? "No description" : o.description()).append('\n');
            }
        }
        if (!d.ethicalPrinciples().isEmpty()) {
            sb.append("  Ethical principles: ").append(String.join(", ", d.ethicalPrinciples())).append('\n');
        }
    }

    static String when(TemporalFact f) {
        var start = TIMESTAMP.format(f.start());
        if (f.isInstant()) return start;
        return start + " to " + (f.end() == null ? "ongoing" : TIMESTAMP.format(f.end()));
    }

    static String confidence(double c) {
        return String.format(Locale.ROOT, " (confidence: %.2f)", c);
    }

    record Line(RelationType type, String text) {}

    /** State of one rendering pass: the scope's facts and the descriptions resolved so far. */
    private final class Render {
        final String scopeId;
        final List<TemporalFact> facts;
        final Map<FactId, TemporalFact> byId = new HashMap<>();
        final Map<OwnerRef, Optional<EntityDescription>> described = new HashMap<>();

        Render(String scopeId) {
            this.scopeId = scopeId;
            var all = store.readTimeline(scopeId);
            if (all.isEmpty()) throw NotFoundException.scope(scopeId);
            this.facts = all;
            all.forEach(f -> byId.put(f.id(), f));
        }

        Optional<EntityDescription> describe(TemporalFact f) {
            return described.computeIfAbsent(f.owner(), owner -> {
                var d = resolver.resolve(owner);
                if (d.isEmpty()) {
                    log.warn("Render skipped: entity {} of fact {} in scope {} not found", owner, f.id(), scopeId);
                }
                return d;
            });
        }

        String label(TemporalFact f, EntityDescription d) {
            return f.kind().label() + " '" + d.description() + "'";
        }

        Optional<String> sentence(TemporalFact from, FactRelation r) {
            var to = byId.get(r.target());
            if (to == null) {
                log.warn("Render skipped: relation {} of fact {} in scope {} targets missing fact {}",
                        r.type(), from.id(), scopeId, r.target());
                return Optional.empty();
            }
            var a = describe(from);
            var b = describe(to);
            if (a.isEmpty() || b.isEmpty()) return Optional.empty();
            return Optional.of(r.type().sentence(label(from, a.get()), label(to, b.get())));
        }

        /**
         * One line per edge. Of a mirrored pair only one half is rendered: the causal half when
         * exactly one of them is causal, otherwise the half whose source comes first.
         */
        List<Line> relationLines(boolean includeConfidence) {
            var edges = new HashSet<String>();
            for (var f : facts) {
                if (f.hasRelation()) edges.add(key(f.id(), f.relation().type(), f.relation().target()));
            }
            var out = new ArrayList<Line>();
            var rendered = new HashSet<String>();
            for (var f : facts) {
                if (!f.hasRelation()) continue;
                var r = f.relation();
                var inverse = r.type().inverse();
                if (inverse.isPresent() && edges.contains(key(r.target(), inverse.get(), f.id()))) {
                    var inv = inverse.get();
                    if (inv.causal() && !r.type().causal()) continue;
                    var preferred = r.type().causal() && !inv.causal();
                    if (!preferred && rendered.contains(key(r.target(), inv, f.id()))) continue;
                }
                var text = sentence(f, r);
                if (text.isEmpty()) continue;
                rendered.add(key(f.id(), r.type(), r.target()));
                out.add(new Line(r.type(),
                        includeConfidence && r.inferred() ? text.get() + confidence(r.confidence()) : text.get()));
            }
            return out;
        }

        private String key(FactId from, RelationType type, FactId to) {
            return from + "|" + type.wireName() + "|" + to;
        }
    }
}
