package io.casetime.store.pg;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.casetime.core.*;
import io.casetime.store.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionOperations;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

public final class PostgresFactStore implements FactStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresFactStore.class);

    private static final String COLUMNS = """
        fact_id, scope_id, owner_kind, owner_id, region_type, start_at, end_at,
        granularity, confidence, relation, timeline_order
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper json;
    private final TransactionOperations tx;

    public PostgresFactStore(JdbcTemplate jdbc, ObjectMapper json, TransactionOperations tx) {
        this.jdbcTemplate = Objects.requireNonNull(jdbc);
        this.json = Objects.requireNonNull(json);
        this.tx = Objects.requireNonNull(tx);
    }

    @Override
    public void save(List<TemporalFact> facts) {
        if (facts == null || facts.isEmpty()) return;
        final String sql = """
      INSERT INTO ct_fact (fact_id, scope_id, owner_kind, owner_id, region_type, start_at, end_at,
                           granularity, confidence, relation, timeline_order)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
      ON CONFLICT (fact_id)
      DO UPDATE SET region_type = EXCLUDED.region_type,
                    start_at = EXCLUDED.start_at,
                    end_at = EXCLUDED.end_at,
                    granularity = EXCLUDED.granularity,
                    confidence = EXCLUDED.confidence,
                    relation = EXCLUDED.relation,
                    timeline_order = EXCLUDED.timeline_order
      """;
        tx.executeWithoutResult(status -> {
            for (TemporalFact f : facts) {
                jdbcTemplate.update(sql,
                        f.id().value(),
                        f.scopeId(),
                        f.owner().kind().name(),
                        f.owner().entityId(),
                        f.regionType().name(),
                        Timestamp.from(f.start()),
                        f.end() == null ? null : Timestamp.from(f.end()),
                        f.granularity().name(),
                        f.confidence(),
                        f.relation() == null ? null : toJson(relationDoc(f.relation())),
                        f.timelineOrder()
                );
            }
        });
        log.debug("Saved {} fact(s)", facts.size());
    }

    @Override
    public Optional<TemporalFact> find(FactId id) {
        var sql = "SELECT " + COLUMNS + " FROM ct_fact WHERE fact_id = ?";
        return jdbcTemplate.query(sql, mapper(), id.value()).stream().findFirst();
    }

    @Override
    public Optional<TemporalFact> findByOwner(String scopeId, OwnerRef owner) {
        var sql = "SELECT " + COLUMNS + " FROM ct_fact WHERE scope_id = ? AND owner_kind = ? AND owner_id = ?";
        return jdbcTemplate.query(sql, mapper(), scopeId, owner.kind().name(), owner.entityId())
                .stream().findFirst();
    }

    @Override
    public List<TemporalFact> read(String scopeId) {
        return search(scopeId, null, null, null, null);
    }

    @Override
    public List<TemporalFact> search(
            String scopeId, EntityKind kind, Instant from, Instant to, Integer limit) {

        record Clause(String sql, List<Object> params) {}

        var clauses = new ArrayList<Clause>();
        clauses.add(new Clause("scope_id = ?", List.of(scopeId)));

        Optional.ofNullable(kind)
                .ifPresent(k -> clauses.add(new Clause("owner_kind = ?", List.of(k.name()))));

        if (from != null && to != null) {
            var f = Timestamp.from(from);
            var t = Timestamp.from(to);
            clauses.add(new Clause("""
                ((region_type = 'INSTANT' AND start_at >= ? AND start_at <= ?)
                 OR (region_type = 'INTERVAL' AND start_at <= ? AND (end_at IS NULL OR end_at >= ?)))""",
                    List.of(f, t, t, f)));
        }

        var sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ct_fact WHERE 1=1");

        clauses.forEach(c -> sql.append(" AND ").append(c.sql()));

        sql.append(" ORDER BY start_at ASC, fact_id ASC");

        var params = clauses.stream()
                .flatMap(c -> c.params().stream())
                .toList();

        if (limit != null && limit > 0) {
            sql.append(" LIMIT ?");
            return jdbcTemplate.query(sql.toString(), mapper(),
                    Stream.concat(params.stream(), Stream.of(limit)).toArray());
        }

        return jdbcTemplate.query(sql.toString(), mapper(), params.toArray());
    }

    @Override
    public int deleteScope(String scopeId) {
        int n = jdbcTemplate.update("DELETE FROM ct_fact WHERE scope_id = ?", scopeId);
        log.info("Deleted {} fact(s) of scope {}", n, scopeId);
        return n;
    }

    private RowMapper<TemporalFact> mapper() {
        return (ResultSet rs, int rowNum) -> {
            var owner = new OwnerRef(EntityKind.valueOf(rs.getString("owner_kind")), rs.getString("owner_id"));
            Timestamp end = rs.getTimestamp("end_at");
            var relation = rs.getString("relation");
            var order = rs.getObject("timeline_order");
            return new TemporalFact(
                    new FactId(UUID.fromString(rs.getString("fact_id"))),
                    owner,
                    rs.getString("scope_id"),
                    RegionType.valueOf(rs.getString("region_type")),
                    rs.getTimestamp("start_at").toInstant(),
                    end == null ? null : end.toInstant(),
                    Granularity.valueOf(rs.getString("granularity")),
                    rs.getDouble("confidence"),
                    relation == null ? null : readRelation(relation),
                    order == null ? null : ((Number) order).intValue()
            );
        };
    }

    static Map<String, Object> relationDoc(FactRelation r) {
        var doc = new LinkedHashMap<String, Object>();
        doc.put("type", r.type().wireName());
        doc.put("target", r.target().toString());
        doc.put("confidence", r.confidence());
        return doc;
    }

    FactRelation readRelation(String jsonStr) {
        Map<String, Object> doc = readJsonObj(jsonStr);
        var confidence = doc.get("confidence");
        return new FactRelation(
                RelationType.parse(String.valueOf(doc.get("type"))),
                FactId.parse(String.valueOf(doc.get("target"))),
                confidence == null ? FactRelation.ASSERTED : ((Number) confidence).doubleValue()
        );
    }

    String toJson(Object o) {
        try { return json.writeValueAsString(o); }
        catch (Exception e) { throw new IllegalStateException("Cannot serialize " + o, e); }
    }

    private Map<String, Object> readJsonObj(String jsonStr) {
        try { return json.readValue(jsonStr, new TypeReference<>() {
        }); }
        catch (Exception e) { throw new IllegalStateException("Cannot parse relation " + jsonStr, e); }
    }
}
