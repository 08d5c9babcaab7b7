package io.casetime.store.pg;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.casetime.core.DecisionOption;
import io.casetime.core.EntityDescription;
import io.casetime.core.OwnerRef;
import io.casetime.store.EntityRegistry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Reads entity descriptions from the {@code ct_entity} table. */
public final class JdbcEntityRegistry implements EntityRegistry {
    private final JdbcTemplate jdbc;
    private final ObjectMapper json;

    public JdbcEntityRegistry(JdbcTemplate jdbc, ObjectMapper json) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.json = Objects.requireNonNull(json);
    }

    @Override
    public Optional<EntityDescription> resolve(OwnerRef owner) {
        var sql = """
          SELECT description, actor_id, options, selected_option, principles
          FROM ct_entity WHERE owner_kind = ? AND owner_id = ?
          """;
        return jdbc.query(sql, mapper(), owner.kind().name(), owner.entityId()).stream().findFirst();
    }

    @Override
    public void upsert(OwnerRef owner, EntityDescription d) {
        var sql = """
          INSERT INTO ct_entity (owner_kind, owner_id, description, actor_id, options, selected_option, principles)
          VALUES (?, ?, ?, ?, ?::jsonb, ?, ?::jsonb)
          ON CONFLICT (owner_kind, owner_id)
          DO UPDATE SET description = EXCLUDED.description, actor_id = EXCLUDED.actor_id,
                        options = EXCLUDED.options, selected_option = EXCLUDED.selected_option,
                        principles = EXCLUDED.principles
          """;
        jdbc.update(sql, owner.kind().name(), owner.entityId(), d.description(), d.actorId(),
                toJson(d.options()), d.selectedOption(), toJson(d.ethicalPrinciples()));
    }

    private String toJson(Object o) {
        try { return json.writeValueAsString(o); }
        catch (Exception e) { throw new IllegalStateException("Cannot serialize " + o, e); }
    }

    private RowMapper<EntityDescription> mapper() {
        return (rs, rn) -> new EntityDescription(
                rs.getString("description"),
                rs.getString("actor_id"),
                readOptions(rs.getString("options")),
                rs.getString("selected_option"),
                readPrinciples(rs.getString("principles"))
        );
    }

    private List<DecisionOption> readOptions(String s) {
        if (s == null) return List.of();
        try { return json.readValue(s, new TypeReference<>(){}); }
        catch (Exception e){ throw new IllegalStateException("Cannot parse options " + s, e); }
    }

    private List<String> readPrinciples(String s) {
        if (s == null) return List.of();
        try { return json.readValue(s, new TypeReference<>(){}); }
        catch (Exception e){ throw new IllegalStateException("Cannot parse principles " + s, e); }
    }
}
