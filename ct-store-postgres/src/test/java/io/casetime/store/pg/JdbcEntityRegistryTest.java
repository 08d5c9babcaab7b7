package io.casetime.store.pg;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.casetime.core.DecisionOption;
import io.casetime.core.EntityDescription;
import io.casetime.core.OwnerRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class JdbcEntityRegistryTest {

    private JdbcTemplate jdbc;
    private JdbcEntityRegistry registry;

    @BeforeEach
    void setUp() {
        jdbc = mock(JdbcTemplate.class);
        registry = new JdbcEntityRegistry(jdbc, new ObjectMapper());
    }

    @Test
    @SuppressWarnings("unchecked")
    void resolve_mapsJsonColumns() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.getString("description")).thenReturn("Suspend work");
        when(rs.getString("actor_id")).thenReturn("engineer-1");
        when(rs.getString("options")).thenReturn(
                "[{\"label\":\"Suspend\",\"description\":\"Stop the site\"},{\"label\":\"Continue\",\"description\":null}]");
        when(rs.getString("selected_option")).thenReturn("Suspend");
        when(rs.getString("principles")).thenReturn("[\"public safety\",\"honesty\"]");

        when(jdbc.query(anyString(), any(RowMapper.class), eq("DECISION"), eq("d1")))
                .thenAnswer(inv -> {
                    RowMapper<EntityDescription> m = inv.getArgument(1);
                    return List.of(m.mapRow(rs, 0));
                });

        var d = registry.resolve(OwnerRef.decision("d1")).orElseThrow();

        assertThat(d.description()).isEqualTo("Suspend work");
        assertThat(d.actorId()).isEqualTo("engineer-1");
        assertThat(d.options()).containsExactly(
                new DecisionOption("Suspend", "Stop the site"), new DecisionOption("Continue", null));
        assertThat(d.selectedOption()).isEqualTo("Suspend");
        assertThat(d.ethicalPrinciples()).containsExactly("public safety", "honesty");
    }

    @Test
    @SuppressWarnings("unchecked")
    void resolve_emptyWhenMissing() {
        when(jdbc.query(anyString(), any(RowMapper.class), any(), any())).thenReturn(List.of());

        assertThat(registry.resolve(OwnerRef.event("nope"))).isEmpty();
    }

    @Test
    void upsert_writesJsonArrays() {
        registry.upsert(OwnerRef.decision("d1"), new EntityDescription("Suspend work", "eng",
                List.of(new DecisionOption("Suspend", "Stop")), "Suspend", List.of("safety")));

        ArgumentCaptor<Object[]> argsCap = ArgumentCaptor.forClass(Object[].class);
        verify(jdbc).update(contains("ct_entity"), argsCap.capture());
        Object[] args = argsCap.getValue();
        assertThat(args).hasSize(7);
        assertThat(args[4]).asString().contains("\"label\":\"Suspend\"");
        assertThat(args[6]).isEqualTo("[\"safety\"]");
    }
}
