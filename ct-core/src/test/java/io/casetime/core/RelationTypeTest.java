package io.casetime.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelationTypeTest {

    @Test
    void inversesArePaired() {
        for (var t : RelationType.values()) {
            t.inverse().ifPresent(inv -> assertThat(inv.inverse()).contains(t));
        }
        assertThat(RelationType.PRECEDES.inverse()).contains(RelationType.FOLLOWS);
        assertThat(RelationType.HAS_CONSEQUENCE.inverse()).contains(RelationType.IS_CONSEQUENCE_OF);
    }

    @Test
    void annotationsHaveNoInverse() {
        assertThat(RelationType.CAUSED_BY.inverse()).isEmpty();
        assertThat(RelationType.ENABLED_BY.inverse()).isEmpty();
        assertThat(RelationType.PREVENTED_BY.inverse()).isEmpty();
    }

    @Test
    void symmetricTypes() {
        assertThat(RelationType.COINCIDES_WITH.symmetric()).isTrue();
        assertThat(RelationType.OVERLAPS.symmetric()).isTrue();
        assertThat(RelationType.PRECEDES.symmetric()).isFalse();
    }

    @Test
    void parsesWireAndConstantNames() {
        assertThat(RelationType.parse("coincidesWith")).isEqualTo(RelationType.COINCIDES_WITH);
        assertThat(RelationType.parse("IS_NECESSITATED_BY")).isEqualTo(RelationType.IS_NECESSITATED_BY);
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> RelationType.parse("interrupts"))
                .isInstanceOf(InvalidRelationTypeException.class)
                .hasMessageContaining("interrupts");
        assertThatThrownBy(() -> RelationType.parse(null))
                .isInstanceOf(InvalidRelationTypeException.class);
    }

    @Test
    void sentences() {
        assertThat(RelationType.HAS_CONSEQUENCE.sentence("A", "B")).isEqualTo("A leads to B");
        assertThat(RelationType.CAUSED_BY.sentence("A", "B")).isEqualTo("A was caused by B");
        assertThat(RelationType.PRECEDES.sentence("A", "B")).isEqualTo("A happens before B");
    }

    @Test
    void causalSubset() {
        assertThat(RelationType.HAS_CONSEQUENCE.causal()).isTrue();
        assertThat(RelationType.PREVENTED_BY.causal()).isTrue();
        assertThat(RelationType.PRECEDES.causal()).isFalse();
        assertThat(RelationType.IS_CONSEQUENCE_OF.causal()).isFalse();
    }
}
