package com.lhcz.pgcdc.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamPositionTest {

    @Test
    void parsesPostgresLsnText() {
        assertThat(StreamPosition.parse("16/B374D848")).isEqualTo(StreamPosition.endOf(0x16B374D848L));
        assertThat(StreamPosition.parse("0/64#3")).isEqualTo(new StreamPosition(100L, 3));
        assertThatThrownBy(() -> StreamPosition.parse("B374D848")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StreamPosition.parse("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void printsWithSequenceOnlyInsideTransaction() {
        assertThat(StreamPosition.endOf(0x16B374D848L)).hasToString("16/B374D848");
        assertThat(new StreamPosition(100L, 3)).hasToString("0/64#3");
        assertThat(StreamPosition.parse(new StreamPosition(0x1_0000_0001L, 7).toString()))
                .isEqualTo(new StreamPosition(0x1_0000_0001L, 7));
    }

    @Test
    void ordersByLsnThenSequence() {
        List<StreamPosition> positions = new ArrayList<>(List.of(
                StreamPosition.endOf(100L), new StreamPosition(200L, 1), new StreamPosition(100L, 2),
                StreamPosition.BEGINNING, new StreamPosition(100L, 1)));

        Collections.sort(positions);

        assertThat(positions).containsExactly(StreamPosition.BEGINNING, new StreamPosition(100L, 1),
                new StreamPosition(100L, 2), StreamPosition.endOf(100L), new StreamPosition(200L, 1));
        assertThat(StreamPosition.max(StreamPosition.endOf(5L), new StreamPosition(6L, 1)))
                .isEqualTo(new StreamPosition(6L, 1));
        assertThat(StreamPosition.BEGINNING.isBeginning()).isTrue();
        assertThat(StreamPosition.endOf(0L).isBeginning()).isFalse();
    }

    @Test
    void lsnComparesUnsigned() {
        assertThat(StreamPosition.endOf(-1L).isAfter(StreamPosition.endOf(1L))).isTrue();
    }

    @Test
    void tableIdDefaultsSchema() {
        assertThat(TableId.parse("users", "public")).isEqualTo(new TableId("public", "users"));
        assertThat(TableId.parse("sales.orders", "public")).hasToString("sales.orders");
    }
}
