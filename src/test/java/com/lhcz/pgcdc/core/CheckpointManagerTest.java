package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.error.CheckpointGapException;
import com.lhcz.pgcdc.model.Batch;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.support.InMemoryDestination;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.lhcz.pgcdc.support.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckpointManagerTest {

    private InMemoryDestination destination;
    private CheckpointManager checkpoints;

    @BeforeEach
    void setUp() {
        destination = new InMemoryDestination();
        checkpoints = new CheckpointManager(destination, "slot_a");
    }

    private static Batch batch(StreamPosition low, StreamPosition high) {
        return new Batch(USERS, List.of(insert(USERS_V1, high, "id", 1, "name", "a")), low, high);
    }

    @Test
    void firstRunStartsAtBeginning() {
        assertThat(checkpoints.load()).isEqualTo(StreamPosition.BEGINNING);
        assertThat(checkpoints.load(USERS)).isEqualTo(StreamPosition.BEGINNING);
    }

    @Test
    void tableProgressMustBeContiguous() {
        checkpoints.advance(batch(StreamPosition.BEGINNING, pos(100L, 2)));
        checkpoints.advance(batch(pos(100L, 2), pos(200L, 1)));

        assertThat(checkpoints.load(USERS)).isEqualTo(pos(200L, 1));
        assertThatThrownBy(() -> checkpoints.advance(batch(pos(100L, 2), pos(300L, 1))))
                .isInstanceOf(CheckpointGapException.class)
                .satisfies(e -> {
                    CheckpointGapException gap = (CheckpointGapException) e;
                    assertThat(gap.getStored()).isEqualTo(pos(200L, 1));
                    assertThat(gap.getRequested()).isEqualTo(pos(100L, 2));
                    assertThat(gap.isRetriable()).isFalse();
                });
    }

    @Test
    void progressSurvivesRestart() {
        checkpoints.advance(batch(StreamPosition.BEGINNING, pos(100L, 2)));
        checkpoints.advanceSession(StreamPosition.endOf(100L));

        CheckpointManager restarted = new CheckpointManager(destination, "slot_a");

        assertThat(restarted.load()).isEqualTo(StreamPosition.endOf(100L));
        assertThat(restarted.load(USERS)).isEqualTo(pos(100L, 2));
        assertThat(new CheckpointManager(destination, "slot_b").load()).isEqualTo(StreamPosition.BEGINNING);
    }

    @Test
    void sessionAdvanceSkipsEqualAndRejectsRegression() {
        assertThat(checkpoints.advanceSession(StreamPosition.endOf(100L))).isTrue();
        int writes = destination.checkpointWrites();

        assertThat(checkpoints.advanceSession(StreamPosition.endOf(100L))).isFalse();
        assertThat(destination.checkpointWrites()).isEqualTo(writes);
        assertThatThrownBy(() -> checkpoints.advanceSession(StreamPosition.endOf(50L)))
                .isInstanceOf(CheckpointGapException.class);
    }

    @Test
    void backfillMarkerIsPerTable() {
        checkpoints.markBackfilled(USERS, StreamPosition.endOf(42L));

        assertThat(checkpoints.isBackfilled(USERS)).isTrue();
        assertThat(checkpoints.isBackfilled(ORDERS)).isFalse();
        assertThat(destination.readCheckpoints("slot_a")).containsEntry("backfill:" + USERS, StreamPosition.endOf(42L));
        assertThat(new CheckpointManager(destination, "slot_a").isBackfilled(USERS)).isTrue();
    }
}
