package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.core.ModeOrchestrator.Mode;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.support.InMemoryDestination;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.lhcz.pgcdc.support.Fixtures.ORDERS;
import static com.lhcz.pgcdc.support.Fixtures.USERS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModeOrchestratorTest {

    private static final String LOCK = "pipeline:bronze";

    private InMemoryDestination destination;
    private CheckpointManager checkpoints;
    private ModeOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        destination = new InMemoryDestination();
        checkpoints = new CheckpointManager(destination, "slot");
        orchestrator = new ModeOrchestrator(destination, checkpoints, LOCK, true);
    }

    @Test
    void otherModeCannotRunWhileLockIsHeld() {
        AtomicBoolean ran = new AtomicBoolean();

        orchestrator.run(Mode.FULL_LOAD, List.of(USERS), () -> {
            assertThat(destination.lockHolder(LOCK)).isEqualTo("FULL_LOAD");
            assertThatThrownBy(() -> orchestrator.run(Mode.CDC, List.of(), () -> ran.set(true)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining(LOCK);
        });

        assertThat(ran).isFalse();
        assertThat(destination.lockHolder(LOCK)).isNull();
    }

    @Test
    void lockIsReleasedWhenTaskFails() {
        assertThatThrownBy(() -> orchestrator.run(Mode.FULL_LOAD, List.of(USERS), () -> {
            throw new IllegalArgumentException("boom");
        })).hasMessage("boom");

        assertThat(destination.lockHolder(LOCK)).isNull();
    }

    @Test
    void cdcRequiresCompletedBackfill() {
        checkpoints.markBackfilled(USERS, StreamPosition.endOf(10L));
        AtomicBoolean ran = new AtomicBoolean();

        assertThatThrownBy(() -> orchestrator.run(Mode.CDC, List.of(USERS, ORDERS), () -> ran.set(true)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(ORDERS.toString())
                .hasMessageNotContaining(USERS.toString());
        assertThat(ran).isFalse();
        assertThat(destination.lockHolder(LOCK)).isNull();

        checkpoints.markBackfilled(ORDERS, StreamPosition.endOf(12L));
        orchestrator.run(Mode.CDC, List.of(USERS, ORDERS), () -> ran.set(true));
        assertThat(ran).isTrue();
    }

    @Test
    void backfillCheckCanBeDisabled() {
        ModeOrchestrator relaxed = new ModeOrchestrator(destination, checkpoints, LOCK, false);
        AtomicBoolean ran = new AtomicBoolean();

        relaxed.run(Mode.CDC, List.of(USERS), () -> ran.set(true));

        assertThat(ran).isTrue();
    }

    @Test
    void sameModeTakesOverLeftoverLock() {
        destination.tryLock(LOCK, "CDC");
        AtomicBoolean ran = new AtomicBoolean();

        new ModeOrchestrator(destination, checkpoints, LOCK, false).run(Mode.CDC, List.of(), () -> ran.set(true));

        assertThat(ran).isTrue();
    }

    @Test
    void parsesModeNames() {
        assertThat(Mode.parse("cdc")).isEqualTo(Mode.CDC);
        assertThat(Mode.parse(" Full-Load ")).isEqualTo(Mode.FULL_LOAD);
        assertThat(Mode.parse("full_load")).isEqualTo(Mode.FULL_LOAD);
        assertThatThrownBy(() -> Mode.parse("incremental")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Mode.parse(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
