package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.config.AppConfig;
import com.lhcz.pgcdc.model.Batch;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.support.InMemoryDestination;
import com.lhcz.pgcdc.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.lhcz.pgcdc.support.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlushControllerTest {

    private InMemoryDestination destination;
    private CheckpointManager checkpoints;
    private MutableClock clock;
    private FlushController controller;

    @BeforeEach
    void setUp() {
        destination = new InMemoryDestination();
        checkpoints = new CheckpointManager(destination, "slot");
        clock = new MutableClock(1_000_000L);
        controller = new FlushController(new AppConfig.FlushConfig(3, 1_000_000L, 5_000L), checkpoints, clock);
    }

    @Test
    void flushesWhenRowThresholdReached() {
        controller.append(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "a"));
        controller.append(insert(USERS_V1, pos(100L, 2), "id", 2, "name", "b"));
        assertThat(controller.shouldFlush(USERS)).isFalse();

        controller.append(insert(USERS_V1, pos(100L, 3), "id", 3, "name", "c"));

        assertThat(controller.shouldFlush(USERS)).isTrue();
        assertThat(controller.dueTables()).containsExactly(USERS);
    }

    @Test
    void flushesWhenOldestRecordWaitedLongEnough() {
        controller.append(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "a"));
        clock.advance(4_999L);
        assertThat(controller.shouldFlush(USERS)).isFalse();

        clock.advance(1L);

        assertThat(controller.shouldFlush(USERS)).isTrue();
    }

    @Test
    void flushesWhenByteThresholdReached() {
        FlushController small = new FlushController(new AppConfig.FlushConfig(1000, 200L, 60_000L), checkpoints, clock);

        small.append(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "x".repeat(100)));

        assertThat(small.shouldFlush(USERS)).isTrue();
    }

    @Test
    void batchesOfOneTableAreContiguous() {
        controller.append(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "a"));
        controller.append(insert(USERS_V1, pos(100L, 2), "id", 2, "name", "b"));

        Batch first = controller.takeBatch(USERS);
        assertThat(first.low()).isEqualTo(StreamPosition.BEGINNING);
        assertThat(first.high()).isEqualTo(pos(100L, 2));
        checkpoints.advance(first);
        controller.complete(first);

        controller.append(insert(USERS_V1, pos(200L, 1), "id", 3, "name", "c"));
        Batch second = controller.takeBatch(USERS);

        assertThat(second.low()).isEqualTo(first.high());
        assertThat(second.records()).hasSize(1);
    }

    @Test
    void inFlightBatchHoldsBackTheNextOne() {
        for (int i = 1; i <= 3; i++) {
            controller.append(insert(USERS_V1, pos(100L, i), "id", i, "name", "n"));
        }
        Batch inFlight = controller.takeBatch(USERS);
        for (int i = 1; i <= 3; i++) {
            controller.append(insert(USERS_V1, pos(200L, i), "id", i, "name", "m"));
        }

        assertThat(controller.shouldFlush(USERS)).isFalse();
        assertThat(controller.saturated()).isTrue();
        assertThatThrownBy(() -> controller.takeBatch(USERS)).isInstanceOf(IllegalStateException.class);

        controller.complete(inFlight);

        assertThat(controller.saturated()).isFalse();
        assertThat(controller.shouldFlush(USERS)).isTrue();
        assertThat(controller.takeBatch(USERS).low()).isEqualTo(pos(100L, 3));
    }

    @Test
    void tablesFlushIndependently() {
        for (int i = 1; i <= 3; i++) {
            controller.append(insert(USERS_V1, pos(100L, i), "id", i, "name", "n"));
        }
        controller.append(insert(ORDERS_V1, pos(100L, 4), "id", 1L, "amount", null, "note", null));

        assertThat(controller.dueTables()).containsExactly(USERS);
    }

    @Test
    void replayedRecordsAreSkipped() {
        checkpoints.advance(new Batch(USERS, List.of(insert(USERS_V1, pos(100L, 2), "id", 2, "name", "b")),
                StreamPosition.BEGINNING, pos(100L, 2)));

        assertThat(controller.append(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "a"))).isFalse();
        assertThat(controller.append(insert(USERS_V1, pos(100L, 2), "id", 2, "name", "b"))).isFalse();
        assertThat(controller.append(insert(USERS_V1, pos(100L, 3), "id", 3, "name", "c"))).isTrue();

        assertThat(controller.stats()).singleElement().satisfies(s -> {
            assertThat(s.skippedRecords()).isEqualTo(2);
            assertThat(s.bufferedRows()).isEqualTo(1);
            assertThat(s.committed()).isEqualTo("0/64#2");
        });
    }

    @Test
    void outOfOrderRecordIsRejected() {
        controller.append(insert(USERS_V1, pos(200L, 1), "id", 1, "name", "a"));

        assertThatThrownBy(() -> controller.append(insert(USERS_V1, pos(100L, 5), "id", 2, "name", "b")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("乱序");
    }

    @Test
    void safePositionStopsBeforeOldestPendingTransaction() {
        assertThat(controller.safePosition(null)).isNull();
        assertThat(controller.safePosition(StreamPosition.endOf(90L))).isEqualTo(StreamPosition.endOf(90L));

        controller.append(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "a"));
        controller.append(insert(ORDERS_V1, pos(300L, 1), "id", 1L, "amount", null, "note", null));

        assertThat(controller.safePosition(StreamPosition.endOf(300L))).isEqualTo(StreamPosition.endOf(99L));
        assertThat(controller.safePosition(StreamPosition.endOf(50L))).isEqualTo(StreamPosition.endOf(50L));

        Batch users = controller.takeBatch(USERS);
        assertThat(controller.safePosition(StreamPosition.endOf(300L))).isEqualTo(StreamPosition.endOf(99L));
        controller.complete(users);

        assertThat(controller.safePosition(StreamPosition.endOf(300L))).isEqualTo(StreamPosition.endOf(299L));
        assertThat(controller.hasPending()).isTrue();
    }

    @Test
    void discardBuffersRewindsToCommitted() {
        controller.append(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "a"));
        Batch batch = controller.takeBatch(USERS);
        controller.append(insert(USERS_V1, pos(200L, 1), "id", 2, "name", "b"));

        assertThatThrownBy(controller::discardBuffers).isInstanceOf(IllegalStateException.class);

        controller.complete(batch);
        assertThat(controller.discardBuffers()).isEqualTo(1);
        assertThat(controller.hasPending()).isFalse();

        // 重放同一条记录不应被视为乱序
        assertThat(controller.append(insert(USERS_V1, pos(200L, 1), "id", 2, "name", "b"))).isTrue();
    }

    @Test
    void takeCommittedLeavesOpenTransactionBuffered() {
        controller.append(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "a"));
        controller.append(insert(USERS_V1, pos(100L, 2), "id", 2, "name", "b"));
        controller.append(insert(USERS_V1, pos(200L, 1), "id", 3, "name", "c"));

        assertThat(controller.bufferedTables()).containsExactly(USERS);
        Batch batch = controller.takeCommitted(USERS, StreamPosition.endOf(100L));

        assertThat(batch.size()).isEqualTo(2);
        assertThat(batch.high()).isEqualTo(pos(100L, 2));
        assertThat(controller.takeCommitted(USERS, StreamPosition.endOf(100L))).isNull();

        controller.complete(batch);
        assertThat(controller.takeCommitted(USERS, StreamPosition.endOf(100L))).isNull();
        assertThat(controller.safePosition(StreamPosition.endOf(100L))).isEqualTo(StreamPosition.endOf(100L));
        assertThat(controller.discardBuffers()).isEqualTo(1);
    }

    @Test
    void completeRequiresTheInFlightBatch() {
        controller.append(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "a"));
        controller.takeBatch(USERS);
        Batch stranger = new Batch(USERS, List.of(insert(USERS_V1, pos(100L, 1), "id", 1, "name", "a")),
                StreamPosition.BEGINNING, pos(100L, 1));

        assertThatThrownBy(() -> controller.complete(stranger)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void sizeEstimateGrowsWithPayload() {
        long small = FlushController.estimateSize(insert(USERS_V1, pos(1L, 1), "id", 1, "name", "a"));
        long large = FlushController.estimateSize(insert(USERS_V1, pos(1L, 1), "id", 1, "name", "a".repeat(1000)));

        assertThat(large - small).isEqualTo(999L * 2);
    }
}
