package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.config.AppConfig;
import com.lhcz.pgcdc.error.ApplyException;
import com.lhcz.pgcdc.error.DecodeException;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.sink.LocalStagingArea;
import com.lhcz.pgcdc.support.InMemoryDestination;
import com.lhcz.pgcdc.support.PgOutputMessages.Col;
import com.lhcz.pgcdc.support.ScriptedConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static com.lhcz.pgcdc.support.Fixtures.USERS;
import static com.lhcz.pgcdc.support.PgOutputMessages.*;
import static org.assertj.core.api.Assertions.assertThat;

class ReplicationSessionTest {

    private static final int REL = 16384;
    private static final Instant TS = Instant.parse("2024-05-01T08:00:00Z");

    @TempDir
    Path tmp;

    private InMemoryDestination destination;
    private ScriptedConnector connector;
    private CheckpointManager checkpoints;
    private ReplicationSession session;
    private Thread runner;
    private final AtomicReference<Throwable> outcome = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        destination = new InMemoryDestination();
        connector = new ScriptedConnector();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (session != null) {
            session.stop();
        }
        if (runner != null) {
            runner.join(10_000);
        }
    }

    private void start(int maxRetries) {
        AppConfig.ApplyConfig apply = new AppConfig.ApplyConfig(2, maxRetries, 1L, tmp.resolve("failed").toString());
        AppConfig.ReplicationConfig replication = new AppConfig.ReplicationConfig(
                "slot", "pub", "public", null, 0L, 10L, 50L, null, null);
        checkpoints = new CheckpointManager(destination, "slot");
        FlushController flush = new FlushController(new AppConfig.FlushConfig(1000, 1L << 30, 0L), checkpoints,
                Clock.systemUTC());
        MergeLoader loader = new MergeLoader(destination, new LocalStagingArea(tmp.resolve("staging")), apply,
                new DeadLetterQueueManager(apply.failedDirOrDefault()));
        session = new ReplicationSession(connector, flush, loader, checkpoints, replication, apply, Clock.systemUTC());
        runner = new Thread(() -> {
            try {
                session.run();
            } catch (Throwable t) {
                outcome.set(t);
            }
        }, "session-under-test");
        runner.start();
    }

    private static ByteBuffer usersRelation() {
        return relation(REL, "public", "users", Col.key("id", OID_INT4), Col.of("name", OID_TEXT));
    }

    private void txn(long lsn, ByteBuffer... changes) {
        ByteBuffer[] messages = new ByteBuffer[changes.length + 3];
        messages[0] = begin(lsn, TS, (int) lsn);
        messages[1] = usersRelation();
        System.arraycopy(changes, 0, messages, 2, changes.length);
        messages[messages.length - 1] = commit(lsn, lsn + 8, TS);
        connector.append(lsn, messages);
    }

    private void givenThreeTransactions() {
        txn(100L, insert(REL, 1, "a"), insert(REL, 2, "b"));
        txn(200L, update(REL, 1, "a2"), delete(REL, 'K', 2, null));
        txn(300L, insert(REL, 3, "c"));
    }

    private static void await(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("等待超时: " + what);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void streamsChangesIntoDestinationAndAcknowledges() throws InterruptedException {
        givenThreeTransactions();

        start(1);
        await(() -> StreamPosition.endOf(300L).equals(session.checkpoint()), "会话进度到达 300");
        await(() -> connector.acknowledged() == 300L, "确认位置到达 300");

        assertThat(destination.rows(USERS)).containsOnlyKeys(1, 3);
        assertThat(destination.row(USERS, 1)).containsEntry("name", "a2");
        assertThat(session.state()).isEqualTo(SessionState.STREAMING);
        // 每个事务 Begin/Relation/Commit 三条，加上 5 条行变更
        assertThat(session.decodedEvents()).isEqualTo(3 * 3 + 5);

        session.stop();
        runner.join(10_000);
        assertThat(session.state()).isEqualTo(SessionState.STOPPED);
        assertThat(outcome.get()).isNull();
        assertThat(connector.closed()).isEqualTo(1);
    }

    @Test
    void transactionsArrivingLaterAreStreamed() throws InterruptedException {
        txn(100L, insert(REL, 1, "a"));
        start(1);
        await(() -> StreamPosition.endOf(100L).equals(session.checkpoint()), "第一个事务落地");

        txn(200L, insert(REL, 2, "b"));

        await(() -> StreamPosition.endOf(200L).equals(session.checkpoint()), "第二个事务落地");
        assertThat(destination.rows(USERS)).containsOnlyKeys(1, 2);
    }

    @Test
    void reconnectReplaysWithoutDuplicatingOrLosingChanges() throws InterruptedException {
        givenThreeTransactions();
        // 第一次连接在第二个事务中途断开
        connector.disconnectAfter(7);

        start(1);
        await(() -> StreamPosition.endOf(300L).equals(session.checkpoint()), "重连后会话进度到达 300");

        assertThat(session.reconnects()).isEqualTo(1);
        assertThat(connector.opens()).hasSize(2);
        assertThat(connector.opens().get(1)).isEqualTo(StreamPosition.endOf(100L));
        assertThat(destination.rows(USERS)).containsOnlyKeys(1, 3);
        assertThat(destination.row(USERS, 1)).containsEntry("name", "a2");
        assertThat(session.lastError()).contains("模拟网络中断");
    }

    @Test
    void restartResumesFromStoredProgress() throws InterruptedException {
        givenThreeTransactions();
        start(1);
        await(() -> StreamPosition.endOf(300L).equals(session.checkpoint()), "首次运行完成");
        session.stop();
        runner.join(10_000);

        txn(400L, insert(REL, 4, "d"));
        start(1);
        await(() -> StreamPosition.endOf(400L).equals(session.checkpoint()), "重启后进度到达 400");

        assertThat(connector.opens()).last().isEqualTo(StreamPosition.endOf(300L));
        assertThat(destination.rows(USERS)).containsOnlyKeys(1, 3, 4);
    }

    @Test
    void malformedMessageFailsTheSession() throws InterruptedException {
        connector.append(100L, begin(100L, TS, 1), raw('Z'), commit(100L, 108L, TS));

        start(1);
        runner.join(10_000);

        assertThat(outcome.get()).isInstanceOf(DecodeException.class);
        assertThat(session.state()).isEqualTo(SessionState.FAILED);
        assertThat(session.lastError()).contains("'Z'");
        assertThat(session.checkpoint()).isEqualTo(StreamPosition.BEGINNING);
    }

    @Test
    void exhaustedApplyFailsTheSessionWithoutAdvancing() throws InterruptedException {
        txn(100L, insert(REL, 1, "a"));
        destination.failNextMerges(100);

        start(1);
        runner.join(10_000);

        assertThat(outcome.get()).isInstanceOf(ApplyException.class);
        assertThat(session.state()).isEqualTo(SessionState.FAILED);
        assertThat(checkpoints.load()).isLessThan(StreamPosition.endOf(100L));
        assertThat(checkpoints.load(USERS)).isEqualTo(StreamPosition.BEGINNING);
        assertThat(destination.rowCount(USERS)).isZero();
    }
}
