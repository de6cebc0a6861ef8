package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.config.AppConfig;
import com.lhcz.pgcdc.error.ReplicationException;
import com.lhcz.pgcdc.model.Batch;
import com.lhcz.pgcdc.model.ChangeRecord;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.model.TableId;
import com.lhcz.pgcdc.source.ReplicationConnector;
import com.lhcz.pgcdc.source.WalStream;
import com.lhcz.pgcdc.wal.PgOutputDecoder;
import com.lhcz.pgcdc.wal.RelationCache;
import com.lhcz.pgcdc.wal.WalEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 复制会话 (CDC 主循环)
 * <p>
 * 单线程解码：读取 -> 解码 -> 组装 -> 按表缓冲；到期的表交给写入线程池，每张表同时最多一个在途批次。
 * 定期计算安全位置，持久化后回报给源端。
 * 连接类故障会等待在途批次、保存进度、丢弃缓冲后退避重连；其他错误使会话失败并抛给调用方。
 */
public class ReplicationSession {
    private static final Logger log = LoggerFactory.getLogger(ReplicationSession.class);

    private static final long IDLE_SLEEP_MS = 10L;

    private final ReplicationConnector connector;
    private final RelationCache relationCache;
    private final PgOutputDecoder decoder;
    private final ChangeRecordAssembler assembler;
    private final FlushController flushController;
    private final MergeLoader mergeLoader;
    private final CheckpointManager checkpointManager;
    private final AppConfig.ReplicationConfig config;
    private final Clock clock;
    private final ExecutorService workers;

    private final Map<Batch, Future<?>> inFlight = new ConcurrentHashMap<>();
    private final AtomicReference<Throwable> fatal = new AtomicReference<>();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile boolean running = true;
    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile String lastError;
    private final AtomicInteger reconnects = new AtomicInteger();
    private final AtomicLong decodedEvents = new AtomicLong();

    public ReplicationSession(ReplicationConnector connector,
                              FlushController flushController,
                              MergeLoader mergeLoader,
                              CheckpointManager checkpointManager,
                              AppConfig.ReplicationConfig config,
                              AppConfig.ApplyConfig apply,
                              Clock clock) {
        this.connector = connector;
        this.relationCache = new RelationCache();
        this.decoder = new PgOutputDecoder(relationCache);
        this.assembler = new ChangeRecordAssembler();
        this.flushController = flushController;
        this.mergeLoader = mergeLoader;
        this.checkpointManager = checkpointManager;
        this.config = config;
        this.clock = clock;
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(apply.workersOrDefault(), r -> {
            Thread t = new Thread(r, "pgcdc-apply-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 运行直到 {@link #stop()} 或遇到致命错误 (以异常抛出)
     */
    public void run() {
        long backoff = config.reconnectBackoffMsOrDefault();
        try {
            while (running) {
                try {
                    stream();
                    backoff = config.reconnectBackoffMsOrDefault();
                } catch (ReplicationException e) {
                    if (!running) {
                        log.warn("停止过程中连接中断: {}", e.getMessage());
                        awaitInFlight();
                        break;
                    }
                    if (!e.isRetriable()) {
                        throw e;
                    }
                    state = SessionState.DISCONNECTED;
                    lastError = e.getMessage();
                    int attempt = reconnects.incrementAndGet();
                    log.warn("⚠️ 复制连接中断: {}，{}ms 后进行第 {} 次重连...", e.getMessage(), backoff, attempt);
                    recover();
                    sleep(backoff);
                    backoff = Math.min(backoff * 2, config.maxReconnectBackoffMsOrDefault());
                }
            }
            state = SessionState.STOPPED;
            log.info("👋 复制会话已停止，进度: {}", checkpointManager.load());
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        } finally {
            workers.shutdown();
            finished.countDown();
        }
    }

    /**
     * 一次连接的生命周期：正常返回表示收到停止请求
     */
    private void stream() {
        state = SessionState.NEGOTIATING;
        StreamPosition start = checkpointManager.load();
        log.info("正在建立复制连接，从 {} 开始...", start);
        try (WalStream stream = connector.open(start)) {
            state = SessionState.STREAMING;
            long lastStatus = clock.millis();

            while (running) {
                checkFatal();
                ByteBuffer message = stream.read();
                if (message == null) {
                    assembler.assemble(new WalEvent.Keepalive(stream.lastReceiveLsn()));
                    dispatchDue();
                    checkpoint(stream, true, false);
                    sleep(IDLE_SLEEP_MS);
                    continue;
                }

                WalEvent event = decoder.decode(message, stream.lastReceiveLsn());
                decodedEvents.incrementAndGet();
                for (ChangeRecord record : assembler.assemble(event)) {
                    flushController.append(record);
                }
                dispatchDue();
                while (running && flushController.saturated()) {
                    // 背压：某张表在等在途批次且缓冲已满
                    checkFatal();
                    sleep(IDLE_SLEEP_MS);
                    dispatchDue();
                }

                if (clock.millis() - lastStatus >= config.statusIntervalMsOrDefault()) {
                    checkpoint(stream, false, true);
                    lastStatus = clock.millis();
                }
            }

            // 正常停止：在途批次写完后保存进度，未刷写的缓冲下次重放
            awaitInFlight();
            checkpoint(stream, false, true);
        }
    }

    private void dispatchDue() {
        for (TableId table : flushController.dueTables()) {
            Batch batch = flushController.takeBatch(table);
            Future<?> future = workers.submit(() -> applyBatch(batch));
            inFlight.put(batch, future);
            if (future.isDone()) {
                inFlight.remove(batch);
            }
        }
    }

    private void applyBatch(Batch batch) {
        try {
            mergeLoader.apply(batch);
            checkpointManager.advance(batch);
            flushController.complete(batch);
        } catch (RuntimeException e) {
            log.error("❌ 表 [{}] 批次 ({}, {}] 写入失败，会话即将停止: {}",
                    batch.table(), batch.low(), batch.high(), e.getMessage());
            fatal.compareAndSet(null, e);
        } finally {
            inFlight.remove(batch);
        }
    }

    /**
     * 持久化安全位置并回报源端
     *
     * @param idle  当前没有待读数据，且不在事务中时可以确认到最新收到的位置
     * @param force 位置未变化也发送状态
     */
    private void checkpoint(WalStream stream, boolean idle, boolean force) {
        StreamPosition stored = checkpointManager.load();
        StreamPosition safe = flushController.safePosition(assembler.lastCommitted());
        if (idle && !assembler.inTransaction() && !flushController.hasPending() && stream.lastReceiveLsn() > 0) {
            // 已收到的内容全部处理完，源端此前提交的事务都已落地
            StreamPosition received = StreamPosition.endOf(stream.lastReceiveLsn());
            safe = safe == null ? received : StreamPosition.max(safe, received);
        }
        // 重放的旧事务不能让进度回退
        StreamPosition target = safe == null ? stored : StreamPosition.max(safe, stored);
        boolean advanced = checkpointManager.advanceSession(target);
        if ((advanced || force) && !target.isBeginning()) {
            stream.acknowledge(target.lsn());
        }
    }

    /**
     * 重连前的清理：等待在途批次，写完已提交事务的缓冲，保存进度，丢弃其余缓冲与事务上下文
     */
    private void recover() {
        awaitInFlight();
        flushCommitted();
        StreamPosition safe = flushController.safePosition(assembler.lastCommitted());
        if (safe != null) {
            checkpointManager.advanceSession(StreamPosition.max(safe, checkpointManager.load()));
        }
        flushController.discardBuffers();
        relationCache.clear();
        assembler.reset();
    }

    private void flushCommitted() {
        StreamPosition committed = assembler.lastCommitted();
        if (committed == null) {
            return;
        }
        for (TableId table : flushController.bufferedTables()) {
            Batch batch = flushController.takeCommitted(table, committed);
            if (batch != null) {
                Future<?> future = workers.submit(() -> applyBatch(batch));
                inFlight.put(batch, future);
                if (future.isDone()) {
                    inFlight.remove(batch);
                }
            }
        }
        awaitInFlight();
    }

    private void awaitInFlight() {
        for (Future<?> future : new ArrayList<>(inFlight.values())) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReplicationException("等待在途批次时被中断", e, false);
            } catch (ExecutionException e) {
                fatal.compareAndSet(null, e.getCause());
            }
        }
        checkFatal();
    }

    private void checkFatal() {
        Throwable error = fatal.get();
        if (error == null) {
            return;
        }
        if (error instanceof ReplicationException re && !re.isRetriable()) {
            throw re;
        }
        // 写入线程的异常一律不可重试：写入器自己已经重试过
        throw new ReplicationException(error.getMessage(), error, false);
    }

    private void fail(RuntimeException e) {
        state = SessionState.FAILED;
        lastError = e.getMessage();
        running = false;
        for (Future<?> future : new ArrayList<>(inFlight.values())) {
            try {
                future.get(30, TimeUnit.SECONDS);
            } catch (Exception waitError) {
                e.addSuppressed(waitError);
            }
        }
        log.error("💥 复制会话失败，进度停留在 {}: {}", checkpointManager.load(), e.getMessage(), e);
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    /**
     * 请求停止并等待主循环退出
     */
    public void stop() {
        running = false;
        try {
            if (!finished.await(60, TimeUnit.SECONDS)) {
                log.warn("等待复制会话停止超时");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public SessionState state() {
        return state;
    }

    public String lastError() {
        return lastError;
    }

    public int reconnects() {
        return reconnects.get();
    }

    public long decodedEvents() {
        return decodedEvents.get();
    }

    public List<FlushController.TableStats> tableStats() {
        return flushController.stats();
    }

    public StreamPosition checkpoint() {
        return checkpointManager.load();
    }
}
