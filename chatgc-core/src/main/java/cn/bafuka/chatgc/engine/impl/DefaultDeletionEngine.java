package cn.bafuka.chatgc.engine.impl;

import cn.bafuka.chatgc.config.ChatGcProperties;
import cn.bafuka.chatgc.core.DeletionCounters;
import cn.bafuka.chatgc.core.DeletionStats;
import cn.bafuka.chatgc.engine.DeletionEngine;
import cn.bafuka.chatgc.event.DeletionEvent;
import cn.bafuka.chatgc.event.DeletionEventPublisher;
import cn.bafuka.chatgc.exception.ConfigurationException;
import cn.bafuka.chatgc.exception.StoreUnavailableException;
import cn.bafuka.chatgc.model.ChatDeletionStatus;
import cn.bafuka.chatgc.model.DeletionState;
import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.model.PendingDeletion;
import cn.bafuka.chatgc.queue.ExpiryQueue;
import cn.bafuka.chatgc.recovery.RecoveryBootstrapper;
import cn.bafuka.chatgc.recovery.RecoveryReport;
import cn.bafuka.chatgc.scheduler.SchedulerLoop;
import cn.bafuka.chatgc.spi.ChatPolicySource;
import cn.bafuka.chatgc.spi.PendingDeletionStore;
import cn.bafuka.chatgc.worker.DeletionWorkerPool;
import cn.bafuka.chatgc.worker.StoreOperations;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 删除引擎默认实现
 * 持有到期队列、调度循环、Worker 池和恢复器，负责它们的生命周期
 */
@Slf4j
public class DefaultDeletionEngine implements DeletionEngine {

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final PendingDeletionStore store;

    private final StoreOperations storeOperations;

    private final ExpiryQueue queue;

    private final DeletionWorkerPool workerPool;

    private final SchedulerLoop schedulerLoop;

    private final RecoveryBootstrapper bootstrapper;

    private final ChatPolicySource policySource;

    private final DeletionEventPublisher eventPublisher;

    private final DeletionCounters counters;

    private final Clock clock;

    /**
     * 允许的最大 TTL
     */
    private final Duration maxTtl;

    /**
     * 是否已初始化
     */
    private volatile boolean initialized = false;

    public DefaultDeletionEngine(PendingDeletionStore store,
                                 StoreOperations storeOperations,
                                 ExpiryQueue queue,
                                 DeletionWorkerPool workerPool,
                                 RecoveryBootstrapper bootstrapper,
                                 ChatPolicySource policySource,
                                 DeletionEventPublisher eventPublisher,
                                 DeletionCounters counters,
                                 ChatGcProperties properties,
                                 Clock clock) {
        this.store = store;
        this.storeOperations = storeOperations;
        this.queue = queue;
        this.workerPool = workerPool;
        this.bootstrapper = bootstrapper;
        this.policySource = policySource;
        this.eventPublisher = eventPublisher;
        this.counters = counters;
        this.clock = clock;
        this.maxTtl = Duration.ofSeconds(properties.getMaxTtlSeconds());
        Duration maxMessageAge = Duration.ofSeconds(properties.getMaxMessageAgeSeconds());
        if (maxTtl.compareTo(maxMessageAge) >= 0) {
            // 到期时消息已超过平台删除时限，这样的 TTL 无法兑现
            throw new ConfigurationException("maxTtlSeconds (" + maxTtl.getSeconds()
                    + ") must be less than maxMessageAgeSeconds (" + maxMessageAge.getSeconds() + ")");
        }
        this.schedulerLoop = new SchedulerLoop(queue, workerPool::dispatch, clock);
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            log.debug("删除引擎已经初始化，跳过");
            return;
        }

        log.info("初始化删除引擎...");

        // 恢复失败直接抛出，进程拒绝启动
        RecoveryReport report = bootstrapper.recover();
        eventPublisher.publish(DeletionEvent.recovered(report.getRecovered(), report.getReset()));

        if (policySource != null) {
            policySource.subscribe(policies ->
                    log.info("群组策略已更新: source={}, chats={}", policySource.getType(), policies.size()));
        }

        schedulerLoop.start();
        initialized = true;
        log.info("删除引擎初始化成功: queueSize={}", queue.size());
    }

    @Override
    public boolean schedule(long chatId, long messageId, Duration ttl) {
        return schedule(chatId, messageId, clock.instant(), ttl);
    }

    @Override
    public boolean schedule(long chatId, long messageId, Instant postedAt, Duration ttl) {
        validateTtl(ttl);
        if (postedAt == null) {
            throw new ConfigurationException("postedAt must not be null");
        }

        PendingDeletion record = PendingDeletion.schedule(chatId, messageId, postedAt, ttl);

        boolean created;
        try {
            created = storeOperations.call("schedule", () -> store.create(record));
        } catch (StoreUnavailableException e) {
            // 删除是后台尽力而为的义务，不向入站调用方抛出
            log.error("调度删除失败，存储不可用: key={}", record.getKey(), e);
            return false;
        }

        if (!created) {
            log.debug("消息已存在活跃的删除记录，忽略: key={}", record.getKey());
            return false;
        }

        if (!queue.insert(record)) {
            // 队列中残留了已取消调度的旧条目，用新记录替换
            log.debug("替换队列中的旧条目: key={}", record.getKey());
            queue.remove(chatId, messageId);
            queue.insert(record);
        }
        counters.scheduled();
        log.debug("已调度删除: key={}, deadline={}", record.getKey(), record.getDeadline());
        return true;
    }

    @Override
    public boolean onMessage(long chatId, long messageId, Instant postedAt) {
        Optional<Duration> ttl = policySource != null ? policySource.getTtl(chatId) : Optional.empty();
        if (!ttl.isPresent()) {
            return false;
        }

        try {
            return schedule(chatId, messageId, postedAt, ttl.get());
        } catch (ConfigurationException e) {
            log.error("群组策略非法，忽略消息: chatId={}, ttl={}, error={}", chatId, ttl.get(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean cancel(long chatId, long messageId) {
        MessageKey key = MessageKey.of(chatId, messageId);
        queue.remove(chatId, messageId);

        boolean cancelled = cancelInStore(key);
        if (cancelled) {
            counters.cancelled(1);
            log.info("已取消删除: key={}", key);
        }
        return cancelled;
    }

    @Override
    public int cancelChat(long chatId) {
        log.info("取消群组全部待删除记录: chatId={}", chatId);
        queue.removeChat(chatId);

        List<PendingDeletion> records = storeOperations.call("cancelChat.find", () -> store.findByChat(chatId));
        int cancelled = 0;
        for (PendingDeletion record : records) {
            if (record.isActive() && cancelInStore(record.getKey())) {
                cancelled++;
            }
        }

        counters.cancelled(cancelled);
        log.info("群组取消完成: chatId={}, cancelled={}", chatId, cancelled);
        return cancelled;
    }

    /**
     * 以 CAS 将活跃记录置为 CANCELLED 后删除
     * IN_FLIGHT 记录被取消后，Worker 的完成写入会因状态不符而失败，不会复活记录
     */
    private boolean cancelInStore(MessageKey key) {
        boolean cancelled = storeOperations.call("cancel",
                () -> store.compareAndSwapState(key, DeletionState.SCHEDULED, DeletionState.CANCELLED));
        if (!cancelled) {
            cancelled = storeOperations.call("cancel",
                    () -> store.compareAndSwapState(key, DeletionState.IN_FLIGHT, DeletionState.CANCELLED));
        }
        if (cancelled) {
            storeOperations.call("cancel.delete", () -> store.deleteIfState(key, DeletionState.CANCELLED));
        }
        return cancelled;
    }

    @Override
    public int retryAbandoned(long chatId, Integer maxAttempts) {
        log.info("重新调度被放弃的删除: chatId={}, maxAttempts={}", chatId, maxAttempts);

        Instant now = clock.instant();
        List<PendingDeletion> records = storeOperations.call("retry.find", () -> store.findByChat(chatId));

        int retried = 0;
        for (PendingDeletion record : records) {
            if (record.getState() != DeletionState.ABANDONED) {
                continue;
            }
            if (maxAttempts != null && record.getAttemptCount() > maxAttempts) {
                continue;
            }

            PendingDeletion rescheduled = record.toBuilder()
                    .state(DeletionState.SCHEDULED)
                    .dueAt(now)
                    .updatedAt(now)
                    .build();

            if (storeOperations.call("retry.update",
                    () -> store.compareAndUpdate(DeletionState.ABANDONED, rescheduled))) {
                queue.insert(rescheduled);
                retried++;
            }
        }

        log.info("重新调度完成: chatId={}, retried={}", chatId, retried);
        return retried;
    }

    @Override
    public ChatDeletionStatus status(long chatId) {
        List<PendingDeletion> records = storeOperations.call("status.find", () -> store.findByChat(chatId));

        long scheduled = 0;
        long inFlight = 0;
        long abandoned = 0;
        Instant nextDueAt = null;

        for (PendingDeletion record : records) {
            switch (record.getState()) {
                case SCHEDULED:
                    scheduled++;
                    if (nextDueAt == null || record.getDueAt().isBefore(nextDueAt)) {
                        nextDueAt = record.getDueAt();
                    }
                    break;
                case IN_FLIGHT:
                    inFlight++;
                    break;
                case ABANDONED:
                    abandoned++;
                    break;
                default:
                    break;
            }
        }

        return ChatDeletionStatus.builder()
                .chatId(chatId)
                .ttl(policySource != null ? policySource.getTtl(chatId).orElse(null) : null)
                .scheduledCount(scheduled)
                .inFlightCount(inFlight)
                .abandonedCount(abandoned)
                .nextDueAt(nextDueAt)
                .build();
    }

    @Override
    public DeletionStats stats() {
        return counters.snapshot(queue.size());
    }

    @Override
    public synchronized void shutdown() {
        if (!initialized) {
            return;
        }

        log.info("关闭删除引擎...");
        schedulerLoop.stop(SHUTDOWN_TIMEOUT);
        workerPool.shutdown(SHUTDOWN_TIMEOUT);
        if (policySource != null) {
            policySource.shutdown();
        }
        initialized = false;
        log.info("删除引擎已关闭");
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * 到期队列（用于诊断和测试）
     */
    public ExpiryQueue getQueue() {
        return queue;
    }

    private void validateTtl(Duration ttl) {
        if (ttl == null) {
            throw new ConfigurationException("TTL must not be null");
        }
        if (ttl.isNegative()) {
            throw new ConfigurationException("TTL must not be negative: " + ttl);
        }
        if (ttl.compareTo(maxTtl) > 0) {
            throw new ConfigurationException("TTL " + ttl.getSeconds() + "s exceeds maximum of "
                    + maxTtl.getSeconds() + "s");
        }
    }
}
