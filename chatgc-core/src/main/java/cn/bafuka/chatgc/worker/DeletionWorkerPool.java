package cn.bafuka.chatgc.worker;

import cn.bafuka.chatgc.config.ChatGcProperties;
import cn.bafuka.chatgc.core.DeletionCounters;
import cn.bafuka.chatgc.event.DeletionEvent;
import cn.bafuka.chatgc.event.DeletionEventPublisher;
import cn.bafuka.chatgc.exception.ExternalDeletionException;
import cn.bafuka.chatgc.exception.StoreUnavailableException;
import cn.bafuka.chatgc.model.AbandonReason;
import cn.bafuka.chatgc.model.DeletionResponse;
import cn.bafuka.chatgc.model.DeletionResult;
import cn.bafuka.chatgc.model.DeletionState;
import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.model.PendingDeletion;
import cn.bafuka.chatgc.queue.ExpiryQueue;
import cn.bafuka.chatgc.ratelimit.DeletionRateLimiter;
import cn.bafuka.chatgc.spi.DeletionClient;
import cn.bafuka.chatgc.spi.PendingDeletionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 删除 Worker 池
 * 调度线程把到期记录投递到工作队列，固定数量的 Worker 执行删除并根据结果更新存储
 *
 * 单次尝试流程：
 * 1. SCHEDULED -> IN_FLIGHT（CAS，要求存储中的记录与队列条目属于同一次调度，失败说明已被取消或已重新调度）
 * 2. 获取限流许可，拿不到则回到 SCHEDULED 并按单群组配额的平均间隔延迟重新入队
 * 3. 调用删除客户端
 * 4. 按结果完成、重试或放弃，所有完成写入都以 IN_FLIGHT 为前置条件
 */
@Slf4j
public class DeletionWorkerPool {

    private final PendingDeletionStore store;

    private final StoreOperations storeOperations;

    private final DeletionClient client;

    private final DeletionRateLimiter rateLimiter;

    private final ExpiryQueue queue;

    private final BackoffPolicy backoffPolicy;

    private final DeletionEventPublisher eventPublisher;

    private final DeletionCounters counters;

    private final Clock clock;

    private final ExecutorService executor;

    private final int maxAttempts;

    private final Duration throttleDelay;

    private final Duration maxMessageAge;

    /**
     * 存储不可用时重新入队的延迟
     */
    private final Duration storeRetryDelay;

    public DeletionWorkerPool(PendingDeletionStore store,
                              StoreOperations storeOperations,
                              DeletionClient client,
                              DeletionRateLimiter rateLimiter,
                              ExpiryQueue queue,
                              DeletionEventPublisher eventPublisher,
                              DeletionCounters counters,
                              ChatGcProperties properties,
                              Clock clock) {
        this(store, storeOperations, client, rateLimiter, queue, eventPublisher, counters, properties, clock,
                newExecutor(properties.getWorkerThreads()));
    }

    public DeletionWorkerPool(PendingDeletionStore store,
                              StoreOperations storeOperations,
                              DeletionClient client,
                              DeletionRateLimiter rateLimiter,
                              ExpiryQueue queue,
                              DeletionEventPublisher eventPublisher,
                              DeletionCounters counters,
                              ChatGcProperties properties,
                              Clock clock,
                              ExecutorService executor) {
        this.store = store;
        this.storeOperations = storeOperations;
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.queue = queue;
        this.backoffPolicy = BackoffPolicy.from(properties.getBackoff());
        this.eventPublisher = eventPublisher;
        this.counters = counters;
        this.clock = clock;
        this.executor = executor;
        this.maxAttempts = properties.getMaxAttempts();
        this.throttleDelay = throttleDelay(properties);
        this.maxMessageAge = Duration.ofSeconds(properties.getMaxMessageAgeSeconds());
        this.storeRetryDelay = Duration.ofMillis(properties.getBackoff().getInitialDelayMs());
    }

    /**
     * 本地限流后的重新入队延迟
     * 取 throttleDelayMs 与单群组配额平均间隔（窗口 / 次数）中的较大者，避免积压记录在窗口内反复空转
     */
    static Duration throttleDelay(ChatGcProperties properties) {
        ChatGcProperties.RateLimit rateLimit = properties.getRateLimit();
        long perChatIntervalMs = 0;
        if (rateLimit.getPerChatCount() > 0) {
            perChatIntervalMs = (long) Math.ceil(rateLimit.getPerChatWindowSeconds() * 1000D / rateLimit.getPerChatCount());
        }
        return Duration.ofMillis(Math.max(properties.getThrottleDelayMs(), perChatIntervalMs));
    }

    private static ExecutorService newExecutor(int threads) {
        AtomicInteger index = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread thread = new Thread(r, "chatgc-worker-" + index.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    /**
     * 投递到期记录（不阻塞调度线程）
     *
     * @param record 到期记录
     */
    public void dispatch(PendingDeletion record) {
        try {
            executor.execute(() -> {
                try {
                    process(record);
                } catch (RuntimeException e) {
                    // 记录仍在存储中，重启恢复时会重新调度
                    log.error("删除记录处理异常: key={}", record.getKey(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Worker 池已关闭，记录留待重启恢复: key={}", record.getKey());
        }
    }

    /**
     * 执行一次删除尝试
     *
     * @param record 到期记录
     */
    void process(PendingDeletion record) {
        MessageKey key = record.getKey();
        Instant now = clock.instant();

        if (record.getDueAt() != null && record.getDueAt().isAfter(now)) {
            queue.insert(record);
            return;
        }

        // 0. 超过平台允许删除的时长，直接放弃
        if (record.getPostedAt() != null && record.getPostedAt().plus(maxMessageAge).isBefore(now)) {
            abandon(record, DeletionState.SCHEDULED, record.getAttemptCount(), AbandonReason.TOO_OLD,
                    "message older than " + maxMessageAge);
            return;
        }

        // 1. 标记执行中
        PendingDeletion inFlight = record.toBuilder()
                .state(DeletionState.IN_FLIGHT)
                .updatedAt(now)
                .build();
        boolean marked;
        try {
            marked = storeOperations.call("markInFlight",
                    () -> store.compareAndUpdate(DeletionState.SCHEDULED, inFlight));
        } catch (StoreUnavailableException e) {
            log.warn("存储不可用，延迟重新调度: key={}, delay={}", key, storeRetryDelay);
            queue.insert(record.toBuilder().dueAt(now.plus(storeRetryDelay)).build());
            return;
        }
        if (!marked) {
            log.info("记录已取消、不存在或已重新调度，丢弃队列条目: key={}", key);
            return;
        }

        // 2. 限流
        if (!rateLimiter.tryAcquire(record.getChatId())) {
            counters.throttled();
            PendingDeletion throttled = record.toBuilder()
                    .state(DeletionState.SCHEDULED)
                    .dueAt(now.plus(throttleDelay))
                    .updatedAt(now)
                    .build();
            if (update(DeletionState.IN_FLIGHT, throttled)) {
                queue.insert(throttled);
            }
            return;
        }

        // 3. 调用删除接口
        DeletionResponse response = invoke(record);

        // 4. 按结果处理
        switch (response.getResult()) {
            case SUCCESS:
            case NOT_FOUND:
                complete(record, response.getResult());
                break;
            case RATE_LIMITED:
            case TRANSIENT_ERROR:
                retryOrAbandon(record, response);
                break;
            case PERMISSION_DENIED:
                abandon(record, DeletionState.IN_FLIGHT, record.getAttemptCount() + 1,
                        AbandonReason.PERMISSION_DENIED, response.getDescription());
                break;
            default:
                throw new IllegalStateException("Unknown deletion result: " + response.getResult());
        }
    }

    private DeletionResponse invoke(PendingDeletion record) {
        try {
            log.debug("删除消息: chatId={}, messageId={}, attempt={}",
                    record.getChatId(), record.getMessageId(), record.getAttemptCount() + 1);

            DeletionResponse response = client.deleteMessage(record.getChatId(), record.getMessageId());
            if (response == null || response.getResult() == null) {
                return DeletionResponse.of(DeletionResult.TRANSIENT_ERROR, "empty response");
            }
            return response;

        } catch (ExternalDeletionException e) {
            return DeletionResponse.of(
                    e.isRetryable() ? DeletionResult.TRANSIENT_ERROR : DeletionResult.PERMISSION_DENIED,
                    e.getMessage());

        } catch (RuntimeException e) {
            log.warn("删除客户端异常，按临时错误处理: key={}", record.getKey(), e);
            return DeletionResponse.of(DeletionResult.TRANSIENT_ERROR, e.getMessage());
        }
    }

    private void complete(PendingDeletion record, DeletionResult result) {
        MessageKey key = record.getKey();
        boolean done;
        try {
            PendingDeletion completed = record.toBuilder()
                    .state(DeletionState.DONE)
                    .updatedAt(clock.instant())
                    .build();
            done = storeOperations.call("markDone",
                    () -> store.compareAndUpdate(DeletionState.IN_FLIGHT, completed));
            if (done) {
                storeOperations.call("deleteDone", () -> store.deleteIfState(key, DeletionState.DONE));
            }
        } catch (StoreUnavailableException e) {
            log.error("消息已删除但记录写入失败，重启恢复时将再次尝试: key={}", key, e);
            return;
        }

        if (result == DeletionResult.NOT_FOUND) {
            counters.notFound();
        } else {
            counters.deleted();
        }

        if (done) {
            log.debug("消息删除完成: key={}, result={}", key, result);
        } else {
            log.info("删除期间记录已被取消: key={}, result={}", key, result);
        }
    }

    private void retryOrAbandon(PendingDeletion record, DeletionResponse response) {
        int attempts = record.getAttemptCount() + 1;
        if (attempts >= maxAttempts) {
            abandon(record, DeletionState.IN_FLIGHT, attempts, AbandonReason.RETRIES_EXHAUSTED,
                    response.getDescription());
            return;
        }

        Instant now = clock.instant();
        Duration delay = backoffPolicy.nextDelay(attempts, response.getRetryAfter());
        PendingDeletion retry = record.toBuilder()
                .state(DeletionState.SCHEDULED)
                .attemptCount(attempts)
                .dueAt(now.plus(delay))
                .lastError(response.getResult() + ": " + response.getDescription())
                .updatedAt(now)
                .build();

        if (update(DeletionState.IN_FLIGHT, retry)) {
            counters.retried();
            queue.insert(retry);
            log.info("删除失败，{}ms 后重试: key={}, attempt={}, result={}",
                    delay.toMillis(), record.getKey(), attempts, response.getResult());
        }
    }

    private void abandon(PendingDeletion record, DeletionState expected, int attempts,
                         AbandonReason reason, String detail) {
        PendingDeletion abandoned = record.toBuilder()
                .state(DeletionState.ABANDONED)
                .attemptCount(attempts)
                .lastError(reason.name() + (detail != null ? ": " + detail : ""))
                .updatedAt(clock.instant())
                .build();

        if (!update(expected, abandoned)) {
            return;
        }

        counters.abandoned();
        log.warn("放弃删除消息: key={}, reason={}, attempts={}, detail={}",
                record.getKey(), reason.getDescription(), attempts, detail);
        eventPublisher.publish(DeletionEvent.abandoned(abandoned, reason, detail));
    }

    /**
     * 以 expected 状态为前置条件写入记录
     *
     * @return 写入成功返回 true；记录已被取消或存储不可用返回 false
     */
    private boolean update(DeletionState expected, PendingDeletion record) {
        try {
            boolean updated = storeOperations.call("update",
                    () -> store.compareAndUpdate(expected, record));
            if (!updated) {
                log.info("记录状态已变化（可能已取消），放弃写入: key={}, expected={}", record.getKey(), expected);
            }
            return updated;
        } catch (StoreUnavailableException e) {
            log.error("记录写入失败，重启恢复时将重新调度: key={}, state={}", record.getKey(), record.getState(), e);
            return false;
        }
    }

    /**
     * 关闭 Worker 池，等待执行中的删除完成
     *
     * @param timeout 最长等待时间
     */
    public void shutdown(Duration timeout) {
        log.info("关闭删除 Worker 池...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker 池未在 {}ms 内结束，强制关闭", timeout.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
