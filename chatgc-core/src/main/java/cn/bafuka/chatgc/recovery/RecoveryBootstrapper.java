package cn.bafuka.chatgc.recovery;

import cn.bafuka.chatgc.exception.ChatGcStartupException;
import cn.bafuka.chatgc.exception.StoreUnavailableException;
import cn.bafuka.chatgc.model.DeletionState;
import cn.bafuka.chatgc.model.PendingDeletion;
import cn.bafuka.chatgc.queue.ExpiryQueue;
import cn.bafuka.chatgc.spi.PendingDeletionStore;
import cn.bafuka.chatgc.worker.StoreOperations;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * 启动恢复
 * 从存储读取全部 SCHEDULED / IN_FLIGHT 记录重建到期队列：
 * IN_FLIGHT 视为删除中途崩溃，重置为 SCHEDULED（至少一次语义，重复删除会得到 NOT_FOUND，按成功处理）
 * 记录按存储中的 dueAt 入队，不以重启时间重新计算
 */
@Slf4j
public class RecoveryBootstrapper {

    private final PendingDeletionStore store;

    private final StoreOperations storeOperations;

    private final ExpiryQueue queue;

    private final Clock clock;

    /**
     * 平台允许删除的最大时长，超过该时长的 ABANDONED 记录会被清理
     */
    private final Duration maxMessageAge;

    public RecoveryBootstrapper(PendingDeletionStore store,
                                StoreOperations storeOperations,
                                ExpiryQueue queue,
                                Clock clock,
                                Duration maxMessageAge) {
        this.store = store;
        this.storeOperations = storeOperations;
        this.queue = queue;
        this.clock = clock;
        this.maxMessageAge = maxMessageAge;
    }

    /**
     * 执行恢复
     *
     * @return 恢复结果
     * @throws ChatGcStartupException 存储不可用
     */
    public RecoveryReport recover() {
        log.info("开始恢复待删除记录: store={}", store.getType());

        try {
            List<PendingDeletion> active = storeOperations.call("recover.getAll",
                    () -> store.getAll(EnumSet.of(DeletionState.SCHEDULED, DeletionState.IN_FLIGHT)));

            int recovered = 0;
            int reset = 0;

            for (PendingDeletion record : active) {
                if (record.getState() == DeletionState.IN_FLIGHT) {
                    boolean swapped = storeOperations.call("recover.reset",
                            () -> store.compareAndSwapState(record.getKey(),
                                    DeletionState.IN_FLIGHT, DeletionState.SCHEDULED));
                    if (!swapped) {
                        log.warn("重置 IN_FLIGHT 记录失败，状态已变化: key={}", record.getKey());
                        continue;
                    }
                    record.setState(DeletionState.SCHEDULED);
                    reset++;
                }

                if (record.getDueAt() == null) {
                    record.setDueAt(record.getDeadline());
                }

                if (queue.insert(record)) {
                    recovered++;
                }
            }

            int purged = purgeUnreachable();

            RecoveryReport report = new RecoveryReport(recovered, reset, purged);
            log.info("恢复完成: recovered={}, reset={}, purged={}", recovered, reset, purged);
            return report;

        } catch (StoreUnavailableException e) {
            throw new ChatGcStartupException("Pending deletion store unavailable during recovery", e);
        }
    }

    /**
     * 清理已超过平台删除时限的 ABANDONED 记录
     *
     * @return 清理数量
     */
    private int purgeUnreachable() {
        Instant threshold = clock.instant().minus(maxMessageAge);
        List<PendingDeletion> abandoned = storeOperations.call("recover.getAbandoned",
                () -> store.getAll(EnumSet.of(DeletionState.ABANDONED)));

        int purged = 0;
        for (PendingDeletion record : abandoned) {
            if (record.getPostedAt() != null && record.getPostedAt().isBefore(threshold)) {
                if (storeOperations.call("recover.purge", () -> store.delete(record.getKey()))) {
                    purged++;
                }
            }
        }
        return purged;
    }
}
