package cn.bafuka.chatgc.core;

import java.util.concurrent.atomic.LongAdder;

/**
 * 引擎内部计数器，由 Worker 和引擎共享
 */
public class DeletionCounters {

    private final LongAdder scheduled = new LongAdder();
    private final LongAdder deleted = new LongAdder();
    private final LongAdder notFound = new LongAdder();
    private final LongAdder retried = new LongAdder();
    private final LongAdder throttled = new LongAdder();
    private final LongAdder abandoned = new LongAdder();
    private final LongAdder cancelled = new LongAdder();

    public void scheduled() {
        scheduled.increment();
    }

    public void deleted() {
        deleted.increment();
    }

    public void notFound() {
        notFound.increment();
    }

    public void retried() {
        retried.increment();
    }

    public void throttled() {
        throttled.increment();
    }

    public void abandoned() {
        abandoned.increment();
    }

    public void cancelled(int count) {
        cancelled.add(count);
    }

    /**
     * 生成统计快照
     *
     * @param queueSize 当前队列长度
     * @return 统计信息
     */
    public DeletionStats snapshot(int queueSize) {
        return DeletionStats.builder()
                .scheduledCount(scheduled.sum())
                .deletedCount(deleted.sum())
                .notFoundCount(notFound.sum())
                .retriedCount(retried.sum())
                .throttledCount(throttled.sum())
                .abandonedCount(abandoned.sum())
                .cancelledCount(cancelled.sum())
                .queueSize(queueSize)
                .build();
    }
}
