package cn.bafuka.chatgc.scheduler;

import cn.bafuka.chatgc.model.PendingDeletion;
import cn.bafuka.chatgc.queue.ExpiryQueue;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * 调度循环
 * 单线程：取出到期记录投递给 Worker 池，然后睡眠到下一个到期时间或被新插入的更早记录唤醒
 * 调度线程不做任何删除 I/O
 */
@Slf4j
public class SchedulerLoop implements Runnable {

    /**
     * 队列为空时的最长睡眠时间
     */
    private static final Duration IDLE_WAIT = Duration.ofMinutes(1);

    private final ExpiryQueue queue;

    /**
     * 到期记录的投递目标（Worker 池）
     */
    private final Consumer<PendingDeletion> dispatcher;

    private final Clock clock;

    private volatile boolean running = false;

    private Thread thread;

    public SchedulerLoop(ExpiryQueue queue, Consumer<PendingDeletion> dispatcher, Clock clock) {
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * 启动调度线程
     */
    public synchronized void start() {
        if (running) {
            log.warn("调度循环已经启动");
            return;
        }

        running = true;
        thread = new Thread(this, "chatgc-scheduler");
        thread.setDaemon(true);
        thread.start();
        log.info("调度循环已启动, queueSize={}", queue.size());
    }

    @Override
    public void run() {
        while (running) {
            try {
                tick();
                queue.awaitNextDue(IDLE_WAIT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("调度循环异常", e);
            }
        }
        log.info("调度循环已退出");
    }

    /**
     * 取出并投递当前所有到期记录
     *
     * @return 投递数量
     */
    int tick() {
        List<PendingDeletion> due = queue.popDue(clock.instant());
        for (PendingDeletion record : due) {
            dispatcher.accept(record);
        }
        if (!due.isEmpty()) {
            log.debug("投递 {} 条到期记录", due.size());
        }
        return due.size();
    }

    /**
     * 停止调度线程
     *
     * @param timeout 最长等待时间
     */
    public synchronized void stop(Duration timeout) {
        if (!running) {
            return;
        }

        log.info("停止调度循环...");
        running = false;
        queue.wakeUp();
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }
}
