package cn.bafuka.chatgc.queue;

import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.model.PendingDeletion;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 到期队列接口
 * 按 dueAt 排序的内存优先队列，是存储的可重建缓存
 * insert 可由入站线程并发调用，popDue / awaitNextDue 只由调度线程调用
 */
public interface ExpiryQueue {

    /**
     * 插入记录，同一消息已在队列中时拒绝
     *
     * @param record 记录
     * @return 插入成功返回 true
     */
    boolean insert(PendingDeletion record);

    /**
     * 取出所有 dueAt <= now 的记录（按 dueAt 升序）
     *
     * @param now 当前时间
     * @return 到期记录
     */
    List<PendingDeletion> popDue(Instant now);

    /**
     * 查看最早的到期时间
     *
     * @return 最早的 dueAt，队列为空时返回 empty
     */
    Optional<Instant> peekNextDeadline();

    /**
     * 移除单条记录
     *
     * @param chatId    群组 ID
     * @param messageId 消息 ID
     * @return 记录存在并被移除返回 true
     */
    boolean remove(long chatId, long messageId);

    /**
     * 移除群组的全部记录
     *
     * @param chatId 群组 ID
     * @return 被移除的消息
     */
    List<MessageKey> removeChat(long chatId);

    /**
     * 阻塞直到队首到期、有更早的记录插入、被唤醒或超过 maxWait
     *
     * @param maxWait 最长等待时间
     * @throws InterruptedException 线程被中断
     */
    void awaitNextDue(Duration maxWait) throws InterruptedException;

    /**
     * 唤醒等待中的调度线程
     */
    void wakeUp();

    boolean contains(MessageKey key);

    int size();

    /**
     * 队列快照（按 dueAt 升序，用于诊断和测试）
     *
     * @return 记录列表
     */
    List<PendingDeletion> snapshot();
}
