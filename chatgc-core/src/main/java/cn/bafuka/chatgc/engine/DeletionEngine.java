package cn.bafuka.chatgc.engine;

import cn.bafuka.chatgc.core.DeletionStats;
import cn.bafuka.chatgc.model.ChatDeletionStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * 消息过期删除引擎
 * 入站层和配置层通过该接口调度、取消删除
 */
public interface DeletionEngine {

    /**
     * 初始化引擎：恢复存储中的记录，启动调度线程和 Worker 池
     */
    void initialize();

    /**
     * 调度删除（消息发送时间取当前时间）
     *
     * @param chatId    群组 ID
     * @param messageId 消息 ID
     * @param ttl       存活时长
     * @return 新建调度返回 true，重复调度返回 false
     * @throws cn.bafuka.chatgc.exception.ConfigurationException TTL 非法
     */
    boolean schedule(long chatId, long messageId, Duration ttl);

    /**
     * 调度删除
     *
     * @param chatId    群组 ID
     * @param messageId 消息 ID
     * @param postedAt  消息发送时间
     * @param ttl       存活时长
     * @return 新建调度返回 true，重复调度返回 false
     * @throws cn.bafuka.chatgc.exception.ConfigurationException TTL 非法
     */
    boolean schedule(long chatId, long messageId, Instant postedAt, Duration ttl);

    /**
     * 处理新消息：群组启用了 TTL 策略时调度删除
     *
     * @param chatId    群组 ID
     * @param messageId 消息 ID
     * @param postedAt  消息发送时间
     * @return 调度成功返回 true
     */
    boolean onMessage(long chatId, long messageId, Instant postedAt);

    /**
     * 取消单条消息的删除（消息已被手动删除等）
     *
     * @param chatId    群组 ID
     * @param messageId 消息 ID
     * @return 存在活跃记录并被取消返回 true
     */
    boolean cancel(long chatId, long messageId);

    /**
     * 取消群组全部待删除记录（群组停用 TTL 策略时）
     *
     * @param chatId 群组 ID
     * @return 取消数量
     */
    int cancelChat(long chatId);

    /**
     * 重新调度群组中被放弃的记录
     *
     * @param chatId      群组 ID
     * @param maxAttempts 只重试尝试次数不超过该值的记录，null 表示全部
     * @return 重新调度数量
     */
    int retryAbandoned(long chatId, Integer maxAttempts);

    /**
     * 查询群组删除状态
     *
     * @param chatId 群组 ID
     * @return 状态概览
     */
    ChatDeletionStatus status(long chatId);

    /**
     * 引擎统计信息
     *
     * @return 统计信息
     */
    DeletionStats stats();

    /**
     * 关闭引擎
     */
    void shutdown();
}
