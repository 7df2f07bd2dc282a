package cn.bafuka.chatgc.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 待删除记录
 * 每条被调度删除的消息对应一条记录，存储是唯一的事实来源
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingDeletion {

    /**
     * 群组 ID
     */
    private long chatId;

    /**
     * 消息 ID
     */
    private long messageId;

    /**
     * 消息发送时间
     */
    private Instant postedAt;

    /**
     * 删除截止时间（postedAt + ttl），创建后不再修改
     */
    private Instant deadline;

    /**
     * 下一次派发时间，创建时等于 deadline，重试或限流时后移
     */
    private Instant dueAt;

    /**
     * 已尝试次数
     */
    private int attemptCount;

    /**
     * 当前状态
     */
    private DeletionState state;

    /**
     * 最近一次失败原因
     */
    private String lastError;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * 创建一条新的待删除记录
     *
     * @param chatId    群组 ID
     * @param messageId 消息 ID
     * @param postedAt  消息发送时间
     * @param ttl       存活时长
     * @return SCHEDULED 状态的记录
     */
    public static PendingDeletion schedule(long chatId, long messageId, Instant postedAt, Duration ttl) {
        Instant deadline = postedAt.plus(ttl);
        Instant now = Instant.now();
        return PendingDeletion.builder()
                .chatId(chatId)
                .messageId(messageId)
                .postedAt(postedAt)
                .deadline(deadline)
                .dueAt(deadline)
                .attemptCount(0)
                .state(DeletionState.SCHEDULED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public MessageKey getKey() {
        return MessageKey.of(chatId, messageId);
    }

    public boolean isActive() {
        return state != null && state.isActive();
    }

    /**
     * 是否为同一次调度产生的记录
     * 取消后重新调度的消息会生成新记录，createdAt 或 deadline 不同；时间按毫秒比较，与存储精度一致
     *
     * @param other 另一条记录
     * @return 同一消息且 createdAt、deadline 相同返回 true
     */
    public boolean isSameGeneration(PendingDeletion other) {
        return other != null
                && chatId == other.chatId
                && messageId == other.messageId
                && sameMillis(createdAt, other.createdAt)
                && sameMillis(deadline, other.deadline);
    }

    private static boolean sameMillis(Instant a, Instant b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.toEpochMilli() == b.toEpochMilli();
    }
}
