package cn.bafuka.chatgc.event;

import cn.bafuka.chatgc.model.AbandonReason;
import cn.bafuka.chatgc.model.PendingDeletion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 删除事件（供运维观测）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionEvent {

    /**
     * 事件类型
     */
    private EventType type;

    private long chatId;

    private long messageId;

    private int attemptCount;

    /**
     * 放弃原因（仅 ABANDONED 事件）
     */
    private AbandonReason reason;

    /**
     * 平台返回的错误描述
     */
    private String detail;

    /**
     * 截止时间（毫秒时间戳）
     */
    private long deadline;

    /**
     * 事件时间（毫秒时间戳）
     */
    private long timestamp;

    /**
     * 创建放弃事件
     */
    public static DeletionEvent abandoned(PendingDeletion record, AbandonReason reason, String detail) {
        return DeletionEvent.builder()
                .type(EventType.ABANDONED)
                .chatId(record.getChatId())
                .messageId(record.getMessageId())
                .attemptCount(record.getAttemptCount())
                .reason(reason)
                .detail(detail)
                .deadline(record.getDeadline() != null ? record.getDeadline().toEpochMilli() : 0L)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    /**
     * 创建恢复完成事件
     */
    public static DeletionEvent recovered(int recovered, int reset) {
        return DeletionEvent.builder()
                .type(EventType.RECOVERED)
                .attemptCount(0)
                .detail("recovered=" + recovered + ", reset=" + reset)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    /**
     * 事件类型枚举
     */
    public enum EventType {
        /**
         * 删除被放弃
         */
        ABANDONED,

        /**
         * 启动恢复完成
         */
        RECOVERED
    }
}
