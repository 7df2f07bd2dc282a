package cn.bafuka.chatgc.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 单个群组的删除状态概览
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatDeletionStatus {

    private long chatId;

    /**
     * 群组当前 TTL，null 表示未启用
     */
    private Duration ttl;

    private long scheduledCount;

    private long inFlightCount;

    private long abandonedCount;

    /**
     * 最早的下一次删除时间，无待删除记录时为 null
     */
    private Instant nextDueAt;
}
