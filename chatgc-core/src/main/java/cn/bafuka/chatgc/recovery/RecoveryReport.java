package cn.bafuka.chatgc.recovery;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 启动恢复结果
 */
@Data
@AllArgsConstructor
public class RecoveryReport {

    /**
     * 重新进入到期队列的记录数
     */
    private int recovered;

    /**
     * 从 IN_FLIGHT 重置为 SCHEDULED 的记录数
     */
    private int reset;

    /**
     * 清理的过期 ABANDONED 记录数
     */
    private int purged;
}
