package cn.bafuka.chatgc.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 引擎运行统计信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionStats {

    private long scheduledCount;
    private long deletedCount;
    private long notFoundCount;
    private long retriedCount;
    private long throttledCount;
    private long abandonedCount;
    private long cancelledCount;
    private int queueSize;

    /**
     * 计算删除成功率
     *
     * @return 成功率（0.0 ~ 1.0）
     */
    public double successRate() {
        long finished = deletedCount + notFoundCount + abandonedCount;
        return finished == 0 ? 1.0 : (double) (deletedCount + notFoundCount) / finished;
    }
}
