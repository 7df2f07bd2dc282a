package cn.bafuka.chatgc.ratelimit;

/**
 * 删除调用限流器接口
 * 同时受全局配额和单群组配额约束，两者都有余量时才放行
 */
public interface DeletionRateLimiter {

    /**
     * 尝试获取一次删除调用许可（非阻塞）
     *
     * @param chatId 群组 ID
     * @return 获取成功返回 true
     */
    boolean tryAcquire(long chatId);

    /**
     * 更新限流规则
     *
     * @param globalQps            全局 QPS 上限
     * @param perChatCount         单群组窗口内调用上限
     * @param perChatWindowSeconds 单群组统计窗口（秒）
     */
    void updateRules(double globalQps, double perChatCount, int perChatWindowSeconds);
}
