package cn.bafuka.chatgc.worker;

import cn.bafuka.chatgc.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * 存储访问层重试
 * 存储不可用时按指数退避重试，不计入删除尝试次数
 */
@Slf4j
public class StoreOperations {

    /**
     * 单次重试等待上限（毫秒）
     */
    private static final long MAX_RETRY_DELAY_MS = 2000;

    private final int maxRetries;

    private final long retryDelayMs;

    public StoreOperations(int maxRetries, long retryDelayMs) {
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
    }

    /**
     * 执行存储操作，失败时重试
     *
     * @param operation 操作名称（用于日志）
     * @param action    存储操作
     * @return 操作结果
     * @throws StoreUnavailableException 重试耗尽后仍然失败
     */
    public <T> T call(String operation, Supplier<T> action) {
        int retryCount = 0;
        long delayMs = retryDelayMs;

        while (true) {
            try {
                return action.get();
            } catch (StoreUnavailableException e) {
                if (retryCount >= maxRetries) {
                    log.error("存储操作重试耗尽: operation={}, retries={}", operation, retryCount, e);
                    throw e;
                }

                retryCount++;
                log.warn("存储操作失败，{}ms 后重试: operation={}, retry={}, error={}",
                        delayMs, operation, retryCount, e.getMessage());

                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }

                // 指数退避
                delayMs = Math.min(delayMs * 2, MAX_RETRY_DELAY_MS);
            }
        }
    }

    /**
     * 执行无返回值的存储操作
     *
     * @param operation 操作名称
     * @param action    存储操作
     */
    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
