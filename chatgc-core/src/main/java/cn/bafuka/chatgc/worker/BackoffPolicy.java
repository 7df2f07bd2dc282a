package cn.bafuka.chatgc.worker;

import cn.bafuka.chatgc.config.ChatGcProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 重试退避策略
 * 指数退避 + 均等抖动：delay = base / 2 + random(0, base / 2)，base = initial * multiplier^(attempt - 1)，上限为 maxDelay
 */
public class BackoffPolicy {

    private final long initialDelayMs;

    private final double multiplier;

    private final long maxDelayMs;

    public BackoffPolicy(long initialDelayMs, double multiplier, long maxDelayMs) {
        if (initialDelayMs <= 0 || multiplier < 1.0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("Invalid backoff: initialDelayMs=" + initialDelayMs
                    + ", multiplier=" + multiplier + ", maxDelayMs=" + maxDelayMs);
        }
        this.initialDelayMs = initialDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
    }

    public static BackoffPolicy from(ChatGcProperties.Backoff config) {
        return new BackoffPolicy(config.getInitialDelayMs(), config.getMultiplier(), config.getMaxDelayMs());
    }

    /**
     * 计算第 attempt 次失败后的等待时间
     *
     * @param attempt    已失败次数（从 1 开始）
     * @param retryAfter 平台建议的等待时间，可为 null
     * @return 等待时间，始终大于 0
     */
    public Duration nextDelay(int attempt, Duration retryAfter) {
        long base = baseDelayMs(attempt);
        long half = Math.max(1, base / 2);
        long jittered = half + ThreadLocalRandom.current().nextLong(half + 1);

        Duration delay = Duration.ofMillis(jittered);
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            return retryAfter;
        }
        return delay;
    }

    /**
     * 不含抖动的基础延迟
     *
     * @param attempt 已失败次数（从 1 开始）
     * @return 毫秒
     */
    long baseDelayMs(int attempt) {
        double delay = initialDelayMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, maxDelayMs);
    }
}
