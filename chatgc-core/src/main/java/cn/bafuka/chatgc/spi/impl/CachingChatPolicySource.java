package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.spi.ChatPolicySource;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 带本地缓存的策略源装饰器
 * 每条消息入站都会查询策略，使用 Caffeine 缓存查询结果，策略变更时整体失效
 */
@Slf4j
public class CachingChatPolicySource implements ChatPolicySource {

    private final ChatPolicySource delegate;

    /**
     * 策略缓存
     * Key: chatId
     * Value: TTL（未启用为 empty）
     */
    private final Cache<Long, Optional<Duration>> cache;

    public CachingChatPolicySource(ChatPolicySource delegate, int cacheSeconds) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheSeconds, TimeUnit.SECONDS)
                .maximumSize(100000)
                .recordStats()
                .build();
        log.info("构建群组策略缓存: source={}, cacheSeconds={}", delegate.getType(), cacheSeconds);
    }

    @Override
    public Optional<Duration> getTtl(long chatId) {
        return cache.get(chatId, delegate::getTtl);
    }

    @Override
    public void subscribe(Consumer<Map<Long, Duration>> listener) {
        delegate.subscribe(policies -> {
            cache.invalidateAll();
            log.debug("群组策略变更，缓存已清空");
            if (listener != null) {
                listener.accept(policies);
            }
        });
    }

    @Override
    public void shutdown() {
        cache.invalidateAll();
        delegate.shutdown();
    }

    @Override
    public String getType() {
        return delegate.getType();
    }

    /**
     * 缓存命中率（用于监控）
     *
     * @return 命中率（0.0 ~ 1.0）
     */
    public double hitRate() {
        return cache.stats().hitRate();
    }
}
