package cn.bafuka.chatgc.spi;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 群组 TTL 策略源 SPI（只读）
 * 用于对接不同的配置来源（本地配置、Nacos 等）
 */
public interface ChatPolicySource {

    /**
     * 查询群组 TTL
     *
     * @param chatId 群组 ID
     * @return TTL，未启用时返回 empty
     */
    Optional<Duration> getTtl(long chatId);

    /**
     * 订阅策略变更
     *
     * @param listener 监听器，接收完整的 chatId -> ttl 映射
     */
    void subscribe(Consumer<Map<Long, Duration>> listener);

    /**
     * 停止订阅
     */
    void shutdown();

    /**
     * 策略源类型标识
     *
     * @return 类型名称（如 "local", "nacos"）
     */
    String getType();
}
