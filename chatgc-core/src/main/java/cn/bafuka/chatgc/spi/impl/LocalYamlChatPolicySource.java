package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.config.ChatGcProperties;
import cn.bafuka.chatgc.spi.ChatPolicySource;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 本地 YAML 策略源实现
 * 从 Spring Boot 配置文件 chatgc.policy.chats 读取群组 TTL
 */
@Slf4j
public class LocalYamlChatPolicySource implements ChatPolicySource {

    /**
     * ChatGC 配置属性
     */
    private final ChatGcProperties properties;

    /**
     * 策略监听器
     */
    private Consumer<Map<Long, Duration>> listener;

    public LocalYamlChatPolicySource(ChatGcProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<Duration> getTtl(long chatId) {
        return Optional.ofNullable(currentPolicies().get(chatId));
    }

    @Override
    public void subscribe(Consumer<Map<Long, Duration>> listener) {
        this.listener = listener;

        // 本地策略源只在启动时加载一次
        Map<Long, Duration> policies = currentPolicies();
        if (listener != null && !policies.isEmpty()) {
            listener.accept(policies);
        }

        log.info("已加载 {} 条本地群组策略", policies.size());
    }

    @Override
    public void shutdown() {
        log.info("关闭 LocalYamlChatPolicySource");
        listener = null;
    }

    @Override
    public String getType() {
        return "local";
    }

    private Map<Long, Duration> currentPolicies() {
        if (properties == null || properties.getPolicy() == null || properties.getPolicy().getChats() == null) {
            return Collections.emptyMap();
        }

        Map<Long, Duration> policies = new LinkedHashMap<>();
        for (Map.Entry<Long, Long> entry : properties.getPolicy().getChats().entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                continue;
            }
            policies.put(entry.getKey(), Duration.ofSeconds(entry.getValue()));
        }
        return policies;
    }
}
