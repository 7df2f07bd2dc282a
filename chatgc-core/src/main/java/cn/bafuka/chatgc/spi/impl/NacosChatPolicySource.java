package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.spi.ChatPolicySource;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.nacos.api.NacosFactory;
import com.alibaba.nacos.api.config.ConfigService;
import com.alibaba.nacos.api.config.listener.Listener;
import com.alibaba.nacos.api.exception.NacosException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Nacos 策略源适配器实现
 * 配置内容为 JSON 对象：{"-100123": 3600, "-100456": 600}，值为 TTL 秒数
 */
@Slf4j
public class NacosChatPolicySource implements ChatPolicySource {

    /**
     * Nacos 服务地址
     */
    private final String serverAddr;

    /**
     * Nacos 命名空间
     */
    private final String namespace;

    /**
     * Nacos DataId
     */
    private final String dataId;

    /**
     * Nacos Group
     */
    private final String group;

    /**
     * Nacos ConfigService
     */
    private ConfigService configService;

    /**
     * 最近一次解析成功的策略
     */
    private volatile Map<Long, Duration> policies = Collections.emptyMap();

    /**
     * 策略监听器
     */
    private Consumer<Map<Long, Duration>> listener;

    /**
     * Nacos 内部监听器
     */
    private NacosListener nacosListener;

    public NacosChatPolicySource(String serverAddr, String namespace, String dataId, String group) {
        this.serverAddr = serverAddr;
        this.namespace = namespace;
        this.dataId = dataId;
        this.group = group;
    }

    /**
     * 使用已创建的 ConfigService（测试或复用连接时使用）
     */
    NacosChatPolicySource(ConfigService configService, String dataId, String group) {
        this(null, null, dataId, group);
        this.configService = configService;
    }

    @Override
    public Optional<Duration> getTtl(long chatId) {
        return Optional.ofNullable(policies.get(chatId));
    }

    @Override
    public void subscribe(Consumer<Map<Long, Duration>> listener) {
        this.listener = listener;

        try {
            if (configService == null) {
                Properties properties = new Properties();
                properties.put("serverAddr", serverAddr);
                if (namespace != null && !namespace.isEmpty()) {
                    properties.put("namespace", namespace);
                }
                configService = NacosFactory.createConfigService(properties);
            }

            // 初次加载配置
            String config = configService.getConfig(dataId, group, 5000);
            handleConfigChange(config);

            // 添加监听器
            nacosListener = new NacosListener();
            configService.addListener(dataId, group, nacosListener);

            log.info("已订阅 Nacos 群组策略: serverAddr={}, namespace={}, dataId={}, group={}",
                    serverAddr, namespace, dataId, group);

        } catch (NacosException e) {
            log.error("订阅 Nacos 群组策略失败", e);
            throw new IllegalStateException("Failed to subscribe to Nacos chat policies", e);
        }
    }

    @Override
    public void shutdown() {
        if (configService != null && nacosListener != null) {
            configService.removeListener(dataId, group, nacosListener);
            log.info("已关闭 NacosChatPolicySource");
        }
    }

    @Override
    public String getType() {
        return "nacos";
    }

    /**
     * 处理配置变更
     *
     * @param config 配置内容
     */
    void handleConfigChange(String config) {
        if (config == null || config.trim().isEmpty()) {
            log.warn("Nacos 群组策略为空");
            policies = Collections.emptyMap();
        } else {
            Map<Long, Duration> parsed = parseConfig(config);
            if (parsed == null) {
                // 解析失败时保留上一次的策略
                return;
            }
            policies = parsed;
            log.info("从 Nacos 解析到 {} 条群组策略", parsed.size());
        }

        if (listener != null) {
            listener.accept(policies);
        }
    }

    /**
     * 解析配置
     *
     * @param config JSON 配置字符串
     * @return chatId -> TTL 映射，解析失败返回 null
     */
    private Map<Long, Duration> parseConfig(String config) {
        try {
            JSONObject json = JSON.parseObject(config);
            Map<Long, Duration> result = new LinkedHashMap<>();
            for (String chatId : json.keySet()) {
                Long seconds = json.getLong(chatId);
                if (seconds == null || seconds < 0) {
                    continue;
                }
                result.put(Long.parseLong(chatId.trim()), Duration.ofSeconds(seconds));
            }
            return Collections.unmodifiableMap(result);
        } catch (RuntimeException e) {
            log.error("解析 Nacos 群组策略失败: {}", config, e);
            return null;
        }
    }

    /**
     * Nacos 监听器实现
     */
    private class NacosListener implements Listener {

        @Override
        public void receiveConfigInfo(String configInfo) {
            log.info("收到 Nacos 群组策略变更, length={}", configInfo != null ? configInfo.length() : 0);
            handleConfigChange(configInfo);
        }

        @Override
        public Executor getExecutor() {
            // 返回 null 使用默认线程池
            return null;
        }
    }
}
