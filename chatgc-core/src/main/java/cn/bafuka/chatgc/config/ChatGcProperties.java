package cn.bafuka.chatgc.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ChatGC 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "chatgc")
public class ChatGcProperties {

    /**
     * 是否启用 ChatGC
     */
    private boolean enabled = true;

    /**
     * 删除 Worker 线程数
     */
    private int workerThreads = 4;

    /**
     * 单条记录最大删除尝试次数
     */
    private int maxAttempts = 5;

    /**
     * 允许的最大 TTL（秒）
     * 必须小于 maxMessageAgeSeconds，否则记录到期时消息已无法删除，引擎启动时校验；
     * 默认值比平台时限少 10 分钟，留给限流和重试
     */
    private long maxTtlSeconds = 172200;

    /**
     * 平台允许删除的最大消息时长（秒），Telegram 为 48 小时
     */
    private long maxMessageAgeSeconds = 172800;

    /**
     * 本地限流拒绝后的最小重新入队延迟（毫秒）
     * 实际延迟取该值与单群组配额平均间隔（perChatWindowSeconds / perChatCount）中的较大者
     */
    private long throttleDelayMs = 200;

    /**
     * 放弃删除事件的 RocketMQ Topic
     */
    private String eventTopic = "chatgc-deletion-events";

    private Backoff backoff = new Backoff();

    private RateLimit rateLimit = new RateLimit();

    private Store store = new Store();

    private Policy policy = new Policy();

    private Telegram telegram = new Telegram();

    /**
     * 重试退避配置
     */
    @Data
    public static class Backoff {
        /**
         * 首次重试延迟（毫秒）
         */
        private long initialDelayMs = 1000;

        /**
         * 退避倍数
         */
        private double multiplier = 2.0;

        /**
         * 最大延迟（毫秒）
         */
        private long maxDelayMs = 60000;
    }

    /**
     * 限流配置（Sentinel）
     */
    @Data
    public static class RateLimit {
        /**
         * 全局 QPS 上限
         */
        private double globalQps = 30;

        /**
         * 单个群组在统计窗口内的调用上限
         */
        private double perChatCount = 20;

        /**
         * 单个群组统计窗口（秒）
         */
        private int perChatWindowSeconds = 60;
    }

    /**
     * 存储配置
     */
    @Data
    public static class Store {
        /**
         * 存储类型：redis / memory
         */
        private String type = "redis";

        /**
         * Redis 键前缀
         */
        private String keyPrefix = "chatgc:";

        /**
         * 存储操作失败后的最大重试次数
         */
        private int maxRetries = 3;

        /**
         * 存储重试初始延迟（毫秒）
         */
        private long retryDelayMs = 100;
    }

    /**
     * 群组策略配置
     */
    @Data
    public static class Policy {
        /**
         * 策略源：local / nacos
         */
        private String source = "local";

        /**
         * 本地群组策略，chatId -> TTL（秒）
         */
        private Map<Long, Long> chats = new LinkedHashMap<>();

        /**
         * 策略本地缓存时间（秒）
         */
        private int cacheSeconds = 30;

        private Nacos nacos = new Nacos();
    }

    /**
     * Nacos 策略源配置
     */
    @Data
    public static class Nacos {
        private String serverAddr = "127.0.0.1:8848";
        private String namespace;
        private String dataId = "chatgc-policies.json";
        private String group = "DEFAULT_GROUP";
    }

    /**
     * Telegram Bot API 配置
     */
    @Data
    public static class Telegram {
        /**
         * Bot Token，为空时不创建 Telegram 删除客户端
         */
        private String botToken;

        private String apiBaseUrl = "https://api.telegram.org";
    }
}
