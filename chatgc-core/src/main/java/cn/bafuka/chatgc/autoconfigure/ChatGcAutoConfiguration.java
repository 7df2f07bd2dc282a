package cn.bafuka.chatgc.autoconfigure;

import cn.bafuka.chatgc.config.ChatGcProperties;
import cn.bafuka.chatgc.core.DeletionCounters;
import cn.bafuka.chatgc.engine.DeletionEngine;
import cn.bafuka.chatgc.engine.impl.DefaultDeletionEngine;
import cn.bafuka.chatgc.event.DeletionEventPublisher;
import cn.bafuka.chatgc.event.impl.LoggingDeletionEventPublisher;
import cn.bafuka.chatgc.event.impl.RocketMQDeletionEventPublisher;
import cn.bafuka.chatgc.exception.ChatGcStartupException;
import cn.bafuka.chatgc.queue.ExpiryQueue;
import cn.bafuka.chatgc.queue.impl.PriorityExpiryQueue;
import cn.bafuka.chatgc.ratelimit.DeletionRateLimiter;
import cn.bafuka.chatgc.ratelimit.impl.SentinelDeletionRateLimiter;
import cn.bafuka.chatgc.recovery.RecoveryBootstrapper;
import cn.bafuka.chatgc.spi.ChatPolicySource;
import cn.bafuka.chatgc.spi.DeletionClient;
import cn.bafuka.chatgc.spi.PendingDeletionStore;
import cn.bafuka.chatgc.spi.impl.CachingChatPolicySource;
import cn.bafuka.chatgc.spi.impl.InMemoryPendingDeletionStore;
import cn.bafuka.chatgc.spi.impl.LocalYamlChatPolicySource;
import cn.bafuka.chatgc.spi.impl.NacosChatPolicySource;
import cn.bafuka.chatgc.spi.impl.RedissonPendingDeletionStore;
import cn.bafuka.chatgc.spi.impl.TelegramDeletionClient;
import cn.bafuka.chatgc.worker.DeletionWorkerPool;
import cn.bafuka.chatgc.worker.StoreOperations;
import lombok.extern.slf4j.Slf4j;
import org.apache.rocketmq.spring.core.RocketMQTemplate;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * ChatGC 自动配置类
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ChatGcProperties.class)
@AutoConfigureAfter(name = {
        "org.redisson.spring.starter.RedissonAutoConfiguration",
        "org.apache.rocketmq.spring.autoconfigure.RocketMQAutoConfiguration"
})
@ConditionalOnProperty(prefix = "chatgc", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ChatGcAutoConfiguration {

    public ChatGcAutoConfiguration() {
        log.info("ChatGC auto-configuration initializing...");
    }

    /**
     * 待删除记录存储
     * redis 类型要求容器中存在 RedissonClient，否则拒绝启动
     */
    @Bean
    @ConditionalOnMissingBean
    public PendingDeletionStore pendingDeletionStore(ChatGcProperties properties,
                                                     ObjectProvider<RedissonClient> redissonClient) {
        String type = properties.getStore().getType();
        if ("memory".equalsIgnoreCase(type)) {
            log.warn("使用内存存储，进程重启后待删除记录将丢失");
            return new InMemoryPendingDeletionStore();
        }

        RedissonClient client = redissonClient.getIfAvailable();
        if (client == null) {
            throw new ChatGcStartupException(
                    "chatgc.store.type=" + type + " requires a RedissonClient bean", null);
        }
        return new RedissonPendingDeletionStore(client, properties.getStore().getKeyPrefix());
    }

    /**
     * 存储访问层重试
     */
    @Bean
    @ConditionalOnMissingBean
    public StoreOperations storeOperations(ChatGcProperties properties) {
        return new StoreOperations(properties.getStore().getMaxRetries(), properties.getStore().getRetryDelayMs());
    }

    /**
     * 到期队列
     */
    @Bean
    @ConditionalOnMissingBean
    public ExpiryQueue expiryQueue() {
        return new PriorityExpiryQueue(Clock.systemUTC());
    }

    /**
     * 删除限流器
     */
    @Bean
    @ConditionalOnMissingBean
    public DeletionRateLimiter deletionRateLimiter(ChatGcProperties properties) {
        ChatGcProperties.RateLimit config = properties.getRateLimit();
        SentinelDeletionRateLimiter limiter = new SentinelDeletionRateLimiter();
        limiter.updateRules(config.getGlobalQps(), config.getPerChatCount(), config.getPerChatWindowSeconds());
        return limiter;
    }

    /**
     * 群组策略源（带本地缓存）
     */
    @Bean
    @ConditionalOnMissingBean
    public ChatPolicySource chatPolicySource(ChatGcProperties properties) {
        ChatGcProperties.Policy policy = properties.getPolicy();
        ChatPolicySource source;

        if ("nacos".equalsIgnoreCase(policy.getSource())) {
            ChatGcProperties.Nacos nacos = policy.getNacos();
            source = new NacosChatPolicySource(nacos.getServerAddr(), nacos.getNamespace(),
                    nacos.getDataId(), nacos.getGroup());
        } else {
            source = new LocalYamlChatPolicySource(properties);
        }

        return new CachingChatPolicySource(source, policy.getCacheSeconds());
    }

    /**
     * Telegram 删除客户端（仅当配置了 bot-token 时创建）
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnExpression("!'${chatgc.telegram.bot-token:}'.isEmpty()")
    public DeletionClient telegramDeletionClient(ChatGcProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(5000);
        requestFactory.setReadTimeout(10000);

        ChatGcProperties.Telegram telegram = properties.getTelegram();
        return new TelegramDeletionClient(new RestTemplate(requestFactory),
                telegram.getApiBaseUrl(), telegram.getBotToken());
    }

    /**
     * 删除事件发布器（默认输出日志）
     */
    @Bean
    @ConditionalOnMissingBean
    public DeletionEventPublisher deletionEventPublisher() {
        return new LoggingDeletionEventPublisher();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeletionCounters deletionCounters() {
        return new DeletionCounters();
    }

    /**
     * 删除 Worker 池
     */
    @Bean
    @ConditionalOnMissingBean
    public DeletionWorkerPool deletionWorkerPool(PendingDeletionStore store,
                                                 StoreOperations storeOperations,
                                                 DeletionClient deletionClient,
                                                 DeletionRateLimiter rateLimiter,
                                                 ExpiryQueue expiryQueue,
                                                 DeletionEventPublisher eventPublisher,
                                                 DeletionCounters counters,
                                                 ChatGcProperties properties) {
        return new DeletionWorkerPool(store, storeOperations, deletionClient, rateLimiter, expiryQueue,
                eventPublisher, counters, properties, Clock.systemUTC());
    }

    /**
     * 启动恢复器
     */
    @Bean
    @ConditionalOnMissingBean
    public RecoveryBootstrapper recoveryBootstrapper(PendingDeletionStore store,
                                                     StoreOperations storeOperations,
                                                     ExpiryQueue expiryQueue,
                                                     ChatGcProperties properties) {
        return new RecoveryBootstrapper(store, storeOperations, expiryQueue, Clock.systemUTC(),
                Duration.ofSeconds(properties.getMaxMessageAgeSeconds()));
    }

    /**
     * 删除引擎（创建时完成恢复并启动调度）
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public DeletionEngine deletionEngine(PendingDeletionStore store,
                                         StoreOperations storeOperations,
                                         ExpiryQueue expiryQueue,
                                         DeletionWorkerPool workerPool,
                                         RecoveryBootstrapper bootstrapper,
                                         ChatPolicySource policySource,
                                         DeletionEventPublisher eventPublisher,
                                         DeletionCounters counters,
                                         ChatGcProperties properties) {
        DefaultDeletionEngine engine = new DefaultDeletionEngine(store, storeOperations, expiryQueue, workerPool,
                bootstrapper, policySource, eventPublisher, counters, properties, Clock.systemUTC());
        engine.initialize();
        return engine;
    }

    /**
     * RocketMQ 事件发布（仅当 RocketMQTemplate 存在时创建）
     */
    @Configuration
    @ConditionalOnClass(RocketMQTemplate.class)
    static class RocketMQEventConfiguration {

        @Bean
        @ConditionalOnBean(RocketMQTemplate.class)
        @ConditionalOnMissingBean(DeletionEventPublisher.class)
        public RocketMQDeletionEventPublisher rocketMQDeletionEventPublisher(RocketMQTemplate rocketMQTemplate,
                                                                             ChatGcProperties properties) {
            return new RocketMQDeletionEventPublisher(rocketMQTemplate, properties.getEventTopic());
        }
    }
}
