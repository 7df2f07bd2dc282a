package cn.bafuka.chatgc.event.impl;

import cn.bafuka.chatgc.event.DeletionEvent;
import cn.bafuka.chatgc.event.DeletionEventPublisher;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;
import org.apache.rocketmq.spring.core.RocketMQTemplate;
import org.apache.rocketmq.spring.support.RocketMQHeaders;
import org.springframework.messaging.support.MessageBuilder;

/**
 * 删除事件发布器实现
 * 基于 RocketMQ，将事件发送到运维 Topic
 */
@Slf4j
public class RocketMQDeletionEventPublisher implements DeletionEventPublisher {

    /**
     * 发送超时（毫秒）
     */
    private static final long SEND_TIMEOUT_MS = 3000;

    /**
     * RocketMQ 模板
     */
    private final RocketMQTemplate rocketMQTemplate;

    /**
     * 事件 Topic
     */
    private final String topic;

    public RocketMQDeletionEventPublisher(RocketMQTemplate rocketMQTemplate, String topic) {
        this.rocketMQTemplate = rocketMQTemplate;
        this.topic = topic;
    }

    @Override
    public void publish(DeletionEvent event) {
        if (event == null) {
            return;
        }

        String payload = JSON.toJSONString(event);
        try {
            // chatId 作为消息 Key，方便按群组检索
            rocketMQTemplate.syncSend(topic + ":" + event.getType().name(),
                    MessageBuilder.withPayload(payload)
                            .setHeader(RocketMQHeaders.KEYS, String.valueOf(event.getChatId()))
                            .build(),
                    SEND_TIMEOUT_MS);

            log.info("已发送删除事件: type={}, chatId={}, messageId={}",
                    event.getType(), event.getChatId(), event.getMessageId());

        } catch (Exception e) {
            // 事件仅用于观测，发送失败时落日志
            log.error("发送删除事件失败: {}", payload, e);
        }
    }
}
