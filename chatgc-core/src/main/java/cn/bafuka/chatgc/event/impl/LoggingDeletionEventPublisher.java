package cn.bafuka.chatgc.event.impl;

import cn.bafuka.chatgc.event.DeletionEvent;
import cn.bafuka.chatgc.event.DeletionEventPublisher;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;

/**
 * 以结构化日志输出删除事件
 * 未配置 RocketMQ 时的默认实现
 */
@Slf4j
public class LoggingDeletionEventPublisher implements DeletionEventPublisher {

    @Override
    public void publish(DeletionEvent event) {
        if (event == null) {
            return;
        }

        if (event.getType() == DeletionEvent.EventType.ABANDONED) {
            log.warn("chatgc-event {}", JSON.toJSONString(event));
        } else {
            log.info("chatgc-event {}", JSON.toJSONString(event));
        }
    }
}
