package cn.bafuka.chatgc.example.service;

import cn.bafuka.chatgc.model.DeletionResponse;
import cn.bafuka.chatgc.model.DeletionResult;
import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.spi.DeletionClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模拟删除客户端
 * 未配置 Telegram bot-token 时代替真实客户端，只记录日志
 */
@Slf4j
@Service
@ConditionalOnExpression("'${chatgc.telegram.bot-token:}'.isEmpty()")
public class SimulatedDeletionClient implements DeletionClient {

    /**
     * 已删除的消息（用于诊断接口查看）
     */
    private final Set<MessageKey> deleted = ConcurrentHashMap.newKeySet();

    @Override
    public DeletionResponse deleteMessage(long chatId, long messageId) {
        MessageKey key = MessageKey.of(chatId, messageId);
        if (!deleted.add(key)) {
            log.info("模拟删除: 消息已不存在, key={}", key);
            return DeletionResponse.of(DeletionResult.NOT_FOUND, "message to delete not found");
        }

        log.info("模拟删除: key={}", key);
        return DeletionResponse.of(DeletionResult.SUCCESS);
    }

    /**
     * 已删除消息列表
     *
     * @return 消息键
     */
    public List<MessageKey> getDeleted() {
        return Collections.unmodifiableList(new ArrayList<>(deleted));
    }
}
