package cn.bafuka.chatgc.spi;

import cn.bafuka.chatgc.model.DeletionResponse;

/**
 * 聊天平台删除消息能力 SPI
 * 实现类需将平台返回映射为 {@link cn.bafuka.chatgc.model.DeletionResult}
 */
public interface DeletionClient {

    /**
     * 删除消息
     *
     * @param chatId    群组 ID
     * @param messageId 消息 ID
     * @return 删除结果
     */
    DeletionResponse deleteMessage(long chatId, long messageId);
}
