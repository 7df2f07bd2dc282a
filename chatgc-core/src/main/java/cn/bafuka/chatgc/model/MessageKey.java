package cn.bafuka.chatgc.model;

import lombok.Value;

/**
 * 消息唯一标识（chatId + messageId）
 */
@Value(staticConstructor = "of")
public class MessageKey {

    long chatId;

    long messageId;

    /**
     * 存储中使用的字段名
     *
     * @return 形如 "chatId:messageId" 的字符串
     */
    public String asString() {
        return chatId + ":" + messageId;
    }

    @Override
    public String toString() {
        return asString();
    }
}
