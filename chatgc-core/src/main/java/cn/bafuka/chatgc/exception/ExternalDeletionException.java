package cn.bafuka.chatgc.exception;

import cn.bafuka.chatgc.model.MessageKey;

/**
 * 调用聊天平台删除接口失败
 * 由删除客户端抛出，Worker 根据子类型决定重试或放弃
 *
 * @author ChatGC Team
 * @since 1.0
 */
public abstract class ExternalDeletionException extends RuntimeException {

    /**
     * 目标消息
     */
    private final MessageKey key;

    protected ExternalDeletionException(String message, Throwable cause, MessageKey key) {
        super(message, cause);
        this.key = key;
    }

    public MessageKey getKey() {
        return key;
    }

    /**
     * 是否可重试
     *
     * @return 可重试返回 true
     */
    public abstract boolean isRetryable();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "key=" + key +
                ", retryable=" + isRetryable() +
                ", message=" + getMessage() +
                '}';
    }
}
