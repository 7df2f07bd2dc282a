package cn.bafuka.chatgc.exception;

import cn.bafuka.chatgc.model.MessageKey;

/**
 * 临时性外部错误（网络、服务端错误、限流），按退避策略重试
 */
public class TransientExternalException extends ExternalDeletionException {

    public TransientExternalException(String message, Throwable cause, MessageKey key) {
        super(message, cause, key);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
