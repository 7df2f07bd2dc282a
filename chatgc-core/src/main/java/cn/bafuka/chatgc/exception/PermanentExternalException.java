package cn.bafuka.chatgc.exception;

import cn.bafuka.chatgc.model.MessageKey;

/**
 * 永久性外部错误（无权限等），直接放弃
 */
public class PermanentExternalException extends ExternalDeletionException {

    public PermanentExternalException(String message, Throwable cause, MessageKey key) {
        super(message, cause, key);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
