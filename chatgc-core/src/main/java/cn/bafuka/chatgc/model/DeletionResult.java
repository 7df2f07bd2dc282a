package cn.bafuka.chatgc.model;

/**
 * 删除请求结果（封闭集合，由 Worker 穷举处理）
 */
public enum DeletionResult {

    /**
     * 删除成功
     */
    SUCCESS,

    /**
     * 消息已不存在（用户已手动删除），视为成功
     */
    NOT_FOUND,

    /**
     * 无删除权限，不重试
     */
    PERMISSION_DENIED,

    /**
     * 被平台限流
     */
    RATE_LIMITED,

    /**
     * 网络错误或服务端错误
     */
    TRANSIENT_ERROR
}
