package cn.bafuka.chatgc.model;

/**
 * 放弃删除的原因
 */
public enum AbandonReason {

    /**
     * 机器人在该群组中没有删除权限
     */
    PERMISSION_DENIED("无删除权限"),

    /**
     * 重试次数耗尽
     */
    RETRIES_EXHAUSTED("重试次数耗尽"),

    /**
     * 消息超过平台允许删除的最大时长
     */
    TOO_OLD("消息过旧，平台不允许删除");

    private final String description;

    AbandonReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
