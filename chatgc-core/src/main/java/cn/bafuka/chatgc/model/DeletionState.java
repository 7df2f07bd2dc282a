package cn.bafuka.chatgc.model;

/**
 * 待删除记录的状态
 * 状态流转：SCHEDULED -> IN_FLIGHT -> {DONE | SCHEDULED(重试) | ABANDONED}
 */
public enum DeletionState {

    /**
     * 已调度，等待到期
     */
    SCHEDULED("已调度"),

    /**
     * 删除请求执行中
     */
    IN_FLIGHT("执行中"),

    /**
     * 已删除（终态）
     */
    DONE("已删除"),

    /**
     * 已放弃（权限不足或重试耗尽）
     */
    ABANDONED("已放弃"),

    /**
     * 已取消（终态）
     */
    CANCELLED("已取消");

    private final String description;

    DeletionState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否为活跃状态（同一条消息最多只能有一条活跃记录）
     *
     * @return SCHEDULED 或 IN_FLIGHT 时返回 true
     */
    public boolean isActive() {
        return this == SCHEDULED || this == IN_FLIGHT;
    }
}
