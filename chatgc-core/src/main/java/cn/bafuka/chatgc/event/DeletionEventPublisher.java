package cn.bafuka.chatgc.event;

/**
 * 删除事件发布器接口
 * 放弃删除等事件只用于运维观测，发布失败不影响删除流程
 */
public interface DeletionEventPublisher {

    /**
     * 发布事件
     *
     * @param event 事件
     */
    void publish(DeletionEvent event);
}
