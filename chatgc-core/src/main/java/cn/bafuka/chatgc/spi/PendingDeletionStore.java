package cn.bafuka.chatgc.spi;

import cn.bafuka.chatgc.model.DeletionState;
import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.model.PendingDeletion;

import java.util.List;
import java.util.Set;

/**
 * 待删除记录持久化存储 SPI
 * 存储是唯一的事实来源，所有状态变更必须是原子的
 *
 * 存储不可用时实现类抛出 {@link cn.bafuka.chatgc.exception.StoreUnavailableException}
 */
public interface PendingDeletionStore {

    /**
     * 写入记录（存在则覆盖）
     *
     * @param record 记录
     */
    void put(PendingDeletion record);

    /**
     * 新建记录，若同一消息已存在活跃记录则不写入
     *
     * @param record 记录
     * @return 写入成功返回 true
     */
    boolean create(PendingDeletion record);

    /**
     * 查询记录
     *
     * @param key 消息标识
     * @return 记录，不存在返回 null
     */
    PendingDeletion get(MessageKey key);

    /**
     * 查询指定状态的全部记录（恢复阶段使用）
     *
     * @param states 状态集合
     * @return 记录列表
     */
    List<PendingDeletion> getAll(Set<DeletionState> states);

    /**
     * 查询群组的全部记录
     *
     * @param chatId 群组 ID
     * @return 记录列表
     */
    List<PendingDeletion> findByChat(long chatId);

    /**
     * 删除记录
     *
     * @param key 消息标识
     * @return 记录存在并被删除返回 true
     */
    boolean delete(MessageKey key);

    /**
     * 原子状态迁移：仅当当前状态等于 expected 时改为 newState
     *
     * @param key      消息标识
     * @param expected 期望的当前状态
     * @param newState 新状态
     * @return 迁移成功返回 true
     */
    boolean compareAndSwapState(MessageKey key, DeletionState expected, DeletionState newState);

    /**
     * 条件删除：仅当当前状态等于 expected 时删除
     * 用于清理 DONE / CANCELLED 记录，不会误删其后重新调度的新记录
     *
     * @param key      消息标识
     * @param expected 期望的当前状态
     * @return 删除成功返回 true
     */
    boolean deleteIfState(MessageKey key, DeletionState expected);

    /**
     * 原子更新：仅当当前记录与 record 属于同一次调度（{@link PendingDeletion#isSameGeneration}）
     * 且状态等于 expected 时用 record 整体替换
     *
     * @param expected 期望的当前状态
     * @param record   新记录
     * @return 更新成功返回 true
     */
    boolean compareAndUpdate(DeletionState expected, PendingDeletion record);

    /**
     * 存储类型标识
     *
     * @return 类型名称（如 "redis", "memory"）
     */
    String getType();
}
