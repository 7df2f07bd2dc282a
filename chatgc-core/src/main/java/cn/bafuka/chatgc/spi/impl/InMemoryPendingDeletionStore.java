package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.model.DeletionState;
import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.model.PendingDeletion;
import cn.bafuka.chatgc.spi.PendingDeletionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 内存版待删除记录存储，用于测试和本地开发
 * 进程重启后数据丢失，不提供持久化保证
 */
@Slf4j
public class InMemoryPendingDeletionStore implements PendingDeletionStore {

    private final Map<MessageKey, PendingDeletion> records = new ConcurrentHashMap<>();

    @Override
    public void put(PendingDeletion record) {
        records.put(record.getKey(), copy(record));
    }

    @Override
    public boolean create(PendingDeletion record) {
        boolean[] created = {false};
        records.compute(record.getKey(), (key, existing) -> {
            if (existing != null && existing.isActive()) {
                return existing;
            }
            created[0] = true;
            return copy(record);
        });
        return created[0];
    }

    @Override
    public PendingDeletion get(MessageKey key) {
        PendingDeletion record = records.get(key);
        return record != null ? copy(record) : null;
    }

    @Override
    public List<PendingDeletion> getAll(Set<DeletionState> states) {
        return records.values().stream()
                .filter(r -> states.contains(r.getState()))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<PendingDeletion> findByChat(long chatId) {
        return records.values().stream()
                .filter(r -> r.getChatId() == chatId)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(MessageKey key) {
        return records.remove(key) != null;
    }

    @Override
    public boolean deleteIfState(MessageKey key, DeletionState expected) {
        boolean[] deleted = {false};
        records.computeIfPresent(key, (k, existing) -> {
            if (existing.getState() != expected) {
                return existing;
            }
            deleted[0] = true;
            return null;
        });
        return deleted[0];
    }

    @Override
    public boolean compareAndSwapState(MessageKey key, DeletionState expected, DeletionState newState) {
        boolean[] swapped = {false};
        records.computeIfPresent(key, (k, existing) -> {
            if (existing.getState() != expected) {
                return existing;
            }
            swapped[0] = true;
            return existing.toBuilder()
                    .state(newState)
                    .updatedAt(Instant.now())
                    .build();
        });
        return swapped[0];
    }

    @Override
    public boolean compareAndUpdate(DeletionState expected, PendingDeletion record) {
        boolean[] updated = {false};
        records.computeIfPresent(record.getKey(), (k, existing) -> {
            if (existing.getState() != expected || !existing.isSameGeneration(record)) {
                return existing;
            }
            updated[0] = true;
            return copy(record);
        });
        return updated[0];
    }

    @Override
    public String getType() {
        return "memory";
    }

    /**
     * 当前记录数（用于测试和监控）
     *
     * @return 记录数
     */
    public int size() {
        return records.size();
    }

    private PendingDeletion copy(PendingDeletion record) {
        return record.toBuilder().build();
    }
}
