package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.exception.StoreUnavailableException;
import cn.bafuka.chatgc.model.DeletionState;
import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.model.PendingDeletion;
import cn.bafuka.chatgc.spi.PendingDeletionStore;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 基于 Redisson 的待删除记录存储
 * 所有记录保存在一个 Redis Hash 中，字段为 "chatId:messageId"，值为 JSON
 * 条件更新通过 HSET 值比较（RMap#replace(key, old, new)）实现原子性
 *
 * 操作超时由 Redisson 客户端的 timeout 配置决定，超时与连接错误统一转换为 StoreUnavailableException
 */
@Slf4j
public class RedissonPendingDeletionStore implements PendingDeletionStore {

    /**
     * 并发修改导致条件更新失败时的最大重读次数
     */
    private static final int MAX_CAS_LOOPS = 8;

    private final RMap<String, String> records;

    public RedissonPendingDeletionStore(RedissonClient redissonClient, String keyPrefix) {
        this.records = redissonClient.getMap(keyPrefix + "pending", StringCodec.INSTANCE);
        log.info("初始化 Redisson 待删除记录存储: map={}", records.getName());
    }

    @Override
    public void put(PendingDeletion record) {
        execute("put", () -> records.fastPut(field(record.getKey()), PendingDeletionCodec.encode(record)));
    }

    @Override
    public boolean create(PendingDeletion record) {
        String field = field(record.getKey());
        String value = PendingDeletionCodec.encode(record);

        return execute("create", () -> {
            for (int i = 0; i < MAX_CAS_LOOPS; i++) {
                String current = records.putIfAbsent(field, value);
                if (current == null) {
                    return true;
                }

                // 已存在活跃记录，保持唯一性
                if (PendingDeletionCodec.decode(current).isActive()) {
                    return false;
                }

                // 终态记录可以被新的调度覆盖
                if (records.replace(field, current, value)) {
                    return true;
                }
            }
            log.warn("新建记录时并发冲突次数过多: key={}", record.getKey());
            return false;
        });
    }

    @Override
    public PendingDeletion get(MessageKey key) {
        return execute("get", () -> {
            String value = records.get(field(key));
            return value != null ? PendingDeletionCodec.decode(value) : null;
        });
    }

    @Override
    public List<PendingDeletion> getAll(Set<DeletionState> states) {
        return execute("getAll", () -> {
            List<PendingDeletion> result = new ArrayList<>();
            for (String value : records.readAllValues()) {
                PendingDeletion record = PendingDeletionCodec.decode(value);
                if (states.contains(record.getState())) {
                    result.add(record);
                }
            }
            return result;
        });
    }

    @Override
    public List<PendingDeletion> findByChat(long chatId) {
        return execute("findByChat", () -> {
            List<PendingDeletion> result = new ArrayList<>();
            for (String value : records.readAllValues()) {
                PendingDeletion record = PendingDeletionCodec.decode(value);
                if (record.getChatId() == chatId) {
                    result.add(record);
                }
            }
            return result;
        });
    }

    @Override
    public boolean delete(MessageKey key) {
        return execute("delete", () -> records.fastRemove(field(key)) > 0);
    }

    @Override
    public boolean deleteIfState(MessageKey key, DeletionState expected) {
        String field = field(key);

        return execute("deleteIfState", () -> {
            for (int i = 0; i < MAX_CAS_LOOPS; i++) {
                String current = records.get(field);
                if (current == null || PendingDeletionCodec.decode(current).getState() != expected) {
                    return false;
                }
                if (records.remove(field, current)) {
                    return true;
                }
            }
            log.warn("条件删除并发冲突次数过多: key={}, expected={}", key, expected);
            return false;
        });
    }

    @Override
    public boolean compareAndSwapState(MessageKey key, DeletionState expected, DeletionState newState) {
        String field = field(key);

        return execute("compareAndSwapState", () -> {
            for (int i = 0; i < MAX_CAS_LOOPS; i++) {
                String current = records.get(field);
                if (current == null) {
                    return false;
                }

                PendingDeletion record = PendingDeletionCodec.decode(current);
                if (record.getState() != expected) {
                    return false;
                }

                record.setState(newState);
                record.setUpdatedAt(Instant.now());
                if (records.replace(field, current, PendingDeletionCodec.encode(record))) {
                    return true;
                }
            }
            log.warn("状态迁移并发冲突次数过多: key={}, {} -> {}", key, expected, newState);
            return false;
        });
    }

    @Override
    public boolean compareAndUpdate(DeletionState expected, PendingDeletion record) {
        String field = field(record.getKey());
        String value = PendingDeletionCodec.encode(record);

        return execute("compareAndUpdate", () -> {
            for (int i = 0; i < MAX_CAS_LOOPS; i++) {
                String current = records.get(field);
                if (current == null) {
                    return false;
                }

                PendingDeletion existing = PendingDeletionCodec.decode(current);
                if (existing.getState() != expected || !existing.isSameGeneration(record)) {
                    return false;
                }

                if (records.replace(field, current, value)) {
                    return true;
                }
            }
            log.warn("条件更新并发冲突次数过多: key={}, expected={}", record.getKey(), expected);
            return false;
        });
    }

    @Override
    public String getType() {
        return "redis";
    }

    private String field(MessageKey key) {
        return key.asString();
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RedisException e) {
            throw new StoreUnavailableException(operation, "Redis 操作失败: " + e.getMessage(), e);
        }
    }
}
