package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.exception.StoreUnavailableException;
import cn.bafuka.chatgc.model.DeletionState;
import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.model.PendingDeletion;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisTimeoutException;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RedissonPendingDeletionStore 单元测试
 * 测试 Hash 字段编码和基于值比较的条件更新
 */
public class RedissonPendingDeletionStoreTest {

    private static final Instant POSTED_AT = Instant.parse("2026-01-01T00:00:00Z");

    private RedissonPendingDeletionStore store;

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RMap<String, String> map;

    @Before
    @SuppressWarnings("unchecked")
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        when(redissonClient.<String, String>getMap("chatgc:pending", StringCodec.INSTANCE)).thenReturn(map);
        when(map.getName()).thenReturn("chatgc:pending");
        store = new RedissonPendingDeletionStore(redissonClient, "chatgc:");
    }

    private PendingDeletion record(long chatId, long messageId) {
        return PendingDeletion.schedule(chatId, messageId, POSTED_AT, Duration.ofSeconds(60));
    }

    /**
     * 测试新建记录：字段不存在时直接写入
     */
    @Test
    public void testCreate_NewRecord() {
        when(map.putIfAbsent(eq("-100:7"), anyString())).thenReturn(null);

        assertTrue(store.create(record(-100, 7)));
        verify(map).putIfAbsent(eq("-100:7"), anyString());
    }

    /**
     * 测试新建记录：已存在活跃记录时拒绝
     */
    @Test
    public void testCreate_ActiveRecordExists() {
        String existing = PendingDeletionCodec.encode(record(-100, 7));
        when(map.putIfAbsent(eq("-100:7"), anyString())).thenReturn(existing);

        assertFalse(store.create(record(-100, 7)));
        verify(map, never()).replace(anyString(), anyString(), anyString());
    }

    /**
     * 测试新建记录：终态记录被覆盖
     */
    @Test
    public void testCreate_ReplacesTerminalRecord() {
        PendingDeletion abandoned = record(-100, 7);
        abandoned.setState(DeletionState.ABANDONED);
        String existing = PendingDeletionCodec.encode(abandoned);

        when(map.putIfAbsent(eq("-100:7"), anyString())).thenReturn(existing);
        when(map.replace(eq("-100:7"), eq(existing), anyString())).thenReturn(true);

        assertTrue(store.create(record(-100, 7)));
    }

    /**
     * 测试状态 CAS 成功
     */
    @Test
    public void testCompareAndSwapState_Success() {
        String current = PendingDeletionCodec.encode(record(1, 2));
        when(map.get("1:2")).thenReturn(current);
        when(map.replace(eq("1:2"), eq(current), anyString())).thenReturn(true);

        assertTrue(store.compareAndSwapState(MessageKey.of(1, 2), DeletionState.SCHEDULED, DeletionState.IN_FLIGHT));
    }

    /**
     * 测试状态 CAS：当前状态不符
     */
    @Test
    public void testCompareAndSwapState_StateMismatch() {
        PendingDeletion inFlight = record(1, 2);
        inFlight.setState(DeletionState.IN_FLIGHT);
        when(map.get("1:2")).thenReturn(PendingDeletionCodec.encode(inFlight));

        assertFalse(store.compareAndSwapState(MessageKey.of(1, 2), DeletionState.SCHEDULED, DeletionState.IN_FLIGHT));
        verify(map, never()).replace(anyString(), anyString(), anyString());
    }

    /**
     * 测试状态 CAS：并发修改后重读成功
     */
    @Test
    public void testCompareAndSwapState_ConcurrentModificationRetry() {
        PendingDeletion first = record(1, 2);
        PendingDeletion second = first.toBuilder().lastError("changed").build();
        String v1 = PendingDeletionCodec.encode(first);
        String v2 = PendingDeletionCodec.encode(second);

        when(map.get("1:2")).thenReturn(v1).thenReturn(v2);
        when(map.replace(eq("1:2"), eq(v1), anyString())).thenReturn(false);
        when(map.replace(eq("1:2"), eq(v2), anyString())).thenReturn(true);

        assertTrue(store.compareAndSwapState(MessageKey.of(1, 2), DeletionState.SCHEDULED, DeletionState.IN_FLIGHT));
        verify(map, times(2)).get("1:2");
    }

    /**
     * 测试条件更新：记录已被删除（取消）
     */
    @Test
    public void testCompareAndUpdate_RecordMissing() {
        when(map.get("1:2")).thenReturn(null);

        PendingDeletion done = record(1, 2);
        done.setState(DeletionState.DONE);
        assertFalse(store.compareAndUpdate(DeletionState.IN_FLIGHT, done));
    }

    /**
     * 测试条件更新：存储中是重新调度后的新记录
     */
    @Test
    public void testCompareAndUpdate_DifferentGeneration() {
        PendingDeletion current = PendingDeletion.schedule(1, 2, POSTED_AT, Duration.ofHours(1));
        when(map.get("1:2")).thenReturn(PendingDeletionCodec.encode(current));

        PendingDeletion stale = record(1, 2);
        stale.setState(DeletionState.IN_FLIGHT);
        assertFalse(store.compareAndUpdate(DeletionState.SCHEDULED, stale));
        verify(map, never()).replace(anyString(), anyString(), anyString());
    }

    /**
     * 测试条件更新：同一次调度的记录经过 JSON 毫秒精度编码后仍能匹配
     */
    @Test
    public void testCompareAndUpdate_SameGeneration() {
        PendingDeletion record = record(1, 2);
        String current = PendingDeletionCodec.encode(record);
        when(map.get("1:2")).thenReturn(current);
        when(map.replace(eq("1:2"), eq(current), anyString())).thenReturn(true);

        PendingDeletion inFlight = record.toBuilder().state(DeletionState.IN_FLIGHT).build();
        assertTrue(store.compareAndUpdate(DeletionState.SCHEDULED, inFlight));
    }

    /**
     * 测试条件删除：状态不符时不删除
     */
    @Test
    public void testDeleteIfState() {
        PendingDeletion done = record(1, 2);
        done.setState(DeletionState.DONE);
        String value = PendingDeletionCodec.encode(done);
        when(map.get("1:2")).thenReturn(value);
        when(map.remove("1:2", value)).thenReturn(true);

        assertFalse(store.deleteIfState(MessageKey.of(1, 2), DeletionState.CANCELLED));
        assertTrue(store.deleteIfState(MessageKey.of(1, 2), DeletionState.DONE));
        verify(map).remove("1:2", value);
    }

    /**
     * 测试按状态查询
     */
    @Test
    public void testGetAll() {
        PendingDeletion scheduled = record(1, 1);
        PendingDeletion inFlight = record(1, 2);
        inFlight.setState(DeletionState.IN_FLIGHT);
        PendingDeletion abandoned = record(2, 1);
        abandoned.setState(DeletionState.ABANDONED);

        when(map.readAllValues()).thenReturn(Arrays.asList(
                PendingDeletionCodec.encode(scheduled),
                PendingDeletionCodec.encode(inFlight),
                PendingDeletionCodec.encode(abandoned)));

        List<PendingDeletion> active = store.getAll(EnumSet.of(DeletionState.SCHEDULED, DeletionState.IN_FLIGHT));
        assertEquals(2, active.size());

        List<PendingDeletion> chat2 = store.findByChat(2);
        assertEquals(1, chat2.size());
        assertEquals(DeletionState.ABANDONED, chat2.get(0).getState());
    }

    /**
     * 测试 Redis 异常转换为 StoreUnavailableException
     */
    @Test
    public void testRedisException_Wrapped() {
        when(map.get("1:2")).thenThrow(new RedisTimeoutException("timeout"));

        try {
            store.get(MessageKey.of(1, 2));
            fail("Expected StoreUnavailableException");
        } catch (StoreUnavailableException e) {
            assertEquals("get", e.getOperation());
            assertTrue(e.getCause() instanceof RedisTimeoutException);
        }
    }

    @Test
    public void testDelete() {
        when(map.fastRemove("1:2")).thenReturn(1L);
        assertTrue(store.delete(MessageKey.of(1, 2)));
        assertEquals("redis", store.getType());
    }
}
