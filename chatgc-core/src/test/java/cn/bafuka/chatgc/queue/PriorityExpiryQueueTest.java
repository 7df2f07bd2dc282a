package cn.bafuka.chatgc.queue;

import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.model.PendingDeletion;
import cn.bafuka.chatgc.queue.impl.PriorityExpiryQueue;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * PriorityExpiryQueue 单元测试
 */
public class PriorityExpiryQueueTest {

    private static final Instant BASE = Instant.parse("2026-01-01T00:00:00Z");

    private PriorityExpiryQueue queue;

    @Before
    public void setUp() {
        queue = new PriorityExpiryQueue();
    }

    private PendingDeletion record(long chatId, long messageId, Instant dueAt) {
        PendingDeletion record = PendingDeletion.schedule(chatId, messageId, dueAt.minusSeconds(60), Duration.ofSeconds(60));
        assertEquals(dueAt, record.getDueAt());
        return record;
    }

    /**
     * 测试按 dueAt 升序取出
     */
    @Test
    public void testPopDue_OrderedByDueAt() {
        queue.insert(record(1, 3, BASE.plusSeconds(30)));
        queue.insert(record(1, 1, BASE.plusSeconds(10)));
        queue.insert(record(2, 2, BASE.plusSeconds(20)));

        List<PendingDeletion> due = queue.popDue(BASE.plusSeconds(30));

        assertEquals(3, due.size());
        assertEquals(1, due.get(0).getMessageId());
        assertEquals(2, due.get(1).getMessageId());
        assertEquals(3, due.get(2).getMessageId());
        assertEquals(0, queue.size());
    }

    /**
     * 测试未到期的记录不会被取出
     */
    @Test
    public void testPopDue_NotYetDue() {
        queue.insert(record(1, 1, BASE.plusSeconds(10)));
        queue.insert(record(1, 2, BASE.plusSeconds(60)));

        List<PendingDeletion> due = queue.popDue(BASE.plusSeconds(10));

        assertEquals(1, due.size());
        assertEquals(1, due.get(0).getMessageId());
        assertEquals(1, queue.size());
        assertEquals(BASE.plusSeconds(60), queue.peekNextDeadline().get());
    }

    /**
     * 测试 dueAt 相同时保持插入顺序
     */
    @Test
    public void testPopDue_SameDueAtKeepsInsertionOrder() {
        queue.insert(record(1, 5, BASE));
        queue.insert(record(1, 4, BASE));
        queue.insert(record(1, 6, BASE));

        List<PendingDeletion> due = queue.popDue(BASE);

        assertEquals(5, due.get(0).getMessageId());
        assertEquals(4, due.get(1).getMessageId());
        assertEquals(6, due.get(2).getMessageId());
    }

    /**
     * 测试同一消息不会重复入队
     */
    @Test
    public void testInsert_Duplicate() {
        assertTrue(queue.insert(record(1, 1, BASE)));
        assertFalse(queue.insert(record(1, 1, BASE.plusSeconds(5))));

        assertEquals(1, queue.size());
        assertEquals(BASE, queue.peekNextDeadline().get());
    }

    /**
     * 测试 dueAt 为空的记录被拒绝
     */
    @Test
    public void testInsert_NullDueAt() {
        PendingDeletion record = record(1, 1, BASE);
        record.setDueAt(null);

        assertFalse(queue.insert(record));
        assertFalse(queue.insert(null));
        assertEquals(0, queue.size());
    }

    /**
     * 测试取出后同一消息可以再次入队（重试场景）
     */
    @Test
    public void testInsert_AfterPop() {
        queue.insert(record(1, 1, BASE));
        queue.popDue(BASE);

        assertTrue(queue.insert(record(1, 1, BASE.plusSeconds(2))));
        assertTrue(queue.contains(MessageKey.of(1, 1)));
    }

    /**
     * 测试移除单条记录
     */
    @Test
    public void testRemove() {
        queue.insert(record(1, 1, BASE));
        queue.insert(record(1, 2, BASE.plusSeconds(1)));

        assertTrue(queue.remove(1, 1));
        assertFalse(queue.remove(1, 1));
        assertFalse(queue.contains(MessageKey.of(1, 1)));

        List<PendingDeletion> due = queue.popDue(BASE.plusSeconds(10));
        assertEquals(1, due.size());
        assertEquals(2, due.get(0).getMessageId());
    }

    /**
     * 测试移除群组全部记录
     */
    @Test
    public void testRemoveChat() {
        queue.insert(record(1, 1, BASE));
        queue.insert(record(1, 2, BASE.plusSeconds(1)));
        queue.insert(record(2, 1, BASE.plusSeconds(2)));

        List<MessageKey> removed = queue.removeChat(1);

        assertEquals(2, removed.size());
        assertTrue(removed.contains(MessageKey.of(1, 1)));
        assertTrue(removed.contains(MessageKey.of(1, 2)));
        assertEquals(1, queue.size());
        assertEquals(BASE.plusSeconds(2), queue.peekNextDeadline().get());
    }

    /**
     * 测试空队列
     */
    @Test
    public void testEmptyQueue() {
        assertFalse(queue.peekNextDeadline().isPresent());
        assertTrue(queue.popDue(BASE).isEmpty());
        assertTrue(queue.snapshot().isEmpty());
    }

    /**
     * 测试快照按 dueAt 排序且不修改队列
     */
    @Test
    public void testSnapshot() {
        queue.insert(record(1, 2, BASE.plusSeconds(20)));
        queue.insert(record(1, 1, BASE.plusSeconds(10)));

        List<PendingDeletion> snapshot = queue.snapshot();

        assertEquals(2, snapshot.size());
        assertEquals(1, snapshot.get(0).getMessageId());
        assertEquals(2, queue.size());
    }

    /**
     * 测试更早的记录插入时唤醒等待线程
     */
    @Test
    public void testAwaitNextDue_WokenByEarlierInsert() throws InterruptedException {
        queue.insert(record(1, 1, Instant.now().plusSeconds(3600)));

        CountDownLatch returned = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                queue.awaitNextDue(Duration.ofMinutes(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            returned.countDown();
        });
        waiter.start();

        // 等待线程进入睡眠
        Thread.sleep(100);
        queue.insert(record(1, 2, Instant.now().plusMillis(50)));

        assertTrue("Waiter should wake up on earlier insert", returned.await(2, TimeUnit.SECONDS));
        waiter.join(1000);
    }

    /**
     * 测试 wakeUp 先于等待调用时不会丢失
     */
    @Test
    public void testAwaitNextDue_PendingWakeUp() throws InterruptedException {
        queue.wakeUp();

        long start = System.nanoTime();
        queue.awaitNextDue(Duration.ofSeconds(30));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue("Pending wakeUp should return immediately", elapsedMs < 1000);
    }

    /**
     * 测试队首已到期时立即返回
     */
    @Test
    public void testAwaitNextDue_HeadAlreadyDue() throws InterruptedException {
        queue.insert(record(1, 1, Instant.now().minusSeconds(1)));

        long start = System.nanoTime();
        queue.awaitNextDue(Duration.ofSeconds(30));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs < 1000);
    }
}
