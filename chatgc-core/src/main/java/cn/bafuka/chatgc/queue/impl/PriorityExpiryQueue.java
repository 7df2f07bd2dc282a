package cn.bafuka.chatgc.queue.impl;

import cn.bafuka.chatgc.model.MessageKey;
import cn.bafuka.chatgc.model.PendingDeletion;
import cn.bafuka.chatgc.queue.ExpiryQueue;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 到期队列默认实现
 * PriorityQueue 按 dueAt 排序，HashMap 按消息索引保证唯一性，二者由同一把锁保护
 */
@Slf4j
public class PriorityExpiryQueue implements ExpiryQueue {

    private static final Comparator<Entry> ORDER = Comparator
            .comparing((Entry e) -> e.record.getDueAt())
            .thenComparingLong(e -> e.sequence);

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * 队首变化或有新记录时通知调度线程
     */
    private final Condition changed = lock.newCondition();

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);

    /**
     * 消息索引
     * Key: 消息标识
     * Value: 队列中的条目
     */
    private final Map<MessageKey, Entry> index = new HashMap<>();

    private final Clock clock;

    /**
     * 插入序号，dueAt 相同时保持插入顺序
     */
    private long sequence;

    /**
     * wakeUp 被调用但调度线程尚未消费的标记
     */
    private boolean wakeUpPending;

    public PriorityExpiryQueue() {
        this(Clock.systemUTC());
    }

    public PriorityExpiryQueue(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean insert(PendingDeletion record) {
        if (record == null || record.getDueAt() == null) {
            return false;
        }

        lock.lock();
        try {
            MessageKey key = record.getKey();
            if (index.containsKey(key)) {
                log.info("消息已在到期队列中，忽略重复插入: key={}", key);
                return false;
            }

            Entry entry = new Entry(record, sequence++);
            heap.add(entry);
            index.put(key, entry);

            // 新记录成为队首时唤醒调度线程重新计算睡眠时间
            if (heap.peek() == entry) {
                changed.signalAll();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PendingDeletion> popDue(Instant now) {
        List<PendingDeletion> due = new ArrayList<>();
        lock.lock();
        try {
            while (!heap.isEmpty() && !heap.peek().record.getDueAt().isAfter(now)) {
                Entry entry = heap.poll();
                index.remove(entry.record.getKey());
                due.add(entry.record);
            }
        } finally {
            lock.unlock();
        }
        return due;
    }

    @Override
    public Optional<Instant> peekNextDeadline() {
        lock.lock();
        try {
            Entry head = heap.peek();
            return head != null ? Optional.of(head.record.getDueAt()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(long chatId, long messageId) {
        lock.lock();
        try {
            Entry entry = index.remove(MessageKey.of(chatId, messageId));
            if (entry == null) {
                return false;
            }
            heap.remove(entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<MessageKey> removeChat(long chatId) {
        List<MessageKey> removed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Map.Entry<MessageKey, Entry>> it = index.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<MessageKey, Entry> e = it.next();
                if (e.getKey().getChatId() == chatId) {
                    heap.remove(e.getValue());
                    removed.add(e.getKey());
                    it.remove();
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    @Override
    public void awaitNextDue(Duration maxWait) throws InterruptedException {
        lock.lock();
        try {
            if (wakeUpPending) {
                wakeUpPending = false;
                return;
            }

            long waitNanos = maxWait.toNanos();
            Entry head = heap.peek();
            if (head != null) {
                long untilDue = Duration.between(clock.instant(), head.record.getDueAt()).toNanos();
                if (untilDue <= 0) {
                    return;
                }
                waitNanos = Math.min(waitNanos, untilDue);
            }

            changed.await(waitNanos, TimeUnit.NANOSECONDS);
            wakeUpPending = false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void wakeUp() {
        lock.lock();
        try {
            wakeUpPending = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(MessageKey key) {
        lock.lock();
        try {
            return index.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PendingDeletion> snapshot() {
        lock.lock();
        try {
            List<Entry> entries = new ArrayList<>(heap);
            entries.sort(ORDER);
            List<PendingDeletion> result = new ArrayList<>(entries.size());
            for (Entry entry : entries) {
                result.add(entry.record);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 队列条目
     */
    private static final class Entry {

        private final PendingDeletion record;

        private final long sequence;

        private Entry(PendingDeletion record, long sequence) {
            this.record = record;
            this.sequence = sequence;
        }
    }
}
