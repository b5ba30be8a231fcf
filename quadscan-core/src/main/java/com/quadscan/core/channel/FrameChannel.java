package com.quadscan.core.channel;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.quadscan.core.frame.Frame;
import com.quadscan.core.frame.RegionSpec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 有界的单生产者/单消费者帧通道，连接 Fork 和一个 Worker。
 *
 * 状态机：
 * RUNNING --close()--> DRAINING --缓冲取完--> CLOSED
 * RUNNING/DRAINING --abort()--> ABORTED
 *
 * 所有状态迁移都在同一把锁下进行，并唤醒 notFull/notEmpty 上的全部等待者，
 * 因此 abort() 可以和阻塞中的 push()/pop() 并发调用而不会丢失唤醒。
 */
@Slf4j
public class FrameChannel {

    public static final int DEFAULT_CAPACITY = 1;

    @Getter
    private final int id;
    @Getter
    private final RegionSpec regionSpec;
    @Getter
    private final int capacity;

    private final ArrayDeque<Frame> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();

    private volatile ChannelState state = ChannelState.RUNNING;
    // 消费端最后取走的帧序号
    private volatile long lastDeliveredSeq = -1;
    // 生产端最后放入的帧序号，只在锁内访问
    private long lastPushedSeq = -1;

    public FrameChannel(int id, RegionSpec regionSpec) {
        this(id, regionSpec, DEFAULT_CAPACITY);
    }

    public FrameChannel(int id, RegionSpec regionSpec, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("channel capacity must be >= 1, got " + capacity);
        }
        this.id = id;
        this.regionSpec = regionSpec;
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * 放入一帧。缓冲满时阻塞，直到有空间或 Channel 被中止。
     *
     * @throws ChannelClosedException Channel 不处于 RUNNING
     * @throws InterruptedException   生产线程被中断
     */
    public void push(Frame frame) throws ChannelClosedException, InterruptedException {
        lock.lockInterruptibly();
        try {
            ensureAccepting();
            if (frame.getSequenceId() <= lastPushedSeq) {
                throw new IllegalArgumentException("channel %d: frame %d pushed after frame %d"
                        .formatted(id, frame.getSequenceId(), lastPushedSeq));
            }
            while (buffer.size() >= capacity) {
                notFull.await();
                ensureAccepting();
            }
            buffer.addLast(frame);
            lastPushedSeq = frame.getSequenceId();
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 取出一帧。没有可用帧时阻塞。
     * 消费线程被中断时视为 Channel 对该消费者结束，中断标志会被保留。
     *
     * @throws ChannelEndedException Channel 已中止，或已关闭且没有剩余帧
     */
    public Frame pop() throws ChannelEndedException {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelEndedException(id, state);
        }
        try {
            while (buffer.isEmpty()) {
                ChannelState current = state;
                if (current == ChannelState.DRAINING) {
                    transition(ChannelState.CLOSED);
                    throw new ChannelEndedException(id, ChannelState.CLOSED);
                }
                if (current.isTerminal()) {
                    throw new ChannelEndedException(id, current);
                }
                try {
                    notEmpty.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ChannelEndedException(id, state);
                }
            }
            Frame frame = buffer.pollFirst();
            lastDeliveredSeq = frame.getSequenceId();
            if (state == ChannelState.DRAINING && buffer.isEmpty()) {
                transition(ChannelState.CLOSED);
            }
            notFull.signal();
            return frame;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 中止 Channel：丢弃缓冲，唤醒所有阻塞的 push/pop。幂等。
     *
     * @return 本次调用是否完成了到 ABORTED 的迁移；已处于终止状态时返回 false
     */
    public boolean abort() {
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            int discarded = buffer.size();
            buffer.clear();
            transition(ChannelState.ABORTED);
            notFull.signalAll();
            notEmpty.signalAll();
            if (discarded > 0) {
                log.debug("Channel {}({}): 中止时丢弃 {} 帧", id, regionSpec.getName(), discarded);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 生产端结束：之后不再接受新帧，消费端取完剩余帧后进入 CLOSED。
     *
     * @return 本次调用是否改变了状态
     */
    public boolean close() {
        lock.lock();
        try {
            if (state != ChannelState.RUNNING) {
                return false;
            }
            transition(buffer.isEmpty() ? ChannelState.CLOSED : ChannelState.DRAINING);
            notFull.signalAll();
            notEmpty.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 非阻塞的存活探测
     */
    public boolean isRunning() {
        ChannelState current = state;
        return current == ChannelState.RUNNING || current == ChannelState.DRAINING;
    }

    public ChannelState getState() {
        return state;
    }

    public long getLastDeliveredSeq() {
        return lastDeliveredSeq;
    }

    /**
     * 当前缓冲中尚未被取走的帧数
     */
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return regionSpec.getName();
    }

    private void ensureAccepting() throws ChannelClosedException {
        ChannelState current = state;
        if (current != ChannelState.RUNNING) {
            throw new ChannelClosedException(id, current);
        }
    }

    // 调用方必须持有锁
    private void transition(ChannelState next) {
        ChannelState previous = state;
        state = next;
        log.debug("Channel {}({}): {} -> {}", id, regionSpec.getName(), previous, next);
    }

    @Override
    public String toString() {
        return "FrameChannel{id=" + id + ", region=" + regionSpec.getName() + ", state=" + state
                + ", buffered=" + buffer.size() + "/" + capacity + "}";
    }
}
