package com.quadscan.core.channel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.quadscan.core.frame.Frame;
import com.quadscan.core.frame.Rectangle;
import com.quadscan.core.frame.RegionSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FrameChannel 测试
 * 验证背压、顺序、中止和关闭语义
 */
class FrameChannelTest {

    private static final RegionSpec REGION = new RegionSpec("UL", new Rectangle(0, 0, 2, 2), null);

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Frame frame(long seq) {
        return Frame.black(seq, 2, 2, 1);
    }

    @Test
    @DisplayName("测试按顺序收发")
    void testPushPopInOrder() throws Exception {
        FrameChannel channel = new FrameChannel(0, REGION, 3);
        channel.push(frame(0));
        channel.push(frame(1));
        channel.push(frame(2));

        assertEquals(3, channel.size());
        assertEquals(0, channel.pop().getSequenceId());
        assertEquals(1, channel.pop().getSequenceId());
        assertEquals(2, channel.pop().getSequenceId());
        assertEquals(2, channel.getLastDeliveredSeq());
        assertEquals(0, channel.size());
        assertTrue(channel.isRunning());
    }

    @Test
    @DisplayName("测试缓冲满时push阻塞，pop后继续")
    void testBackpressure() throws Exception {
        FrameChannel channel = new FrameChannel(0, REGION, 1);
        channel.push(frame(0));

        CountDownLatch pushing = new CountDownLatch(1);
        Future<?> blockedPush = executor.submit(() -> {
            pushing.countDown();
            channel.push(frame(1));
            return null;
        });

        assertTrue(pushing.await(1, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertFalse(blockedPush.isDone(), "缓冲已满时push应该阻塞");
        assertEquals(1, channel.size());

        assertEquals(0, channel.pop().getSequenceId());
        blockedPush.get(1, TimeUnit.SECONDS);
        assertEquals(1, channel.size());
        assertEquals(1, channel.pop().getSequenceId());
    }

    @Test
    @DisplayName("测试缓冲帧数从不超过容量")
    void testCapacityBound() throws Exception {
        int capacity = 2;
        FrameChannel channel = new FrameChannel(0, REGION, capacity);
        AtomicInteger maxObserved = new AtomicInteger();

        Future<?> producer = executor.submit(() -> {
            for (int i = 0; i < 200; i++) {
                channel.push(frame(i));
                maxObserved.accumulateAndGet(channel.size(), Math::max);
            }
            channel.close();
            return null;
        });

        List<Long> received = new ArrayList<>();
        try {
            while (true) {
                received.add(channel.pop().getSequenceId());
                maxObserved.accumulateAndGet(channel.size(), Math::max);
            }
        } catch (ChannelEndedException e) {
            assertEquals(ChannelState.CLOSED, e.getState());
        }
        producer.get(5, TimeUnit.SECONDS);

        assertEquals(200, received.size());
        assertTrue(maxObserved.get() <= capacity, "缓冲帧数超过容量: " + maxObserved.get());
        for (int i = 0; i < received.size(); i++) {
            assertEquals(i, received.get(i));
        }
    }

    @Test
    @DisplayName("测试abort唤醒阻塞中的push")
    void testAbortWakesBlockedPush() throws Exception {
        FrameChannel channel = new FrameChannel(0, REGION, 1);
        channel.push(frame(0));

        Future<?> blockedPush = executor.submit(() -> {
            channel.push(frame(1));
            return null;
        });
        Thread.sleep(50);

        assertTrue(channel.abort());
        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> blockedPush.get(1, TimeUnit.SECONDS));
        assertInstanceOf(ChannelClosedException.class, thrown.getCause());
        assertEquals(ChannelState.ABORTED, channel.getState());
        assertEquals(0, channel.size(), "中止时应丢弃缓冲的帧");
    }

    @Test
    @DisplayName("测试abort唤醒阻塞中的pop")
    void testAbortWakesBlockedPop() throws Exception {
        FrameChannel channel = new FrameChannel(0, REGION);
        AtomicReference<ChannelState> endedState = new AtomicReference<>();
        CountDownLatch ended = new CountDownLatch(1);

        executor.submit(() -> {
            try {
                channel.pop();
            } catch (ChannelEndedException e) {
                endedState.set(e.getState());
                ended.countDown();
            }
        });
        Thread.sleep(50);

        channel.abort();
        assertTrue(ended.await(1, TimeUnit.SECONDS), "pop应该被abort唤醒");
        assertEquals(ChannelState.ABORTED, endedState.get());
        assertFalse(channel.isRunning());
    }

    @Test
    @DisplayName("测试abort幂等：并发调用只有一次真正迁移")
    void testAbortIdempotence() throws Exception {
        FrameChannel channel = new FrameChannel(0, REGION);
        channel.push(frame(0));

        int callers = 8;
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(executor.submit(() -> {
                start.await();
                return channel.abort();
            }));
        }
        start.countDown();

        int transitions = 0;
        for (Future<Boolean> result : results) {
            if (result.get(1, TimeUnit.SECONDS)) {
                transitions++;
            }
        }
        assertEquals(1, transitions);
        assertEquals(ChannelState.ABORTED, channel.getState());

        assertFalse(channel.abort(), "再次abort应为no-op");
        assertEquals(ChannelState.ABORTED, channel.getState());
        assertThrows(ChannelClosedException.class, () -> channel.push(frame(1)));
        assertThrows(ChannelEndedException.class, channel::pop);
    }

    @Test
    @DisplayName("测试close后消费端取完缓冲再结束")
    void testCloseDrainsBufferedFrames() throws Exception {
        FrameChannel channel = new FrameChannel(0, REGION, 2);
        channel.push(frame(0));
        channel.push(frame(1));

        assertTrue(channel.close());
        assertEquals(ChannelState.DRAINING, channel.getState());
        assertTrue(channel.isRunning());
        assertThrows(ChannelClosedException.class, () -> channel.push(frame(2)));

        assertEquals(0, channel.pop().getSequenceId());
        assertEquals(1, channel.pop().getSequenceId());
        assertEquals(ChannelState.CLOSED, channel.getState());

        ChannelEndedException ended = assertThrows(ChannelEndedException.class, channel::pop);
        assertEquals(ChannelState.CLOSED, ended.getState());
        assertFalse(channel.abort(), "已关闭的Channel不能再被中止");
        assertEquals(ChannelState.CLOSED, channel.getState());
    }

    @Test
    @DisplayName("测试空Channel直接close进入CLOSED")
    void testCloseEmptyChannel() {
        FrameChannel channel = new FrameChannel(0, REGION);
        assertTrue(channel.close());
        assertEquals(ChannelState.CLOSED, channel.getState());
        assertFalse(channel.close());
    }

    @Test
    @DisplayName("测试pop线程被中断")
    void testInterruptedPop() throws Exception {
        FrameChannel channel = new FrameChannel(0, REGION);
        AtomicReference<Boolean> interruptFlag = new AtomicReference<>();
        CountDownLatch ended = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            try {
                channel.pop();
            } catch (ChannelEndedException e) {
                interruptFlag.set(Thread.currentThread().isInterrupted());
                ended.countDown();
            }
        });
        consumer.start();
        Thread.sleep(50);
        consumer.interrupt();

        assertTrue(ended.await(1, TimeUnit.SECONDS));
        assertTrue(interruptFlag.get(), "中断标志应被保留");
        assertEquals(ChannelState.RUNNING, channel.getState(), "中断消费线程不改变Channel状态");
    }

    @Test
    @DisplayName("测试拒绝乱序的帧")
    void testRejectsOutOfOrderFrames() throws Exception {
        FrameChannel channel = new FrameChannel(0, REGION, 4);
        channel.push(frame(3));
        assertThrows(IllegalArgumentException.class, () -> channel.push(frame(3)));
        assertThrows(IllegalArgumentException.class, () -> channel.push(frame(1)));
        assertThrows(IllegalArgumentException.class, () -> new FrameChannel(1, REGION, 0));
    }
}
