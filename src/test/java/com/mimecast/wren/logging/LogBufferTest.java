package com.mimecast.wren.logging;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class LogBufferTest {

    @Test
    void evictsOldest() {
        LogBuffer buffer = new LogBuffer(3);
        for (int i = 1; i <= 5; i++) {
            buffer.append("line " + i);
        }

        assertEquals(List.of("line 3", "line 4", "line 5"), buffer.snapshot());
        assertEquals(3, buffer.size());
        assertEquals(3, buffer.capacity());
    }

    @Test
    void snapshotIsDetached() {
        LogBuffer buffer = new LogBuffer(5);
        buffer.append("first");

        List<String> snapshot = buffer.snapshot();
        buffer.append("second");

        assertEquals(List.of("first"), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("third"));
    }

    @Test
    void defaultCapacity() {
        assertEquals(LogBuffer.DEFAULT_CAPACITY, new LogBuffer().capacity());
        assertThrows(IllegalArgumentException.class, () -> new LogBuffer(0));
    }

    @Test
    void concurrentAppends() throws InterruptedException {
        LogBuffer buffer = new LogBuffer(100);
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            int id = t;
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 250; i++) {
                    buffer.append("t" + id + "-" + i);
                }
            });
            thread.start();
            threads.add(thread);
        }

        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }

        assertEquals(100, buffer.size());
        assertEquals(100, buffer.snapshot().stream().distinct().count());
    }
}
