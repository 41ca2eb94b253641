package com.catalog.picklist.service;

import com.catalog.picklist.dto.MismatchInput;
import com.catalog.picklist.model.PicklistType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class MismatchWriteBufferTest {

    private static final TaskExecutor INLINE = Runnable::run;

    @Mock
    private MismatchUpsertStore upsertStore;

    static MismatchInput input(String value) {
        return new MismatchInput(PicklistType.BRAND, value, "api", null, 0.3, 0.7,
                List.of(), null, null, null, OffsetDateTime.now());
    }

    @Test
    void bufferedItemsAreWrittenOnlyOnFlush() {
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 100, 50);

        buffer.enqueue(input("Acme"));
        buffer.enqueue(input("Zenith"));

        verifyNoInteractions(upsertStore);
        assertThat(buffer.pendingCount()).isEqualTo(2);
        assertThat(buffer.flush()).isEqualTo(2);
        assertThat(buffer.pendingCount()).isZero();
        verify(upsertStore, times(2)).upsert(any(MismatchInput.class));
    }

    @Test
    void reachingFlushSizeDispatchesFlush() {
        List<Runnable> dispatched = new ArrayList<>();
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, dispatched::add, 100, 3);

        buffer.enqueue(input("a"));
        buffer.enqueue(input("b"));
        assertThat(dispatched).isEmpty();
        buffer.enqueue(input("c"));

        assertThat(dispatched).hasSize(1);
        dispatched.get(0).run();
        verify(upsertStore, times(3)).upsert(any(MismatchInput.class));
        assertThat(buffer.pendingCount()).isZero();
    }

    private void rejectWrites(MismatchInput... rejected) {
        List<MismatchInput> failing = List.of(rejected);
        doAnswer(invocation -> {
            if (failing.contains(invocation.getArgument(0))) {
                throw new IllegalStateException("invalid byte sequence for encoding \"UTF8\": 0x00");
            }
            return null;
        }).when(upsertStore).upsert(any(MismatchInput.class));
    }

    @Test
    void failedItemIsRequeuedWithoutRewritingOthers() {
        MismatchInput first = input("first");
        MismatchInput second = input("second");
        MismatchInput third = input("third");
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 100, 50);
        rejectWrites(second);

        buffer.enqueue(first);
        buffer.enqueue(second);
        buffer.enqueue(third);

        assertThat(buffer.flush()).isEqualTo(2);
        assertThat(buffer.pendingCount()).isEqualTo(1);

        rejectWrites();
        assertThat(buffer.flush()).isEqualTo(1);

        verify(upsertStore, times(1)).upsert(first);
        verify(upsertStore, times(2)).upsert(second);
        verify(upsertStore, times(1)).upsert(third);
        assertThat(buffer.pendingCount()).isZero();
    }

    @Test
    void itemThatAlwaysFailsDoesNotHoldBackLaterItems() {
        MismatchInput poisoned = input("bad\u0000value");
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 100, 50);
        rejectWrites(poisoned);

        buffer.enqueue(poisoned);
        buffer.enqueue(input("Acme"));
        buffer.enqueue(input("Zenith"));

        int written = 0;
        for (int i = 0; i < 5; i++) {
            written += buffer.flush();
        }

        assertThat(written).isEqualTo(2);
        assertThat(buffer.pendingCount()).isEqualTo(1);
    }

    @Test
    void itemIsDroppedAfterMaxAttemptsWhileOthersAreWritten() {
        MismatchInput poisoned = input("bad\u0000value");
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 100, 50, 2);
        rejectWrites(poisoned);

        buffer.enqueue(poisoned);
        buffer.enqueue(input("Acme"));
        buffer.flush();
        assertThat(buffer.pendingCount()).isEqualTo(1);

        buffer.enqueue(input("Zenith"));
        buffer.flush();

        assertThat(buffer.pendingCount()).isZero();
        assertThat(buffer.droppedCount()).isEqualTo(1);
        verify(upsertStore, times(2)).upsert(poisoned);
    }

    @Test
    void outageStopsFlushAndCountsNoAttempts() {
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 100, 50, 1);
        doThrow(new IllegalStateException("connection refused")).when(upsertStore).upsert(any(MismatchInput.class));
        for (String value : List.of("a", "b", "c", "d", "e")) {
            buffer.enqueue(input(value));
        }

        assertThat(buffer.flush()).isZero();
        assertThat(buffer.flush()).isZero();

        verify(upsertStore, times(2 * MismatchWriteBuffer.MAX_CONSECUTIVE_FAILURES)).upsert(any(MismatchInput.class));
        assertThat(buffer.pendingCount()).isEqualTo(5);
        assertThat(buffer.droppedCount()).isZero();
    }

    @Test
    void overlappingFlushReturnsImmediately() {
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 100, 50);
        AtomicInteger nestedResult = new AtomicInteger(-1);
        doAnswer(invocation -> {
            nestedResult.set(buffer.flush());
            return null;
        }).when(upsertStore).upsert(any(MismatchInput.class));

        buffer.enqueue(input("a"));
        buffer.enqueue(input("b"));

        assertThat(buffer.flush()).isEqualTo(2);
        assertThat(nestedResult.get()).isZero();
    }

    @Test
    void fullQueueFlushesSynchronouslyThenAcceptsItem() {
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 2, 100);

        assertThat(buffer.enqueue(input("a"))).isTrue();
        assertThat(buffer.enqueue(input("b"))).isTrue();
        assertThat(buffer.enqueue(input("c"))).isTrue();

        verify(upsertStore, times(2)).upsert(any(MismatchInput.class));
        assertThat(buffer.pendingCount()).isEqualTo(1);
    }

    @Test
    void itemIsReportedLostWhenQueueStaysFull() {
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 1, 100);
        doThrow(new IllegalStateException("database down")).when(upsertStore).upsert(any(MismatchInput.class));

        assertThat(buffer.enqueue(input("a"))).isTrue();
        assertThat(buffer.enqueue(input("b"))).isFalse();
        assertThat(buffer.pendingCount()).isEqualTo(1);
    }

    @Test
    void shutdownWritesRemainingItemsAndStopsTimerFlushes() {
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 100, 50);
        buffer.enqueue(input("a"));

        buffer.shutdown();
        verify(upsertStore, times(1)).upsert(any(MismatchInput.class));

        buffer.enqueue(input("b"));
        buffer.scheduledFlush();
        assertThat(buffer.pendingCount()).isEqualTo(1);
    }

    @Test
    void flushingEmptyBufferIsNoOp() {
        MismatchWriteBuffer buffer = new MismatchWriteBuffer(upsertStore, INLINE, 100, 50);

        assertThat(buffer.flush()).isZero();
        verifyNoInteractions(upsertStore);
    }
}
