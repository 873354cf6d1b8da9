package io.eventchat.server.loop;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChatEventLoopTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final ChatEventLoop loop = new ChatEventLoop();

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void tasks_run_one_at_a_time_in_submission_order() {
        List<Integer> seen = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            int n = i;
            loop.execute(() -> seen.add(n));
        }
        List<Integer> snapshot = loop.call(() -> List.copyOf(seen), TIMEOUT);

        assertEquals(100, snapshot.size());
        for (int i = 0; i < 100; i++) assertEquals(i, snapshot.get(i).intValue());
    }

    @Test
    void tasks_run_on_the_loop_thread() {
        String name = loop.call(() -> Thread.currentThread().getName(), TIMEOUT);
        assertEquals(ChatEventLoop.THREAD_NAME, name);
        assertFalse(loop.inLoop());
        assertTrue(loop.call(loop::inLoop, TIMEOUT));
    }

    @Test
    void call_from_inside_the_loop_runs_inline() {
        int v = loop.call(() -> loop.call(() -> 7, TIMEOUT) + 1, TIMEOUT);
        assertEquals(8, v);
    }

    @Test
    void runtime_exception_reaches_the_caller_unwrapped() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> loop.call(() -> { throw new IllegalArgumentException("boom"); }, TIMEOUT));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void failing_task_does_not_stop_the_loop() {
        loop.execute(() -> { throw new IllegalStateException("task failed"); });
        assertEquals("alive", loop.call(() -> "alive", TIMEOUT));
    }

    @Test
    void slow_task_times_out_the_caller() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        loop.execute(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThrows(IllegalStateException.class, () -> loop.call(() -> 1, Duration.ofMillis(100)));
        release.countDown();
    }

    @Test
    void closed_loop_refuses_calls_and_drops_tasks() {
        loop.close();
        loop.execute(() -> fail("should not run"));
        assertThrows(IllegalStateException.class, () -> loop.call(() -> 1, TIMEOUT));
    }
}
