package sh.harold.flotilla.cluster;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleEventLoopTest {

    private final RoleEventLoop loop = new RoleEventLoop("test-loop");

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    void callRunsOnLoopThread() {
        String threadName = loop.call(() -> Thread.currentThread().getName());

        assertThat(threadName).isEqualTo("test-loop");
    }

    @Test
    void callPropagatesRuntimeExceptions() {
        assertThatThrownBy(() -> loop.call(() -> {
            throw new IllegalArgumentException("bad input");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("bad input");
    }

    @Test
    void callWrapsCheckedExceptions() {
        assertThatThrownBy(() -> loop.call(() -> {
            throw new IOException("disk");
        })).isInstanceOf(IllegalStateException.class).hasCauseInstanceOf(IOException.class);
    }

    @Test
    void nestedCallRunsInline() {
        int value = loop.call(() -> loop.call(() -> 42));

        assertThat(value).isEqualTo(42);
    }

    @Test
    void executedTasksRunInOrder() throws InterruptedException {
        StringBuilder order = new StringBuilder();
        CountDownLatch done = new CountDownLatch(1);

        loop.execute(() -> order.append('a'));
        loop.execute(() -> {
            throw new IllegalStateException("ignored");
        });
        loop.execute(() -> order.append('b'));
        loop.execute(done::countDown);

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(loop.call(order::toString)).isEqualTo("ab");
    }

    @Test
    void tickSurvivesFailures() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch threeRuns = new CountDownLatch(3);
        AtomicReference<String> thread = new AtomicReference<>();

        loop.startTick(() -> {
            thread.set(Thread.currentThread().getName());
            threeRuns.countDown();
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("first tick fails");
            }
        }, Duration.ofMillis(10));

        assertThat(threeRuns.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(thread.get()).isEqualTo("test-loop");
    }

    @Test
    void eventsAfterStopAreDropped() {
        AtomicInteger runs = new AtomicInteger();
        loop.stop();

        loop.execute(runs::incrementAndGet);

        assertThat(runs).hasValue(0);
        assertThatThrownBy(() -> loop.call(() -> 1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Event loop is stopped");
    }
}
