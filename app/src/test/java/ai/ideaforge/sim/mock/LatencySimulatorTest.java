package ai.ideaforge.sim.mock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class LatencySimulatorTest {

    @Test
    void drawsWithinInclusiveBounds() {
        LatencySimulator simulator = new LatencySimulator(new Random(42));

        for (int i = 0; i < 500; i++) {
            long latency = simulator.draw(50, 100);
            assertThat(latency).isBetween(50L, 100L);
            assertThat(simulator.lastDrawn()).isEqualTo(latency);
        }
        assertThat(simulator.draw(30, 30)).isEqualTo(30);
    }

    @Test
    void rejectsInvalidBounds() {
        LatencySimulator simulator = new LatencySimulator();

        assertThatThrownBy(() -> simulator.draw(-1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> simulator.draw(20, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zeroLatencyRunsOnCallingThread() {
        AtomicReference<Thread> runner = new AtomicReference<>();

        new LatencySimulator().executorFor(0).execute(() -> runner.set(Thread.currentThread()));

        assertThat(runner.get()).isSameAs(Thread.currentThread());
    }
}
