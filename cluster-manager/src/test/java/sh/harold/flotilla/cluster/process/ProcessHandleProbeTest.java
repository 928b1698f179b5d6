package sh.harold.flotilla.cluster.process;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessHandleProbeTest {

    private final ProcessHandleProbe probe = new ProcessHandleProbe();

    @Test
    void currentProcessIsAlive() {
        assertThat(probe.isAlive(ProcessHandle.current().pid())).isTrue();
    }

    @Test
    void unusedProcessIdIsNotAlive() {
        assertThat(probe.isAlive(Long.MAX_VALUE)).isFalse();
    }
}
