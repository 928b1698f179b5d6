package sh.harold.flotilla.cluster.process;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CurrentProcessCommandTest {

    @Test
    void macroArgumentsAreDropped() {
        List<String> arguments = List.of("spads.pl", "etc/spads.conf", "instanceDir=var/ClusterManager/ffa0",
                "lobbyLogin=Host0", "set:autoHostPort=8453", "--debug");

        assertThat(CurrentProcessCommand.withoutMacros(arguments))
                .containsExactly("spads.pl", "etc/spads.conf", "--debug");
    }

    @Test
    void resolvesCurrentExecutable() {
        List<String> command = CurrentProcessCommand.resolve();

        if (!command.isEmpty()) {
            assertThat(command.get(0)).isNotBlank();
        }
    }
}
