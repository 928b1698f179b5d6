package sh.harold.flotilla.cluster.account;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExistingAccountsTest {

    @TempDir
    Path directory;

    @Test
    void missingFileStartsEmpty() throws IOException {
        ExistingAccounts accounts = ExistingAccounts.load(directory.resolve(ExistingAccounts.FILE_NAME));

        assertThat(accounts.size()).isZero();
        assertThat(accounts.contains("Host0")).isFalse();
    }

    @Test
    void savedAccountsAreReloaded() throws IOException {
        Path file = directory.resolve(ExistingAccounts.FILE_NAME);
        ExistingAccounts accounts = ExistingAccounts.load(file);
        accounts.markSeen("Host0", Instant.parse("2024-05-01T12:00:00Z"));
        accounts.markRegistrationRequested("Host1", Instant.parse("2024-05-01T12:05:00Z"));
        accounts.save();

        ExistingAccounts reloaded = ExistingAccounts.load(file);

        assertThat(reloaded.size()).isEqualTo(2);
        assertThat(reloaded.contains("Host0")).isTrue();
        assertThat(reloaded.contains("Host1")).isTrue();
        assertThat(Files.readString(file)).contains("\"registrationRequested\" : true", "2024-05-01T12:05:00Z");
        assertThat(directory.resolve(ExistingAccounts.FILE_NAME + ".tmp")).doesNotExist();
    }

    @Test
    void corruptFileIsReported() throws IOException {
        Path file = directory.resolve(ExistingAccounts.FILE_NAME);
        Files.writeString(file, "{ not json");

        assertThatThrownBy(() -> ExistingAccounts.load(file)).isInstanceOf(IOException.class);
    }
}
