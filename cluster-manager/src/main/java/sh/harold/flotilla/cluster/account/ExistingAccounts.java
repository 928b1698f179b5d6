package sh.harold.flotilla.cluster.account;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Lobby accounts of instances known to exist, persisted across manager restarts so that bot
 * account registration is only requested for new instance names.
 */
public final class ExistingAccounts {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExistingAccounts.class);

    public static final String FILE_NAME = "existing-accounts.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;
    private final Map<String, AccountRecord> accounts;

    private ExistingAccounts(Path file, Map<String, AccountRecord> accounts) {
        this.file = file;
        this.accounts = accounts;
    }

    /**
     * Loads the accounts file, starting empty if it does not exist yet.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static ExistingAccounts load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            LOGGER.debug("No existing accounts file at {}, starting empty", file);
            return new ExistingAccounts(file, new TreeMap<>());
        }
        AccountsDocument document = MAPPER.readValue(file.toFile(), AccountsDocument.class);
        Map<String, AccountRecord> accounts = new TreeMap<>();
        if (document.accounts() != null) {
            accounts.putAll(document.accounts());
        }
        LOGGER.debug("Loaded {} existing accounts from {}", accounts.size(), file);
        return new ExistingAccounts(file, accounts);
    }

    public void save() throws IOException {
        Path temporary = file.resolveSibling(file.getFileName() + ".tmp");
        MAPPER.writeValue(temporary.toFile(), new AccountsDocument(new TreeMap<>(accounts)));
        Files.move(temporary, file, StandardCopyOption.REPLACE_EXISTING);
    }

    public boolean contains(String accountName) {
        return accounts.containsKey(accountName);
    }

    public void markSeen(String accountName, Instant now) {
        accounts.put(accountName, new AccountRecord(now, false));
    }

    public void markRegistrationRequested(String accountName, Instant now) {
        accounts.put(accountName, new AccountRecord(now, true));
    }

    public int size() {
        return accounts.size();
    }

    public record AccountsDocument(Map<String, AccountRecord> accounts) {
    }
}
