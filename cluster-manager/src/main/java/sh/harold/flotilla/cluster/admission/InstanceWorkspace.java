package sh.harold.flotilla.cluster.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Prepares the working directory of a new instance from the manager instance directory.
 *
 * <p>Layout: {@code cache} (symbolic link to the manager cache when archive cache sharing is
 * enabled, copy otherwise), instance data files, {@code log} directory.</p>
 */
public class InstanceWorkspace {
    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceWorkspace.class);

    static final String CACHE_DIRECTORY = "cache";
    static final String LOG_DIRECTORY = "log";
    static final List<String> INSTANCE_DATA_FILES = List.of("mapHashes.dat", "userData.dat");

    private final Path sourceDirectory;

    /**
     * @param sourceDirectory Instance directory of the manager, holding the data to share
     */
    public InstanceWorkspace(Path sourceDirectory) {
        this.sourceDirectory = Objects.requireNonNull(sourceDirectory, "sourceDirectory");
    }

    /**
     * @param privateDataFiles Additional data files each instance gets its own copy of
     * @throws IOException if the directory, a data file copy or the log directory cannot be created;
     *                     cache initialization failures are only logged
     */
    public void prepare(Path instanceDirectory, boolean shareArchiveCache, List<String> privateDataFiles) throws IOException {
        Files.createDirectories(instanceDirectory);

        Path sourceCache = sourceDirectory.resolve(CACHE_DIRECTORY);
        Path instanceCache = instanceDirectory.resolve(CACHE_DIRECTORY);
        if (Files.isDirectory(sourceCache) && !Files.exists(instanceCache, LinkOption.NOFOLLOW_LINKS)) {
            if (shareArchiveCache) {
                try {
                    Files.createSymbolicLink(instanceCache, sourceCache.toAbsolutePath());
                } catch (IOException | UnsupportedOperationException e) {
                    LOGGER.warn("Failed to create symbolic link \"{}\" to directory \"{}\" to initialize instance archive cache ({})",
                            instanceCache, sourceCache, e.getMessage());
                }
            } else {
                try {
                    copyDirectory(sourceCache, instanceCache);
                } catch (IOException e) {
                    LOGGER.warn("Failed to copy cache data from \"{}\" to \"{}\" to initialize instance archive cache ({})",
                            sourceCache, instanceCache, e.getMessage());
                }
            }
        }

        List<String> dataFiles = new ArrayList<>(INSTANCE_DATA_FILES);
        dataFiles.addAll(privateDataFiles);
        for (String dataFile : dataFiles) {
            Path source = sourceDirectory.resolve(dataFile);
            Path destination = instanceDirectory.resolve(dataFile);
            if (Files.isRegularFile(source) && !Files.exists(destination)) {
                Files.copy(source, destination);
            }
        }

        Files.createDirectories(instanceDirectory.resolve(LOG_DIRECTORY));
    }

    /**
     * Copies a directory tree, skipping symbolic links and hidden entries.
     */
    static void copyDirectory(Path source, Path destination) throws IOException {
        Files.createDirectories(destination);
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(source)) {
            for (Path entry : entries) {
                String fileName = entry.getFileName().toString();
                if (fileName.startsWith(".") || Files.isSymbolicLink(entry)) {
                    continue;
                }
                Path target = destination.resolve(fileName);
                if (Files.isDirectory(entry)) {
                    copyDirectory(entry, target);
                } else if (Files.isRegularFile(entry)) {
                    Files.copy(entry, target);
                } else {
                    LOGGER.warn("Ignoring unknown item during directory copy: \"{}\"", entry);
                }
            }
        }
    }
}
