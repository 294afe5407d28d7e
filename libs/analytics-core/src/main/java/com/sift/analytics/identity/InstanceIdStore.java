package com.sift.analytics.identity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists the instance uid next to the database and in the user configuration directory.
 * <p>
 * The uid is read from {@code <dataDir>/instance-uid}. When it is missing or unreadable a new one
 * is generated and written to both locations. Every I/O error is ignored: without a persisted
 * uid the next start simply generates another one.
 */
public final class InstanceIdStore {

    private static final Logger log = LoggerFactory.getLogger(InstanceIdStore.class);

    /** File holding the uid inside the data directory. */
    public static final String INSTANCE_UID_FILE = "instance-uid";

    private final Path dataDir;
    private final Path configDir;
    private final Supplier<UUID> generator;

    /**
     * @param dataDir   database directory; primary location of the uid
     * @param configDir user configuration directory; secondary copy, may be {@code null}
     */
    public InstanceIdStore(Path dataDir, Path configDir) {
        this(dataDir, configDir, UUID::randomUUID);
    }

    InstanceIdStore(Path dataDir, Path configDir, Supplier<UUID> generator) {
        if (dataDir == null) {
            throw new IllegalArgumentException("dataDir must not be null");
        }
        this.dataDir = dataDir;
        this.configDir = configDir;
        this.generator = generator;
    }

    /**
     * Reads the persisted uid or generates a new one, then writes it to both locations.
     */
    public InstanceIdentity load() {
        Optional<UUID> existing = read();
        UUID uid = existing.orElseGet(generator);
        write(uid);
        return new InstanceIdentity(uid, existing.isEmpty());
    }

    /**
     * Reads the uid persisted in the data directory, if any.
     */
    public Optional<UUID> read() {
        Path file = primaryFile();
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(Files.readString(file, StandardCharsets.UTF_8).trim()));
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Ignoring unreadable instance uid at {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the uid to the data directory and to the configuration directory.
     */
    public void write(UUID uid) {
        writeQuietly(primaryFile(), uid);
        secondaryFile().ifPresent(file -> writeQuietly(file, uid));
    }

    /** {@code <dataDir>/instance-uid}. */
    public Path primaryFile() {
        return dataDir.resolve(INSTANCE_UID_FILE);
    }

    /**
     * {@code <configDir>/<absolute data dir with separators replaced>-instance-uid}, so several
     * databases on the same machine keep distinct copies.
     */
    public Optional<Path> secondaryFile() {
        if (configDir == null) {
            return Optional.empty();
        }
        String absolute = dataDir.toAbsolutePath().normalize().toString();
        String flattened = absolute.replaceAll("[/\\\\:]+", "-").replaceAll("^-+", "");
        return Optional.of(configDir.resolve(flattened + "-" + INSTANCE_UID_FILE));
    }

    private static void writeQuietly(Path file, UUID uid) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, uid.toString(), StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            log.debug("Could not persist instance uid to {}: {}", file, e.getMessage());
        }
    }
}
