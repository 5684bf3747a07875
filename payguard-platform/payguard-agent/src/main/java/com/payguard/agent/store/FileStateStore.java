package com.payguard.agent.store;

import com.payguard.agent.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * File-backed StateStore. One file per key under a state directory.
 * Writes go to a temporary file first and are moved into place, so a crash
 * leaves either the previous or the new document, never a torn one.
 */
public class FileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;

    public FileStateStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create state directory " + directory, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        Path file = fileFor(key);
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new PersistenceException("Cannot read state '" + key + "'", e);
        }
    }

    @Override
    public synchronized void put(String key, String value) {
        Objects.requireNonNull(value, "Value cannot be null");
        Path file = fileFor(key);
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported in {}, falling back to replace", directory);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot write state '" + key + "'", e);
        }
    }

    @Override
    public synchronized void remove(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new PersistenceException("Cannot remove state '" + key + "'", e);
        }
    }

    public Path directory() {
        return directory;
    }

    private Path fileFor(String key) {
        Objects.requireNonNull(key, "Key cannot be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be blank");
        }
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }
}
