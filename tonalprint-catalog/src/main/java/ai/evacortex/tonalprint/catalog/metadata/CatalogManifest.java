/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.catalog.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * JSON file listing every catalog entry by ID.
 *
 * <p>Each flush first copies the current file to {@code <name>.bak}. If the primary file cannot be
 * read on load, the backup is restored in its place; only when both are unreadable does loading
 * fail.</p>
 */
public class CatalogManifest {

    private static final Logger LOG = LogManager.getLogger(CatalogManifest.class);

    public static final int FORMAT_VERSION = 1;

    private final Path manifestFile;
    private final Map<String, CatalogEntry> entries;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock rwLock;

    public record ManifestFile(int formatVersion, Map<String, CatalogEntry> entries) {}

    public static CatalogManifest loadOrCreate(Path path) {
        CatalogManifest manifest = new CatalogManifest(path);
        if (!Files.exists(path)) {
            return manifest;
        }
        Path backup = backupOf(path);
        try {
            manifest.entries.putAll(manifest.read(path));
        } catch (IOException primaryFailure) {
            if (!Files.exists(backup)) {
                throw new UncheckedIOException("Failed to load catalog manifest " + path, primaryFailure);
            }
            LOG.warn("Catalog manifest {} is unreadable ({}), restoring {}", path, primaryFailure.getMessage(), backup);
            try {
                manifest.entries.putAll(manifest.read(backup));
                Files.copy(backup, path, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException backupFailure) {
                backupFailure.addSuppressed(primaryFailure);
                throw new UncheckedIOException("Failed to load catalog manifest and its backup " + path, backupFailure);
            }
        }
        return manifest;
    }

    private CatalogManifest(Path manifestFile) {
        this.manifestFile = manifestFile;
        this.mapper = new ObjectMapper();
        this.entries = new TreeMap<>();
        this.rwLock = new ReentrantReadWriteLock();
    }

    private Map<String, CatalogEntry> read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            ManifestFile file = mapper.readValue(in, ManifestFile.class);
            if (file.formatVersion() != FORMAT_VERSION) {
                throw new IOException("Unsupported catalog manifest version " + file.formatVersion());
            }
            return file.entries() == null ? Map.of() : file.entries();
        } catch (RuntimeException e) {
            throw new IOException("Invalid catalog manifest " + path, e);
        }
    }

    public void put(String id, CatalogEntry entry) {
        rwLock.writeLock().lock();
        try {
            entries.put(id, entry);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public CatalogEntry remove(String id) {
        rwLock.writeLock().lock();
        try {
            return entries.remove(id);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public CatalogEntry get(String id) {
        rwLock.readLock().lock();
        try {
            return entries.get(id);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public boolean contains(String id) {
        rwLock.readLock().lock();
        try {
            return entries.containsKey(id);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public int size() {
        rwLock.readLock().lock();
        try {
            return entries.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /** Entries ordered by ID. */
    public Map<String, CatalogEntry> snapshot() {
        rwLock.readLock().lock();
        try {
            return new TreeMap<>(entries);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public Set<String> getAllIds() {
        rwLock.readLock().lock();
        try {
            return new TreeSet<>(entries.keySet());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public void flush() {
        rwLock.writeLock().lock();
        try {
            Files.createDirectories(manifestFile.getParent());
            if (Files.exists(manifestFile)) {
                Files.copy(manifestFile, backupOf(manifestFile), StandardCopyOption.REPLACE_EXISTING);
            }
            try (OutputStream out = Files.newOutputStream(manifestFile,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, new ManifestFile(FORMAT_VERSION, entries));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush catalog manifest " + manifestFile, e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public Path path() {
        return manifestFile;
    }

    static Path backupOf(Path path) {
        return path.resolveSibling(path.getFileName().toString() + ".bak");
    }
}
