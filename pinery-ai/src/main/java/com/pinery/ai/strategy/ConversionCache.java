package com.pinery.ai.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pinery.converter.codegen.GeneratedCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accepted conversions keyed by the SHA-256 of the normalized script source.
 *
 * Entries expire after their TTL and are dropped when read or by {@link #evictExpired()}.
 * Writes replace whatever is stored under the key; the same source always converts to an
 * equivalent result, so concurrent writers need no coordination. With a directory, every entry
 * is also written as {@code <hash>.json} and read back on a memory miss.
 */
public class ConversionCache {

    private static final Logger log = LoggerFactory.getLogger(ConversionCache.class);

    private static final ObjectMapper JSON = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    public static final int DEFAULT_TTL_DAYS = 30;

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final int ttlDays;
    private final Path directory;
    private final Clock clock;

    public ConversionCache() {
        this(DEFAULT_TTL_DAYS, null, Clock.systemUTC());
    }

    /**
     * @param directory where entries persist, or null for memory only
     */
    public ConversionCache(int ttlDays, Path directory, Clock clock) {
        this.ttlDays = ttlDays;
        this.directory = directory;
        this.clock = clock;
    }

    // ===== Keys =====

    /**
     * CRLF to LF, trailing whitespace stripped from every line, surrounding blank lines trimmed.
     */
    public static String normalize(String source) {
        String text = source.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder sb = new StringBuilder(text.length());
        for (String line : text.split("\n", -1)) {
            sb.append(line.stripTrailing()).append('\n');
        }
        return sb.toString().strip();
    }

    public static String key(String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalize(source).getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ===== Access =====

    public Optional<CacheEntry> get(String source) {
        String key = key(source);
        CacheEntry entry = entries.get(key);
        if (entry == null && directory != null) {
            entry = readFile(key);
            if (entry != null) {
                entries.put(key, entry);
            }
        }
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            log.debug("Cache entry expired: {}", key);
            remove(key);
            return Optional.empty();
        }
        log.debug("Cache hit: {}", key);
        return Optional.of(entry);
    }

    public CacheEntry put(String source, GeneratedCode code, ConversionStrategy strategyUsed, double costUsd) {
        String key = key(source);
        CacheEntry entry = new CacheEntry(key, code.fullCode(), code.className(), strategyUsed.id(), costUsd,
            clock.instant(), ttlDays, code.indicatorsUsed());
        entries.put(key, entry);
        if (directory != null) {
            writeFile(entry);
        }
        log.debug("Cached {} result: {}", strategyUsed.id(), key);
        return entry;
    }

    /**
     * Drop every expired entry from memory and disk.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int count = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                count++;
            }
        }
        if (directory != null && Files.isDirectory(directory)) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
                for (Path file : files) {
                    CacheEntry entry = readFile(file);
                    if (entry == null || entry.isExpired(now)) {
                        Files.deleteIfExists(file);
                        if (entry != null && !entries.containsKey(entry.hash())) {
                            count++;
                        }
                    }
                }
            } catch (IOException e) {
                log.warn("Failed to scan cache directory {}: {}", directory, e.getMessage());
            }
        }
        log.info("Evicted {} expired cache entries", count);
        return count;
    }

    public void clear() {
        entries.clear();
        if (directory != null && Files.isDirectory(directory)) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
                for (Path file : files) {
                    Files.deleteIfExists(file);
                }
            } catch (IOException e) {
                log.warn("Failed to clear cache directory {}: {}", directory, e.getMessage());
            }
        }
    }

    /**
     * Entries held in memory.
     */
    public int size() {
        return entries.size();
    }

    public int ttlDays() {
        return ttlDays;
    }

    // ===== Files =====

    private void remove(String key) {
        entries.remove(key);
        if (directory != null) {
            try {
                Files.deleteIfExists(file(key));
            } catch (IOException e) {
                log.warn("Failed to delete cache file for {}: {}", key, e.getMessage());
            }
        }
    }

    private Path file(String key) {
        return directory.resolve(key + ".json");
    }

    private CacheEntry readFile(String key) {
        Path file = file(key);
        return Files.exists(file) ? readFile(file) : null;
    }

    private CacheEntry readFile(Path file) {
        try {
            return JSON.readValue(file.toFile(), CacheEntry.class);
        } catch (IOException e) {
            log.warn("Unreadable cache file {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private void writeFile(CacheEntry entry) {
        try {
            Files.createDirectories(directory);
            Path target = file(entry.hash());
            Path tmp = Files.createTempFile(directory, entry.hash(), ".tmp");
            JSON.writeValue(tmp.toFile(), entry);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Failed to write cache file for {}: {}", entry.hash(), e.getMessage());
        }
    }
}
