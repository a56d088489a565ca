package com.spacesync.backend.modules.telemetry.infrastructure.spool;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import com.spacesync.backend.modules.telemetry.application.WebhookProperties;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Durable append-only log of webhook deliveries plus a replay cursor.
 *
 * <p>Each entry is one JSON line in {@code spool.log}; {@code spool.cursor} holds the byte offset of
 * the first entry not yet replayed. Appends are forced to disk before the sender is acknowledged.
 * When the cursor reaches the end of the log both files are reset.
 */
@Component
public class WebhookSpool {

    private static final Logger log = LoggerFactory.getLogger(WebhookSpool.class);
    private static final String LOG_FILE = "spool.log";
    private static final String CURSOR_FILE = "spool.cursor";

    private final ObjectMapper objectMapper;
    private final Path logFile;
    private final Path cursorFile;
    private final long maxBacklogBytes;
    private final ReentrantLock replayLock = new ReentrantLock();

    public WebhookSpool(ObjectMapper objectMapper, WebhookProperties properties) {
        this(objectMapper, Path.of(properties.getSpool().getDirectory()), properties.getSpool().getMaxBacklogBytes());
    }

    WebhookSpool(ObjectMapper objectMapper, Path directory, long maxBacklogBytes) {
        this.objectMapper = objectMapper;
        this.logFile = directory.resolve(LOG_FILE);
        this.cursorFile = directory.resolve(CURSOR_FILE);
        this.maxBacklogBytes = maxBacklogBytes;
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot create spool directory " + directory, ex);
        }
    }

    public synchronized void append(SpooledEvent event) throws IOException, SpoolFullException {
        byte[] line = (objectMapper.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
        long backlog = backlogBytes();
        if (backlog + line.length > maxBacklogBytes) {
            throw new SpoolFullException("Spool backlog " + backlog + " bytes exceeds " + maxBacklogBytes);
        }
        try (FileChannel channel = FileChannel.open(logFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    /**
     * Hands spooled events to {@code handler} in append order. The handler returns {@code false} to
     * stop, leaving that event at the head for the next replay. Returns the number of events consumed.
     *
     * <p>The spool monitor is held only while an entry is read or the cursor moves, never while the
     * handler runs, so appends and backlog checks proceed during a slow replay. Concurrent replays are
     * skipped.
     */
    public int replay(Predicate<SpooledEvent> handler) throws IOException {
        if (!replayLock.tryLock()) {
            return 0;
        }
        try {
            int consumed = 0;
            SpoolEntry entry;
            while ((entry = nextEntry()) != null) {
                if (entry.event() != null) {
                    if (!handler.test(entry.event())) {
                        break;
                    }
                    consumed++;
                }
                advance(entry);
            }
            return consumed;
        } finally {
            replayLock.unlock();
        }
    }

    private synchronized SpoolEntry nextEntry() throws IOException {
        if (!Files.exists(logFile)) {
            return null;
        }
        long cursor = readCursor();
        try (FileChannel channel = FileChannel.open(logFile, StandardOpenOption.READ)) {
            channel.position(cursor);
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(Channels.newInputStream(channel), StandardCharsets.UTF_8));
            String line = reader.readLine();
            if (line == null) {
                reset();
                return null;
            }
            long next = cursor + line.getBytes(StandardCharsets.UTF_8).length + 1;
            if (line.isBlank()) {
                return new SpoolEntry(next, null);
            }
            try {
                return new SpoolEntry(next, objectMapper.readValue(line, SpooledEvent.class));
            } catch (IOException ex) {
                log.warn("[ALERT] Dropping unreadable spool entry at offset {}", cursor, ex);
                return new SpoolEntry(next, null);
            }
        }
    }

    private synchronized void advance(SpoolEntry entry) throws IOException {
        writeCursor(entry.next());
        if (entry.next() >= Files.size(logFile)) {
            reset();
        }
    }

    public synchronized boolean hasBacklog() {
        return backlogBytes() > 0;
    }

    public synchronized long backlogBytes() {
        try {
            if (!Files.exists(logFile)) {
                return 0L;
            }
            return Math.max(0L, Files.size(logFile) - readCursor());
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read spool state", ex);
        }
    }

    public long getMaxBacklogBytes() {
        return maxBacklogBytes;
    }

    private long readCursor() throws IOException {
        if (!Files.exists(cursorFile)) {
            return 0L;
        }
        String raw = Files.readString(cursorFile, StandardCharsets.UTF_8).trim();
        return raw.isEmpty() ? 0L : Long.parseLong(raw);
    }

    private void writeCursor(long cursor) throws IOException {
        Path temp = cursorFile.resolveSibling(CURSOR_FILE + ".tmp");
        try (FileChannel channel = FileChannel.open(temp,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            channel.write(ByteBuffer.wrap(Long.toString(cursor).getBytes(StandardCharsets.UTF_8)));
            channel.force(true);
        }
        Files.move(temp, cursorFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private void reset() throws IOException {
        Files.deleteIfExists(logFile);
        Files.deleteIfExists(cursorFile);
        log.info("Webhook spool drained");
    }

    private record SpoolEntry(long next, SpooledEvent event) {
    }
}
