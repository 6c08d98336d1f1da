/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.durable.core.eventlog;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.exception.EventLogConflictException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.model.RunKey;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Event log persisted as one JSON-lines journal per run:
 * {@code {directory}/{urlencoded workflowId}/{runId}.jsonl}.
 *
 * <p>Every batch is written as a single line and forced to disk before the
 * append completes. A line without its terminating newline is a torn write
 * from a failed append; it is truncated away when the journal is loaded, so
 * the log reads exactly as it did before the failed attempt.
 *
 * <p>Appends and loads run under an exclusive {@link FileLock} on the journal,
 * so several processes may share the directory. Within one JVM the lock is
 * paired with a monitor per journal path, since file locks are held on behalf
 * of the whole JVM.
 */
@Slf4j
public class FileEventLog implements EventLog {

    private static final String SUFFIX = ".jsonl";
    private static final TypeReference<List<HistoryEvent>> BATCH = new TypeReference<>() {};
    private static final ConcurrentHashMap<Path, Object> MONITORS = new ConcurrentHashMap<>();

    private final Path directory;
    private final PayloadConverter converter;
    private final ConcurrentHashMap<RunKey, Journal> journals = new ConcurrentHashMap<>();

    public FileEventLog(Path directory, PayloadConverter converter) {
        this.directory = directory;
        this.converter = converter;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create event log directory " + directory, e);
        }
        log.info("[event-log] File event log initialized at {}", directory.toAbsolutePath());
    }

    @Override
    public Mono<Void> append(RunKey runKey, long expectedSeq, List<HistoryEvent> events) {
        return Mono.<Void>fromRunnable(() -> {
            EventLog.checkBatch(runKey, expectedSeq, events);
            journal(runKey).append(runKey, expectedSeq, events, encode(events));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<HistoryEvent> read(RunKey runKey, long fromSeq) {
        return Mono.fromCallable(() -> journal(runKey).snapshot(fromSeq))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(list -> list);
    }

    @Override
    public Mono<Long> length(RunKey runKey) {
        return read(runKey, 0).count();
    }

    @Override
    public Flux<RunKey> runs() {
        return Mono.fromCallable(this::scanRuns)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(list -> list);
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.fromCallable(() -> Files.isDirectory(directory) && Files.isWritable(directory))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Path getDirectory() {
        return directory;
    }

    private byte[] encode(List<HistoryEvent> events) {
        byte[] json = converter.serializeToBytes(events);
        byte[] line = new byte[json.length + 1];
        System.arraycopy(json, 0, line, 0, json.length);
        line[json.length] = '\n';
        return line;
    }

    private Journal journal(RunKey runKey) {
        return journals.computeIfAbsent(runKey, key -> new Journal(fileFor(key)));
    }

    private Path fileFor(RunKey runKey) {
        String folder = URLEncoder.encode(runKey.workflowId(), StandardCharsets.UTF_8);
        String file = URLEncoder.encode(runKey.runId(), StandardCharsets.UTF_8) + SUFFIX;
        return directory.resolve(folder).resolve(file);
    }

    private List<RunKey> scanRuns() throws IOException {
        List<RunKey> keys = new ArrayList<>();
        try (Stream<Path> folders = Files.list(directory)) {
            for (Path folder : folders.filter(Files::isDirectory).toList()) {
                String workflowId = URLDecoder.decode(folder.getFileName().toString(), StandardCharsets.UTF_8);
                try (Stream<Path> files = Files.list(folder)) {
                    files.map(p -> p.getFileName().toString())
                            .filter(name -> name.endsWith(SUFFIX))
                            .map(name -> URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()),
                                    StandardCharsets.UTF_8))
                            .forEach(runId -> keys.add(new RunKey(workflowId, runId)));
                }
            }
        }
        return keys;
    }

    @FunctionalInterface
    private interface ChannelAction<T> {
        T apply(FileChannel channel) throws IOException;
    }

    /**
     * In-memory view of one journal file, refreshed under the file lock
     * whenever the file's size moved.
     */
    private final class Journal {
        private final Path file;
        private final Object monitor;
        private final List<HistoryEvent> events = new ArrayList<>();
        private long loadedSize = -1;

        private Journal(Path file) {
            this.file = file;
            this.monitor = MONITORS.computeIfAbsent(file.toAbsolutePath().normalize(), path -> new Object());
        }

        List<HistoryEvent> snapshot(long fromSeq) {
            synchronized (monitor) {
                if (!Files.exists(file)) {
                    events.clear();
                    loadedSize = 0;
                    return List.of();
                }
                return locked(false, channel -> {
                    refresh(channel);
                    int from = (int) Math.min(Math.max(fromSeq, 0), events.size());
                    return List.copyOf(events.subList(from, events.size()));
                });
            }
        }

        void append(RunKey runKey, long expectedSeq, List<HistoryEvent> batch, byte[] line) {
            synchronized (monitor) {
                locked(true, channel -> {
                    refresh(channel);
                    if (events.size() != expectedSeq) {
                        throw new EventLogConflictException(runKey, expectedSeq, events.size());
                    }
                    write(channel, line);
                    events.addAll(batch);
                    return null;
                });
            }
        }

        private <T> T locked(boolean create, ChannelAction<T> action) {
            try {
                if (create) {
                    Files.createDirectories(file.getParent());
                }
                try (FileChannel channel = create
                        ? FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)
                        : FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE);
                     FileLock lock = channel.lock()) {
                    return action.apply(channel);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot access journal " + file, e);
            }
        }

        private void refresh(FileChannel channel) throws IOException {
            long size = channel.size();
            if (size == loadedSize) return;
            events.clear();
            ByteBuffer buffer = ByteBuffer.allocate((int) size);
            long position = 0;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) break;
                position += read;
            }
            byte[] bytes = buffer.array();
            int length = (int) position;
            int lineStart = 0;
            for (int i = 0; i < length; i++) {
                if (bytes[i] != '\n') continue;
                String line = new String(bytes, lineStart, i - lineStart, StandardCharsets.UTF_8);
                if (!line.isBlank()) {
                    events.addAll(converter.deserialize(line, BATCH));
                }
                lineStart = i + 1;
            }
            if (lineStart < length) {
                log.warn("[event-log] Discarding torn write of {} byte(s) at the end of {}",
                        length - lineStart, file);
                channel.truncate(lineStart);
                channel.force(true);
            }
            loadedSize = lineStart;
        }

        private void write(FileChannel channel, byte[] line) throws IOException {
            long start = channel.size();
            try {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                long position = start;
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(true);
            } catch (IOException e) {
                channel.truncate(start);
                throw e;
            }
            loadedSize = start + line.length;
        }
    }
}
