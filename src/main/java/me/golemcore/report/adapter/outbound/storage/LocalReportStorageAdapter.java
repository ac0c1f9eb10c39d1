package me.golemcore.report.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.report.domain.model.StoredReport;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.ReportStoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link ReportStoragePort}.
 *
 * <p>
 * Reports are plain {@code .txt} files in one directory, configured via
 * {@code report.storage.output-dir} (default
 * {@code ${user.home}/.golemcore/reports}). Writes go to a temp file first
 * and are moved into place atomically.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalReportStorageAdapter implements ReportStoragePort {

    private static final Pattern SAFE_FILE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}\\.txt");

    private final ReportProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String outputDir = properties.getStorage().getOutputDir();
        this.basePath = Paths.get(outputDir.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(basePath);
            log.info("[Storage] Report directory: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create report directory {}", basePath, e);
        }
    }

    @Override
    public CompletableFuture<Void> save(String fileName, String content) {
        Path target = resolve(fileName);
        return CompletableFuture.runAsync(() -> {
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                Files.createDirectories(basePath);
                Files.writeString(temp, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
                try {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("[Storage] Wrote {} ({} chars)", fileName, content.length());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write report: " + fileName, e);
            }
        });
    }

    @Override
    public CompletableFuture<Optional<String>> read(String fileName) {
        Path path = resolve(fileName);
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.isRegularFile(path)) {
                return Optional.empty();
            }
            try {
                return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read report: " + fileName, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<StoredReport>> list() {
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.isDirectory(basePath)) {
                return List.of();
            }
            try (Stream<Path> files = Files.list(basePath)) {
                return files
                        .filter(Files::isRegularFile)
                        .filter(path -> SAFE_FILE_NAME.matcher(path.getFileName().toString()).matches())
                        .map(this::describe)
                        .sorted(Comparator.comparing(StoredReport::modifiedAt).reversed()
                                .thenComparing(StoredReport::fileName))
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list reports in " + basePath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(String fileName) {
        Path path = resolve(fileName);
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Files.deleteIfExists(path);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete report: " + fileName, e);
            }
        });
    }

    private StoredReport describe(Path path) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new StoredReport(path.getFileName().toString(), attributes.size(),
                    attributes.lastModifiedTime().toInstant());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read attributes of " + path, e);
        }
    }

    /**
     * Resolve a report file name inside the output directory, rejecting
     * anything that could escape it.
     */
    Path resolve(String fileName) {
        if (fileName == null || !SAFE_FILE_NAME.matcher(fileName).matches()) {
            throw new IllegalArgumentException("Invalid report file name: " + fileName);
        }
        Path resolved = basePath.resolve(fileName).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Invalid report file name: " + fileName);
        }
        return resolved;
    }
}
