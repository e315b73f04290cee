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

package me.golemcore.imagebot.adapter.outbound.storage;

import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Base path configured via {@code bot.storage.local.base-path}, defaults to
 * {@code ${user.home}/.golemcore/image-bot}. The usage ledger lives in the
 * {@code logs/} subdirectory.
 *
 * <p>
 * Operations complete synchronously; the returned futures exist so callers can
 * {@code join()} and get failures as {@link java.util.concurrent.CompletionException}
 * the same way for every storage backend.
 *
 * @see me.golemcore.imagebot.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final BotProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory {}", basePath, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        try {
            Path filePath = resolvePath(directory, path);
            if (!Files.exists(filePath)) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.completedFuture(Files.readString(filePath, StandardCharsets.UTF_8));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new UncheckedIOException("Failed to read file: " + directory + "/" + path, e));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        try {
            return CompletableFuture.completedFuture(Files.exists(resolvePath(directory, path)));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        try {
            Files.createDirectories(resolvePath(directory, "."));
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new UncheckedIOException("Failed to create directory: " + directory, e));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        Path targetPath;
        try {
            targetPath = resolvePath(directory, path);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

        try {
            Path parent = targetPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            // 1. Write to temp file with fsync
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            // 2. Verify written content is readable
            if (Files.size(tempPath) != bytes.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            // 3. Backup existing file if requested
            if (backup && Files.exists(targetPath)) {
                Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                log.debug("[Storage] Created backup: {}", backupPath);
            }

            // 4. Atomic rename
            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }

            log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            return CompletableFuture.failedFuture(
                    new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e));
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
