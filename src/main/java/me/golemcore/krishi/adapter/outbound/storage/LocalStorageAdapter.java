package me.golemcore.krishi.adapter.outbound.storage;

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

import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import me.golemcore.krishi.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final KrishiProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getBasePath();
        this.basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        if (!properties.getStorage().getSnapshot().isEnabled()) {
            log.debug("[Storage] Snapshots disabled, not touching {}", basePath);
            return;
        }
        Path snapshotDir = basePath.resolve(properties.getStorage().getDirectory());
        try {
            Files.createDirectories(snapshotDir);
            log.info("[Storage] Snapshot directory ready: {}", snapshotDir);
        } catch (IOException e) {
            log.error("[Storage] Cannot create snapshot directory {}", snapshotDir, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolve(directory, path);
            if (!Files.isRegularFile(file)) {
                return null;
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ProviderException("Cannot read snapshot " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.isRegularFile(resolve(directory, path)));
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolve(directory, path);
            Path staging = sibling(target, ".tmp");
            try {
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                writeSynced(staging, content);
                if (backup && Files.isRegularFile(target)) {
                    Files.copy(target, sibling(target, ".bak"), StandardCopyOption.REPLACE_EXISTING);
                }
                replace(staging, target);
                log.debug("[Storage] Wrote {} chars to {}/{}", content.length(), directory, path);
            } catch (IOException e) {
                discard(staging);
                throw new ProviderException("Cannot write snapshot " + directory + "/" + path, e);
            }
        });
    }

    private static void writeSynced(Path file, String content) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void replace(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Filesystem has no atomic rename, falling back to plain move for {}", target);
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            log.warn("[Storage] Leftover staging file {}", staging, e);
        }
    }

    private static Path sibling(Path target, String suffix) {
        return target.resolveSibling(target.getFileName() + suffix);
    }

    private Path resolve(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Snapshot path escapes the workspace: " + directory + "/" + path);
        }
        return resolved;
    }
}
