package me.golemcore.agent.adapter.outbound.credentials;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.Credentials;
import me.golemcore.agent.port.outbound.CredentialStore;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

/**
 * Keeps the credential set in a single JSON file readable only by the current
 * user.
 *
 * <p>
 * Writes go to a sibling temp file that is synced and then renamed over the
 * target, so a reader never observes a half-written file.
 */
@Slf4j
public class FileCredentialStore implements CredentialStore {

    private static final String DIRECTORY_PERMISSIONS = "rwx------";
    private static final String FILE_PERMISSIONS = "rw-------";

    private final Path file;
    private final ObjectMapper objectMapper;

    public FileCredentialStore(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Optional<Credentials> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            Credentials credentials = objectMapper.readValue(file.toFile(), Credentials.class);
            if (credentials == null || credentials.getAccessToken() == null) {
                log.warn("[Credentials] Ignoring incomplete credential file {}", file);
                return Optional.empty();
            }
            return Optional.of(credentials);
        } catch (IOException e) {
            log.warn("[Credentials] Ignoring unreadable credential file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(Credentials credentials) {
        Path tempPath = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
                restrict(parent, DIRECTORY_PERMISSIONS);
            }

            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(credentials);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }
            restrict(tempPath, FILE_PERMISSIONS);

            try {
                Files.move(tempPath, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Credentials] Atomic move not supported, using regular move");
                Files.move(tempPath, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Credentials] Saved credentials to {}", file);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Credentials] Failed to cleanup temp file: {}", tempPath);
            }
            throw new UncheckedIOException("Failed to save credentials: " + file, e);
        }
    }

    @Override
    public void clear() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("[Credentials] Cleared stored credentials");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear credentials: " + file, e);
        }
    }

    private static void restrict(Path path, String permissions) {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(permissions));
        } catch (IOException | UnsupportedOperationException e) { // NOSONAR - permissions are best effort
            log.debug("[Credentials] Cannot set permissions on {}: {}", path, e.getMessage());
        }
    }
}
