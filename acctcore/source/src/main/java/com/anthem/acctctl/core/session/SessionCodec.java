package com.anthem.acctctl.core.session;

import com.anthem.acctctl.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes {@link SavedSession} as JSON.
 */
@Slf4j
public final class SessionCodec {

    private SessionCodec() {
    }

    public static String encode(SavedSession s) {
        return JsonUtils.toJson(s);
    }

    /**
     * Decodes a saved session. Sessions of another version, or without the
     * gateway identity and session name, are ignored.
     *
     * @throws IllegalArgumentException if {@code json} is not a valid session
     */
    public static Optional<SavedSession> decode(String json) {
        SavedSession s;
        try {
            s = JsonUtils.fromJson(json, SavedSession.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid saved session", e);
        }
        if (s == null || s.getVersion() != SavedSession.VERSION) {
            log.info("Ignoring saved session: version={}, expected={}",
                    s == null ? null : s.getVersion(), SavedSession.VERSION);
            return Optional.empty();
        }
        if (s.getIdentity() == null || isBlank(s.getIdentity().getAccount()) || isBlank(s.getSessionName())) {
            log.info("Ignoring saved session without gateway identity");
            return Optional.empty();
        }
        return Optional.of(s);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Reads a session from {@code file}. A missing, unreadable or incompatible
     * file yields an empty result.
     */
    public static Optional<SavedSession> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return decode(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to read saved session: file={}, error={}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes {@code s} to {@code file}, replacing it atomically.
     */
    public static void write(Path file, SavedSession s) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            Files.writeString(tmp, encode(s), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write saved session: " + file, e);
        }
    }
}
