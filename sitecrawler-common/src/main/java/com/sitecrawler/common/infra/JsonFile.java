package com.sitecrawler.common.infra;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * JSON file load/save with owner-only permissions and atomic replace.
 * {@code java.time} values are written as ISO-8601 strings.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Load and parse a JSON file.
     *
     * @return the parsed value, or null if the file does not exist or is blank
     * @throws IOException if the file cannot be read or does not parse
     */
    public static <T> T load(Path path, Class<T> type) throws IOException {
        if (!Files.exists(path))
            return null;
        String raw = Files.readString(path);
        if (raw.isBlank())
            return null;
        return MAPPER.readValue(raw, type);
    }

    /**
     * Save data as a JSON file with restrictive permissions (owner-only rw).
     * The content is written to a sibling temp file first and then moved over
     * the target, so readers never observe a half-written document.
     */
    public static void save(Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        String json = MAPPER.writeValueAsString(data) + "\n";
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json);

        try {
            Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-------");
            Files.setPosixFilePermissions(tmp, perms);
        } catch (UnsupportedOperationException ignored) {
            // Non-POSIX (e.g. Windows)
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
