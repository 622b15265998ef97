package com.sitecrawler.common.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTest {

    record Snapshot(String name, Instant savedAt, int count) {
    }

    @TempDir
    Path tempDir;

    @Test
    void saveThenLoad_writesIsoInstants() throws Exception {
        Path path = tempDir.resolve("nested/dir/state.json");
        Snapshot snapshot = new Snapshot("docs", Instant.parse("2024-03-15T10:00:00Z"), 3);

        JsonFile.save(path, snapshot);

        assertTrue(Files.readString(path).contains("\"2024-03-15T10:00:00Z\""));
        assertFalse(Files.exists(path.resolveSibling("state.json.tmp")));
        assertEquals(snapshot, JsonFile.load(path, Snapshot.class));
    }

    @Test
    void save_replacesExistingFile() throws Exception {
        Path path = tempDir.resolve("state.json");
        JsonFile.save(path, new Snapshot("a", null, 1));
        JsonFile.save(path, new Snapshot("b", null, 2));

        assertEquals("b", JsonFile.load(path, Snapshot.class).name());
    }

    @Test
    void save_restrictsPermissionsOnPosix() throws Exception {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        Path path = tempDir.resolve("state.json");
        JsonFile.save(path, new Snapshot("a", null, 1));

        assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(path)));
    }

    @Test
    void load_missingOrBlank_returnsNull() throws Exception {
        assertNull(JsonFile.load(tempDir.resolve("missing.json"), Snapshot.class));

        Path blank = tempDir.resolve("blank.json");
        Files.writeString(blank, "\n");
        assertNull(JsonFile.load(blank, Snapshot.class));
    }

    @Test
    void load_malformed_throws() throws Exception {
        Path path = tempDir.resolve("bad.json");
        Files.writeString(path, "{ \"name\": ");

        assertThrows(JsonProcessingException.class, () -> JsonFile.load(path, Snapshot.class));
    }

    @Test
    void load_ignoresUnknownFields() throws Exception {
        Path path = tempDir.resolve("extra.json");
        Files.writeString(path, "{ \"name\": \"x\", \"count\": 2, \"legacy\": true }");

        Snapshot loaded = JsonFile.load(path, Snapshot.class);
        assertEquals("x", loaded.name());
        assertEquals(2, loaded.count());
    }
}
