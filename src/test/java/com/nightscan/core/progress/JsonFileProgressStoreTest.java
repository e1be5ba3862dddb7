package com.nightscan.core.progress;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileProgressStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void write_shouldReplaceDocumentWithoutLeavingTempFile() {
        JsonFileProgressStore store = new JsonFileProgressStore(tempDir.resolve("state/progress.json"), tempDir.resolve("history"));

        store.write(new JSONObject().put("overall_status", "running"));
        store.write(new JSONObject().put("overall_status", "complete"));

        assertEquals("complete", store.read().orElseThrow().getString("overall_status"));
        assertFalse(Files.exists(tempDir.resolve("state/progress.json.tmp")));
    }

    @Test
    void read_shouldBeEmptyWhenNothingWritten() {
        JsonFileProgressStore store = new JsonFileProgressStore(tempDir.resolve("progress.json"), tempDir.resolve("history"));

        assertTrue(store.read().isEmpty());
        assertEquals(List.of(), store.history(5));
    }

    @Test
    void read_shouldFailOnCorruptDocument() throws Exception {
        Path progress = tempDir.resolve("progress.json");
        Files.writeString(progress, "{not json", StandardCharsets.UTF_8);
        JsonFileProgressStore store = new JsonFileProgressStore(progress, tempDir.resolve("history"));

        assertThrows(ProgressPersistenceException.class, store::read);
    }

    @Test
    void archive_shouldNameFilesByStartTimeAndListNewestFirst() throws Exception {
        Path history = tempDir.resolve("history");
        JsonFileProgressStore store = new JsonFileProgressStore(tempDir.resolve("progress.json"), history);

        store.archive(new JSONObject().put("run", 1), LocalDateTime.of(2024, 3, 6, 22, 0, 5));
        store.archive(new JSONObject().put("run", 3), LocalDateTime.of(2024, 3, 8, 22, 0, 0));
        store.archive(new JSONObject().put("run", 2), LocalDateTime.of(2024, 3, 7, 22, 0, 0));
        Files.writeString(history.resolve("run_20240309_220000.json"), "garbage", StandardCharsets.UTF_8);
        Files.writeString(history.resolve("notes.txt"), "ignored", StandardCharsets.UTF_8);

        assertTrue(Files.isRegularFile(history.resolve("run_20240306_220005.json")));
        List<JSONObject> runs = store.history(10);
        assertEquals(3, runs.size());
        assertEquals(3, runs.get(0).getInt("run"));
        assertEquals(2, runs.get(1).getInt("run"));
        assertEquals(1, runs.get(2).getInt("run"));
        assertEquals(1, store.history(1).size());
    }
}
