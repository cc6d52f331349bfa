package com.botscript.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTest {

    @TempDir
    Path tempDir;

    @Test
    void loadTree_missingFile_returnsNull() throws IOException {
        assertNull(JsonFile.loadTree(tempDir.resolve("absent.json")));
    }

    @Test
    void save_createsParentsAndRoundTrips() throws IOException {
        Path target = tempDir.resolve("a/b/data.json");

        JsonFile.save(target, Map.of("x", 1));

        JsonNode tree = JsonFile.loadTree(target);
        assertEquals(1, tree.get("x").asInt());
        assertFalse(Files.exists(target.resolveSibling("data.json.tmp")));
    }

    @Test
    void loadTree_corruptFile_throws() throws IOException {
        Path target = tempDir.resolve("bad.json");
        Files.writeString(target, "{ not json");

        assertThrows(IOException.class, () -> JsonFile.loadTree(target));
    }
}
