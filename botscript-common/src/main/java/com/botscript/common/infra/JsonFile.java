package com.botscript.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * JSON file load/save with owner-only file permissions.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Load a JSON file as a tree. Returns null if the file does not exist.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static JsonNode loadTree(Path path) throws IOException {
        if (!Files.exists(path))
            return null;
        return MAPPER.readTree(Files.readString(path));
    }

    /**
     * Save data as a JSON file with restrictive permissions (owner-only rw).
     * The content is written to a sibling temp file first and moved into place,
     * so readers never observe a half-written file.
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
            // non-POSIX file system, default permissions apply
        }

        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
