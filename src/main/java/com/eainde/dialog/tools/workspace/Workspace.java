package com.eainde.dialog.tools.workspace;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Sandbox directory the file tools operate in. Every path an agent supplies is resolved against
 * the root and rejected if it escapes it.
 */
public class Workspace {

    private final Path root;

    public Workspace(Path root) throws IOException {
        this.root = Files.createDirectories(root).toRealPath();
    }

    public Path root() {
        return root;
    }

    public Path resolve(String relativePath) {
        String candidate = relativePath == null || relativePath.isBlank() ? "." : relativePath;
        Path resolved = root.resolve(candidate).normalize();
        if (!resolved.startsWith(root) || !realAncestor(resolved).startsWith(root)) {
            throw new IllegalArgumentException("Path '" + relativePath + "' escapes the workspace");
        }
        return resolved;
    }

    // Symlinks are followed on the deepest part of the path that already exists.
    private static Path realAncestor(Path path) {
        Path existing = path;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return path;
        }
        try {
            return existing.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve '" + existing + "'", e);
        }
    }

    public String relativize(Path path) {
        String relative = root.relativize(path).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }

    static String requiredText(JsonNode arguments, String field) {
        JsonNode node = arguments.get(field);
        if (node == null || node.isNull() || !node.isTextual()) {
            throw new IllegalArgumentException("Missing required string argument '" + field + "'");
        }
        return node.asText();
    }

    static String optionalText(JsonNode arguments, String field) {
        JsonNode node = arguments.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
