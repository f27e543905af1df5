package com.loopclaw.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class WorkspacePaths {

    static final long MAX_FILE_SIZE_BYTES = 10 * 1024 * 1024;

    private WorkspacePaths() {}

    static Path resolve(String workDir, String rawPath) throws IOException {
        if (rawPath == null || rawPath.contains("\0")) {
            throw new SecurityException("Invalid path");
        }
        var base = Path.of(workDir).toRealPath();
        var resolved = base.resolve(rawPath).normalize();
        if (!resolved.startsWith(base)) {
            throw new SecurityException("Path escapes working directory");
        }
        if (Files.exists(resolved)) {
            // symlinks may still point outside
            if (!resolved.toRealPath().startsWith(base)) {
                throw new SecurityException("Resolved path escapes working directory");
            }
            return resolved;
        }
        var ancestor = resolved.getParent();
        while (ancestor != null && !Files.exists(ancestor)) {
            ancestor = ancestor.getParent();
        }
        if (ancestor == null || !ancestor.toRealPath().startsWith(base)) {
            throw new SecurityException("Path escapes working directory");
        }
        return resolved;
    }
}
