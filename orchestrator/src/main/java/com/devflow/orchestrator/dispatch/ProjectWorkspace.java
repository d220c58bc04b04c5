package com.devflow.orchestrator.dispatch;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File access for step handlers, confined to the project root.
 *
 * Every relative path is normalized against the root and rejected with
 * {@link StepActionException.Kind#PATH_ESCAPE} when it resolves outside it.
 */
@Component
public class ProjectWorkspace {

    public Path resolve(Path projectRoot, String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new StepActionException(StepActionException.Kind.PATH_ESCAPE, "Step target is empty");
        }
        Path root = projectRoot.toAbsolutePath().normalize();
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new StepActionException(StepActionException.Kind.PATH_ESCAPE,
                    "Path '%s' resolves outside the project root".formatted(relativePath));
        }
        return resolved;
    }

    public boolean exists(Path projectRoot, String relativePath) {
        return Files.isRegularFile(resolve(projectRoot, relativePath));
    }

    public String read(Path projectRoot, String relativePath) {
        Path file = resolve(projectRoot, relativePath);
        if (!Files.isRegularFile(file)) {
            throw new StepActionException(StepActionException.Kind.TARGET_MISSING, "File not found: " + relativePath);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StepActionException(StepActionException.Kind.IO_ERROR,
                    "Cannot read " + relativePath + ": " + e.getMessage(), e);
        }
    }

    /** Write (or overwrite) the file, creating parent directories. Returns the absolute path. */
    public Path write(Path projectRoot, String relativePath, String content) {
        Path file = resolve(projectRoot, relativePath);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new StepActionException(StepActionException.Kind.IO_ERROR,
                    "Cannot write " + relativePath + ": " + e.getMessage(), e);
        }
    }
}
