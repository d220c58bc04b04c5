package com.devflow.orchestrator.dispatch.impl;

import com.devflow.orchestrator.dispatch.*;
import com.devflow.orchestrator.role.DefaultRoleCatalog;
import com.devflow.orchestrator.role.Role;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Walks the project tree and produces a structure report: file counts per
 * extension, directory count and maximum depth, followed by the focus of
 * the acting role. Nothing is written to the project.
 */
@Component
public class AnalyzeProjectAction implements StepActionHandler {

    static final Set<String> SKIPPED_DIRECTORIES = Set.of(".git", "target", "node_modules");

    private static final Map<String, String> ROLE_APPROACH = Map.of(
            DefaultRoleCatalog.PRODUCT_MANAGER,      "Focus on business impact and user value",
            DefaultRoleCatalog.ARCHITECT,            "Focus on system design and technical architecture",
            DefaultRoleCatalog.SENIOR_DEVELOPER,     "Focus on code quality and best practices",
            DefaultRoleCatalog.CODE_REVIEW,          "Focus on security, performance, and maintainability",
            DefaultRoleCatalog.INTEGRATION_ENGINEER, "Focus on deployment and integration readiness");

    @Override public ActionKind kind() { return ActionKind.ANALYZE; }

    @Override
    public ActionOutcome execute(StepRequest request) {
        Path root = request.context().projectRoot().toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new StepActionException(StepActionException.Kind.TARGET_MISSING,
                    "Project directory not found: " + root);
        }
        Structure structure = scan(root);
        String report = render(request.role(), request.step().name(), structure);
        return new ActionOutcome(
                "Project analysis '%s' completed (%s approach): %d files in %d directories"
                        .formatted(request.step().name(), request.role().displayName(),
                                structure.totalFiles(), structure.directories),
                report);
    }

    static String approachFor(Role role) {
        return ROLE_APPROACH.getOrDefault(role.id(), "Comprehensive analysis approach");
    }

    private static Structure scan(Path root) {
        Structure structure = new Structure();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root)) {
                        if (SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        structure.directories++;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    structure.maxDepth = Math.max(structure.maxDepth, root.relativize(file).getNameCount());
                    structure.byExtension.merge(extension(file), 1, Integer::sum);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new StepActionException(StepActionException.Kind.IO_ERROR,
                    "Cannot scan " + root + ": " + e.getMessage(), e);
        }
        return structure;
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1) : "(none)";
    }

    private static String render(Role role, String stepName, Structure structure) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(stepName).append(" (").append(role.displayName()).append(")\n\n");
        sb.append("## Analysis Approach\n").append(approachFor(role)).append("\n\n");
        sb.append("## Overview\n");
        sb.append("- Total Files: ").append(structure.totalFiles()).append('\n');
        sb.append("- Directories: ").append(structure.directories).append('\n');
        sb.append("- Maximum Depth: ").append(structure.maxDepth).append("\n\n");
        sb.append("## Files by Extension\n");
        structure.byExtension.forEach((ext, count) ->
                sb.append("- ").append(ext).append(": ").append(count).append('\n'));
        return sb.toString();
    }

    private static final class Structure {
        final Map<String, Integer> byExtension = new TreeMap<>();
        int directories;
        int maxDepth;

        int totalFiles() {
            return byExtension.values().stream().mapToInt(Integer::intValue).sum();
        }
    }
}
