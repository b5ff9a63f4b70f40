package com.pricemonitor.engine.infrastructure.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Directory-based hand-off from the scrapers: files appear in the inbox and are moved to
 * {@code processed} or {@code failed} once ingested.
 */
@Slf4j
public class BatchInbox {

    private final Path inboxDir;
    private final Path processedDir;
    private final Path failedDir;

    public BatchInbox(Path inboxDir, Path processedDir, Path failedDir) {
        this.inboxDir = inboxDir;
        this.processedDir = processedDir;
        this.failedDir = failedDir;
    }

    /** Pending batch files in name order. */
    public List<Path> pending() {
        if (!Files.isDirectory(inboxDir)) {
            log.debug("batch.inbox.missing: dir={}", inboxDir);
            return List.of();
        }
        try (Stream<Path> files = Files.list(inboxDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(BatchInbox::isBatchFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw BatchFileException.unreadable(inboxDir, e);
        }
    }

    public Path markProcessed(Path file) {
        return move(file, processedDir);
    }

    public Path markFailed(Path file) {
        return move(file, failedDir);
    }

    private static boolean isBatchFile(Path file) {
        var name = file.getFileName().toString();
        return name.endsWith(".json") || name.endsWith(".jsonl");
    }

    private static Path move(Path file, Path dir) {
        var target = dir.resolve(file.getFileName());
        try {
            Files.createDirectories(dir);
            return Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw BatchFileException.notMovable(file, target, e);
        }
    }
}
