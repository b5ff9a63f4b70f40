package com.pricemonitor.engine.infrastructure.batch;

import java.nio.file.Path;

public class BatchFileException extends RuntimeException {

    private BatchFileException(String message, Throwable cause) {
        super(message, cause);
    }

    public static BatchFileException unreadable(Path file, Throwable cause) {
        return new BatchFileException("Cannot read batch file " + file, cause);
    }

    public static BatchFileException malformed(Path file, String detail, Throwable cause) {
        return new BatchFileException("Malformed batch file " + file + ": " + detail, cause);
    }

    public static BatchFileException notMovable(Path file, Path target, Throwable cause) {
        return new BatchFileException("Cannot move " + file + " to " + target, cause);
    }
}
