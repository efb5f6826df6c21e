package com.yangproto.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yangproto.generator.codegen.model.output.GeneratedFile;

/**
 * Writes generated files only when their content differs from what is on disk,
 * creating parent directories as needed. Unchanged files keep their timestamps,
 * so downstream builds see no modification.
 */
public class ChangeAwareWriter {
    private static final Logger log = LoggerFactory.getLogger(ChangeAwareWriter.class);

    private int written;
    private int unchanged;

    /**
     * @return true when the file was (re)written
     */
    public boolean write(GeneratedFile file) throws IOException {
        return write(file.getPath(), file.getContents());
    }

    /**
     * @return true when the file was (re)written
     */
    public boolean write(Path filePath, String content) throws IOException {
        if (!isChanged(filePath, content)) {
            log.info("file {} unchanged, skipped writing...", filePath);
            unchanged++;
            return false;
        }
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        log.info("writing file: {}", filePath);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
        written++;
        return true;
    }

    /**
     * True when the file is missing or its content differs.
     */
    public static boolean isChanged(Path filePath, String content) throws IOException {
        if (!Files.isRegularFile(filePath)) {
            return true;
        }
        return !Files.readString(filePath, StandardCharsets.UTF_8).equals(content);
    }

    public int getWritten() {
        return written;
    }

    public int getUnchanged() {
        return unchanged;
    }
}
