package com.yangproto.generator.codegen;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Result of a compiler run.
 */
@Data
@Builder
public class CompilerResult {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    /** Configuration or resolution error. */
    public static final int EXIT_USAGE = 2;

    private boolean success;
    private int exitCode;
    private String errorMessage;

    private String stubPrefix;
    private int modulesCompiled;
    private int modulesSkipped;
    private int rpcsCompiled;
    private int protoFilesWritten;
    private int protoFilesUnchanged;
    private int handlersRegenerated;
    private int filesWritten;
    private int filesUnchanged;

    @Singular
    private List<String> warnings;

    @Singular
    private List<String> errors;

    public static CompilerResult failure(int exitCode, String errorMessage) {
        return failure(exitCode, errorMessage, List.of());
    }

    /**
     * Failed run carrying the diagnostics gathered before the failure.
     */
    public static CompilerResult failure(int exitCode, String errorMessage, List<String> errors) {
        return CompilerResult.builder()
                .success(false)
                .exitCode(exitCode)
                .errorMessage(errorMessage)
                .errors(errors)
                .build();
    }
}
