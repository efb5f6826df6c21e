package com.yangproto.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration for one compiler run.
 */
@Data
@Builder
public class CompilerConfig {

    public static final String DEFAULT_STUB_PACKAGE = "gnoi.yang";

    /**
     * Statement-tree JSON files dumped by the YANG frontend.
     */
    @Singular
    private List<Path> inputFiles;

    /**
     * Root directory for generated proto files.
     */
    private Path protoDir;

    /**
     * Root directory for server handler, registration and translator sources.
     */
    private Path serverStubDir;

    /**
     * Root directory for the client dispatch program.
     */
    private Path clientStubDir;

    /**
     * Only compile rpcs; modules without rpcs are skipped.
     */
    private boolean rpcOnly;

    /**
     * Java package root of the generated stubs.
     */
    @Builder.Default
    private String stubPackage = DEFAULT_STUB_PACKAGE;
}
