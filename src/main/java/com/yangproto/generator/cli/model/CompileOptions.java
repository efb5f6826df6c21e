package com.yangproto.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.yangproto.generator.codegen.model.core.context.CompilerConfig;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the compile command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class CompileOptions {

    @Option(names = { "--proto-outdir" }, description = "Output directory for generated proto files")
    private Path protoOutDir;

    @Option(names = { "--server-rpc-outdir" }, description = "Output directory for server handlers and registration")
    private Path serverRpcOutDir;

    @Option(names = { "--client-rpc-outdir" }, description = "Output directory for the client dispatch program")
    private Path clientRpcOutDir;

    @Option(names = { "--rpc-only" }, description = "Only compile rpcs and skip modules without rpcs")
    private boolean rpcOnly;

    @Option(names = { "--stub-package" }, defaultValue = CompilerConfig.DEFAULT_STUB_PACKAGE,
            description = "Java package root of the generated stubs (default: ${DEFAULT-VALUE})")
    private String stubPackage;

    @Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
    private boolean verbose;

    @Parameters(paramLabel = "<statement-tree.json>", arity = "0..*",
            description = "Statement-tree JSON files dumped by the YANG frontend")
    private List<Path> inputFiles = new ArrayList<>();
}
