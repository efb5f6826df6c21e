package com.yangproto.generator.cli;

import java.util.concurrent.Callable;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yangproto.generator.cli.exception.OptionsValidationException;
import com.yangproto.generator.cli.model.CompileOptions;
import com.yangproto.generator.cli.model.ValidatedCompileOptions;
import com.yangproto.generator.cli.output.CompileResultsPrinter;
import com.yangproto.generator.cli.validation.CompileOptionsValidator;
import com.yangproto.generator.codegen.CompilerResult;
import com.yangproto.generator.codegen.ProtoCompiler;
import com.yangproto.generator.codegen.model.core.context.CompilerConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command compiling YANG statement trees into proto3 files and gRPC stubs.
 */
@Command(
        name = "yang-proto-gen",
        mixinStandardHelpOptions = true,
        version = "yang-proto-gen 1.0.0",
        description = "Compiles YANG statement trees into proto3 definitions, gRPC server handlers and a client program."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Mixin
    private CompileOptions options = new CompileOptions();

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();
    private final Function<CompilerConfig, ProtoCompiler> compilerFactory;

    public CompileCommand() {
        this(ProtoCompiler::new);
    }

    CompileCommand(Function<CompilerConfig, ProtoCompiler> compilerFactory) {
        this.compilerFactory = compilerFactory;
    }

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedCompileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return CompilerResult.EXIT_USAGE;
        }

        try {
            printer.printBanner(options, validated);

            CompilerConfig config = CompilerConfig.builder()
                    .inputFiles(validated.getInputFiles())
                    .protoDir(validated.getProtoDir())
                    .serverStubDir(validated.getServerStubDir())
                    .clientStubDir(validated.getClientStubDir())
                    .rpcOnly(options.isRpcOnly())
                    .stubPackage(options.getStubPackage())
                    .build();

            CompilerResult result = compilerFactory.apply(config).compile();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return result.getExitCode();
            }
            printer.printSuccess(result);
            return CompilerResult.EXIT_OK;

        } catch (Exception e) {
            log.error("Compilation failed with exception", e);
            return CompilerResult.EXIT_FAILURE;
        }
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
