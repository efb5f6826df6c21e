package com.yangproto.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yangproto.generator.cli.model.CompileOptions;
import com.yangproto.generator.cli.model.ValidatedCompileOptions;
import com.yangproto.generator.codegen.CompilerResult;

/**
 * Responsible only for printing CLI output for the compile command.
 * No validation, no execution.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    public void printBanner(CompileOptions o, ValidatedCompileOptions v) {
        log.info("=================================================");
        log.info("YANG Proto Generator");
        log.info("=================================================");
        log.info("Input Files: {}", v.getInputFiles().size());
        v.getInputFiles().forEach(f -> log.info("  {}", f));
        log.info("Proto Directory: {}", v.getProtoDir());
        log.info("Server Stub Directory: {}", v.getServerStubDir());
        log.info("Client Stub Directory: {}", v.getClientStubDir());
        log.info("Stub Package: {}", o.getStubPackage());
        log.info("RPC Only: {}", o.isRpcOnly());
        log.info("=================================================");
    }

    public void printSuccess(CompilerResult result) {
        log.info("");
        log.info("=================================================");
        log.info("COMPILATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Modules Compiled: {}", result.getModulesCompiled());
        if (result.getModulesSkipped() > 0) {
            log.info("Modules Skipped (no rpcs): {}", result.getModulesSkipped());
        }
        log.info("RPCs Compiled: {}", result.getRpcsCompiled());
        log.info("Stub Prefix: {}", result.getStubPrefix());
        log.info("");
        log.info("Output Summary:");
        log.info("  Proto Files Written: {}", result.getProtoFilesWritten());
        log.info("  Proto Files Unchanged: {}", result.getProtoFilesUnchanged());
        log.info("  Handlers Regenerated: {}", result.getHandlersRegenerated());
        log.info("  Files Written: {}", result.getFilesWritten());
        log.info("  Files Unchanged: {}", result.getFilesUnchanged());

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("Schema Limitations ({}):", result.getWarnings().size());
            result.getWarnings().forEach(w -> log.info("  {}", w));
        }
        log.info("=================================================");
    }

    public void printFailure(CompilerResult result) {
        log.error("Compilation failed: {}", result.getErrorMessage());
        if (result.getErrors().size() > 1) {
            result.getErrors().forEach(e -> log.error("  {}", e));
        }
    }
}
