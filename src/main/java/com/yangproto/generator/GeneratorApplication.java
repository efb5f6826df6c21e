package com.yangproto.generator;

import com.yangproto.generator.cli.CompileCommand;
import picocli.CommandLine;

/**
 * Main entry point for the YANG to proto3 generator.
 * Compiles statement trees dumped by a YANG frontend into proto files plus
 * gRPC server handler skeletons, a service registration and a client program.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CompileCommand()).execute(args);
        System.exit(exitCode);
    }
}
