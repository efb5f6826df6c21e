package com.yangproto.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Normalized values needed by the compiler. Keeps CompileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCompileOptions {
    Path protoDir;
    Path serverStubDir;
    Path clientStubDir;
    List<Path> inputFiles;
}
