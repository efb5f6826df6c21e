package com.yangproto.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.yangproto.generator.cli.exception.OptionsValidationException;
import com.yangproto.generator.cli.model.CompileOptions;
import com.yangproto.generator.cli.model.ValidatedCompileOptions;

public class CompileOptionsValidator {

    private static final Pattern JAVA_PACKAGE = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)*");

    public ValidatedCompileOptions validate(CompileOptions o) {
        List<String> errors = new ArrayList<>();

        Path protoDir = outputDir(o.getProtoOutDir(), "--proto-outdir", errors);
        Path serverDir = outputDir(o.getServerRpcOutDir(), "--server-rpc-outdir", errors);
        Path clientDir = outputDir(o.getClientRpcOutDir(), "--client-rpc-outdir", errors);

        List<Path> inputs = o.getInputFiles() == null ? List.of() : o.getInputFiles();
        if (inputs.isEmpty()) {
            errors.add("At least one statement-tree JSON file is required.");
        }
        for (Path input : inputs) {
            if (!Files.isRegularFile(input)) {
                errors.add("Input file does not exist or is not a file: " + input);
            }
        }

        if (o.getStubPackage() == null || !JAVA_PACKAGE.matcher(o.getStubPackage()).matches()) {
            errors.add("Stub package is not a valid Java package name: " + o.getStubPackage());
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        List<Path> normalizedInputs = inputs.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .toList();
        return new ValidatedCompileOptions(protoDir, serverDir, clientDir, normalizedInputs);
    }

    private static Path outputDir(Path dir, String option, List<String> errors) {
        if (dir == null) {
            errors.add("Output directory is required (" + option + ").");
            return null;
        }
        Path normalized = dir.toAbsolutePath().normalize();
        if (Files.exists(normalized) && !Files.isDirectory(normalized)) {
            errors.add("Output path exists but is not a directory: " + normalized);
        }
        return normalized;
    }
}
