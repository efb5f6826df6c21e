package com.yangproto.generator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yangproto.generator.codegen.exception.ResolutionException;
import com.yangproto.generator.codegen.generator.ProtoEmitter;
import com.yangproto.generator.codegen.generator.StubCodeGenerator;
import com.yangproto.generator.codegen.model.ProtoModule;
import com.yangproto.generator.codegen.model.core.context.CompilerConfig;
import com.yangproto.generator.codegen.model.core.context.ToolDiagnostics;
import com.yangproto.generator.codegen.model.output.GeneratedFile;
import com.yangproto.generator.codegen.model.output.GeneratedFileType;
import com.yangproto.generator.codegen.model.output.OutputPathSet;
import com.yangproto.generator.codegen.tree.SchemaTreeBuilder;
import com.yangproto.generator.codegen.type.EnumCompiler;
import com.yangproto.generator.codegen.type.TypeResolver;
import com.yangproto.generator.codegen.util.ChangeAwareWriter;
import com.yangproto.generator.model.ModuleRegistry;
import com.yangproto.generator.model.Statement;
import com.yangproto.generator.parser.StatementTreeException;
import com.yangproto.generator.parser.StatementTreeReader;

/**
 * Main compiler: reads statement trees, builds every module tree, renders all
 * artifacts in memory and only then writes them through the change-aware writer.
 * A resolution failure therefore leaves the output directories untouched.
 */
public class ProtoCompiler {
    private static final Logger log = LoggerFactory.getLogger(ProtoCompiler.class);

    static final String SONIC_PREFIX = "sonic";
    static final String OPENCONFIG_PREFIX = "openconfig";

    private final CompilerConfig config;
    private final OutputPathSet outputPaths;
    private final ProtoEmitter protoEmitter = new ProtoEmitter();

    public ProtoCompiler(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.outputPaths = OutputPathSet.builder()
                .protoDir(config.getProtoDir())
                .serverStubDir(config.getServerStubDir())
                .clientStubDir(config.getClientStubDir())
                .build();
    }

    /**
     * Reads the configured input files and compiles them.
     */
    public CompilerResult compile() {
        ModuleRegistry registry;
        try {
            log.info("Step 1: Reading statement trees...");
            registry = new StatementTreeReader().readAll(config.getInputFiles());
        } catch (StatementTreeException e) {
            log.error("Invalid statement tree: {}", e.getMessage());
            return CompilerResult.failure(CompilerResult.EXIT_USAGE, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read statement trees", e);
            return CompilerResult.failure(CompilerResult.EXIT_FAILURE, "Failed to read input: " + e.getMessage());
        }

        if (registry.size() == 0) {
            return CompilerResult.failure(CompilerResult.EXIT_USAGE, "No modules found in " + config.getInputFiles());
        }
        return compile(registry);
    }

    /**
     * Compiles already loaded modules.
     */
    public CompilerResult compile(ModuleRegistry registry) {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        SchemaTreeBuilder treeBuilder = new SchemaTreeBuilder(new TypeResolver(registry), new EnumCompiler());

        // Step 2: build and render everything before touching the disk
        log.info("Step 2: Compiling {} modules...", registry.size());
        List<ProtoModule> modules = new ArrayList<>();
        int skipped = 0;
        try {
            for (Statement module : registry.getModules()) {
                log.info("===> processing {} ...", module.getArgument());
                ProtoModule compiled = treeBuilder.buildModule(module, diagnostics, config.isRpcOnly());
                if (config.isRpcOnly() && !compiled.hasRpcs()) {
                    log.info("skip module without rpcs: {}", module.getArgument());
                    skipped++;
                    continue;
                }
                modules.add(compiled);
            }
        } catch (ResolutionException e) {
            log.error("Resolution failed: {}", e.getMessage());
            diagnostics.getErrors().add(e.getMessage());
            return CompilerResult.failure(CompilerResult.EXIT_USAGE, e.getMessage(), diagnostics.getErrors());
        }

        try {
            return writeAll(modules, skipped, diagnostics);
        } catch (IOException e) {
            log.error("Failed to write generated files", e);
            return CompilerResult.failure(CompilerResult.EXIT_FAILURE, "Failed to write output: " + e.getMessage());
        }
    }

    private CompilerResult writeAll(List<ProtoModule> modules, int skipped, ToolDiagnostics diagnostics)
            throws IOException {
        String prefix = stubPrefix(modules);
        StubCodeGenerator stubGenerator = new StubCodeGenerator(outputPaths, config.getStubPackage());

        List<GeneratedFile> protoFiles = new ArrayList<>();
        List<GeneratedFile> handlerFiles = new ArrayList<>();
        for (ProtoModule module : modules) {
            protoFiles.add(GeneratedFile.builder()
                    .path(outputPaths.protoFile(module))
                    .contents(protoEmitter.emit(module))
                    .type(GeneratedFileType.PROTO)
                    .build());
            handlerFiles.add(module.hasRpcs() ? stubGenerator.renderServerHandler(module) : null);
        }
        GeneratedFile registration = stubGenerator.renderRegistration(modules, prefix);
        GeneratedFile translator = stubGenerator.renderTranslatorSupport();
        GeneratedFile client = stubGenerator.renderClientDispatch(modules, prefix);

        // Step 3: persist only what changed
        log.info("Step 3: Writing generated files...");
        Files.createDirectories(outputPaths.getProtoDir());
        Files.createDirectories(outputPaths.getServerStubDir());
        Files.createDirectories(outputPaths.getClientStubDir());

        ChangeAwareWriter writer = new ChangeAwareWriter();
        int protoWritten = 0;
        int handlersRegenerated = 0;
        for (int i = 0; i < modules.size(); i++) {
            ProtoModule module = modules.get(i);
            boolean protoChanged = writer.write(protoFiles.get(i));
            if (protoChanged) {
                protoWritten++;
            }
            GeneratedFile handler = handlerFiles.get(i);
            if (handler == null) {
                continue;
            }
            if (protoChanged || !Files.exists(handler.getPath())) {
                if (writer.write(handler)) {
                    handlersRegenerated++;
                }
            } else {
                log.info("skip unchanged module: {}", module.getSourceName());
            }
        }
        writer.write(registration);
        writer.write(translator);
        writer.write(client);

        return CompilerResult.builder()
                .success(true)
                .exitCode(CompilerResult.EXIT_OK)
                .stubPrefix(prefix)
                .modulesCompiled(modules.size())
                .modulesSkipped(skipped)
                .rpcsCompiled(modules.stream().mapToInt(m -> m.getRpcs().size()).sum())
                .protoFilesWritten(protoWritten)
                .protoFilesUnchanged(modules.size() - protoWritten)
                .handlersRegenerated(handlersRegenerated)
                .filesWritten(writer.getWritten())
                .filesUnchanged(writer.getUnchanged())
                .warnings(diagnostics.getWarnings())
                .build();
    }

    /**
     * {@code sonic} when any compiled module is a SONiC module, else {@code openconfig}.
     */
    static String stubPrefix(List<ProtoModule> modules) {
        boolean sonic = modules.stream()
                .anyMatch(m -> m.getSourceName().toLowerCase(Locale.ROOT).startsWith(SONIC_PREFIX));
        return sonic ? SONIC_PREFIX : OPENCONFIG_PREFIX;
    }
}
