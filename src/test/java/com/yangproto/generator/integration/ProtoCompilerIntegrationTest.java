package com.yangproto.generator.integration;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.yangproto.generator.codegen.CompilerResult;
import com.yangproto.generator.codegen.ProtoCompiler;
import com.yangproto.generator.codegen.model.core.context.CompilerConfig;

/**
 * Integration tests for a complete compiler run over JSON statement trees.
 */
class ProtoCompilerIntegrationTest {

    @TempDir
    Path tempDir;

    private Path protoDir;
    private Path serverDir;
    private Path clientDir;

    @BeforeEach
    void setUp() {
        protoDir = tempDir.resolve("proto");
        serverDir = tempDir.resolve("server");
        clientDir = tempDir.resolve("client");
    }

    private static Path fixture(String name) {
        try {
            return Path.of(ProtoCompilerIntegrationTest.class.getResource("/fixtures/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private CompilerResult compile(boolean rpcOnly, String... fixtures) {
        CompilerConfig.CompilerConfigBuilder config = CompilerConfig.builder()
                .protoDir(protoDir)
                .serverStubDir(serverDir)
                .clientStubDir(clientDir)
                .rpcOnly(rpcOnly);
        for (String name : fixtures) {
            config.inputFile(fixture(name));
        }
        return new ProtoCompiler(config.build()).compile();
    }

    @Test
    void testCompileSonicModules() throws IOException {
        CompilerResult result = compile(false, "sonic-system.json", "sonic-types.json", "openconfig-platform.json");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getExitCode()).isEqualTo(CompilerResult.EXIT_OK);
        assertThat(result.getStubPrefix()).isEqualTo("sonic");
        assertThat(result.getModulesCompiled()).isEqualTo(3);
        assertThat(result.getRpcsCompiled()).isEqualTo(2);
        assertThat(result.getHandlersRegenerated()).isEqualTo(1);

        Path systemProto = protoDir.resolve("sonic_system/sonic_system.proto");
        assertThat(systemProto).exists();
        assertThat(protoDir.resolve("sonic_types/sonic_types.proto")).exists();
        assertThat(protoDir.resolve("openconfig_platform/openconfig_platform.proto")).exists();

        String proto = Files.readString(systemProto);
        assertThat(proto)
                .contains("package gnoi.SonicSystem;")
                .contains("string hostname = 1 [json_name = \"hostname\"];")
                .contains("string primary = 2 [json_name = \"primary\"];")
                .contains("enum Mode {")
                .contains("cluster = 1;")
                .contains("rpc Reboot(RebootRequest) returns (RebootResponse) {}")
                .contains("rpc GetStatus(GetStatusRequest) returns (GetStatusResponse) {}")
                .doesNotContain("severity");

        assertThat(Files.readString(protoDir.resolve("openconfig_platform/openconfig_platform.proto")))
                .contains("import \"google/protobuf/struct.proto\";")
                .contains("repeated Component component = 1")
                .doesNotContain("service ");

        assertThat(serverDir.resolve("sonic_system/SonicSystemServiceHandler.java")).exists();
        assertThat(serverDir.resolve("openconfig_platform")).doesNotExist();
        assertThat(serverDir.resolve("SonicServiceRegistration.java")).exists();
        assertThat(serverDir.resolve("YangRpcTranslator.java")).exists();
        assertThat(clientDir.resolve("gnoi_sonic_client/SonicClientMain.java")).exists();
    }

    @Test
    void testSecondRunIsIdempotent() throws IOException {
        compile(false, "sonic-system.json", "sonic-types.json");
        Path proto = protoDir.resolve("sonic_system/sonic_system.proto");
        Path handler = serverDir.resolve("sonic_system/SonicSystemServiceHandler.java");
        String firstProto = Files.readString(proto);
        FileTime stamp = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(proto, stamp);
        Files.setLastModifiedTime(handler, stamp);

        CompilerResult second = compile(false, "sonic-system.json", "sonic-types.json");

        assertThat(second.isSuccess()).isTrue();
        assertThat(second.getProtoFilesWritten()).isZero();
        assertThat(second.getProtoFilesUnchanged()).isEqualTo(2);
        assertThat(second.getHandlersRegenerated()).isZero();
        assertThat(second.getFilesWritten()).isZero();
        assertThat(Files.readString(proto)).isEqualTo(firstProto);
        assertThat(Files.getLastModifiedTime(proto)).isEqualTo(stamp);
        assertThat(Files.getLastModifiedTime(handler)).isEqualTo(stamp);
    }

    @Test
    void testMissingHandlerIsRegenerated() throws IOException {
        compile(false, "sonic-system.json", "sonic-types.json");
        Path handler = serverDir.resolve("sonic_system/SonicSystemServiceHandler.java");
        Files.delete(handler);

        CompilerResult second = compile(false, "sonic-system.json", "sonic-types.json");

        assertThat(second.getHandlersRegenerated()).isEqualTo(1);
        assertThat(handler).exists();
    }

    @Test
    void testLeafrefToContainerAbortsWithoutOutput() throws IOException {
        CompilerResult result = compile(false, "sonic-system.json", "sonic-types.json", "leafref-container.json");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getExitCode()).isEqualTo(CompilerResult.EXIT_USAGE);
        assertThat(result.getErrorMessage())
                .contains("not pointing to leaf/leaf-list but to container config")
                .contains("/sonic-bad:config/ref");
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0)).isEqualTo(result.getErrorMessage());
        assertThat(countFiles(tempDir)).isZero();
    }

    @Test
    void testMissingImportedModuleFails() {
        CompilerResult result = compile(false, "sonic-system.json");

        assertThat(result.getExitCode()).isEqualTo(CompilerResult.EXIT_USAGE);
        assertThat(result.getErrorMessage()).contains("Prefix 'stypes'");
        assertThat(protoDir).doesNotExist();
    }

    @Test
    void testRpcOnlySkipsModulesWithoutRpcs() throws IOException {
        CompilerResult result = compile(true, "sonic-system.json", "sonic-types.json", "openconfig-platform.json");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getModulesCompiled()).isEqualTo(1);
        assertThat(result.getModulesSkipped()).isEqualTo(2);
        assertThat(protoDir.resolve("openconfig_platform")).doesNotExist();
        assertThat(Files.readString(protoDir.resolve("sonic_system/sonic_system.proto")))
                .doesNotContain("hostname")
                .contains("message RebootRequest {");
    }

    @Test
    void testOpenconfigPrefix() {
        CompilerResult result = compile(false, "openconfig-platform.json");

        assertThat(result.getStubPrefix()).isEqualTo("openconfig");
        assertThat(serverDir.resolve("OpenconfigServiceRegistration.java")).exists();
        assertThat(clientDir.resolve("gnoi_openconfig_client/OpenconfigClientMain.java")).exists();
    }

    @Test
    void testMalformedInputIsUsageError() {
        CompilerResult result = compile(false, "malformed.json");

        assertThat(result.getExitCode()).isEqualTo(CompilerResult.EXIT_USAGE);
        assertThat(result.getErrorMessage()).contains("malformed.json");
    }

    private static long countFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile).count();
        }
    }
}
