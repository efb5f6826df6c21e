package com.yangproto.generator.parser;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.yangproto.generator.model.ModuleRegistry;
import com.yangproto.generator.model.Statement;
import com.yangproto.generator.model.YangKeywords;

class StatementTreeReaderTest {

    static Path fixture(String name) {
        try {
            return Path.of(StatementTreeReaderTest.class.getResource("/fixtures/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void testReadsModulesAndSkipsSubmodules() throws IOException {
        ModuleRegistry registry = new StatementTreeReader()
                .readAll(List.of(fixture("sonic-system.json"), fixture("sonic-types.json")));

        assertThat(registry.getModules()).extracting(Statement::getArgument)
                .containsExactly("sonic-system", "sonic-types");
        assertThat(registry.find("sonic-types-common")).isEmpty();
    }

    @Test
    void testChildrenInheritModuleAndPrefix() throws IOException {
        ModuleRegistry registry = new StatementTreeReader().readAll(List.of(fixture("sonic-system.json")));
        Statement module = registry.find("sonic-system").orElseThrow();

        Statement system = module.getChildren().get(0);
        Statement hostname = system.getChildren().get(0);
        assertThat(hostname.getModuleName()).isEqualTo("sonic-system");
        assertThat(hostname.getModulePrefix()).isEqualTo("sys");
        assertThat(hostname.getParent()).isSameAs(system);
        assertThat(hostname.searchOne(YangKeywords.TYPE).orElseThrow().getArgument()).isEqualTo("stypes:host-name");
        assertThat(module.getImports()).containsEntry("stypes", "sonic-types");
    }

    @Test
    void testLeafrefTargetsAreLinked() throws IOException {
        ModuleRegistry registry = new StatementTreeReader().readAll(List.of(fixture("sonic-system.json")));
        Statement system = registry.find("sonic-system").orElseThrow().getChildren().get(0);

        Statement primary = system.getChildren().get(1);
        assertThat(primary.getLeafrefTarget()).isSameAs(system.getChildren().get(0));
    }

    @Test
    void testUnknownLeafrefTargetStaysUnset() {
        StatementTreeReader reader = new StatementTreeReader();
        reader.read(new StringReader("""
                {"keyword": "module", "arg": "m", "prefix": "m", "children": [
                  {"keyword": "leaf", "arg": "ref", "leafrefTarget": "/m:nowhere",
                   "substatements": [{"keyword": "type", "arg": "leafref"}]}
                ]}
                """), "inline");

        Statement ref = reader.link().find("m").orElseThrow().getChildren().get(0);

        assertThat(ref.getLeafrefPath()).isEqualTo("/m:nowhere");
        assertThat(ref.getLeafrefTarget()).isNull();
    }

    @Test
    void testMalformedJsonFails() {
        assertThatThrownBy(() -> new StatementTreeReader().readAll(List.of(fixture("malformed.json"))))
                .isInstanceOf(StatementTreeException.class)
                .hasMessageContaining("Malformed statement tree JSON");
    }

    @Test
    void testTopLevelMustBeModule() {
        assertThatThrownBy(() -> new StatementTreeReader().read(
                new StringReader("{\"keyword\": \"container\", \"arg\": \"c\"}"), "inline"))
                .isInstanceOf(StatementTreeException.class)
                .hasMessageContaining("must be a module");
    }

    @Test
    void testMissingKeywordFails() {
        assertThatThrownBy(() -> new StatementTreeReader().read(
                new StringReader("{\"keyword\": \"module\", \"arg\": \"m\", \"children\": [{\"arg\": \"x\"}]}"), "inline"))
                .isInstanceOf(StatementTreeException.class)
                .hasMessageContaining("without keyword");
    }
}
