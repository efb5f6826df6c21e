package com.yangproto.generator.codegen.type;

import static com.yangproto.generator.YangFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.yangproto.generator.codegen.model.EnumDefinition;
import com.yangproto.generator.model.Statement;
import com.yangproto.generator.model.YangKeywords;

class EnumCompilerTest {

    private final EnumCompiler compiler = new EnumCompiler();

    @Test
    void testMembersNumberedFromZeroIgnoringExplicitValues() {
        Statement module = module("m", "m");
        Statement leaf = enumLeaf(module, "admin-status", "up", "down", "testing");
        Statement type = leaf.searchOne(YangKeywords.TYPE).orElseThrow();
        sub(type.search(YangKeywords.ENUM).get(0), YangKeywords.VALUE, "1");
        sub(type.search(YangKeywords.ENUM).get(1), YangKeywords.VALUE, "7");

        EnumDefinition enumeration = compiler.compile(type, "admin-status", Set.of()).orElseThrow();

        assertThat(enumeration.getName()).isEqualTo("AdminStatus");
        assertThat(enumeration.getMembers())
                .extracting(EnumDefinition.EnumMember::getName, EnumDefinition.EnumMember::getTag)
                .containsExactly(tuple("up", 0), tuple("down", 1), tuple("testing", 2));
    }

    @Test
    void testSharedMemberWithSiblingFallsBack() {
        Statement module = module("m", "m");
        Statement leaf = enumLeaf(module, "oper-status", "up", "unknown");

        Optional<EnumDefinition> result = compiler.compile(
                leaf.searchOne(YangKeywords.TYPE).orElseThrow(), "oper-status", Set.of("up", "down"));

        assertThat(result).isEmpty();
    }

    @Test
    void testMemberNamesKeepDeclarationOrder() {
        Statement module = module("m", "m");
        Statement leaf = enumLeaf(module, "speed", "auto", "10G", "100G");

        assertThat(EnumCompiler.memberNames(leaf.searchOne(YangKeywords.TYPE).orElseThrow()))
                .containsExactly("auto", "10G", "100G");
    }

    @ParameterizedTest
    @CsvSource({
            "10G, false",
            "half-duplex, false",
            "full_duplex, true",
            "auto, true"
    })
    void testMemberNameValidity(String member, boolean valid) {
        assertThat(EnumCompiler.isValidMemberName(member)).isEqualTo(valid);
    }

    @Test
    void testMalformedMemberFallsBack() {
        Statement module = module("m", "m");
        Statement leaf = enumLeaf(module, "speed", "auto", "10G");

        assertThat(compiler.compile(leaf.searchOne(YangKeywords.TYPE).orElseThrow(), "speed", Set.of())).isEmpty();
    }
}
