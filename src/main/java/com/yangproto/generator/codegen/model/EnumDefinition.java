package com.yangproto.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A proto enum compiled from a YANG enumeration.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class EnumDefinition {

    /**
     * Enum type name, the PascalCase identifier of the declaring leaf.
     */
    @NonNull
    String name;

    @NonNull
    @Singular("member")
    List<EnumMember> members;

    public Set<String> getMemberNames() {
        return members.stream().map(EnumMember::getName).collect(Collectors.toUnmodifiableSet());
    }

    @Value
    public static class EnumMember {
        @NonNull
        String name;
        int tag;
    }
}
