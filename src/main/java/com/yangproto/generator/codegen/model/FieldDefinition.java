package com.yangproto.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Describes a single field of a proto message (a compiled YANG leaf, or the
 * synthetic field referencing a nested container or list).
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class FieldDefinition {

    /**
     * Field identifier with hyphens replaced by underscores.
     */
    @NonNull
    String name;

    /**
     * Proto type: a scalar name, or a message/enum name defined in the same tree.
     */
    @NonNull
    String typeName;

    /**
     * Member name used in YANG-encoded JSON payloads.
     */
    @NonNull
    String jsonName;

    /**
     * Emitted as {@code repeated} (leaf-list or list reference).
     */
    boolean repeated;

    /**
     * Set only when the field carries its own enum type.
     */
    EnumDefinition enumeration;

    public Optional<EnumDefinition> getEnumeration() {
        return Optional.ofNullable(enumeration);
    }
}
