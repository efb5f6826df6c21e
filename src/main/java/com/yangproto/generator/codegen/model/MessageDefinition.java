package com.yangproto.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Canonical internal representation of one proto message compiled from a YANG
 * container, grouping, list or rpc wrapper.
 *
 * Pure structure only (no resolution, no emission logic).
 */
@Value
@Builder(toBuilder = true)
public class MessageDefinition {

    @NonNull
    String name;

    @NonNull
    MessageKind kind;

    /**
     * Nested messages compiled from YANG lists, emitted first.
     */
    @NonNull
    @Singular("list")
    List<MessageDefinition> lists;

    /**
     * Nested messages compiled from containers, emitted after lists.
     */
    @NonNull
    @Singular("container")
    List<MessageDefinition> containers;

    /**
     * Fields in append order; field numbers follow this order.
     */
    @NonNull
    @Singular("field")
    List<FieldDefinition> fields;
}
