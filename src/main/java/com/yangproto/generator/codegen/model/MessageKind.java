package com.yangproto.generator.codegen.model;

/**
 * Origin of a compiled message. Both kinds share the same shape; a list is
 * referenced from its parent through a repeated field.
 */
public enum MessageKind {
    CONTAINER,
    LIST
}
