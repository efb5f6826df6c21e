package com.yangproto.generator.codegen.model.output;

/**
 * High-level categories of compiler output.
 */
public enum GeneratedFileType {
    PROTO,
    SERVER_HANDLER,
    REGISTRATION,
    TRANSLATOR_SUPPORT,
    CLIENT_DISPATCH
}
