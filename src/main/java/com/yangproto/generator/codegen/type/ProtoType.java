package com.yangproto.generator.codegen.type;

import lombok.Getter;

/**
 * Target proto3 scalar kinds a YANG leaf can resolve to.
 */
@Getter
public enum ProtoType {
    INT32("int32"),
    INT64("int64"),
    UINT32("uint32"),
    UINT64("uint64"),
    SINT64("sint64"),
    BOOL("bool"),
    BYTES("bytes"),
    STRING("string"),
    /** Generic structured value used for unions. */
    STRUCTURED_VALUE("google.protobuf.Value"),
    /** Sentinel: the enumeration compiler decides the final type. */
    ENUMERATION(null);

    private final String protoName;

    ProtoType(String protoName) {
        this.protoName = protoName;
    }
}
