package com.yangproto.generator.codegen.type;

import com.yangproto.generator.model.Statement;

import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of type resolution: the proto kind plus the {@code type} statement where
 * chasing stopped (carries the enum members for enumerations).
 */
@Value
public class ResolvedType {
    @NonNull
    ProtoType protoType;
    @NonNull
    Statement typeStatement;
}
