package com.yangproto.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One compiled YANG module: the immutable tree handed to the emitters.
 */
@Value
@Builder(toBuilder = true)
public class ProtoModule {

    /**
     * Module name as declared in YANG.
     */
    @NonNull
    String sourceName;

    /**
     * Module name with hyphens replaced by underscores; used for file names.
     */
    @NonNull
    String plainName;

    /**
     * PascalCase module name; used for the proto package and the service.
     */
    @NonNull
    String pascalName;

    @NonNull
    @Singular("leaf")
    List<FieldDefinition> leafs;

    @NonNull
    @Singular("list")
    List<MessageDefinition> lists;

    @NonNull
    @Singular("container")
    List<MessageDefinition> containers;

    @NonNull
    @Singular("rpc")
    List<RpcMethod> rpcs;

    /**
     * A union was resolved somewhere in the module.
     */
    boolean usesStructuredValue;

    public boolean hasRpcs() {
        return !rpcs.isEmpty();
    }
}
