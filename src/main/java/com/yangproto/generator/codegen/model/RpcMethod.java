package com.yangproto.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Method descriptor recorded for one YANG rpc. Drives the service block and
 * every generated stub.
 */
@Value
@Builder(toBuilder = true)
public class RpcMethod {

    /**
     * PascalCase(module + "_" + rpc), unique across all compiled modules.
     */
    @NonNull
    String methodName;

    /**
     * PascalCase(rpc), the name used inside the module's service.
     */
    @NonNull
    String rpcName;

    /**
     * Module name with hyphens replaced by underscores.
     */
    @NonNull
    String moduleName;

    @NonNull
    String modulePascalName;

    /**
     * Absolute schema path of the rpc, used as the wire route.
     */
    @NonNull
    String route;

    @NonNull
    String requestType;

    @NonNull
    String responseType;

    boolean inputEmpty;
    boolean outputEmpty;

    /**
     * lowerCamelCase rpc name, the Java method name of the gRPC stub.
     */
    public String getJavaMethodName() {
        return Character.toLowerCase(rpcName.charAt(0)) + rpcName.substring(1);
    }
}
