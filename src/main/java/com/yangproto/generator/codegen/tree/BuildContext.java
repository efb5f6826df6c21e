package com.yangproto.generator.codegen.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.yangproto.generator.codegen.model.RpcMethod;
import com.yangproto.generator.codegen.model.core.context.ToolDiagnostics;
import com.yangproto.generator.codegen.util.NamingUtil;

import lombok.Getter;

/**
 * Per-module state threaded through the recursive lowering: module names, the rpc
 * descriptors collected so far and module-level facts such as "a union was seen".
 * One instance per module; discarded once the module is built.
 */
@Getter
public class BuildContext {

    private final String sourceName;
    private final String plainName;
    private final String pascalName;
    private final ToolDiagnostics diagnostics;

    private final List<RpcMethod> rpcs = new ArrayList<>();
    private boolean usesStructuredValue;

    public BuildContext(String moduleName, ToolDiagnostics diagnostics) {
        this.sourceName = Objects.requireNonNull(moduleName, "moduleName");
        this.plainName = moduleName.replace('-', '_');
        this.pascalName = NamingUtil.toPascalCase(plainName);
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public void addRpc(RpcMethod rpc) {
        rpcs.add(rpc);
    }

    public List<RpcMethod> getRpcs() {
        return Collections.unmodifiableList(rpcs);
    }

    public void markStructuredValue() {
        usesStructuredValue = true;
    }

    public void recordEnumFallback(String message) {
        diagnostics.getWarnings().add(message);
    }
}
