package com.yangproto.generator;

import java.util.Map;

import com.yangproto.generator.model.ModuleRegistry;
import com.yangproto.generator.model.Statement;
import com.yangproto.generator.model.YangKeywords;

/**
 * Builds small statement trees for tests. Children inherit module name and prefix
 * from their parent, as the JSON reader does.
 */
public final class YangFixtures {

    private YangFixtures() {
    }

    public static Statement module(String name, String prefix) {
        return module(name, prefix, Map.of());
    }

    public static Statement module(String name, String prefix, Map<String, String> imports) {
        return Statement.builder()
                .keyword(YangKeywords.MODULE)
                .argument(name)
                .moduleName(name)
                .modulePrefix(prefix)
                .imports(imports)
                .build();
    }

    /**
     * Schema child (container, list, leaf, rpc, ...).
     */
    public static Statement child(Statement parent, String keyword, String arg) {
        Statement stmt = inherit(parent, keyword, arg);
        parent.addChild(stmt);
        return stmt;
    }

    /**
     * Plain substatement (type, typedef, enum, input, ...).
     */
    public static Statement sub(Statement parent, String keyword, String arg) {
        Statement stmt = inherit(parent, keyword, arg);
        parent.addSubstatement(stmt);
        return stmt;
    }

    public static Statement leaf(Statement parent, String name, String type) {
        Statement leaf = child(parent, YangKeywords.LEAF, name);
        sub(leaf, YangKeywords.TYPE, type);
        return leaf;
    }

    public static Statement leafList(Statement parent, String name, String type) {
        Statement leaf = child(parent, YangKeywords.LEAF_LIST, name);
        sub(leaf, YangKeywords.TYPE, type);
        return leaf;
    }

    public static Statement enumLeaf(Statement parent, String name, String... members) {
        Statement leaf = child(parent, YangKeywords.LEAF, name);
        Statement type = sub(leaf, YangKeywords.TYPE, "enumeration");
        for (String member : members) {
            sub(type, YangKeywords.ENUM, member);
        }
        return leaf;
    }

    public static Statement typedef(Statement scope, String name, String type) {
        Statement typedef = sub(scope, YangKeywords.TYPEDEF, name);
        sub(typedef, YangKeywords.TYPE, type);
        return typedef;
    }

    /**
     * Leafref leaf already linked to its target, as the reader leaves it.
     */
    public static Statement leafref(Statement parent, String name, Statement target) {
        Statement leaf = leaf(parent, name, "leafref");
        leaf.setLeafrefTarget(target);
        return leaf;
    }

    /**
     * The reboot rpc: three input leafs and no output.
     */
    public static Statement rebootRpc(Statement module) {
        Statement rpc = child(module, YangKeywords.RPC, "reboot");
        Statement input = sub(rpc, YangKeywords.INPUT, null);
        leaf(input, "method", "int32");
        leaf(input, "delay", "uint64");
        leaf(input, "message", "string");
        return rpc;
    }

    public static ModuleRegistry registry(Statement... modules) {
        ModuleRegistry registry = new ModuleRegistry();
        for (Statement module : modules) {
            registry.register(module);
        }
        return registry;
    }

    private static Statement inherit(Statement parent, String keyword, String arg) {
        return Statement.builder()
                .keyword(keyword)
                .argument(arg)
                .moduleName(parent.getModuleName())
                .modulePrefix(parent.getModulePrefix())
                .build();
    }
}
