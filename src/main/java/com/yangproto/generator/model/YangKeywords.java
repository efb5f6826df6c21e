package com.yangproto.generator.model;

/**
 * YANG statement keywords the compiler reacts to.
 */
public final class YangKeywords {
    public static final String MODULE = "module";
    public static final String SUBMODULE = "submodule";
    public static final String CONTAINER = "container";
    public static final String GROUPING = "grouping";
    public static final String LIST = "list";
    public static final String LEAF = "leaf";
    public static final String LEAF_LIST = "leaf-list";
    public static final String CHOICE = "choice";
    public static final String CASE = "case";
    public static final String RPC = "rpc";
    public static final String NOTIFICATION = "notification";
    public static final String INPUT = "input";
    public static final String OUTPUT = "output";
    public static final String TYPE = "type";
    public static final String TYPEDEF = "typedef";
    public static final String ENUM = "enum";
    public static final String VALUE = "value";

    private YangKeywords() {
        // Constants
    }
}
