package com.yangproto.generator.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One node of an already-parsed, module-resolved YANG statement tree.
 *
 * Substatements hold every YANG substatement (type, typedef, enum, input, ...),
 * children hold the expanded schema data nodes. The parent link is only used for
 * typedef scoping and schema path computation.
 */
@Data
@NoArgsConstructor
public class Statement {
    private String keyword;
    private String argument;
    private String moduleName;
    private String modulePrefix;
    private List<Statement> substatements = new ArrayList<>();
    private List<Statement> children = new ArrayList<>();
    private Map<String, String> imports = new LinkedHashMap<>();
    private String leafrefPath;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Statement leafrefTarget;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Statement parent;

    @Builder
    public Statement(String keyword, String argument, String moduleName, String modulePrefix,
                     Map<String, String> imports, String leafrefPath) {
        this.keyword = keyword;
        this.argument = argument;
        this.moduleName = moduleName;
        this.modulePrefix = modulePrefix;
        this.imports = imports != null ? new LinkedHashMap<>(imports) : new LinkedHashMap<>();
        this.leafrefPath = leafrefPath;
    }

    public void addSubstatement(Statement sub) {
        substatements.add(sub);
        sub.setParent(this);
    }

    public void addChild(Statement child) {
        children.add(child);
        child.setParent(this);
    }

    /**
     * First substatement with the given keyword.
     */
    public Optional<Statement> searchOne(String kw) {
        return substatements.stream()
                .filter(s -> kw.equals(s.getKeyword()))
                .findFirst();
    }

    /**
     * All substatements with the given keyword, in declaration order.
     */
    public List<Statement> search(String kw) {
        return substatements.stream()
                .filter(s -> kw.equals(s.getKeyword()))
                .toList();
    }

    public Optional<Statement> findTypedef(String name) {
        return substatements.stream()
                .filter(s -> YangKeywords.TYPEDEF.equals(s.getKeyword()))
                .filter(s -> name.equals(s.getArgument()))
                .findFirst();
    }

    public boolean isModule() {
        return YangKeywords.MODULE.equals(keyword) || YangKeywords.SUBMODULE.equals(keyword);
    }

    public boolean is(String kw) {
        return kw.equals(keyword);
    }

    /**
     * Human readable location used in diagnostics.
     */
    public String describe() {
        return keyword + " " + (argument != null ? argument : "") + " (module " + moduleName + ")";
    }
}
