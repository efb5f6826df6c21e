package com.yangproto.generator.parser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.yangproto.generator.codegen.util.SchemaPathUtil;
import com.yangproto.generator.model.ModuleRegistry;
import com.yangproto.generator.model.Statement;
import com.yangproto.generator.model.YangKeywords;

/**
 * Loads statement trees dumped by the YANG frontend as JSON.
 *
 * Each file holds one module object or an array of them. Leafref target paths are
 * linked to their nodes only after every file has been read, so targets may live in
 * any loaded module.
 */
public class StatementTreeReader {
    private static final Logger log = LoggerFactory.getLogger(StatementTreeReader.class);

    private final List<Statement> modules = new ArrayList<>();

    /**
     * Reads all files and returns a registry holding every module, submodules excluded.
     */
    public ModuleRegistry readAll(List<Path> files) throws IOException {
        Objects.requireNonNull(files, "files");
        for (Path file : files) {
            read(file);
        }
        return link();
    }

    public void read(Path file) throws IOException {
        log.debug("Reading statement tree: {}", file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            read(reader, file.toString());
        }
    }

    public void read(Reader reader, String source) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new StatementTreeException("Malformed statement tree JSON in " + source + ": " + e.getMessage(), e);
        }

        if (root.isJsonArray()) {
            for (JsonElement el : root.getAsJsonArray()) {
                addTopLevel(toObject(el, source), source);
            }
        } else {
            addTopLevel(toObject(root, source), source);
        }
    }

    /**
     * Resolves leafref target paths and builds the registry.
     */
    public ModuleRegistry link() {
        Map<String, Statement> index = new HashMap<>();
        for (Statement module : modules) {
            indexSchemaNodes(module, index);
        }
        for (Statement module : modules) {
            linkLeafrefs(module, index);
        }
        return new ModuleRegistry(modules);
    }

    private void addTopLevel(JsonObject obj, String source) {
        Statement stmt = toStatement(obj, null, null, source);
        if (YangKeywords.SUBMODULE.equals(stmt.getKeyword())) {
            log.debug("Skipping submodule {}", stmt.getArgument());
            return;
        }
        if (!YangKeywords.MODULE.equals(stmt.getKeyword())) {
            throw new StatementTreeException("Top-level statement in " + source
                    + " must be a module, got: " + stmt.getKeyword());
        }
        modules.add(stmt);
    }

    private Statement toStatement(JsonObject obj, String inheritedModule, String inheritedPrefix, String source) {
        String keyword = string(obj, "keyword");
        if (keyword == null) {
            throw new StatementTreeException("Statement without keyword in " + source + ": " + obj);
        }
        String argument = string(obj, "arg");
        String moduleName = string(obj, "module");
        String prefix = string(obj, "prefix");

        if (moduleName == null) {
            moduleName = YangKeywords.MODULE.equals(keyword) || YangKeywords.SUBMODULE.equals(keyword)
                    ? argument : inheritedModule;
        }
        if (prefix == null) {
            prefix = inheritedPrefix;
        }

        Map<String, String> imports = new HashMap<>();
        if (obj.has("imports") && obj.get("imports").isJsonObject()) {
            for (Map.Entry<String, JsonElement> e : obj.getAsJsonObject("imports").entrySet()) {
                imports.put(e.getKey(), e.getValue().getAsString());
            }
        }

        Statement stmt = Statement.builder()
                .keyword(keyword)
                .argument(argument)
                .moduleName(moduleName)
                .modulePrefix(prefix)
                .imports(imports)
                .leafrefPath(string(obj, "leafrefTarget"))
                .build();

        for (JsonObject sub : array(obj, "substatements", source)) {
            stmt.addSubstatement(toStatement(sub, moduleName, prefix, source));
        }
        for (JsonObject child : array(obj, "children", source)) {
            stmt.addChild(toStatement(child, moduleName, prefix, source));
        }
        return stmt;
    }

    private void indexSchemaNodes(Statement node, Map<String, Statement> index) {
        for (Statement child : node.getChildren()) {
            if (child.is(YangKeywords.LEAF) || child.is(YangKeywords.LEAF_LIST)
                    || child.is(YangKeywords.CONTAINER) || child.is(YangKeywords.LIST)) {
                index.putIfAbsent(SchemaPathUtil.fullyQualifiedPath(child), child);
            }
            indexSchemaNodes(child, index);
        }
        for (Statement sub : node.getSubstatements()) {
            if (sub.is(YangKeywords.INPUT) || sub.is(YangKeywords.OUTPUT)) {
                indexSchemaNodes(sub, index);
            }
        }
    }

    private void linkLeafrefs(Statement node, Map<String, Statement> index) {
        if (node.getLeafrefPath() != null) {
            Statement target = index.get(SchemaPathUtil.normalize(node.getLeafrefPath()));
            if (target == null) {
                log.debug("Leafref target {} of {} not found among loaded modules",
                        node.getLeafrefPath(), node.describe());
            }
            node.setLeafrefTarget(target);
        }
        node.getChildren().forEach(child -> linkLeafrefs(child, index));
        node.getSubstatements().forEach(sub -> linkLeafrefs(sub, index));
    }

    private static String string(JsonObject obj, String member) {
        JsonElement el = obj.get(member);
        return el == null || el.isJsonNull() ? null : el.getAsString();
    }

    private static List<JsonObject> array(JsonObject obj, String member, String source) {
        JsonElement el = obj.get(member);
        if (el == null || el.isJsonNull()) {
            return List.of();
        }
        if (!el.isJsonArray()) {
            throw new StatementTreeException("'" + member + "' must be an array in " + source);
        }
        JsonArray arr = el.getAsJsonArray();
        List<JsonObject> result = new ArrayList<>(arr.size());
        for (JsonElement item : arr) {
            result.add(toObject(item, source));
        }
        return result;
    }

    private static JsonObject toObject(JsonElement el, String source) {
        if (!el.isJsonObject()) {
            throw new StatementTreeException("Expected a statement object in " + source + ", got: " + el);
        }
        return el.getAsJsonObject();
    }
}
