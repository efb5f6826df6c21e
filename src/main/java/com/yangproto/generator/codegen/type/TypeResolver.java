package com.yangproto.generator.codegen.type;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yangproto.generator.codegen.exception.ResolutionException;
import com.yangproto.generator.codegen.util.SchemaPathUtil;
import com.yangproto.generator.model.ModuleRegistry;
import com.yangproto.generator.model.Statement;
import com.yangproto.generator.model.YangKeywords;

/**
 * Maps a leaf's declared YANG type to a proto type, chasing typedefs (local
 * scopes first, then module scope, then imported modules) and leafrefs.
 */
public class TypeResolver {
    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    public static final String LEAFREF = "leafref";

    private static final Map<String, ProtoType> BASE_TYPES = Map.ofEntries(
            Map.entry("int8", ProtoType.INT32),
            Map.entry("int16", ProtoType.INT32),
            Map.entry("int32", ProtoType.INT32),
            Map.entry("int64", ProtoType.INT64),
            Map.entry("uint8", ProtoType.UINT32),
            Map.entry("uint16", ProtoType.UINT32),
            Map.entry("uint32", ProtoType.UINT32),
            Map.entry("uint64", ProtoType.UINT64),
            Map.entry("decimal64", ProtoType.SINT64),
            Map.entry("boolean", ProtoType.BOOL),
            Map.entry("binary", ProtoType.BYTES),
            Map.entry("bits", ProtoType.BYTES),
            Map.entry("string", ProtoType.STRING),
            Map.entry("empty", ProtoType.STRING),
            Map.entry("identityref", ProtoType.STRING),
            Map.entry("instance-identifier", ProtoType.STRING),
            Map.entry("union", ProtoType.STRUCTURED_VALUE),
            Map.entry("enumeration", ProtoType.ENUMERATION));

    private final ModuleRegistry registry;

    public TypeResolver(ModuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public static boolean isBaseType(String name) {
        return BASE_TYPES.containsKey(name) || LEAFREF.equals(name);
    }

    /**
     * Resolves the type of a leaf or leaf-list.
     *
     * @throws ResolutionException if a typedef, prefix or leafref target cannot be resolved
     */
    public ResolvedType resolve(Statement node) {
        return resolve(node, identitySet());
    }

    private ResolvedType resolve(Statement node, Set<Statement> visitedLeafrefs) {
        Statement type = node.is(YangKeywords.TYPE)
                ? node
                : node.searchOne(YangKeywords.TYPE).orElseThrow(() -> new ResolutionException(
                        pathOf(node), "No type statement on " + node.describe()));

        Set<Statement> visitedTypedefs = identitySet();
        while (!isBaseType(type.getArgument())) {
            Statement typedef = findTypedef(type, node);
            if (!visitedTypedefs.add(typedef)) {
                throw new ResolutionException(pathOf(node), "Circular typedef " + typedef.getArgument());
            }
            log.debug("Chasing typedef {} for {}", typedef.getArgument(), node.getArgument());
            Statement next = typedef.searchOne(YangKeywords.TYPE).orElse(null);
            if (next == null) {
                throw new ResolutionException(pathOf(node), "Typedef " + typedef.getArgument() + " has no type");
            }
            type = next;
        }

        if (LEAFREF.equals(type.getArgument())) {
            return resolveLeafref(node, visitedLeafrefs);
        }
        return new ResolvedType(BASE_TYPES.get(type.getArgument()), type);
    }

    private Statement findTypedef(Statement type, Statement node) {
        String qualified = type.getArgument();
        int colon = qualified.indexOf(':');
        String prefix = colon >= 0 ? qualified.substring(0, colon) : null;
        String name = colon >= 0 ? qualified.substring(colon + 1) : qualified;

        Optional<Statement> typedef;
        if (prefix == null || prefix.equals(type.getModulePrefix())) {
            typedef = searchAncestry(type, name);
            if (typedef.isEmpty()) {
                typedef = registry.find(type.getModuleName()).flatMap(m -> m.findTypedef(name));
            }
        } else {
            Statement owner = registry.find(type.getModuleName()).orElse(null);
            Statement imported = registry.resolvePrefix(owner, prefix).orElseThrow(() -> new ResolutionException(
                    pathOf(node), "Prefix '" + prefix + "' is not mapped to a loaded module (module "
                            + type.getModuleName() + ")"));
            typedef = imported.findTypedef(name);
        }

        return typedef.orElseThrow(() -> new ResolutionException(pathOf(node),
                "Typedef " + qualified + " is not found, make sure all dependent modules are present"));
    }

    /**
     * Nearest enclosing scope first. The module itself is the last ancestor.
     */
    private static Optional<Statement> searchAncestry(Statement from, String name) {
        Statement scope = from.getParent();
        while (scope != null) {
            Optional<Statement> found = scope.findTypedef(name);
            if (found.isPresent()) {
                return found;
            }
            scope = scope.getParent();
        }
        return Optional.empty();
    }

    private ResolvedType resolveLeafref(Statement node, Set<Statement> visitedLeafrefs) {
        Statement target = node.getLeafrefTarget();
        if (target == null) {
            throw new ResolutionException(pathOf(node), "Leafref of " + node.describe()
                    + " has no resolvable target" + (node.getLeafrefPath() != null ? " (" + node.getLeafrefPath() + ")" : ""));
        }
        if (!target.is(YangKeywords.LEAF) && !target.is(YangKeywords.LEAF_LIST)) {
            throw new ResolutionException(pathOf(node), "Leafref of " + node.getArgument()
                    + " not pointing to leaf/leaf-list but to " + target.getKeyword() + " " + target.getArgument());
        }
        if (!visitedLeafrefs.add(node)) {
            throw new ResolutionException(pathOf(node), "Circular leafref chain through " + node.getArgument());
        }
        return resolve(target, visitedLeafrefs);
    }

    /**
     * Statements compare by value; cycle detection needs node identity.
     */
    private static Set<Statement> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static String pathOf(Statement node) {
        return node.is(YangKeywords.TYPE) && node.getParent() != null
                ? SchemaPathUtil.qualifiedPath(node.getParent())
                : SchemaPathUtil.qualifiedPath(node);
    }
}
