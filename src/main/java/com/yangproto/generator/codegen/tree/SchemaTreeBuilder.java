package com.yangproto.generator.codegen.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yangproto.generator.codegen.model.EnumDefinition;
import com.yangproto.generator.codegen.model.FieldDefinition;
import com.yangproto.generator.codegen.model.MessageKind;
import com.yangproto.generator.codegen.model.ProtoModule;
import com.yangproto.generator.codegen.model.core.context.ToolDiagnostics;
import com.yangproto.generator.codegen.type.EnumCompiler;
import com.yangproto.generator.codegen.type.ProtoType;
import com.yangproto.generator.codegen.type.ResolvedType;
import com.yangproto.generator.codegen.type.TypeResolver;
import com.yangproto.generator.codegen.util.NamingUtil;
import com.yangproto.generator.codegen.util.SchemaPathUtil;
import com.yangproto.generator.model.Statement;
import com.yangproto.generator.model.YangKeywords;

/**
 * Lowers a module's schema statements into the compiled message tree.
 *
 * Containers and groupings become nested messages, lists become nested messages
 * referenced through repeated fields, choice/case are flattened into the
 * enclosing message, notifications are dropped and rpcs are handed to the
 * {@link RpcExtractor}.
 */
public class SchemaTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(SchemaTreeBuilder.class);

    private final TypeResolver typeResolver;
    private final EnumCompiler enumCompiler;
    private final RpcExtractor rpcExtractor;

    public SchemaTreeBuilder(TypeResolver typeResolver, EnumCompiler enumCompiler) {
        this.typeResolver = Objects.requireNonNull(typeResolver, "typeResolver");
        this.enumCompiler = Objects.requireNonNull(enumCompiler, "enumCompiler");
        this.rpcExtractor = new RpcExtractor(this);
    }

    /**
     * Builds the full tree of one module.
     *
     * @param rpcOnly only compile the module's rpcs (top-level data nodes are skipped)
     * @throws com.yangproto.generator.codegen.exception.ResolutionException on any unresolvable type
     */
    public ProtoModule buildModule(Statement module, ToolDiagnostics diagnostics, boolean rpcOnly) {
        BuildContext ctx = new BuildContext(module.getArgument(), diagnostics);
        MessageScope root = new MessageScope(ctx.getPascalName(), MessageKind.CONTAINER);

        if (rpcOnly) {
            module.getChildren().stream()
                    .filter(ch -> ch.is(YangKeywords.RPC))
                    .forEach(rpc -> rpcExtractor.extract(rpc, root, ctx));
        } else {
            processChildren(module, root, ctx);
        }

        return ProtoModule.builder()
                .sourceName(ctx.getSourceName())
                .plainName(ctx.getPlainName())
                .pascalName(ctx.getPascalName())
                .leafs(root.getFields())
                .lists(root.getLists())
                .containers(root.getContainers())
                .rpcs(ctx.getRpcs())
                .usesStructuredValue(ctx.isUsesStructuredValue())
                .build();
    }

    void processChildren(Statement node, MessageScope parent, BuildContext ctx) {
        for (Statement ch : node.getChildren()) {
            switch (ch.getKeyword()) {
                case YangKeywords.RPC -> rpcExtractor.extract(ch, parent, ctx);
                case YangKeywords.NOTIFICATION -> log.debug("Ignoring notification {}", ch.getArgument());
                case YangKeywords.CHOICE, YangKeywords.CASE -> processChildren(ch, parent, ctx);
                case YangKeywords.CONTAINER, YangKeywords.GROUPING -> processNested(ch, parent, ctx, MessageKind.CONTAINER);
                case YangKeywords.LIST -> processNested(ch, parent, ctx, MessageKind.LIST);
                case YangKeywords.LEAF -> processLeaf(ch, parent, ctx, false);
                case YangKeywords.LEAF_LIST -> processLeaf(ch, parent, ctx, true);
                default -> log.debug("Skipping unsupported statement {}", ch.describe());
            }
        }
    }

    private void processNested(Statement ch, MessageScope parent, BuildContext ctx, MessageKind kind) {
        MessageScope nested = new MessageScope(NamingUtil.toPascalCase(ch.getArgument()), kind);
        processChildren(ch, nested, ctx);

        if (kind == MessageKind.LIST) {
            parent.addList(nested.toDefinition());
        } else {
            parent.addContainer(nested.toDefinition());
        }
        parent.addField(FieldDefinition.builder()
                .name(NamingUtil.toFieldName(ch.getArgument()))
                .typeName(nested.getName())
                .jsonName(SchemaPathUtil.lastSegment(ch))
                .repeated(kind == MessageKind.LIST)
                .build());
    }

    private void processLeaf(Statement ch, MessageScope parent, BuildContext ctx, boolean leafList) {
        String jsonName = SchemaPathUtil.lastSegment(ch);
        ResolvedType resolved = typeResolver.resolve(ch);

        FieldDefinition.FieldDefinitionBuilder field = FieldDefinition.builder()
                .name(NamingUtil.toFieldName(ch.getArgument()))
                .jsonName(jsonName)
                .repeated(leafList);

        if (resolved.getProtoType() == ProtoType.STRUCTURED_VALUE) {
            ctx.markStructuredValue();
        }

        if (resolved.getProtoType() == ProtoType.ENUMERATION) {
            Statement enumType = resolved.getTypeStatement();
            List<String> members = EnumCompiler.memberNames(enumType);
            Optional<EnumDefinition> enumeration =
                    enumCompiler.compile(enumType, ch.getArgument(), parent.getDeclaredEnumMembers());
            if (enumeration.isPresent()) {
                field.typeName(enumeration.get().getName()).enumeration(enumeration.get());
            } else {
                recordFallback(jsonName, SchemaPathUtil.qualifiedPath(ch), ctx);
                field.typeName(ProtoType.STRING.getProtoName());
                // a collision downgrades the earlier sibling as well
                for (FieldDefinition sibling : parent.downgradeCollidingEnums(members, ProtoType.STRING.getProtoName())) {
                    recordFallback(sibling.getJsonName(), sibling.getJsonName(), ctx);
                }
            }
            parent.declareEnumMembers(members);
        } else {
            field.typeName(resolved.getProtoType().getProtoName());
        }

        parent.addField(field.build());
    }

    private static void recordFallback(String jsonName, String location, BuildContext ctx) {
        log.info("Due to protobuf limitation changing type to string from enum for leaf {}", jsonName);
        ctx.recordEnumFallback("Enum of leaf " + location + " downgraded to string");
    }
}
