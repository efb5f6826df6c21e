package com.yangproto.generator.codegen.tree;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yangproto.generator.codegen.model.FieldDefinition;
import com.yangproto.generator.codegen.model.MessageKind;
import com.yangproto.generator.codegen.model.RpcMethod;
import com.yangproto.generator.codegen.util.NamingUtil;
import com.yangproto.generator.codegen.util.SchemaPathUtil;
import com.yangproto.generator.model.Statement;
import com.yangproto.generator.model.YangKeywords;

/**
 * Turns one rpc statement into its request/response wrapper messages and a
 * {@link RpcMethod} descriptor.
 *
 * Both wrappers always exist. An absent or childless input/output leaves its
 * wrapper without fields and sets the corresponding empty flag.
 */
class RpcExtractor {
    private static final Logger log = LoggerFactory.getLogger(RpcExtractor.class);

    static final String INPUT_MESSAGE = "Input";
    static final String OUTPUT_MESSAGE = "Output";

    private final SchemaTreeBuilder treeBuilder;

    RpcExtractor(SchemaTreeBuilder treeBuilder) {
        this.treeBuilder = treeBuilder;
    }

    void extract(Statement rpc, MessageScope parent, BuildContext ctx) {
        String rpcArg = rpc.getArgument();
        log.debug("Extracting rpc {} of module {}", rpcArg, ctx.getSourceName());

        MessageScope request = new MessageScope(NamingUtil.toPascalCase(rpcArg + "_request"), MessageKind.CONTAINER);
        boolean inputEmpty = !lowerWrapped(rpc, YangKeywords.INPUT, INPUT_MESSAGE, request, ctx);
        parent.addContainer(request.toDefinition());

        MessageScope response = new MessageScope(NamingUtil.toPascalCase(rpcArg + "_response"), MessageKind.CONTAINER);
        boolean outputEmpty = !lowerWrapped(rpc, YangKeywords.OUTPUT, OUTPUT_MESSAGE, response, ctx);
        parent.addContainer(response.toDefinition());

        ctx.addRpc(RpcMethod.builder()
                .methodName(NamingUtil.toPascalCase(ctx.getPlainName() + "_" + rpcArg))
                .rpcName(NamingUtil.toPascalCase(rpcArg))
                .moduleName(ctx.getPlainName())
                .modulePascalName(ctx.getPascalName())
                .route(SchemaPathUtil.qualifiedPath(rpc))
                .requestType(request.getName())
                .responseType(response.getName())
                .inputEmpty(inputEmpty)
                .outputEmpty(outputEmpty)
                .build());
    }

    /**
     * Lowers input or output into a nested message plus one field referencing it.
     *
     * @return false when the statement is absent or has no children
     */
    private boolean lowerWrapped(Statement rpc, String keyword, String messageName,
                                 MessageScope wrapper, BuildContext ctx) {
        Optional<Statement> stmt = findIo(rpc, keyword);
        if (stmt.isEmpty() || stmt.get().getChildren().isEmpty()) {
            return false;
        }

        MessageScope nested = new MessageScope(messageName, MessageKind.CONTAINER);
        treeBuilder.processChildren(stmt.get(), nested, ctx);
        wrapper.addContainer(nested.toDefinition());
        wrapper.addField(FieldDefinition.builder()
                .name(keyword)
                .typeName(messageName)
                .jsonName(rpc.getModuleName() + ":" + keyword)
                .build());
        return true;
    }

    private static Optional<Statement> findIo(Statement rpc, String keyword) {
        Optional<Statement> sub = rpc.searchOne(keyword);
        if (sub.isPresent()) {
            return sub;
        }
        return rpc.getChildren().stream().filter(ch -> ch.is(keyword)).findFirst();
    }
}
