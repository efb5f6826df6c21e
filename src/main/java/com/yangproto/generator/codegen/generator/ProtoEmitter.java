package com.yangproto.generator.codegen.generator;

import java.util.ArrayList;
import java.util.List;

import com.yangproto.generator.codegen.model.EnumDefinition;
import com.yangproto.generator.codegen.model.FieldDefinition;
import com.yangproto.generator.codegen.model.MessageDefinition;
import com.yangproto.generator.codegen.model.ProtoModule;
import com.yangproto.generator.codegen.model.RpcMethod;

/**
 * Serializes one compiled module into proto3 text.
 *
 * Output is a pure function of the module tree: headers, one wrapper message per
 * top-level leaf, top-level lists, top-level containers, then the service block
 * when the module declares rpcs. Field numbers run 1..N per message in append order.
 */
public class ProtoEmitter {

    public static final String PACKAGE_ROOT = "gnoi";
    public static final String STRUCT_IMPORT = "google/protobuf/struct.proto";

    private static final String INDENT = "    ";

    /**
     * Renders the proto file for a module.
     */
    public String emit(ProtoModule module) {
        List<String> blocks = new ArrayList<>();
        blocks.add(headers(module));

        for (FieldDefinition leaf : module.getLeafs()) {
            blocks.add(leafWrapper(leaf));
        }
        for (MessageDefinition list : module.getLists()) {
            blocks.add(message(list, 0));
        }
        for (MessageDefinition container : module.getContainers()) {
            blocks.add(message(container, 0));
        }
        if (module.hasRpcs()) {
            blocks.add(service(module));
        }
        return String.join("\n", blocks);
    }

    public static String protoPackage(ProtoModule module) {
        return PACKAGE_ROOT + "." + module.getPascalName();
    }

    public static String serviceName(ProtoModule module) {
        return module.getPascalName() + "Service";
    }

    private String headers(ProtoModule module) {
        StringBuilder sb = new StringBuilder();
        sb.append("syntax = \"proto3\";\n");
        sb.append('\n');
        sb.append("package ").append(protoPackage(module)).append(";\n");
        sb.append("option java_multiple_files = true;\n");
        if (module.isUsesStructuredValue()) {
            sb.append('\n');
            sb.append("import \"").append(STRUCT_IMPORT).append("\";\n");
        }
        return sb.toString();
    }

    private String leafWrapper(FieldDefinition leaf) {
        StringBuilder sb = new StringBuilder();
        sb.append("message ").append(leaf.getName()).append(" {\n");
        appendFields(sb, List.of(leaf), 1);
        sb.append("}\n");
        return sb.toString();
    }

    private String message(MessageDefinition message, int level) {
        String pad = INDENT.repeat(level);
        StringBuilder sb = new StringBuilder();
        sb.append(pad).append("message ").append(message.getName()).append(" {\n");
        for (MessageDefinition list : message.getLists()) {
            sb.append(message(list, level + 1));
        }
        for (MessageDefinition container : message.getContainers()) {
            sb.append(message(container, level + 1));
        }
        appendFields(sb, message.getFields(), level + 1);
        sb.append(pad).append("}\n");
        return sb.toString();
    }

    private void appendFields(StringBuilder sb, List<FieldDefinition> fields, int level) {
        String pad = INDENT.repeat(level);
        int number = 1;
        for (FieldDefinition field : fields) {
            field.getEnumeration().ifPresent(e -> appendEnum(sb, e, pad));
            sb.append(pad);
            if (field.isRepeated()) {
                sb.append("repeated ");
            }
            sb.append(field.getTypeName()).append(' ')
                    .append(field.getName()).append(" = ").append(number++)
                    .append(" [json_name = \"").append(field.getJsonName()).append("\"];\n");
        }
    }

    private void appendEnum(StringBuilder sb, EnumDefinition enumeration, String pad) {
        sb.append(pad).append("enum ").append(enumeration.getName()).append(" {\n");
        for (EnumDefinition.EnumMember member : enumeration.getMembers()) {
            sb.append(pad).append(INDENT).append(member.getName()).append(" = ").append(member.getTag()).append(";\n");
        }
        sb.append(pad).append("}\n");
    }

    private String service(ProtoModule module) {
        StringBuilder sb = new StringBuilder();
        sb.append("service ").append(serviceName(module)).append(" {\n");
        for (RpcMethod rpc : module.getRpcs()) {
            sb.append(INDENT).append("rpc ").append(rpc.getRpcName())
                    .append('(').append(rpc.getRequestType()).append(')')
                    .append(" returns (").append(rpc.getResponseType()).append(") {}\n");
        }
        sb.append("}\n");
        return sb.toString();
    }
}
