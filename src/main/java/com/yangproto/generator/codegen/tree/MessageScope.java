package com.yangproto.generator.codegen.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.yangproto.generator.codegen.model.FieldDefinition;
import com.yangproto.generator.codegen.model.MessageDefinition;
import com.yangproto.generator.codegen.model.MessageKind;

/**
 * Mutable accumulator for one message while its children are being lowered.
 * Frozen into a {@link MessageDefinition} once complete.
 */
class MessageScope {

    private final String name;
    private final MessageKind kind;
    private final List<MessageDefinition> lists = new ArrayList<>();
    private final List<MessageDefinition> containers = new ArrayList<>();
    private final List<FieldDefinition> fields = new ArrayList<>();
    private final Set<String> declaredEnumMembers = new HashSet<>();

    MessageScope(String name, MessageKind kind) {
        this.name = name;
        this.kind = kind;
    }

    String getName() {
        return name;
    }

    void addList(MessageDefinition list) {
        lists.add(list);
    }

    void addContainer(MessageDefinition container) {
        containers.add(container);
    }

    void addField(FieldDefinition field) {
        fields.add(field);
    }

    List<MessageDefinition> getLists() {
        return Collections.unmodifiableList(lists);
    }

    List<MessageDefinition> getContainers() {
        return Collections.unmodifiableList(containers);
    }

    List<FieldDefinition> getFields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * Member names of every enumeration declared by a leaf of this message so far,
     * including enumerations that were downgraded to string.
     */
    Set<String> getDeclaredEnumMembers() {
        return Collections.unmodifiableSet(declaredEnumMembers);
    }

    void declareEnumMembers(Collection<String> members) {
        declaredEnumMembers.addAll(members);
    }

    /**
     * Replaces, in place, every enum field sharing a member with {@code members}
     * by a string field.
     *
     * @return the downgraded fields, as they were before the downgrade
     */
    List<FieldDefinition> downgradeCollidingEnums(Collection<String> members, String stringType) {
        List<FieldDefinition> downgraded = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            FieldDefinition field = fields.get(i);
            boolean collides = field.getEnumeration()
                    .map(e -> e.getMemberNames().stream().anyMatch(members::contains))
                    .orElse(false);
            if (collides) {
                fields.set(i, field.toBuilder().typeName(stringType).enumeration(null).build());
                downgraded.add(field);
            }
        }
        return downgraded;
    }

    MessageDefinition toDefinition() {
        return MessageDefinition.builder()
                .name(name)
                .kind(kind)
                .lists(lists)
                .containers(containers)
                .fields(fields)
                .build();
    }
}
