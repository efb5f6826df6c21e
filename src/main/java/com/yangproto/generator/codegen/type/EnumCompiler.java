package com.yangproto.generator.codegen.type;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yangproto.generator.codegen.model.EnumDefinition;
import com.yangproto.generator.codegen.util.NamingUtil;
import com.yangproto.generator.model.Statement;
import com.yangproto.generator.model.YangKeywords;

/**
 * Compiles a YANG enumeration into a proto enum.
 *
 * Proto enum values share one namespace per scope, so an enumeration is rejected
 * (and the leaf falls back to string) when a member name is not a valid proto
 * identifier or is already declared by a sibling leaf's enumeration under the same parent.
 * Members are numbered 0..N-1 in declaration order; explicit YANG values are ignored.
 */
public class EnumCompiler {
    private static final Logger log = LoggerFactory.getLogger(EnumCompiler.class);

    /**
     * @param enumerationType the {@code type enumeration} statement
     * @param leafName        YANG name of the declaring leaf
     * @param siblingMembers  member names declared by earlier sibling enumerations
     * @return the enum, or empty when the leaf must fall back to string
     */
    public Optional<EnumDefinition> compile(Statement enumerationType, String leafName, Set<String> siblingMembers) {
        List<Statement> enums = enumerationType.search(YangKeywords.ENUM);
        Set<String> names = new LinkedHashSet<>();

        for (Statement e : enums) {
            String member = e.getArgument();
            if (!isValidMemberName(member)) {
                log.debug("Enum member '{}' of leaf {} is not a valid proto identifier", member, leafName);
                return Optional.empty();
            }
            if (siblingMembers.contains(member)) {
                log.debug("Enum member '{}' of leaf {} already declared by a sibling enum", member, leafName);
                return Optional.empty();
            }
            names.add(member);
        }

        EnumDefinition.EnumDefinitionBuilder builder = EnumDefinition.builder()
                .name(NamingUtil.toPascalCase(leafName));
        int tag = 0;
        for (String member : names) {
            logDiscardedValue(enums, member, tag, leafName);
            builder.member(new EnumDefinition.EnumMember(member, tag++));
        }
        return Optional.of(builder.build());
    }

    static boolean isValidMemberName(String member) {
        return member != null
                && !member.isEmpty()
                && !Character.isDigit(member.charAt(0))
                && member.indexOf('-') < 0;
    }

    /**
     * Declared member names in order, valid or not.
     */
    public static List<String> memberNames(Statement enumerationType) {
        return enumerationType.search(YangKeywords.ENUM).stream()
                .map(Statement::getArgument)
                .toList();
    }

    private static void logDiscardedValue(List<Statement> enums, String member, int tag, String leafName) {
        enums.stream()
                .filter(e -> member.equals(e.getArgument()))
                .findFirst()
                .flatMap(e -> e.searchOne(YangKeywords.VALUE))
                .map(Statement::getArgument)
                .filter(v -> !v.trim().equals(Integer.toString(tag)))
                .ifPresent(v -> log.debug("Leaf {}: enum member {} declared value {} renumbered to {}",
                        leafName, member, v, tag));
    }
}
