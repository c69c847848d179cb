package com.jsonparser.generator.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of primitive kinds a schema field may declare.
 */
public enum FieldKind {
    /**
     * Quoted JSON string, handed back verbatim.
     */
    STRING("string", "str", "text", "char*"),

    /**
     * Signed integer literal, handed back as its decimal text.
     */
    INTEGER("int", "integer", "long", "int64", "int64_t"),

    /**
     * {@code true} or {@code false} literal.
     */
    BOOLEAN("bool", "boolean");

    private final String canonicalName;
    private final List<String> aliases;

    FieldKind(String canonicalName, String... aliases) {
        this.canonicalName = canonicalName;
        this.aliases = List.of(aliases);
    }

    /**
     * Declared type name used when a schema is built from kinds directly.
     */
    public String getCanonicalName() {
        return canonicalName;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /**
     * Resolves a declared type name (case-insensitive, canonical name or alias).
     */
    public static Optional<FieldKind> fromDeclaredType(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) {
            return Optional.empty();
        }
        String normalized = declaredType.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.canonicalName.equals(normalized) || kind.aliases.contains(normalized))
                .findFirst();
    }
}
