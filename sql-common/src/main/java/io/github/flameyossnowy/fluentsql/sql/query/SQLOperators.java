package io.github.flameyossnowy.fluentsql.sql.query;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Set;

/**
 * Comparison operators accepted in WHERE, HAVING and JOIN conditions.
 * <p>
 * Operators are written into the SQL text, so anything outside this set is rejected.
 */
public final class SQLOperators {
    private static final Set<String> COMPARISONS = Set.of(
        "=", "!=", "<>", "<", "<=", ">", ">=", "<=>", "LIKE", "NOT LIKE"
    );

    private SQLOperators() {
    }

    /**
     * @param operator the operator as supplied by the caller
     * @return the operator trimmed, upper-cased and with inner whitespace collapsed
     * @throws IllegalArgumentException if the operator is not a supported comparison
     */
    public static @NotNull String validate(@NotNull String operator) {
        String normalized = operator.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (!COMPARISONS.contains(normalized)) {
            throw new IllegalArgumentException(
                "Operator '" + operator + "' is not a valid SQL operator. " +
                "Valid operators: =, !=, <>, <, <=, >, >=, <=>, LIKE, NOT LIKE"
            );
        }
        return normalized;
    }
}
