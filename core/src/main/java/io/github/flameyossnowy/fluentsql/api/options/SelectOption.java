package io.github.flameyossnowy.fluentsql.api.options;

/**
 * A single predicate of a WHERE or HAVING clause.
 * @param option The column or expression on the left-hand side.
 * @param operator The operator, usually "=". {@code IN} predicates carry a collection as value.
 * @param value The value to compare with, always bound as a parameter.
 */
public record SelectOption(String option, String operator, Object value) {
}
