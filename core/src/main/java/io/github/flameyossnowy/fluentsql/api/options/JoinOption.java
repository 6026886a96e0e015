package io.github.flameyossnowy.fluentsql.api.options;

/**
 * @param joinType INNER or LEFT
 * @param targetTable the joined table
 * @param onCondition the rendered condition following {@code ON}
 */
public record JoinOption(String joinType, String targetTable, String onCondition) {
}
