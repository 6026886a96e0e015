package io.github.flameyossnowy.fluentsql.sql.internals;

import io.github.flameyossnowy.fluentsql.api.options.JoinOption;
import io.github.flameyossnowy.fluentsql.api.options.SelectOption;
import io.github.flameyossnowy.fluentsql.api.options.SortOption;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders accumulated clauses into SQL text with positional placeholders.
 * <p>
 * Every value ends up in the parameter list of the returned {@link ParsedQuery}, never in the text.
 * Identifiers (tables, columns, expressions) are written as given.
 */
public final class QueryParseEngine {
    /** Rendered for an {@code IN} predicate with no values, matches nothing. */
    public static final String ALWAYS_FALSE = "1 = 0";

    private QueryParseEngine() {
    }

    @Contract("_, _ -> new")
    public static @NotNull ParsedQuery parseSelect(@NotNull String table, @NotNull QueryState state) {
        List<Object> parameters = new ArrayList<>();

        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(state.columns.isEmpty() ? "*" : String.join(", ", state.columns));
        sql.append(" FROM ").append(table);

        for (JoinOption join : state.joins) {
            sql.append(' ').append(join.joinType()).append(" JOIN ").append(join.targetTable())
                .append(" ON ").append(join.onCondition());
        }

        appendConditions(" WHERE ", state.filters, sql, parameters);

        if (!state.groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", state.groupBy));
        }

        appendConditions(" HAVING ", state.havings, sql, parameters);
        appendSortingAndLimit(state, sql);

        return new ParsedQuery(sql.toString(), parameters);
    }

    @Contract("_, _ -> new")
    public static @NotNull ParsedQuery parseInsert(@NotNull String table, @NotNull Map<String, ?> data) {
        StringJoiner columns = new StringJoiner(", ");
        StringJoiner placeholders = new StringJoiner(", ");
        List<Object> parameters = new ArrayList<>(data.size());

        for (Map.Entry<String, ?> entry : data.entrySet()) {
            columns.add(entry.getKey());
            placeholders.add("?");
            parameters.add(entry.getValue());
        }

        return new ParsedQuery("INSERT INTO " + table + " (" + columns + ") VALUES (" + placeholders + ")", parameters);
    }

    @Contract("_, _, _ -> new")
    public static @NotNull ParsedQuery parseUpdate(@NotNull String table, @NotNull Map<String, ?> data, @NotNull List<SelectOption> filters) {
        StringJoiner setClause = new StringJoiner(", ");
        List<Object> parameters = new ArrayList<>(data.size() + filters.size());

        for (Map.Entry<String, ?> entry : data.entrySet()) {
            setClause.add(entry.getKey() + " = ?");
            parameters.add(entry.getValue());
        }

        StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ").append(setClause);
        appendConditions(" WHERE ", filters, sql, parameters);
        return new ParsedQuery(sql.toString(), parameters);
    }

    @Contract("_, _ -> new")
    public static @NotNull ParsedQuery parseDelete(@NotNull String table, @NotNull List<SelectOption> filters) {
        List<Object> parameters = new ArrayList<>(filters.size());
        StringBuilder sql = new StringBuilder("DELETE FROM ").append(table);
        appendConditions(" WHERE ", filters, sql, parameters);
        return new ParsedQuery(sql.toString(), parameters);
    }

    @Contract("_, _, _ -> new")
    public static @NotNull ParsedQuery parseCount(@NotNull String table, @NotNull String column, @NotNull List<SelectOption> filters) {
        List<Object> parameters = new ArrayList<>(filters.size());
        StringBuilder sql = new StringBuilder("SELECT COUNT(").append(column).append(") AS count FROM ").append(table);
        appendConditions(" WHERE ", filters, sql, parameters);
        return new ParsedQuery(sql.toString(), parameters);
    }

    @Contract("_, _ -> new")
    public static @NotNull ParsedQuery parseExists(@NotNull String table, @NotNull List<SelectOption> filters) {
        List<Object> parameters = new ArrayList<>(filters.size());
        StringBuilder sql = new StringBuilder("SELECT EXISTS(SELECT 1 FROM ").append(table);
        appendConditions(" WHERE ", filters, sql, parameters);
        sql.append(") AS result");
        return new ParsedQuery(sql.toString(), parameters);
    }

    private static void appendConditions(String keyword, @NotNull List<SelectOption> conditions, StringBuilder sql, List<Object> parameters) {
        if (conditions.isEmpty()) return;
        sql.append(keyword).append(buildConditions(conditions, parameters));
    }

    private static void appendSortingAndLimit(@NotNull QueryState state, StringBuilder sql) {
        if (!state.sortOptions.isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ");
            for (SortOption option : state.sortOptions) {
                joiner.add(option.field() + ' ' + option.order().name());
            }
            sql.append(" ORDER BY ").append(joiner);
        }

        if (state.limit != -1) {
            sql.append(" LIMIT ").append(state.limit);
        }
        if (state.offset != -1) {
            sql.append(" OFFSET ").append(state.offset);
        }
    }

    private static String buildConditions(@NotNull Iterable<SelectOption> conditions, List<Object> parameters) {
        StringJoiner joiner = new StringJoiner(" AND ");
        for (SelectOption condition : conditions) {
            if ("IN".equals(condition.operator()) && condition.value() instanceof Collection<?> values) {
                if (values.isEmpty()) {
                    joiner.add(ALWAYS_FALSE);
                    continue;
                }
                joiner.add(condition.option() + " IN (" + String.join(", ", Collections.nCopies(values.size(), "?")) + ")");
                parameters.addAll(values);
            } else {
                joiner.add(condition.option() + " " + condition.operator() + " ?");
                parameters.add(condition.value());
            }
        }
        return joiner.toString();
    }
}
