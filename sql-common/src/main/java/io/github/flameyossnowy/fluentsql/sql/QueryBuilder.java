package io.github.flameyossnowy.fluentsql.sql;

import io.github.flameyossnowy.fluentsql.api.exceptions.QueryException;
import io.github.flameyossnowy.fluentsql.api.options.JoinOption;
import io.github.flameyossnowy.fluentsql.api.options.SelectOption;
import io.github.flameyossnowy.fluentsql.api.options.SortOption;
import io.github.flameyossnowy.fluentsql.api.options.SortOrder;
import io.github.flameyossnowy.fluentsql.api.result.Row;
import io.github.flameyossnowy.fluentsql.api.utils.Logging;
import io.github.flameyossnowy.fluentsql.sql.internals.ParsedQuery;
import io.github.flameyossnowy.fluentsql.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.fluentsql.sql.internals.QueryState;
import io.github.flameyossnowy.fluentsql.sql.internals.RowExtractor;
import io.github.flameyossnowy.fluentsql.sql.internals.SQLConnectionProvider;
import io.github.flameyossnowy.fluentsql.sql.internals.StatementFunction;
import io.github.flameyossnowy.fluentsql.sql.query.SQLOperators;
import io.github.flameyossnowy.fluentsql.sql.resolvers.SQLValueResolver;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder for queries against one table.
 * <p>
 * Clause methods record what they are given and return this builder, so calls can be chained in any order.
 * Terminal methods ({@link #execute()}, {@link #insert(Map)}, {@link #insertGetId(Map)}, {@link #update(Map)},
 * {@link #delete()}, {@link #count()} and {@link #exists()}) render the SQL, run it through the connection provider
 * and then {@link #reset()} the builder, keeping only the table and the provider. A terminal method that fails throws
 * a {@link QueryException} and leaves the accumulated clauses untouched.
 * <p>
 * Every value is sent as a positional {@code ?} parameter. Table names, column names and expressions are written into
 * the SQL text as given and must never come from untrusted input.
 * <p>
 * A builder is mutable and meant for one owner at a time; use one builder per logical query sequence.
 * Several builders may share a connection provider.
 *
 * <pre>{@code
 * List<Row> rows = database.table("users")
 *     .select("id", "name")
 *     .where("age", ">=", 18)
 *     .orderBy("name")
 *     .limit(10)
 *     .execute();
 * }</pre>
 */
public class QueryBuilder {
    private final SQLConnectionProvider connectionProvider;
    private final QueryState state = new QueryState();
    private String table;

    public QueryBuilder(@NotNull SQLConnectionProvider connectionProvider, @NotNull String table) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "Connection provider cannot be null");
        this.table = Objects.requireNonNull(table, "Table cannot be null");
    }

    /*
     * |---------|
     * | Clauses |
     * |---------|
     */

    /**
     * Selects every column.
     *
     * @return this builder
     */
    public QueryBuilder select() {
        return select("*");
    }

    /**
     * Replaces the SELECT list.
     *
     * @param columns column expressions, {@code *} when none are given
     * @return this builder
     */
    public QueryBuilder select(String @NotNull ... columns) {
        return select(Arrays.asList(columns));
    }

    /**
     * Replaces the SELECT list.
     *
     * @param columns column expressions, {@code *} when empty
     * @return this builder
     */
    public QueryBuilder select(@NotNull Collection<String> columns) {
        state.columns.clear();
        if (columns.isEmpty()) {
            state.columns.add("*");
        } else {
            for (String column : columns) {
                state.columns.add(Objects.requireNonNull(column, "Column cannot be null"));
            }
        }
        return this;
    }

    /**
     * Switches the target table. Accumulated clauses are kept.
     *
     * @param table the table
     * @return this builder
     */
    public QueryBuilder from(@NotNull String table) {
        this.table = Objects.requireNonNull(table, "Table cannot be null");
        return this;
    }

    /**
     * Adds an equality predicate.
     *
     * @param column the column to compare
     * @param value the value, bound as a parameter
     * @return this builder
     */
    public QueryBuilder where(@NotNull String column, @Nullable Object value) {
        return where(column, "=", value);
    }

    /**
     * Adds a predicate. Predicates are combined with {@code AND}.
     *
     * @param column the column to compare
     * @param operator the comparison, one of {@code =, !=, <>, <, <=, >, >=, <=>, LIKE, NOT LIKE}
     * @param value the value, bound as a parameter
     * @return this builder
     * @throws IllegalArgumentException if the operator is not supported
     */
    public QueryBuilder where(@NotNull String column, @NotNull String operator, @Nullable Object value) {
        state.filters.add(new SelectOption(Objects.requireNonNull(column, "Column cannot be null"), SQLOperators.validate(operator), value));
        return this;
    }

    /**
     * Adds an {@code IN} predicate with one placeholder per value.
     * An empty collection adds a predicate that matches no row.
     *
     * @param column the column to compare
     * @param values the candidate values
     * @return this builder
     */
    public QueryBuilder whereIn(@NotNull String column, @NotNull Collection<?> values) {
        state.filters.add(new SelectOption(Objects.requireNonNull(column, "Column cannot be null"), "IN", Collections.unmodifiableList(new ArrayList<>(values))));
        return this;
    }

    public QueryBuilder whereIn(@NotNull String column, Object @NotNull ... values) {
        return whereIn(column, Arrays.asList(values));
    }

    public QueryBuilder join(@NotNull String table, @NotNull String foreignColumn) {
        return join(table, foreignColumn, "=", null);
    }

    public QueryBuilder join(@NotNull String table, @NotNull String foreignColumn, @NotNull String operator) {
        return join(table, foreignColumn, operator, null);
    }

    /**
     * Adds an {@code INNER JOIN table ON <this table>.<localColumn> <operator> table.<foreignColumn>}.
     *
     * @param table the joined table
     * @param foreignColumn the column of the joined table
     * @param operator the comparison
     * @param localColumn the column of this builder's table, {@code <this table>_id} when {@code null}
     * @return this builder
     */
    public QueryBuilder join(@NotNull String table, @NotNull String foreignColumn, @NotNull String operator, @Nullable String localColumn) {
        return addJoin("INNER", table, foreignColumn, operator, localColumn);
    }

    public QueryBuilder leftJoin(@NotNull String table, @NotNull String foreignColumn) {
        return leftJoin(table, foreignColumn, "=", null);
    }

    public QueryBuilder leftJoin(@NotNull String table, @NotNull String foreignColumn, @NotNull String operator) {
        return leftJoin(table, foreignColumn, operator, null);
    }

    /**
     * Adds a {@code LEFT JOIN}, otherwise identical to {@link #join(String, String, String, String)}.
     */
    public QueryBuilder leftJoin(@NotNull String table, @NotNull String foreignColumn, @NotNull String operator, @Nullable String localColumn) {
        return addJoin("LEFT", table, foreignColumn, operator, localColumn);
    }

    private QueryBuilder addJoin(String type, @NotNull String target, @NotNull String foreignColumn, @NotNull String operator, @Nullable String localColumn) {
        Objects.requireNonNull(target, "Table cannot be null");
        Objects.requireNonNull(foreignColumn, "Foreign column cannot be null");
        String local = localColumn != null ? localColumn : this.table + "_id";
        String condition = this.table + '.' + local + ' ' + SQLOperators.validate(operator) + ' ' + target + '.' + foreignColumn;
        state.joins.add(new JoinOption(type, target, condition));
        return this;
    }

    public QueryBuilder orderBy(@NotNull String column) {
        return orderBy(column, SortOrder.ASC);
    }

    /**
     * @param column the column to sort by
     * @param direction {@code ASC} or {@code DESC}, case-insensitive
     * @return this builder
     * @throws IllegalArgumentException for any other direction
     */
    public QueryBuilder orderBy(@NotNull String column, @NotNull String direction) {
        return orderBy(column, SortOrder.parse(direction));
    }

    /**
     * Adds a sort key. Later keys break ties of earlier ones.
     *
     * @param column the column to sort by
     * @param order the direction
     * @return this builder
     */
    public QueryBuilder orderBy(@NotNull String column, @NotNull SortOrder order) {
        state.sortOptions.add(new SortOption(Objects.requireNonNull(column, "Column cannot be null"), Objects.requireNonNull(order, "Order cannot be null")));
        return this;
    }

    public QueryBuilder groupBy(String @NotNull ... columns) {
        if (columns.length == 0) {
            throw new IllegalArgumentException("GROUP BY needs at least one column");
        }
        for (String column : columns) {
            state.groupBy.add(Objects.requireNonNull(column, "Column cannot be null"));
        }
        return this;
    }

    public QueryBuilder having(@NotNull String column, @Nullable Object value) {
        return having(column, "=", value);
    }

    /**
     * Adds a HAVING predicate. Predicates are combined with {@code AND}.
     *
     * @param column the column or aggregate expression
     * @param operator the comparison
     * @param value the value, bound as a parameter
     * @return this builder
     */
    public QueryBuilder having(@NotNull String column, @NotNull String operator, @Nullable Object value) {
        state.havings.add(new SelectOption(Objects.requireNonNull(column, "Column cannot be null"), SQLOperators.validate(operator), value));
        return this;
    }

    public QueryBuilder limit(int limit) {
        if (limit < 0) throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        state.limit = limit;
        return this;
    }

    public QueryBuilder offset(int offset) {
        if (offset < 0) throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        state.offset = offset;
        return this;
    }

    /*
     * |----------------------|
     * | Terminal operations  |
     * |----------------------|
     */

    /**
     * Runs the SELECT built so far, {@code SELECT *} if no columns were chosen.
     *
     * @return every matching row
     * @throws QueryException if the driver fails
     */
    public @NotNull List<Row> execute() {
        List<Row> rows = run(QueryParseEngine.parseSelect(table, state), QueryBuilder::fetchAll);
        reset();
        return rows;
    }

    /**
     * Inserts one row. Accumulated clauses are ignored.
     *
     * @param data column names mapped to values, in column order
     * @return {@code true} once the row is written
     * @throws IllegalArgumentException if {@code data} is empty
     * @throws QueryException if the driver fails
     */
    public boolean insert(@NotNull Map<String, ?> data) {
        requireData(data);
        run(QueryParseEngine.parseInsert(table, data), PreparedStatement::executeUpdate);
        reset();
        return true;
    }

    /**
     * Inserts one row and reads back the key the database generated for it.
     *
     * @param data column names mapped to values, in column order
     * @return the generated key, or {@code -1} if the table generated none
     * @throws IllegalArgumentException if {@code data} is empty
     * @throws QueryException if the driver fails
     */
    public long insertGetId(@NotNull Map<String, ?> data) {
        requireData(data);
        long id = run(QueryParseEngine.parseInsert(table, data), true, statement -> {
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        });
        reset();
        return id;
    }

    /**
     * Updates the rows matching the WHERE predicates, every row of the table if there are none.
     *
     * @param data column names mapped to their new values
     * @return {@code true} once the statement ran
     * @throws IllegalArgumentException if {@code data} is empty
     * @throws QueryException if the driver fails
     */
    public boolean update(@NotNull Map<String, ?> data) {
        requireData(data);
        run(QueryParseEngine.parseUpdate(table, data, state.filters), PreparedStatement::executeUpdate);
        reset();
        return true;
    }

    /**
     * Deletes the rows matching the WHERE predicates, every row of the table if there are none.
     *
     * @return {@code true} once the statement ran
     * @throws QueryException if the driver fails
     */
    public boolean delete() {
        run(QueryParseEngine.parseDelete(table, state.filters), PreparedStatement::executeUpdate);
        reset();
        return true;
    }

    public long count() {
        return count("*");
    }

    /**
     * Counts the rows matching the WHERE predicates.
     *
     * @param column the counted expression, rows where it is NULL are skipped unless it is {@code *}
     * @return the count, {@code 0} when nothing matched
     * @throws QueryException if the driver fails
     */
    public long count(@NotNull String column) {
        long count = run(QueryParseEngine.parseCount(table, column, state.filters), statement -> {
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getLong(1) : 0L;
            }
        });
        reset();
        return count;
    }

    /**
     * @return {@code true} if at least one row matches the WHERE predicates
     * @throws QueryException if the driver fails
     */
    public boolean exists() {
        boolean exists = run(QueryParseEngine.parseExists(table, state.filters), statement -> {
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() && resultSet.getLong(1) != 0;
            }
        });
        reset();
        return exists;
    }

    /**
     * Runs caller-written SQL. The builder's own clauses are neither used nor reset.
     *
     * @param query the SQL, trusted as is
     * @param parameters values for its {@code ?} placeholders
     * @return every row the statement produced, empty for statements without a result set
     * @throws QueryException if the driver fails
     */
    public @NotNull List<Row> executeRaw(@NotNull String query, Object @NotNull ... parameters) {
        return executeRaw(query, Arrays.asList(parameters));
    }

    public @NotNull List<Row> executeRaw(@NotNull String query, @NotNull List<?> parameters) {
        return run(new ParsedQuery(query, new ArrayList<>(parameters)), statement -> {
            if (!statement.execute()) return List.of();
            try (ResultSet resultSet = statement.getResultSet()) {
                return RowExtractor.extract(resultSet);
            }
        });
    }

    /*
     * |------------|
     * | Inspection |
     * |------------|
     */

    /**
     * @return the SQL {@link #execute()} would run, or an empty string if no clause has been added since the last reset
     */
    public @NotNull String getRawQuery() {
        return state.isEmpty() ? "" : QueryParseEngine.parseSelect(table, state).sql();
    }

    /**
     * @return the values {@link #execute()} would bind, in placeholder order
     */
    public @NotNull List<Object> getBindings() {
        return QueryParseEngine.parseSelect(table, state).parameters();
    }

    public @NotNull String getTable() {
        return table;
    }

    /**
     * Drops every accumulated clause. The table and the connection provider are kept.
     *
     * @return this builder
     */
    @Contract("-> this")
    public QueryBuilder reset() {
        state.clear();
        return this;
    }

    /*
     * |-----------|
     * | Execution |
     * |-----------|
     */

    private static List<Row> fetchAll(PreparedStatement statement) throws SQLException {
        try (ResultSet resultSet = statement.executeQuery()) {
            return RowExtractor.extract(resultSet);
        }
    }

    private static void requireData(@NotNull Map<String, ?> data) {
        if (data.isEmpty()) {
            throw new IllegalArgumentException("Data cannot be empty");
        }
    }

    private <R> R run(ParsedQuery query, StatementFunction<R> function) {
        return run(query, false, function);
    }

    private <R> R run(ParsedQuery query, boolean generatedKeys, StatementFunction<R> function) {
        Logging.info(() -> "Executing query: " + query.sql());
        Logging.deepInfo(() -> "Binding parameters " + query.parameters() + " for: " + query.sql());

        Connection connection = connectionProvider.getConnection();
        QueryException failure = null;
        try (PreparedStatement statement = generatedKeys
                ? connectionProvider.prepareStatement(query.sql(), connection, Statement.RETURN_GENERATED_KEYS)
                : connectionProvider.prepareStatement(query.sql(), connection)) {
            List<Object> parameters = query.parameters();
            for (int i = 0; i < parameters.size(); i++) {
                SQLValueResolver.bind(statement, i + 1, parameters.get(i));
            }
            return function.apply(statement);
        } catch (SQLException e) {
            String message = "Query execution failed: " + e.getMessage();
            Logging.error(message + " [" + query.sql() + "]", e);
            failure = new QueryException(message, query.sql(), e);
            throw failure;
        } finally {
            release(connection, failure);
        }
    }

    // A release failure must not replace the query failure that is already propagating.
    private void release(Connection connection, @Nullable QueryException failure) {
        try {
            connectionProvider.releaseConnection(connection);
        } catch (RuntimeException e) {
            if (failure == null) throw e;
            failure.addSuppressed(e);
        }
    }
}
