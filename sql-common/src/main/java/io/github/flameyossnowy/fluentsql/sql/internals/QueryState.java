package io.github.flameyossnowy.fluentsql.sql.internals;

import io.github.flameyossnowy.fluentsql.api.options.JoinOption;
import io.github.flameyossnowy.fluentsql.api.options.SelectOption;
import io.github.flameyossnowy.fluentsql.api.options.SortOption;

import java.util.ArrayList;
import java.util.List;

/**
 * The clauses a {@link io.github.flameyossnowy.fluentsql.sql.QueryBuilder} has accumulated, kept apart from any SQL text.
 */
public final class QueryState {
    public final List<String> columns = new ArrayList<>(4);
    public final List<JoinOption> joins = new ArrayList<>(1);
    public final List<SelectOption> filters = new ArrayList<>(2);
    public final List<String> groupBy = new ArrayList<>(1);
    public final List<SelectOption> havings = new ArrayList<>(1);
    public final List<SortOption> sortOptions = new ArrayList<>(1);
    public int limit = -1;
    public int offset = -1;

    public void clear() {
        columns.clear();
        joins.clear();
        filters.clear();
        groupBy.clear();
        havings.clear();
        sortOptions.clear();
        limit = -1;
        offset = -1;
    }

    public boolean isEmpty() {
        return columns.isEmpty()
            && joins.isEmpty()
            && filters.isEmpty()
            && groupBy.isEmpty()
            && havings.isEmpty()
            && sortOptions.isEmpty()
            && limit == -1
            && offset == -1;
    }
}
