package io.github.flameyossnowy.fluentsql.sql.internals;

import io.github.flameyossnowy.fluentsql.api.result.Row;
import io.github.flameyossnowy.fluentsql.api.result.Value;
import io.github.flameyossnowy.fluentsql.sql.resolvers.SQLValueResolver;
import org.jetbrains.annotations.NotNull;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drains a result set into {@link Row}s keyed by column label.
 * When two columns share a label, the later one wins.
 */
public final class RowExtractor {
    private RowExtractor() {
    }

    public static @NotNull List<Row> extract(@NotNull ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        String[] labels = new String[columnCount];
        for (int i = 0; i < columnCount; i++) {
            labels[i] = metaData.getColumnLabel(i + 1);
        }

        List<Row> rows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Value> values = new LinkedHashMap<>(columnCount);
            for (int i = 0; i < columnCount; i++) {
                values.put(labels[i], SQLValueResolver.read(resultSet, i + 1));
            }
            rows.add(new Row(values));
        }
        return rows;
    }
}
