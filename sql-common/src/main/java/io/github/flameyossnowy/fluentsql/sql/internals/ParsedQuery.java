package io.github.flameyossnowy.fluentsql.sql.internals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text together with the values for its {@code ?} placeholders, in placeholder order.
 * Values may be {@code null}.
 */
public record ParsedQuery(String sql, List<Object> parameters) {
    public ParsedQuery {
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }
}
