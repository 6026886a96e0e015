package io.github.flameyossnowy.fluentsql.sql.internals;

import java.sql.PreparedStatement;
import java.sql.SQLException;

@FunctionalInterface
public interface StatementFunction<R> {
    R apply(PreparedStatement statement) throws SQLException;
}
