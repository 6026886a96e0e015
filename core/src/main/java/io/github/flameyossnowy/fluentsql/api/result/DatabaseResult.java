package io.github.flameyossnowy.fluentsql.api.result;

/**
 * Represents a database-agnostic result row that can be used to retrieve values
 * without depending on any specific driver.
 */
public interface DatabaseResult {
    /**
     * Gets a value from the result by column name.
     *
     * @param columnName the name of the column
     * @param type the expected type of the value
     * @return the value converted to {@code type}, {@code null} for SQL NULL
     * @throws IllegalArgumentException if the column doesn't exist or type conversion fails
     */
    <T> T get(String columnName, Class<T> type);

    /**
     * Checks if a column exists in the result.
     *
     * @param columnName the name of the column to check
     * @return true if the column exists, false otherwise
     */
    boolean hasColumn(String columnName);

    /**
     * Gets the column count in the result.
     *
     * @return the number of columns in the result
     */
    int getColumnCount();

    /**
     * Gets the column name for the specified index.
     *
     * @param columnIndex the 0-based index of the column
     * @return the column name
     * @throws IndexOutOfBoundsException if the index is invalid
     */
    String getColumnName(int columnIndex);
}
