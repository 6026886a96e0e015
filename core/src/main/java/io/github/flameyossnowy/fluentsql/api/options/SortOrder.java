package io.github.flameyossnowy.fluentsql.api.options;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    /**
     * Parses a direction keyword, ignoring case and surrounding whitespace.
     *
     * @param direction "ASC" or "DESC"
     * @return the matching order
     * @throws IllegalArgumentException for anything else
     */
    public static @NotNull SortOrder parse(@NotNull String direction) {
        String normalized = direction.trim().toUpperCase(Locale.ROOT);
        for (SortOrder order : values()) {
            if (order.name().equals(normalized)) return order;
        }
        throw new IllegalArgumentException("Sort direction must be ASC or DESC, got: " + direction);
    }
}
