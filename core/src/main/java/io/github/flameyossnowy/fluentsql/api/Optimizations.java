package io.github.flameyossnowy.fluentsql.api;

public enum Optimizations {
    /**
     * Caches prepared statements to improve performance and minimize database calls.
     * <p>
     * Usually redundant when using the recommended settings constant.
     */
    CACHE_PREPARED_STATEMENTS,

    /**
     * Sets the recommended driver settings for statement caching and batching.
     */
    RECOMMENDED_SETTINGS
}
