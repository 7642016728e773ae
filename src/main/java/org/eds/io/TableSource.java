package org.eds.io;

/**
 * A single physical data table (periodic table, x-ray line database, ...):
 * - which table it is (its resource or file name)
 * - where its data comes from (classpath/file/stream)
 *
 * Implementations should load once, cache, and return immutable data.
 */
public interface TableSource<T> {

    /**
     * The table's name, e.g. {@code default_xrays.json}.
     */
    String name();

    /**
     * Loads (or returns cached) table content.
     */
    T load();
}
