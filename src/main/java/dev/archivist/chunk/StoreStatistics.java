package dev.archivist.chunk;

/**
 * Row counts of the three provenance tables.
 *
 * @param copyrightHolders rows in {@code copyright_holders}
 * @param sources rows in {@code sources}
 * @param chunks rows in {@code chunks}
 */
public record StoreStatistics(long copyrightHolders, long sources, long chunks) {}
