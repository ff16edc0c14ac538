package io.github.loregraph.index;

/**
 * Size of the in-memory graph.
 *
 * @param nodes       entity node count
 * @param aliases     distinct normalized aliases
 * @param edges       edge count across all adjacency maps
 * @param initialized whether the index reflects a completed rebuild
 */
public record EntityGraphStats(int nodes, int aliases, int edges, boolean initialized) {
}
