package com.nexus.resolution.graph;

import java.util.List;
import java.util.Map;

/**
 * Cypher-speaking connection to the graph database holding canonical entities.
 */
public interface GraphConnection extends AutoCloseable {

    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * @return one map per result row, keyed by column alias
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes used by the canonical store; existing indexes are left alone.
     */
    void createIndexes();

    @Override
    void close();
}
