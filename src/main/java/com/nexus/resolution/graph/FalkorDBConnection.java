package com.nexus.resolution.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphConnection} over the JFalkorDB client. Parameters are passed to the server
 * as query parameters rather than spliced into the query text.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized for graph: {}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        log.debug("Executing: {}", query);
        graph.query(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        log.debug("Querying: {}", query);
        ResultSet resultSet = graph.query(query, params);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        log.debug("Query returned {} rows", rows.size());
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating canonical store indexes for graph {}", graphName);
        safeExecute("CREATE INDEX FOR (c:Canonical) ON (c.id)");
        safeExecute("CREATE INDEX FOR (c:Canonical) ON (c.type)");
        safeExecute("CREATE INDEX FOR (c:Canonical) ON (c.normalizedName)");
        safeExecute("CREATE INDEX FOR (c:Canonical) ON (c.status)");
        safeExecute("CREATE INDEX FOR (l:Lease) ON (l.key)");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (RuntimeException e) {
            // index already exists
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection", e);
        }
        log.info("FalkorDB connection closed");
    }
}
