package com.entity.canonical.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * FalkorDB connection using the JFalkorDB client.
 * Parameters are inlined into the query text as escaped Cypher literals.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX FOR (c:CanonicalEntity) ON (c.id)",
            "CREATE INDEX FOR (c:CanonicalEntity) ON (c.entityType, c.canonicalNormalized)",
            "CREATE INDEX FOR (a:EntityAlias) ON (a.id)",
            "CREATE INDEX FOR (a:EntityAlias) ON (a.entityType, a.aliasNormalized)",
            "CREATE INDEX FOR (a:EntityAlias) ON (a.canonicalEntityId)",
            "CREATE INDEX FOR (m:EntityMention) ON (m.id)",
            "CREATE INDEX FOR (m:EntityMention) ON (m.canonicalEntityId)",
            "CREATE INDEX FOR (m:EntityMention) ON (m.documentId)",
            "CREATE INDEX FOR (l:EntityCandidateLink) ON (l.id)",
            "CREATE INDEX FOR (l:EntityCandidateLink) ON (l.mentionId)",
            "CREATE INDEX FOR (l:EntityCandidateLink) ON (l.status)",
            "CREATE INDEX FOR (d:ResolvedDocument) ON (d.documentId)"
    );

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("falkordb.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processed = inlineParams(query, params);
        log.debug("falkordb.execute query={}", processed);
        graph.query(processed);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processed = inlineParams(query, params);
        log.debug("falkordb.query query={}", processed);

        ResultSet resultSet = graph.query(processed);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        log.trace("falkordb.query.rows count={}", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("falkordb.ping.failed graph={}", graphName, e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        for (String statement : INDEXES) {
            try {
                graph.query(statement);
            } catch (RuntimeException e) {
                // FalkorDB rejects re-creating an existing index
                log.debug("falkordb.index.skipped statement={} message={}", statement, e.getMessage());
            }
        }
        log.info("falkordb.indexes.ready graph={} count={}", graphName, INDEXES.size());
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("falkordb.close.failed graph={}", graphName, e);
        }
        log.info("falkordb.closed graph={}", graphName);
    }

    /**
     * Replaces {@code $name} placeholders with literals. Longer names are substituted first
     * so that {@code $id} never clobbers {@code $idList}.
     */
    static String inlineParams(String query, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return query;
        }
        List<String> keys = params.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toList());
        String result = query;
        for (String key : keys) {
            result = result.replace("$" + key, formatValue(params.get(key)));
        }
        return result;
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(FalkorDBConnection::formatValue)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
