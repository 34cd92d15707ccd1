package com.project.attest.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.io.Closeable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shares one {@link Web3j} client per RPC endpoint across the ledgers that point at it.
 *
 * Clients live until {@link #close()}, which shuts all of them down. Callers must not shut down
 * a client they got from the pool.
 */
public class Web3jConnectionPool implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Web3jConnectionPool.class);

    private static final int DEFAULT_MAX_CONNECTIONS = 16;

    private final int maxConnections;
    private final Map<String, Web3j> connections = new ConcurrentHashMap<>();

    public Web3jConnectionPool() {
        this(DEFAULT_MAX_CONNECTIONS);
    }

    public Web3jConnectionPool(int maxConnections) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        this.maxConnections = maxConnections;
    }

    /**
     * Returns the shared client for {@code rpcEndpoint}, creating it if needed.
     */
    public synchronized Web3j getConnection(String rpcEndpoint) {
        if (rpcEndpoint == null || rpcEndpoint.isBlank()) {
            throw new IllegalArgumentException("RPC endpoint must not be null or empty");
        }
        String endpoint = normalizeEndpoint(rpcEndpoint);
        Web3j existing = connections.get(endpoint);
        if (existing != null) {
            return existing;
        }
        if (connections.size() >= maxConnections) {
            throw new IllegalStateException("Connection pool exhausted: " + connections.size()
                    + " active connections, maximum allowed " + maxConnections);
        }

        Web3j web3j = Web3j.build(new HttpService(endpoint));
        connections.put(endpoint, web3j);
        log.debug("Opened RPC connection to {}", endpoint);
        return web3j;
    }

    public int getActiveConnectionCount() {
        return connections.size();
    }

    private static String normalizeEndpoint(String endpoint) {
        String normalized = endpoint.trim();
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    @Override
    public synchronized void close() {
        for (Map.Entry<String, Web3j> entry : connections.entrySet()) {
            try {
                entry.getValue().shutdown();
            } catch (RuntimeException e) {
                log.warn("Error closing RPC connection to {}: {}", entry.getKey(), e.getMessage());
            }
        }
        connections.clear();
    }
}
