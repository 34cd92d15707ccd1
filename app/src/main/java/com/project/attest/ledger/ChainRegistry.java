package com.project.attest.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads ledger definitions from a directory holding one {@code <name>.json} per ledger.
 */
public class ChainRegistry {

    private final Path chainsDirectory;
    private final ObjectMapper mapper = new ObjectMapper();

    public ChainRegistry(Path chainsDirectory) {
        this.chainsDirectory = chainsDirectory;
    }

    public Optional<ChainDeployment> load(String name) {
        Path file = chainsDirectory.resolve(name + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    /**
     * All ledgers in the directory, ordered by file name. A missing directory yields no ledgers.
     */
    public List<ChainDeployment> loadAll() {
        if (!Files.isDirectory(chainsDirectory)) {
            return List.of();
        }
        List<ChainDeployment> deployments = new ArrayList<>();
        try (Stream<Path> files = Files.list(chainsDirectory)) {
            files.filter(file -> file.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .forEach(file -> deployments.add(read(file)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list chains directory: " + chainsDirectory, e);
        }
        return deployments;
    }

    /**
     * Turns every deployment into a tracking target, sharing RPC clients through {@code pool}.
     */
    public List<ChainTarget> targets(Web3jConnectionPool pool) {
        List<ChainTarget> targets = new ArrayList<>();
        for (ChainDeployment deployment : loadAll()) {
            LedgerGateway gateway = new Web3jLedgerGateway(deployment.chainId(), pool.getConnection(deployment.rpcUrl()));
            targets.add(new ChainTarget(deployment.chainId(), gateway, deployment.requiredDepth(),
                    deployment.notFoundGrace(), deployment.pollInterval()));
        }
        return targets;
    }

    private ChainDeployment read(Path file) {
        ChainDeployment deployment;
        try {
            deployment = mapper.readValue(file.toFile(), ChainDeployment.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read chain definition: " + file, e);
        }
        if (deployment.chainId() == null || deployment.chainId().isBlank()) {
            throw new IllegalStateException("Chain definition " + file + " has no chainId");
        }
        if (deployment.rpcUrl() == null || deployment.rpcUrl().isBlank()) {
            throw new IllegalStateException("Chain definition " + file + " has no rpcUrl");
        }
        return deployment;
    }
}
