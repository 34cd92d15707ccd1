package com.project.attest.core;

import com.project.attest.crypto.Canonicalizer;
import com.project.attest.crypto.DocumentHasher;
import com.project.attest.io.ContentStore;
import com.project.attest.io.LocalFileContentStore;
import com.project.attest.io.ProofArtifactWriter;
import com.project.attest.ipfs.IPFSContentStore;
import com.project.attest.ipfs.IPFSService;
import com.project.attest.ledger.ChainRegistry;
import com.project.attest.ledger.ChainTarget;
import com.project.attest.ledger.ConfirmationTracker;
import com.project.attest.ledger.Web3jConnectionPool;
import com.project.attest.net.TimedCall;
import com.project.attest.oracle.HttpOracleGateway;
import com.project.attest.oracle.OracleClient;
import com.project.attest.oracle.OracleReportValidator;
import com.project.attest.proof.ProofArtifactCodec;
import com.project.attest.proof.ProofAssembler;
import com.project.attest.verify.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the engine and the verifier from an {@link EngineConfig} and owns what they share:
 * the worker pool and the RPC connection pool. Close it when done.
 */
public class EngineRuntime implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(EngineRuntime.class);

    private final EngineConfig config;
    private final Clock clock;
    private final ExecutorService executor;
    private final Web3jConnectionPool connectionPool;
    private final Canonicalizer canonicalizer = new Canonicalizer();
    private final ProofArtifactCodec codec = new ProofArtifactCodec(canonicalizer);
    private final List<ChainTarget> ledgers;
    private final ContentStore contentStore;

    public EngineRuntime(EngineConfig config) {
        this(config, Clock.systemUTC());
    }

    public EngineRuntime(EngineConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(daemonThreads());
        this.connectionPool = new Web3jConnectionPool();
        this.ledgers = new ChainRegistry(config.chainsDirectory()).targets(connectionPool);
        this.contentStore = config.ipfsUrl().isPresent()
                ? new IPFSContentStore(new IPFSService(config.ipfsUrl().get(), ipfsOptions(config)))
                : new LocalFileContentStore(config.contentDirectory());
        log.info("Loaded {} ledger(s) from {}", ledgers.size(), config.chainsDirectory());
    }

    public AttestationEngine engine() {
        requireLedgers();
        String oracleUrl = config.oracleUrl()
                .orElseThrow(() -> new IllegalStateException("ATTEST_ORACLE_URL is not set"));
        OracleReportValidator validator = new OracleReportValidator(
                requireOracleKeys(), config.stalenessWindow(), clock);
        OracleClient oracleClient = new OracleClient(
                new HttpOracleGateway(oracleUrl, config.oracleAuthToken(), config.callTimeout()),
                validator, config.oraclePolicy(), new TimedCall(executor), clock);
        ConfirmationTracker tracker = new ConfirmationTracker(executor, new TimedCall(executor),
                config.retryPolicy(), config.callTimeout(), config.ledgerCeiling(), clock);
        return new AttestationEngine(contentStore, new DocumentHasher(canonicalizer), oracleClient, tracker,
                ledgers, config.quorumFor(ledgers.size()), new ProofAssembler(codec),
                new ProofArtifactWriter(config.outboxDirectory(), codec), executor, clock);
    }

    public Verifier verifier() {
        requireLedgers();
        return new Verifier(new DocumentHasher(canonicalizer), codec, requireOracleKeys(), ledgers,
                config.quorumFor(ledgers.size()), contentStore, executor, config.callTimeout());
    }

    public ProofArtifactCodec codec() {
        return codec;
    }

    public Canonicalizer canonicalizer() {
        return canonicalizer;
    }

    public ContentStore contentStore() {
        return contentStore;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker threads still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        connectionPool.close();
    }

    private void requireLedgers() {
        if (ledgers.isEmpty()) {
            throw new IllegalStateException("No ledger definitions found in " + config.chainsDirectory());
        }
    }

    private List<String> requireOracleKeys() {
        if (config.authorizedOracleKeys().isEmpty()) {
            throw new IllegalStateException("ATTEST_AUTHORIZED_ORACLE_KEYS is not set");
        }
        return config.authorizedOracleKeys();
    }

    private static IPFSService.IpfsOptions ipfsOptions(EngineConfig config) {
        IPFSService.IpfsOptions fromEnv = IPFSService.IpfsOptions.fromEnv();
        return config.ipfsGatewayUrl().map(fromEnv::withGateway).orElse(fromEnv);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "attest-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
