package com.project.attest.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * One ledger entry of the chains directory, e.g. {@code chains/sepolia.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChainDeployment {

    @JsonProperty("chainId")
    private String chainId;

    @JsonProperty("rpcUrl")
    private String rpcUrl;

    @JsonProperty("requiredDepth")
    private int requiredDepth = 12;

    @JsonProperty("notFoundGraceSeconds")
    private long notFoundGraceSeconds = 120;

    @JsonProperty("pollIntervalMillis")
    private long pollIntervalMillis = 4000;

    public ChainDeployment() {
    }

    public ChainDeployment(String chainId, String rpcUrl, int requiredDepth,
                           long notFoundGraceSeconds, long pollIntervalMillis) {
        this.chainId = chainId;
        this.rpcUrl = rpcUrl;
        this.requiredDepth = requiredDepth;
        this.notFoundGraceSeconds = notFoundGraceSeconds;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public String chainId() {
        return chainId;
    }

    public String rpcUrl() {
        return rpcUrl;
    }

    public int requiredDepth() {
        return requiredDepth;
    }

    public Duration notFoundGrace() {
        return Duration.ofSeconds(notFoundGraceSeconds);
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMillis);
    }
}
