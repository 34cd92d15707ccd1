package com.project.attest.proof;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.attest.core.ReportValidationException;
import com.project.attest.crypto.CanonicalizationException;
import com.project.attest.crypto.Canonicalizer;
import com.project.attest.crypto.Digest;
import com.project.attest.crypto.DocumentId;
import com.project.attest.crypto.HashingUtils;
import com.project.attest.io.ByteEncoding;
import com.project.attest.io.ContentLocator;
import com.project.attest.io.Timestamps;
import com.project.attest.ledger.AggregateStatus;
import com.project.attest.ledger.ChainConfirmation;
import com.project.attest.ledger.ConfirmationStatus;
import com.project.attest.ledger.QuorumPolicy;
import com.project.attest.oracle.OracleReport;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical JSON form of {@link ProofArtifact}.
 *
 * Digests are 64-character lowercase hex, signatures lowercase hex, timestamps in
 * {@link Timestamps} format. The checksum covers the canonical bytes of every field except
 * {@code artifactChecksum} itself.
 */
public class ProofArtifactCodec {

    static final String CHECKSUM_FIELD = "artifactChecksum";

    private final Canonicalizer canonicalizer;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ProofArtifactCodec(Canonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /**
     * Canonical bytes of the artifact, checksum included when the artifact is sealed.
     */
    public byte[] toJson(ProofArtifact artifact) {
        ObjectNode tree = body(artifact);
        if (artifact.artifactChecksum() != null) {
            tree.put(CHECKSUM_FIELD, artifact.artifactChecksum().hex());
        }
        return canonicalizer.canonicalize(tree);
    }

    /**
     * SHA-256 over the canonical bytes of the artifact without its checksum field.
     */
    public Digest computeChecksum(ProofArtifact artifact) {
        return Digest.sha256(HashingUtils.sha256(canonicalizer.canonicalize(body(artifact))));
    }

    /**
     * Reads an artifact, validating every field. Does not check the checksum; that is the
     * verifier's job.
     *
     * @throws ReportValidationException naming the first malformed field
     */
    public ProofArtifact fromJson(byte[] json) {
        JsonNode root;
        try {
            root = canonicalizer.parse(json);
        } catch (CanonicalizationException e) {
            throw new ReportValidationException("$", e.getMessage(), e);
        }
        if (!root.isObject()) {
            throw new ReportValidationException("$", "Artifact must be a JSON object");
        }

        int version = requiredInt(root, "version");
        if (version != ProofArtifact.FORMAT_VERSION) {
            throw new ReportValidationException("version", "Unsupported artifact version " + version);
        }
        String algorithm = requiredText(root, "digestAlgorithm");
        if (!Digest.SHA_256.equals(algorithm)) {
            throw new ReportValidationException("digestAlgorithm", "Unsupported digest algorithm " + algorithm);
        }

        JsonNode locatorNode = requiredObject(root, "contentLocator");
        ContentLocator locator;
        try {
            locator = new ContentLocator(URI.create(requiredText(locatorNode, "contentLocator.uri")),
                    digest(locatorNode, "contentLocator.contentDigest"));
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException("contentLocator.uri", e.getMessage(), e);
        }

        JsonNode quorumNode = requiredObject(root, "quorum");
        QuorumPolicy quorum;
        try {
            quorum = new QuorumPolicy(requiredInt(quorumNode, "quorum.required"), requiredInt(quorumNode, "quorum.ledgers"));
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException("quorum", e.getMessage(), e);
        }

        JsonNode checksumNode = root.get(CHECKSUM_FIELD);
        Digest checksum = checksumNode == null || checksumNode.isNull() ? null : digest(root, CHECKSUM_FIELD);

        return new ProofArtifact(
                version,
                algorithm,
                new DocumentId(digest(root, "documentId")),
                locator,
                digest(root, "metadataDigest"),
                readReport(requiredObject(root, "oracleReport")),
                readConfirmations(root),
                enumValue(AggregateStatus.class, requiredText(root, "aggregateStatus"), "aggregateStatus"),
                quorum,
                requiredBoolean(root, "cutoff"),
                timestamp(root, "createdAt"),
                readWarnings(root),
                checksum
        );
    }

    private ObjectNode body(ProofArtifact artifact) {
        ObjectNode root = nodes.objectNode();
        root.put("version", artifact.version());
        root.put("digestAlgorithm", artifact.digestAlgorithm());
        root.put("documentId", artifact.documentId().hex());

        ObjectNode locator = root.putObject("contentLocator");
        locator.put("uri", artifact.contentLocator().uri().toString());
        locator.put("contentDigest", artifact.contentLocator().contentDigest().hex());

        root.put("metadataDigest", artifact.metadataDigest().hex());
        root.set("oracleReport", report(artifact.oracleReport()));

        ArrayNode confirmations = root.putArray("chainConfirmations");
        for (ChainConfirmation confirmation : artifact.chainConfirmations()) {
            ObjectNode node = confirmations.addObject();
            node.put("chainId", confirmation.chainId());
            node.put("transactionRef", confirmation.transactionRef());
            if (confirmation.blockHeight() == null) {
                node.putNull("blockHeight");
            } else {
                node.put("blockHeight", confirmation.blockHeight().longValue());
            }
            node.put("confirmationCount", confirmation.confirmationCount());
            node.put("requiredDepth", confirmation.requiredDepth());
            node.put("status", confirmation.status().name());
            node.put("detail", confirmation.detail());
        }

        root.put("aggregateStatus", artifact.aggregateStatus().name());
        ObjectNode quorum = root.putObject("quorum");
        quorum.put("required", artifact.quorum().quorum());
        quorum.put("ledgers", artifact.quorum().ledgerCount());
        root.put("cutoff", artifact.cutoff());
        root.put("createdAt", Timestamps.format(artifact.createdAt()));

        ArrayNode warnings = root.putArray("warnings");
        artifact.warnings().forEach(warnings::add);
        return root;
    }

    private ObjectNode report(OracleReport report) {
        ObjectNode node = nodes.objectNode();
        node.put("requestId", report.requestId());
        node.put("reportedDigest", report.reportedDigest().hex());
        node.put("signature", ByteEncoding.toHex(report.signature()));
        node.put("issuedAt", Timestamps.format(report.issuedAt()));
        node.put("finalized", report.finalized());
        ObjectNode relays = node.putObject("relayTransactions");
        report.relayTransactions().forEach(relays::put);
        return node;
    }

    private OracleReport readReport(JsonNode node) {
        Map<String, String> relays = new TreeMap<>();
        JsonNode relayNode = requiredObject(node, "oracleReport.relayTransactions");
        Iterator<Map.Entry<String, JsonNode>> fields = relayNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isTextual()) {
                throw new ReportValidationException("oracleReport.relayTransactions." + entry.getKey(),
                        "Relay transaction must be a string");
            }
            relays.put(entry.getKey(), entry.getValue().textValue());
        }
        byte[] signature;
        try {
            signature = ByteEncoding.fromHex(requiredText(node, "oracleReport.signature"));
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException("oracleReport.signature", e.getMessage(), e);
        }
        return new OracleReport(
                requiredText(node, "oracleReport.requestId"),
                digest(node, "oracleReport.reportedDigest"),
                signature,
                timestamp(node, "oracleReport.issuedAt"),
                requiredBoolean(node, "oracleReport.finalized"),
                relays);
    }

    private List<ChainConfirmation> readConfirmations(JsonNode root) {
        JsonNode array = root.get("chainConfirmations");
        if (array == null || !array.isArray()) {
            throw new ReportValidationException("chainConfirmations", "Missing or not an array");
        }
        List<ChainConfirmation> confirmations = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            String prefix = "chainConfirmations[" + i + "].";
            JsonNode node = array.get(i);
            if (!node.isObject()) {
                throw new ReportValidationException("chainConfirmations[" + i + "]", "Not an object");
            }
            JsonNode height = node.get("blockHeight");
            try {
                confirmations.add(new ChainConfirmation(
                        requiredText(node, prefix + "chainId"),
                        optionalText(node, prefix + "transactionRef"),
                        height == null || height.isNull() ? null : requiredLong(node, prefix + "blockHeight"),
                        requiredLong(node, prefix + "confirmationCount"),
                        requiredInt(node, prefix + "requiredDepth"),
                        enumValue(ConfirmationStatus.class, requiredText(node, prefix + "status"), prefix + "status"),
                        optionalText(node, prefix + "detail")));
            } catch (IllegalArgumentException e) {
                throw new ReportValidationException("chainConfirmations[" + i + "]", e.getMessage(), e);
            }
        }
        return confirmations;
    }

    private List<String> readWarnings(JsonNode root) {
        JsonNode array = root.get("warnings");
        if (array == null || !array.isArray()) {
            throw new ReportValidationException("warnings", "Missing or not an array");
        }
        List<String> warnings = new ArrayList<>();
        for (JsonNode warning : array) {
            if (!warning.isTextual()) {
                throw new ReportValidationException("warnings", "Warnings must be strings");
            }
            warnings.add(warning.textValue());
        }
        return warnings;
    }

    // Field paths are dotted; the last segment is the key inside the given node.

    private static JsonNode field(JsonNode node, String path) {
        return node.get(path.substring(path.lastIndexOf('.') + 1));
    }

    private static String requiredText(JsonNode node, String path) {
        JsonNode value = field(node, path);
        if (value == null || !value.isTextual()) {
            throw new ReportValidationException(path, "Missing or not a string");
        }
        return value.textValue();
    }

    private static String optionalText(JsonNode node, String path) {
        JsonNode value = field(node, path);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ReportValidationException(path, "Not a string");
        }
        return value.textValue();
    }

    private static JsonNode requiredObject(JsonNode node, String path) {
        JsonNode value = field(node, path);
        if (value == null || !value.isObject()) {
            throw new ReportValidationException(path, "Missing or not an object");
        }
        return value;
    }

    private static boolean requiredBoolean(JsonNode node, String path) {
        JsonNode value = field(node, path);
        if (value == null || !value.isBoolean()) {
            throw new ReportValidationException(path, "Missing or not a boolean");
        }
        return value.booleanValue();
    }

    private static long requiredLong(JsonNode node, String path) {
        JsonNode value = field(node, path);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new ReportValidationException(path, "Missing or not an integer");
        }
        return value.longValue();
    }

    private static int requiredInt(JsonNode node, String path) {
        JsonNode value = field(node, path);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ReportValidationException(path, "Missing or not an integer");
        }
        return value.intValue();
    }

    private static Digest digest(JsonNode node, String path) {
        String hex = requiredText(node, path);
        if (hex.length() != Digest.LENGTH * 2 || !hex.equals(hex.toLowerCase(Locale.ROOT))) {
            throw new ReportValidationException(path, "Digest must be 64 lowercase hex characters");
        }
        try {
            return Digest.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException(path, e.getMessage(), e);
        }
    }

    private static Instant timestamp(JsonNode node, String path) {
        try {
            return Timestamps.parse(requiredText(node, path));
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException(path, e.getMessage(), e);
        }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, String path) {
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException(path, "Unknown value " + value);
        }
    }
}
