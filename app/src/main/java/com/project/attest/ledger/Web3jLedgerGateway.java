package com.project.attest.ledger;

import com.project.attest.core.ExternalServiceException;
import com.project.attest.core.TransientNetworkException;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.ClientConnectionException;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads relay transaction status from an EVM ledger over JSON-RPC.
 *
 * A transaction counts as found once it has a receipt. The confirmation count is the distance
 * from the receipt's block to the current head, inclusive.
 *
 * Non-2xx HTTP replies surface from web3j as {@link ClientConnectionException}. 5xx, 408, 429
 * and replies without a readable status are transient; any other status is a hard error.
 */
public class Web3jLedgerGateway implements LedgerGateway {

    private static final Pattern HTTP_STATUS = Pattern.compile("Invalid response received: (\\d{3})");

    private final String chainId;
    private final Web3j web3;

    public Web3jLedgerGateway(String chainId, Web3j web3) {
        this.chainId = Objects.requireNonNull(chainId, "chainId must not be null");
        this.web3 = Objects.requireNonNull(web3, "web3 must not be null");
    }

    @Override
    public TransactionStatus getTransactionStatus(String transactionRef) {
        try {
            EthGetTransactionReceipt receiptResponse = web3.ethGetTransactionReceipt(transactionRef).send();
            checkError(receiptResponse, "eth_getTransactionReceipt");
            Optional<TransactionReceipt> receipt = receiptResponse.getTransactionReceipt();
            if (receipt.isEmpty() || receipt.get().getBlockNumberRaw() == null) {
                return TransactionStatus.notFound();
            }

            EthBlockNumber headResponse = web3.ethBlockNumber().send();
            checkError(headResponse, "eth_blockNumber");
            BigInteger head = headResponse.getBlockNumber();
            BigInteger included = receipt.get().getBlockNumber();

            long confirmations = head.compareTo(included) < 0
                    ? 0
                    : head.subtract(included).add(BigInteger.ONE).longValueExact();
            long height = included.longValueExact();
            return receipt.get().isStatusOK()
                    ? TransactionStatus.included(height, confirmations)
                    : TransactionStatus.reverted(height, confirmations);
        } catch (IOException e) {
            throw new TransientNetworkException("RPC call to " + chainId + " failed: " + e.getMessage(), e);
        } catch (ClientConnectionException e) {
            throw classify(e);
        }
    }

    private RuntimeException classify(ClientConnectionException e) {
        Integer status = httpStatus(e.getMessage());
        if (status == null || status >= 500 || status == 408 || status == 429) {
            return new TransientNetworkException("RPC call to " + chainId + " failed: " + e.getMessage(), e);
        }
        return new ExternalServiceException(chainId, "RPC endpoint rejected the call: " + e.getMessage());
    }

    static Integer httpStatus(String message) {
        if (message == null) {
            return null;
        }
        Matcher matcher = HTTP_STATUS.matcher(message);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    private void checkError(Response<?> response, String method) {
        if (response.hasError()) {
            throw new ExternalServiceException(chainId,
                    method + " returned error " + response.getError().getCode() + ": " + response.getError().getMessage());
        }
    }
}
