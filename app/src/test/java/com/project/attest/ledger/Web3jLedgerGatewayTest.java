package com.project.attest.ledger;

import com.project.attest.core.ExternalServiceException;
import com.project.attest.core.TransientNetworkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.ClientConnectionException;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Web3jLedgerGatewayTest {

    private static final String TX = "0x5c504ed432cb51138bcf09aa5e8a410dd4a1e204ef84bfed1be16dfba1b22060";

    @Mock
    Web3j web3j;
    @Mock
    Request<?, EthGetTransactionReceipt> receiptRequest;
    @Mock
    Request<?, EthBlockNumber> blockNumberRequest;

    private Web3jLedgerGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new Web3jLedgerGateway("sepolia", web3j);
        lenient().doReturn(receiptRequest).when(web3j).ethGetTransactionReceipt(TX);
    }

    @Test
    @DisplayName("confirmations count the inclusion block and every block after it")
    void included() throws IOException {
        when(receiptRequest.send()).thenReturn(receipt("0x64", "0x1"));
        doReturn(blockNumberRequest).when(web3j).ethBlockNumber();
        when(blockNumberRequest.send()).thenReturn(head("0x6e"));

        TransactionStatus status = gateway.getTransactionStatus(TX);

        assertThat(status.found()).isTrue();
        assertThat(status.reverted()).isFalse();
        assertThat(status.blockHeight()).isEqualTo(100L);
        assertThat(status.confirmationCount()).isEqualTo(11L);
    }

    @Test
    @DisplayName("a failed receipt status is reported as reverted")
    void reverted() throws IOException {
        when(receiptRequest.send()).thenReturn(receipt("0x64", "0x0"));
        doReturn(blockNumberRequest).when(web3j).ethBlockNumber();
        when(blockNumberRequest.send()).thenReturn(head("0x64"));

        TransactionStatus status = gateway.getTransactionStatus(TX);

        assertThat(status.reverted()).isTrue();
        assertThat(status.confirmationCount()).isEqualTo(1L);
    }

    @Test
    @DisplayName("no receipt means not found, without asking for the head")
    void notFound() throws IOException {
        when(receiptRequest.send()).thenReturn(new EthGetTransactionReceipt());

        assertThat(gateway.getTransactionStatus(TX)).isEqualTo(TransactionStatus.notFound());
        verify(web3j, never()).ethBlockNumber();
    }

    @Test
    @DisplayName("I/O errors are transient")
    void ioError() throws IOException {
        when(receiptRequest.send()).thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> gateway.getTransactionStatus(TX))
                .isInstanceOf(TransientNetworkException.class)
                .hasMessageContaining("sepolia");
    }

    @Test
    @DisplayName("HTTP 503 and 429 from the endpoint are transient")
    void overloadedEndpoint() throws IOException {
        when(receiptRequest.send())
                .thenThrow(new ClientConnectionException("Invalid response received: 503; busy"))
                .thenThrow(new ClientConnectionException("Invalid response received: 429; Too Many Requests"));

        assertThatThrownBy(() -> gateway.getTransactionStatus(TX))
                .isInstanceOf(TransientNetworkException.class)
                .hasMessageContaining("503");
        assertThatThrownBy(() -> gateway.getTransactionStatus(TX))
                .isInstanceOf(TransientNetworkException.class)
                .hasMessageContaining("429");
    }

    @Test
    @DisplayName("HTTP 401 from the endpoint is a hard error")
    void unauthorizedEndpoint() throws IOException {
        when(receiptRequest.send())
                .thenThrow(new ClientConnectionException("Invalid response received: 401; Unauthorized"));

        assertThatThrownBy(() -> gateway.getTransactionStatus(TX))
                .isInstanceOfSatisfying(ExternalServiceException.class,
                        e -> assertThat(e.service()).isEqualTo("sepolia"))
                .hasMessageContaining("401");
    }

    @Test
    @DisplayName("the HTTP status is read from the client's message when present")
    void httpStatus() {
        assertThat(Web3jLedgerGateway.httpStatus("Invalid response received: 502; Bad Gateway")).isEqualTo(502);
        assertThat(Web3jLedgerGateway.httpStatus("socket closed")).isNull();
        assertThat(Web3jLedgerGateway.httpStatus(null)).isNull();
    }

    @Test
    @DisplayName("JSON-RPC errors are explicit refusals")
    void rpcError() throws IOException {
        EthGetTransactionReceipt error = new EthGetTransactionReceipt();
        error.setError(new Response.Error(-32602, "invalid argument 0: hex string has length 10"));
        when(receiptRequest.send()).thenReturn(error);

        assertThatThrownBy(() -> gateway.getTransactionStatus(TX))
                .isInstanceOfSatisfying(ExternalServiceException.class,
                        e -> assertThat(e.service()).isEqualTo("sepolia"))
                .hasMessageContaining("-32602");
    }

    private static EthGetTransactionReceipt receipt(String blockNumber, String status) {
        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setTransactionHash(TX);
        receipt.setBlockNumber(blockNumber);
        receipt.setStatus(status);
        EthGetTransactionReceipt response = new EthGetTransactionReceipt();
        response.setResult(receipt);
        return response;
    }

    private static EthBlockNumber head(String blockNumber) {
        EthBlockNumber response = new EthBlockNumber();
        response.setResult(blockNumber);
        return response;
    }
}
