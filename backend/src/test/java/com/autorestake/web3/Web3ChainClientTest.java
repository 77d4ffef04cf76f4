package com.autorestake.web3;

import com.autorestake.TestConfigs;
import com.autorestake.config.KeeperProperties;
import com.autorestake.config.RunConfig;
import com.autorestake.web3.dto.CallDescriptor;
import com.autorestake.web3.dto.ChainEvent;
import com.autorestake.web3.dto.ChainReceipt;
import com.autorestake.web3.exception.ConfirmationException;
import com.autorestake.web3.exception.SubmissionException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Web3ChainClientTest {

    private static final String TX = "0x" + "ab".repeat(32);
    private static final String TOPIC = "0x" + "cd".repeat(32);

    private MockWebServer server;
    private Web3ClientFactory factory;
    private Web3ChainClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        KeeperProperties p = TestConfigs.validProperties();
        p.getRpc().setUrls(List.of(server.url("/").toString()));
        p.getRpc().setReceiptPollInterval(Duration.ofMillis(10));
        p.getRpc().setReceiptPollAttempts(3);
        RunConfig config = RunConfig.from(p);

        factory = new Web3ClientFactory(config);
        client = new Web3ChainClient(factory, config);
    }

    @AfterEach
    void tearDown() throws Exception {
        factory.destroy();
        server.shutdown();
    }

    @Test
    void waitForFinalityPollsUntilReceiptAndSplitsLogData() {
        server.enqueue(rpc("null"));
        server.enqueue(rpc(receiptJson("0x1",
                "\"0x" + "0".repeat(63) + "1" + "0".repeat(63) + "2" + "0".repeat(63) + "3\"")));

        ChainReceipt receipt = client.waitForFinality(TX);

        assertThat(receipt.isAccepted()).isTrue();
        assertThat(receipt.txId()).isEqualTo(TX);
        assertThat(receipt.events()).hasSize(1);
        ChainEvent event = receipt.events().get(0);
        assertThat(event.keys()).containsExactly(TOPIC);
        assertThat(event.data()).hasSize(3);
        assertThat(event.data().get(2)).isEqualTo("0x" + "0".repeat(63) + "3");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void revertedReceiptIsRejected() {
        server.enqueue(rpc(receiptJson("0x0", "\"0x\"")));

        ChainReceipt receipt = client.waitForFinality(TX);

        assertThat(receipt.status()).isEqualTo(ChainReceipt.Status.REJECTED);
        assertThat(receipt.events().get(0).data()).isEmpty();
    }

    @Test
    void waitGivesUpAfterConfiguredPolls() {
        server.enqueue(rpc("null"));
        server.enqueue(rpc("null"));
        server.enqueue(rpc("null"));

        assertThatThrownBy(() -> client.waitForFinality(TX))
                .isInstanceOf(ConfirmationException.class)
                .hasMessageContaining("not final after 3 polls")
                .extracting(e -> ((ConfirmationException) e).getTxId())
                .isEqualTo(TX);
    }

    @Test
    void submitSignsAndBroadcastsRawTransaction() throws Exception {
        server.enqueue(rpc("\"0x5\""));          // eth_getTransactionCount
        server.enqueue(rpc("\"0x3b9aca00\""));   // eth_gasPrice
        server.enqueue(rpc("\"0x5208\""));       // eth_estimateGas
        server.enqueue(rpc("\"" + TX + "\""));   // eth_sendRawTransaction

        String txId = client.submit(CallDescriptor.of(TestConfigs.CONTRACT, "executeAutoRestake", List.of(), List.of()));

        assertThat(txId).isEqualTo(TX);
        assertThat(server.takeRequest().getBody().readUtf8()).contains("eth_getTransactionCount");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("eth_gasPrice");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("eth_estimateGas");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("eth_sendRawTransaction");
    }

    @Test
    void nodeRejectionBecomesSubmissionException() {
        server.enqueue(rpc("\"0x5\""));
        server.enqueue(rpc("\"0x3b9aca00\""));
        server.enqueue(rpc("\"0x5208\""));
        server.enqueue(rpcError("insufficient funds for gas * price + value"));

        assertThatThrownBy(() -> client.submit(
                CallDescriptor.of(TestConfigs.CONTRACT, "executeAutoRestake", List.of(), List.of())))
                .isInstanceOf(SubmissionException.class)
                .hasMessageContaining("insufficient funds");
    }

    @Test
    void failedGasEstimateFallsBackToConfiguredLimit() {
        server.enqueue(rpc("\"0x5\""));
        server.enqueue(rpc("\"0x3b9aca00\""));
        server.enqueue(rpcError("execution reverted"));
        server.enqueue(rpc("\"" + TX + "\""));

        String txId = client.submit(CallDescriptor.of(TestConfigs.CONTRACT, "executeAutoRestake", List.of(), List.of()));

        assertThat(txId).isEqualTo(TX);
    }

    @Test
    void callDecodesViewOutputs() {
        String word1 = "0".repeat(24) + "33".repeat(20);
        String word2 = "0".repeat(24) + "44".repeat(20);
        String word3 = "0".repeat(24) + "55".repeat(20);
        server.enqueue(rpc("\"0x" + word1 + word2 + word3 + "\""));

        List<Type> out = client.call(CallDescriptor.of(TestConfigs.CONTRACT, "getConfig", List.of(), List.of(
                new TypeReference<Address>() {},
                new TypeReference<Address>() {},
                new TypeReference<Address>() {})));

        assertThat(out).hasSize(3);
        assertThat(out.get(0).getValue()).isEqualTo("0x" + "33".repeat(20));
        assertThat(out.get(2).getValue()).isEqualTo("0x" + "55".repeat(20));
    }

    // ---------------------------- helpers ----------------------------

    private static MockResponse rpc(String resultJson) {
        return new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + resultJson + "}");
    }

    private static MockResponse rpcError(String message) {
        return new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"" + message + "\"}}");
    }

    private static String receiptJson(String status, String logDataJson) {
        return "{"
                + "\"transactionHash\":\"" + TX + "\","
                + "\"transactionIndex\":\"0x0\","
                + "\"blockHash\":\"0x" + "11".repeat(32) + "\","
                + "\"blockNumber\":\"0x10\","
                + "\"cumulativeGasUsed\":\"0x5208\","
                + "\"gasUsed\":\"0x5208\","
                + "\"status\":\"" + status + "\","
                + "\"from\":\"" + TestConfigs.ACCOUNT + "\","
                + "\"to\":\"" + TestConfigs.CONTRACT + "\","
                + "\"logs\":[{"
                + "\"removed\":false,"
                + "\"logIndex\":\"0x0\","
                + "\"transactionIndex\":\"0x0\","
                + "\"transactionHash\":\"" + TX + "\","
                + "\"blockHash\":\"0x" + "11".repeat(32) + "\","
                + "\"blockNumber\":\"0x10\","
                + "\"address\":\"" + TestConfigs.CONTRACT + "\","
                + "\"data\":" + logDataJson + ","
                + "\"topics\":[\"" + TOPIC + "\"]"
                + "}],"
                + "\"logsBloom\":\"0x00\""
                + "}";
    }
}
