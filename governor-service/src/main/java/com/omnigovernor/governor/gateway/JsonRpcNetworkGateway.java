package com.omnigovernor.governor.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omnigovernor.common.exception.GovernorException;
import com.omnigovernor.common.exception.InsufficientFundsException;
import com.omnigovernor.common.exception.RpcException;
import com.omnigovernor.common.model.ConfirmationStatus;
import com.omnigovernor.common.model.FeeData;
import com.omnigovernor.common.model.NetworkConfig;
import com.omnigovernor.common.model.SimulationResult;
import com.omnigovernor.common.model.StrikeAction;
import com.omnigovernor.common.model.SubmissionHandle;
import com.omnigovernor.common.network.NetworkGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link NetworkGateway} over Ethereum JSON-RPC.
 *
 * <ul>
 *   <li>balance → {@code eth_getBalance}</li>
 *   <li>fees → {@code eth_gasPrice}</li>
 *   <li>simulate → {@code eth_call} (an RPC error is a revert)</li>
 *   <li>submit → {@code eth_getTransactionCount(pending)} + locally signed EIP-1559
 *       {@code eth_sendRawTransaction}</li>
 *   <li>confirmation → {@code eth_getTransactionReceipt} polling, then
 *       {@code eth_blockNumber} polling for depth beyond one</li>
 * </ul>
 *
 * <p>All calls are non-blocking WebClient exchanges.
 */
public class JsonRpcNetworkGateway implements NetworkGateway {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcNetworkGateway.class);

    private final NetworkConfig config;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Credentials credentials;
    private final Duration pollInterval;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcNetworkGateway(NetworkConfig config, WebClient webClient, ObjectMapper objectMapper,
                                 Credentials credentials, Duration pollInterval) {
        this.config       = config;
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.credentials  = credentials;
        this.pollInterval = pollInterval;
    }

    @Override
    public Mono<BigInteger> getBalance(String address) {
        return call("eth_getBalance", address, "latest")
            .map(result -> Numeric.decodeQuantity(result.asText()));
    }

    @Override
    public Mono<FeeData> getFeeData() {
        return call("eth_gasPrice")
            .map(result -> result.isNull() || result.asText().isEmpty()
                ? new FeeData(null)
                : new FeeData(Numeric.decodeQuantity(result.asText())));
    }

    @Override
    public Mono<SimulationResult> simulate(StrikeAction action) {
        return call("eth_call", callObject(action), "latest")
            .map(result -> SimulationResult.passed())
            .onErrorResume(RpcException.class, e -> Mono.just(SimulationResult.reverted(e.getMessage())));
    }

    @Override
    public Mono<SubmissionHandle> submit(StrikeAction action) {
        if (credentials == null) {
            return Mono.error(new GovernorException(config.name(), "no signing identity bound"));
        }
        return call("eth_getTransactionCount", credentials.getAddress(), "pending")
            .map(result -> Numeric.decodeQuantity(result.asText()))
            .map(nonce -> sign(action, nonce))
            .flatMap(signed -> call("eth_sendRawTransaction", signed))
            .map(result -> new SubmissionHandle(config.name(), result.asText()));
    }

    @Override
    public Mono<ConfirmationStatus> awaitConfirmation(SubmissionHandle handle, int confirmations) {
        Mono<JsonNode> receipt = Mono.defer(() -> call("eth_getTransactionReceipt", handle.transactionHash()))
            .filter(node -> !node.isNull() && !node.isMissingNode())
            .repeatWhenEmpty(attempts -> attempts.delayElements(pollInterval));

        return receipt.flatMap(r -> {
            ConfirmationStatus status = "0x1".equals(r.path("status").asText())
                ? ConfirmationStatus.ACCEPTED : ConfirmationStatus.REVERTED;
            if (confirmations <= 1) {
                return Mono.just(status);
            }
            BigInteger included = Numeric.decodeQuantity(r.path("blockNumber").asText());
            BigInteger target   = included.add(BigInteger.valueOf(confirmations - 1L));
            return Mono.defer(() -> call("eth_blockNumber"))
                .map(head -> Numeric.decodeQuantity(head.asText()))
                .filter(head -> head.compareTo(target) >= 0)
                .repeatWhenEmpty(attempts -> attempts.delayElements(pollInterval))
                .thenReturn(status);
        });
    }

    // ── internals ────────────────────────────────────────────────────────────

    private String sign(StrikeAction action, BigInteger nonce) {
        RawTransaction transaction = RawTransaction.createTransaction(
            config.chainId(),
            nonce,
            action.gasLimit(),
            action.executor(),
            action.value(),
            StrikeCallEncoder.encode(action),
            action.maxPriorityFeePerGas(),
            action.maxFeePerGas());
        byte[] signed = TransactionEncoder.signMessage(transaction, credentials);
        return Numeric.toHexString(signed);
    }

    private Map<String, Object> callObject(StrikeAction action) {
        Map<String, Object> tx = new LinkedHashMap<>();
        if (credentials != null) {
            tx.put("from", credentials.getAddress());
        }
        tx.put("to", action.executor());
        tx.put("gas", Numeric.encodeQuantity(action.gasLimit()));
        tx.put("value", Numeric.encodeQuantity(action.value()));
        tx.put("data", StrikeCallEncoder.encode(action));
        return tx;
    }

    /**
     * Issues one JSON-RPC request and returns its {@code result} node.
     * A JSON-RPC {@code error} object becomes an {@link RpcException}, or an
     * {@link InsufficientFundsException} when the node reports missing funds.
     */
    Mono<JsonNode> call(String method, Object... params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", requestIds.incrementAndGet());
        request.put("method", method);
        request.put("params", Arrays.asList(params));

        return webClient.post()
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> unwrap(method, body))
            .doOnError(e -> log.debug("[{}] rpc call failed. method={} reason={}",
                                      config.name(), method, e.getMessage()));
    }

    private JsonNode unwrap(String method, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new GovernorException(config.name(), "unreadable rpc response for " + method, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.path("message").asText("unknown error");
            if (InsufficientFundsException.matches(message)) {
                throw new InsufficientFundsException(config.name(), message);
            }
            throw new RpcException(config.name(), error.path("code").asInt(), message);
        }
        return root.path("result");
    }
}
