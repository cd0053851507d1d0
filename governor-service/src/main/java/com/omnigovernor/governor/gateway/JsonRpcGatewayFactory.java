package com.omnigovernor.governor.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omnigovernor.common.model.NetworkConfig;
import com.omnigovernor.common.network.NetworkGateway;
import com.omnigovernor.governor.config.GovernorProperties;
import com.omnigovernor.governor.registry.NetworkGatewayFactory;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.web3j.crypto.Credentials;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds one {@link JsonRpcNetworkGateway} per network, each with its own WebClient bound to
 * the network's RPC endpoint.
 */
@Component
public class JsonRpcGatewayFactory implements NetworkGatewayFactory {

    private final WebClient.Builder builder;
    private final ObjectMapper objectMapper;
    private final Duration pollInterval;

    public JsonRpcGatewayFactory(WebClient.Builder builder, ObjectMapper objectMapper,
                                 GovernorProperties properties) {
        this.builder      = builder;
        this.objectMapper = objectMapper;
        this.pollInterval = properties.receiptPollInterval();
    }

    @Override
    public NetworkGateway create(NetworkConfig config, Credentials credentials) {
        // Fails fast on a malformed endpoint so the registry can isolate this network.
        URI endpoint = URI.create(config.rpcUrl());
        if (endpoint.getScheme() == null || endpoint.getHost() == null) {
            throw new IllegalArgumentException("invalid rpc url: " + config.rpcUrl());
        }

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(15))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
            );

        WebClient webClient = builder.clone()
            .baseUrl(config.rpcUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();

        return new JsonRpcNetworkGateway(config, webClient, objectMapper, credentials, pollInterval);
    }
}
