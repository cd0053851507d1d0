package com.omnigovernor.governor.registry;

import com.omnigovernor.common.model.NetworkConfig;
import com.omnigovernor.common.network.NetworkGateway;
import com.omnigovernor.governor.config.GovernorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the static network configuration and one {@link NetworkSession} per network.
 *
 * <p>Sessions are established once, in the constructor. A network whose session cannot be
 * established is logged and left out; the remaining networks still initialize. After
 * construction the registry is read-only and safe to share across concurrent attempts.
 */
@Component
public class NetworkRegistry {

    private static final Logger log = LoggerFactory.getLogger(NetworkRegistry.class);

    /** 32-byte hex key, {@code 0x} prefix not counted. */
    static final int MIN_KEY_LENGTH = 64;

    private final List<String> networkNames;
    private final Map<String, NetworkSession> sessions;

    public NetworkRegistry(GovernorProperties properties, NetworkGatewayFactory gatewayFactory) {
        Credentials credentials = resolveCredentials(properties.privateKey());
        List<String> names = new ArrayList<>();
        Map<String, NetworkSession> established = new LinkedHashMap<>();

        for (GovernorProperties.Network network : properties.networks()) {
            String name = network.name() != null ? network.name() : "UNNAMED";
            names.add(name);
            try {
                NetworkConfig config = network.toConfig();
                NetworkGateway gateway = gatewayFactory.create(config, credentials);
                String signer = credentials != null ? credentials.getAddress() : null;
                established.put(name, new NetworkSession(config, gateway, signer));
                log.info("[{}] Session established. chainId={} armed={}", name, config.chainId(), signer != null);
            } catch (RuntimeException e) {
                log.error("[{}] Init Fail: {}", name, e.getMessage());
            }
        }

        this.networkNames = Collections.unmodifiableList(names);
        this.sessions     = Collections.unmodifiableMap(established);
        log.info("Network registry ready. configured={} available={} armed={}",
                 networkNames.size(), sessions.size(), armedCount());
    }

    /** Session for {@code name}; empty when the network is unknown or failed to initialize. */
    public Optional<NetworkSession> find(String name) {
        return Optional.ofNullable(sessions.get(name));
    }

    /** Every configured network name in configuration order, failed ones included. */
    public List<String> networkNames() {
        return networkNames;
    }

    public long armedCount() {
        return sessions.values().stream().filter(NetworkSession::isArmed).count();
    }

    /**
     * Signing material is bound only when it is long enough to be a private key.
     * A malformed key leaves every session read-only rather than failing startup.
     */
    static Credentials resolveCredentials(String privateKey) {
        if (privateKey == null) {
            return null;
        }
        String hex = privateKey.startsWith("0x") || privateKey.startsWith("0X")
            ? privateKey.substring(2) : privateKey;
        if (hex.length() < MIN_KEY_LENGTH) {
            log.warn("Signing key shorter than {} hex characters; networks stay read-only", MIN_KEY_LENGTH);
            return null;
        }
        try {
            return Credentials.create(hex);
        } catch (RuntimeException e) {
            log.warn("Signing key rejected; networks stay read-only. reason={}", e.getMessage());
            return null;
        }
    }
}
