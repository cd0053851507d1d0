package com.omnigovernor.governor.config;

import com.omnigovernor.common.model.NetworkConfig;
import com.omnigovernor.common.unit.Units;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Externalized governor settings ({@code governor.*}).
 *
 * <p>Secrets and endpoints arrive from the environment ({@code PRIVATE_KEY},
 * {@code EXECUTOR_ADDRESS}, {@code ETH_RPC}, ...) through placeholders in {@code application.yml}.
 */
@ConfigurationProperties(prefix = "governor")
public record GovernorProperties(
    String privateKey,
    String executorAddress,
    Duration tickInterval,
    Duration confirmationTimeout,
    Duration receiptPollInterval,
    Trust trust,
    Signals signals,
    List<Network> networks
) {

    public GovernorProperties {
        privateKey      = blankToNull(privateKey);
        executorAddress = blankToNull(executorAddress);
        if (tickInterval == null) {
            tickInterval = Duration.ofSeconds(1);
        }
        if (confirmationTimeout == null) {
            confirmationTimeout = Duration.ofMinutes(3);
        }
        if (receiptPollInterval == null) {
            receiptPollInterval = Duration.ofSeconds(2);
        }
        if (trust == null) {
            trust = new Trust(null, null);
        }
        if (signals == null) {
            signals = new Signals(null, null, null);
        }
        networks = networks == null ? List.of() : List.copyOf(networks);
    }

    /** Both required secrets present: the loop may start. */
    public boolean credentialsConfigured() {
        return privateKey != null && executorAddress != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * @param file path of the trust score document
     * @param seed scores used when no readable document exists
     */
    public record Trust(String file, Map<String, Double> seed) {
        public Trust {
            if (file == null || file.isBlank()) {
                file = "trust_scores.json";
            }
            if (seed == null || seed.isEmpty()) {
                Map<String, Double> defaults = new LinkedHashMap<>();
                defaults.put("WEB_AI", 0.85);
                defaults.put("DISCOVERY", 0.70);
                seed = defaults;
            }
            seed = Map.copyOf(seed);
        }
    }

    /**
     * @param providers text endpoints consulted each tick
     * @param timeout   per-provider timeout
     * @param threshold minimum comparative sentiment for a signal
     */
    public record Signals(List<String> providers, Duration timeout, Double threshold) {
        public Signals {
            if (providers == null) {
                providers = List.of(
                    "https://api.crypto-ai-signals.com/v1/latest",
                    "https://top-trading-ai-blog.com/alerts");
            }
            providers = providers.stream().filter(Objects::nonNull).map(String::trim)
                .filter(p -> !p.isEmpty()).toList();
            if (timeout == null) {
                timeout = Duration.ofSeconds(5);
            }
            if (threshold == null) {
                threshold = 0.1;
            }
        }
    }

    /**
     * One network entry. {@code safetyMargin} is written in ether, {@code priorityFee} in gwei.
     */
    public record Network(String name, long chainId, String rpcUrl, String safetyMargin, String priorityFee) {

        public NetworkConfig toConfig() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("network name is required");
            }
            if (rpcUrl == null || rpcUrl.isBlank()) {
                throw new IllegalArgumentException("rpc-url is required for network " + name);
            }
            return new NetworkConfig(name, chainId, rpcUrl,
                Units.etherToWei(safetyMargin), Units.gweiToWei(priorityFee));
        }
    }
}
