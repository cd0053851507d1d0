package com.omnigovernor.governor.registry;

import com.omnigovernor.governor.config.GovernorProperties;
import com.omnigovernor.governor.support.FakeNetworkGateway;
import com.omnigovernor.governor.support.GovernorFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NetworkRegistryTest {

    private static final Path TRUST = Path.of("unused.json");

    private static final NetworkGatewayFactory FAKE_FACTORY =
        (config, credentials) -> new FakeNetworkGateway(config.name());

    @Nested
    @DisplayName("Session establishment")
    class Establishment {

        @Test
        @DisplayName("every configured network gets a session in configuration order")
        void allNetworksEstablished() {
            NetworkRegistry registry = new NetworkRegistry(
                GovernorFixtures.properties(TRUST, GovernorFixtures.TEST_KEY,
                    GovernorFixtures.networks("ETHEREUM", "BASE", "ARBITRUM", "POLYGON")),
                FAKE_FACTORY);

            assertEquals(List.of("ETHEREUM", "BASE", "ARBITRUM", "POLYGON"), registry.networkNames());
            assertTrue(registry.find("BASE").isPresent());
            assertEquals(4, registry.armedCount());
        }

        @Test
        @DisplayName("one failing network is left out; the rest still initialize")
        void failingNetworkIsolated() {
            NetworkGatewayFactory flaky = (config, credentials) -> {
                if ("ARBITRUM".equals(config.name())) {
                    throw new IllegalStateException("connection refused");
                }
                return new FakeNetworkGateway(config.name());
            };

            NetworkRegistry registry = new NetworkRegistry(
                GovernorFixtures.properties(TRUST, GovernorFixtures.TEST_KEY,
                    GovernorFixtures.networks("ETHEREUM", "BASE", "ARBITRUM", "POLYGON")),
                flaky);

            assertTrue(registry.find("ARBITRUM").isEmpty());
            assertTrue(registry.find("ETHEREUM").isPresent());
            assertTrue(registry.find("POLYGON").isPresent());
            assertEquals(4, registry.networkNames().size(), "failed networks stay listed");
            assertEquals(3, registry.armedCount());
        }

        @Test
        @DisplayName("invalid network entry is isolated like a connection failure")
        void invalidEntryIsolated() {
            List<GovernorProperties.Network> networks = new ArrayList<>(GovernorFixtures.networks("BASE"));
            networks.add(new GovernorProperties.Network("BROKEN", 1, null, "0.001", "1.0"));

            NetworkRegistry registry = new NetworkRegistry(
                GovernorFixtures.properties(TRUST, GovernorFixtures.TEST_KEY, networks), FAKE_FACTORY);

            assertTrue(registry.find("BASE").isPresent());
            assertTrue(registry.find("BROKEN").isEmpty());
        }

        @Test
        @DisplayName("unknown name → empty")
        void unknownName() {
            NetworkRegistry registry = new NetworkRegistry(
                GovernorFixtures.properties(TRUST, GovernorFixtures.TEST_KEY, GovernorFixtures.networks("BASE")),
                FAKE_FACTORY);
            assertTrue(registry.find("SOLANA").isEmpty());
        }
    }

    @Nested
    @DisplayName("Signing identity")
    class SigningIdentity {

        @Test
        @DisplayName("valid key → armed sessions bound to the key's address")
        void armed() {
            NetworkRegistry registry = new NetworkRegistry(
                GovernorFixtures.properties(TRUST, GovernorFixtures.TEST_KEY, GovernorFixtures.networks("BASE")),
                FAKE_FACTORY);

            NetworkSession session = registry.find("BASE").orElseThrow();
            assertTrue(session.isArmed());
            assertEquals(Credentials.create(GovernorFixtures.TEST_KEY).getAddress(), session.signerAddress());
        }

        @Test
        @DisplayName("short key → sessions exist but stay read-only")
        void shortKeyReadOnly() {
            NetworkRegistry registry = new NetworkRegistry(
                GovernorFixtures.properties(TRUST, "0xdeadbeef", GovernorFixtures.networks("BASE")),
                FAKE_FACTORY);

            NetworkSession session = registry.find("BASE").orElseThrow();
            assertFalse(session.isArmed());
            assertEquals(0, registry.armedCount());
        }

        @Test
        @DisplayName("no key → read-only")
        void noKey() {
            NetworkRegistry registry = new NetworkRegistry(
                GovernorFixtures.properties(TRUST, null, GovernorFixtures.networks("BASE")),
                FAKE_FACTORY);
            assertFalse(registry.find("BASE").orElseThrow().isArmed());
        }

        @Test
        @DisplayName("0x prefix does not count toward key length")
        void prefixedKey() {
            assertNotNull(NetworkRegistry.resolveCredentials("0x" + GovernorFixtures.TEST_KEY));
            assertNull(NetworkRegistry.resolveCredentials("0x" + GovernorFixtures.TEST_KEY.substring(2)));
        }

        @Test
        @DisplayName("non-hex key of valid length → read-only, no exception")
        void nonHexKey() {
            assertNull(NetworkRegistry.resolveCredentials("z".repeat(64)));
        }
    }
}
