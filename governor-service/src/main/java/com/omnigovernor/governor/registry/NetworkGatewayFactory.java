package com.omnigovernor.governor.registry;

import com.omnigovernor.common.model.NetworkConfig;
import com.omnigovernor.common.network.NetworkGateway;
import org.web3j.crypto.Credentials;

/**
 * Establishes the connection for one network.
 *
 * @see com.omnigovernor.governor.gateway.JsonRpcGatewayFactory
 */
@FunctionalInterface
public interface NetworkGatewayFactory {

    /**
     * @param credentials signing identity to bind, or {@code null} for a read-only connection
     */
    NetworkGateway create(NetworkConfig config, Credentials credentials);
}
