package com.omnigovernor.governor.registry;

import com.omnigovernor.common.model.NetworkConfig;
import com.omnigovernor.common.network.NetworkGateway;

/**
 * Connection handle for one network plus, when signing material is configured, the address
 * of the signing identity bound to it. Created once at startup and shared read-only.
 *
 * @param signerAddress {@code null} for a read-only session
 */
public record NetworkSession(NetworkConfig config, NetworkGateway gateway, String signerAddress) {

    public String name() {
        return config.name();
    }

    /** Only armed sessions may plan or submit strikes. */
    public boolean isArmed() {
        return signerAddress != null;
    }
}
