package com.locationsharing.engine.gateway;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Peer directory backed by the {@code location-sharing.peers} property.
 */
@Component
public class ConfiguredPeerDirectory implements PeerDirectory {

    private final Set<String> peers;

    public ConfiguredPeerDirectory(@Value("${location-sharing.peers:}") String[] peers) {
        this.peers = Arrays.stream(peers)
            .map(String::trim)
            .filter(id -> !id.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Set<String> peers() {
        return peers;
    }
}
