package io.spiffehelper.model;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.List;

/**
 * An X.509 SVID: the certificate chain (leaf first, then intermediates) and the
 * private key bound to the leaf.
 */
public record Credential(
        String spiffeId,
        List<X509Certificate> chain,
        PrivateKey privateKey
) {
    public Credential {
        if (spiffeId == null || spiffeId.isBlank()) {
            throw new IllegalArgumentException("credential spiffe id cannot be empty");
        }
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("credential chain cannot be empty: " + spiffeId);
        }
        if (privateKey == null) {
            throw new IllegalArgumentException("credential private key is required: " + spiffeId);
        }
        chain = List.copyOf(chain);
    }

    public X509Certificate leaf() {
        return chain.get(0);
    }

    public List<X509Certificate> intermediates() {
        return chain.subList(1, chain.size());
    }

    public Instant expiresAt() {
        return leaf().getNotAfter().toInstant();
    }

    public String trustDomain() {
        return trustDomainOf(spiffeId);
    }

    static String trustDomainOf(String spiffeId) {
        String rest = spiffeId.startsWith("spiffe://") ? spiffeId.substring("spiffe://".length()) : spiffeId;
        int slash = rest.indexOf('/');
        return slash < 0 ? rest : rest.substring(0, slash);
    }
}
