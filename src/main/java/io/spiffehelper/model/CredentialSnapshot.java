package io.spiffehelper.model;

import java.util.List;
import java.util.Optional;

/**
 * The current credential together with the bundle of its own trust domain and
 * any federated bundles delivered alongside it. Snapshots are replaced whole.
 */
public record CredentialSnapshot(
        Credential credential,
        TrustBundle bundle,
        List<TrustBundle> federatedBundles
) {
    public CredentialSnapshot {
        if (credential == null) {
            throw new IllegalArgumentException("snapshot credential is required");
        }
        federatedBundles = federatedBundles == null ? List.of() : List.copyOf(federatedBundles);
    }

    public static CredentialSnapshot of(Credential credential, TrustBundle bundle) {
        return new CredentialSnapshot(credential, bundle, List.of());
    }

    public Optional<TrustBundle> ownBundle() {
        return Optional.ofNullable(bundle);
    }
}
