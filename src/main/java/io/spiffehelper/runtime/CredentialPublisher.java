package io.spiffehelper.runtime;

import io.spiffehelper.model.Credential;
import io.spiffehelper.model.CredentialSnapshot;
import io.spiffehelper.model.TrustBundle;
import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;
import io.spiffehelper.security.CertificateInfo;
import io.spiffehelper.storage.CredentialWriter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a snapshot through a {@link CredentialWriter}: the credential first,
 * then the bundle composed from the snapshot's trust material.
 */
public final class CredentialPublisher {
    private final CredentialWriter writer;
    private final boolean addIntermediatesToBundle;
    private final boolean includeFederatedDomains;
    private final EventSink events;

    public CredentialPublisher(
            CredentialWriter writer,
            boolean addIntermediatesToBundle,
            boolean includeFederatedDomains,
            EventSink events
    ) {
        this.writer = writer;
        this.addIntermediatesToBundle = addIntermediatesToBundle;
        this.includeFederatedDomains = includeFederatedDomains;
        this.events = events;
    }

    public void publish(CredentialSnapshot snapshot) throws IOException {
        Credential credential = snapshot.credential();
        writer.writeCredential(credential);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("spiffe_id", credential.spiffeId());
        details.putAll(CertificateInfo.describe(credential.leaf()));
        events.emit(DaemonEvent.info("svid.written", "X.509 certificates updated", details));

        TrustBundle bundle = composeBundle(snapshot, addIntermediatesToBundle, includeFederatedDomains);
        if (bundle == null) {
            return;
        }
        writer.writeBundle(bundle);
        events.emit(DaemonEvent.debug("bundle.written", "Trust bundle updated",
                Map.of("trust_domain", bundle.trustDomain(), "authorities", bundle.authorities().size())));
    }

    /**
     * The bundle to write for {@code snapshot}, or null when there is no trust
     * material at all.
     */
    static TrustBundle composeBundle(CredentialSnapshot snapshot, boolean addIntermediates, boolean includeFederated) {
        Credential credential = snapshot.credential();
        TrustBundle bundle = snapshot.bundle();
        if (addIntermediates && !credential.intermediates().isEmpty()) {
            bundle = bundle == null
                    ? new TrustBundle(credential.trustDomain(), credential.intermediates())
                    : bundle.withAdditional(credential.intermediates());
        }
        if (includeFederated) {
            for (TrustBundle federated : snapshot.federatedBundles()) {
                bundle = bundle == null
                        ? new TrustBundle(credential.trustDomain(), federated.authorities())
                        : bundle.withAdditional(federated.authorities());
            }
        }
        return bundle;
    }
}
