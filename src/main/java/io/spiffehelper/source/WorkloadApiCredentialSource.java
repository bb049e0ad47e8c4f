package io.spiffehelper.source;

import io.spiffe.bundle.x509bundle.X509Bundle;
import io.spiffe.bundle.x509bundle.X509BundleSet;
import io.spiffe.exception.SocketEndpointAddressException;
import io.spiffe.exception.X509ContextException;
import io.spiffe.spiffeid.TrustDomain;
import io.spiffe.svid.x509svid.X509Svid;
import io.spiffe.workloadapi.DefaultWorkloadApiClient;
import io.spiffe.workloadapi.Watcher;
import io.spiffe.workloadapi.WorkloadApiClient;
import io.spiffe.workloadapi.X509Context;
import io.spiffehelper.model.Credential;
import io.spiffehelper.model.CredentialSnapshot;
import io.spiffehelper.model.TrustBundle;
import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;

import java.io.Closeable;
import java.io.IOException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link CredentialSource} backed by the SPIFFE Workload API. The first X.509
 * context is fetched synchronously; later contexts arrive through the
 * client's watch stream.
 */
public final class WorkloadApiCredentialSource implements CredentialSource {
    private final WorkloadApiClient client;
    private final EventSink events;
    private final AtomicReference<CredentialSnapshot> current = new AtomicReference<>();
    private final UpdateChannel channel = new UpdateChannel();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private WorkloadApiCredentialSource(WorkloadApiClient client, EventSink events) {
        this.client = client;
        this.events = events;
    }

    public static CredentialSourceFactory factory(EventSink events) {
        return address -> open(address, events);
    }

    public static WorkloadApiCredentialSource open(String address, EventSink events) throws CredentialSourceException {
        WorkloadApiClient client;
        try {
            client = DefaultWorkloadApiClient.newClient(DefaultWorkloadApiClient.ClientOptions.builder()
                    .spiffeSocketPath(address)
                    .build());
        } catch (SocketEndpointAddressException e) {
            throw new CredentialSourceException("Invalid Workload API address: " + address, e);
        }
        WorkloadApiCredentialSource source = new WorkloadApiCredentialSource(client, events);
        try {
            source.current.set(toSnapshot(client.fetchX509Context()));
        } catch (X509ContextException | RuntimeException e) {
            source.close();
            throw new CredentialSourceException("Failed to fetch X.509 context from " + address + ": "
                    + describe(e), e);
        }
        client.watchX509Context(source.new ContextWatcher());
        return source;
    }

    @Override
    public CredentialSnapshot current() {
        return current.get();
    }

    @Override
    public UpdateChannel.Receiver updates() {
        return channel.subscribe();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.close(new IllegalStateException("credential source closed"));
        Closeable closeable = client;
        try {
            closeable.close();
        } catch (IOException | RuntimeException e) {
            events.emit(DaemonEvent.warn("source.close_failed", "Failed to close Workload API client: " + e.getMessage(),
                    Map.of()));
        }
    }

    static CredentialSnapshot toSnapshot(X509Context context) {
        X509Svid svid = context.getDefaultSvid();
        Credential credential = new Credential(svid.getSpiffeId().toString(), svid.getChain(), svid.getPrivateKey());
        TrustDomain ownDomain = svid.getSpiffeId().getTrustDomain();
        X509BundleSet bundleSet = context.getX509BundleSet();
        X509Bundle ownBundle = bundleSet.getBundles().get(ownDomain);
        TrustBundle own = ownBundle == null ? null : toTrustBundle(ownBundle);
        List<TrustBundle> federated = new ArrayList<>();
        for (Map.Entry<TrustDomain, X509Bundle> entry : bundleSet.getBundles().entrySet()) {
            if (!entry.getKey().equals(ownDomain)) {
                federated.add(toTrustBundle(entry.getValue()));
            }
        }
        federated.sort(Comparator.comparing(TrustBundle::trustDomain));
        return new CredentialSnapshot(credential, own, federated);
    }

    private static TrustBundle toTrustBundle(X509Bundle bundle) {
        List<X509Certificate> authorities = new ArrayList<>(bundle.getX509Authorities());
        authorities.sort(Comparator.comparing(c -> c.getSerialNumber().toString(16)));
        return new TrustBundle(bundle.getTrustDomain().getName(), authorities);
    }

    private static String describe(Throwable error) {
        StringBuilder sb = new StringBuilder(String.valueOf(error.getMessage()));
        Throwable cause = error.getCause();
        while (cause != null && cause != error) {
            sb.append(": ").append(cause.getMessage());
            error = cause;
            cause = cause.getCause();
        }
        return sb.toString();
    }

    private final class ContextWatcher implements Watcher<X509Context> {
        @Override
        public void onUpdate(X509Context update) {
            CredentialSnapshot next;
            try {
                next = toSnapshot(update);
            } catch (RuntimeException e) {
                events.emit(DaemonEvent.error("source.invalid_update", "Ignoring malformed X.509 context: " + e.getMessage(),
                        Map.of()));
                return;
            }
            CredentialSnapshot previous = current.getAndSet(next);
            if (previous != null && sameContent(previous, next)) {
                return;
            }
            channel.publish();
        }

        @Override
        public void onError(Throwable error) {
            events.emit(DaemonEvent.error("source.session_lost", "Workload API watch failed: " + error.getMessage(),
                    Map.of()));
            channel.close(error);
        }
    }

    static boolean sameContent(CredentialSnapshot a, CredentialSnapshot b) {
        return a.credential().spiffeId().equals(b.credential().spiffeId())
                && a.credential().chain().equals(b.credential().chain())
                && a.credential().privateKey().equals(b.credential().privateKey())
                && Objects.equals(a.bundle(), b.bundle())
                && a.federatedBundles().equals(b.federatedBundles());
    }
}
