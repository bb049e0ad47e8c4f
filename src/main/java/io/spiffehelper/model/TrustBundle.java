package io.spiffehelper.model;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

public record TrustBundle(
        String trustDomain,
        List<X509Certificate> authorities
) {
    public TrustBundle {
        if (trustDomain == null || trustDomain.isBlank()) {
            throw new IllegalArgumentException("trust bundle domain cannot be empty");
        }
        authorities = authorities == null ? List.of() : List.copyOf(authorities);
    }

    /**
     * Returns a bundle for the same trust domain holding this bundle's authorities
     * followed by {@code extra}, without duplicates.
     */
    public TrustBundle withAdditional(List<X509Certificate> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        LinkedHashSet<X509Certificate> merged = new LinkedHashSet<>(authorities);
        merged.addAll(extra);
        return new TrustBundle(trustDomain, new ArrayList<>(merged));
    }

    public boolean isEmpty() {
        return authorities.isEmpty();
    }
}
