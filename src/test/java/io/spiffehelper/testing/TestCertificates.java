package io.spiffehelper.testing;

import io.spiffehelper.model.Credential;
import io.spiffehelper.model.TrustBundle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import javax.security.auth.x500.X500Principal;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues throwaway EC certificates: a self-signed root per trust domain and
 * short-lived leaf SVIDs, optionally through an intermediate.
 */
public final class TestCertificates {
    private static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

    private final String trustDomain;
    private final KeyPair rootKey;
    private final X509Certificate root;
    private final AtomicLong serials = new AtomicLong(0x1000);

    public TestCertificates(String trustDomain) {
        this.trustDomain = trustDomain;
        this.rootKey = newKeyPair();
        this.root = sign(new X500Principal("CN=" + trustDomain + " root"), rootKey,
                new X500Principal("CN=" + trustDomain + " root"), rootKey, Duration.ofDays(1), true, null);
    }

    public String trustDomain() {
        return trustDomain;
    }

    public X509Certificate root() {
        return root;
    }

    public TrustBundle bundle() {
        return new TrustBundle(trustDomain, List.of(root));
    }

    public Credential issue(String path, Duration ttl) {
        String spiffeId = "spiffe://" + trustDomain + path;
        KeyPair leafKey = newKeyPair();
        X509Certificate leaf = sign(root.getSubjectX500Principal(), rootKey,
                new X500Principal("CN=workload"), leafKey, ttl, false, spiffeId);
        return new Credential(spiffeId, List.of(leaf), leafKey.getPrivate());
    }

    public Credential issueThroughIntermediate(String path, Duration ttl) {
        String spiffeId = "spiffe://" + trustDomain + path;
        KeyPair intermediateKey = newKeyPair();
        X500Principal intermediateName = new X500Principal("CN=" + trustDomain + " intermediate");
        X509Certificate intermediate = sign(root.getSubjectX500Principal(), rootKey, intermediateName,
                intermediateKey, Duration.ofDays(1), true, null);
        KeyPair leafKey = newKeyPair();
        X509Certificate leaf = sign(intermediateName, intermediateKey, new X500Principal("CN=workload"), leafKey,
                ttl, false, spiffeId);
        return new Credential(spiffeId, List.of(leaf, intermediate), leafKey.getPrivate());
    }

    private X509Certificate sign(
            X500Principal issuer,
            KeyPair issuerKey,
            X500Principal subject,
            KeyPair subjectKey,
            Duration ttl,
            boolean isCa,
            String spiffeId
    ) {
        Instant now = Instant.now();
        try {
            JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                    issuer,
                    BigInteger.valueOf(serials.incrementAndGet()),
                    Date.from(now.minusSeconds(60)),
                    Date.from(now.plus(ttl)),
                    subject,
                    subjectKey.getPublic());
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(isCa));
            if (spiffeId != null) {
                builder.addExtension(Extension.subjectAlternativeName, false,
                        new GeneralNames(new GeneralName(GeneralName.uniformResourceIdentifier, spiffeId)));
            }
            ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(issuerKey.getPrivate());
            return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
        } catch (OperatorException | GeneralSecurityException e) {
            throw new RuntimeException(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static KeyPair newKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec("secp256r1"));
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new RuntimeException(e);
        }
    }
}
