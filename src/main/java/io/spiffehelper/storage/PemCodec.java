package io.spiffehelper.storage;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.util.io.pem.PemObject;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

/**
 * PEM encoding for certificate chains, bundles and PKCS#8 private keys.
 */
public final class PemCodec {
    private PemCodec() {
    }

    public static String certificatesToPem(List<X509Certificate> certificates) {
        try (StringWriter stringWriter = new StringWriter(); JcaPEMWriter pemWriter = new JcaPEMWriter(stringWriter)) {
            for (X509Certificate certificate : certificates) {
                pemWriter.writeObject(new PemObject("CERTIFICATE", certificate.getEncoded()));
            }
            pemWriter.flush();
            return stringWriter.toString();
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to encode certificate", e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String privateKeyToPem(PrivateKey privateKey) {
        try (StringWriter stringWriter = new StringWriter(); JcaPEMWriter pemWriter = new JcaPEMWriter(stringWriter)) {
            pemWriter.writeObject(new PemObject("PRIVATE KEY", privateKey.getEncoded()));
            pemWriter.flush();
            return stringWriter.toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<X509Certificate> certificatesFromPem(String pem) {
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            List<X509Certificate> list = new ArrayList<>();
            JcaX509CertificateConverter converter = new JcaX509CertificateConverter();
            Object pemObject;
            while ((pemObject = parser.readObject()) != null) {
                if (pemObject instanceof X509CertificateHolder holder) {
                    list.add(converter.getCertificate(holder));
                } else {
                    throw new IllegalArgumentException("Invalid type of PEM object: " + pemObject.getClass().getName());
                }
            }
            return list;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to decode certificate", e);
        }
    }

    public static PrivateKey privateKeyFromPem(String pem) {
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
            Object pemObject;
            while ((pemObject = parser.readObject()) != null) {
                if (pemObject instanceof PrivateKeyInfo keyInfo) {
                    return converter.getPrivateKey(keyInfo);
                }
                if (pemObject instanceof PEMKeyPair keyPair) {
                    return converter.getPrivateKey(keyPair.getPrivateKeyInfo());
                }
            }
            throw new IllegalArgumentException("Expected a private key in PEM input");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
