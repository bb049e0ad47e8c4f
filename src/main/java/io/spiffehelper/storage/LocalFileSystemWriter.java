package io.spiffehelper.storage;

import io.spiffehelper.config.FileModes;
import io.spiffehelper.config.HelperConfig;
import io.spiffehelper.model.Credential;
import io.spiffehelper.model.TrustBundle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;

/**
 * Writes PEM files into a single directory. Each file is staged next to its
 * destination and moved into place, so readers see either the old or the new
 * content.
 */
public final class LocalFileSystemWriter implements CredentialWriter {
    private final Path certDir;
    private final Path svidFile;
    private final Path keyFile;
    private final Path bundleFile;
    private final int certFileMode;
    private final int keyFileMode;

    public LocalFileSystemWriter(
            Path certDir,
            String svidFileName,
            String keyFileName,
            String bundleFileName,
            int certFileMode,
            int keyFileMode
    ) {
        this.certDir = certDir;
        this.svidFile = certDir.resolve(svidFileName);
        this.keyFile = certDir.resolve(keyFileName);
        this.bundleFile = bundleFileName == null ? null : certDir.resolve(bundleFileName);
        this.certFileMode = certFileMode;
        this.keyFileMode = keyFileMode;
    }

    public static LocalFileSystemWriter fromConfig(HelperConfig config) {
        return new LocalFileSystemWriter(
                config.certDir(),
                config.svidFileName(),
                config.svidKeyFileName(),
                config.svidBundleFileName(),
                config.certFileMode(),
                config.keyFileMode()
        );
    }

    @Override
    public void writeCredential(Credential credential) throws IOException {
        ensureDirectory();
        writeAtomically(svidFile, PemCodec.certificatesToPem(credential.chain()), certFileMode);
        writeAtomically(keyFile, PemCodec.privateKeyToPem(credential.privateKey()), keyFileMode);
    }

    @Override
    public void writeBundle(TrustBundle bundle) throws IOException {
        if (bundleFile == null || bundle == null) {
            return;
        }
        ensureDirectory();
        writeAtomically(bundleFile, PemCodec.certificatesToPem(bundle.authorities()), certFileMode);
    }

    public Path svidFile() {
        return svidFile;
    }

    public Path keyFile() {
        return keyFile;
    }

    public Path bundleFile() {
        return bundleFile;
    }

    private void ensureDirectory() throws IOException {
        Files.createDirectories(certDir);
    }

    private void writeAtomically(Path target, String content, int mode) throws IOException {
        Path tmp = Files.createTempFile(certDir, "." + target.getFileName() + "-", ".tmp");
        try {
            applyMode(tmp, mode);
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw new IOException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    private static void applyMode(Path path, int mode) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
        if (view != null) {
            view.setPermissions(FileModes.toPermissions(mode));
        }
    }
}
