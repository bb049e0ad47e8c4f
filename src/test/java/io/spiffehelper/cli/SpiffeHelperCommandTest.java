package io.spiffehelper.cli;

import io.spiffehelper.source.CredentialSourceException;
import io.spiffehelper.source.CredentialSourceFactory;
import io.spiffehelper.storage.PemCodec;
import io.spiffehelper.testing.MockCredentialSource;
import io.spiffehelper.testing.TempDirs;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class SpiffeHelperCommandTest {

    @Test
    void missingConfigFileIsAConfigurationError() throws Exception {
        Path root = TempDirs.create("cli-test");
        try {
            ByteArrayOutputStream err = new ByteArrayOutputStream();
            int exit = command(address -> {
                throw new AssertionError("must not connect");
            }, err).execute("-c", root.resolve("absent.json").toString());

            assertEquals(SpiffeHelperCommand.EXIT_CONFIG, exit);
            assertTrue(err.toString(StandardCharsets.UTF_8).contains("Failed to read config file"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void invalidConfigIsRejectedBeforeConnecting() throws Exception {
        Path root = TempDirs.create("cli-test");
        try {
            Path config = root.resolve("helper.json");
            Files.writeString(config, "{\"cert_dir\": \"" + root + "\"}");
            ByteArrayOutputStream err = new ByteArrayOutputStream();

            int exit = command(address -> {
                throw new AssertionError("must not connect");
            }, err).execute("--config", config.toString());

            assertEquals(SpiffeHelperCommand.EXIT_CONFIG, exit);
            assertTrue(err.toString(StandardCharsets.UTF_8).contains("agent_address"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void oneShotModeWritesCredentialsAndExits() throws Exception {
        Path root = TempDirs.create("cli-test");
        MockCredentialSource source = MockCredentialSource.withOneSecondTtl();
        try {
            Path certDir = root.resolve("certs");
            Path config = writeConfig(root, certDir, true);
            ByteArrayOutputStream err = new ByteArrayOutputStream();

            int exit = command(source.factory(), err).execute("-c", config.toString(), "--daemon-mode", "false");

            assertEquals(SpiffeHelperCommand.EXIT_OK, exit, err.toString(StandardCharsets.UTF_8));
            assertEquals(source.current().credential().chain(),
                    PemCodec.certificatesFromPem(Files.readString(certDir.resolve("svid.pem"))));
            assertTrue(Files.exists(certDir.resolve("svid_key.pem")));
            assertTrue(Files.exists(certDir.resolve("svid_bundle.pem")));
            assertTrue(source.isClosed());
            assertEquals("unix:/tmp/agent.sock", source.connectedAddresses().get(0));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void connectorFailureExitsWithFailure() throws Exception {
        Path root = TempDirs.create("cli-test");
        try {
            Path certDir = root.resolve("certs");
            Path config = writeConfig(root, certDir, false);
            ByteArrayOutputStream err = new ByteArrayOutputStream();

            int exit = command(address -> {
                throw new CredentialSourceException("invalid agent address");
            }, err).execute("-c", config.toString());

            assertEquals(SpiffeHelperCommand.EXIT_FAILURE, exit);
            assertTrue(err.toString(StandardCharsets.UTF_8).contains("invalid agent address"));
            assertFalse(Files.exists(certDir.resolve("svid.pem")));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void versionIsPrinted() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CommandLine commandLine = command(address -> {
            throw new AssertionError("must not connect");
        }, new ByteArrayOutputStream());
        commandLine.setOut(new PrintWriter(out, true, StandardCharsets.UTF_8));

        assertEquals(0, commandLine.execute("--version"));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("spiffe-helper "));
    }

    private static CommandLine command(CredentialSourceFactory factory, ByteArrayOutputStream err) {
        PrintStream stream = new PrintStream(err, true, StandardCharsets.UTF_8);
        return new CommandLine(new SpiffeHelperCommand(events -> factory, false, stream));
    }

    private static Path writeConfig(Path root, Path certDir, boolean daemonMode) throws Exception {
        Path config = root.resolve("helper.json");
        Files.writeString(config, "{\n"
                + "  \"agent_address\": \"unix:///tmp/agent.sock\",\n"
                + "  \"cert_dir\": \"" + certDir + "\",\n"
                + "  \"daemon_mode\": " + daemonMode + "\n"
                + "}\n");
        return config;
    }
}
