package io.spiffehelper.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.spiffehelper.process.RenewSignal;
import io.spiffehelper.process.ShellWords;
import io.spiffehelper.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Resolved, validated helper configuration. Built from the JSON config file by
 * {@link #load(Path)}; every optional field has its default applied.
 */
public record HelperConfig(
        String agentAddress,
        Path certDir,
        boolean daemonMode,
        String cmd,
        List<String> cmdArgs,
        Path pidFile,
        RenewSignal renewSignal,
        String svidFileName,
        String svidKeyFileName,
        String svidBundleFileName,
        boolean addIntermediatesToBundle,
        boolean includeFederatedDomains,
        int certFileMode,
        int keyFileMode,
        Path eventLogFile,
        HealthChecksConfig healthChecks
) {
    public static final String DEFAULT_CONFIG_FILE = "helper.json";
    public static final String DEFAULT_SVID_FILE_NAME = "svid.pem";
    public static final String DEFAULT_SVID_KEY_FILE_NAME = "svid_key.pem";
    public static final String DEFAULT_SVID_BUNDLE_FILE_NAME = "svid_bundle.pem";
    public static final int DEFAULT_CERT_FILE_MODE = 0644;
    public static final int DEFAULT_KEY_FILE_MODE = 0600;

    public HelperConfig {
        if (agentAddress == null || agentAddress.isBlank()) {
            throw new ConfigException("agent_address must be configured, e.g. \"unix:///run/spire/sockets/agent.sock\"");
        }
        if (certDir == null) {
            throw new ConfigException("cert_dir must be configured, e.g. \"/path/to/certs\"");
        }
        cmdArgs = cmdArgs == null ? List.of() : List.copyOf(cmdArgs);
        if (cmd == null && !cmdArgs.isEmpty()) {
            throw new ConfigException("cmd_args is set but cmd is not");
        }
        svidFileName = requireFileName(svidFileName, DEFAULT_SVID_FILE_NAME, "svid_file_name");
        svidKeyFileName = requireFileName(svidKeyFileName, DEFAULT_SVID_KEY_FILE_NAME, "svid_key_file_name");
        healthChecks = healthChecks == null ? HealthChecksConfig.disabled() : healthChecks;
    }

    public static HelperConfig load(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file: " + path, e);
        }
        HelperConfigFile file;
        try {
            file = Jsons.mapper().readValue(content, HelperConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Failed to parse config file: " + path + ": " + e.getOriginalMessage(), e);
        }
        if (file == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        return fromFile(file);
    }

    static HelperConfig fromFile(HelperConfigFile file) {
        RenewSignal signal = null;
        if (file.renewSignal() != null && !file.renewSignal().isBlank()) {
            try {
                signal = RenewSignal.parse(file.renewSignal());
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Failed to parse renew_signal: " + e.getMessage(), e);
            }
        }
        List<String> args;
        try {
            args = ShellWords.split(file.cmdArgs());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        String cmd = file.cmd() == null || file.cmd().isBlank() ? null : file.cmd().trim();
        return new HelperConfig(
                trimToNull(file.agentAddress()),
                toPath(file.certDir()),
                file.daemonMode() == null || file.daemonMode(),
                cmd,
                args,
                toPath(file.pidFileName()),
                signal,
                file.svidFileName(),
                file.svidKeyFileName(),
                bundleFileName(file.svidBundleFileName()),
                Boolean.TRUE.equals(file.addIntermediatesToBundle()),
                Boolean.TRUE.equals(file.includeFederatedDomains()),
                mode(file.certFileMode(), DEFAULT_CERT_FILE_MODE, "cert_file_mode"),
                mode(file.keyFileMode(), DEFAULT_KEY_FILE_MODE, "key_file_mode"),
                toPath(file.eventLogFile()),
                healthChecks(file.healthChecks())
        );
    }

    public HelperConfig withDaemonMode(Boolean override) {
        if (override == null || override == daemonMode) {
            return this;
        }
        return new HelperConfig(agentAddress, certDir, override, cmd, cmdArgs, pidFile, renewSignal,
                svidFileName, svidKeyFileName, svidBundleFileName, addIntermediatesToBundle,
                includeFederatedDomains, certFileMode, keyFileMode, eventLogFile, healthChecks);
    }

    public Path svidPath() {
        return certDir.resolve(svidFileName);
    }

    public Path svidKeyPath() {
        return certDir.resolve(svidKeyFileName);
    }

    /**
     * @return the bundle destination, or null when bundle writing is disabled
     */
    public Path svidBundlePath() {
        return svidBundleFileName == null ? null : certDir.resolve(svidBundleFileName);
    }

    private static String requireFileName(String raw, String fallback, String field) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        if (value.contains("/") || value.equals("..") || value.equals(".")) {
            throw new ConfigException(field + " must be a plain file name: " + raw);
        }
        return value;
    }

    // Absent means the default name; an explicit empty string turns bundle writing off.
    private static String bundleFileName(String raw) {
        if (raw == null) {
            return DEFAULT_SVID_BUNDLE_FILE_NAME;
        }
        if (raw.isBlank()) {
            return null;
        }
        return requireFileName(raw, DEFAULT_SVID_BUNDLE_FILE_NAME, "svid_bundle_file_name");
    }

    private static int mode(String raw, int fallback, String field) {
        if (raw == null) {
            return fallback;
        }
        try {
            return FileModes.parse(raw);
        } catch (ConfigException e) {
            throw new ConfigException(field + ": " + e.getMessage(), e);
        }
    }

    private static HealthChecksConfig healthChecks(HealthChecksFile file) {
        if (file == null) {
            return HealthChecksConfig.disabled();
        }
        boolean enabled = Boolean.TRUE.equals(file.listenerEnabled());
        if (!enabled) {
            return HealthChecksConfig.disabled();
        }
        int port = file.bindPort() == null ? HealthChecksConfig.DEFAULT_BIND_PORT : file.bindPort();
        if (port < 0 || port > 65535) {
            throw new ConfigException("health_checks.bind_port must not be larger than 65535, got " + port);
        }
        return new HealthChecksConfig(true, port, file.livenessPath(), file.readinessPath());
    }

    private static String trimToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static Path toPath(String raw) {
        String value = trimToNull(raw);
        return value == null ? null : Paths.get(value);
    }

    record HelperConfigFile(
            @JsonProperty("agent_address") String agentAddress,
            @JsonProperty("cert_dir") String certDir,
            @JsonProperty("daemon_mode") Boolean daemonMode,
            @JsonProperty("cmd") String cmd,
            @JsonProperty("cmd_args") String cmdArgs,
            @JsonProperty("pid_file_name") String pidFileName,
            @JsonProperty("renew_signal") String renewSignal,
            @JsonProperty("svid_file_name") String svidFileName,
            @JsonProperty("svid_key_file_name") String svidKeyFileName,
            @JsonProperty("svid_bundle_file_name") String svidBundleFileName,
            @JsonProperty("add_intermediates_to_bundle") Boolean addIntermediatesToBundle,
            @JsonProperty("include_federated_domains") Boolean includeFederatedDomains,
            @JsonProperty("cert_file_mode") String certFileMode,
            @JsonProperty("key_file_mode") String keyFileMode,
            @JsonProperty("event_log_file") String eventLogFile,
            @JsonProperty("health_checks") HealthChecksFile healthChecks
    ) {
    }

    record HealthChecksFile(
            @JsonProperty("listener_enabled") Boolean listenerEnabled,
            @JsonProperty("bind_port") Integer bindPort,
            @JsonProperty("liveness_path") String livenessPath,
            @JsonProperty("readiness_path") String readinessPath
    ) {
    }
}
