package io.spiffehelper.cli;

import io.spiffehelper.config.ConfigException;
import io.spiffehelper.config.HelperConfig;
import io.spiffehelper.observability.EventSink;
import io.spiffehelper.observability.JsonLinesEventSink;
import io.spiffehelper.observability.Slf4jEventSink;
import io.spiffehelper.process.KillCommandSignaller;
import io.spiffehelper.runtime.Daemon;
import io.spiffehelper.runtime.DaemonException;
import io.spiffehelper.runtime.DaemonTimings;
import io.spiffehelper.runtime.OneShot;
import io.spiffehelper.runtime.OsSignals;
import io.spiffehelper.source.BackoffPolicy;
import io.spiffehelper.source.CredentialSourceFactory;
import io.spiffehelper.source.Sleeper;
import io.spiffehelper.source.WorkloadApiCredentialSource;
import io.spiffehelper.storage.LocalFileSystemWriter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
        name = "spiffe-helper",
        description = "Keeps X.509 SVIDs from the SPIFFE Workload API on disk and signals workloads on rotation",
        versionProvider = SpiffeHelperCommand.ManifestVersionProvider.class
)
public final class SpiffeHelperCommand implements Callable<Integer> {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIG = 2;

    private static final Duration SHUTDOWN_HOOK_GRACE = Duration.ofSeconds(15);

    @Option(names = {"-c", "--config"}, defaultValue = HelperConfig.DEFAULT_CONFIG_FILE,
            description = "Configuration file path (default: ${DEFAULT-VALUE})")
    String configFile;

    @Option(names = "--daemon-mode", arity = "1", paramLabel = "BOOL",
            description = "Keep running and renew credentials (overrides daemon_mode in the config file)")
    Boolean daemonMode;

    @Option(names = {"-v", "--version"}, versionHelp = true, description = "Print version information and exit")
    boolean versionRequested;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    boolean helpRequested;

    private final Function<EventSink, CredentialSourceFactory> sourceFactories;
    private final boolean installSignalHandlers;
    private final PrintStream err;

    public SpiffeHelperCommand() {
        this(WorkloadApiCredentialSource::factory, true, System.err);
    }

    SpiffeHelperCommand(
            Function<EventSink, CredentialSourceFactory> sourceFactories,
            boolean installSignalHandlers,
            PrintStream err
    ) {
        this.sourceFactories = sourceFactories;
        this.installSignalHandlers = installSignalHandlers;
        this.err = err;
    }

    public static CommandLine commandLine() {
        return new CommandLine(new SpiffeHelperCommand());
    }

    @Override
    public Integer call() {
        HelperConfig config;
        EventSink events;
        try {
            config = HelperConfig.load(Paths.get(configFile)).withDaemonMode(daemonMode);
            events = eventSink(config.eventLogFile());
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (RuntimeException e) {
            err.println("Failed to initialize: " + e.getMessage());
            return EXIT_CONFIG;
        }

        CredentialSourceFactory sources = sourceFactories.apply(events);
        LocalFileSystemWriter writer = LocalFileSystemWriter.fromConfig(config);
        try {
            if (!config.daemonMode()) {
                OneShot.run(config, sources, writer, BackoffPolicy.defaults(), Sleeper.SYSTEM, events);
                return EXIT_OK;
            }
            Daemon daemon = new Daemon(config, sources, writer, new KillCommandSignaller(),
                    DaemonTimings.defaults(), events);
            if (installSignalHandlers) {
                OsSignals.install(daemon, SHUTDOWN_HOOK_GRACE);
            }
            daemon.run();
            return EXIT_OK;
        } catch (DaemonException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static EventSink eventSink(Path eventLogFile) {
        List<EventSink> sinks = new ArrayList<>();
        sinks.add(new Slf4jEventSink());
        if (eventLogFile != null) {
            sinks.add(new JsonLinesEventSink(eventLogFile, "spiffe-helper"));
        }
        return sinks.size() == 1 ? sinks.get(0) : EventSink.fanOut(sinks);
    }

    static final class ManifestVersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = SpiffeHelperCommand.class.getPackage().getImplementationVersion();
            return new String[]{"spiffe-helper " + (version == null ? "dev" : version)};
        }
    }
}
