package io.spiffehelper.process;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The supervised child process. {@link #currentPid()} returns 0 once the
 * process has been observed to exit or has been killed, so a recycled PID is
 * never signaled.
 */
public final class ManagedChild {
    private final Process process;
    private final String command;
    private final List<String> args;
    private final AtomicLong currentPid;

    private ManagedChild(Process process, String command, List<String> args) {
        this.process = process;
        this.command = command;
        this.args = List.copyOf(args);
        this.currentPid = new AtomicLong(process.pid());
    }

    public static ManagedChild spawn(String command, List<String> args) throws IOException {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("managed command cannot be empty");
        }
        List<String> argv = new ArrayList<>();
        argv.add(command);
        if (args != null) {
            argv.addAll(args);
        }
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.inheritIO();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IOException("Failed to spawn managed process: " + command, e);
        }
        return new ManagedChild(process, command, args == null ? List.of() : args);
    }

    public long currentPid() {
        return currentPid.get();
    }

    void clearPid() {
        currentPid.set(0L);
    }

    public Process process() {
        return process;
    }

    public String command() {
        return command;
    }

    public List<String> args() {
        return args;
    }

    public String commandLine() {
        List<String> words = new ArrayList<>();
        words.add(command);
        words.addAll(args);
        return ShellWords.join(words);
    }
}
