package io.spiffehelper.testing;

import io.spiffehelper.process.ProcessSignaller;
import io.spiffehelper.process.RenewSignal;
import io.spiffehelper.process.SignalException;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingSignaller implements ProcessSignaller {
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final Set<Long> failingPids = ConcurrentHashMap.newKeySet();

    @Override
    public void send(long pid, RenewSignal signal) throws SignalException {
        if (failingPids.contains(pid)) {
            throw new SignalException("kill " + signal.signalName() + " " + pid + ": no such process");
        }
        sent.add(new Sent(pid, signal));
    }

    public void failFor(long pid) {
        failingPids.add(pid);
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }

    public record Sent(long pid, RenewSignal signal) {
    }
}
