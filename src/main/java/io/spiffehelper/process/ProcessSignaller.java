package io.spiffehelper.process;

@FunctionalInterface
public interface ProcessSignaller {
    void send(long pid, RenewSignal signal) throws SignalException;
}
