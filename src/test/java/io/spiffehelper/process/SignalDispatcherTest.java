package io.spiffehelper.process;

import io.spiffehelper.testing.RecordingEventSink;
import io.spiffehelper.testing.RecordingSignaller;
import io.spiffehelper.testing.TempDirs;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class SignalDispatcherTest {

    @Test
    void noSignalMeansNoDispatch() throws Exception {
        Path root = TempDirs.create("dispatch-test");
        try {
            Path pidFile = root.resolve("app.pid");
            Files.writeString(pidFile, "1234", StandardCharsets.UTF_8);
            RecordingSignaller signaller = new RecordingSignaller();
            SignalDispatcher dispatcher = new SignalDispatcher(null, null, pidFile, signaller, new RecordingEventSink());

            SignalDispatcher.DispatchOutcome outcome = dispatcher.dispatch();

            assertFalse(dispatcher.enabled());
            assertFalse(outcome.enabled());
            assertTrue(signaller.sent().isEmpty());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void signalsChildAndPidFileTarget() throws Exception {
        Path root = TempDirs.create("dispatch-test");
        ManagedChild child = ManagedChild.spawn("sleep", List.of("30"));
        try {
            Path pidFile = root.resolve("app.pid");
            Files.writeString(pidFile, " 4321 \n", StandardCharsets.UTF_8);
            RecordingSignaller signaller = new RecordingSignaller();
            RecordingEventSink events = new RecordingEventSink();
            SignalDispatcher dispatcher = new SignalDispatcher(RenewSignal.USR1, child, pidFile, signaller, events);

            SignalDispatcher.DispatchOutcome outcome = dispatcher.dispatch();

            assertTrue(outcome.childSignaled());
            assertTrue(outcome.pidFileSignaled());
            assertEquals(List.of(
                    new RecordingSignaller.Sent(child.currentPid(), RenewSignal.USR1),
                    new RecordingSignaller.Sent(4321L, RenewSignal.USR1)
            ), signaller.sent());
            assertEquals("SIGUSR1", events.withAction("signal.pid_file").get(0).detail("signal"));
        } finally {
            child.process().destroyForcibly();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void childFailureDoesNotPreventPidFileSignal() throws Exception {
        Path root = TempDirs.create("dispatch-test");
        ManagedChild child = ManagedChild.spawn("sleep", List.of("30"));
        try {
            Path pidFile = root.resolve("app.pid");
            Files.writeString(pidFile, "4321", StandardCharsets.UTF_8);
            RecordingSignaller signaller = new RecordingSignaller();
            signaller.failFor(child.currentPid());
            RecordingEventSink events = new RecordingEventSink();
            SignalDispatcher dispatcher = new SignalDispatcher(RenewSignal.HUP, child, pidFile, signaller, events);

            SignalDispatcher.DispatchOutcome outcome = dispatcher.dispatch();

            assertFalse(outcome.childSignaled());
            assertTrue(outcome.pidFileSignaled());
            assertEquals(1, outcome.errors().size());
            assertTrue(events.has("signal.child_failed"));
        } finally {
            child.process().destroyForcibly();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void unreadablePidFileDoesNotPreventChildSignal() throws Exception {
        Path root = TempDirs.create("dispatch-test");
        ManagedChild child = ManagedChild.spawn("sleep", List.of("30"));
        try {
            Path pidFile = root.resolve("app.pid");
            Files.writeString(pidFile, "garbage", StandardCharsets.UTF_8);
            RecordingSignaller signaller = new RecordingSignaller();
            RecordingEventSink events = new RecordingEventSink();
            SignalDispatcher dispatcher = new SignalDispatcher(RenewSignal.HUP, child, pidFile, signaller, events);

            SignalDispatcher.DispatchOutcome outcome = dispatcher.dispatch();

            assertTrue(outcome.childSignaled());
            assertFalse(outcome.pidFileSignaled());
            assertTrue(events.has("signal.pid_file_unreadable"));
            assertEquals(1, signaller.sent().size());
        } finally {
            child.process().destroyForcibly();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void exitedChildIsNotSignaled() throws Exception {
        ManagedChild child = ManagedChild.spawn("true", List.of());
        assertTrue(child.process().waitFor(5, TimeUnit.SECONDS));
        child.clearPid();
        RecordingSignaller signaller = new RecordingSignaller();
        RecordingEventSink events = new RecordingEventSink();
        SignalDispatcher dispatcher = new SignalDispatcher(RenewSignal.HUP, child, null, signaller, events);

        SignalDispatcher.DispatchOutcome outcome = dispatcher.dispatch();

        assertFalse(outcome.childSignaled());
        assertTrue(signaller.sent().isEmpty());
        assertTrue(events.has("signal.child_skipped"));
    }
}
