package io.spiffehelper.process;

import io.spiffehelper.runtime.ShutdownSignal;
import io.spiffehelper.testing.RecordingEventSink;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ChildSupervisorTest {

    @Test
    void naturalExitClearsPidAndIsReported() throws Exception {
        ManagedChild child = ManagedChild.spawn("sh", List.of("-c", "exit 3"));
        ShutdownSignal shutdown = new ShutdownSignal();
        RecordingEventSink events = new RecordingEventSink();
        ChildSupervisor supervisor = new ChildSupervisor(child, shutdown, Duration.ofSeconds(2), events);

        Thread thread = new Thread(supervisor, "child-supervisor-test");
        thread.start();
        thread.join(10_000L);

        assertFalse(thread.isAlive());
        assertEquals(0L, child.currentPid());
        assertFalse(shutdown.isCancelled());
        assertEquals(3, events.withAction("child.exited").get(0).detail("exit_status"));
    }

    @Test
    void shutdownKillsChild() throws Exception {
        ManagedChild child = ManagedChild.spawn("sleep", List.of("60"));
        ShutdownSignal shutdown = new ShutdownSignal();
        RecordingEventSink events = new RecordingEventSink();
        ChildSupervisor supervisor = new ChildSupervisor(child, shutdown, Duration.ofSeconds(2), events);
        Thread thread = new Thread(supervisor, "child-supervisor-test");
        thread.start();
        try {
            assertTrue(child.currentPid() > 0);
            shutdown.cancel();
            thread.join(10_000L);

            assertFalse(thread.isAlive());
            assertFalse(child.process().isAlive());
            assertEquals(0L, child.currentPid());
            assertTrue(events.has("child.stopped"));
            assertFalse(events.has("child.exited"));
        } finally {
            child.process().destroyForcibly();
        }
    }

    @Test
    void escalatesWhenChildIgnoresTermination() throws Exception {
        ManagedChild child = ManagedChild.spawn("sh", List.of("-c", "trap '' TERM; while true; do sleep 1; done"));
        ShutdownSignal shutdown = new ShutdownSignal();
        RecordingEventSink events = new RecordingEventSink();
        ChildSupervisor supervisor = new ChildSupervisor(child, shutdown, Duration.ofMillis(500), events);
        try {
            // Give the shell time to install its trap.
            Thread.sleep(300L);
            supervisor.stop();

            assertFalse(child.process().isAlive());
            assertEquals(0L, child.currentPid());
            assertTrue(events.has("child.kill_escalated"));
        } finally {
            child.process().descendants().forEach(ProcessHandle::destroyForcibly);
            child.process().destroyForcibly();
        }
    }
}
