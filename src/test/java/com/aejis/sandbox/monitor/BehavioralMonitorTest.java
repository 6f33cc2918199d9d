package com.aejis.sandbox.monitor;

import com.aejis.core.model.JobState;
import com.aejis.sandbox.FakeProcess;
import com.aejis.sandbox.SandboxProcess;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BehavioralMonitorTest {

    private static final Duration POLL = Duration.ofMillis(20);
    private static final Duration GRACE = Duration.ofMillis(200);

    private final BehavioralMonitor monitor = new BehavioralMonitor(POLL, GRACE, Clock.systemUTC());

    @Test
    @DisplayName("clean exit with output completes")
    void completes() {
        var process = FakeProcess.finished("ctr", 0, "{\"success\":true}", "");

        SupervisionReport report = monitor.supervise(process, Duration.ofSeconds(5), JobCancellation.none());

        assertEquals(JobState.COMPLETED, report.state());
        assertEquals(SupervisionReport.Reason.NONE, report.reason());
        assertEquals(0, report.exitCode());
        assertFalse(report.killed());
        assertTrue(report.completed());
    }

    @Test
    @DisplayName("process running past its wall time is killed at the boundary")
    void killedAtWallTime() {
        var process = FakeProcess.hanging("ctr", "{\"success\":tr");
        Duration budget = Duration.ofMillis(150);

        SupervisionReport report = monitor.supervise(process, budget, JobCancellation.none());

        assertEquals(JobState.TIMED_OUT, report.state());
        assertEquals(SupervisionReport.Reason.WALL_TIME_EXCEEDED, report.reason());
        assertTrue(report.killed());
        assertTrue(process.wasKilled());
        assertFalse(process.isRunning());
        assertNull(report.exitCode());
        assertEquals("{\"success\":tr", report.stdout(), "partial output is kept");
        assertTrue(report.elapsed().compareTo(budget) >= 0);
        assertTrue(report.elapsed().compareTo(budget.plus(POLL).plus(GRACE)) <= 0,
                "elapsed " + report.elapsed() + " exceeds budget plus grace");
    }

    @Test
    @DisplayName("caller cancellation kills the process")
    void cancellation() {
        var process = FakeProcess.hanging("ctr", "");
        var cancellation = new JobCancellation();
        assertTrue(cancellation.cancel());
        assertFalse(cancellation.cancel());

        SupervisionReport report = monitor.supervise(process, Duration.ofSeconds(10), cancellation);

        assertEquals(JobState.TIMED_OUT, report.state());
        assertEquals(SupervisionReport.Reason.CANCELLED, report.reason());
        assertTrue(process.wasKilled());
    }

    @Test
    void nonZeroExitFails() {
        var process = FakeProcess.finished("ctr", 137, "", "OOM");

        SupervisionReport report = monitor.supervise(process, Duration.ofSeconds(5), JobCancellation.none());

        assertEquals(JobState.FAILED, report.state());
        assertEquals(SupervisionReport.Reason.NON_ZERO_EXIT, report.reason());
        assertEquals(137, report.exitCode());
        assertEquals("OOM", report.stderr());
    }

    @Test
    void emptyOutputFails() {
        var process = FakeProcess.finished("ctr", 0, "   ", "");

        SupervisionReport report = monitor.supervise(process, Duration.ofSeconds(5), JobCancellation.none());

        assertEquals(JobState.FAILED, report.state());
        assertEquals(SupervisionReport.Reason.NO_OUTPUT, report.reason());
    }

    @Test
    @DisplayName("process that exits after a few polls completes")
    void exitsAfterPolling() {
        var polls = new AtomicInteger();
        SandboxProcess process = mock(SandboxProcess.class);
        when(process.containerId()).thenReturn("ctr");
        when(process.isRunning()).thenAnswer(inv -> polls.incrementAndGet() < 3);
        when(process.exitCode()).thenReturn(0);
        when(process.stdout()).thenReturn("{}");
        when(process.stderr()).thenReturn("");

        SupervisionReport report = monitor.supervise(process, Duration.ofSeconds(5), JobCancellation.none());

        assertEquals(JobState.COMPLETED, report.state());
        assertEquals(3, polls.get());
        verify(process).awaitOutput(GRACE);
        verify(process, never()).kill();
    }

    @Test
    @DisplayName("losing track of the process is a monitor error, and the process is killed")
    void monitorError() {
        SandboxProcess process = mock(SandboxProcess.class);
        when(process.containerId()).thenReturn("ctr");
        when(process.isRunning()).thenThrow(new IllegalStateException("exec vanished"));

        SupervisionReport report = monitor.supervise(process, Duration.ofSeconds(5), JobCancellation.none());

        assertEquals(JobState.FAILED, report.state());
        assertEquals(SupervisionReport.Reason.MONITOR_ERROR, report.reason());
        assertTrue(report.killed());
        verify(process).kill();
        assertEquals("", report.stdout());
    }

    @Test
    @DisplayName("a daemon failure after the process exits is a monitor error")
    void exitCodeLostAfterExit() {
        var process = FakeProcess.finished("ctr", 0, "{\"success\":true}", "")
                .failExitCode(new RuntimeException("docker daemon connection reset"));

        SupervisionReport report = monitor.supervise(process, Duration.ofSeconds(5), JobCancellation.none());

        assertEquals(JobState.FAILED, report.state());
        assertEquals(SupervisionReport.Reason.MONITOR_ERROR, report.reason());
        assertNull(report.exitCode());
        assertFalse(report.killed());
    }

    @Test
    void unreadableOutputIsReportedEmpty() {
        SandboxProcess process = mock(SandboxProcess.class);
        when(process.containerId()).thenReturn("ctr");
        when(process.isRunning()).thenReturn(false);
        when(process.exitCode()).thenReturn(0);
        when(process.stdout()).thenThrow(new IllegalStateException("stream closed"));

        SupervisionReport report = monitor.supervise(process, Duration.ofSeconds(5), JobCancellation.none());

        assertEquals(SupervisionReport.Reason.MONITOR_ERROR, report.reason());
        assertEquals("", report.stdout());
    }

    @Test
    void killFailureIsReported() {
        SandboxProcess process = mock(SandboxProcess.class);
        when(process.containerId()).thenReturn("ctr");
        when(process.isRunning()).thenReturn(true);
        doThrow(new IllegalStateException("daemon gone")).when(process).kill();

        SupervisionReport report = monitor.supervise(process, Duration.ofMillis(50), JobCancellation.none());

        assertEquals(JobState.TIMED_OUT, report.state());
        assertFalse(report.killed());
    }

    @Test
    void rejectsNonPositivePollInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new BehavioralMonitor(Duration.ZERO, GRACE, Clock.systemUTC()));
    }
}
