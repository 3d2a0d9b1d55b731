package com.tyron.cosched.core.diagnostics;

import com.google.common.truth.Truth;
import com.tyron.cosched.api.concurrent.PriorityLevel;
import com.tyron.cosched.api.concurrent.ScheduleOptions;
import com.tyron.cosched.api.concurrent.Work;
import com.tyron.cosched.api.diagnostics.HostStall;
import com.tyron.cosched.api.diagnostics.SchedulerListener;
import com.tyron.cosched.core.concurrent.SchedulerImpl;
import com.tyron.cosched.core.config.SchedulerConfiguration;
import com.tyron.cosched.core.test.ManualClock;
import com.tyron.cosched.core.test.ManualHostBridge;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class HostWatchdogTest {

    private ManualClock clock;
    private ManualHostBridge host;
    private SchedulerImpl scheduler;
    private final List<HostStall> reported = new ArrayList<>();
    private HostWatchdog watchdog;

    @BeforeEach
    public void setUp() {
        clock = new ManualClock();
        host = new ManualHostBridge(clock, 5);
        scheduler = new SchedulerImpl(host);
        watchdog = new HostWatchdog(scheduler, 1_000, new SchedulerListener() {
            @Override
            public void onHostStall(HostStall stall) {
                reported.add(stall);
            }
        });
    }

    @AfterEach
    public void tearDown() {
        watchdog.dispose();
        scheduler.dispose();
    }

    @Test
    public void testNothingPendingNothingReported() {
        clock.advance(5_000);
        Truth.assertThat(watchdog.check()).isEmpty();
        Truth.assertThat(reported).isEmpty();
    }

    @Test
    public void testUndeliveredSoonCallbackIsReportedOnce() {
        clock.set(100);
        scheduler.scheduleCallback(PriorityLevel.NORMAL, Work.of(() -> { }));

        clock.advance(1_000);
        Truth.assertThat(watchdog.check()).isEmpty();

        clock.advance(1);
        List<HostStall> stalls = watchdog.check();
        Assertions.assertEquals(List.of(new HostStall(HostStall.Kind.SOON_CALLBACK, 100, 1_001)), stalls);
        Truth.assertThat(watchdog.check()).isEmpty();
        Assertions.assertEquals(stalls, reported);

        // once delivered, nothing is pending
        host.flushAll();
        Assertions.assertEquals(-1, scheduler.pendingHostCallbackSince());
    }

    @Test
    public void testRequestsWithEqualTimestampsAreReportedSeparately() {
        PinnedClock pinnedClock = new PinnedClock();
        ManualHostBridge pinnedHost = new ManualHostBridge(pinnedClock, 5);
        SchedulerImpl pinnedScheduler = new SchedulerImpl(pinnedHost);
        HostWatchdog pinnedWatchdog = new HostWatchdog(pinnedScheduler, 1_000, new SchedulerListener() {
            @Override
            public void onHostStall(HostStall stall) {
                reported.add(stall);
            }
        });

        // both requests read t=100 from the clock
        pinnedClock.pinned = 100;
        pinnedScheduler.scheduleCallback(PriorityLevel.NORMAL, Work.of(() -> { }));
        pinnedClock.pinned = -1;
        pinnedClock.set(2_000);
        Assertions.assertEquals(1, pinnedWatchdog.check().size());

        pinnedClock.pinned = 100;
        pinnedHost.flushAll();
        pinnedScheduler.scheduleCallback(PriorityLevel.NORMAL, Work.of(() -> { }));
        Assertions.assertEquals(2, pinnedScheduler.hostCallbackRequestCount());
        pinnedClock.pinned = -1;

        List<HostStall> second = pinnedWatchdog.check();
        Assertions.assertEquals(List.of(new HostStall(HostStall.Kind.SOON_CALLBACK, 100, 1_900)), second);
        Assertions.assertEquals(2, reported.size());
        Truth.assertThat(pinnedWatchdog.check()).isEmpty();

        pinnedScheduler.dispose();
    }

    @Test
    public void testOverdueTimerIsReported() {
        scheduler.scheduleCallback(PriorityLevel.NORMAL, Work.of(() -> { }), ScheduleOptions.withDelay(50));

        // the clock moves without the host firing its timer
        clock.advance(2_000);
        List<HostStall> stalls = watchdog.check();
        Assertions.assertEquals(1, stalls.size());
        Assertions.assertEquals(HostStall.Kind.DELAYED_CALLBACK, stalls.get(0).kind());
        Assertions.assertEquals(50, stalls.get(0).expectedAtMillis());
        Assertions.assertEquals(1_950, stalls.get(0).overdueMillis());
    }

    @Test
    public void testStartedFromConfiguration() {
        SchedulerImpl watched = new SchedulerImpl(new ManualHostBridge(),
                SchedulerConfiguration.builder().watchdogEnabled(true).watchdogIntervalMillis(10).build());
        watched.dispose();

        HostWatchdog manual = new HostWatchdog(scheduler, 1_000, new SchedulerListener() { });
        manual.start(10);
        Assertions.assertTrue(manual.isRunning());
        Assertions.assertThrows(IllegalStateException.class, () -> manual.start(10));
        manual.dispose();
        Assertions.assertFalse(manual.isRunning());
    }

    /**
     * Reports a fixed time while {@code pinned} is set.
     */
    private static final class PinnedClock extends ManualClock {
        long pinned = -1;

        @Override
        public long nowMillis() {
            return pinned >= 0 ? pinned : super.nowMillis();
        }
    }
}
