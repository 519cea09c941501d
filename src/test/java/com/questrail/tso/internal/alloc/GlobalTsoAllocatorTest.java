package com.questrail.tso.internal.alloc;

import com.questrail.tso.api.ClockAnomalyException;
import com.questrail.tso.api.NotLeaderException;
import com.questrail.tso.api.StreamKey;
import com.questrail.tso.api.Timestamp;
import com.questrail.tso.config.TsoConfig;
import com.questrail.tso.election.InMemoryLeaderElection;
import com.questrail.tso.election.LeaderLease;
import com.questrail.tso.election.LeadershipGuard;
import com.questrail.tso.observability.LeadershipTransitionEvent;
import com.questrail.tso.observability.RecordingObservabilitySink;
import com.questrail.tso.observability.TsoErrorEvent;
import com.questrail.tso.store.Checkpoint;
import com.questrail.tso.store.CheckpointStore;
import com.questrail.tso.store.FlakyCheckpointStore;
import com.questrail.tso.store.InMemoryCheckpointStore;
import com.questrail.tso.store.VersionConflictException;
import com.questrail.tso.time.ManualClock;
import com.questrail.tso.time.ManualSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GlobalTsoAllocatorTest
 * -----------------------------------------------------------------------------
 * Cursor algorithm of a single stream: seeding, allocation at the logical
 * ceiling, maintenance ticks, checkpoint races and store outages.
 */
class GlobalTsoAllocatorTest {

    private static final int MAX = (int) Timestamp.MAX_LOGICAL;

    private ManualClock clock;
    private ManualSleeper sleeper;
    private CheckpointStore store;
    private InMemoryLeaderElection election;
    private LeadershipGuard guard;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1000);
        sleeper = new ManualSleeper(clock);
        store = new InMemoryCheckpointStore();
        election = new InMemoryLeaderElection();
        sink = new RecordingObservabilitySink();
        guard = new LeadershipGuard(election, clock, sink);
        guard.start();
    }

    private GlobalTsoAllocator allocator(TsoConfig config) {
        return new GlobalTsoAllocator(config, store, guard, clock, clock, sleeper, sink);
    }

    private GlobalTsoAllocator leading(TsoConfig config) {
        LeaderLease lease = election.campaign("a");
        GlobalTsoAllocator allocator = allocator(config);
        allocator.initialize(lease);
        return allocator;
    }

    private Checkpoint saved() {
        return store.load(StreamKey.GLOBAL_ID).orElseThrow();
    }

    // -------------------------------------------------------------------------
    // Initialization
    // -------------------------------------------------------------------------

    @Test
    void firstLeaderSeedsFromWallClock() {
        GlobalTsoAllocator allocator = leading(TsoConfig.defaults());

        assertEquals(new Timestamp(1000, 0), allocator.allocate(1));
        assertEquals(new Timestamp(1000, 1), allocator.allocate(1));

        assertEquals(4000, saved().savedPhysical());
        assertEquals(1, saved().version());
        assertEquals(4000, allocator.persistedWatermark());
        assertTrue(sink.getTransitionKinds().contains(LeadershipTransitionEvent.Kind.ALLOCATOR_READY));
    }

    @Test
    void notServingBeforeInitialize() {
        GlobalTsoAllocator allocator = allocator(TsoConfig.defaults());

        assertFalse(allocator.isReady());
        assertEquals(TsoAllocator.NOT_SERVING, allocator.currentPhysical());
        assertThrows(NotLeaderException.class, () -> allocator.allocate(1));
    }

    @Test
    void restartWaitsForClockToReachWatermark() {
        store.save(StreamKey.GLOBAL_ID, 5000, CheckpointStore.NO_VERSION);
        clock.setWallMillis(4990);

        GlobalTsoAllocator allocator = leading(TsoConfig.defaults());
        Timestamp first = allocator.allocate(1);

        assertTrue(first.physical() >= 5000);
        assertEquals(List.of(Duration.ofMillis(10)), sleeper.sleeps());
        assertEquals(2, saved().version());
    }

    @Test
    void clockBehindWatermarkBeyondGapIsAnomaly() {
        store.save(StreamKey.GLOBAL_ID, 5000, CheckpointStore.NO_VERSION);
        clock.setWallMillis(4000);
        clock.stallWall();

        TsoConfig config = TsoConfig.builder()
                .withMaxResetTsGap(Duration.ofMillis(100))
                .build();
        LeaderLease lease = election.campaign("a");
        GlobalTsoAllocator allocator = allocator(config);

        assertThrows(ClockAnomalyException.class, () -> allocator.initialize(lease));
        assertFalse(allocator.isReady());
        assertThrows(NotLeaderException.class, () -> allocator.allocate(1));
        assertEquals(5000, saved().savedPhysical());
        assertEquals(1, saved().version());
    }

    @Test
    void catchUpWaitIsCutShortByLeadershipLoss() {
        store.save(StreamKey.GLOBAL_ID, 5000, CheckpointStore.NO_VERSION);
        clock.setWallMillis(2000);
        clock.stallWall();
        TsoConfig config = TsoConfig.builder()
                .withMaxResetTsGap(Duration.ofSeconds(10))
                .build();
        LeaderLease lease = election.campaign("a");
        GlobalTsoAllocator allocator = allocator(config);
        sleeper.afterSleep(d -> {
            if (sleeper.sleeps().size() == 2) {
                election.revoke();
            }
        });

        assertThrows(NotLeaderException.class, () -> allocator.initialize(lease));

        assertEquals(List.of(Duration.ofMillis(50), Duration.ofMillis(50)), sleeper.sleeps());
        assertFalse(allocator.isReady());
        assertEquals(1, saved().version());
    }

    @Test
    void initializeUnderStaleEpochFails() {
        LeaderLease stale = election.campaign("a");
        election.campaign("b");

        GlobalTsoAllocator allocator = allocator(TsoConfig.defaults());

        assertThrows(NotLeaderException.class, () -> allocator.initialize(stale));
        assertFalse(allocator.isReady());
        assertTrue(store.load(StreamKey.GLOBAL_ID).isEmpty());
    }

    // -------------------------------------------------------------------------
    // Handover
    // -------------------------------------------------------------------------

    @Test
    void newLeaderIssuesStrictlyGreaterTimestamps() {
        GlobalTsoAllocator a = leading(TsoConfig.defaults());
        Timestamp last = null;
        for (int i = 0; i < 100; i++) {
            last = a.allocate(10);
        }
        clock.advanceMillis(500);
        a.tick();
        last = a.allocate(1);
        assertEquals(new Timestamp(1500, 0), last);

        LeaderLease leaseB = election.campaign("b");
        GlobalTsoAllocator b = allocator(TsoConfig.defaults());
        b.initialize(leaseB);

        Timestamp first = b.allocate(1);
        assertTrue(first.isAfter(last), first + " must be after " + last);
        assertEquals(new Timestamp(4000, 0), first);
    }

    @Test
    void staleAllocatorLosesCheckpointRace() {
        GlobalTsoAllocator a = leading(TsoConfig.defaults());
        a.allocate(1);

        LeaderLease leaseB = election.campaign("b");
        GlobalTsoAllocator b = allocator(TsoConfig.defaults());
        b.initialize(leaseB);
        assertEquals(4000, clock.nowMillis());

        // a still believes it serves; its next persist hits b's version.
        assertThrows(VersionConflictException.class, a::tick);
        assertFalse(a.isReady());
        assertThrows(NotLeaderException.class, () -> a.allocate(1));

        assertEquals(7000, saved().savedPhysical());
        assertEquals(2, saved().version());
        assertTrue(b.isReady());
    }

    // -------------------------------------------------------------------------
    // Allocation
    // -------------------------------------------------------------------------

    @Test
    void rejectsOutOfRangeCount() {
        GlobalTsoAllocator allocator = leading(TsoConfig.defaults());

        assertThrows(IllegalArgumentException.class, () -> allocator.allocate(0));
        assertThrows(IllegalArgumentException.class, () -> allocator.allocate(10_001));
        assertEquals(new Timestamp(1000, 0), allocator.allocate(10_000));
    }

    @Test
    void fullLogicalSpaceCanBeReservedAtOnce() {
        GlobalTsoAllocator allocator = leading(TsoConfig.builder().withMaxAllocateCount(MAX).build());

        Timestamp first = allocator.allocate(MAX);

        assertEquals(new Timestamp(1000, 0), first);
        assertEquals(new Timestamp(1000, MAX - 1), first.next(MAX - 1));
    }

    @Test
    void ceilingAdoptsAdvancedWallClock() {
        GlobalTsoAllocator allocator = leading(TsoConfig.builder().withMaxAllocateCount(MAX).build());
        allocator.allocate(MAX);

        Timestamp next = allocator.allocate(1);

        assertEquals(new Timestamp(1001, 0), next);
        assertEquals(1, sleeper.sleeps().size());
    }

    @Test
    void ceilingWithStalledClockBumpsPhysicalAfterRetries() {
        clock.stallWall();
        GlobalTsoAllocator allocator = leading(TsoConfig.builder().withMaxAllocateCount(MAX).build());
        allocator.allocate(MAX);

        Timestamp next = allocator.allocate(1);

        assertEquals(new Timestamp(1001, 0), next);
        assertEquals(List.of(Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofMillis(4)), sleeper.sleeps());
        assertEquals(1000, clock.nowMillis());
    }

    @Test
    void ceilingAgainstWatermarkBecomesAnomalyAfterGap() {
        clock.stallWall();
        TsoConfig config = TsoConfig.builder()
                .withMaxAllocateCount(MAX)
                .withPersistAheadMargin(Duration.ofMillis(2))
                .withMaxResetTsGap(Duration.ofMillis(100))
                .build();
        GlobalTsoAllocator allocator = leading(config);
        assertEquals(1002, allocator.persistedWatermark());

        allocator.allocate(MAX);
        assertEquals(new Timestamp(1001, 0), allocator.allocate(MAX));

        // 1002 would reach the watermark; only a tick could move it.
        ClockAnomalyException e = assertThrows(ClockAnomalyException.class, () -> allocator.allocate(MAX));
        assertEquals(1, e.epoch());
        assertFalse(allocator.isReady());
        assertTrue(sink.hasEventOfType(TsoErrorEvent.class));
        assertTrue(sink.getTransitionKinds().contains(LeadershipTransitionEvent.Kind.ALLOCATOR_RESET));
    }

    @Test
    void concurrentAllocationsAreUniqueAndIncreasing() throws Exception {
        GlobalTsoAllocator allocator = leading(TsoConfig.defaults());

        int threads = 8;
        int perThread = 2000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<List<Timestamp>>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    List<Timestamp> issued = new ArrayList<>(perThread);
                    for (int i = 0; i < perThread; i++) {
                        issued.add(allocator.allocate(1));
                    }
                    return issued;
                }));
            }
            go.countDown();

            Set<Timestamp> all = new HashSet<>();
            for (Future<List<Timestamp>> future : futures) {
                List<Timestamp> issued = future.get(10, TimeUnit.SECONDS);
                for (int i = 1; i < issued.size(); i++) {
                    assertTrue(issued.get(i).isAfter(issued.get(i - 1)));
                }
                all.addAll(issued);
            }
            assertEquals(threads * perThread, all.size());
        } finally {
            pool.shutdownNow();
        }
    }

    // -------------------------------------------------------------------------
    // Maintenance
    // -------------------------------------------------------------------------

    @Test
    void tickAdoptsWallClockAndPersistsAhead() {
        GlobalTsoAllocator allocator = leading(TsoConfig.defaults());

        clock.setWallMillis(2000);
        allocator.tick();
        assertEquals(new Timestamp(2000, 0), allocator.allocate(1));
        assertEquals(4000, allocator.persistedWatermark());

        clock.setWallMillis(3999);
        allocator.tick();
        assertEquals(6999, allocator.persistedWatermark());
        assertEquals(6999, saved().savedPhysical());
        assertEquals(2, saved().version());
        assertEquals(new Timestamp(3999, 0), allocator.allocate(1));
    }

    @Test
    void tickAdvancesStalledClockWhenLogicalMostlyUsed() {
        GlobalTsoAllocator allocator = leading(TsoConfig.builder().withMaxAllocateCount(MAX).build());

        allocator.allocate(MAX / 2);
        allocator.tick();
        assertEquals(new Timestamp(1000, MAX / 2), allocator.allocate(1));

        allocator.tick();
        assertEquals(new Timestamp(1001, 0), allocator.allocate(1));
    }

    @Test
    void wallClockStepBackNeverMovesCursorBack() {
        GlobalTsoAllocator allocator = leading(TsoConfig.defaults());
        clock.setWallMillis(2000);
        allocator.tick();
        assertEquals(new Timestamp(2000, 0), allocator.allocate(1));

        clock.setWallMillis(1500);
        allocator.tick();
        assertEquals(new Timestamp(2000, 1), allocator.allocate(1));
    }

    @Test
    void advanceToRaisesFloorForwardOnly() {
        GlobalTsoAllocator allocator = leading(TsoConfig.defaults());

        allocator.advanceTo(2500);
        assertEquals(new Timestamp(2500, 0), allocator.allocate(1));

        allocator.advanceTo(2000);
        assertEquals(new Timestamp(2500, 1), allocator.allocate(1));

        allocator.advanceTo(3999);
        assertEquals(6999, allocator.persistedWatermark());
        assertEquals(new Timestamp(3999, 0), allocator.allocate(1));
    }

    @Test
    void storeOutageWithinBudgetIsTolerated() {
        FlakyCheckpointStore flaky = new FlakyCheckpointStore();
        store = flaky;
        clock.stallWall();
        GlobalTsoAllocator allocator = leading(TsoConfig.builder().withSaveInterval(Duration.ofSeconds(1)).build());
        assertEquals(2000, allocator.persistedWatermark());

        flaky.failSaves(true);
        clock.setWallMillis(1999);
        allocator.tick();

        assertTrue(allocator.isReady());
        assertEquals(new Timestamp(1999, 0), allocator.allocate(1));
        assertEquals(2000, allocator.persistedWatermark());
        assertEquals(1, sink.getErrors().size());

        flaky.failSaves(false);
        clock.setWallMillis(2500);
        allocator.tick();
        assertEquals(3500, allocator.persistedWatermark());
        assertEquals(new Timestamp(2500, 0), allocator.allocate(1));
    }

    @Test
    void storeOutageBeyondSaveIntervalIsAnomaly() {
        FlakyCheckpointStore flaky = new FlakyCheckpointStore();
        store = flaky;
        clock.stallWall();
        GlobalTsoAllocator allocator = leading(TsoConfig.builder().withSaveInterval(Duration.ofSeconds(1)).build());

        flaky.failSaves(true);
        clock.setWallMillis(1999);
        allocator.tick();
        assertTrue(allocator.isReady());

        clock.advanceMonotonicMillis(1000);
        assertThrows(ClockAnomalyException.class, allocator::tick);
        assertFalse(allocator.isReady());
    }

    @Test
    void successfulSaveRestartsFailureBudget() {
        FlakyCheckpointStore flaky = new FlakyCheckpointStore();
        store = flaky;
        clock.stallWall();
        GlobalTsoAllocator allocator = leading(TsoConfig.builder().withSaveInterval(Duration.ofSeconds(1)).build());

        flaky.failNextSaves(3);
        clock.setWallMillis(1999);
        allocator.tick();
        allocator.tick();
        assertEquals(2999, allocator.persistedWatermark());

        clock.advanceMonotonicMillis(5000);
        flaky.failNextSaves(3);
        clock.setWallMillis(2998);
        assertDoesNotThrow(allocator::tick);
        assertTrue(allocator.isReady());
    }

    @Test
    void lostTermStopsIssuingBeforeReset() {
        GlobalTsoAllocator allocator = leading(TsoConfig.defaults());
        allocator.allocate(1);

        // Nothing has reset the allocator yet; the guard alone knows.
        election.revoke();

        assertThrows(NotLeaderException.class, () -> allocator.allocate(1));
        assertFalse(allocator.isReady());
        assertEquals(TsoAllocator.NOT_SERVING, allocator.currentPhysical());
        assertTrue(sink.getTransitionKinds().contains(LeadershipTransitionEvent.Kind.ALLOCATOR_RESET));
    }

    @Test
    void resetStopsServing() {
        GlobalTsoAllocator allocator = leading(TsoConfig.defaults());
        allocator.allocate(1);

        allocator.reset();

        assertFalse(allocator.isReady());
        assertThrows(NotLeaderException.class, () -> allocator.allocate(1));
        assertEquals(TsoAllocator.NOT_SERVING, allocator.persistedWatermark());
        assertTrue(sink.getTransitionKinds().contains(LeadershipTransitionEvent.Kind.ALLOCATOR_RESET));
    }
}
