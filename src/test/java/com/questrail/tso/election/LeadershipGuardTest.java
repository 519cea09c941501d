package com.questrail.tso.election;

import com.questrail.tso.observability.LeadershipTransitionEvent;
import com.questrail.tso.observability.RecordingObservabilitySink;
import com.questrail.tso.time.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LeadershipGuardTest
 * -----------------------------------------------------------------------------
 * Epoch tracking, staleness filtering and notification order of the guard.
 */
class LeadershipGuardTest {

    private InMemoryLeaderElection election;
    private RecordingObservabilitySink sink;
    private LeadershipGuard guard;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        election = new InMemoryLeaderElection();
        sink = new RecordingObservabilitySink();
        guard = new LeadershipGuard(election, new ManualClock(1000), sink);
        calls = new ArrayList<>();
        guard.subscribe(new ElectionObserver() {
            @Override
            public void onLeadershipAcquired(LeaderLease lease) {
                calls.add("acquired:" + lease.epoch());
            }

            @Override
            public void onLeadershipLost(LeaderLease lease) {
                calls.add("lost:" + lease.epoch());
            }
        });
        guard.start();
    }

    @Test
    void tracksCurrentTerm() {
        assertFalse(guard.isLeader());
        assertEquals(LeadershipGuard.NO_EPOCH, guard.currentEpoch());

        LeaderLease lease = election.campaign("a");

        assertTrue(guard.isLeader());
        assertTrue(guard.isLeader(lease.epoch()));
        assertFalse(guard.isLeader(lease.epoch() + 1));
        assertEquals(lease, guard.currentLease());
        assertEquals(List.of("acquired:1"), calls);
    }

    @Test
    void handoverNotifiesLossBeforeAcquisition() {
        election.campaign("a");
        election.campaign("b");

        assertEquals(List.of("acquired:1", "lost:1", "acquired:2"), calls);
        assertEquals(2, guard.currentEpoch());
    }

    @Test
    void newerTermWithoutLossStillNotifiesLoss() {
        guard.onLeadershipAcquired(LeaderLease.unbounded("a", 1));
        guard.onLeadershipAcquired(LeaderLease.unbounded("a", 2));

        assertEquals(List.of("acquired:1", "lost:1", "acquired:2"), calls);
    }

    @Test
    void staleTermIsIgnored() {
        guard.onLeadershipAcquired(LeaderLease.unbounded("a", 5));
        guard.onLeadershipAcquired(LeaderLease.unbounded("b", 3));
        guard.onLeadershipAcquired(LeaderLease.unbounded("b", 5));

        assertEquals(5, guard.currentEpoch());
        assertEquals("a", guard.currentLease().leaderId());
        assertEquals(List.of("acquired:5"), calls);
    }

    @Test
    void lossOfNonCurrentLeaseIsIgnored() {
        election.campaign("a");

        guard.onLeadershipLost(LeaderLease.unbounded("x", 7));

        assertTrue(guard.isLeader());
        assertEquals(List.of("acquired:1"), calls);
    }

    @Test
    void resignInvalidatesLocallyThenReleases() {
        election.campaign("a");

        guard.resign("clock anomaly");

        assertFalse(guard.isLeader());
        assertEquals(List.of("acquired:1", "lost:1"), calls);
        assertTrue(election.current().isEmpty());
        assertEquals("clock anomaly", election.lastResignReason().orElseThrow());
    }

    @Test
    void lossDuringAcquisitionIsVisibleImmediately() {
        List<Boolean> observed = new ArrayList<>();
        guard.subscribe(new ElectionObserver() {
            @Override
            public void onLeadershipAcquired(LeaderLease lease) {
                election.revoke();
                observed.add(guard.isLeader(lease.epoch()));
            }

            @Override
            public void onLeadershipLost(LeaderLease lease) {
            }
        });

        election.campaign("a");

        assertEquals(List.of(false), observed);
        assertFalse(guard.isLeader());
    }

    @Test
    void publishesTransitions() {
        election.campaign("a");
        election.revoke();

        assertEquals(List.of(
                LeadershipTransitionEvent.Kind.LEADERSHIP_ACQUIRED,
                LeadershipTransitionEvent.Kind.LEADERSHIP_LOST),
            sink.getTransitionKinds());
    }
}
