package com.meetrelay.server.ws;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RoomRegistryTest {

    private final RoomRegistry registry = new RoomRegistry();

    @Test
    void membersReflectLastOperationPerParticipant() {
        registry.register("demo", "P1", new FakeConnection());
        registry.register("demo", "P2", new FakeConnection());
        registry.register("demo", "P3", new FakeConnection());
        registry.unregister("demo", "P2");
        registry.register("demo", "P2", new FakeConnection());
        registry.unregister("demo", "P3");

        assertThat(registry.members("demo")).containsExactlyInAnyOrder("P1", "P2");
        assertThat(registry.lookup("demo", "P3")).isEmpty();
    }

    @Test
    void unregisterIsSafeToRepeat() {
        registry.register("demo", "P1", new FakeConnection());

        assertThat(registry.unregister("demo", "P1")).isTrue();
        assertThat(registry.unregister("demo", "P1")).isFalse();
        assertThat(registry.unregister("nowhere", "P1")).isFalse();
    }

    @Test
    void emptyRoomIsPruned() {
        registry.register("demo", "P1", new FakeConnection());
        registry.unregister("demo", "P1");

        assertThat(registry.roomIds()).isEmpty();
        assertThat(registry.members("demo")).isEmpty();
    }

    @Test
    void roomsAreIndependent() {
        FakeConnection a = new FakeConnection();
        FakeConnection b = new FakeConnection();
        registry.register("r1", "P1", a);
        registry.register("r2", "P1", b);

        assertThat(registry.lookup("r1", "P1")).containsSame(a);
        assertThat(registry.lookup("r2", "P1")).containsSame(b);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void duplicateJoinReportsSupersededConnection() {
        FakeConnection first = new FakeConnection();
        FakeConnection second = new FakeConnection();

        Membership m1 = registry.register("demo", "P1", first);
        Membership m2 = registry.register("demo", "P1", second);

        assertThat(m1.superseded()).isEmpty();
        assertThat(m2.superseded()).containsSame(first);
        assertThat(registry.lookup("demo", "P1")).containsSame(second);
    }

    @Test
    void supersededMembershipCannotEvictReplacement() {
        Membership old = registry.register("demo", "P1", new FakeConnection());
        FakeConnection replacement = new FakeConnection();
        registry.register("demo", "P1", replacement);

        assertThat(old.release()).isFalse();
        assertThat(registry.lookup("demo", "P1")).containsSame(replacement);
    }

    @Test
    void membershipReleasesExactlyOnce() {
        Membership m = registry.register("demo", "P1", new FakeConnection());

        assertThat(m.release()).isTrue();
        assertThat(m.release()).isFalse();
        assertThat(m.isReleased()).isTrue();
        assertThat(registry.members("demo")).isEmpty();
    }

    @Test
    void snapshotIsNotAffectedByLaterMutation() {
        registry.register("demo", "P1", new FakeConnection());
        var before = registry.snapshot("demo");

        registry.register("demo", "P2", new FakeConnection());

        assertThat(before).containsOnlyKeys("P1");
        assertThat(registry.snapshot("demo")).containsOnlyKeys("P1", "P2");
    }

    @Test
    void concurrentJoinsLoseNoUpdates() throws Exception {
        int n = 200;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < n; i++) {
                String participant = "P" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    registry.register("demo", participant, new FakeConnection());
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.members("demo")).hasSize(n);
    }

    @Test
    void concurrentJoinAndLeaveSettleToSurvivors() throws Exception {
        int n = 100;
        for (int i = 0; i < n; i++) {
            registry.register("demo", "old" + i, new FakeConnection());
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < n; i++) {
                String leaving = "old" + i;
                String joining = "new" + i;
                futures.add(pool.submit(() -> registry.unregister("demo", leaving)));
                futures.add(pool.submit(() -> registry.register("demo", joining, new FakeConnection())));
            }
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        Set<String> members = registry.members("demo");
        assertThat(members).hasSize(n).allMatch(p -> p.startsWith("new"));
    }

    @Test
    void closeAllEmptiesRegistryAndClosesConnections() {
        FakeConnection a = new FakeConnection();
        FakeConnection b = new FakeConnection();
        registry.register("r1", "P1", a);
        registry.register("r2", "P2", b);

        registry.closeAll(CloseStatus.GOING_AWAY);

        assertThat(registry.size()).isZero();
        assertThat(a.closedWith).isEqualTo(CloseStatus.GOING_AWAY);
        assertThat(b.closedWith).isEqualTo(CloseStatus.GOING_AWAY);
    }
}
