package com.payguard.agent.baseline;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.snapshot.DeviceSnapshot;
import com.payguard.agent.store.InMemoryStateStore;
import com.payguard.agent.store.StateRepository;
import com.payguard.agent.support.MutableClock;
import com.payguard.agent.support.Snapshots;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class BaselineStoreTest {

    private static final String DEVICE = "device-1";

    private InMemoryStateStore store;
    private MutableClock clock;
    private AuditLog auditLog;
    private BaselineStore baselineStore;

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore();
        clock = MutableClock.startingAt("2026-10-01T10:00:00Z");
        auditLog = new AuditLog("test-agent", entry -> { }, clock);
        baselineStore = new BaselineStore(new StateRepository(store), auditLog, clock);
    }

    @Test
    void active_isEmptyBeforeEnrollment() {
        assertThat(baselineStore.active(DEVICE)).isEmpty();
        assertThat(baselineStore.enrollment(DEVICE)).isEmpty();
    }

    @Test
    void enroll_setsEnrollmentAndActiveBaseline() {
        // When
        BaselineReference reference = baselineStore.enroll(DEVICE, Snapshots.clean(DEVICE));

        // Then
        assertThat(reference.origin()).isEqualTo(BaselineOrigin.ENROLLMENT);
        assertThat(baselineStore.active(DEVICE)).contains(reference);
        assertThat(baselineStore.enrollment(DEVICE)).contains(reference);
        assertThat(auditLog.getEntries(AuditLog.EventType.BASELINE_COMMITTED)).hasSize(1);
    }

    @Test
    void commit_replacesActiveButKeepsEnrollment() {
        baselineStore.enroll(DEVICE, Snapshots.clean(DEVICE));
        DeviceSnapshot confirmed = Snapshots.clean(DEVICE).toBuilder().appInventoryHash("apps-v2").build();

        baselineStore.commit(DEVICE, confirmed, BaselineOrigin.BACKEND_CONFIRMED);

        assertThat(baselineStore.active(DEVICE)).get()
                .satisfies(ref -> {
                    assertThat(ref.snapshot()).isEqualTo(confirmed);
                    assertThat(ref.origin()).isEqualTo(BaselineOrigin.BACKEND_CONFIRMED);
                });
        assertThat(baselineStore.enrollment(DEVICE).get().snapshot().appInventoryHash()).isEqualTo("apps-v1");
    }

    @Test
    void recover_restoresEnrollmentSnapshot() {
        baselineStore.enroll(DEVICE, Snapshots.clean(DEVICE));
        baselineStore.commit(DEVICE, Snapshots.rooted(DEVICE), BaselineOrigin.BACKEND_CONFIRMED);

        BaselineReference recovered = baselineStore.recover(DEVICE).orElseThrow();

        assertThat(recovered.origin()).isEqualTo(BaselineOrigin.RECOVERY);
        assertThat(recovered.snapshot()).isEqualTo(Snapshots.clean(DEVICE));
        assertThat(baselineStore.active(DEVICE)).contains(recovered);
    }

    @Test
    void recover_withoutEnrollment_isEmpty() {
        assertThat(baselineStore.recover(DEVICE)).isEmpty();
    }

    @Test
    void baselineSurvivesRestart() {
        baselineStore.enroll(DEVICE, Snapshots.clean(DEVICE));

        BaselineStore restarted = new BaselineStore(new StateRepository(store), auditLog, clock);

        assertThat(restarted.active(DEVICE).map(BaselineReference::snapshot)).contains(Snapshots.clean(DEVICE));
    }

    @Test
    void readersNeverObserveHalfWrittenBaseline() throws Exception {
        // Given
        DeviceSnapshot a = Snapshots.clean(DEVICE);
        DeviceSnapshot b = Snapshots.rooted(DEVICE);
        baselineStore.enroll(DEVICE, a);
        ExecutorService executor = Executors.newFixedThreadPool(4);

        try {
            // When
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(executor.submit(() -> {
                    for (int j = 0; j < 200; j++) {
                        baselineStore.withActive(DEVICE, ref -> {
                            DeviceSnapshot seen = ref.orElseThrow().snapshot();
                            assertThat(seen).isIn(a, b);
                            return seen;
                        });
                    }
                }));
            }
            for (int j = 0; j < 200; j++) {
                baselineStore.commit(DEVICE, j % 2 == 0 ? b : a, BaselineOrigin.BACKEND_CONFIRMED);
            }

            // Then
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
