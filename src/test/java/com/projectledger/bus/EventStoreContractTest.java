package com.projectledger.bus;

import com.projectledger.contract.EventPayload.ProjectStarted;
import com.projectledger.contract.EventPayload.TitleChanged;
import com.projectledger.contract.EventStatus;
import com.projectledger.contract.NotFoundException;
import com.projectledger.contract.ProjectEvent;
import com.projectledger.contract.ProjectEventTypes;
import com.projectledger.contract.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link EventStore} implementation must show.
 */
abstract class EventStoreContractTest {

    protected abstract EventStore store();

    protected ProjectEvent titleChanged(UUID projectId, String title, EventStatus status) {
        return new ProjectEvent(UUID.randomUUID(), projectId, 0, ProjectEventTypes.TITLE_CHANGED, "Title Change",
            UUID.randomUUID(), Instant.now().truncatedTo(ChronoUnit.MILLIS), status, new TitleChanged(title));
    }

    protected ProjectEvent started(UUID projectId) {
        return new ProjectEvent(UUID.randomUUID(), projectId, 0, ProjectEventTypes.PROJECT_STARTED,
            "Project Proposal", UUID.randomUUID(), Instant.now().truncatedTo(ChronoUnit.MILLIS), EventStatus.APPROVED,
            new ProjectStarted("Apollo", "apollo", "Moon", LocalDate.of(2024, 1, 1), null, List.of(), null));
    }

    @Test
    void emptyStream_loadsAtVersionZero() {
        EventStream stream = store().load(UUID.randomUUID());
        assertTrue(stream.isEmpty());
        assertEquals(0, stream.currentVersion());
    }

    @Test
    void append_assignsConsecutiveVersions() {
        UUID projectId = UUID.randomUUID();
        store().append(projectId, 0, List.of(started(projectId)));
        List<ProjectEvent> stored = store().append(projectId, 1, List.of(
            titleChanged(projectId, "A", EventStatus.APPROVED),
            titleChanged(projectId, "B", EventStatus.APPROVED)));

        assertEquals(List.of(2L, 3L), stored.stream().map(ProjectEvent::version).toList());

        EventStream stream = store().load(projectId);
        assertEquals(3, stream.currentVersion());
        assertEquals(List.of(1L, 2L, 3L), stream.events().stream().map(ProjectEvent::version).toList());
        assertEquals(new TitleChanged("B"), stream.events().get(2).payload());
    }

    @Test
    void payloadSurvivesStorage() {
        UUID projectId = UUID.randomUUID();
        ProjectEvent event = started(projectId);
        store().append(projectId, 0, List.of(event));

        ProjectEvent loaded = store().loadOne(event.id());
        assertEquals(event.withVersion(1), loaded);
    }

    @Test
    void emptyAppend_isNoOp() {
        UUID projectId = UUID.randomUUID();
        assertTrue(store().append(projectId, 5, List.of()).isEmpty());
        assertEquals(0, store().load(projectId).currentVersion());
    }

    @Test
    void staleExpectedVersion_isConcurrencyError() {
        UUID projectId = UUID.randomUUID();
        store().append(projectId, 0, List.of(started(projectId)));

        assertThrows(ConcurrencyException.class,
            () -> store().append(projectId, 0, List.of(titleChanged(projectId, "late", EventStatus.APPROVED))));
        assertEquals(1, store().load(projectId).events().size());
    }

    @Test
    void expectedVersionAhead_onEmptyStream_isConcurrencyError() {
        UUID projectId = UUID.randomUUID();
        assertThrows(ConcurrencyException.class,
            () -> store().append(projectId, 3, List.of(titleChanged(projectId, "x", EventStatus.APPROVED))));
    }

    @Test
    void concurrentAppendsAtSameVersion_exactlyOneWins() throws Exception {
        UUID projectId = UUID.randomUUID();
        store().append(projectId, 0, List.of(started(projectId)));

        int writers = 4;
        CountDownLatch ready = new CountDownLatch(writers);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String title = "writer-" + i;
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    try {
                        store().append(projectId, 1, List.of(titleChanged(projectId, title, EventStatus.APPROVED)));
                    } catch (ConcurrencyException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            go.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(writers - 1, conflicts.get());
        assertEquals(2, store().load(projectId).currentVersion());
    }

    @Test
    void pendingEvent_canBeApprovedOnce() {
        UUID projectId = UUID.randomUUID();
        store().append(projectId, 0, List.of(started(projectId)));
        ProjectEvent pending = store().append(projectId, 1,
            List.of(titleChanged(projectId, "Artemis", EventStatus.PENDING))).get(0);

        ProjectEvent approved = store().updateStatus(pending.id(), EventStatus.APPROVED);

        assertEquals(EventStatus.APPROVED, approved.status());
        assertEquals(EventStatus.APPROVED, store().loadOne(pending.id()).status());
        assertThrows(ValidationException.class, () -> store().updateStatus(pending.id(), EventStatus.REJECTED));
        assertEquals(EventStatus.APPROVED, store().loadOne(pending.id()).status());
    }

    @Test
    void statusCannotMoveBackToPending() {
        UUID projectId = UUID.randomUUID();
        ProjectEvent pending = store().append(projectId, 0, List.of(started(projectId).withStatus(EventStatus.PENDING)))
            .get(0);
        assertThrows(ValidationException.class, () -> store().updateStatus(pending.id(), EventStatus.PENDING));
    }

    @Test
    void unknownEvent_isNotFound() {
        assertThrows(NotFoundException.class, () -> store().loadOne(UUID.randomUUID()));
        assertThrows(NotFoundException.class, () -> store().updateStatus(UUID.randomUUID(), EventStatus.APPROVED));
    }
}
