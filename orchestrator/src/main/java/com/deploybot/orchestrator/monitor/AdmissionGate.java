package com.deploybot.orchestrator.monitor;

import com.deploybot.orchestrator.config.ProjectCatalog;
import com.deploybot.orchestrator.model.BackendKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per (project, backend) ceiling on builds that are submitted but not yet
 * terminal ({@code max-concurrent-builds}; zero or less means unbounded).
 *
 * Admission is a future, so no thread waits for a slot. Waiters are served
 * in arrival order. The ceiling is read from the catalog on every decision,
 * which makes a reloaded value effective at the next admit or release.
 */
@Component
public class AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    private final ProjectCatalog catalog;
    private final Map<LaneKey, Lane> lanes = new ConcurrentHashMap<>();

    public AdmissionGate(ProjectCatalog catalog) {
        this.catalog = catalog;
    }

    /** Completes with a permit as soon as the lane has room. */
    public CompletableFuture<Permit> admit(String project, BackendKind kind) {
        return lane(project, kind).admit();
    }

    /**
     * Take a slot without waiting, even above the ceiling. Used when
     * re-registering builds that were already running before a restart.
     */
    public Permit occupy(String project, BackendKind kind) {
        return lane(project, kind).occupy();
    }

    public int inFlight(String project, BackendKind kind) {
        return lane(project, kind).inFlight();
    }

    public int waiting(String project, BackendKind kind) {
        return lane(project, kind).waiting();
    }

    private Lane lane(String project, BackendKind kind) {
        return lanes.computeIfAbsent(new LaneKey(project, kind), Lane::new);
    }

    // ------------------------------------------------------------------
    // Permit
    // ------------------------------------------------------------------

    /** One admitted build. Releasing twice is a no-op. */
    public static final class Permit {

        private final Lane lane;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(Lane lane) {
            this.lane = lane;
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                lane.release();
            }
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public String toString() {
            return "Permit[" + lane.key + (released.get() ? ", released]" : "]");
        }
    }

    // ------------------------------------------------------------------
    // Lane
    // ------------------------------------------------------------------

    private record LaneKey(String project, BackendKind kind) {
        @Override
        public String toString() {
            return project + "/" + kind;
        }
    }

    private final class Lane {

        private final LaneKey key;
        private final Deque<CompletableFuture<Permit>> waiters = new ArrayDeque<>();
        private int active;

        Lane(LaneKey key) {
            this.key = key;
        }

        CompletableFuture<Permit> admit() {
            CompletableFuture<Permit> waiter = new CompletableFuture<>();
            synchronized (this) {
                waiters.addLast(waiter);
                if (waiters.size() > 1 || !hasRoom()) {
                    log.debug("Lane {} full ({} active, ceiling {}); {} waiting",
                            key, active, ceiling(), waiters.size());
                }
            }
            drain();
            return waiter;
        }

        synchronized Permit occupy() {
            active++;
            return new Permit(this);
        }

        void release() {
            synchronized (this) {
                active = Math.max(0, active - 1);
            }
            drain();
        }

        /** Hand free slots to waiters in arrival order; futures complete outside the lock. */
        private void drain() {
            List<CompletableFuture<Permit>> admitted = new ArrayList<>();
            synchronized (this) {
                while (!waiters.isEmpty() && hasRoom()) {
                    admitted.add(waiters.pollFirst());
                    active++;
                }
            }
            for (CompletableFuture<Permit> waiter : admitted) {
                Permit permit = new Permit(this);
                if (!waiter.complete(permit)) {
                    // Waiter was cancelled meanwhile; give the slot back.
                    permit.release();
                }
            }
        }

        private boolean hasRoom() {
            int ceiling = ceiling();
            return ceiling <= 0 || active < ceiling;
        }

        private int ceiling() {
            return catalog.backend(key.project(), key.kind()).maxConcurrentBuilds();
        }

        synchronized int inFlight() {
            return active;
        }

        synchronized int waiting() {
            return waiters.size();
        }
    }
}
