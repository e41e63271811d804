package com.commandhub;

import com.commandhub.models.Operation;
import com.commandhub.models.OperationQuery;
import com.commandhub.models.OperationStatus;
import com.commandhub.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Journal of Operations.
 *
 * Rows live in an id-ordered arena; every create or transition appends the
 * full row to {@code operations.jsonl}, so the last line for an id is its
 * current state. All access is serialized on the store monitor, which makes
 * it the single writer for the log and the only locking boundary for
 * Operation state.
 */
public class OperationStore {

    static final String INTERRUPTED_ERROR = "interrupted by restart; remote effect unknown";

    /**
     * Mutation applied to a detached copy of a row before it is persisted.
     */
    @FunctionalInterface
    public interface Patch {
        void apply(Operation op, long now);
    }

    private final Map<Long, Operation> rows = new LinkedHashMap<>();
    private final Path logFile;
    private final Clock clock;
    private final AppLogger.Channel log = AppLogger.channel("OperationStore");
    private long nextId = 1;
    private long lastCreatedAt = 0L;

    private OperationStore(Path logFile, Clock clock) {
        this.logFile = logFile;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Non-durable store. Pending approvals are lost when the process exits.
     */
    public static OperationStore inMemory(Clock clock) {
        return new OperationStore(null, clock);
    }

    /**
     * Opens (or creates) a file-backed store, replaying and compacting the log.
     */
    public static OperationStore open(Path logFile, Clock clock) throws IOException {
        OperationStore store = new OperationStore(logFile, clock);
        store.load();
        return store;
    }

    public boolean isDurable() {
        return logFile != null;
    }

    public long now() {
        return clock.millis();
    }

    public synchronized Operation create(Operation draft) {
        Operation row = assign(draft);
        persist(row);
        rows.put(row.getId(), row);
        nextId++;
        lastCreatedAt = row.getCreatedAt();
        return row.copy();
    }

    /**
     * Creates the inverse of {@code originalId} and links it to the original in
     * one step, so two concurrent undo requests cannot both be accepted.
     */
    public synchronized Operation createUndo(long originalId, Operation draft) {
        Operation original = require(originalId);
        if (!original.isUndoable()) {
            throw new HubException(ErrorCode.NOT_UNDOABLE, describeNotUndoable(original));
        }
        draft.setUndoOf(originalId);
        Operation inverse = create(draft);
        Operation linked = original.copy();
        linked.setUndoOperationId(inverse.getId());
        linked.setUpdatedAt(now());
        persist(linked);
        rows.put(originalId, linked);
        return inverse;
    }

    public synchronized Optional<Operation> find(long id) {
        Operation row = rows.get(id);
        return row != null ? Optional.of(row.copy()) : Optional.empty();
    }

    public synchronized Operation get(long id) {
        return require(id).copy();
    }

    /**
     * Moves a row from {@code expected} to {@code next}. Fails without touching
     * the row when its current status differs or the move is not allowed.
     */
    public synchronized Operation transition(long id, OperationStatus expected, OperationStatus next, Patch patch) {
        Operation current = require(id);
        if (current.getStatus() != expected || !expected.canTransitionTo(next)) {
            throw new IllegalTransitionException(id, current.getStatus(), next);
        }
        long now = now();
        Operation updated = current.copy();
        if (patch != null) {
            patch.apply(updated, now);
        }
        updated.setStatus(next);
        updated.setUpdatedAt(now);
        try {
            persist(updated);
        } catch (HubException e) {
            throw strand(updated, e);
        }
        rows.put(id, updated);
        return updated.copy();
    }

    /**
     * Settles a row whose journal write failed. A terminal status is kept in
     * memory as requested; anything else ends in {@code failed} with the
     * storage error, so the row never stays in flight.
     */
    private HubException strand(Operation row, HubException cause) {
        long id = row.getId();
        if (!row.getStatus().isTerminal()) {
            row.setStatus(OperationStatus.FAILED);
            row.setError(cause.getMessage());
            row.setResultExcerpt(null);
        }
        rows.put(id, row);
        if (row.getUndoOf() != null) {
            Operation original = rows.get(row.getUndoOf());
            if (original != null && Long.valueOf(id).equals(original.getUndoOperationId())) {
                applyUndoOutcome(original, row.getStatus() == OperationStatus.COMPLETED,
                    row.getApprovedBy() != null ? row.getApprovedBy() : row.getActor(), row.getUpdatedAt());
            }
        }
        log.warn("Operation " + id + " settled as " + row.getStatus().wireName()
            + " in memory only; the journal is behind until the next write succeeds");
        return cause.forOperation(id, row.getStatus());
    }

    /**
     * Records the outcome of an inverse on the operation it reverses: a
     * completed inverse marks the original undone, a failed one releases it so
     * the undo can be requested again.
     */
    public synchronized Operation settleUndo(long originalId, long inverseId, boolean completed, String actor) {
        Operation original = require(originalId);
        if (original.getUndoOperationId() == null || original.getUndoOperationId() != inverseId) {
            return original.copy();
        }
        Operation updated = original.copy();
        applyUndoOutcome(updated, completed, actor, now());
        persist(updated);
        rows.put(originalId, updated);
        return updated.copy();
    }

    private static void applyUndoOutcome(Operation original, boolean completed, String actor, long now) {
        if (completed) {
            original.setUndoneAt(now);
            original.setUndoneBy(actor);
        } else {
            original.setUndoOperationId(null);
        }
        original.setUpdatedAt(now);
    }

    /**
     * Newest first, strictly by creation time. The limit is clamped to [1, 200].
     */
    public synchronized List<Operation> list(OperationQuery query) {
        OperationQuery q = query != null ? query : new OperationQuery();
        List<Operation> result = new ArrayList<>();
        for (Operation row : rows.values()) {
            if (q.matches(row)) {
                result.add(row);
            }
        }
        result.sort(Comparator.comparingLong(Operation::getCreatedAt)
            .thenComparingLong(Operation::getId)
            .reversed());
        List<Operation> page = new ArrayList<>();
        for (Operation row : result.subList(0, Math.min(q.getLimit(), result.size()))) {
            page.add(row.copy());
        }
        return page;
    }

    public synchronized Map<OperationStatus, Long> countByStatus() {
        Map<OperationStatus, Long> counts = new EnumMap<>(OperationStatus.class);
        for (OperationStatus status : OperationStatus.values()) {
            counts.put(status, 0L);
        }
        for (Operation row : rows.values()) {
            counts.merge(row.getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    public synchronized int size() {
        return rows.size();
    }

    private Operation assign(Operation draft) {
        Operation row = draft.copy();
        // created_at is kept strictly increasing so recency order equals id order.
        long createdAt = Math.max(now(), lastCreatedAt + 1);
        row.setId(nextId);
        row.setCreatedAt(createdAt);
        row.setUpdatedAt(createdAt);
        if (row.getStatus() == null) {
            row.setStatus(OperationStatus.QUEUED);
        }
        return row;
    }

    private Operation require(long id) {
        Operation row = rows.get(id);
        if (row == null) {
            throw new HubException(ErrorCode.OPERATION_NOT_FOUND, "Operation not found: " + id);
        }
        return row;
    }

    private void persist(Operation row) {
        if (logFile == null) {
            return;
        }
        try {
            JsonStorage.appendJsonLine(logFile, row);
        } catch (IOException e) {
            log.error("Failed to append operation " + row.getId() + " to " + logFile, e);
            throw new HubException(ErrorCode.STORAGE_ERROR, "Operation journal write failed: " + e.getMessage(), e);
        }
    }

    private void load() throws IOException {
        List<Operation> lines = JsonStorage.readJsonLines(logFile, Operation.class);
        for (Operation line : lines) {
            rows.put(line.getId(), line);
            nextId = Math.max(nextId, line.getId() + 1);
            lastCreatedAt = Math.max(lastCreatedAt, line.getCreatedAt());
        }
        int recovered = recoverInterrupted();
        JsonStorage.writeJsonLinesAtomic(logFile, new ArrayList<>(rows.values()));
        long pending = rows.values().stream()
            .filter(row -> row.getStatus() == OperationStatus.PENDING_APPROVAL)
            .count();
        log.info("Loaded " + rows.size() + " operation(s) from " + logFile
            + " (" + pending + " pending approval, " + recovered + " marked failed after restart)");
    }

    private int recoverInterrupted() {
        long now = now();
        int recovered = 0;
        for (Operation row : new ArrayList<>(rows.values())) {
            if (row.getStatus() != OperationStatus.RUNNING && row.getStatus() != OperationStatus.QUEUED) {
                continue;
            }
            row.setStatus(OperationStatus.FAILED);
            row.setError(INTERRUPTED_ERROR);
            row.setResultExcerpt(null);
            row.setUpdatedAt(now);
            recovered++;
            if (row.getUndoOf() != null) {
                Operation original = rows.get(row.getUndoOf());
                if (original != null && Long.valueOf(row.getId()).equals(original.getUndoOperationId())) {
                    original.setUndoOperationId(null);
                    original.setUpdatedAt(now);
                }
            }
            log.warn("Operation " + row.getId() + " (" + row.getCommand() + ") was in flight at shutdown; marked failed");
        }
        return recovered;
    }

    static String describeNotUndoable(Operation op) {
        if (op.getStatus() != OperationStatus.COMPLETED) {
            return "Operation " + op.getId() + " cannot be undone (status: " + op.getStatus().wireName() + ")";
        }
        if (op.getUndoCommand() == null) {
            return "Operation " + op.getId() + " (" + op.getCommand() + ") has no inverse";
        }
        if (op.getUndoneAt() != null) {
            return "Operation " + op.getId() + " was already undone";
        }
        return "Operation " + op.getId() + " already has an undo in progress (operation "
            + op.getUndoOperationId() + ")";
    }

    /**
     * Raised when a row is not in the status a transition expects.
     */
    public static class IllegalTransitionException extends RuntimeException {
        private final long operationId;
        private final OperationStatus current;

        public IllegalTransitionException(long operationId, OperationStatus current, OperationStatus requested) {
            super("Operation " + operationId + " cannot move from " + current.wireName()
                + " to " + requested.wireName());
            this.operationId = operationId;
            this.current = current;
        }

        public long getOperationId() {
            return operationId;
        }

        public OperationStatus getCurrent() {
            return current;
        }
    }
}
