package com.commandhub;

import com.commandhub.commands.CommandCatalog;
import com.commandhub.commands.CommandEntry;
import com.commandhub.commands.CommandResolution;
import com.commandhub.commands.UndoSpec;
import com.commandhub.credentials.Credential;
import com.commandhub.credentials.CredentialResolver;
import com.commandhub.models.Operation;
import com.commandhub.models.OperationSource;
import com.commandhub.models.OperationStatus;
import com.commandhub.models.Risk;
import com.commandhub.tools.BoundedToolInvoker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;

/**
 * Orchestrates one mutating request: resolve, journal, gate, execute, settle.
 *
 * Catalog and credential failures are raised before an Operation exists.
 * Once the Operation is created every failure ends it in {@code failed} and
 * the raised {@link HubException} carries its id.
 */
public class ApprovalGate {

    static final int EXCERPT_LIMIT = 220;

    private final OperationStore store;
    private final CommandCatalog catalog;
    private final CredentialResolver credentials;
    private final BoundedToolInvoker invoker;
    private final ObjectMapper mapper;
    private final AppLogger.Channel log = AppLogger.channel("ApprovalGate");

    public ApprovalGate(OperationStore store, CommandCatalog catalog, CredentialResolver credentials,
                        BoundedToolInvoker invoker, ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "store");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.mapper = mapper != null ? mapper : new ObjectMapper();
    }

    public SubmitOutcome submit(SubmitRequest request) {
        if (request.getExistingOperationId() != null) {
            return resume(request);
        }
        CommandResolution resolution = catalog.resolve(
            request.getCommand(), request.getArguments(), request.getProjectId());
        Credential credential = credentials.resolve(
            request.getCallerToken(), resolution.getEntry().isRequiresProjectId());
        boolean approvalRequired = request.isForceApproval() || resolution.getRisk() == Risk.HIGH;

        Operation draft = draft(resolution, request.getSource(), request.getActor(), request.getSessionId(),
            approvalRequired);
        Operation queued = store.create(draft);
        log.info("Operation " + queued.getId() + " queued: " + queued.getCommand() + " -> " + queued.getTool()
            + " (risk " + queued.getRisk().wireName() + ", actor " + queued.getActor() + ")");
        return proceed(queued, credential, request.getActor(), request.isApproved());
    }

    /**
     * Moves a {@code pending_approval} Operation to {@code running} and
     * executes it with the approver's credential.
     *
     * @throws HubException {@link ErrorCode#NOT_PENDING_APPROVAL} without
     *                      touching the Operation when it is not pending
     */
    public SubmitOutcome approve(long operationId, String approver, String callerToken) {
        Operation current = store.get(operationId);
        if (current.getStatus() != OperationStatus.PENDING_APPROVAL) {
            throw HubException.notPendingApproval(operationId, current.getStatus());
        }
        Credential credential = credentials.resolve(callerToken, requiresProjectScope(current));
        String actor = approver != null && !approver.isBlank() ? approver.trim() : "anonymous";
        Operation running;
        try {
            running = store.transition(operationId, OperationStatus.PENDING_APPROVAL, OperationStatus.RUNNING,
                (op, now) -> {
                    op.setApprovedAt(now);
                    op.setApprovedBy(actor);
                    op.setCredentialScope(credential.scope());
                });
        } catch (OperationStore.IllegalTransitionException e) {
            throw HubException.notPendingApproval(operationId, e.getCurrent());
        }
        log.info("Operation " + operationId + " approved by " + actor);
        return execute(running, credential);
    }

    /**
     * Submits the inverse of a completed Operation as a new Operation. The
     * original is marked undone once the inverse completes.
     */
    public SubmitOutcome undo(long operationId, String actor, String callerToken, String sessionId, boolean approved) {
        Operation original = store.get(operationId);
        if (!original.isUndoable()) {
            throw new HubException(ErrorCode.NOT_UNDOABLE, OperationStore.describeNotUndoable(original));
        }
        CommandEntry inverseEntry = catalog.entry(original.getUndoCommand())
            .orElseThrow(() -> new HubException(ErrorCode.NOT_UNDOABLE,
                "Inverse command " + original.getUndoCommand() + " is no longer in the catalog"));
        CommandResolution resolution = catalog.resolve(inverseEntry.getName(), original.getUndoArguments(),
            inverseEntry.isRequiresProjectId() ? original.getProjectId() : null);
        Credential credential = credentials.resolve(callerToken, inverseEntry.isRequiresProjectId());
        boolean approvalRequired = resolution.getRisk() == Risk.HIGH;

        String requester = actor != null && !actor.isBlank() ? actor.trim() : "anonymous";
        Operation draft = draft(resolution, OperationSource.API, requester, sessionId, approvalRequired);
        Operation queued = store.createUndo(operationId, draft);
        log.info("Operation " + queued.getId() + " queued as undo of " + operationId + ": " + queued.getCommand());
        return proceed(queued, credential, requester, approved);
    }

    private SubmitOutcome resume(SubmitRequest request) {
        long id = request.getExistingOperationId();
        Operation existing = store.get(id);
        String command = request.getCommand();
        if (command != null && !command.isBlank()) {
            CommandResolution named = catalog.resolve(command, request.getArguments(), existing.getProjectId());
            if (!named.getCommand().equals(existing.getCommand())) {
                throw new HubException(ErrorCode.VALIDATION_ERROR,
                    "Operation " + id + " is for command " + existing.getCommand() + ", not " + named.getCommand());
            }
        }
        if (existing.getStatus() != OperationStatus.PENDING_APPROVAL) {
            throw HubException.notPendingApproval(id, existing.getStatus());
        }
        if (!request.isApproved()) {
            return SubmitOutcome.pending(existing);
        }
        return approve(id, request.getActor(), request.getCallerToken());
    }

    private SubmitOutcome proceed(Operation queued, Credential credential, String actor, boolean approved) {
        long id = queued.getId();
        if (queued.isApprovalRequired() && !approved) {
            Operation pending = store.transition(id, OperationStatus.QUEUED, OperationStatus.PENDING_APPROVAL,
                (op, now) -> op.setCredentialScope(credential.scope()));
            log.info("Operation " + id + " (" + pending.getCommand() + ") is waiting for approval");
            return SubmitOutcome.pending(pending);
        }
        Operation running = store.transition(id, OperationStatus.QUEUED, OperationStatus.RUNNING, (op, now) -> {
            op.setCredentialScope(credential.scope());
            if (op.isApprovalRequired()) {
                op.setApprovedAt(now);
                op.setApprovedBy(actor);
            }
        });
        return execute(running, credential);
    }

    private SubmitOutcome execute(Operation running, Credential credential) {
        long id = running.getId();
        JsonNode result;
        try {
            result = invoker.invoke(running.getTool(), running.getArguments(), credential);
        } catch (RuntimeException e) {
            HubException failure = e instanceof HubException
                ? (HubException) e
                : new HubException(ErrorCode.ADAPTER_FAILURE, describe(e), e);
            String message = failure.getMessage();
            Operation failed = store.transition(id, OperationStatus.RUNNING, OperationStatus.FAILED, (op, now) -> {
                op.setError(message);
                op.setResultExcerpt(null);
            });
            settleUndo(failed, false);
            log.warn("Operation " + id + " (" + failed.getCommand() + ") failed: " + message);
            throw failure.forOperation(id, OperationStatus.FAILED);
        }

        UndoSpec undo = catalog.entry(running.getCommand()).map(CommandEntry::getUndo).orElse(null);
        Map<String, Object> inverseArgs = bindInverse(running, undo, result);
        String excerpt = excerpt(result);
        Operation completed = store.transition(id, OperationStatus.RUNNING, OperationStatus.COMPLETED, (op, now) -> {
            op.setResultExcerpt(excerpt);
            op.setError(null);
            if (inverseArgs != null) {
                op.setUndoCommand(undo.getCommand());
                op.setUndoArguments(inverseArgs);
            }
        });
        settleUndo(completed, true);
        log.info("Operation " + id + " (" + completed.getCommand() + ") completed");
        return SubmitOutcome.completed(completed, result);
    }

    private void settleUndo(Operation inverse, boolean completed) {
        if (inverse.getUndoOf() == null) {
            return;
        }
        String actor = inverse.getApprovedBy() != null ? inverse.getApprovedBy() : inverse.getActor();
        store.settleUndo(inverse.getUndoOf(), inverse.getId(), completed, actor);
    }

    private Map<String, Object> bindInverse(Operation op, UndoSpec undo, JsonNode result) {
        if (undo == null) {
            return null;
        }
        Map<String, Object> bound = undo.bind(op.getArguments(), result, mapper);
        if (bound == null) {
            log.warn("Operation " + op.getId() + " completed but its inverse " + undo.getCommand()
                + " could not be bound from the result; it will not be undoable");
        }
        return bound;
    }

    private boolean requiresProjectScope(Operation op) {
        return catalog.entry(op.getCommand())
            .map(CommandEntry::isRequiresProjectId)
            .orElse(op.getProjectId() != null);
    }

    private Operation draft(CommandResolution resolution, OperationSource source, String actor,
                            String sessionId, boolean approvalRequired) {
        Operation op = new Operation();
        op.setSource(source != null ? source : OperationSource.API);
        op.setActor(actor);
        op.setSessionId(sessionId);
        op.setCommand(resolution.getCommand());
        op.setTool(resolution.getTool());
        op.setArguments(resolution.getEffectiveArgs());
        op.setProjectId(resolution.getProjectId());
        op.setRisk(resolution.getRisk());
        op.setApprovalRequired(approvalRequired);
        op.setStatus(OperationStatus.QUEUED);
        return op;
    }

    String excerpt(JsonNode result) {
        String text;
        if (result == null || result.isNull() || result.isMissingNode()) {
            text = "null";
        } else if (result.isTextual()) {
            text = result.asText();
        } else {
            try {
                text = mapper.writeValueAsString(result);
            } catch (JsonProcessingException e) {
                text = result.toString();
            }
        }
        if (text.length() <= EXCERPT_LIMIT) {
            return text;
        }
        int cut = EXCERPT_LIMIT - 3;
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut) + "...";
    }

    private static String describe(Throwable e) {
        String m = e.getMessage();
        return m == null || m.isBlank() ? e.getClass().getSimpleName() : m;
    }
}
