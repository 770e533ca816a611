package com.branchwork.core.coordinator;

import com.branchwork.core.agent.Agent;
import com.branchwork.core.agent.AgentRegistry;
import com.branchwork.core.branch.ExecutionBranch;
import com.branchwork.core.branch.ResourceRef;
import com.branchwork.core.events.EventBus;
import com.branchwork.core.events.OrchestrationEvent;
import com.branchwork.core.logging.MdcContext;
import com.branchwork.core.metrics.BranchworkMetrics;
import com.branchwork.core.result.ErrorCode;
import com.branchwork.core.result.OrchestrationError;
import com.branchwork.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Entry point of the orchestration core.
 * <p>
 * Registers epics, binds each sub-task to an agent and a dedicated {@link ExecutionBranch}, drives
 * the {@link SubIssueStatus} state machine and runs caller-supplied {@link WorkFunction}s. The
 * coordinator is the only writer of its assignment table; every status change (together with any
 * branch replacement) is a single atomic {@code compute} on one {@code (epicId, subTaskId)} key,
 * so unrelated sub-tasks never contend.
 * <p>
 * {@link #executeManyConcurrently} runs sub-tasks on a worker pool behind a coordinator-wide
 * admission gate of {@code maxConcurrentSubTasks} permits. Each sub-task's failure is isolated and
 * reported in its own result.
 */
public class EpicCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EpicCoordinator.class);

    private static final long ADMISSION_POLL_MS = 50;
    private static final Set<SubIssueStatus> NOT_STARTED =
            EnumSet.of(SubIssueStatus.PENDING, SubIssueStatus.BRANCH_CREATED);

    private final ConcurrentHashMap<String, Epic> epics = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<AssignmentKey, SubIssueAssignment> assignments = new ConcurrentHashMap<>();

    private final AgentRegistry agentRegistry;
    private final EpicCoordinatorConfig config;
    private final EventBus eventBus;
    private final BranchworkMetrics metrics;
    private final Clock clock;
    private final Semaphore admissionGate;
    private final ExecutorService workers;

    public EpicCoordinator(AgentRegistry agentRegistry, EpicCoordinatorConfig config, EventBus eventBus,
                           BranchworkMetrics metrics, Clock clock) {
        this.agentRegistry = Objects.requireNonNull(agentRegistry, "agentRegistry");
        this.config = Objects.requireNonNull(config, "config");
        this.eventBus = eventBus != null ? eventBus : new EventBus();
        this.metrics = metrics != null ? metrics : BranchworkMetrics.inMemory();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.admissionGate = new Semaphore(config.maxConcurrentSubTasks(), true);
        this.workers = Executors.newCachedThreadPool(new SubTaskThreadFactory());
    }

    public EpicCoordinator(AgentRegistry agentRegistry, EpicCoordinatorConfig config) {
        this(agentRegistry, config, null, null, null);
    }

    public EpicCoordinatorConfig config() {
        return config;
    }

    // -- Registration ---------------------------------------------------------

    /**
     * Registers an epic and creates one assignment per sub-task id.
     * <p>
     * With {@code autoAssignAgents} each assignment gets the pool agent
     * {@code "{agentPoolPrefix}-{epicId}-{subTaskId}"}; with {@code autoCreateBranches} it gets the
     * branch {@code "{branchPrefix}-{epicId}/sub-task-{subTaskId}"} and starts in
     * {@link SubIssueStatus#BRANCH_CREATED}, otherwise in {@link SubIssueStatus#PENDING}.
     */
    public Result<Epic> registerEpic(String epicId, String title, String description, List<String> subTaskIds) {
        if (epicId == null || epicId.isBlank()) {
            return Result.failure(ErrorCode.INVALID_ARGUMENT, "Epic id cannot be blank");
        }
        if (subTaskIds == null || subTaskIds.isEmpty()) {
            return Result.failure(ErrorCode.EMPTY_SUB_TASK_LIST, "Epic " + epicId + " must have at least one sub-task");
        }
        var seen = new HashSet<String>();
        for (String subTaskId : subTaskIds) {
            if (subTaskId == null || subTaskId.isBlank()) {
                return Result.failure(ErrorCode.INVALID_ARGUMENT, "Sub-task ids cannot be blank");
            }
            if (!seen.add(subTaskId)) {
                return Result.failure(ErrorCode.DUPLICATE_SUB_TASK,
                        "Sub-task " + subTaskId + " appears more than once in epic " + epicId);
            }
        }

        var epic = new Epic(epicId, title, description, subTaskIds, clock.instant());
        if (epics.putIfAbsent(epicId, epic) != null) {
            return Result.failure(ErrorCode.DUPLICATE_EPIC, "Epic " + epicId + " is already registered");
        }

        for (String subTaskId : epic.subTaskIds()) {
            String agentId = config.autoAssignAgents() ? config.agentName(epicId, subTaskId) : null;
            var assignment = newAssignment(epic, subTaskId, agentId);
            assignments.put(new AssignmentKey(epicId, subTaskId), assignment);
            publishAssigned(assignment);
        }

        log.info("Registered epic {} '{}' with {} sub-tasks (autoAssignAgents={}, autoCreateBranches={})",
                epicId, epic.title(), epic.subTaskIds().size(), config.autoAssignAgents(), config.autoCreateBranches());
        metrics.recordEpicRegistered(epic.subTaskIds().size());
        eventBus.publish(new OrchestrationEvent("epic.registered", epicId, null,
                Map.of("title", epic.title(), "subTaskCount", epic.subTaskIds().size()),
                epic.createdAt()));
        return Result.success(epic);
    }

    /**
     * Creates a fresh assignment for a registered sub-task, replacing any previous one.
     * <p>
     * This is the manual path when auto-assignment is off, and the retry path for a sub-task that
     * ended {@code FAILED}. An assignment that is {@code IN_PROGRESS} cannot be replaced.
     *
     * @param preferredAgentId agent to use; the pool agent name when null
     */
    public Result<SubIssueAssignment> assignSubTask(String epicId, String subTaskId, String preferredAgentId) {
        Epic epic = epicId == null ? null : epics.get(epicId);
        if (epic == null) {
            return Result.failure(ErrorCode.UNKNOWN_EPIC, "Epic " + epicId + " is not registered");
        }
        if (subTaskId == null || !epic.contains(subTaskId)) {
            return Result.failure(ErrorCode.UNKNOWN_SUB_TASK,
                    "Sub-task " + subTaskId + " is not part of epic " + epicId);
        }

        String agentId = preferredAgentId != null ? preferredAgentId : config.agentName(epicId, subTaskId);
        var fresh = newAssignment(epic, subTaskId, agentId);
        var rejected = new AtomicReference<SubIssueAssignment>();
        assignments.compute(new AssignmentKey(epicId, subTaskId), (key, current) -> {
            if (current != null && current.status() == SubIssueStatus.IN_PROGRESS) {
                rejected.set(current);
                return current;
            }
            return fresh;
        });
        if (rejected.get() != null) {
            return Result.failure(ErrorCode.INVALID_STATUS_TRANSITION,
                    "Sub-task " + subTaskId + " of epic " + epicId + " is in progress and cannot be reassigned");
        }

        log.info("Assigned sub-task {} of epic {} to agent {} (branch {})",
                subTaskId, epicId, agentId, fresh.branchName());
        publishAssigned(fresh);
        return Result.success(fresh);
    }

    // -- Queries ----------------------------------------------------------------

    public Optional<Epic> getEpic(String epicId) {
        return Optional.ofNullable(epicId == null ? null : epics.get(epicId));
    }

    public List<Epic> listEpics() {
        return epics.values().stream()
                .sorted((a, b) -> a.createdAt().compareTo(b.createdAt()))
                .toList();
    }

    /**
     * Snapshot of an epic's assignments in sub-task registration order; empty for unknown epics.
     */
    public List<SubIssueAssignment> getAssignments(String epicId) {
        Epic epic = epicId == null ? null : epics.get(epicId);
        if (epic == null) {
            return List.of();
        }
        var result = new ArrayList<SubIssueAssignment>(epic.subTaskIds().size());
        for (String subTaskId : epic.subTaskIds()) {
            SubIssueAssignment assignment = assignments.get(new AssignmentKey(epicId, subTaskId));
            if (assignment != null) {
                result.add(assignment);
            }
        }
        return List.copyOf(result);
    }

    public Optional<SubIssueAssignment> getAssignment(String epicId, String subTaskId) {
        if (epicId == null || subTaskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(assignments.get(new AssignmentKey(epicId, subTaskId)));
    }

    /**
     * Counts per status, completion ratio and failure messages for an epic.
     */
    public Result<EpicProgress> summarize(String epicId) {
        Epic epic = epicId == null ? null : epics.get(epicId);
        if (epic == null) {
            return Result.failure(ErrorCode.UNKNOWN_EPIC, "Epic " + epicId + " is not registered");
        }
        var counts = new EnumMap<SubIssueStatus, Integer>(SubIssueStatus.class);
        var failures = new LinkedHashMap<String, String>();
        var current = getAssignments(epicId);
        for (var assignment : current) {
            counts.merge(assignment.status(), 1, Integer::sum);
            if (assignment.status() == SubIssueStatus.FAILED) {
                failures.put(assignment.subTaskId(), assignment.errorMessage());
            }
        }
        return Result.success(new EpicProgress(epicId, current.size(), Map.copyOf(counts), failures));
    }

    // -- Status machine -----------------------------------------------------------

    /**
     * Moves a sub-task to {@code newStatus} if the state machine allows it.
     * <p>
     * Illegal transitions (including any transition out of {@code COMPLETED} or {@code FAILED})
     * return {@code INVALID_STATUS_TRANSITION} and leave the stored assignment untouched.
     * {@code FAILED} requires an error message; {@code COMPLETED} stamps {@code completedAt}.
     */
    public Result<SubIssueAssignment> updateStatus(String epicId, String subTaskId, SubIssueStatus newStatus,
                                                   String errorMessage) {
        if (newStatus == null) {
            return Result.failure(ErrorCode.INVALID_ARGUMENT, "Status cannot be null");
        }
        if (newStatus == SubIssueStatus.FAILED && (errorMessage == null || errorMessage.isBlank())) {
            return Result.failure(ErrorCode.INVALID_ARGUMENT, "FAILED status requires an error message");
        }
        if (epicId == null || subTaskId == null) {
            return unknownAssignment(epicId, subTaskId);
        }
        return transition(new AssignmentKey(epicId, subTaskId), newStatus, errorMessage, null, UnaryOperator.identity());
    }

    // -- Execution ------------------------------------------------------------------

    public Result<SubIssueAssignment> executeSubTask(String epicId, String subTaskId, WorkFunction workFn) {
        return executeSubTask(epicId, subTaskId, workFn, CancellationSignal.none());
    }

    /**
     * Runs {@code workFn} against the sub-task's current assignment.
     * <p>
     * The sub-task is rejected straight to {@code FAILED}, never reaching {@code IN_PROGRESS}, when the
     * signal is already cancelled or the work function requires operations the agent's permission
     * level does not allow. Otherwise it moves to {@code IN_PROGRESS}, the work function runs, and the
     * sub-task ends {@code COMPLETED} with the branch the work function returned, or {@code FAILED}
     * with the error and the branch as it was before the call.
     * <p>
     * Safe to call concurrently for different sub-tasks. Concurrent calls for the same sub-task are
     * not supported; the second one is rejected by the {@code IN_PROGRESS} transition.
     */
    public Result<SubIssueAssignment> executeSubTask(String epicId, String subTaskId, WorkFunction workFn,
                                                     CancellationSignal signal) {
        Objects.requireNonNull(workFn, "workFn");
        CancellationSignal cancellation = signal != null ? signal : CancellationSignal.none();
        SubIssueAssignment current = getAssignment(epicId, subTaskId).orElse(null);
        if (current == null) {
            return unknownAssignment(epicId, subTaskId);
        }
        var key = new AssignmentKey(epicId, subTaskId);
        String agentId = current.assignedAgentId();
        long startMs = System.currentTimeMillis();

        MdcContext.setSubTask(epicId, subTaskId, agentId);
        try {
            if (!current.hasAgent()) {
                return Result.failure(ErrorCode.UNKNOWN_AGENT,
                        "Sub-task " + subTaskId + " of epic " + epicId + " has no assigned agent");
            }
            if (cancellation.isCancelled()) {
                return failBeforeStart(key, OrchestrationError.cancelled(
                        "Sub-task " + subTaskId + " cancelled before start"), "cancelled", startMs);
            }
            Result<Void> authorized = agentRegistry.authorize(agentId, workFn.requiredOperations());
            if (authorized.isFailure()) {
                if (authorized.error().is(ErrorCode.PERMISSION_DENIED)) {
                    metrics.recordPermissionDenial(agentRegistry.find(agentId)
                            .map(Agent::permissionLevel).map(Enum::name).orElse("UNKNOWN"));
                    return failBeforeStart(key, authorized.error(), "denied", startMs);
                }
                return Result.failure(authorized.error());
            }

            if (!current.hasBranch()) {
                Result<SubIssueAssignment> branched = transition(key, SubIssueStatus.BRANCH_CREATED, null, null,
                        assignment -> assignment.withBranch(createBranch(assignment.branchName())));
                if (branched.isFailure()) {
                    return branched;
                }
            }

            Result<SubIssueAssignment> started = transition(key, SubIssueStatus.IN_PROGRESS, null, null,
                    UnaryOperator.identity());
            if (started.isFailure()) {
                return started;
            }
            agentRegistry.markBusy(agentId);
            try {
                return runStarted(key, started.value(), workFn, cancellation, startMs);
            } catch (RuntimeException | Error e) {
                return abandon(key, e, startMs);
            } finally {
                agentRegistry.markAvailable(agentId);
            }
        } finally {
            MdcContext.clear();
        }
    }

    public List<Result<SubIssueAssignment>> executeManyConcurrently(String epicId, Collection<String> subTaskIds,
                                                                    WorkFunction workFn) {
        return executeManyConcurrently(epicId, subTaskIds, workFn, CancellationSignal.none());
    }

    /**
     * Runs one {@link #executeSubTask} per id with at most {@code maxConcurrentSubTasks} in flight.
     * <p>
     * Always returns one result per requested id, in request order; a failing sub-task never aborts
     * its siblings. When {@code signal} fires, running work functions are interrupted and sub-tasks
     * still waiting for admission are marked {@code FAILED} with {@code CANCELLED} without starting.
     * Interrupting the calling thread cancels {@code signal}.
     */
    public List<Result<SubIssueAssignment>> executeManyConcurrently(String epicId, Collection<String> subTaskIds,
                                                                    WorkFunction workFn, CancellationSignal signal) {
        Objects.requireNonNull(workFn, "workFn");
        CancellationSignal cancellation = signal != null ? signal : CancellationSignal.none();
        List<String> ids = List.copyOf(subTaskIds);
        metrics.recordBatch(ids.size(), config.maxConcurrentSubTasks());
        log.info("Executing {} sub-tasks of epic {} (maxConcurrent={})",
                ids.size(), epicId, config.maxConcurrentSubTasks());

        var futures = new ArrayList<Future<Result<SubIssueAssignment>>>(ids.size());
        for (String subTaskId : ids) {
            try {
                futures.add(workers.submit(() -> admitAndExecute(epicId, subTaskId, workFn, cancellation)));
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected sub-task {} of epic {}: {}", subTaskId, epicId, e.getMessage());
                futures.add(CompletableFuture.completedFuture(Result.failure(
                        OrchestrationError.cancelled("Coordinator is shut down"))));
            }
        }

        var results = new ArrayList<Result<SubIssueAssignment>>(futures.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            Future<Result<SubIssueAssignment>> future = futures.get(i);
            while (true) {
                try {
                    results.add(future.get());
                    break;
                } catch (InterruptedException e) {
                    if (!interrupted) {
                        log.warn("Interrupted while awaiting batch for epic {}, cancelling remaining sub-tasks", epicId);
                        interrupted = true;
                        cancellation.cancel();
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Unexpected error executing sub-task {} of epic {}", ids.get(i), epicId, cause);
                    results.add(Result.failure(OrchestrationError.workFailure(describe(cause))));
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        long succeeded = results.stream().filter(Result::isSuccess).count();
        log.info("Batch for epic {} finished: {} completed, {} failed", epicId, succeeded, results.size() - succeeded);
        return List.copyOf(results);
    }

    /**
     * Stops accepting batches and waits briefly for running sub-tasks to finish.
     */
    public void shutdown() {
        close();
    }

    @Override
    public void close() {
        if (workers.isShutdown()) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Sub-task workers did not stop within 10s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // -- Internals -------------------------------------------------------------------

    private Result<SubIssueAssignment> admitAndExecute(String epicId, String subTaskId, WorkFunction workFn,
                                                       CancellationSignal signal) {
        var key = new AssignmentKey(epicId, subTaskId);
        long startMs = System.currentTimeMillis();
        try {
            while (!admissionGate.tryAcquire(ADMISSION_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (signal.isCancelled()) {
                    return skipped(key, startMs);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return skipped(key, startMs);
        }
        try {
            return executeSubTask(epicId, subTaskId, workFn, signal);
        } finally {
            admissionGate.release();
        }
    }

    private Result<SubIssueAssignment> skipped(AssignmentKey key, long startMs) {
        if (!assignments.containsKey(key)) {
            return unknownAssignment(key.epicId(), key.subTaskId());
        }
        log.info("Skipping sub-task {} of epic {}: batch cancelled before admission", key.subTaskId(), key.epicId());
        return failBeforeStart(key, OrchestrationError.cancelled(
                "Sub-task " + key.subTaskId() + " cancelled before start"), "cancelled", startMs);
    }

    private Result<SubIssueAssignment> runStarted(AssignmentKey key, SubIssueAssignment started, WorkFunction workFn,
                                                  CancellationSignal cancellation, long startMs) {
        String agentId = started.assignedAgentId();
        agentRegistry.heartbeat(agentId);
        log.info("Executing sub-task {} of epic {} on agent {}", key.subTaskId(), key.epicId(), agentId);
        eventBus.publish(new OrchestrationEvent("subtask.started", key.epicId(), key.subTaskId(),
                Map.of("agentId", agentId, "branch", started.branchName()), clock.instant()));

        Result<SubIssueAssignment> outcome = invoke(workFn, started, cancellation);
        if (outcome.isSuccess() && cancellation.isCancelled()) {
            outcome = Result.failure(OrchestrationError.cancelled("Sub-task " + key.subTaskId() + " cancelled"));
        }

        if (outcome.isSuccess()) {
            ExecutionBranch produced = outcome.value().branch();
            Result<SubIssueAssignment> completed = transition(key, SubIssueStatus.COMPLETED, null, null,
                    assignment -> produced != null ? assignment.withBranch(produced) : assignment);
            if (completed.isSuccess()) {
                onFinished(completed.value(), "completed", startMs);
            }
            return completed;
        }

        OrchestrationError error = outcome.error();
        Result<SubIssueAssignment> failed = transition(key, SubIssueStatus.FAILED, error.message(), null,
                UnaryOperator.identity());
        if (failed.isSuccess()) {
            onFinished(failed.value(), error.is(ErrorCode.CANCELLED) ? "cancelled" : "failed", startMs);
        }
        return Result.failure(error);
    }

    /**
     * Moves a sub-task left {@code IN_PROGRESS} by an unexpected throwable to {@code FAILED}, so it can be
     * reassigned.
     */
    private Result<SubIssueAssignment> abandon(AssignmentKey key, Throwable cause, long startMs) {
        log.error("Sub-task {} of epic {} aborted unexpectedly", key.subTaskId(), key.epicId(), cause);
        OrchestrationError error = OrchestrationError.workFailure(describe(cause));
        Result<SubIssueAssignment> failed = transition(key, SubIssueStatus.FAILED, error.message(),
                EnumSet.of(SubIssueStatus.IN_PROGRESS), UnaryOperator.identity());
        if (failed.isSuccess()) {
            onFinished(failed.value(), "failed", startMs);
        }
        return Result.failure(error);
    }

    private Result<SubIssueAssignment> invoke(WorkFunction workFn, SubIssueAssignment assignment,
                                              CancellationSignal signal) {
        Thread worker = Thread.currentThread();
        try (CancellationSignal.Registration registration = signal.onCancel(worker::interrupt)) {
            Result<SubIssueAssignment> result = workFn.apply(assignment, signal);
            if (result == null) {
                return Result.failure(OrchestrationError.workFailure("Work function returned no result"));
            }
            if (result.isSuccess() && result.value() == null) {
                return Result.failure(OrchestrationError.workFailure("Work function returned no assignment"));
            }
            if (result.isFailure() && !result.error().is(ErrorCode.CANCELLED)) {
                return Result.failure(OrchestrationError.workFailure(result.error().message()));
            }
            return result;
        } catch (InterruptedException e) {
            if (!signal.isCancelled()) {
                Thread.currentThread().interrupt();
            }
            return Result.failure(OrchestrationError.cancelled("Interrupted: " + describe(e)));
        } catch (Exception | Error e) {
            if (signal.isCancelled()) {
                return Result.failure(OrchestrationError.cancelled("Cancelled: " + describe(e)));
            }
            log.warn("Work function for sub-task {} threw: {}", assignment.subTaskId(), describe(e), e);
            return Result.failure(OrchestrationError.workFailure(describe(e)));
        } finally {
            if (signal.isCancelled()) {
                // clear the interrupt delivered by the cancellation listener
                Thread.interrupted();
            }
        }
    }

    private Result<SubIssueAssignment> failBeforeStart(AssignmentKey key, OrchestrationError error, String outcome,
                                                       long startMs) {
        Result<SubIssueAssignment> failed = transition(key, SubIssueStatus.FAILED, error.message(), NOT_STARTED,
                UnaryOperator.identity());
        if (failed.isFailure()) {
            return failed;
        }
        onFinished(failed.value(), outcome, startMs);
        return Result.failure(error);
    }

    /**
     * Atomically applies {@code amend} and the status change to one assignment.
     *
     * @param requiredFrom statuses the assignment must currently be in; null to rely on the state machine only
     */
    private Result<SubIssueAssignment> transition(AssignmentKey key, SubIssueStatus next, String errorMessage,
                                                  Set<SubIssueStatus> requiredFrom,
                                                  UnaryOperator<SubIssueAssignment> amend) {
        var rejection = new AtomicReference<OrchestrationError>();
        String error = next == SubIssueStatus.FAILED ? errorMessage : null;
        SubIssueAssignment updated = assignments.computeIfPresent(key, (k, current) -> {
            boolean allowed = current.status().canTransitionTo(next)
                    && (requiredFrom == null || requiredFrom.contains(current.status()));
            if (!allowed) {
                rejection.set(OrchestrationError.of(ErrorCode.INVALID_STATUS_TRANSITION,
                        "Sub-task " + k.subTaskId() + " of epic " + k.epicId() + " cannot move from "
                                + current.status() + " to " + next));
                return current;
            }
            return amend.apply(current).withStatus(next, clock.instant(), error);
        });
        if (updated == null) {
            return unknownAssignment(key.epicId(), key.subTaskId());
        }
        if (rejection.get() != null) {
            log.warn("Rejected status transition: {}", rejection.get().message());
            return Result.failure(rejection.get());
        }
        log.debug("Sub-task {} of epic {} -> {}", key.subTaskId(), key.epicId(), next);
        return Result.success(updated);
    }

    private SubIssueAssignment newAssignment(Epic epic, String subTaskId, String agentId) {
        if (agentId != null) {
            agentRegistry.getOrCreate(agentId,
                    Set.of("epic-" + epic.epicId(), "sub-task-" + subTaskId),
                    config.defaultPermissionLevel());
        }
        String branchName = config.branchName(epic.epicId(), subTaskId);
        ExecutionBranch branch = config.autoCreateBranches() ? createBranch(branchName) : null;
        return new SubIssueAssignment(
                epic.epicId(),
                subTaskId,
                "Sub-task " + subTaskId,
                "Work item for epic " + epic.epicId() + (epic.title().isEmpty() ? "" : ": " + epic.title()),
                agentId,
                branchName,
                branch,
                branch != null ? SubIssueStatus.BRANCH_CREATED : SubIssueStatus.PENDING,
                clock.instant(),
                null,
                null);
    }

    private ExecutionBranch createBranch(String branchName) {
        return ExecutionBranch.create(branchName,
                ResourceRef.retrievalStore("memory:" + branchName),
                ResourceRef.dataSource(config.dataSourceLocation()));
    }

    private void publishAssigned(SubIssueAssignment assignment) {
        var payload = new HashMap<String, Object>();
        payload.put("branch", assignment.branchName());
        payload.put("status", assignment.status().name());
        if (assignment.assignedAgentId() != null) {
            payload.put("agentId", assignment.assignedAgentId());
        }
        eventBus.publish(new OrchestrationEvent("subtask.assigned", assignment.epicId(), assignment.subTaskId(),
                payload, clock.instant()));
    }

    private void onFinished(SubIssueAssignment assignment, String outcome, long startMs) {
        long elapsedMs = System.currentTimeMillis() - startMs;
        metrics.recordSubTaskExecution(outcome, elapsedMs);
        metrics.recordSubTaskResult(assignment.status().name());

        var payload = new HashMap<String, Object>();
        payload.put("status", assignment.status().name());
        payload.put("outcome", outcome);
        payload.put("elapsedMs", elapsedMs);
        if (assignment.errorMessage() != null) {
            payload.put("error", assignment.errorMessage());
        }
        boolean completed = assignment.status() == SubIssueStatus.COMPLETED;
        if (completed) {
            log.info("Sub-task {} of epic {} completed in {}ms", assignment.subTaskId(), assignment.epicId(), elapsedMs);
        } else {
            log.warn("Sub-task {} of epic {} failed ({}): {}", assignment.subTaskId(), assignment.epicId(),
                    outcome, assignment.errorMessage());
        }
        eventBus.publish(new OrchestrationEvent(completed ? "subtask.completed" : "subtask.failed",
                assignment.epicId(), assignment.subTaskId(), payload, clock.instant()));
    }

    private static <T> Result<T> unknownAssignment(String epicId, String subTaskId) {
        return Result.failure(ErrorCode.UNKNOWN_ASSIGNMENT,
                "No assignment for sub-task " + subTaskId + " of epic " + epicId);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private record AssignmentKey(String epicId, String subTaskId) {}

    private static final class SubTaskThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "branchwork-subtask-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
