package com.branchwork.core.coordinator;

import com.branchwork.core.agent.AgentRegistry;
import com.branchwork.core.agent.AgentStatus;
import com.branchwork.core.branch.ExecutionBranch;
import com.branchwork.core.branch.ReasoningState;
import com.branchwork.core.events.EventBus;
import com.branchwork.core.events.OrchestrationEvent;
import com.branchwork.core.metrics.BranchworkMetrics;
import com.branchwork.core.result.ErrorCode;
import com.branchwork.core.result.Result;
import com.branchwork.core.security.OperationKind;
import com.branchwork.core.security.PermissionGuard;
import com.branchwork.core.security.PermissionLevel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EpicCoordinatorTest {

    private SimpleMeterRegistry meterRegistry;
    private EventBus eventBus;
    private AgentRegistry agentRegistry;
    private EpicCoordinator coordinator;
    private List<OrchestrationEvent> events;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        agentRegistry = new AgentRegistry(new PermissionGuard(), eventBus, Clock.systemUTC(), 100);
        coordinator = newCoordinator(EpicCoordinatorConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private EpicCoordinator newCoordinator(EpicCoordinatorConfig config) {
        return new EpicCoordinator(agentRegistry, config, eventBus, new BranchworkMetrics(meterRegistry),
                Clock.systemUTC());
    }

    private void useConfig(EpicCoordinatorConfig config) {
        coordinator.close();
        coordinator = newCoordinator(config);
    }

    /** Appends a reasoning step naming the sub-task and returns the updated assignment. */
    private static WorkFunction recordStep() {
        return (assignment, signal) -> Result.success(assignment.withBranch(
                assignment.branch().withReasoningStep(ReasoningState.draft("work on " + assignment.subTaskId()),
                        "prompt")));
    }

    private long eventCount(String type, String subTaskId) {
        return events.stream()
                .filter(e -> e.eventType().equals(type))
                .filter(e -> subTaskId == null || subTaskId.equals(e.subTaskId()))
                .count();
    }

    @Nested
    @DisplayName("registerEpic")
    class RegisterEpic {

        @Test
        @DisplayName("creates one assignment per sub-task with derived branch and agent names")
        void namingScenario() {
            var result = coordinator.registerEpic("E1", "Title", "Desc", List.of("A", "B", "C"));

            assertTrue(result.isSuccess());
            var assignments = coordinator.getAssignments("E1");
            assertEquals(3, assignments.size());
            assertEquals(List.of("A", "B", "C"), assignments.stream().map(SubIssueAssignment::subTaskId).toList());

            var a = assignments.get(0);
            assertEquals("epic-E1/sub-task-A", a.branchName());
            assertEquals("epic-E1/sub-task-A", a.branch().name());
            assertTrue(a.branch().isEmpty());
            assertEquals("agent-E1-A", a.assignedAgentId());
            assertEquals(SubIssueStatus.BRANCH_CREATED, a.status());
            assertNull(a.completedAt());
            assertNull(a.errorMessage());
        }

        @Test
        @DisplayName("pool agents are created with the default permission level")
        void createsAgents() {
            coordinator.registerEpic("E1", "t", "d", List.of("A", "B"));

            var agent = agentRegistry.find("agent-E1-A").orElseThrow();
            assertEquals(PermissionLevel.SANDBOXED, agent.permissionLevel());
            assertTrue(agent.hasCapability("epic-E1"));
            assertEquals(2, agentRegistry.size());
        }

        @Test
        @DisplayName("rejects a second registration of the same epic")
        void duplicateEpic() {
            coordinator.registerEpic("E1", "t", "d", List.of("A"));
            var second = coordinator.registerEpic("E1", "other", "d", List.of("X", "Y"));

            assertEquals(ErrorCode.DUPLICATE_EPIC, second.error().code());
            assertEquals(1, coordinator.getAssignments("E1").size());
        }

        @Test
        @DisplayName("rejects an empty sub-task list")
        void emptyList() {
            assertEquals(ErrorCode.EMPTY_SUB_TASK_LIST,
                    coordinator.registerEpic("E1", "t", "d", List.of()).error().code());
            assertTrue(coordinator.getEpic("E1").isEmpty());
        }

        @Test
        @DisplayName("rejects duplicate and blank sub-task ids")
        void invalidSubTaskIds() {
            assertEquals(ErrorCode.DUPLICATE_SUB_TASK,
                    coordinator.registerEpic("E1", "t", "d", List.of("A", "A")).error().code());
            assertEquals(ErrorCode.INVALID_ARGUMENT,
                    coordinator.registerEpic("E2", "t", "d", List.of("A", " ")).error().code());
        }

        @Test
        @DisplayName("publishes epic.registered and one subtask.assigned per sub-task")
        void publishesEvents() {
            coordinator.registerEpic("E1", "t", "d", List.of("A", "B"));

            assertEquals(1, eventCount("epic.registered", null));
            assertEquals(2, eventCount("subtask.assigned", null));
            assertEquals(1.0, meterRegistry.find("branchwork.epics.registered").counter().count());
        }

        @Test
        @DisplayName("without auto-assignment sub-tasks are pending with no agent and no branch")
        void manualAssignment() {
            useConfig(EpicCoordinatorConfig.defaults().withAutoAssign(false, false));

            coordinator.registerEpic("E1", "t", "d", List.of("A"));

            var a = coordinator.getAssignment("E1", "A").orElseThrow();
            assertEquals(SubIssueStatus.PENDING, a.status());
            assertNull(a.assignedAgentId());
            assertNull(a.branch());
            assertEquals("epic-E1/sub-task-A", a.branchName());
            assertEquals(0, agentRegistry.size());
        }
    }

    @Nested
    @DisplayName("assignSubTask")
    class AssignSubTask {

        @Test
        @DisplayName("unknown epic and sub-task are reported")
        void unknown() {
            assertEquals(ErrorCode.UNKNOWN_EPIC, coordinator.assignSubTask("nope", "A", null).error().code());
            coordinator.registerEpic("E1", "t", "d", List.of("A"));
            assertEquals(ErrorCode.UNKNOWN_SUB_TASK, coordinator.assignSubTask("E1", "Z", null).error().code());
        }

        @Test
        @DisplayName("a null sub-task id is reported as unknown")
        void nullSubTaskId() {
            coordinator.registerEpic("E1", "t", "d", List.of("A"));

            var result = coordinator.assignSubTask("E1", null, null);

            assertEquals(ErrorCode.UNKNOWN_SUB_TASK, result.error().code());
        }

        @Test
        @DisplayName("assigns a preferred agent when auto-assignment is off, and execution creates the branch")
        void manualThenExecute() {
            useConfig(EpicCoordinatorConfig.defaults().withAutoAssign(false, false));
            coordinator.registerEpic("E1", "t", "d", List.of("A"));

            var unassigned = coordinator.executeSubTask("E1", "A", recordStep());
            assertEquals(ErrorCode.UNKNOWN_AGENT, unassigned.error().code());

            var assigned = coordinator.assignSubTask("E1", "A", "worker-7");
            assertTrue(assigned.isSuccess());
            assertEquals("worker-7", assigned.value().assignedAgentId());
            assertTrue(agentRegistry.find("worker-7").isPresent());

            var result = coordinator.executeSubTask("E1", "A", recordStep());
            assertTrue(result.isSuccess());
            assertEquals(SubIssueStatus.COMPLETED, result.value().status());
            assertEquals(1, result.value().branch().size());
        }

        @Test
        @DisplayName("a failed sub-task can be retried through a fresh assignment")
        void retryAfterFailure() {
            coordinator.registerEpic("E1", "t", "d", List.of("A"));
            coordinator.executeSubTask("E1", "A", (a, s) -> {
                throw new IllegalStateException("boom");
            });
            assertEquals(SubIssueStatus.FAILED, coordinator.getAssignment("E1", "A").orElseThrow().status());

            var retried = coordinator.assignSubTask("E1", "A", null);
            assertEquals(SubIssueStatus.BRANCH_CREATED, retried.value().status());
            assertNull(retried.value().errorMessage());

            assertTrue(coordinator.executeSubTask("E1", "A", recordStep()).isSuccess());
        }

        @Test
        @Timeout(10)
        @DisplayName("an in-progress sub-task cannot be reassigned")
        void inProgressNotReplaced() throws Exception {
            coordinator.registerEpic("E1", "t", "d", List.of("A"));
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);

            var running = CompletableFuture.supplyAsync(() -> coordinator.executeSubTask("E1", "A", (a, s) -> {
                started.countDown();
                release.await();
                return Result.success(a);
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            var reassign = coordinator.assignSubTask("E1", "A", "other");
            assertEquals(ErrorCode.INVALID_STATUS_TRANSITION, reassign.error().code());

            release.countDown();
            assertTrue(running.get(5, TimeUnit.SECONDS).isSuccess());
        }
    }

    @Nested
    @DisplayName("updateStatus")
    class UpdateStatus {

        @BeforeEach
        void register() {
            coordinator.registerEpic("E1", "t", "d", List.of("A"));
        }

        @Test
        @DisplayName("follows the forward path and stamps completedAt")
        void forwardPath() {
            assertTrue(coordinator.updateStatus("E1", "A", SubIssueStatus.IN_PROGRESS, null).isSuccess());
            var done = coordinator.updateStatus("E1", "A", SubIssueStatus.COMPLETED, null);

            assertTrue(done.isSuccess());
            assertNotNull(done.value().completedAt());
        }

        @Test
        @DisplayName("terminal states never change")
        void terminalIsFinal() {
            coordinator.updateStatus("E1", "A", SubIssueStatus.FAILED, "gave up");

            for (SubIssueStatus next : SubIssueStatus.values()) {
                var result = coordinator.updateStatus("E1", "A", next, "again");
                assertEquals(ErrorCode.INVALID_STATUS_TRANSITION, result.error().code(), "to " + next);
            }
            var stored = coordinator.getAssignment("E1", "A").orElseThrow();
            assertEquals(SubIssueStatus.FAILED, stored.status());
            assertEquals("gave up", stored.errorMessage());
        }

        @Test
        @DisplayName("skipping IN_PROGRESS is rejected and leaves the assignment untouched")
        void illegalTransition() {
            var before = coordinator.getAssignment("E1", "A").orElseThrow();
            var result = coordinator.updateStatus("E1", "A", SubIssueStatus.COMPLETED, null);

            assertEquals(ErrorCode.INVALID_STATUS_TRANSITION, result.error().code());
            assertEquals(before, coordinator.getAssignment("E1", "A").orElseThrow());
        }

        @Test
        @DisplayName("FAILED requires an error message")
        void failedNeedsMessage() {
            assertEquals(ErrorCode.INVALID_ARGUMENT,
                    coordinator.updateStatus("E1", "A", SubIssueStatus.FAILED, " ").error().code());
        }

        @Test
        @DisplayName("unknown sub-tasks fail with UNKNOWN_ASSIGNMENT")
        void unknownAssignment() {
            assertEquals(ErrorCode.UNKNOWN_ASSIGNMENT,
                    coordinator.updateStatus("E1", "Z", SubIssueStatus.IN_PROGRESS, null).error().code());
        }
    }

    @Nested
    @DisplayName("executeSubTask")
    class ExecuteSubTask {

        @BeforeEach
        void register() {
            coordinator.registerEpic("E1", "t", "d", List.of("A"));
        }

        @Test
        @DisplayName("success stores the returned branch and completes")
        void success() {
            var result = coordinator.executeSubTask("E1", "A", recordStep());

            assertTrue(result.isSuccess());
            var stored = coordinator.getAssignment("E1", "A").orElseThrow();
            assertEquals(SubIssueStatus.COMPLETED, stored.status());
            assertEquals(1, stored.branch().size());
            assertNotNull(stored.completedAt());
            assertEquals(1, eventCount("subtask.started", "A"));
            assertEquals(1, eventCount("subtask.completed", "A"));
        }

        @Test
        @DisplayName("the work function sees IN_PROGRESS")
        void seesInProgress() {
            var seen = new ArrayList<SubIssueStatus>();
            coordinator.executeSubTask("E1", "A", (a, s) -> {
                seen.add(a.status());
                seen.add(coordinator.getAssignment("E1", "A").orElseThrow().status());
                return Result.success(a);
            });
            assertEquals(List.of(SubIssueStatus.IN_PROGRESS, SubIssueStatus.IN_PROGRESS), seen);
        }

        @Test
        @DisplayName("only the branch is taken from the returned assignment")
        void onlyBranchTaken() {
            coordinator.executeSubTask("E1", "A", (a, s) -> Result.success(
                    a.withAgent("someone-else").withBranch(ExecutionBranch.create("x")
                            .withReasoningStep(ReasoningState.draft("d"), "p"))));

            var stored = coordinator.getAssignment("E1", "A").orElseThrow();
            assertEquals("agent-E1-A", stored.assignedAgentId());
            assertEquals(1, stored.branch().size());
        }

        @Test
        @DisplayName("an exception fails the sub-task and keeps the previous branch")
        void exceptionFails() {
            var before = coordinator.getAssignment("E1", "A").orElseThrow().branch();

            var result = coordinator.executeSubTask("E1", "A", (a, s) -> {
                throw new IllegalStateException("disk full");
            });

            assertEquals(ErrorCode.WORK_FUNCTION_FAILURE, result.error().code());
            var stored = coordinator.getAssignment("E1", "A").orElseThrow();
            assertEquals(SubIssueStatus.FAILED, stored.status());
            assertEquals("disk full", stored.errorMessage());
            assertEquals(before, stored.branch());
            assertEquals(1, eventCount("subtask.failed", "A"));
        }

        @Test
        @DisplayName("an Error thrown by the work function fails the sub-task, which can then be retried")
        void errorFails() {
            var result = assertDoesNotThrow(() -> coordinator.executeSubTask("E1", "A", (a, s) -> {
                throw new AssertionError("invariant broken");
            }));

            assertEquals(ErrorCode.WORK_FUNCTION_FAILURE, result.error().code());
            var stored = coordinator.getAssignment("E1", "A").orElseThrow();
            assertEquals(SubIssueStatus.FAILED, stored.status());
            assertEquals("invariant broken", stored.errorMessage());
            assertEquals(AgentStatus.AVAILABLE, agentRegistry.status("agent-E1-A", Duration.ofMinutes(5)).orElseThrow());

            assertTrue(coordinator.assignSubTask("E1", "A", null).isSuccess());
            assertTrue(coordinator.executeSubTask("E1", "A", recordStep()).isSuccess());
        }

        @Test
        @DisplayName("an Error raised while the sub-task is running outside the work function still fails it")
        void errorAroundWorkFunction() {
            eventBus.subscribeSubTask("E1", "A", event -> {
                if (event.eventType().equals("subtask.started")) {
                    throw new AssertionError("listener broke");
                }
            });

            var result = assertDoesNotThrow(() -> coordinator.executeSubTask("E1", "A", recordStep()));

            assertEquals(ErrorCode.WORK_FUNCTION_FAILURE, result.error().code());
            assertEquals("listener broke", result.error().message());
            var stored = coordinator.getAssignment("E1", "A").orElseThrow();
            assertEquals(SubIssueStatus.FAILED, stored.status());
            assertEquals(1, eventCount("subtask.failed", "A"));
            assertTrue(coordinator.assignSubTask("E1", "A", null).isSuccess());
        }

        @Test
        @DisplayName("the agent is busy while the work function runs and available afterwards")
        void agentBusyWhileRunning() {
            var during = new ArrayList<AgentStatus>();
            var foundWhileBusy = new ArrayList<Boolean>();
            coordinator.executeSubTask("E1", "A", (a, s) -> {
                during.add(agentRegistry.status(a.assignedAgentId(), Duration.ofMinutes(5)).orElseThrow());
                foundWhileBusy.add(agentRegistry.findByCapability("sub-task-A", Duration.ofMinutes(5)).isPresent());
                return Result.success(a);
            });

            assertEquals(List.of(AgentStatus.BUSY), during);
            assertEquals(List.of(false), foundWhileBusy);
            assertTrue(agentRegistry.isAvailable("agent-E1-A", Duration.ofMinutes(5)));
            assertEquals("agent-E1-A",
                    agentRegistry.findByCapability("sub-task-A", Duration.ofMinutes(5)).orElseThrow().id());
        }

        @Test
        @DisplayName("a returned failure is reported as WORK_FUNCTION_FAILURE")
        void returnedFailure() {
            var result = coordinator.executeSubTask("E1", "A",
                    (a, s) -> Result.failure(ErrorCode.UNKNOWN_AGENT, "no such tool"));

            assertEquals(ErrorCode.WORK_FUNCTION_FAILURE, result.error().code());
            assertEquals("no such tool", coordinator.getAssignment("E1", "A").orElseThrow().errorMessage());
        }

        @Test
        @DisplayName("a null result fails the sub-task")
        void nullResult() {
            var result = coordinator.executeSubTask("E1", "A", (a, s) -> null);
            assertEquals(ErrorCode.WORK_FUNCTION_FAILURE, result.error().code());
        }

        @Test
        @DisplayName("permission denial fails without ever entering IN_PROGRESS")
        void permissionDenied() {
            var invoked = new AtomicInteger();
            WorkFunction privileged = WorkFunction.requiring(Set.of(OperationKind.UNRESTRICTED), (a, s) -> {
                invoked.incrementAndGet();
                return Result.success(a);
            });

            var result = coordinator.executeSubTask("E1", "A", privileged);

            assertEquals(ErrorCode.PERMISSION_DENIED, result.error().code());
            assertEquals(0, invoked.get());
            assertEquals(SubIssueStatus.FAILED, coordinator.getAssignment("E1", "A").orElseThrow().status());
            assertEquals(0, eventCount("subtask.started", "A"));
            assertEquals(1.0, meterRegistry.find("branchwork.permission.denials")
                    .tag("level", "SANDBOXED").counter().count());
        }

        @Test
        @DisplayName("a TRUSTED default permission level lets pool agents run unrestricted work")
        void trustedDefaultLevel() {
            useConfig(EpicCoordinatorConfig.defaults().withDefaultPermissionLevel(PermissionLevel.TRUSTED));
            coordinator.registerEpic("E2", "t", "d", List.of("A"));
            WorkFunction privileged = WorkFunction.requiring(Set.of(OperationKind.UNRESTRICTED), recordStep());

            var result = coordinator.executeSubTask("E2", "A", privileged);

            assertTrue(result.isSuccess(), () -> result.error().toString());
            assertEquals(PermissionLevel.TRUSTED, agentRegistry.find("agent-E2-A").orElseThrow().permissionLevel());
        }

        @Test
        @DisplayName("an already-cancelled signal fails the sub-task before start")
        void cancelledBeforeStart() {
            var signal = new CancellationSignal();
            signal.cancel();

            var result = coordinator.executeSubTask("E1", "A", recordStep(), signal);

            assertEquals(ErrorCode.CANCELLED, result.error().code());
            assertEquals(SubIssueStatus.FAILED, coordinator.getAssignment("E1", "A").orElseThrow().status());
            assertEquals(0, eventCount("subtask.started", "A"));
        }

        @Test
        @Timeout(10)
        @DisplayName("cancelling interrupts a blocked work function")
        void cancelInterrupts() throws Exception {
            var signal = new CancellationSignal();
            var started = new CountDownLatch(1);

            var running = CompletableFuture.supplyAsync(() -> coordinator.executeSubTask("E1", "A", (a, s) -> {
                started.countDown();
                Thread.sleep(60_000);
                return Result.success(a);
            }, signal));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            signal.cancel();

            var result = running.get(5, TimeUnit.SECONDS);
            assertEquals(ErrorCode.CANCELLED, result.error().code());
            assertEquals(SubIssueStatus.FAILED, coordinator.getAssignment("E1", "A").orElseThrow().status());
        }

        @Test
        @DisplayName("a finished sub-task cannot run again")
        void noRerun() {
            coordinator.executeSubTask("E1", "A", recordStep());
            var again = coordinator.executeSubTask("E1", "A", recordStep());

            assertEquals(ErrorCode.INVALID_STATUS_TRANSITION, again.error().code());
            assertEquals(1, coordinator.getAssignment("E1", "A").orElseThrow().branch().size());
        }

        @Test
        @DisplayName("unknown sub-tasks fail with UNKNOWN_ASSIGNMENT")
        void unknown() {
            assertEquals(ErrorCode.UNKNOWN_ASSIGNMENT,
                    coordinator.executeSubTask("E1", "Z", recordStep()).error().code());
        }
    }

    @Nested
    @DisplayName("executeManyConcurrently")
    class ExecuteMany {

        @Test
        @Timeout(20)
        @DisplayName("one failing sub-task among five leaves the other four completed")
        void isolatesFailure() {
            var ids = List.of("1", "2", "3", "4", "5");
            coordinator.registerEpic("E1", "t", "d", ids);

            var results = coordinator.executeManyConcurrently("E1", ids, (a, s) -> {
                if (a.subTaskId().equals("3")) {
                    throw new IllegalStateException("sub-task 3 broke");
                }
                return recordStep().apply(a, s);
            });

            assertEquals(5, results.size());
            assertEquals(4, results.stream().filter(Result::isSuccess).count());
            assertTrue(results.get(2).isFailure());
            assertEquals("sub-task 3 broke", results.get(2).error().message());
            for (int i = 0; i < ids.size(); i++) {
                if (i != 2) {
                    assertEquals(ids.get(i), results.get(i).value().subTaskId());
                }
            }

            var progress = coordinator.summarize("E1").value();
            assertEquals(4, progress.count(SubIssueStatus.COMPLETED));
            assertEquals(1, progress.count(SubIssueStatus.FAILED));
            assertTrue(progress.isFinished());
            assertEquals(0.8, progress.completionRatio(), 1e-9);
            assertEquals("sub-task 3 broke", progress.failures().get("3"));
        }

        @Test
        @Timeout(20)
        @DisplayName("an Error in one sub-task of a batch leaves it FAILED and the others completed")
        void errorInBatch() {
            var ids = List.of("A", "B", "C");
            coordinator.registerEpic("E1", "t", "d", ids);

            var results = coordinator.executeManyConcurrently("E1", ids, (a, s) -> {
                if (a.subTaskId().equals("B")) {
                    throw new AssertionError("boom");
                }
                return recordStep().apply(a, s);
            });

            assertEquals(ErrorCode.WORK_FUNCTION_FAILURE, results.get(1).error().code());
            assertEquals("boom", results.get(1).error().message());
            assertEquals(SubIssueStatus.FAILED, coordinator.getAssignment("E1", "B").orElseThrow().status());
            assertEquals(2, coordinator.summarize("E1").value().count(SubIssueStatus.COMPLETED));
            assertTrue(coordinator.summarize("E1").value().isFinished());
        }

        @Test
        @Timeout(20)
        @DisplayName("never runs more than maxConcurrentSubTasks work functions at once")
        void boundedConcurrency() {
            useConfig(EpicCoordinatorConfig.defaults().withMaxConcurrentSubTasks(2));
            var ids = List.of("a", "b", "c", "d", "e", "f");
            coordinator.registerEpic("E1", "t", "d", ids);
            var inFlight = new AtomicInteger();
            var maxSeen = new AtomicInteger();

            var results = coordinator.executeManyConcurrently("E1", ids, (a, s) -> {
                int now = inFlight.incrementAndGet();
                maxSeen.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(50);
                } finally {
                    inFlight.decrementAndGet();
                }
                return Result.success(a);
            });

            assertTrue(results.stream().allMatch(Result::isSuccess));
            assertTrue(maxSeen.get() <= 2, "max in flight was " + maxSeen.get());
            assertTrue(maxSeen.get() >= 1);
        }

        @Test
        @Timeout(20)
        @DisplayName("cancellation skips sub-tasks that have not started")
        void cancellationSkipsPending() {
            useConfig(EpicCoordinatorConfig.defaults().withMaxConcurrentSubTasks(1));
            var ids = List.of("a", "b", "c", "d");
            coordinator.registerEpic("E1", "t", "d", ids);
            var signal = new CancellationSignal();
            var invocations = new AtomicInteger();

            var results = coordinator.executeManyConcurrently("E1", ids, (a, s) -> {
                invocations.incrementAndGet();
                s.cancel();
                return Result.success(a);
            }, signal);

            assertEquals(1, invocations.get());
            assertEquals(4, results.size());
            assertTrue(results.stream().allMatch(r -> r.isFailure() && r.error().is(ErrorCode.CANCELLED)));
            assertTrue(coordinator.getAssignments("E1").stream()
                    .allMatch(a -> a.status() == SubIssueStatus.FAILED));
            assertEquals(1, eventCount("subtask.started", null));
        }

        @Test
        @DisplayName("unknown sub-task ids get their own failure without affecting others")
        void unknownIdInBatch() {
            coordinator.registerEpic("E1", "t", "d", List.of("A"));

            var results = coordinator.executeManyConcurrently("E1", List.of("A", "ghost"), recordStep());

            assertTrue(results.get(0).isSuccess());
            assertEquals(ErrorCode.UNKNOWN_ASSIGNMENT, results.get(1).error().code());
        }

        @Test
        @DisplayName("records the batch size")
        void recordsBatch() {
            coordinator.registerEpic("E1", "t", "d", List.of("A", "B"));
            coordinator.executeManyConcurrently("E1", List.of("A", "B"), recordStep());

            assertEquals(1, meterRegistry.find("branchwork.batch.size").summary().count());
            assertEquals(2, meterRegistry.find("branchwork.subtask.results")
                    .tag("status", "COMPLETED").counter().count(), 1e-9);
        }
    }

    @Test
    @DisplayName("summarize and getAssignments handle unknown epics")
    void unknownEpicQueries() {
        assertEquals(ErrorCode.UNKNOWN_EPIC, coordinator.summarize("nope").error().code());
        assertTrue(coordinator.getAssignments("nope").isEmpty());
        assertTrue(coordinator.getAssignment("nope", "A").isEmpty());
    }
}
