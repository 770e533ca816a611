package com.branchwork.dispatch.cli;

import com.branchwork.core.branch.ReasoningState;
import com.branchwork.core.coordinator.EpicCoordinator;
import com.branchwork.core.coordinator.SubIssueAssignment;
import com.branchwork.core.coordinator.WorkFunction;
import com.branchwork.core.events.EventBus;
import com.branchwork.core.events.OrchestrationEvent;
import com.branchwork.core.result.ErrorCode;
import com.branchwork.core.result.Result;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * CLI command: branchwork run --epic E --sub-tasks A,B,C
 * <p>
 * Registers an epic and runs all of its sub-tasks concurrently with a simulated work function
 * that records a draft and a final reasoning step on each sub-task's branch. Sub-tasks listed
 * in {@code --fail} throw instead, which shows how one failure stays isolated from its siblings.
 * <p>
 * Start, completion and failure of each sub-task are printed as they happen. {@code --follow}
 * narrows that stream to the listed sub-tasks.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Register an epic and run its sub-tasks")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--epic", "-e"}, required = true, description = "Epic id")
    private String epicId;

    @Option(names = {"--title", "-t"}, defaultValue = "", description = "Epic title")
    private String title;

    @Option(names = {"--sub-tasks", "-s"}, required = true, split = ",", description = "Comma-separated sub-task ids")
    private List<String> subTaskIds = new ArrayList<>();

    @Option(names = "--fail", split = ",", description = "Sub-task ids whose work should fail")
    private Set<String> failing = new LinkedHashSet<>();

    @Option(names = "--delay-ms", defaultValue = "100", description = "Simulated work time per sub-task")
    private long delayMs;

    @Option(names = "--follow", split = ",", description = "Only stream events of these sub-task ids")
    private List<String> followed = new ArrayList<>();

    private final EpicCoordinator coordinator;
    private final EventBus eventBus;

    public RunCommand(EpicCoordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var registered = coordinator.registerEpic(epicId, title, "", subTaskIds);
        if (registered.isFailure()) {
            ConsoleOutput.error("Could not register epic: " + registered.error());
            return 2;
        }
        ConsoleOutput.info("Epic " + epicId + " registered with " + subTaskIds.size() + " sub-task(s), max "
                + coordinator.config().maxConcurrentSubTasks() + " in parallel");

        List<EventBus.Subscription> subscriptions = streamProgress();
        List<Result<SubIssueAssignment>> results;
        try {
            results = coordinator.executeManyConcurrently(epicId, subTaskIds, simulatedWork());
        } finally {
            subscriptions.forEach(EventBus.Subscription::unsubscribe);
        }

        for (int i = 0; i < subTaskIds.size(); i++) {
            String subTaskId = subTaskIds.get(i);
            var result = results.get(i);
            var assignment = coordinator.getAssignment(epicId, subTaskId).orElse(null);
            if (assignment == null) {
                ConsoleOutput.error(subTaskId + ": " + result.error());
                continue;
            }
            String detail = result.isSuccess()
                    ? assignment.branch().size() + " event(s) on " + assignment.branchName()
                    : result.error().message();
            ConsoleOutput.subTaskResult(subTaskId, assignment.status(), detail);
        }

        var progress = coordinator.summarize(epicId).value();
        ConsoleOutput.progress(progress);
        return progress.failures().isEmpty() ? 0 : 1;
    }

    private List<EventBus.Subscription> streamProgress() {
        Consumer<OrchestrationEvent> printer = ConsoleOutput::subTaskEvent;
        if (followed.isEmpty()) {
            return List.of(eventBus.subscribe(epicId, printer));
        }
        var subscriptions = new ArrayList<EventBus.Subscription>(followed.size());
        for (String subTaskId : followed) {
            subscriptions.add(eventBus.subscribeSubTask(epicId, subTaskId, printer));
        }
        return subscriptions;
    }

    private WorkFunction simulatedWork() {
        return (assignment, signal) -> {
            ConsoleOutput.agent(assignment.assignedAgentId(), "working on " + assignment.subTaskId());
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
            if (failing.contains(assignment.subTaskId())) {
                throw new IllegalStateException("Simulated failure in sub-task " + assignment.subTaskId());
            }
            if (signal.isCancelled()) {
                return Result.failure(ErrorCode.CANCELLED, "Cancelled during " + assignment.subTaskId());
            }
            var branch = assignment.branch()
                    .withReasoningStep(ReasoningState.draft("Plan for " + assignment.subTaskId()),
                            assignment.description())
                    .withReasoningStep(ReasoningState.finalSpec("Done: " + assignment.subTaskId()),
                            assignment.description());
            return Result.<SubIssueAssignment>success(assignment.withBranch(branch));
        };
    }
}
