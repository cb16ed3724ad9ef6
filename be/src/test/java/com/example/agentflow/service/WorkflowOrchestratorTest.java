package com.example.agentflow.service;

import com.example.agentflow.StubAgentsTestConfig;
import com.example.agentflow.agent.AgentReply;
import com.example.agentflow.agent.StubAgentInvocationService;
import com.example.agentflow.api.TemplateNotFoundException;
import com.example.agentflow.api.WorkflowNotFoundException;
import com.example.agentflow.api.v1.dto.AgentCreateRequest;
import com.example.agentflow.api.v1.dto.SimpleChainRequest;
import com.example.agentflow.api.v1.dto.TemplateExecuteRequest;
import com.example.agentflow.api.v1.dto.WorkflowExecuteRequest;
import com.example.agentflow.api.v1.dto.WorkflowHistoryItem;
import com.example.agentflow.api.v1.dto.WorkflowResponse;
import com.example.agentflow.api.v1.dto.WorkflowStatusResponse;
import com.example.agentflow.api.v1.dto.WorkflowStepRequest;
import com.example.agentflow.api.v1.dto.WorkflowStepResultDto;
import com.example.agentflow.domain.AgentStatus;
import com.example.agentflow.domain.StepStatus;
import com.example.agentflow.domain.WorkflowStatus;
import com.example.agentflow.orchestration.OrchestrationException;
import com.example.agentflow.repository.WorkflowStepRepository;
import com.example.agentflow.validation.WorkflowValidationException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(StubAgentsTestConfig.class)
@DisplayName("WorkflowOrchestrator")
class WorkflowOrchestratorTest {

    @Autowired
    private WorkflowOrchestrator orchestrator;

    @Autowired
    private WorkflowQueryService queries;

    @Autowired
    private AgentDirectoryService agentDirectory;

    @Autowired
    private StubAgentInvocationService agents;

    @Autowired
    private WorkflowStepRepository stepRepository;

    private UUID owner;

    @BeforeEach
    void setUp() {
        agents.reset();
        owner = UUID.randomUUID();
    }

    private String newAgent(String name) {
        return agentDirectory.registerAgent(owner, new AgentCreateRequest(name, null, null, List.of())).id().toString();
    }

    private static WorkflowStepRequest step(String agentId, String message, String name, String... dependsOn) {
        return new WorkflowStepRequest(agentId, message, name, List.of(dependsOn));
    }

    private int historySize() {
        return queries.getWorkflowHistory(owner, 200).workflows().size();
    }

    @Nested
    @DisplayName("sequential runs")
    class Sequential {

        @Test
        @DisplayName("linear chain completes in order and feeds each response downstream")
        void linearChain() {
            String a1 = newAgent("one");
            String a2 = newAgent("two");
            String a3 = newAgent("three");
            agents.respond(a1, "alpha").respond(a2, "beta").respond(a3, "gamma");

            WorkflowResponse response = orchestrator.executeWorkflow(new WorkflowExecuteRequest("chain", List.of(
                    step(a1, "start", "s1"),
                    step(a2, "continue", "s2", "s1"),
                    step(a3, "finish", "s3", "s2")), false), owner);

            assertThat(response.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(response.conversationId()).isEqualTo("workflow_" + response.workflowId());
            assertThat(response.steps()).extracting(WorkflowStepResultDto::stepName).containsExactly("s1", "s2", "s3");
            assertThat(response.steps().get(1).message()).contains("alpha");
            assertThat(response.steps().get(2).message()).contains("beta");
            assertThat(response.totalExecutionTime()).isGreaterThan(0.0);

            WorkflowResponse details = queries.getWorkflowDetails(response.workflowId(), owner);
            assertThat(details.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(details.steps()).extracting(WorkflowStepResultDto::status).containsOnly(StepStatus.SUCCESS);
            assertThat(details.steps().get(1).message()).isEqualTo("continue");
            assertThat(details.steps().get(2).response()).isEqualTo("gamma");
        }

        @Test
        @DisplayName("failed dependency skips the downstream step and yields partial success")
        void failedDependency() {
            String a1 = newAgent("one");
            String a2 = newAgent("two");
            agents.fail(a1, "backend unavailable");

            WorkflowResponse response = orchestrator.executeWorkflow(new WorkflowExecuteRequest("broken", List.of(
                    step(a1, "start", "s1"),
                    step(a2, "continue", "s2", "s1")), false), owner);

            assertThat(response.status()).isEqualTo(WorkflowStatus.PARTIAL_SUCCESS);
            assertThat(response.steps().get(0).error()).isEqualTo("backend unavailable");
            assertThat(response.steps().get(1).status()).isEqualTo(StepStatus.SKIPPED);
            assertThat(response.steps().get(1).error()).contains("s1");

            WorkflowStatusResponse status = queries.getWorkflowStatus(response.workflowId(), owner);
            assertThat(status.stepCount()).isEqualTo(2);
            assertThat(status.completedSteps()).isZero();
            assertThat(status.failedSteps()).isEqualTo(1);
            assertThat(status.skippedSteps()).isEqualTo(1);
        }

        @Test
        @DisplayName("every step failing marks the workflow failed")
        void allFailed() {
            String a1 = newAgent("one");
            agents.fail(a1, "nope");

            WorkflowResponse response = orchestrator.executeWorkflow(
                    new WorkflowExecuteRequest("doomed", List.of(step(a1, "x", null), step(a1, "y", null)), false), owner);

            assertThat(response.status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(queries.getWorkflowDetails(response.workflowId(), owner).status()).isEqualTo(WorkflowStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("parallel runs")
    class Parallel {

        @Test
        @DisplayName("independent steps overlap so total time stays below the sum of step times")
        void independentStepsOverlap() {
            String a1 = newAgent("one");
            String a2 = newAgent("two");
            CountDownLatch bothStarted = new CountDownLatch(2);
            agents.answer(a1, message -> rendezvous(bothStarted, "one"));
            agents.answer(a2, message -> rendezvous(bothStarted, "two"));

            WorkflowResponse response = orchestrator.executeWorkflow(new WorkflowExecuteRequest("fan-out", List.of(
                    step(a1, "left", "s1"),
                    step(a2, "right", "s2")), true), owner);

            assertThat(response.status()).isEqualTo(WorkflowStatus.COMPLETED);
            double sum = response.steps().stream().mapToDouble(WorkflowStepResultDto::executionTime).sum();
            assertThat(response.totalExecutionTime()).isLessThan(sum);
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("rejects 51 steps without persisting anything")
        void tooManySteps() {
            String a1 = newAgent("one");
            List<WorkflowStepRequest> steps = IntStream.range(0, 51).mapToObj(i -> step(a1, "m", null)).toList();

            assertThatThrownBy(() -> orchestrator.executeWorkflow(new WorkflowExecuteRequest("big", steps, false), owner))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("cannot have more than 50 steps");
            assertThat(historySize()).isZero();
            assertThat(agents.invocations()).isEmpty();
        }

        @Test
        @DisplayName("rejects another user's agent and names it")
        void foreignAgent() {
            String foreign = agentDirectory.registerAgent(UUID.randomUUID(),
                    new AgentCreateRequest("theirs", null, null, null)).id().toString();

            assertThatThrownBy(() -> orchestrator.executeWorkflow(
                    new WorkflowExecuteRequest("stolen", List.of(step(foreign, "hi", "s1")), false), owner))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("Agent " + foreign + " not found or not accessible");
            assertThat(historySize()).isZero();
        }

        @Test
        @DisplayName("rejects paused agents")
        void pausedAgent() {
            String a1 = newAgent("one");
            agentDirectory.updateStatus(UUID.fromString(a1), owner, AgentStatus.PAUSED);

            assertThatThrownBy(() -> orchestrator.executeWorkflow(
                    new WorkflowExecuteRequest("paused", List.of(step(a1, "hi", "s1")), false), owner))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("is not active (status: paused)");
        }

        @Test
        @DisplayName("accepts the same agent written in different letter case")
        void agentIdCase() {
            String a1 = newAgent("one");
            String upper = a1.toUpperCase(Locale.ROOT);

            assertThat(agentDirectory.resolveStatuses(owner, List.of(a1, upper)))
                    .containsEntry(a1, AgentStatus.ACTIVE)
                    .containsEntry(upper, AgentStatus.ACTIVE);

            WorkflowResponse response = orchestrator.executeWorkflow(new WorkflowExecuteRequest("mixed case", List.of(
                    step(a1, "x", "s1"),
                    step(upper, "y", "s2")), false), owner);

            assertThat(response.status()).isEqualTo(WorkflowStatus.COMPLETED);
        }

        @Test
        @DisplayName("rejects cycles without persisting anything")
        void cycle() {
            String a1 = newAgent("one");

            assertThatThrownBy(() -> orchestrator.executeWorkflow(new WorkflowExecuteRequest("loop", List.of(
                    step(a1, "x", "s1", "s2"),
                    step(a1, "y", "s2", "s1")), false), owner))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("Circular dependencies detected in workflow");
            assertThat(historySize()).isZero();
        }
    }

    @Nested
    @DisplayName("simple chains and templates")
    class ChainsAndTemplates {

        @Test
        @DisplayName("sequential simple chain makes every step depend on all earlier ones")
        void simpleChain() {
            String a1 = newAgent("one");
            String a2 = newAgent("two");
            agents.respond(a1, "first answer");

            WorkflowResponse response = orchestrator.executeSimpleChain(
                    new SimpleChainRequest(List.of(a1, a2), "summarize", null, false), owner);

            assertThat(response.workflowName()).isEqualTo("Simple Chain - 2 agents");
            assertThat(response.steps()).extracting(WorkflowStepResultDto::stepName).containsExactly("step_1", "step_2");
            assertThat(response.steps().get(1).message()).isEqualTo("summarize\n\nContext from step_1: first answer");
        }

        @Test
        @DisplayName("simple chain needs agents and a message")
        void simpleChainValidation() {
            assertThatThrownBy(() -> orchestrator.executeSimpleChain(
                    new SimpleChainRequest(List.of(), " ", "x", true), owner))
                    .isInstanceOfSatisfying(WorkflowValidationException.class,
                            e -> assertThat(e.getErrors()).hasSize(2));
        }

        @Test
        @DisplayName("templates are loaded at startup and run sequentially with agents from params")
        void template() {
            String github = newAgent("github");
            String slack = newAgent("slack");
            agents.respond(github, "repo list");

            assertThat(orchestrator.listTemplates()).extracting(WorkflowTemplate::key)
                    .containsExactly("code_review_workflow", "github_to_slack");

            WorkflowResponse response = orchestrator.executeTemplate("github_to_slack", new TemplateExecuteRequest(
                    Map.of("github_agent_id", github, "slack_agent_id", slack), null), owner);

            assertThat(response.workflowName()).isEqualTo("GitHub to Slack Integration");
            assertThat(response.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(response.steps()).extracting(WorkflowStepResultDto::stepName)
                    .containsExactly("fetch_repos", "send_to_slack");
            assertThat(agents.invocationsOf(slack)).singleElement()
                    .satisfies(call -> assertThat(call.message()).startsWith("Send the repository information to Slack")
                            .contains("Context from fetch_repos: repo list"));
        }

        @Test
        @DisplayName("template execution reports missing params and unknown templates")
        void templateErrors() {
            assertThatThrownBy(() -> orchestrator.executeTemplate("github_to_slack",
                    new TemplateExecuteRequest(Map.of("github_agent_id", "x"), null), owner))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("Missing required parameters: [slack_agent_id]");
            assertThatThrownBy(() -> orchestrator.executeTemplate("nope", new TemplateExecuteRequest(null, null), owner))
                    .isInstanceOf(TemplateNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("queries, cancellation and deletion")
    class Lifecycle {

        @Test
        @DisplayName("history lists newest first and honours the limit")
        void history() {
            String a1 = newAgent("one");
            WorkflowResponse first = orchestrator.executeWorkflow(
                    new WorkflowExecuteRequest("first", List.of(step(a1, "x", null)), false), owner);
            WorkflowResponse second = orchestrator.executeWorkflow(
                    new WorkflowExecuteRequest("second", List.of(step(a1, "x", null), step(a1, "y", null)), false), owner);

            List<WorkflowHistoryItem> all = queries.getWorkflowHistory(owner, null).workflows();
            assertThat(all).extracting(WorkflowHistoryItem::workflowId)
                    .containsExactly(second.workflowId(), first.workflowId());
            assertThat(all.get(0).stepCount()).isEqualTo(2);
            assertThat(queries.getWorkflowHistory(owner, 1).workflows()).hasSize(1);
            assertThat(queries.getWorkflowHistory(owner, 0).workflows()).hasSize(1);
        }

        @ParameterizedTest(name = "parallel={0}")
        @ValueSource(booleans = {false, true})
        @DisplayName("a persistence failure mid-run marks the workflow failed and surfaces as an orchestration error")
        void persistenceFailureMidRun(boolean parallel) {
            String a1 = newAgent("one");
            agents.answer(a1, message -> {
                UUID running = queries.getWorkflowHistory(owner, null).workflows().get(0).workflowId();
                stepRepository.deleteAllInBatch(stepRepository.findByWorkflowIdOrderByPositionAsc(running));
                return new AgentReply("done", List.of(), null);
            });

            assertThatThrownBy(() -> orchestrator.executeWorkflow(
                    new WorkflowExecuteRequest("doomed", List.of(step(a1, "x", "s1")), parallel), owner))
                    .isInstanceOf(OrchestrationException.class)
                    .isNotInstanceOf(WorkflowValidationException.class);

            UUID workflowId = queries.getWorkflowHistory(owner, null).workflows().get(0).workflowId();
            WorkflowStatusResponse status = queries.getWorkflowStatus(workflowId, owner);
            assertThat(status.status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(status.totalExecutionTime()).isNotNull().isGreaterThan(0.0);
            assertThat(queries.getWorkflowDetails(workflowId, owner).status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(orchestrator.cancelWorkflow(workflowId, owner)).isFalse();
        }

        @Test
        @DisplayName("other users cannot see a workflow")
        void ownerScoped() {
            String a1 = newAgent("one");
            WorkflowResponse response = orchestrator.executeWorkflow(
                    new WorkflowExecuteRequest("mine", List.of(step(a1, "x", null)), false), owner);

            assertThatThrownBy(() -> queries.getWorkflowDetails(response.workflowId(), UUID.randomUUID()))
                    .isInstanceOf(WorkflowNotFoundException.class);
            assertThatThrownBy(() -> queries.getWorkflowStatus(response.workflowId(), UUID.randomUUID()))
                    .isInstanceOf(WorkflowNotFoundException.class);
        }

        @Test
        @DisplayName("a running workflow shows live progress, can be cancelled and is deleted afterwards")
        void cancelRunningWorkflow() throws Exception {
            String slow = newAgent("slow");
            String next = newAgent("next");
            CountDownLatch started = new CountDownLatch(1);
            agents.answer(slow, message -> {
                started.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new AgentReply("late", List.of(), null);
            });

            CompletableFuture<WorkflowResponse> pending = CompletableFuture.supplyAsync(() -> orchestrator.executeWorkflow(
                    new WorkflowExecuteRequest("slow", List.of(step(slow, "wait", "s1"), step(next, "go", "s2")), false), owner));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            UUID workflowId = queries.getWorkflowHistory(owner, null).workflows().get(0).workflowId();
            WorkflowStatusResponse live = queries.getWorkflowStatus(workflowId, owner);
            assertThat(live.status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThatThrownBy(() -> queries.deleteWorkflow(workflowId, owner))
                    .isInstanceOf(WorkflowValidationException.class);

            assertThat(orchestrator.cancelWorkflow(workflowId, owner)).isTrue();
            WorkflowResponse response = pending.get(10, TimeUnit.SECONDS);

            assertThat(response.steps().get(0).status()).isEqualTo(StepStatus.ERROR);
            assertThat(response.steps().get(0).error()).isEqualTo("Step cancelled");
            assertThat(response.steps().get(1).status()).isEqualTo(StepStatus.SKIPPED);
            assertThat(response.steps().get(1).error()).isEqualTo("Workflow cancelled");
            assertThat(response.status()).isEqualTo(WorkflowStatus.PARTIAL_SUCCESS);
            assertThat(orchestrator.cancelWorkflow(workflowId, owner)).isFalse();

            queries.deleteWorkflow(workflowId, owner);
            assertThatThrownBy(() -> queries.getWorkflowDetails(workflowId, owner))
                    .isInstanceOf(WorkflowNotFoundException.class);
        }
    }

    private static AgentReply rendezvous(CountDownLatch latch, String response) {
        latch.countDown();
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("steps did not overlap");
            }
            Thread.sleep(200);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return new AgentReply(response, List.of(), null);
    }
}
