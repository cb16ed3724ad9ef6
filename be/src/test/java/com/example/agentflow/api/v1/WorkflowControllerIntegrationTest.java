package com.example.agentflow.api.v1;

import com.example.agentflow.StubAgentsTestConfig;
import com.example.agentflow.agent.StubAgentInvocationService;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import({WorkflowControllerIntegrationTest.RestTemplateTestConfig.class, StubAgentsTestConfig.class})
@DisplayName("Workflow API")
class WorkflowControllerIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {};

    @TestConfiguration
    static class RestTemplateTestConfig {
        @Bean
        public RestTemplate restTemplate() {
            RestTemplate rest = new RestTemplate();
            rest.setErrorHandler(new org.springframework.web.client.ResponseErrorHandler() {
                @Override
                public boolean hasError(ClientHttpResponse response) {
                    return false;
                }

                @Override
                public void handleError(java.net.URI url, HttpMethod method, ClientHttpResponse response) throws java.io.IOException {
                }
            });
            return rest;
        }
    }

    @LocalServerPort
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    @Autowired
    private StubAgentInvocationService agents;

    private UUID userId;

    @BeforeEach
    void setUp() {
        agents.reset();
        userId = UUID.randomUUID();
    }

    private String url(String path) {
        return "http://localhost:" + port + "/api/v1" + path;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(ApiHeaders.USER_ID, userId.toString());
        return headers;
    }

    private ResponseEntity<Map<String, Object>> call(HttpMethod method, String path, String body) {
        return restTemplate.exchange(url(path), method, new HttpEntity<>(body, headers()), JSON_OBJECT);
    }

    private String createAgent(String name) {
        ResponseEntity<Map<String, Object>> resp = call(HttpMethod.POST, "/agents",
                "{\"name\": \"" + name + "\", \"toolIds\": [\"time\"]}");
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return (String) resp.getBody().get("id");
    }

    private static String chain(String firstAgent, String secondAgent) {
        return """
                {
                  "name": "Research chain",
                  "parallel": false,
                  "steps": [
                    { "agentId": "%s", "message": "find sources", "stepName": "research" },
                    { "agentId": "%s", "message": "write it up", "stepName": "write", "dependsOn": ["research"] }
                  ]
                }
                """.formatted(firstAgent, secondAgent);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(Map<String, Object> body, String key) {
        return (List<Map<String, Object>>) body.get(key);
    }

    @Nested
    @DisplayName("agents")
    class Agents {

        @Test
        @DisplayName("register, list, get and pause an agent")
        void lifecycle() {
            String id = createAgent("Researcher");

            ResponseEntity<Map<String, Object>> listResp = call(HttpMethod.GET, "/agents", null);
            assertThat(listResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(list(listResp.getBody(), "agents")).singleElement()
                    .satisfies(agent -> assertThat(agent.get("id")).isEqualTo(id));

            ResponseEntity<Map<String, Object>> getResp = call(HttpMethod.GET, "/agents/" + id, null);
            assertThat(getResp.getBody().get("status")).isEqualTo("active");
            assertThat(getResp.getBody().get("toolIds")).asList().containsExactly("time");

            ResponseEntity<Map<String, Object>> pauseResp = call(HttpMethod.PUT, "/agents/" + id + "/status",
                    "{\"status\": \"paused\"}");
            assertThat(pauseResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(pauseResp.getBody().get("status")).isEqualTo("paused");
        }

        @Test
        @DisplayName("unknown tool id returns 400")
        void unknownTool() {
            ResponseEntity<Map<String, Object>> resp = call(HttpMethod.POST, "/agents",
                    "{\"name\": \"x\", \"toolIds\": [\"teleport\"]}");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody().get("message")).isEqualTo("Unknown tool id: teleport");
        }

        @Test
        @DisplayName("another user's agent returns 404")
        void foreignAgent() {
            String id = createAgent("Private");
            userId = UUID.randomUUID();
            assertThat(call(HttpMethod.GET, "/agents/" + id, null).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("workflow runs")
    class Runs {

        @Test
        @DisplayName("execute, inspect, list in history, then delete")
        void executeInspectDelete() {
            String researcher = createAgent("Researcher");
            String writer = createAgent("Writer");
            agents.respond(researcher, "three sources", "time");

            ResponseEntity<Map<String, Object>> execResp = call(HttpMethod.POST, "/workflows/execute", chain(researcher, writer));
            assertThat(execResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            Map<String, Object> run = execResp.getBody();
            assertThat(run.get("status")).isEqualTo("completed");
            String workflowId = (String) run.get("workflowId");
            assertThat(run.get("conversationId")).isEqualTo("workflow_" + workflowId);
            List<Map<String, Object>> steps = list(run, "steps");
            assertThat(steps).extracting(s -> s.get("stepName")).containsExactly("research", "write");
            assertThat(steps.get(0).get("toolsUsed")).asList().containsExactly("time");
            assertThat((String) steps.get(1).get("message")).contains("Context from research: three sources");

            ResponseEntity<Map<String, Object>> details = call(HttpMethod.GET, "/workflows/" + workflowId, null);
            assertThat(details.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(details.getBody().get("workflowName")).isEqualTo("Research chain");
            assertThat(list(details.getBody(), "steps")).extracting(s -> s.get("status")).containsOnly("success");

            ResponseEntity<Map<String, Object>> status = call(HttpMethod.GET, "/workflows/" + workflowId + "/status", null);
            assertThat(status.getBody().get("status")).isEqualTo("completed");
            assertThat(status.getBody().get("stepCount")).isEqualTo(2);
            assertThat(status.getBody().get("completedSteps")).isEqualTo(2);

            ResponseEntity<Map<String, Object>> history = call(HttpMethod.GET, "/workflows/history?limit=10", null);
            assertThat(list(history.getBody(), "workflows")).singleElement()
                    .satisfies(item -> assertThat(item.get("workflowId")).isEqualTo(workflowId));

            ResponseEntity<Void> deleteResp = restTemplate.exchange(url("/workflows/" + workflowId), HttpMethod.DELETE,
                    new HttpEntity<>(headers()), Void.class);
            assertThat(deleteResp.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
            assertThat(call(HttpMethod.GET, "/workflows/" + workflowId, null).getStatusCode())
                    .isEqualTo(HttpStatus.NOT_FOUND);
        }

        @Test
        @DisplayName("simple chain runs every agent on the same message")
        void simpleChain() {
            String first = createAgent("First");
            String second = createAgent("Second");

            ResponseEntity<Map<String, Object>> resp = call(HttpMethod.POST, "/workflows/simple-chain", """
                    { "agentIds": ["%s", "%s"], "message": "hello", "parallel": true }
                    """.formatted(first, second));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody().get("workflowName")).isEqualTo("Simple Chain - 2 agents");
            assertThat(list(resp.getBody(), "steps")).extracting(s -> s.get("message")).containsOnly("hello");
        }

        @Test
        @DisplayName("cancelling a finished workflow is accepted but reports nothing cancelled")
        void cancelFinished() {
            String agent = createAgent("Solo");
            String workflowId = (String) call(HttpMethod.POST, "/workflows/simple-chain",
                    "{\"agentIds\": [\"" + agent + "\"], \"message\": \"hi\"}").getBody().get("workflowId");

            ResponseEntity<Map<String, Object>> resp = call(HttpMethod.POST, "/workflows/" + workflowId + "/cancel", null);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
            assertThat(resp.getBody().get("cancelled")).isEqualTo(false);
        }
    }

    @Nested
    @DisplayName("templates")
    class Templates {

        @Test
        @DisplayName("lists the bundled templates")
        void listTemplates() {
            ResponseEntity<Map<String, Object>> resp = call(HttpMethod.GET, "/workflows/templates", null);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(list(resp.getBody(), "templates")).extracting(t -> t.get("key"))
                    .containsExactly("code_review_workflow", "github_to_slack");
        }

        @Test
        @DisplayName("runs a template with agent params")
        void executeTemplate() {
            String github = createAgent("GitHub");
            String slack = createAgent("Slack");

            ResponseEntity<Map<String, Object>> resp = call(HttpMethod.POST, "/workflows/templates/code_review_workflow", """
                    { "params": { "github_agent_id": "%s", "slack_agent_id": "%s" } }
                    """.formatted(github, slack));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody().get("workflowName")).isEqualTo("Code Review Workflow");
            assertThat(list(resp.getBody(), "steps")).extracting(s -> s.get("stepName"))
                    .containsExactly("get_commits", "notify_reviewers");
        }

        @Test
        @DisplayName("missing params return 400 and unknown templates 404")
        void templateErrors() {
            ResponseEntity<Map<String, Object>> missing = call(HttpMethod.POST, "/workflows/templates/github_to_slack", null);
            assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat((String) missing.getBody().get("message"))
                    .contains("Missing required parameters: [github_agent_id, slack_agent_id]");

            ResponseEntity<Map<String, Object>> unknown = call(HttpMethod.POST, "/workflows/templates/nope", "{}");
            assertThat(unknown.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat((String) unknown.getBody().get("message")).startsWith("Template 'nope' not found");
        }
    }

    @Nested
    @DisplayName("error handling")
    class ErrorHandling {

        @Test
        @DisplayName("missing X-User-Id returns 400")
        void missingUserHeader() {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(url("/workflows/history"), HttpMethod.GET,
                    new HttpEntity<>(headers), JSON_OBJECT);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody().get("message")).isEqualTo("Missing required header: X-User-Id");
        }

        @Test
        @DisplayName("invalid definition returns 400 with every error and persists nothing")
        void invalidDefinition() {
            String agent = createAgent("Solo");
            ResponseEntity<Map<String, Object>> resp = call(HttpMethod.POST, "/workflows/execute", """
                    {
                      "name": "bad",
                      "steps": [
                        { "agentId": "%s", "message": " ", "stepName": "a", "dependsOn": ["ghost"] },
                        { "agentId": "%s", "message": "x", "stepName": "b" }
                      ]
                    }
                    """.formatted(agent, UUID.randomUUID()));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(list(resp.getBody(), "errors")).extracting(e -> e.get("field"))
                    .containsExactlyInAnyOrder("steps[0].message", "steps[1].agentId", "steps[0].dependsOn");
            assertThat(list(call(HttpMethod.GET, "/workflows/history", null).getBody(), "workflows")).isEmpty();
        }

        @Test
        @DisplayName("unknown workflow returns 404 and malformed id 400")
        void unknownWorkflow() {
            assertThat(call(HttpMethod.GET, "/workflows/" + UUID.randomUUID(), null).getStatusCode())
                    .isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(call(HttpMethod.GET, "/workflows/not-a-uuid", null).getStatusCode())
                    .isEqualTo(HttpStatus.BAD_REQUEST);
        }
    }

    @Nested
    @DisplayName("service endpoints")
    class ServiceEndpoints {

        @Test
        @DisplayName("health reports UP")
        void health() {
            ResponseEntity<Map<String, Object>> resp = call(HttpMethod.GET, "/health", null);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).containsEntry("status", "UP");
        }

        @Test
        @DisplayName("tools lists the registered tools")
        void tools() {
            ResponseEntity<List<Map<String, Object>>> resp = restTemplate.exchange(url("/tools"), HttpMethod.GET,
                    null, new ParameterizedTypeReference<>() {});
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).extracting(t -> t.get("id")).containsExactly("time", "word_count");
        }
    }
}
