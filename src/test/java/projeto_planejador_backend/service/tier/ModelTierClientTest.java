package projeto_planejador_backend.service.tier;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import projeto_planejador_backend.exceptions.ModelTierException;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.ModelFailureKind;
import projeto_planejador_backend.model.ModelPrompt;
import projeto_planejador_backend.model.ModelProvider;
import projeto_planejador_backend.model.ModelReply;
import projeto_planejador_backend.model.TierSpec;
import projeto_planejador_backend.service.PlannerMetricsService;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@org.mockito.junit.jupiter.MockitoSettings(strictness = org.mockito.quality.Strictness.LENIENT)
class ModelTierClientTest {

    @Mock
    private PlannerMetricsService plannerMetricsService;

    private MockWebServer mockWebServer;
    private ModelTierClient modelTierClient;
    private TierSpec openAiTier;
    private TierSpec ollamaTier;
    private final ModelPrompt prompt = new ModelPrompt("You are a planner.",
            List.of(ConversationTurn.user("A fitness app")), 0.3, true);

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        String baseUrl = mockWebServer.url("/").toString();

        openAiTier = new TierSpec("large", 1, ModelProvider.OPENAI_COMPATIBLE, baseUrl + "openai/v1", "large-model");
        openAiTier.setApiKey("secret-key");
        openAiTier.setTimeoutSeconds(1);
        ollamaTier = new TierSpec("local", 2, ModelProvider.OLLAMA, baseUrl, "mistral");
        ollamaTier.setTimeoutSeconds(1);

        WebClient webClient = WebClient.builder().build();
        modelTierClient = new ModelTierClient(
                List.of(new OpenAiCompatibleModelBackend(webClient), new OllamaModelBackend(webClient)),
                plannerMetricsService);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void shouldCallChatCompletionsWithBearerToken() throws Exception {
        mockWebServer.enqueue(jsonResponse(200,
                "{\"model\": \"large-model\", \"choices\": [{\"index\": 0, \"message\": {\"role\": \"assistant\", \"content\": \"  {\\\"ok\\\": true}  \"}}]}"));

        ModelReply reply = modelTierClient.invoke(openAiTier, prompt);

        assertEquals("{\"ok\": true}", reply.getContent());
        assertEquals("large", reply.getTierName());
        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/openai/v1/chat/completions", request.getPath());
        assertEquals("Bearer secret-key", request.getHeader("Authorization"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"response_format\":{\"type\":\"json_object\"}"), body);
        assertTrue(body.contains("\"role\":\"system\""), body);
        verify(plannerMetricsService).recordTierCallTime(eq("large"), anyLong());
    }

    @Test
    void shouldCallOllamaChatEndpoint() throws Exception {
        mockWebServer.enqueue(jsonResponse(200,
                "{\"model\": \"mistral\", \"message\": {\"role\": \"assistant\", \"content\": \"plan\"}, \"done\": true}"));

        ModelReply reply = modelTierClient.invoke(ollamaTier, prompt);

        assertEquals("plan", reply.getContent());
        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/api/chat", request.getPath());
        assertNull(request.getHeader("Authorization"));
        assertTrue(request.getBody().readUtf8().contains("\"format\":\"json\""));
    }

    @Test
    void shouldClassifyRateLimit() {
        mockWebServer.enqueue(jsonResponse(429, "{\"error\": {\"message\": \"Rate limit reached\"}}"));

        ModelTierException exception = assertThrows(ModelTierException.class, () -> modelTierClient.invoke(openAiTier, prompt));

        assertEquals(ModelFailureKind.RATE_LIMITED, exception.getKind());
        assertEquals("large", exception.getTierName());
        verify(plannerMetricsService).recordTierFailure("large", ModelFailureKind.RATE_LIMITED);
    }

    @Test
    void shouldClassifyServerErrorAsUnavailable() {
        mockWebServer.enqueue(jsonResponse(500, "{}"));

        ModelTierException exception = assertThrows(ModelTierException.class, () -> modelTierClient.invoke(ollamaTier, prompt));

        assertEquals(ModelFailureKind.UNAVAILABLE, exception.getKind());
    }

    @Test
    void shouldClassifySlowReplyAsTimeout() {
        mockWebServer.enqueue(jsonResponse(200, "{\"choices\": []}").setBodyDelay(3, TimeUnit.SECONDS));

        ModelTierException exception = assertThrows(ModelTierException.class, () -> modelTierClient.invoke(openAiTier, prompt));

        assertEquals(ModelFailureKind.TIMEOUT, exception.getKind());
    }

    @Test
    void shouldClassifyUndecodableBodyAsMalformed() {
        mockWebServer.enqueue(jsonResponse(200, "<html>not json</html>"));

        ModelTierException exception = assertThrows(ModelTierException.class, () -> modelTierClient.invoke(ollamaTier, prompt));

        assertEquals(ModelFailureKind.MALFORMED_REPLY, exception.getKind());
    }

    @Test
    void shouldClassifyEmptyContentAsMalformed() {
        mockWebServer.enqueue(jsonResponse(200, "{\"choices\": [{\"index\": 0, \"message\": {\"role\": \"assistant\", \"content\": \"   \"}}]}"));

        ModelTierException exception = assertThrows(ModelTierException.class, () -> modelTierClient.invoke(openAiTier, prompt));

        assertEquals(ModelFailureKind.MALFORMED_REPLY, exception.getKind());
    }

    @Test
    void shouldClassifyRefusedConnectionAsUnavailable() throws IOException {
        mockWebServer.shutdown();

        ModelTierException exception = assertThrows(ModelTierException.class, () -> modelTierClient.invoke(ollamaTier, prompt));

        assertEquals(ModelFailureKind.UNAVAILABLE, exception.getKind());
    }

    @Test
    void shouldReportMissingBackendAsUnavailable() {
        ModelTierClient clientWithoutBackends = new ModelTierClient(List.of(), plannerMetricsService);

        ModelTierException exception = assertThrows(ModelTierException.class, () -> clientWithoutBackends.invoke(ollamaTier, prompt));

        assertEquals(ModelFailureKind.UNAVAILABLE, exception.getKind());
        assertEquals(0, mockWebServer.getRequestCount());
    }

    @ParameterizedTest
    @CsvSource({
            "429, RATE_LIMITED",
            "408, TIMEOUT",
            "504, TIMEOUT",
            "401, UNAVAILABLE",
            "404, UNAVAILABLE",
            "503, UNAVAILABLE"
    })
    void shouldClassifyHttpStatus(int status, ModelFailureKind expected) {
        assertEquals(expected, ModelTierClient.classifyStatus(status));
    }

    @Test
    void shouldFindTimeoutInCauseChain() {
        RuntimeException wrapped = new RuntimeException("wrapper", new TimeoutException("Did not observe any item"));

        assertEquals(ModelFailureKind.TIMEOUT, ModelTierClient.classifyTransportError(wrapped));
        assertEquals(ModelFailureKind.UNAVAILABLE, ModelTierClient.classifyTransportError(new IllegalStateException("boom")));
    }

    private static MockResponse jsonResponse(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .setBody(body)
                .addHeader("Content-Type", "application/json");
    }
}
