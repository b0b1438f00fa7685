package projeto_planejador_backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import projeto_planejador_backend.config.PlannerProperties;
import projeto_planejador_backend.exceptions.ModelTierException;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.ModelFailureKind;
import projeto_planejador_backend.model.ModelPrompt;
import projeto_planejador_backend.model.ModelProvider;
import projeto_planejador_backend.model.ModelReply;
import projeto_planejador_backend.model.SufficiencyResult;
import projeto_planejador_backend.model.TierSpec;
import projeto_planejador_backend.service.tier.ModelTierClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@org.mockito.junit.jupiter.MockitoSettings(strictness = org.mockito.quality.Strictness.LENIENT)
class SufficiencyEstimatorServiceTest {

    private static final String TIMELINE_QUESTION = "What's your timeline for this project? (e.g., 6 weeks, 3 months, 1 year)";

    @Mock
    private ModelTierClient modelTierClient;

    @Mock
    private PlannerMetricsService plannerMetricsService;

    private PlannerProperties plannerProperties;
    private SufficiencyEstimatorService sufficiencyEstimatorService;

    @BeforeEach
    void setUp() {
        plannerProperties = new PlannerProperties();
        plannerProperties.setTiers(new ArrayList<>(List.of(
                new TierSpec("large", 1, ModelProvider.OPENAI_COMPATIBLE, "http://large", "large-model"),
                new TierSpec("local", 2, ModelProvider.OLLAMA, "http://local", "local-model"))));
        PromptSanitizer promptSanitizer = new PromptSanitizer();
        sufficiencyEstimatorService = new SufficiencyEstimatorService(
                modelTierClient,
                new PromptBuilderService(promptSanitizer, plannerProperties, Clock.systemUTC()),
                promptSanitizer,
                new SufficiencyHeuristic(),
                new QuestionLoopDetector(plannerProperties),
                plannerProperties,
                plannerMetricsService,
                new ObjectMapper());
    }

    @Test
    void shouldReturnModelJudgment() {
        replyWith("{\"score\": 25, \"nextPrompt\": \"" + TIMELINE_QUESTION + "\", \"isSufficient\": false}");

        SufficiencyResult result = sufficiencyEstimatorService.evaluate(List.of(ConversationTurn.user("I want a fitness app")));

        assertEquals(25, result.getScore());
        assertFalse(result.isSufficient());
        assertEquals(TIMELINE_QUESTION, result.getNextPrompt());
        verify(plannerMetricsService, never()).recordSufficiencyFallback();
    }

    @Test
    void shouldAnswerEmptyTranscriptWithoutCallingModel() {
        SufficiencyResult result = sufficiencyEstimatorService.evaluate(List.of());

        assertEquals(0, result.getScore());
        assertFalse(result.isSufficient());
        assertEquals(SufficiencyHeuristic.OPENING_QUESTION, result.getNextPrompt());
        verify(modelTierClient, never()).invoke(any(), any());
    }

    @Test
    void shouldFallBackToHeuristicWhenTierFails() {
        when(modelTierClient.invoke(any(), any()))
                .thenThrow(new ModelTierException("large", ModelFailureKind.RATE_LIMITED, "429"));

        SufficiencyResult result = sufficiencyEstimatorService.evaluate(List.of(ConversationTurn.user("I want to build a mobile fitness app")));

        assertEquals(25, result.getScore());
        assertFalse(result.isSufficient());
        assertEquals(SufficiencyHeuristic.RubricItem.TIMELINE.question(), result.getNextPrompt());
        verify(plannerMetricsService).recordSufficiencyFallback();
    }

    @Test
    void shouldFallBackToHeuristicWhenReplyIsUnparseable() {
        replyWith("I think you should tell me more about the project.");

        SufficiencyResult result = sufficiencyEstimatorService.evaluate(List.of(ConversationTurn.user("I want to build a mobile fitness app")));

        assertEquals(25, result.getScore());
        verify(plannerMetricsService).recordSufficiencyFallback();
    }

    @Test
    void shouldUseConfiguredEstimatorTier() {
        plannerProperties.getSufficiency().setTierName("local");
        replyWith("{\"score\": 10, \"nextPrompt\": \"What are you building?\"}");

        sufficiencyEstimatorService.evaluate(List.of(ConversationTurn.user("hi, I need a plan")));

        ArgumentCaptor<TierSpec> tierCaptor = ArgumentCaptor.forClass(TierSpec.class);
        verify(modelTierClient, times(1)).invoke(tierCaptor.capture(), any(ModelPrompt.class));
        assertEquals("local", tierCaptor.getValue().getName());
    }

    @Test
    void shouldForceGenerationWhenQuestionKeepsRepeating() {
        replyWith("{\"score\": 25, \"nextPrompt\": \"" + TIMELINE_QUESTION + "\", \"isSufficient\": false}");
        List<ConversationTurn> transcript = new ArrayList<>(List.of(ConversationTurn.user("I want a fitness app")));

        SufficiencyResult first = sufficiencyEstimatorService.evaluate(transcript);
        assertFalse(first.isSufficient());

        SufficiencyResult last = first;
        int evaluations = 1;
        while (!last.isSufficient() && evaluations < 4) {
            transcript.add(ConversationTurn.assistant(last.getNextPrompt()));
            transcript.add(ConversationTurn.user("I'm not sure"));
            last = sufficiencyEstimatorService.evaluate(transcript);
            evaluations++;
        }

        assertTrue(last.isSufficient());
        assertTrue(evaluations <= 4);
        assertEquals(25, last.getScore());
        assertEquals(SufficiencyHeuristic.CONCLUDING_STATEMENT, last.getNextPrompt());
        verify(plannerMetricsService).recordQuestionLoop();
    }

    @Test
    void shouldLetScoreDecreaseAcrossTurns() {
        when(modelTierClient.invoke(any(), any()))
                .thenThrow(new ModelTierException("large", ModelFailureKind.UNAVAILABLE, "down"));
        List<ConversationTurn> transcript = new ArrayList<>(List.of(
                ConversationTurn.user("I want to build a mobile fitness app in 3 months")));

        int before = sufficiencyEstimatorService.evaluate(transcript).getScore();
        transcript.add(ConversationTurn.assistant("Which key features should it include? (e.g., user login, online payments, progress charts)"));
        transcript.add(ConversationTurn.user("Actually, forget the deadline"));
        int after = sufficiencyEstimatorService.evaluate(transcript).getScore();

        assertTrue(after < before, before + " -> " + after);
    }

    @Test
    void shouldAddConcludingStatementWhenSufficientReplyHasNoPrompt() {
        replyWith("{\"score\": 100, \"isSufficient\": true}");

        SufficiencyResult result = sufficiencyEstimatorService.evaluate(List.of(ConversationTurn.user("everything is defined")));

        assertTrue(result.isSufficient());
        assertEquals(SufficiencyHeuristic.CONCLUDING_STATEMENT, result.getNextPrompt());
    }

    @Test
    void shouldParseLegacyFieldNamesAndClampScore() {
        Optional<SufficiencyResult> result = sufficiencyEstimatorService.parse(
                "```json\n{\"progress\": 140, \"assistantReply\": \"All set, generate whenever you like.\"}\n```");

        assertTrue(result.isPresent());
        assertEquals(100, result.get().getScore());
        assertTrue(result.get().isSufficient());
        assertEquals("All set, generate whenever you like.", result.get().getNextPrompt());
    }

    @Test
    void shouldParseTextualScoreAndClampNegative() {
        assertEquals(60, sufficiencyEstimatorService.parse("{\"score\": \"60\", \"nextPrompt\": \"Q?\"}").orElseThrow().getScore());
        assertEquals(0, sufficiencyEstimatorService.parse("{\"score\": -5, \"nextPrompt\": \"Q?\"}").orElseThrow().getScore());
        assertEquals(100, sufficiencyEstimatorService.parse("{\"score\": \"99999999999\", \"nextPrompt\": \"Q?\"}").orElseThrow().getScore());
        assertEquals(100, sufficiencyEstimatorService.parse("{\"score\": 99999999999999999999999, \"nextPrompt\": \"Q?\"}").orElseThrow().getScore());
        assertEquals(0, sufficiencyEstimatorService.parse("{\"score\": -99999999999, \"nextPrompt\": \"Q?\"}").orElseThrow().getScore());
        assertEquals(42, sufficiencyEstimatorService.parse("{\"score\": 42.9, \"nextPrompt\": \"Q?\"}").orElseThrow().getScore());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"99999999999\"", "\"000000000000000000000000000100\"", "99999999999", "-2147483649", "1e400", "-1e400", "1.7976931348623157E308"})
    void shouldKeepScoreInRangeForOversizedModelScores(String score) {
        replyWith("{\"score\": " + score + ", \"nextPrompt\": \"What is the timeline?\"}");

        SufficiencyResult result = assertDoesNotThrow(
                () -> sufficiencyEstimatorService.evaluate(List.of(ConversationTurn.user("build an app"))));

        assertTrue(result.getScore() >= 0 && result.getScore() <= 100, "score " + result.getScore());
    }

    @Test
    void shouldFallBackToHeuristicWhenScoreIsNotFinite() {
        replyWith("{\"score\": 1e400, \"nextPrompt\": \"What is the timeline?\"}");

        sufficiencyEstimatorService.evaluate(List.of(ConversationTurn.user("build an app")));

        verify(plannerMetricsService).recordSufficiencyFallback();
    }

    @Test
    void shouldRejectReplyWithoutQuestionOrDecision() {
        assertTrue(sufficiencyEstimatorService.parse("{\"score\": 40}").isEmpty());
        assertTrue(sufficiencyEstimatorService.parse("{\"nextPrompt\": \"Q?\"}").isEmpty());
        assertTrue(sufficiencyEstimatorService.parse("not json").isEmpty());
    }

    private void replyWith(String content) {
        when(modelTierClient.invoke(any(), any()))
                .thenAnswer(invocation -> {
                    TierSpec tier = invocation.getArgument(0);
                    return new ModelReply(tier.getName(), tier.getModel(), content, 5L);
                });
    }
}
