package projeto_planejador_backend.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import projeto_planejador_backend.config.PlannerProperties;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.ModelPrompt;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderServiceTest {

    private PlannerProperties plannerProperties;
    private PromptBuilderService promptBuilderService;

    @BeforeEach
    void setUp() {
        plannerProperties = new PlannerProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-03-14T10:00:00Z"), ZoneOffset.UTC);
        promptBuilderService = new PromptBuilderService(new PromptSanitizer(), plannerProperties, clock);
    }

    @Test
    void shouldBuildSufficiencyPromptWithChatTemperature() {
        ModelPrompt prompt = promptBuilderService.buildSufficiencyPrompt(List.of(ConversationTurn.user("A fitness app")));

        assertTrue(prompt.getSystemPrompt().contains("Current date: March 14, 2025"));
        assertTrue(prompt.getSystemPrompt().contains("\"isSufficient\""));
        assertEquals(0.7, prompt.getTemperature());
        assertTrue(prompt.isJsonOutput());
    }

    @Test
    void shouldBuildPlanPromptWithErrorEscapeHatch() {
        plannerProperties.setPlanTemperature(0.2);

        ModelPrompt prompt = promptBuilderService.buildPlanPrompt(List.of(ConversationTurn.user("A fitness app")));

        assertTrue(prompt.getSystemPrompt().contains("{\"error\":"));
        assertTrue(prompt.getSystemPrompt().contains("\"ganttData\""));
        assertTrue(prompt.getSystemPrompt().contains("March 14, 2025"));
        assertEquals(0.2, prompt.getTemperature());
    }

    @Test
    void shouldSanitizeAndDropEmptyTurns() {
        ModelPrompt prompt = promptBuilderService.buildPlanPrompt(Arrays.asList(
                ConversationTurn.user("  A\tfitness   app  "),
                ConversationTurn.assistant("   "),
                null,
                ConversationTurn.user("3 months")));

        assertEquals(2, prompt.getMessages().size());
        assertEquals("A fitness app", prompt.getMessages().get(0).getContent());
        assertEquals(ConversationTurn.Role.USER, prompt.getMessages().get(1).getRole());
    }
}
