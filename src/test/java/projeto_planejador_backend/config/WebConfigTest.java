package projeto_planejador_backend.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import projeto_planejador_backend.model.ModelProvider;
import projeto_planejador_backend.model.TierSpec;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WebConfigTest {

    private PlannerProperties plannerProperties;
    private WebConfig webConfig;

    @BeforeEach
    void setUp() {
        plannerProperties = new PlannerProperties();
        webConfig = new WebConfig(plannerProperties);
    }

    @Test
    void shouldCreateWebClientWithoutTiers() {
        WebClient webClient = webConfig.webClient();

        assertNotNull(webClient);
    }

    @Test
    void shouldCreateWebClientSizedForSlowestTier() {
        TierSpec slow = new TierSpec("ollama-local", 3, ModelProvider.OLLAMA, "http://localhost:11434", "mistral");
        slow.setTimeoutSeconds(120);
        plannerProperties.setTiers(new ArrayList<>(List.of(slow)));

        WebClient webClient = webConfig.webClient();

        assertNotNull(webClient);
    }

    @Test
    void shouldConfigureCorsMappings() {
        plannerProperties.setAllowedOrigin("http://localhost:3000");
        CorsRegistry registry = new CorsRegistry();

        assertDoesNotThrow(() -> webConfig.addCorsMappings(registry));
    }
}
