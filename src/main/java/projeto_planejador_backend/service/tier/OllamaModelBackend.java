package projeto_planejador_backend.service.tier;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import projeto_planejador_backend.dto.request.OllamaRequest;
import projeto_planejador_backend.dto.response.OllamaResponse;
import projeto_planejador_backend.model.ModelPrompt;
import projeto_planejador_backend.model.ModelProvider;
import projeto_planejador_backend.model.TierSpec;

import java.time.Duration;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class OllamaModelBackend implements ModelBackend {

    private final WebClient webClient;

    @Override
    public ModelProvider provider() {
        return ModelProvider.OLLAMA;
    }

    @Override
    public String complete(TierSpec tier, ModelPrompt prompt) {
        List<OllamaRequest.Message> history = prompt.getMessages().stream()
                .map(turn -> new OllamaRequest.Message(turn.getRole().getValue(), turn.getContent()))
                .toList();
        OllamaRequest ollamaRequest = new OllamaRequest(tier.getModel(), prompt.getSystemPrompt(), history,
                prompt.getTemperature(), prompt.isJsonOutput());

        log.debug("Executing Ollama request on tier {} ({} messages)", tier.getName(), ollamaRequest.getMessages().size());

        OllamaResponse response = webClient.post()
                .uri(ModelBackend.endpoint(tier, "/api/chat"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(ollamaRequest)
                .retrieve()
                .bodyToMono(OllamaResponse.class)
                .timeout(Duration.ofSeconds(tier.getTimeoutSeconds()))
                .block();

        if (response == null || response.getMessage() == null) {
            return null;
        }
        return response.getMessage().getContent();
    }
}
