package projeto_planejador_backend.service.tier;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import projeto_planejador_backend.dto.request.OpenAiChatRequest;
import projeto_planejador_backend.dto.response.OpenAiChatResponse;
import projeto_planejador_backend.model.ModelPrompt;
import projeto_planejador_backend.model.ModelProvider;
import projeto_planejador_backend.model.TierSpec;

import java.time.Duration;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiCompatibleModelBackend implements ModelBackend {

    private final WebClient webClient;

    @Override
    public ModelProvider provider() {
        return ModelProvider.OPENAI_COMPATIBLE;
    }

    @Override
    public String complete(TierSpec tier, ModelPrompt prompt) {
        List<OpenAiChatRequest.Message> history = prompt.getMessages().stream()
                .map(turn -> new OpenAiChatRequest.Message(turn.getRole().getValue(), turn.getContent()))
                .toList();
        OpenAiChatRequest request = new OpenAiChatRequest(tier.getModel(), prompt.getSystemPrompt(), history,
                prompt.getTemperature(), prompt.isJsonOutput());

        log.debug("Executing chat completion on tier {} ({} messages)", tier.getName(), request.getMessages().size());

        OpenAiChatResponse response = webClient.post()
                .uri(ModelBackend.endpoint(tier, "/chat/completions"))
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (tier.getApiKey() != null && !tier.getApiKey().isBlank()) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + tier.getApiKey());
                    }
                })
                .bodyValue(request)
                .retrieve()
                .bodyToMono(OpenAiChatResponse.class)
                .timeout(Duration.ofSeconds(tier.getTimeoutSeconds()))
                .block();

        return response == null ? null : response.firstContent();
    }
}
