package projeto_planejador_backend.service.tier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import projeto_planejador_backend.exceptions.ModelTierException;
import projeto_planejador_backend.model.ModelFailureKind;
import projeto_planejador_backend.model.ModelPrompt;
import projeto_planejador_backend.model.ModelProvider;
import projeto_planejador_backend.model.ModelReply;
import projeto_planejador_backend.model.TierSpec;
import projeto_planejador_backend.service.PlannerMetricsService;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Uniform entry point to every model tier. Makes exactly one call per invocation and reports any
 * failure as a {@link ModelTierException} carrying its {@link ModelFailureKind}.
 */
@Slf4j
@Service
public class ModelTierClient {

    private final Map<ModelProvider, ModelBackend> backends = new EnumMap<>(ModelProvider.class);
    private final PlannerMetricsService plannerMetricsService;

    public ModelTierClient(List<ModelBackend> modelBackends, PlannerMetricsService plannerMetricsService) {
        for (ModelBackend backend : modelBackends) {
            backends.put(backend.provider(), backend);
        }
        this.plannerMetricsService = plannerMetricsService;
    }

    public ModelReply invoke(TierSpec tier, ModelPrompt prompt) {
        ModelBackend backend = backends.get(tier.getProvider());
        if (backend == null) {
            throw fail(tier, ModelFailureKind.UNAVAILABLE,
                    "Nenhum backend registrado para o provider " + tier.getProvider(), null);
        }

        log.info("Sending request to tier {} (model {}, {} messages)",
                tier.getName(), tier.getModel(), prompt.getMessages().size());
        long startTime = System.currentTimeMillis();

        String content;
        try {
            content = backend.complete(tier, prompt);
        } catch (WebClientResponseException e) {
            throw fail(tier, classifyStatus(e.getStatusCode().value()),
                    String.format("Tier %s respondeu HTTP %d", tier.getName(), e.getStatusCode().value()), e);
        } catch (RuntimeException e) {
            throw fail(tier, classifyTransportError(e),
                    String.format("Erro ao se comunicar com o tier %s: %s", tier.getName(), e.getMessage()), e);
        }

        long duration = System.currentTimeMillis() - startTime;
        if (content == null || content.isBlank()) {
            throw fail(tier, ModelFailureKind.MALFORMED_REPLY,
                    "Resposta vazia ou sem conteúdo do tier " + tier.getName(), null);
        }

        log.info("Tier {} answered in {}ms ({} chars)", tier.getName(), duration, content.length());
        plannerMetricsService.recordTierCallTime(tier.getName(), duration);
        return new ModelReply(tier.getName(), tier.getModel(), content.trim(), duration);
    }

    private ModelTierException fail(TierSpec tier, ModelFailureKind kind, String message, Throwable cause) {
        log.warn("Tier {} failed with {}: {}", tier.getName(), kind, message);
        plannerMetricsService.recordTierFailure(tier.getName(), kind);
        return new ModelTierException(tier.getName(), kind, message, cause);
    }

    static ModelFailureKind classifyStatus(int statusCode) {
        if (statusCode == 429) {
            return ModelFailureKind.RATE_LIMITED;
        }
        if (statusCode == 408 || statusCode == 504) {
            return ModelFailureKind.TIMEOUT;
        }
        return ModelFailureKind.UNAVAILABLE;
    }

    static ModelFailureKind classifyTransportError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException) {
                return ModelFailureKind.TIMEOUT;
            }
            if (current instanceof CodecException
                    || current instanceof com.fasterxml.jackson.core.JsonProcessingException) {
                return ModelFailureKind.MALFORMED_REPLY;
            }
            if (current instanceof WebClientResponseException responseException) {
                return classifyStatus(responseException.getStatusCode().value());
            }
            if (current instanceof WebClientRequestException && current.getCause() == null) {
                return ModelFailureKind.UNAVAILABLE;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return ModelFailureKind.UNAVAILABLE;
    }
}
