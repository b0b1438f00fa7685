package projeto_planejador_backend.service.tier;

import projeto_planejador_backend.model.ModelPrompt;
import projeto_planejador_backend.model.ModelProvider;
import projeto_planejador_backend.model.TierSpec;

/**
 * One provider's call shape. Implementations return the raw reply text, or {@code null} when the
 * provider answered without any content; transport errors propagate unclassified to
 * {@link ModelTierClient}.
 */
public interface ModelBackend {

    ModelProvider provider();

    String complete(TierSpec tier, ModelPrompt prompt);

    static String endpoint(TierSpec tier, String path) {
        String baseUrl = tier.getBaseUrl().trim();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + path;
    }
}
