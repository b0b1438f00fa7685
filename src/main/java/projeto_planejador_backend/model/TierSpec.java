package projeto_planejador_backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One ranked model backend in the fallback sequence. Rank 1 is the highest quality tier.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TierSpec {
    private String name;
    private int rank;
    private ModelProvider provider;
    private String baseUrl;
    private String model;
    @ToString.Exclude
    private String apiKey;
    private int timeoutSeconds = 30;
    private boolean enabled = true;

    public TierSpec(String name, int rank, ModelProvider provider, String baseUrl, String model) {
        this(name, rank, provider, baseUrl, model, null, 30, true);
    }
}
