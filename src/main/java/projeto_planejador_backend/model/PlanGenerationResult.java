package projeto_planejador_backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class PlanGenerationResult {

    public static final String SYNTHETIC_SOURCE = "synthetic";

    private ProjectPlan plan;
    private String source;
    private List<TierAttempt> attempts;

    public boolean isSynthetic() {
        return SYNTHETIC_SOURCE.equals(source);
    }
}
