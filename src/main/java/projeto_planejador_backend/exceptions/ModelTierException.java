package projeto_planejador_backend.exceptions;

import lombok.Getter;
import projeto_planejador_backend.model.ModelFailureKind;

/**
 * A single tier failed to produce a reply. The pipeline treats every kind as "advance to the next tier".
 */
@Getter
public class ModelTierException extends RuntimeException {

    private final String tierName;
    private final ModelFailureKind kind;

    public ModelTierException(String tierName, ModelFailureKind kind, String message) {
        super(message);
        this.tierName = tierName;
        this.kind = kind;
    }

    public ModelTierException(String tierName, ModelFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.tierName = tierName;
        this.kind = kind;
    }
}
