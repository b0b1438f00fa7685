package projeto_planejador_backend.exceptions;

import lombok.Getter;

/**
 * Graph or schedule rejection of a structurally valid plan.
 */
@Getter
public class PlanSemanticException extends RuntimeException {

    private final String invariant;

    public PlanSemanticException(String invariant) {
        super(invariant);
        this.invariant = invariant;
    }

    public PlanSemanticException(String invariant, Throwable cause) {
        super(invariant, cause);
        this.invariant = invariant;
    }
}
