package projeto_planejador_backend.exceptions;

import lombok.Getter;

/**
 * Structural rejection of a raw plan reply, pointing at the offending field path.
 */
@Getter
public class PlanSchemaException extends RuntimeException {

    private final String fieldPath;

    public PlanSchemaException(String fieldPath, String message) {
        super(fieldPath + ": " + message);
        this.fieldPath = fieldPath;
    }

    public PlanSchemaException(String fieldPath, String message, Throwable cause) {
        super(fieldPath + ": " + message, cause);
        this.fieldPath = fieldPath;
    }
}
