package projeto_planejador_backend.exceptions;

public class PlanGenerationException extends RuntimeException {

    public PlanGenerationException(String message) {
        super(message);
    }

    public PlanGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
