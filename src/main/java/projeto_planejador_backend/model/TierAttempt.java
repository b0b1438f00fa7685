package projeto_planejador_backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TierAttempt {

    private String tierName;
    private Outcome outcome;
    private String detail;

    public enum Outcome {
        SUCCESS,
        RATE_LIMITED,
        TIMEOUT,
        UNAVAILABLE,
        MALFORMED_REPLY,
        SCHEMA_INVALID,
        SEMANTIC_INVALID;

        public static Outcome from(ModelFailureKind kind) {
            return valueOf(kind.name());
        }
    }
}
