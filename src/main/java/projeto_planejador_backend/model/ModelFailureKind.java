package projeto_planejador_backend.model;

public enum ModelFailureKind {
    RATE_LIMITED,
    TIMEOUT,
    UNAVAILABLE,
    MALFORMED_REPLY
}
