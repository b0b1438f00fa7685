package projeto_planejador_backend.model;

public enum ModelProvider {
    OPENAI_COMPATIBLE,
    OLLAMA
}
