package projeto_planejador_backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ModelReply {
    private String tierName;
    private String model;
    private String content;
    private long durationMs;
}
