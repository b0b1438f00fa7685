package projeto_planejador_backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ModelPrompt {
    private String systemPrompt;
    private List<ConversationTurn> messages;
    private double temperature;
    private boolean jsonOutput;
}
