package projeto_planejador_backend.dto.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OllamaRequest {
    private static final String ROLE_SYSTEM = "system";

    private String model;
    private List<Message> messages;
    private boolean stream = false;
    private String format;
    private Map<String, Object> options;

    public OllamaRequest(String model, String systemPrompt, List<Message> historyMessages,
                         double temperature, boolean jsonOutput) {
        this.model = model;
        List<Message> allMessages = new ArrayList<>();
        allMessages.add(new Message(ROLE_SYSTEM, systemPrompt));
        if (historyMessages != null && !historyMessages.isEmpty()) {
            allMessages.addAll(historyMessages);
        }
        this.messages = allMessages;
        this.options = Map.of("temperature", temperature);
        if (jsonOutput) {
            this.format = "json";
        }
    }

    @Data
    @NoArgsConstructor
    public static class Message {
        private String role;
        private String content;

        public Message(String role, String content) {
            this.role = role;
            this.content = content;
        }
    }
}
