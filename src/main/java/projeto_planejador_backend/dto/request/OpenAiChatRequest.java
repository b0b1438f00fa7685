package projeto_planejador_backend.dto.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of an OpenAI-compatible {@code /chat/completions} call (Groq and similar providers).
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenAiChatRequest {

    private String model;
    private List<Message> messages;
    private Double temperature;

    @JsonProperty("response_format")
    private ResponseFormat responseFormat;

    public OpenAiChatRequest(String model, String systemPrompt, List<Message> historyMessages,
                             double temperature, boolean jsonOutput) {
        this.model = model;
        List<Message> allMessages = new ArrayList<>();
        allMessages.add(new Message("system", systemPrompt));
        if (historyMessages != null) {
            allMessages.addAll(historyMessages);
        }
        this.messages = allMessages;
        this.temperature = temperature;
        if (jsonOutput) {
            this.responseFormat = new ResponseFormat("json_object");
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

    @Data
    @NoArgsConstructor
    public static class ResponseFormat {
        private String type;

        public ResponseFormat(String type) {
            this.type = type;
        }
    }
}
