package projeto_planejador_backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Uma mensagem da conversa de levantamento do projeto")
public class ConversationTurn {

    @NotNull(message = "O papel da mensagem é obrigatório (user ou assistant).")
    @Schema(description = "Quem escreveu a mensagem", example = "user")
    private Role role;

    @NotBlank(message = "O conteúdo da mensagem não pode estar em branco.")
    @Schema(description = "Texto da mensagem", example = "Quero criar um app mobile de fitness em 3 meses")
    private String content;

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content);
    }

    @JsonIgnore
    public boolean isFromUser() {
        return role == Role.USER;
    }

    @JsonIgnore
    public boolean isFromAssistant() {
        return role == Role.ASSISTANT;
    }

    public enum Role {
        USER("user"),
        ASSISTANT("assistant");

        private final String value;

        Role(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static Role fromValue(String value) {
            if (value != null) {
                for (Role role : values()) {
                    if (role.value.equalsIgnoreCase(value.trim())) {
                        return role;
                    }
                }
            }
            throw new IllegalArgumentException("Papel de mensagem inválido: " + value);
        }
    }
}
