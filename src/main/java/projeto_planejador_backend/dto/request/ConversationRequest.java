package projeto_planejador_backend.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import projeto_planejador_backend.model.ConversationTurn;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Histórico completo da conversa, reenviado a cada chamada")
public class ConversationRequest {

    @NotNull(message = "A lista de mensagens é obrigatória.")
    @Valid
    private List<ConversationTurn> messages = new ArrayList<>();
}
