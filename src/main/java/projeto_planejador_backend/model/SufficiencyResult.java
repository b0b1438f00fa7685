package projeto_planejador_backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Completeness judgment for a transcript. The score is not monotonic across turns: a later
 * turn that retracts earlier information may lower it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Avaliação de suficiência da conversa")
public class SufficiencyResult {

    @Schema(description = "Completude das informações, de 0 a 100", example = "75")
    private int score;

    @JsonProperty("isSufficient")
    @Schema(description = "Se já é possível gerar o plano", example = "false")
    private boolean sufficient;

    @Schema(description = "Próxima pergunta ou mensagem de encerramento; vazia quando não há")
    private String nextPrompt;
}
