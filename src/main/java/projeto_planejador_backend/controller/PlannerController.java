package projeto_planejador_backend.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import projeto_planejador_backend.dto.request.ConversationRequest;
import projeto_planejador_backend.dto.response.ErrorResponse;
import projeto_planejador_backend.model.PlanGenerationResult;
import projeto_planejador_backend.model.ProjectPlan;
import projeto_planejador_backend.model.SufficiencyResult;
import projeto_planejador_backend.service.PlanGenerationService;
import projeto_planejador_backend.service.SufficiencyEstimatorService;
import projeto_planejador_backend.service.TranscriptValidator;

@RestController
@RequestMapping("/api/planner")
@RequiredArgsConstructor
public class PlannerController {

    public static final String PLAN_SOURCE_HEADER = "X-Plan-Source";

    private final SufficiencyEstimatorService sufficiencyEstimatorService;
    private final PlanGenerationService planGenerationService;
    private final TranscriptValidator transcriptValidator;

    @Operation(
            summary = "Avaliar a conversa",
            description = "Calcula a completude das informações do projeto e devolve a próxima pergunta. Nunca falha por indisponibilidade da IA."
    )
    @ApiResponse(responseCode = "200", description = "Avaliação calculada",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = SufficiencyResult.class)))
    @ApiResponse(responseCode = "400", description = "Mensagens inválidas ou acima dos limites",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @PostMapping("/chat")
    public ResponseEntity<SufficiencyResult> evaluateConversation(@Valid @RequestBody ConversationRequest request) {
        transcriptValidator.validateForEvaluation(request.getMessages());
        return ResponseEntity.ok(sufficiencyEstimatorService.evaluate(request.getMessages()));
    }

    @Operation(
            summary = "Gerar plano de projeto",
            description = "Gera o plano tentando cada modelo em ordem de qualidade; se todos falharem, devolve um plano sintético. "
                    + "O cabeçalho X-Plan-Source indica a origem do plano."
    )
    @ApiResponse(responseCode = "200", description = "Plano gerado e validado",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ProjectPlan.class)))
    @ApiResponse(responseCode = "400", description = "Conversa vazia ou sem mensagem do usuário",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "500", description = "Falha fatal de configuração",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @PostMapping("/generate-plan")
    public ResponseEntity<ProjectPlan> generatePlan(@Valid @RequestBody ConversationRequest request) {
        transcriptValidator.validateForGeneration(request.getMessages());
        PlanGenerationResult result = planGenerationService.generate(request.getMessages());
        return ResponseEntity.ok()
                .header(PLAN_SOURCE_HEADER, result.getSource())
                .body(result.getPlan());
    }
}
