package projeto_planejador_backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import projeto_planejador_backend.config.PlannerProperties;
import projeto_planejador_backend.exceptions.ModelTierException;
import projeto_planejador_backend.exceptions.PlanGenerationException;
import projeto_planejador_backend.exceptions.PlanSchemaException;
import projeto_planejador_backend.exceptions.PlanSemanticException;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.ModelPrompt;
import projeto_planejador_backend.model.ModelReply;
import projeto_planejador_backend.model.PlanGenerationResult;
import projeto_planejador_backend.model.ProjectPlan;
import projeto_planejador_backend.model.TierAttempt;
import projeto_planejador_backend.model.TierSpec;
import projeto_planejador_backend.service.tier.ModelTierClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Tries each tier once, in rank order, and returns the first reply that passes both validation
 * stages. When every tier fails the synthetic generator answers, so callers always get a plan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanGenerationService {

    private final ModelTierClient modelTierClient;
    private final PlannerProperties plannerProperties;
    private final PromptBuilderService promptBuilderService;
    private final PlanValidator planValidator;
    private final SyntheticPlanGenerator syntheticPlanGenerator;
    private final PlannerMetricsService plannerMetricsService;
    private final ObjectMapper objectMapper;

    public ProjectPlan generatePlan(List<ConversationTurn> transcript) {
        return generate(transcript).getPlan();
    }

    public PlanGenerationResult generate(List<ConversationTurn> transcript) {
        List<TierSpec> tiers = plannerProperties.orderedTiers();
        List<TierAttempt> attempts = new ArrayList<>();
        ModelPrompt prompt = tiers.isEmpty() ? null : promptBuilderService.buildPlanPrompt(transcript);

        for (TierSpec tier : tiers) {
            log.info("Generating plan with tier {} (rank {})", tier.getName(), tier.getRank());
            try {
                ModelReply reply = modelTierClient.invoke(tier, prompt);
                ProjectPlan plan = planValidator.validateStage2(planValidator.validateStage1(reply.getContent()));
                attempts.add(new TierAttempt(tier.getName(), TierAttempt.Outcome.SUCCESS, null));
                plannerMetricsService.recordPlanGenerated(tier.getName());
                log.info("Plan accepted from tier {} after {} attempt(s)", tier.getName(), attempts.size());
                return new PlanGenerationResult(plan, tier.getName(), attempts);
            } catch (ModelTierException e) {
                attempts.add(new TierAttempt(tier.getName(), TierAttempt.Outcome.from(e.getKind()), e.getMessage()));
            } catch (PlanSchemaException e) {
                log.warn("Tier {} reply rejected by schema validation at {}", tier.getName(), e.getFieldPath());
                plannerMetricsService.recordValidationFailure("schema");
                attempts.add(new TierAttempt(tier.getName(), TierAttempt.Outcome.SCHEMA_INVALID, e.getMessage()));
            } catch (PlanSemanticException e) {
                log.warn("Tier {} reply rejected by semantic validation: {}", tier.getName(), e.getInvariant());
                plannerMetricsService.recordValidationFailure("semantic");
                attempts.add(new TierAttempt(tier.getName(), TierAttempt.Outcome.SEMANTIC_INVALID, e.getMessage()));
            }
        }

        log.warn("All {} model tier(s) failed, falling back to synthetic plan", tiers.size());
        ProjectPlan synthetic = syntheticPlanGenerator.synthesize(transcript);
        try {
            planValidator.validateStage2(planValidator.validateStage1(objectMapper.writeValueAsString(synthetic)));
        } catch (PlanSchemaException | PlanSemanticException e) {
            log.error("Synthetic plan failed validation: {}", e.getMessage());
            throw new PlanGenerationException("O plano de contingência é inválido: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new PlanGenerationException("Não foi possível serializar o plano de contingência", e);
        }
        plannerMetricsService.recordPlanGenerated(PlanGenerationResult.SYNTHETIC_SOURCE);
        return new PlanGenerationResult(synthetic, PlanGenerationResult.SYNTHETIC_SOURCE, attempts);
    }
}
