package projeto_planejador_backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import projeto_planejador_backend.config.PlannerProperties;
import projeto_planejador_backend.exceptions.ModelTierException;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.ModelReply;
import projeto_planejador_backend.model.SufficiencyResult;
import projeto_planejador_backend.model.TierSpec;
import projeto_planejador_backend.service.tier.ModelTierClient;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a transcript holds enough information to generate a plan. Model failures never
 * escape: the estimator falls back to {@link SufficiencyHeuristic}. A repeated clarifying question
 * forces the dialogue into generation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SufficiencyEstimatorService {

    private final ModelTierClient modelTierClient;
    private final PromptBuilderService promptBuilderService;
    private final PromptSanitizer promptSanitizer;
    private final SufficiencyHeuristic sufficiencyHeuristic;
    private final QuestionLoopDetector questionLoopDetector;
    private final PlannerProperties plannerProperties;
    private final PlannerMetricsService plannerMetricsService;
    private final ObjectMapper objectMapper;

    public SufficiencyResult evaluate(List<ConversationTurn> transcript) {
        boolean hasUserTurn = transcript != null && transcript.stream()
                .anyMatch(turn -> turn != null && turn.isFromUser() && turn.getContent() != null && !turn.getContent().isBlank());
        if (!hasUserTurn) {
            return new SufficiencyResult(0, false, SufficiencyHeuristic.OPENING_QUESTION);
        }

        SufficiencyResult proposed = askModel(transcript).orElseGet(() -> {
            plannerMetricsService.recordSufficiencyFallback();
            return sufficiencyHeuristic.estimate(transcript);
        });
        return applyLoopGuard(proposed, transcript);
    }

    private Optional<SufficiencyResult> askModel(List<ConversationTurn> transcript) {
        Optional<TierSpec> tier = estimatorTier();
        if (tier.isEmpty()) {
            log.warn("No model tier configured for sufficiency estimation, using heuristic");
            return Optional.empty();
        }
        try {
            ModelReply reply = modelTierClient.invoke(tier.get(), promptBuilderService.buildSufficiencyPrompt(transcript));
            Optional<SufficiencyResult> parsed = parse(reply.getContent());
            if (parsed.isEmpty()) {
                log.warn("Unparseable sufficiency reply from tier {}, using heuristic", reply.getTierName());
            }
            return parsed;
        } catch (ModelTierException e) {
            log.warn("Sufficiency model call failed on tier {} ({}), using heuristic", e.getTierName(), e.getKind());
            return Optional.empty();
        }
    }

    private Optional<TierSpec> estimatorTier() {
        List<TierSpec> tiers = plannerProperties.orderedTiers();
        String configured = plannerProperties.getSufficiency().getTierName();
        if (configured != null && !configured.isBlank()) {
            Optional<TierSpec> named = tiers.stream().filter(t -> configured.equals(t.getName())).findFirst();
            if (named.isPresent()) {
                return named;
            }
            log.warn("Sufficiency tier '{}' is not an enabled tier, using the highest ranked one", configured);
        }
        return tiers.stream().findFirst();
    }

    Optional<SufficiencyResult> parse(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(promptSanitizer.extractJsonObject(content));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        JsonNode scoreNode = root.has("score") ? root.get("score") : root.get("progress");
        JsonNode promptNode = root.has("nextPrompt") ? root.get("nextPrompt") : root.get("assistantReply");
        if (scoreNode == null || !(scoreNode.isNumber() || scoreNode.isTextual() && scoreNode.asText().matches("\\s*\\d+\\s*"))) {
            return Optional.empty();
        }

        int score;
        try {
            score = clampScore(scoreNode.isNumber() ? scoreNode.decimalValue() : new BigDecimal(scoreNode.asText().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        String nextPrompt = promptNode == null || promptNode.isNull() ? "" : promptNode.asText().trim();
        JsonNode sufficientNode = root.get("isSufficient");
        boolean sufficient = sufficientNode != null && sufficientNode.asBoolean(false)
                || score >= plannerProperties.getSufficiency().getSufficientScore();

        if (!sufficient && nextPrompt.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SufficiencyResult(score, sufficient, nextPrompt));
    }

    private static int clampScore(BigDecimal raw) {
        return raw.max(BigDecimal.ZERO).min(BigDecimal.valueOf(100)).intValue();
    }

    private SufficiencyResult applyLoopGuard(SufficiencyResult proposed, List<ConversationTurn> transcript) {
        if (proposed.isSufficient()) {
            if (proposed.getNextPrompt() == null || proposed.getNextPrompt().isBlank()) {
                proposed.setNextPrompt(SufficiencyHeuristic.CONCLUDING_STATEMENT);
            }
            return proposed;
        }
        if (questionLoopDetector.isRepeated(proposed.getNextPrompt(), transcript)) {
            log.warn("Clarifying question repeated within the last {} assistant turns, escalating to generation (score {})",
                    plannerProperties.getSufficiency().getLoopWindow(), proposed.getScore());
            plannerMetricsService.recordQuestionLoop();
            return new SufficiencyResult(proposed.getScore(), true, SufficiencyHeuristic.CONCLUDING_STATEMENT);
        }
        return proposed;
    }
}
