package projeto_planejador_backend.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import projeto_planejador_backend.config.PlannerProperties;
import projeto_planejador_backend.model.ConversationTurn;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Detects a dialogue that keeps asking the same clarifying question. The window of recent questions
 * is rebuilt from the transcript's assistant turns on every call.
 */
@Component
@RequiredArgsConstructor
public class QuestionLoopDetector {

    private final PlannerProperties plannerProperties;

    public boolean isRepeated(String proposedQuestion, List<ConversationTurn> transcript) {
        String proposed = normalize(proposedQuestion);
        if (proposed.isEmpty()) {
            return false;
        }
        double threshold = plannerProperties.getSufficiency().getSimilarityThreshold();
        for (String previous : recentQuestions(transcript)) {
            String normalized = normalize(previous);
            if (normalized.equals(proposed) || isSimilar(normalized, proposed, threshold)) {
                return true;
            }
        }
        return false;
    }

    List<String> recentQuestions(List<ConversationTurn> transcript) {
        if (transcript == null || transcript.isEmpty()) {
            return List.of();
        }
        int window = Math.max(0, plannerProperties.getSufficiency().getLoopWindow());
        List<String> questions = new ArrayList<>();
        for (int i = transcript.size() - 1; i >= 0 && questions.size() < window; i--) {
            ConversationTurn turn = transcript.get(i);
            if (turn != null && turn.isFromAssistant() && turn.getContent() != null && !turn.getContent().isBlank()) {
                questions.add(turn.getContent());
            }
        }
        return questions;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .trim()
                .replaceAll("[\\s?!.…]+$", "");
    }

    /**
     * True when 1 minus the Levenshtein distance divided by the longer length reaches the threshold.
     * Only distances up to the allowed budget are computed.
     */
    static boolean isSimilar(String a, String b, double threshold) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return true;
        }
        int maxDistance = (int) Math.floor((1.0 - threshold) * longest + 1e-9);
        if (maxDistance < 0) {
            return false;
        }
        return boundedDistance(a, b, maxDistance) <= maxDistance;
    }

    /**
     * Levenshtein distance restricted to the diagonal band of width {@code 2 * maxDistance + 1}.
     * Returns {@code maxDistance + 1} as soon as the distance is known to exceed the budget.
     */
    static int boundedDistance(String a, String b, int maxDistance) {
        int outside = maxDistance + 1;
        if (Math.abs(a.length() - b.length()) > maxDistance) {
            return outside;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = Math.min(j, outside);
        }
        for (int i = 1; i <= a.length(); i++) {
            int from = Math.max(1, i - maxDistance);
            int to = Math.min(b.length(), i + maxDistance);
            current[from - 1] = from == 1 ? Math.min(i, outside) : outside;
            int rowMinimum = current[from - 1];
            for (int j = from; j <= to; j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                int value = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
                current[j] = Math.min(value, outside);
                rowMinimum = Math.min(rowMinimum, current[j]);
            }
            if (to < b.length()) {
                current[to + 1] = outside;
            }
            if (rowMinimum > maxDistance) {
                return outside;
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
