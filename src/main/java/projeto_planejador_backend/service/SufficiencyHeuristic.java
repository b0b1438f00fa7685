package projeto_planejador_backend.service;

import org.springframework.stereotype.Component;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.SufficiencyResult;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword scoring used when the estimator model is unreachable. User turns are read in order;
 * a turn that retracts a rubric item uncovers it again, so the score can go down.
 */
@Component
public class SufficiencyHeuristic {

    static final String OPENING_QUESTION =
            "Hello! What project can I help you plan? (e.g., a mobile fitness app, a marketing campaign, a portfolio website)";
    static final String CONCLUDING_STATEMENT =
            "Great, I have enough details to draft your plan. Click Generate Plan whenever you're ready.";

    enum RubricItem {
        GOAL("\\b(build|create|make|develop|design|launch|app|application|website|site|platform|system|tool|campaign|store|shop|game|dashboard|service|product|blog|portfolio)\\b",
                "\\b(forget|scratch|cancel|drop)\\s+(the|that|this)\\s+(idea|project|app|plan)\\b",
                "What's the main goal of this project? (e.g., help users track workouts, sell products online, promote a new brand)"),
        TIMELINE("\\b\\d+\\s*-?\\s*(days?|weeks?|months?|years?)\\b|\\b(deadline|timeline|time ?frame|by (january|february|march|april|may|june|july|august|september|october|november|december|the end of|next)|end of (the )?(month|year|quarter)|q[1-4]|asap|next (week|month|year))\\b",
                "\\b(no|not sure about( the)?|forget( about)?( the)?|scratch( the)?|drop( the)?|don'?t have an?|without an?|undecided( on)?( the)?|no fixed)\\s+(deadline|timeline|time ?frame|schedule|due date|date)s?\\b",
                "What's your timeline for this project? (e.g., 6 weeks, 3 months, 1 year)"),
        FEATURES("\\b(features?|functionalit(y|ies)|including|such as|should (be able|have|let|allow)|users? (can|should|will)|log ?in|sign ?up|payments?|checkout|notifications?|search|sharing|charts?|profiles?|chat|booking|upload)\\b",
                "\\b(no|not sure about( the)?|forget( about)?( the)?|scratch( the)?|drop( the)?|undecided( on)?( the)?)\\s+(features?|functionality)\\b",
                "Which key features should it include? (e.g., user login, online payments, progress charts)"),
        TEAM("\\b\\d+\\s+([a-z-]+\\s+)?(developers?|devs?|engineers?|people|persons|members|designers?)\\b|\\b(team|solo|just me|by myself|on my own|freelancers?|alone)\\b",
                "\\b(no|not sure about( the)?|don'?t (have|know)( a| the| my)?|undecided( on)?( the)?)\\s+(team|developers?)\\b",
                "How big is the team working on it? (e.g., just me, 3 developers, a designer plus 2 engineers)");

        private final Pattern evidence;
        private final Pattern retraction;
        private final String question;

        RubricItem(String evidence, String retraction, String question) {
            this.evidence = Pattern.compile(evidence, Pattern.CASE_INSENSITIVE);
            this.retraction = Pattern.compile(retraction, Pattern.CASE_INSENSITIVE);
            this.question = question;
        }

        String question() {
            return question;
        }
    }

    public SufficiencyResult estimate(List<ConversationTurn> transcript) {
        Map<RubricItem, Boolean> covered = new EnumMap<>(RubricItem.class);
        for (RubricItem item : RubricItem.values()) {
            covered.put(item, false);
        }

        boolean anyUserTurn = false;
        if (transcript != null) {
            for (ConversationTurn turn : transcript) {
                if (turn == null || !turn.isFromUser() || turn.getContent() == null || turn.getContent().isBlank()) {
                    continue;
                }
                anyUserTurn = true;
                for (RubricItem item : RubricItem.values()) {
                    if (item.retraction.matcher(turn.getContent()).find()) {
                        covered.put(item, false);
                    } else if (item.evidence.matcher(turn.getContent()).find()) {
                        covered.put(item, true);
                    }
                }
            }
        }

        if (!anyUserTurn || covered.values().stream().noneMatch(Boolean::booleanValue)) {
            return new SufficiencyResult(0, false, OPENING_QUESTION);
        }

        int coveredCount = (int) covered.values().stream().filter(Boolean::booleanValue).count();
        int score = coveredCount * 25;
        for (RubricItem item : RubricItem.values()) {
            if (!covered.get(item)) {
                return new SufficiencyResult(score, false, item.question());
            }
        }
        return new SufficiencyResult(score, true, CONCLUDING_STATEMENT);
    }
}
