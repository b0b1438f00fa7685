package projeto_planejador_backend.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import projeto_planejador_backend.config.PlannerProperties;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.ModelPrompt;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class PromptBuilderService {

    private static final DateTimeFormatter PROMPT_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    private final PromptSanitizer promptSanitizer;
    private final PlannerProperties plannerProperties;
    private final Clock clock;

    private static final String SUFFICIENCY_PROMPT = """
            You are a project planning assistant gathering requirements before a plan is written.

            Current date: %s

            RULE 1: Ask only ONE question at a time. Never ask for the goal and the timeline in the same message.
            RULE 2: Every question MUST carry 2-3 brief, concrete examples in parentheses.
            Example: "What's your timeline for this project? (e.g., 6 weeks, 3 months, 1 year)"

            RUBRIC - rate how well the conversation covers these four items:
            1. Goal: what is being built and why
            2. Timeline: how long, or by when
            3. Scope/Features: the key features or deliverables
            4. Team/Resources: who works on it and how many

            SCORE (0-100):
            - 0: no information, greetings only, or input that is not a project description
            - 25: goal known
            - 50: goal + timeline
            - 75: goal + timeline + one more item
            - 100: all four items
            If the user retracts something said earlier (for example drops the deadline), lower the score.

            Your nextPrompt is the single most valuable clarifying question for the weakest-covered rubric item.
            If the latest message is only a greeting, reply politely, ask what project to plan, score 0.
            When all four items are covered, nextPrompt is a short concluding statement telling the user
            the plan can now be generated, and isSufficient is true.

            OUTPUT: return ONLY a JSON object, no markdown, no extra text:
            {"score": 0, "nextPrompt": "your question or concluding statement", "isSufficient": false}
            isSufficient must be false for greetings, empty messages and non-project queries.""";

    private static final String PLAN_PROMPT = """
            You are a project planning AI. Your only task is to produce one JSON object describing a project plan
            from the conversation that follows.

            Current date: %s. Calculate all dates relative to this date.

            INSTRUCTIONS:
            1. Read the WHOLE conversation, from the first message to the last.
            2. When the user corrects or changes something, use the LATEST information.
            3. Use every concrete detail: timeline, team size, features, technology preferences, constraints.

            INVALID INPUT: if the conversation does not describe a project (only greetings, gibberish, no goal),
            return ONLY {"error": "Invalid input. Please provide a clear project goal, timeline, and key features first."}

            Otherwise return ONLY this JSON structure, no markdown, no code fences:
            {
              "projectName": "Short project name",
              "executiveSummary": "2-3 sentences covering goal, duration and key components",
              "keyMilestones": ["3-5 major checkpoints"],
              "technologyStack": [
                {"component": "e.g. Frontend", "technology": "e.g. React", "rationale": "brief justification"}
              ],
              "resourceSuggestions": ["1x UI/UX Designer", "2x Backend Developers"],
              "ganttData": {
                "data": [
                  {"id": 1, "text": "Task name", "start_date": "YYYY-MM-DD", "duration": 5, "progress": 0, "owner": "Role or Unassigned"}
                ],
                "links": [
                  {"id": 1, "source": 1, "target": 2, "type": "0"}
                ]
              }
            }

            RULES:
            - keyMilestones: 3-5 items. technologyStack: 3-5 entries.
            - ganttData.data: 5-10 tasks, sequential ids starting at 1, duration in whole days (at least 1),
              progress 0, start_date in YYYY-MM-DD.
            - ganttData.links: type "0" means finish-to-start. Every source and target must be an existing task id,
              no task may depend on itself and dependencies must never form a cycle.
            - A task must not start before every task it depends on (finish-to-start) has finished:
              its start_date must be on or after the predecessor's start_date plus its duration.
            - Fit the whole schedule inside the timeline discussed.""";

    public ModelPrompt buildSufficiencyPrompt(List<ConversationTurn> transcript) {
        String systemPrompt = String.format(SUFFICIENCY_PROMPT, today());
        return new ModelPrompt(systemPrompt, sanitize(transcript), plannerProperties.getChatTemperature(), true);
    }

    public ModelPrompt buildPlanPrompt(List<ConversationTurn> transcript) {
        String systemPrompt = String.format(PLAN_PROMPT, today());
        return new ModelPrompt(systemPrompt, sanitize(transcript), plannerProperties.getPlanTemperature(), true);
    }

    private String today() {
        return LocalDate.now(clock).format(PROMPT_DATE);
    }

    private List<ConversationTurn> sanitize(List<ConversationTurn> transcript) {
        if (transcript == null) {
            return List.of();
        }
        return transcript.stream()
                .filter(turn -> turn != null && turn.getRole() != null && turn.getContent() != null)
                .map(turn -> new ConversationTurn(turn.getRole(), promptSanitizer.sanitizeForPrompt(turn.getContent())))
                .filter(turn -> !turn.getContent().isEmpty())
                .toList();
    }
}
