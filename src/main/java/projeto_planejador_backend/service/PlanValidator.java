package projeto_planejador_backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import projeto_planejador_backend.exceptions.PlanSchemaException;
import projeto_planejador_backend.exceptions.PlanSemanticException;
import projeto_planejador_backend.model.GanttGraph;
import projeto_planejador_backend.model.GanttLink;
import projeto_planejador_backend.model.GanttTask;
import projeto_planejador_backend.model.ProjectPlan;
import projeto_planejador_backend.model.TechnologyStackEntry;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Two-stage plan validation. Stage 1 turns a raw reply into a {@link ProjectPlan} or names the
 * offending field; stage 2 checks the task graph and the schedule. Neither stage mutates its input.
 */
@Service
@RequiredArgsConstructor
public class PlanValidator {

    static final LocalDate EARLIEST_DATE = LocalDate.of(1900, 1, 1);
    static final LocalDate LATEST_DATE = LocalDate.of(9999, 12, 31);
    static final int MAX_DURATION_DAYS = 3650;

    private final ObjectMapper objectMapper;
    private final PromptSanitizer promptSanitizer;

    public ProjectPlan validateStage1(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new PlanSchemaException("$", "resposta vazia");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(promptSanitizer.extractJsonObject(raw));
        } catch (JsonProcessingException e) {
            throw new PlanSchemaException("$", "JSON inválido", e);
        }
        if (root == null || !root.isObject()) {
            throw new PlanSchemaException("$", "esperado um objeto JSON");
        }
        if (root.has("error") && !root.has("projectName")) {
            throw new PlanSchemaException("error", "modelo recusou a conversa: " + root.path("error").asText());
        }

        ProjectPlan plan = new ProjectPlan();
        plan.setProjectName(requireText(root, "projectName", "projectName"));
        plan.setExecutiveSummary(requireText(root, "executiveSummary", "executiveSummary"));
        plan.setKeyMilestones(requireTextArray(root, "keyMilestones"));
        plan.setResourceSuggestions(requireTextArray(root, "resourceSuggestions"));

        JsonNode stackNode = requireNonEmptyArray(root, "technologyStack", "technologyStack");
        List<TechnologyStackEntry> stack = new ArrayList<>();
        for (int i = 0; i < stackNode.size(); i++) {
            String path = "technologyStack[" + i + "]";
            JsonNode entry = requireObject(stackNode.get(i), path);
            stack.add(new TechnologyStackEntry(
                    requireText(entry, "component", path + ".component"),
                    requireText(entry, "technology", path + ".technology"),
                    requireText(entry, "rationale", path + ".rationale")));
        }
        plan.setTechnologyStack(stack);

        JsonNode ganttNode = requireObject(root.get("ganttData"), "ganttData");
        plan.setGanttData(parseGantt(ganttNode));
        return plan;
    }

    public ProjectPlan validateStage2(ProjectPlan plan) {
        if (plan == null || plan.getGanttData() == null || plan.getGanttData().getTasks() == null
                || plan.getGanttData().getTasks().isEmpty()) {
            throw new PlanSemanticException("ganttData: o plano não tem tarefas");
        }
        List<GanttTask> tasks = plan.getGanttData().getTasks();
        List<GanttLink> links = plan.getGanttData().getLinks() == null ? List.of() : plan.getGanttData().getLinks();

        Map<Integer, GanttTask> tasksById = new LinkedHashMap<>();
        for (GanttTask task : tasks) {
            if (tasksById.putIfAbsent(task.getId(), task) != null) {
                throw new PlanSemanticException("duplicate task id: " + task.getId());
            }
        }

        Set<Integer> linkIds = new HashSet<>();
        Map<Integer, List<Integer>> successors = new TreeMap<>();
        for (GanttLink link : links) {
            if (!linkIds.add(link.getId())) {
                throw new PlanSemanticException("duplicate link id: " + link.getId());
            }
            if (link.getSourceTaskId() == link.getTargetTaskId()) {
                throw new PlanSemanticException(String.format("self-link %d: task %d → task %d",
                        link.getId(), link.getSourceTaskId(), link.getTargetTaskId()));
            }
            requireTaskExists(tasksById, link, link.getSourceTaskId());
            requireTaskExists(tasksById, link, link.getTargetTaskId());
            successors.computeIfAbsent(link.getSourceTaskId(), k -> new ArrayList<>()).add(link.getTargetTaskId());
        }

        List<Integer> cycle = findCycle(tasksById.keySet(), successors);
        if (!cycle.isEmpty()) {
            throw new PlanSemanticException("cycle: " + cycle.stream()
                    .map(id -> "task " + id)
                    .collect(Collectors.joining(" → ")));
        }

        for (GanttLink link : links) {
            GanttTask source = tasksById.get(link.getSourceTaskId());
            GanttTask target = tasksById.get(link.getTargetTaskId());
            try {
                checkSchedule(link, source, target);
            } catch (DateTimeException e) {
                throw new PlanSemanticException(String.format("dates: task %d or task %d out of calendar range (link %d)",
                        source.getId(), target.getId(), link.getId()), e);
            }
        }
        return plan;
    }

    private GanttGraph parseGantt(JsonNode ganttNode) {
        JsonNode tasksNode = requireNonEmptyArray(ganttNode, "data", "ganttData.data");
        List<GanttTask> tasks = new ArrayList<>();
        for (int i = 0; i < tasksNode.size(); i++) {
            String path = "ganttData.data[" + i + "]";
            JsonNode node = requireObject(tasksNode.get(i), path);
            int id = requireInt(node, "id", path + ".id", 1);
            String label = requireText(node, "text", path + ".text");
            LocalDate startDate = requireDate(node, "start_date", path + ".start_date");
            int duration = requireInt(node, "duration", path + ".duration", 1);
            if (duration > MAX_DURATION_DAYS) {
                throw new PlanSchemaException(path + ".duration",
                        "valor deve ser <= " + MAX_DURATION_DAYS + ", recebido " + duration);
            }
            double progress = requireFraction(node, "progress", path + ".progress");
            String owner = requireText(node, "owner", path + ".owner");
            tasks.add(new GanttTask(id, label, startDate, duration, progress, owner));
        }

        JsonNode linksNode = ganttNode.get("links");
        if (linksNode == null || !linksNode.isArray()) {
            throw new PlanSchemaException("ganttData.links", "esperada uma lista");
        }
        List<GanttLink> links = new ArrayList<>();
        for (int i = 0; i < linksNode.size(); i++) {
            String path = "ganttData.links[" + i + "]";
            JsonNode node = requireObject(linksNode.get(i), path);
            int id = requireInt(node, "id", path + ".id", 1);
            int source = requireInt(node, "source", path + ".source", Integer.MIN_VALUE);
            int target = requireInt(node, "target", path + ".target", Integer.MIN_VALUE);
            links.add(new GanttLink(id, source, target, requireLinkKind(node, path + ".type")));
        }
        return new GanttGraph(tasks, links);
    }

    private void requireTaskExists(Map<Integer, GanttTask> tasksById, GanttLink link, int taskId) {
        if (!tasksById.containsKey(taskId)) {
            throw new PlanSemanticException(String.format("dangling link %d: task %d does not exist",
                    link.getId(), taskId));
        }
    }

    /**
     * Iterative depth-first search with white/grey/black colouring. Returns the first cycle found,
     * closed on its starting task, or an empty list.
     */
    private List<Integer> findCycle(Set<Integer> taskIds, Map<Integer, List<Integer>> successors) {
        Map<Integer, Integer> colour = new HashMap<>();
        for (Integer start : new TreeSet<>(taskIds)) {
            if (colour.getOrDefault(start, 0) != 0) {
                continue;
            }
            Deque<Integer> path = new ArrayDeque<>();
            Deque<Iterator<Integer>> pending = new ArrayDeque<>();
            path.addLast(start);
            pending.addLast(successors.getOrDefault(start, List.of()).iterator());
            colour.put(start, 1);

            while (!pending.isEmpty()) {
                Iterator<Integer> next = pending.peekLast();
                if (!next.hasNext()) {
                    colour.put(path.removeLast(), 2);
                    pending.removeLast();
                    continue;
                }
                Integer child = next.next();
                int childColour = colour.getOrDefault(child, 0);
                if (childColour == 1) {
                    List<Integer> cycle = new ArrayList<>();
                    boolean inCycle = false;
                    for (Integer id : path) {
                        inCycle = inCycle || id.equals(child);
                        if (inCycle) {
                            cycle.add(id);
                        }
                    }
                    cycle.add(child);
                    return cycle;
                }
                if (childColour == 0) {
                    colour.put(child, 1);
                    path.addLast(child);
                    pending.addLast(successors.getOrDefault(child, List.of()).iterator());
                }
            }
        }
        return List.of();
    }

    private void checkSchedule(GanttLink link, GanttTask source, GanttTask target) {
        LocalDate earliest;
        LocalDate actual;
        String constrained;
        switch (link.getKind()) {
            case FINISH_TO_START -> {
                earliest = source.finishDate();
                actual = target.getStartDate();
                constrained = "starts";
            }
            case START_TO_START -> {
                earliest = source.getStartDate();
                actual = target.getStartDate();
                constrained = "starts";
            }
            case FINISH_TO_FINISH -> {
                earliest = source.finishDate();
                actual = target.finishDate();
                constrained = "finishes";
            }
            case START_TO_FINISH -> {
                earliest = source.getStartDate();
                actual = target.finishDate();
                constrained = "finishes";
            }
            default -> throw new IllegalStateException("Tipo de dependência não tratado: " + link.getKind());
        }
        if (actual.isBefore(earliest)) {
            throw new PlanSemanticException(String.format("schedule: task %d %s %s, before %s of task %d (%s, link %d)",
                    target.getId(), constrained, actual, earliest, source.getId(), link.getKind().getLabel(), link.getId()));
        }
    }

    private JsonNode requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new PlanSchemaException(path, "esperado um objeto");
        }
        return node;
    }

    private JsonNode requireNonEmptyArray(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isArray()) {
            throw new PlanSchemaException(path, "esperada uma lista");
        }
        if (node.isEmpty()) {
            throw new PlanSchemaException(path, "lista vazia");
        }
        return node;
    }

    private String requireText(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new PlanSchemaException(path, "texto obrigatório");
        }
        return node.asText().trim();
    }

    private List<String> requireTextArray(JsonNode parent, String field) {
        JsonNode node = requireNonEmptyArray(parent, field, field);
        List<String> values = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            if (item == null || !item.isTextual() || item.asText().isBlank()) {
                throw new PlanSchemaException(field + "[" + i + "]", "texto obrigatório");
            }
            values.add(item.asText().trim());
        }
        return values;
    }

    private int requireInt(JsonNode parent, String field, String path, int minimum) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new PlanSchemaException(path, "inteiro obrigatório");
        }
        int value = node.intValue();
        if (value < minimum) {
            throw new PlanSchemaException(path, "valor deve ser >= " + minimum + ", recebido " + value);
        }
        return value;
    }

    private double requireFraction(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isNumber()) {
            throw new PlanSchemaException(path, "número obrigatório");
        }
        double value = node.doubleValue();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new PlanSchemaException(path, "valor deve estar entre 0 e 1, recebido " + value);
        }
        return value;
    }

    private LocalDate requireDate(JsonNode parent, String field, String path) {
        String text = requireText(parent, field, path);
        LocalDate date;
        try {
            date = LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new PlanSchemaException(path, "data inválida '" + text + "', esperado YYYY-MM-DD", e);
        }
        if (date.isBefore(EARLIEST_DATE) || date.isAfter(LATEST_DATE)) {
            throw new PlanSchemaException(path, "data fora do intervalo " + EARLIEST_DATE + " a " + LATEST_DATE + ": " + text);
        }
        return date;
    }

    private GanttLink.LinkKind requireLinkKind(JsonNode parent, String path) {
        JsonNode node = parent.get("type");
        if (node == null || !(node.isTextual() || node.isIntegralNumber())) {
            throw new PlanSchemaException(path, "tipo de dependência obrigatório");
        }
        try {
            return GanttLink.LinkKind.fromCode(node.asText());
        } catch (IllegalArgumentException e) {
            throw new PlanSchemaException(path, e.getMessage(), e);
        }
    }
}
