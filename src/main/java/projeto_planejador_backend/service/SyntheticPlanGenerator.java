package projeto_planejador_backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import projeto_planejador_backend.config.PlannerProperties;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.GanttGraph;
import projeto_planejador_backend.model.GanttLink;
import projeto_planejador_backend.model.GanttTask;
import projeto_planejador_backend.model.ProjectPlan;
import projeto_planejador_backend.model.TechnologyStackEntry;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Model-free plan built from canned templates. Every template is a small DAG listed in topological
 * order and start dates come from a forward pass, so the result passes both validation stages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyntheticPlanGenerator {

    private static final int MAX_TIMEFRAME_DAYS = 3650;

    private static final String NUMBER = "(\\d+|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve)";
    private static final Pattern TIMEFRAME_PATTERN = Pattern.compile(
            "\\b" + NUMBER + "\\s*-?\\s*(day|week|month|year)s?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TEAM_SIZE_PATTERN = Pattern.compile(
            "\\b" + NUMBER + "\\s+(?:[a-z-]+\\s+)?(developers?|devs?|engineers?|people|persons|members|designers?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SOLO_PATTERN = Pattern.compile(
            "\\b(solo|just me|by myself|on my own|alone)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROJECT_NOUN_PATTERN = Pattern.compile(
            "\\b(?:an?|the|my|our)\\s+((?:[a-z0-9][a-z0-9-]*\\s+){0,3}?)"
                    + "(app|application|website|site|platform|campaign|store|shop|dashboard|game|tool|system|portal|blog|marketplace|chatbot)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
            Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3), Map.entry("four", 4),
            Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7), Map.entry("eight", 8),
            Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11), Map.entry("twelve", 12));

    enum Category {
        MOBILE_APP("\\b(mobile|ios|android|iphone|smartphone|app store|play store)\\b"),
        MARKETING("\\b(marketing|campaign|seo|social media|advertising|ads|branding|brand awareness|newsletter)\\b"),
        WEBSITE("\\b(website|web site|landing page|portfolio|blog|e-commerce|ecommerce|online store|web ?app)\\b"),
        DATA_AI("\\b(machine learning|ml|ai|artificial intelligence|data pipeline|analytics|chatbot|data science|prediction)\\b"),
        GENERIC(null);

        private final Pattern keywords;

        Category(String regex) {
            this.keywords = regex == null ? null : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }

        static Category detect(String text) {
            for (Category category : values()) {
                if (category.keywords != null && category.keywords.matcher(text).find()) {
                    return category;
                }
            }
            return GENERIC;
        }
    }

    private static final Map<Category, PlanTemplate> TEMPLATES = new EnumMap<>(Category.class);

    static {
        TEMPLATES.put(Category.MOBILE_APP, new PlanTemplate("Mobile App Project", "mobile application",
                List.of("Requirements & UX Flows Approved", "Clickable Prototype Validated",
                        "Beta Build Distributed to Testers", "App Store Release"),
                List.of(new TechnologyStackEntry("Mobile App", "React Native", "Single codebase for iOS and Android with a large component ecosystem"),
                        new TechnologyStackEntry("Backend API", "Spring Boot", "Mature REST stack with strong typing and testing support"),
                        new TechnologyStackEntry("Database", "PostgreSQL", "Reliable relational storage for user and activity data"),
                        new TechnologyStackEntry("Authentication & Push", "Firebase", "Managed sign-in and push notifications without extra servers")),
                List.of("1x Product Owner", "1x UI/UX Designer", "2x Mobile Developers", "1x Backend Developer", "1x QA Engineer"),
                List.of(new TaskTemplate("Discovery & Requirements", "Product Owner", 2),
                        new TaskTemplate("UX/UI Design", "UI/UX Designer", 3, 1),
                        new TaskTemplate("Mobile App Development", "Mobile Developer", 6, 2),
                        new TaskTemplate("Backend & API Development", "Backend Developer", 5, 2),
                        new TaskTemplate("Testing & QA", "QA Engineer", 3, 3, 4),
                        new TaskTemplate("Store Submission & Launch", "Product Owner", 1, 5))));

        TEMPLATES.put(Category.MARKETING, new PlanTemplate("Marketing Campaign", "marketing campaign",
                List.of("Audience & Positioning Defined", "Creative Assets Approved",
                        "Campaign Launched", "Performance Review Complete"),
                List.of(new TechnologyStackEntry("Marketing Automation", "HubSpot", "Email journeys, lead capture and CRM in one tool"),
                        new TechnologyStackEntry("Analytics", "Google Analytics 4", "Attribution and conversion tracking across channels"),
                        new TechnologyStackEntry("Design", "Figma", "Collaborative creation of campaign assets"),
                        new TechnologyStackEntry("Social Scheduling", "Buffer", "Planned publishing across social networks")),
                List.of("1x Marketing Manager", "1x Content Writer", "1x Graphic Designer", "1x Data Analyst"),
                List.of(new TaskTemplate("Market Research & Audience Definition", "Marketing Manager", 2),
                        new TaskTemplate("Messaging & Content Plan", "Content Writer", 2, 1),
                        new TaskTemplate("Creative Asset Production", "Graphic Designer", 3, 2),
                        new TaskTemplate("Channel Setup & Tracking", "Data Analyst", 2, 2),
                        new TaskTemplate("Campaign Execution", "Marketing Manager", 4, 3, 4),
                        new TaskTemplate("Results Analysis & Report", "Data Analyst", 1, 5))));

        TEMPLATES.put(Category.WEBSITE, new PlanTemplate("Website Project", "website",
                List.of("Sitemap & Wireframes Approved", "Visual Design Complete",
                        "Content Loaded on Staging", "Website Live"),
                List.of(new TechnologyStackEntry("Frontend", "Next.js", "Server-side rendering for fast pages and good SEO"),
                        new TechnologyStackEntry("CMS", "Strapi", "Editors update content without developer help"),
                        new TechnologyStackEntry("Hosting", "Vercel", "Zero-config deployments with a global CDN"),
                        new TechnologyStackEntry("Analytics", "Plausible", "Lightweight, privacy-friendly traffic insights")),
                List.of("1x Project Manager", "1x UI/UX Designer", "1x Frontend Developer", "1x Content Writer", "1x QA Tester"),
                List.of(new TaskTemplate("Requirements & Sitemap", "Project Manager", 2),
                        new TaskTemplate("Wireframes & Visual Design", "UI/UX Designer", 3, 1),
                        new TaskTemplate("Frontend Development", "Frontend Developer", 5, 2),
                        new TaskTemplate("Content Creation", "Content Writer", 3, 2),
                        new TaskTemplate("Testing & Launch", "QA Tester", 2, 3, 4))));

        TEMPLATES.put(Category.DATA_AI, new PlanTemplate("Data & AI Project", "data and AI solution",
                List.of("Data Sources Audited", "Baseline Model Trained",
                        "Model Integrated into Product", "Monitoring in Production"),
                List.of(new TechnologyStackEntry("Data Pipeline", "Apache Airflow", "Scheduled, observable ingestion and transformation jobs"),
                        new TechnologyStackEntry("Model Training", "Python with scikit-learn", "Fast iteration on proven algorithms"),
                        new TechnologyStackEntry("Model Serving", "FastAPI", "Lightweight HTTP inference endpoints"),
                        new TechnologyStackEntry("Storage", "PostgreSQL", "Structured storage for features and predictions")),
                List.of("1x Data Engineer", "1x Data Scientist", "1x Backend Developer", "1x MLOps Engineer"),
                List.of(new TaskTemplate("Data Discovery & Collection", "Data Engineer", 3),
                        new TaskTemplate("Data Pipeline Build", "Data Engineer", 4, 1),
                        new TaskTemplate("Model Prototyping", "Data Scientist", 5, 1),
                        new TaskTemplate("Integration & Serving", "Backend Developer", 3, 2, 3),
                        new TaskTemplate("Evaluation & Monitoring Setup", "MLOps Engineer", 2, 4))));

        TEMPLATES.put(Category.GENERIC, new PlanTemplate("New Project Plan", "software project",
                List.of("Requirements & Design Complete", "Development Phase 1 Complete",
                        "Testing & QA Complete", "Production Deployment"),
                List.of(new TechnologyStackEntry("Frontend", "React", "Component-based architecture for maintainable UI and rich ecosystem"),
                        new TechnologyStackEntry("Backend", "FastAPI", "High performance async framework with automatic API documentation"),
                        new TechnologyStackEntry("Database", "PostgreSQL", "Robust relational database with excellent data integrity"),
                        new TechnologyStackEntry("Deployment", "Docker", "Containerization for consistent deployment across environments")),
                List.of("1x Project Manager", "1x UI/UX Designer", "2x Full-Stack Developers", "1x QA Engineer"),
                List.of(new TaskTemplate("Project Planning & Requirements", "Project Manager", 3),
                        new TaskTemplate("UI/UX Design", "UI/UX Designer", 5, 1),
                        new TaskTemplate("Frontend Development", "Frontend Developer", 7, 2),
                        new TaskTemplate("Backend Development", "Backend Developer", 7, 2),
                        new TaskTemplate("Integration & Testing", "QA Engineer", 5, 3, 4),
                        new TaskTemplate("Deployment & Launch", "DevOps", 2, 5))));
    }

    private final PlannerProperties plannerProperties;
    private final Clock clock;

    public ProjectPlan synthesize(List<ConversationTurn> transcript) {
        List<String> userTexts = transcript == null ? List.of() : transcript.stream()
                .filter(turn -> turn != null && turn.isFromUser() && turn.getContent() != null)
                .map(ConversationTurn::getContent)
                .toList();
        String userText = String.join("\n", userTexts);

        Category category = Category.detect(userText);
        PlanTemplate template = TEMPLATES.get(category);
        int timeframeDays = detectTimeframeDays(userText).orElse(plannerProperties.getSynthetic().getDefaultTimeframeDays());
        OptionalInt teamSize = detectTeamSize(userText);
        String projectName = deriveProjectName(userTexts, template.defaultName);

        GanttGraph gantt = schedule(template.tasks, timeframeDays, LocalDate.now(clock));
        log.info("Synthetic plan built: category={}, timeframeDays={}, tasks={}",
                category, timeframeDays, gantt.getTasks().size());

        List<String> resources = new ArrayList<>();
        teamSize.ifPresent(size -> resources.add(String.format("Core team of %d %s, as described in the conversation",
                size, size == 1 ? "person" : "people")));
        resources.addAll(template.resources);

        ProjectPlan plan = new ProjectPlan();
        plan.setProjectName(projectName);
        plan.setExecutiveSummary(summarize(projectName, template, timeframeDays, teamSize, gantt));
        plan.setKeyMilestones(new ArrayList<>(template.milestones));
        plan.setTechnologyStack(template.stack.stream()
                .map(entry -> new TechnologyStackEntry(entry.getComponent(), entry.getTechnology(), entry.getRationale()))
                .collect(Collectors.toCollection(ArrayList::new)));
        plan.setResourceSuggestions(resources);
        plan.setGanttData(gantt);
        return plan;
    }

    static GanttGraph schedule(List<TaskTemplate> templates, int timeframeDays, LocalDate projectStart) {
        double[] pathWeight = new double[templates.size()];
        double criticalWeight = 0;
        for (int i = 0; i < templates.size(); i++) {
            TaskTemplate template = templates.get(i);
            double longestPredecessor = 0;
            for (int predecessor : template.predecessors) {
                longestPredecessor = Math.max(longestPredecessor, pathWeight[predecessor - 1]);
            }
            pathWeight[i] = longestPredecessor + template.weight;
            criticalWeight = Math.max(criticalWeight, pathWeight[i]);
        }

        List<GanttTask> tasks = new ArrayList<>();
        List<GanttLink> links = new ArrayList<>();
        for (int i = 0; i < templates.size(); i++) {
            TaskTemplate template = templates.get(i);
            int id = i + 1;
            int duration = (int) Math.max(1, Math.round(template.weight * timeframeDays / criticalWeight));
            LocalDate start = projectStart;
            for (int predecessor : template.predecessors) {
                LocalDate predecessorFinish = tasks.get(predecessor - 1).finishDate();
                if (predecessorFinish.isAfter(start)) {
                    start = predecessorFinish;
                }
                links.add(GanttLink.finishToStart(links.size() + 1, predecessor, id));
            }
            tasks.add(new GanttTask(id, template.label, start, duration, 0.0, template.owner));
        }
        return new GanttGraph(tasks, links);
    }

    static OptionalInt detectTimeframeDays(String text) {
        Matcher matcher = TIMEFRAME_PATTERN.matcher(text);
        OptionalInt days = OptionalInt.empty();
        while (matcher.find()) {
            int amount = parseNumber(matcher.group(1));
            if (amount <= 0) {
                continue;
            }
            int unitDays = switch (matcher.group(2).toLowerCase(Locale.ROOT)) {
                case "week" -> 7;
                case "month" -> 30;
                case "year" -> 365;
                default -> 1;
            };
            days = OptionalInt.of((int) Math.min(MAX_TIMEFRAME_DAYS, (long) amount * unitDays));
        }
        return days;
    }

    static OptionalInt detectTeamSize(String text) {
        Matcher matcher = TEAM_SIZE_PATTERN.matcher(text);
        OptionalInt size = OptionalInt.empty();
        while (matcher.find()) {
            int amount = parseNumber(matcher.group(1));
            if (amount > 0) {
                size = OptionalInt.of(amount);
            }
        }
        if (size.isEmpty() && SOLO_PATTERN.matcher(text).find()) {
            size = OptionalInt.of(1);
        }
        return size;
    }

    static String deriveProjectName(List<String> userTexts, String defaultName) {
        String name = null;
        for (String text : userTexts) {
            Matcher matcher = PROJECT_NOUN_PATTERN.matcher(text);
            while (matcher.find()) {
                if (!matcher.group(1).isBlank()) {
                    name = matcher.group(1) + matcher.group(2);
                }
            }
        }
        if (name == null) {
            return defaultName;
        }
        String cleaned = Arrays.stream(name.replaceAll("[^A-Za-z0-9 ]", " ").trim().split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
        return cleaned.isBlank() ? defaultName : cleaned;
    }

    private static int parseNumber(String value) {
        Integer word = NUMBER_WORDS.get(value.toLowerCase(Locale.ROOT));
        if (word != null) {
            return word;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String summarize(String projectName, PlanTemplate template, int timeframeDays,
                                    OptionalInt teamSize, GanttGraph gantt) {
        String team = teamSize.isPresent()
                ? String.format(" with a team of %d", teamSize.getAsInt())
                : "";
        List<GanttTask> tasks = gantt.getTasks();
        return String.format("%s is a %s planned over roughly %d days%s. "
                        + "The schedule runs from %s to %s across %d tasks, built on %s and %s.",
                projectName, template.description, timeframeDays, team,
                tasks.get(0).getLabel(), tasks.get(tasks.size() - 1).getLabel(), tasks.size(),
                template.stack.get(0).getTechnology(), template.stack.get(1).getTechnology());
    }

    private static final class PlanTemplate {
        private final String defaultName;
        private final String description;
        private final List<String> milestones;
        private final List<TechnologyStackEntry> stack;
        private final List<String> resources;
        private final List<TaskTemplate> tasks;

        private PlanTemplate(String defaultName, String description, List<String> milestones,
                             List<TechnologyStackEntry> stack, List<String> resources, List<TaskTemplate> tasks) {
            this.defaultName = defaultName;
            this.description = description;
            this.milestones = milestones;
            this.stack = stack;
            this.resources = resources;
            this.tasks = tasks;
        }
    }

    static final class TaskTemplate {
        private final String label;
        private final String owner;
        private final int weight;
        private final int[] predecessors;

        TaskTemplate(String label, String owner, int weight, int... predecessors) {
            this.label = label;
            this.owner = owner;
            this.weight = weight;
            this.predecessors = predecessors;
        }
    }
}
