package projeto_planejador_backend.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Plano de projeto validado")
public class ProjectPlan {

    @Schema(example = "Mobile Fitness App")
    private String projectName;

    private String executiveSummary;

    private List<String> keyMilestones = new ArrayList<>();

    private List<TechnologyStackEntry> technologyStack = new ArrayList<>();

    private List<String> resourceSuggestions = new ArrayList<>();

    private GanttGraph ganttData;
}
