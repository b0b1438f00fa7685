package projeto_planejador_backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GanttGraph {

    @JsonProperty("data")
    private List<GanttTask> tasks = new ArrayList<>();

    private List<GanttLink> links = new ArrayList<>();
}
