package projeto_planejador_backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TechnologyStackEntry {
    private String component;
    private String technology;
    private String rationale;
}
