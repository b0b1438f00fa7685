package projeto_planejador_backend.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GanttTask {

    private int id;

    @JsonProperty("text")
    private String label;

    @JsonProperty("start_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonProperty("duration")
    private int durationDays;

    @JsonProperty("progress")
    private double progressFraction;

    private String owner;

    /**
     * First day after the task ends. A finish-to-start successor may start on this date.
     */
    public LocalDate finishDate() {
        return startDate.plusDays(durationDays);
    }
}
