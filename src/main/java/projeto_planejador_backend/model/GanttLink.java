package projeto_planejador_backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GanttLink {

    private int id;

    @JsonProperty("source")
    private int sourceTaskId;

    @JsonProperty("target")
    private int targetTaskId;

    @JsonProperty("type")
    private LinkKind kind;

    public static GanttLink finishToStart(int id, int sourceTaskId, int targetTaskId) {
        return new GanttLink(id, sourceTaskId, targetTaskId, LinkKind.FINISH_TO_START);
    }

    /**
     * Dependency kinds, serialized with the numeric codes the Gantt widget uses.
     */
    public enum LinkKind {
        FINISH_TO_START("0", "finish-to-start"),
        START_TO_START("1", "start-to-start"),
        FINISH_TO_FINISH("2", "finish-to-finish"),
        START_TO_FINISH("3", "start-to-finish");

        private final String code;
        private final String label;

        LinkKind(String code, String label) {
            this.code = code;
            this.label = label;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        public String getLabel() {
            return label;
        }

        @JsonCreator
        public static LinkKind fromCode(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Tipo de dependência ausente");
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (LinkKind kind : values()) {
                if (kind.code.equals(normalized) || kind.label.equals(normalized)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Tipo de dependência inválido: " + value);
        }
    }
}
