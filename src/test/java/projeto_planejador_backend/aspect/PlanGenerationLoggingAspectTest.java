package projeto_planejador_backend.aspect;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.PlanGenerationResult;
import projeto_planejador_backend.service.PlanGenerationService;
import projeto_planejador_backend.service.SufficiencyEstimatorService;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ExtendWith(OutputCaptureExtension.class)
@ActiveProfiles("test")
class PlanGenerationLoggingAspectTest {

    @Autowired
    private SufficiencyEstimatorService sufficiencyEstimatorService;

    @Autowired
    private PlanGenerationService planGenerationService;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void shouldLogAndTimeSufficiencyEvaluation(CapturedOutput output) {
        sufficiencyEstimatorService.evaluate(List.of());

        assertThat(output).contains(">> Iniciando: evaluate() | Mensagens: 0 (0 do usuário)");
        assertThat(output).contains("<< Suficiência: score=0 suficiente=false");
        assertThat(output).contains("<< Finalizado com sucesso: evaluate()");
        Timer timer = meterRegistry.find("planner.operation.time")
                .tag("method", "evaluate")
                .tag("status", "success")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void shouldLogPlanSourceWhenEveryTierIsUnreachable(CapturedOutput output) {
        PlanGenerationResult result = planGenerationService.generate(List.of(ConversationTurn.user("A website in 6 weeks")));

        assertThat(result.isSynthetic()).isTrue();
        assertThat(output).contains(">> Iniciando: generate() | Mensagens: 1 (1 do usuário)");
        assertThat(output).contains("<< Plano gerado por 'synthetic' após 2 tentativa(s) de tier");
    }
}
