package projeto_planejador_backend.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import projeto_planejador_backend.model.ConversationTurn;
import projeto_planejador_backend.model.PlanGenerationResult;
import projeto_planejador_backend.model.SufficiencyResult;
import projeto_planejador_backend.service.PlannerMetricsService;

import java.util.List;

@Aspect
@Component
public class PlanGenerationLoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(PlanGenerationLoggingAspect.class);
    private final PlannerMetricsService plannerMetricsService;

    public PlanGenerationLoggingAspect(PlannerMetricsService plannerMetricsService) {
        this.plannerMetricsService = plannerMetricsService;
    }

    @Pointcut("execution(public * projeto_planejador_backend.service.PlanGenerationService.generate*(..))"
            + " || execution(public * projeto_planejador_backend.service.SufficiencyEstimatorService.evaluate(..))")
    public void plannerOperationPointcut() {}

    @Around("plannerOperationPointcut()")
    public Object logPlannerOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().getName();
        Object[] args = joinPoint.getArgs();
        int turns = args.length > 0 && args[0] instanceof List<?> transcript ? transcript.size() : 0;
        long userTurns = args.length > 0 && args[0] instanceof List<?> transcript
                ? transcript.stream().filter(t -> t instanceof ConversationTurn turn && turn.isFromUser()).count()
                : 0;

        log.info(">> Iniciando: {}() | Mensagens: {} ({} do usuário)", methodName, turns, userTurns);
        long startTime = System.currentTimeMillis();
        Throwable thrownException = null;

        try {
            Object result = joinPoint.proceed();
            if (result instanceof PlanGenerationResult generation) {
                log.info("<< Plano gerado por '{}' após {} tentativa(s) de tier", generation.getSource(), generation.getAttempts().size());
            } else if (result instanceof SufficiencyResult sufficiency) {
                log.info("<< Suficiência: score={} suficiente={}", sufficiency.getScore(), sufficiency.isSufficient());
            }
            return result;
        } catch (Throwable e) {
            thrownException = e;
            throw e;
        } finally {
            long executionTime = System.currentTimeMillis() - startTime;
            if (thrownException == null) {
                log.info("<< Finalizado com sucesso: {}() | Tempo de Execução Total: {}ms", methodName, executionTime);
            } else {
                log.error("<< Finalizado com erro: {}() | Tempo de Execução Total: {}ms | Erro: {}", methodName, executionTime, thrownException.getMessage());
            }
            plannerMetricsService.recordOperationTime(methodName, thrownException == null, executionTime);
        }
    }
}
