package projeto_planejador_backend.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import projeto_planejador_backend.model.ModelFailureKind;

import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlannerMetricsService {

    private static final String TAG_TIER = "tier";

    private final MeterRegistry meterRegistry;
    private final Cache<String, Counter> counterCache = Caffeine.newBuilder()
            .maximumSize(500)
            .expireAfterWrite(1, TimeUnit.HOURS)
            .build();
    private final Cache<String, Timer> timerCache = Caffeine.newBuilder()
            .maximumSize(500)
            .expireAfterWrite(1, TimeUnit.HOURS)
            .build();

    public void recordTierCallTime(String tierName, long durationMs) {
        try {
            getTimer("planner.tier.call.time", TAG_TIER, tierName).record(durationMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.warn("Failed to record tier call time metric", e);
        }
    }

    public void recordTierFailure(String tierName, ModelFailureKind kind) {
        try {
            getCounter("planner.tier.failures", TAG_TIER, tierName, "kind", kind.name()).increment();
        } catch (Exception e) {
            log.warn("Failed to record tier failure metric", e);
        }
    }

    public void recordValidationFailure(String stage) {
        try {
            getCounter("planner.validation.failures", "stage", stage).increment();
        } catch (Exception e) {
            log.warn("Failed to record validation failure metric", e);
        }
    }

    public void recordPlanGenerated(String source) {
        try {
            getCounter("planner.plans.generated", "source", source).increment();
        } catch (Exception e) {
            log.warn("Failed to record plan generated metric", e);
        }
    }

    public void recordSufficiencyFallback() {
        try {
            getCounter("planner.sufficiency.fallbacks").increment();
        } catch (Exception e) {
            log.warn("Failed to record sufficiency fallback metric", e);
        }
    }

    public void recordQuestionLoop() {
        try {
            getCounter("planner.sufficiency.loops").increment();
        } catch (Exception e) {
            log.warn("Failed to record question loop metric", e);
        }
    }

    public void recordOperationTime(String method, boolean success, long durationMs) {
        try {
            getTimer("planner.operation.time", "method", method, "status", success ? "success" : "failure")
                    .record(durationMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.warn("Failed to record operation time metric", e);
        }
    }

    private Counter getCounter(String name, String... tags) {
        try {
            String key = name + ":" + String.join(":", tags);
            return counterCache.get(key, k -> {
                Counter.Builder builder = Counter.builder(name);
                for (int i = 0; i + 1 < tags.length; i += 2) {
                    builder.tag(tags[i], tags[i + 1]);
                }
                return builder.register(meterRegistry);
            });
        } catch (Exception e) {
            log.warn("Failed to get or create counter: " + name, e);
            return Counter.builder(name).register(new SimpleMeterRegistry());
        }
    }

    private Timer getTimer(String name, String... tags) {
        try {
            String key = name + ":" + String.join(":", tags);
            return timerCache.get(key, k -> {
                Timer.Builder builder = Timer.builder(name);
                for (int i = 0; i + 1 < tags.length; i += 2) {
                    builder.tag(tags[i], tags[i + 1]);
                }
                return builder.register(meterRegistry);
            });
        } catch (Exception e) {
            log.warn("Failed to get or create timer: " + name, e);
            return Timer.builder(name).register(new SimpleMeterRegistry());
        }
    }
}
