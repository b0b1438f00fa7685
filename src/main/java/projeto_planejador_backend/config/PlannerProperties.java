package projeto_planejador_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import projeto_planejador_backend.model.TierSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "planner")
@Getter
@Setter
public class PlannerProperties {
    private List<TierSpec> tiers = new ArrayList<>();
    private Sufficiency sufficiency = new Sufficiency();
    private Input input = new Input();
    private Synthetic synthetic = new Synthetic();
    private String allowedOrigin = "http://localhost:5173";
    private double chatTemperature = 0.7;
    private double planTemperature = 0.3;

    @PostConstruct
    void validateTiers() {
        Set<String> names = new HashSet<>();
        for (TierSpec tier : tiers) {
            if (tier.getName() == null || tier.getName().isBlank()) {
                throw new IllegalStateException("planner.tiers: todo tier precisa de um nome");
            }
            if (!names.add(tier.getName())) {
                throw new IllegalStateException("planner.tiers: nome de tier duplicado '" + tier.getName() + "'");
            }
            if (tier.getProvider() == null) {
                throw new IllegalStateException("planner.tiers: tier '" + tier.getName() + "' sem provider");
            }
            if (tier.getBaseUrl() == null || tier.getBaseUrl().isBlank()) {
                throw new IllegalStateException("planner.tiers: tier '" + tier.getName() + "' sem base-url");
            }
        }
    }

    /**
     * Enabled tiers, highest quality first. Ties keep their declaration order.
     */
    public List<TierSpec> orderedTiers() {
        return tiers.stream()
                .filter(TierSpec::isEnabled)
                .sorted(Comparator.comparingInt(TierSpec::getRank))
                .toList();
    }

    public int maxTierTimeoutSeconds() {
        return tiers.stream()
                .mapToInt(TierSpec::getTimeoutSeconds)
                .max()
                .orElse(30);
    }

    @Getter
    @Setter
    public static class Sufficiency {
        private String tierName;
        private int loopWindow = 3;
        private double similarityThreshold = 0.9;
        private int sufficientScore = 100;
    }

    @Getter
    @Setter
    public static class Input {
        private int maxMessages = 50;
        private int maxCharsPerMessage = 4000;
    }

    @Getter
    @Setter
    public static class Synthetic {
        private int defaultTimeframeDays = 28;
    }
}
