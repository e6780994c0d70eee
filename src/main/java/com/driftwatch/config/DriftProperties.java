package com.driftwatch.config;

import com.driftwatch.domain.DriftThresholds;
import com.driftwatch.domain.ModelDriftSettings;
import com.driftwatch.domain.TaskType;
import com.driftwatch.domain.WindowPolicyType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Application-wide drift defaults. Per-project overrides live in
 * {@code project_monitoring_configs}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "drift")
public class DriftProperties {

    private Windows windows = new Windows();
    private Statistical statistical = new Statistical();
    private Prediction prediction = new Prediction();
    private Model model = new Model();
    private Llm llm = new Llm();

    /** Upper bound on rows accepted by one ingestion call. */
    private int maxBatchSize = 10_000;

    public DriftThresholds toThresholds() {
        return DriftThresholds.builder()
            .meanThreshold(statistical.meanThreshold)
            .medianThreshold(statistical.medianThreshold)
            .varianceThreshold(statistical.varianceThreshold)
            .ksPValueThreshold(statistical.ksPValueThreshold)
            .ksStatisticThreshold(prediction.ksThreshold)
            .psiLowThreshold(statistical.psiLowThreshold)
            .psiHighThreshold(statistical.psiHighThreshold)
            .psiBins(statistical.psiBins)
            .minSamples(statistical.minSamples)
            .alertThreshold(statistical.alertThreshold)
            .columnQuantiles(List.copyOf(statistical.quantiles))
            .predictionQuantiles(List.copyOf(prediction.quantiles))
            .build();
    }

    public ModelDriftSettings toModelSettings() {
        return ModelDriftSettings.builder()
            .alertThreshold(model.alertThreshold)
            .ensembleSize(model.ensembleSize)
            .testFraction(model.testFraction)
            .seed(model.seed)
            .build();
    }

    @Getter
    @Setter
    public static class Windows {
        private int baselineBatchSize = 1000;
        private int monitorBatchSize = 500;
        private WindowPolicyType policy = WindowPolicyType.SLIDING;
        /** When false, projects without a stored config are never ready. */
        private boolean createDefaults = true;
    }

    @Getter
    @Setter
    public static class Statistical {
        private double meanThreshold = 0.10;
        private double medianThreshold = 0.10;
        private double varianceThreshold = 0.20;
        private double ksPValueThreshold = 0.05;
        private double psiLowThreshold = 0.10;
        private double psiHighThreshold = 0.25;
        private int psiBins = 10;
        private int minSamples = 50;
        private int alertThreshold = 2;
        private List<Double> quantiles = new ArrayList<>(List.of(0.25, 0.5, 0.75));
    }

    @Getter
    @Setter
    public static class Prediction {
        private TaskType taskType = TaskType.REGRESSION;
        private double ksThreshold = 0.10;
        private List<Double> quantiles = new ArrayList<>(List.of(0.25, 0.5, 0.75, 0.95));
    }

    @Getter
    @Setter
    public static class Model {
        private double alertThreshold = 0.50;
        private int ensembleSize = 200;
        private double testFraction = 0.2;
        private int seed = 42;
        private int poolSize = 2;
    }

    @Getter
    @Setter
    public static class Llm {
        private int baselineBatchSize = 1000;
        private int monitorBatchSize = 500;
        private double tokenDriftThreshold = 0.15;
    }
}
