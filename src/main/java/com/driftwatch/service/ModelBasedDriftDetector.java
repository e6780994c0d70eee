package com.driftwatch.service;

import com.driftwatch.domain.FeatureFrame;
import com.driftwatch.domain.FieldValue;
import com.driftwatch.domain.ModelDriftReport;
import com.driftwatch.domain.ModelDriftSettings;
import com.driftwatch.domain.WindowDescriptor;
import com.yahoo.labs.samoa.instances.Attribute;
import com.yahoo.labs.samoa.instances.DenseInstance;
import com.yahoo.labs.samoa.instances.Instance;
import com.yahoo.labs.samoa.instances.Instances;
import com.yahoo.labs.samoa.instances.InstancesHeader;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import moa.classifiers.meta.OzaBag;
import moa.core.Utils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Domain-classifier drift: a bagged Hoeffding-tree ensemble learns to tell baseline
 * rows (label 0) from current rows (label 1). Held-out accuracy near 0.5 means the
 * windows are indistinguishable; accuracy near 1.0 means strong drift.
 *
 * <p>Training runs on a dedicated pool and the caller blocks for the result.
 */
@Slf4j
@Service
public class ModelBasedDriftDetector {

    static final String MODEL_TYPE = "BaggedHoeffdingTrees";
    private static final String LABEL_ATTRIBUTE = "__window__";
    private static final List<String> LABELS = List.of("baseline", "current");

    @Value("${drift.model.pool-size:2}")
    private int poolSize;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
        log.info("Model drift pool started | threads={}", Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public Optional<ModelDriftReport> runModelBasedDrift(List<Map<String, FieldValue>> baselineRows,
                                                         List<Map<String, FieldValue>> currentRows,
                                                         ModelDriftSettings settings) {
        return runModelBasedDrift(baselineRows, currentRows, settings,
            WindowDescriptor.adHoc(baselineRows.size()), WindowDescriptor.adHoc(currentRows.size()));
    }

    public Optional<ModelDriftReport> runModelBasedDrift(List<Map<String, FieldValue>> baselineRows,
                                                         List<Map<String, FieldValue>> currentRows,
                                                         ModelDriftSettings settings,
                                                         WindowDescriptor baselineWindow,
                                                         WindowDescriptor currentWindow) {
        FeatureFrame baseline = FeatureFrame.of(baselineRows);
        FeatureFrame current = FeatureFrame.of(currentRows);
        List<String> columns = baseline.numericColumns();
        if (columns.isEmpty() || baseline.rowCount() < 2 || current.rowCount() < 2) {
            log.info("Model drift skipped | columns={} | baseline={} | current={}",
                     columns.size(), baseline.rowCount(), current.rowCount());
            return Optional.empty();
        }
        try {
            ModelDriftReport report = CompletableFuture
                .supplyAsync(() -> evaluate(baseline, current, columns, settings), executor)
                .join()
                .toBuilder()
                .baselineWindow(baselineWindow)
                .currentWindow(currentWindow)
                .build();
            return Optional.of(report);
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw ex;
        }
    }

    ModelDriftReport evaluate(FeatureFrame baseline, FeatureFrame current,
                              List<String> columns, ModelDriftSettings settings) {
        Instances header = header(columns, baseline.rowCount() + current.rowCount());
        List<Instance> baselineSet = toInstances(baseline, columns, 0, header);
        List<Instance> currentSet = toInstances(current, columns, 1, header);

        Random random = new Random(settings.getSeed());
        List<Instance> train = new ArrayList<>();
        List<Instance> test = new ArrayList<>();
        split(baselineSet, settings.getTestFraction(), random, train, test);
        split(currentSet, settings.getTestFraction(), random, train, test);
        Collections.shuffle(train, random);

        OzaBag ensemble = newEnsemble(settings, header);
        for (Instance instance : train) {
            ensemble.trainOnInstance(instance);
        }

        int correct = 0;
        for (Instance instance : test) {
            double[] votes = ensemble.getVotesForInstance(instance);
            int predicted = votes.length == 0 ? 0 : Utils.maxIndex(votes);
            if (predicted == (int) instance.classValue()) {
                correct++;
            }
        }
        double accuracy = test.isEmpty() ? 0.0 : (double) correct / test.size();
        boolean alert = accuracy >= settings.getAlertThreshold();
        log.info("Model drift computed | accuracy={} | alert={} | train={} | test={}",
                 accuracy, alert, train.size(), test.size());

        return ModelDriftReport.builder()
            .driftScore(accuracy)
            .alert(alert)
            .alertThreshold(settings.getAlertThreshold())
            .baselineSamples(baseline.rowCount())
            .currentSamples(current.rowCount())
            .trainSamples(train.size())
            .testSamples(test.size())
            .modelType(MODEL_TYPE)
            .featureColumns(List.copyOf(columns))
            .build();
    }

    static OzaBag newEnsemble(ModelDriftSettings settings, Instances header) {
        OzaBag ensemble = new OzaBag();
        ensemble.ensembleSizeOption.setValue(settings.getEnsembleSize());
        ensemble.setRandomSeed(settings.getSeed());
        ensemble.setModelContext(new InstancesHeader(header));
        ensemble.prepareForUse();
        return ensemble;
    }

    static Instances header(List<String> columns, int capacity) {
        Attribute[] attributes = new Attribute[columns.size() + 1];
        for (int i = 0; i < columns.size(); i++) {
            attributes[i] = new Attribute(columns.get(i));
        }
        attributes[columns.size()] = new Attribute(LABEL_ATTRIBUTE, LABELS);
        Instances header = new Instances("window-membership", attributes, capacity);
        header.setClassIndex(header.numAttributes() - 1);
        return header;
    }

    // missing or absent numeric values become 0
    private static List<Instance> toInstances(FeatureFrame frame, List<String> columns,
                                              int label, Instances header) {
        List<Instance> instances = new ArrayList<>(frame.rowCount());
        double[][] matrix = new double[frame.rowCount()][columns.size() + 1];
        for (int c = 0; c < columns.size(); c++) {
            List<FieldValue> values = frame.column(columns.get(c));
            for (int r = 0; r < frame.rowCount(); r++) {
                FieldValue v = r < values.size() ? values.get(r) : FieldValue.missing();
                matrix[r][c] = v.isNumber() ? v.asDouble() : 0.0;
            }
        }
        for (double[] row : matrix) {
            row[columns.size()] = label;
            Instance instance = new DenseInstance(1d, row);
            instance.setDataset(header);
            instances.add(instance);
        }
        return instances;
    }

    // per-class holdout keeps the label balance of the full set in both splits
    private static void split(List<Instance> instances, double testFraction, Random random,
                              List<Instance> train, List<Instance> test) {
        List<Instance> shuffled = new ArrayList<>(instances);
        Collections.shuffle(shuffled, random);
        int testCount = (int) Math.round(shuffled.size() * testFraction);
        testCount = Math.max(1, Math.min(testCount, shuffled.size() - 1));
        test.addAll(shuffled.subList(0, testCount));
        train.addAll(shuffled.subList(testCount, shuffled.size()));
    }
}
