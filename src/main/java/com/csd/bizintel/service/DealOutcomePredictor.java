package com.csd.bizintel.service;

import com.csd.bizintel.catalog.DealFactor;
import com.csd.bizintel.ml.GradientBoostingRegressor;
import com.csd.bizintel.ml.RegressionModel;
import com.csd.bizintel.ml.SyntheticDealDataset;
import com.csd.bizintel.model.DealPrediction;
import com.csd.bizintel.model.DealRecord;
import com.csd.bizintel.model.KeyFactor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Deal success probability from a gradient-boosted model bootstrapped on synthetic deals.
 * The model is trained once per instance, either on construction or on the first prediction,
 * and is read-only afterwards.
 */
@Slf4j
@Service
public class DealOutcomePredictor {

    static final double DEFAULT_VALUE = 10_000;
    static final double DEFAULT_MATCH_SCORE = 50;
    static final double DEFAULT_DURATION_MONTHS = 6;
    static final double MODEL_CONFIDENCE = 0.82;
    static final double FALLBACK_PROBABILITY = 50.0;
    static final double FALLBACK_CONFIDENCE = 0.3;

    private final AtomicInteger trainingRuns = new AtomicInteger();
    private volatile RegressionModel model;

    public DealOutcomePredictor(@Value("${bizintel.deal.train-on-startup:false}") boolean trainOnStartup) {
        if (trainOnStartup) {
            model();
        }
    }

    public DealPrediction predictDealSuccess(DealRecord deal) {
        try {
            double[] features = extractFeatures(deal == null ? new DealRecord() : deal);
            double probability = Math.max(0, Math.min(1, model().predict(features)));

            return DealPrediction.builder()
                    .successProbability(probability * 100)
                    .confidence(MODEL_CONFIDENCE)
                    .keyFactors(keyFactors(features))
                    .recommendations(recommendations(features, probability))
                    .build();
        } catch (Exception e) {
            log.error("Error predicting deal success: {}", e.getMessage(), e);
            return DealPrediction.builder()
                    .successProbability(FALLBACK_PROBABILITY)
                    .confidence(FALLBACK_CONFIDENCE)
                    .keyFactors(List.of())
                    .recommendations(List.of())
                    .build();
        }
    }

    public boolean isTrained() {
        return model != null;
    }

    int getTrainingRuns() {
        return trainingRuns.get();
    }

    RegressionModel model() {
        RegressionModel current = model;
        if (current == null) {
            synchronized (this) {
                current = model;
                if (current == null) {
                    current = train();
                    model = current;
                }
            }
        }
        return current;
    }

    private RegressionModel train() {
        trainingRuns.incrementAndGet();
        long started = System.nanoTime();
        SyntheticDealDataset dataset = SyntheticDealDataset.generate(
                SyntheticDealDataset.DEFAULT_SEED, SyntheticDealDataset.DEFAULT_SAMPLES);
        RegressionModel fitted = GradientBoostingRegressor.builder().build()
                .fit(dataset.features(), dataset.targets());
        log.info("Deal success prediction model trained on {} synthetic samples in {} ms",
                dataset.size(), (System.nanoTime() - started) / 1_000_000);
        return fitted;
    }

    static double[] extractFeatures(DealRecord deal) {
        double value = deal.getValue() == null ? DEFAULT_VALUE : deal.getValue();
        String description = deal.getDescription() == null ? "" : deal.getDescription();
        double matchScore = deal.getMatchScore() == null ? DEFAULT_MATCH_SCORE : deal.getMatchScore();
        double duration = deal.getDurationMonths() == null ? DEFAULT_DURATION_MONTHS : deal.getDurationMonths();

        return new double[]{
                value / 1_000_000,
                description.length() / 1000.0,
                matchScore / 100,
                description.toLowerCase(Locale.ROOT).contains("urgent") ? 1 : 0,
                duration / 12
        };
    }

    static List<KeyFactor> keyFactors(double[] features) {
        List<KeyFactor> factors = new ArrayList<>();
        for (DealFactor factor : DealFactor.values()) {
            if (!factor.isReported()) continue;
            double value = features[factor.ordinal()];
            factors.add(KeyFactor.builder()
                    .factor(factor.getDisplayName())
                    .importance(factor.getImportance())
                    .currentValue(value)
                    .impact(value > 0.5 ? "positive" : "negative")
                    .build());
        }
        return factors.stream()
                .sorted(Comparator.comparingDouble(KeyFactor::getImportance).reversed())
                .collect(Collectors.toList());
    }

    static List<String> recommendations(double[] features, double probability) {
        List<String> recommendations = new ArrayList<>();
        if (features[DealFactor.PARTNER_COMPATIBILITY.ordinal()] < 0.6) {
            recommendations.add("Consider improving partner alignment through preliminary meetings");
        }
        if (features[DealFactor.DESCRIPTION_DETAIL.ordinal()] < 0.3) {
            recommendations.add("Provide more detailed deal documentation to build trust");
        }
        if (probability < 0.5) {
            recommendations.add("Consider risk mitigation strategies or deal restructuring");
        }
        if (features[DealFactor.DEAL_VALUE.ordinal()] > 0.8) {
            recommendations.add("Implement milestone-based payment structure for large deals");
        }
        return recommendations;
    }
}
