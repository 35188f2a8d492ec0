package com.csd.bizintel.controller;

import com.csd.bizintel.catalog.ScoreBands;
import com.csd.bizintel.model.DealPrediction;
import com.csd.bizintel.model.DealPredictionResponse;
import com.csd.bizintel.model.DealRecord;
import com.csd.bizintel.service.DealOutcomePredictor;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class DealController {

    private final DealOutcomePredictor dealOutcomePredictor;

    public DealController(DealOutcomePredictor dealOutcomePredictor) { this.dealOutcomePredictor = dealOutcomePredictor; }

    @PostMapping("/predict-deal")
    public DealPredictionResponse predictDeal(@Valid @RequestBody DealRecord deal) {
        DealPrediction prediction = dealOutcomePredictor.predictDealSuccess(deal);
        double probability = prediction.getSuccessProbability();
        return DealPredictionResponse.builder()
                .success(true)
                .prediction(prediction)
                .dealAnalysis(DealPredictionResponse.DealAnalysis.builder()
                        .riskLevel(ScoreBands.dealRiskLevel(probability))
                        .recommendedAction(ScoreBands.dealRecommendedAction(probability))
                        .build())
                .build();
    }
}
