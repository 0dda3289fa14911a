package com.demo.churn.service;

import com.demo.churn.service.dto.ChurnPrediction;
import com.demo.churn.service.refresh.RefreshOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ScoringRunResult {

    RefreshOutcome refresh;
    int rows;
    boolean modelTrained;
    long predictedChurnCount;
    long churnedNowCount;
    List<String> outputs;
    List<ChurnPrediction> predictions;
}
