package com.demo.churn.controller.dto;

import com.demo.churn.service.dto.ChurnPrediction;

import java.util.List;

public class ScoringRunResponse {
    public String refreshStatus;   // executed | skipped | failed
    public String refreshReason;
    public int rows;
    public boolean modelTrained;
    public long predictedChurn;
    public long churnedNow;
    public List<String> outputs;
    public List<ChurnPrediction> preview;
}
