package com.demo.churn.service.export;

import com.demo.churn.service.dto.ChurnPrediction;

import java.util.List;

/** Receives the rows of a finished scoring run. */
public interface PredictionSink {

    /**
     * @param includeActual whether the run had labels, so the actual-side columns carry data
     * @return where the rows went, for logging and the run response
     */
    String write(List<ChurnPrediction> predictions, boolean includeActual);
}
