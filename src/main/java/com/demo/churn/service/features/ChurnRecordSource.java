package com.demo.churn.service.features;

import java.util.List;

/** Supplies the raw churn feature rows a scoring run works on. */
public interface ChurnRecordSource {

    /**
     * @param top         optional row limit, null or non-positive for all rows
     * @param labelColumn label column to select, null to fetch without labels
     */
    List<ChurnRecord> fetch(Integer top, String labelColumn);
}
