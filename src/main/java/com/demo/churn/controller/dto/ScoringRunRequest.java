package com.demo.churn.controller.dto;

import com.demo.churn.service.export.HeaderStyle;
import com.demo.churn.service.export.LoadMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

public class ScoringRunRequest {
    @Min(1)
    public Integer top;            // null = all rows
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}")
    public String asOf;            // keep only this snapshot date
    public boolean keepAllRows;
    public boolean forceRefresh;
    public boolean skipRefresh;
    public String csvOutput;       // relative to churn.output.dir, null = no CSV
    public String rawOutput;       // deduplicated source rows, null = none
    public HeaderStyle headers = HeaderStyle.FRIENDLY;
    public boolean writeTable;
    public LoadMode loadMode = LoadMode.REPLACE;
    public Integer previewRows = 20;
}
