package com.demo.churn.service.error;

import java.util.List;

/** Input records do not expose every column of the feature schema. */
public class SchemaException extends ChurnScoringException {

    private final List<String> missingColumns;

    public SchemaException(List<String> missingColumns) {
        super("Missing required feature columns: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
