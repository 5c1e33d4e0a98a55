package com.amannm.pdftk.mcp;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Simple record describing the outcome of a page operation for JSON serialization.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OperationSummary(
    String operation,
    String output,
    @JsonProperty("page_count") int pageCount,
    List<String> files
) {

    public OperationSummary(String operation, String output, int pageCount) {
        this(operation, output, pageCount, List.of());
    }
}
