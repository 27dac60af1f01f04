package com.example.chronotrace.search;

import com.example.chronotrace.index.SearchFilters;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SearchRequest {
    String query;
    @Builder.Default
    SearchFilters filters = SearchFilters.none();
    /** null means the configured default */
    Integer topK;
    /** null means 0.0 */
    Double scoreThreshold;
}
