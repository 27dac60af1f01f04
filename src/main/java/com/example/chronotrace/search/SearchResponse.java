package com.example.chronotrace.search;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SearchResponse {
    String queryId;
    String query;
    boolean cacheHit;
    long latencyMs;
    List<SearchHit> results;
}
