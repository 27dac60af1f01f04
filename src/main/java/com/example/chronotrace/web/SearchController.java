package com.example.chronotrace.web;

import com.example.chronotrace.search.SearchResponse;
import com.example.chronotrace.search.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/search")
public class SearchController {

    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final SearchService searchService;

    public SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping
    public SearchResponse search(@RequestBody ApiModels.SearchBody body) {
        SearchResponse resp = searchService.search(body.toRequest());
        log.info("Search {} \"{}\": {} results, cacheHit={}, {} ms",
                resp.getQueryId(), body.getQuery(), resp.getResults().size(), resp.isCacheHit(), resp.getLatencyMs());
        return resp;
    }
}
