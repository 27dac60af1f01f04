package com.example.chronotrace.web;

import com.example.chronotrace.anomaly.AnomalyService;
import com.example.chronotrace.anomaly.AnomalyStatus;
import com.example.chronotrace.anomaly.Severity;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/anomalies")
public class AnomalyController {

    private final AnomalyService anomalyService;

    public AnomalyController(AnomalyService anomalyService) {
        this.anomalyService = anomalyService;
    }

    @GetMapping
    public List<ApiModels.AnomalyView> list(
            @RequestParam(name = "status", required = false) AnomalyStatus status,
            @RequestParam(name = "severity", required = false) Severity severity,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return anomalyService.query(status, severity, from, to).stream()
                .map(ApiModels.AnomalyView::of)
                .collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ApiModels.AnomalyView get(@PathVariable("id") String id) {
        return ApiModels.AnomalyView.of(anomalyService.get(id));
    }

    @PostMapping("/{id}/status")
    public ApiModels.AnomalyView updateStatus(@PathVariable("id") String id, @RequestBody ApiModels.StatusUpdate body) {
        if (body.getStatus() == null) throw new IllegalArgumentException("status is required");
        return ApiModels.AnomalyView.of(anomalyService.updateStatus(id, body.getStatus()));
    }
}
