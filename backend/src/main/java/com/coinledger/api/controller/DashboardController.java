package com.coinledger.api.controller;

import com.coinledger.reporting.DashboardQueryService;
import com.coinledger.reporting.DashboardView;
import com.coinledger.reporting.ReportFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/dashboard and GET /api/export/operations over a finished session.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DashboardController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final DashboardQueryService dashboardQueryService;

    @GetMapping("/dashboard")
    public DashboardView dashboard(
            @RequestParam("session_id") String sessionId,
            @RequestParam(name = "group_by", required = false) String groupBy,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(required = false) String asset,
            @RequestParam(required = false) String type
    ) {
        return dashboardQueryService.dashboard(sessionId, ReportFilter.of(groupBy, startDate, endDate, asset, type));
    }

    @GetMapping("/export/operations")
    public ResponseEntity<String> exportOperations(
            @RequestParam("session_id") String sessionId,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(required = false) String asset,
            @RequestParam(required = false) String type
    ) {
        String csv = dashboardQueryService.exportOperations(sessionId, ReportFilter.of(null, startDate, endDate, asset, type));
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename("operations.csv").build().toString())
                .body(csv);
    }
}
