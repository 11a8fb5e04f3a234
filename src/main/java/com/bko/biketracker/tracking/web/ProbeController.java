package com.bko.biketracker.tracking.web;

import com.bko.biketracker.tracking.IngestProbeUseCase;
import com.bko.biketracker.tracking.app.IngestionResult;
import com.bko.biketracker.tracking.domain.RawProbeReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Endpoint called by the radio network for every message of the tracker.
 */
@RestController
public class ProbeController {
    private static final Logger logger = LoggerFactory.getLogger(ProbeController.class);

    private final IngestProbeUseCase ingestProbeUseCase;
    private final ProbeFormParser parser;

    public ProbeController(IngestProbeUseCase ingestProbeUseCase, ProbeFormParser parser) {
        this.ingestProbeUseCase = ingestProbeUseCase;
        this.parser = parser;
    }

    @PostMapping(value = "/new-probe", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<?> newProbe(@RequestParam Map<String, String> form) {
        RawProbeReport report;
        try {
            report = parser.parse(form);
        } catch (InvalidProbeReportException e) {
            logger.warn("Rejected probe report: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Bad request");
        }

        IngestionResult result = ingestProbeUseCase.ingest(report);
        Map<String, Object> body = Map.of(
                form.get("device").trim(), Map.of("downlinkData", result.downlinkToken()));
        return ResponseEntity.status(result.duplicate() ? HttpStatus.OK : HttpStatus.CREATED)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
