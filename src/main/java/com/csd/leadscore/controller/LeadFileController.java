package com.csd.leadscore.controller;

import com.csd.leadscore.exception.InvalidLeadException;
import com.csd.leadscore.model.ExportScope;
import com.csd.leadscore.model.LeadRecord;
import com.csd.leadscore.service.LeadFileService;
import com.csd.leadscore.service.LeadScoringService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV import of leads (scored on arrival) and CSV / Excel export of scored leads.
 */
@Slf4j
@RestController
@RequestMapping("/api/leads")
public class LeadFileController {

    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private final LeadFileService fileService;
    private final LeadScoringService scoringService;

    public LeadFileController(LeadFileService fileService, LeadScoringService scoringService) {
        this.fileService = fileService;
        this.scoringService = scoringService;
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Map<String, Object> importFile(@RequestParam("file") MultipartFile file) throws IOException {
        log.info("Import request: file={}, size={}", file.getOriginalFilename(), file.getSize());
        return importCsv(new String(file.getBytes(), StandardCharsets.UTF_8));
    }

    @PostMapping(value = "/import", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public Map<String, Object> importText(@RequestBody String csv) {
        log.info("Import request: {} chars of CSV", csv.length());
        return importCsv(csv);
    }

    private Map<String, Object> importCsv(String csv) {
        List<LeadRecord> scored = scoringService.scoreRecords(fileService.parseCsv(csv));
        long successful = scored.stream().filter(LeadRecord::isSuccess).count();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("results", scored);
        response.put("total", scored.size());
        response.put("successful", successful);
        response.put("failed", scored.size() - successful);
        return response;
    }

    @PostMapping("/export/csv")
    public ResponseEntity<String> exportCsv(@RequestBody List<LeadRecord> leads,
                                            @RequestParam(defaultValue = "all") String scope) {
        log.info("Export CSV request: {} leads, scope={}", leads.size(), scope);
        String csv = fileService.exportCsv(leads, parseScope(scope));

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"scored-leads.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    @PostMapping("/export/excel")
    public ResponseEntity<byte[]> exportExcel(@RequestBody List<LeadRecord> leads,
                                              @RequestParam(defaultValue = "all") String scope) throws IOException {
        log.info("Export Excel request: {} leads, scope={}", leads.size(), scope);
        byte[] excel = fileService.exportExcel(leads, parseScope(scope));

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"scored-leads.xlsx\"")
                .contentType(MediaType.parseMediaType(XLSX))
                .body(excel);
    }

    private ExportScope parseScope(String scope) {
        if (scope.equalsIgnoreCase("all")) return ExportScope.ALL;
        if (scope.equalsIgnoreCase("per_priority") || scope.equalsIgnoreCase("per-priority")) return ExportScope.PER_PRIORITY;
        throw new InvalidLeadException("Unknown export scope: " + scope);
    }
}
