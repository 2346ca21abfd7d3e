package com.csd.leadscore.service;

import com.csd.leadscore.exception.InvalidLeadException;
import com.csd.leadscore.model.ExportScope;
import com.csd.leadscore.model.LeadRecord;
import com.csd.leadscore.model.Priority;
import com.csd.leadscore.scoring.PriorityClassifier;
import com.csd.leadscore.scoring.ScoreAggregator;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * CSV ingestion of lead files and CSV / Excel export of scored leads.
 */
@Slf4j
@Service
public class LeadFileService {

    static final String ROLE = "role";
    static final String COMPANY_SIZE = "company_size";
    static final String MESSAGE = "message";

    private static final List<String> SCORE_COLUMNS = List.of("score", "priority", "justification");

    /**
     * Parse a lead CSV. The header must contain role, company_size and message (any case);
     * every other column is kept as an attribute.
     */
    public List<LeadRecord> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new InvalidLeadException("CSV is empty");
        }
        List<List<String>> rows = readRows(csv);
        List<String> header = rows.get(0).stream().map(this::normalizeHeader).collect(Collectors.toList());
        for (String required : List.of(ROLE, COMPANY_SIZE, MESSAGE)) {
            if (!header.contains(required)) {
                throw new InvalidLeadException("CSV header is missing required column '" + required + "'");
            }
        }

        List<LeadRecord> records = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() == 1 && row.get(0).isBlank()) continue; // trailing blank line
            records.add(toRecord(header, row, i + 1));
        }
        log.info("Parsed {} lead rows from CSV", records.size());
        return records;
    }

    private LeadRecord toRecord(List<String> header, List<String> row, int lineNo) {
        LeadRecord record = new LeadRecord();
        for (int c = 0; c < header.size(); c++) {
            String value = c < row.size() ? row.get(c).trim() : null;
            switch (header.get(c)) {
                case ROLE -> record.setRole(value);
                case COMPANY_SIZE -> record.setCompanySize(value);
                case MESSAGE -> record.setMessage(value);
                default -> {
                    if (value != null) record.getAttributes().put(header.get(c), value);
                }
            }
        }
        if (row.size() != header.size()) {
            record.setError("Row " + lineNo + " has " + row.size() + " of " + header.size() + " columns");
        }
        return record;
    }

    private String normalizeHeader(String name) {
        String n = name.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        if (n.startsWith("\uFEFF")) n = n.substring(1);
        return n.equals("companysize") ? COMPANY_SIZE : n;
    }

    /**
     * Splits CSV text into rows. Supports quoted fields with commas, doubled quotes and line
     * breaks.
     */
    List<List<String>> readRows(String csv) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < csv.length()) {
            char ch = csv.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < csv.length() && csv.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == ',') {
                row.add(field.toString());
                field.setLength(0);
            } else if (ch == '\r' || ch == '\n') {
                row.add(field.toString());
                field.setLength(0);
                rows.add(row);
                row = new ArrayList<>();
                if (ch == '\r' && i + 1 < csv.length() && csv.charAt(i + 1) == '\n') i++;
            } else {
                field.append(ch);
            }
            i++;
        }
        if (field.length() > 0 || !row.isEmpty()) {
            row.add(field.toString());
            rows.add(row);
        }
        return rows;
    }

    /**
     * Export scored leads as CSV, highest score first.
     */
    public String exportCsv(List<LeadRecord> leads, ExportScope scope) {
        List<String> attributeColumns = attributeColumns(leads);
        if (scope == ExportScope.PER_PRIORITY) {
            StringBuilder sb = new StringBuilder();
            for (Map.Entry<String, List<LeadRecord>> group : byPriority(leads).entrySet()) {
                sb.append("=== ").append(group.getKey()).append(" ===\n");
                appendCsv(sb, attributeColumns, group.getValue());
                sb.append("\n");
            }
            return sb.toString();
        }
        StringBuilder sb = new StringBuilder();
        appendCsv(sb, attributeColumns, sorted(leads));
        return sb.toString();
    }

    private void appendCsv(StringBuilder sb, List<String> attributeColumns, List<LeadRecord> leads) {
        sb.append(String.join(",", headers(attributeColumns))).append("\n");
        for (LeadRecord lead : leads) {
            List<String> values = values(attributeColumns, lead);
            sb.append(values.stream().map(this::escapeCsv).collect(Collectors.joining(","))).append("\n");
        }
    }

    /**
     * Export scored leads as an Excel workbook: one sheet, or one sheet per priority bucket.
     */
    public byte[] exportExcel(List<LeadRecord> leads, ExportScope scope) throws IOException {
        List<String> attributeColumns = attributeColumns(leads);
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = workbook.createCellStyle();
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);

            if (scope == ExportScope.PER_PRIORITY) {
                for (Map.Entry<String, List<LeadRecord>> group : byPriority(leads).entrySet()) {
                    writeSheet(workbook.createSheet(sanitizeSheetName(group.getKey())), headerStyle,
                            attributeColumns, group.getValue());
                }
            } else {
                writeSheet(workbook.createSheet("Scored Leads"), headerStyle, attributeColumns, sorted(leads));
            }

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            workbook.write(outputStream);
            return outputStream.toByteArray();
        }
    }

    private void writeSheet(Sheet sheet, CellStyle headerStyle, List<String> attributeColumns, List<LeadRecord> leads) {
        List<String> headers = headers(attributeColumns);
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < headers.size(); i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(headers.get(i));
            cell.setCellStyle(headerStyle);
        }

        int rowNum = 1;
        int scoreColumn = headers.indexOf("score");
        for (LeadRecord lead : leads) {
            Row row = sheet.createRow(rowNum++);
            List<String> values = values(attributeColumns, lead);
            for (int i = 0; i < values.size(); i++) {
                if (i == scoreColumn) {
                    row.createCell(i).setCellValue(lead.scoreOrZero());
                } else {
                    row.createCell(i).setCellValue(values.get(i));
                }
            }
        }

        for (int i = 0; i < headers.size(); i++) {
            sheet.autoSizeColumn(i);
        }
    }

    private List<String> attributeColumns(List<LeadRecord> leads) {
        LinkedHashSet<String> columns = new LinkedHashSet<>();
        for (LeadRecord lead : leads) {
            columns.addAll(lead.getAttributes().keySet());
        }
        return new ArrayList<>(columns);
    }

    private List<String> headers(List<String> attributeColumns) {
        List<String> headers = new ArrayList<>(attributeColumns);
        headers.addAll(List.of(ROLE, COMPANY_SIZE, MESSAGE));
        headers.addAll(SCORE_COLUMNS);
        return headers;
    }

    private List<String> values(List<String> attributeColumns, LeadRecord lead) {
        List<String> values = new ArrayList<>();
        for (String column : attributeColumns) {
            values.add(lead.getAttributes().getOrDefault(column, ""));
        }
        values.add(nullToEmpty(lead.getRole()));
        values.add(nullToEmpty(lead.getCompanySize()));
        values.add(nullToEmpty(lead.getMessage()));
        values.add(String.valueOf(lead.scoreOrZero()));
        values.add(nullToEmpty(lead.getPriorityLabel()));
        values.add(nullToEmpty(lead.getJustification()));
        return values;
    }

    private List<LeadRecord> sorted(List<LeadRecord> leads) {
        return leads.stream()
                .sorted(Comparator.comparingInt(LeadRecord::scoreOrZero).reversed())
                .collect(Collectors.toList());
    }

    private Map<String, List<LeadRecord>> byPriority(List<LeadRecord> leads) {
        Map<String, List<LeadRecord>> groups = new LinkedHashMap<>();
        for (Priority priority : Priority.values()) {
            List<LeadRecord> members = sorted(leads).stream()
                    .filter(l -> priorityOf(l) == priority)
                    .collect(Collectors.toList());
            if (!members.isEmpty()) {
                groups.put(priority.label(), members);
            }
        }
        return groups;
    }

    // grouped by score, not by the label text
    private Priority priorityOf(LeadRecord lead) {
        int score = Math.max(ScoreAggregator.MIN_SCORE, Math.min(ScoreAggregator.MAX_SCORE, lead.scoreOrZero()));
        return PriorityClassifier.classify(score);
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private String escapeCsv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private String sanitizeSheetName(String name) {
        // Excel sheet names can't contain: \ / ? * [ ]
        String sanitized = name.replaceAll("[\\\\/:*?\\[\\]]", "_");
        if (sanitized.length() > 31) {
            sanitized = sanitized.substring(0, 31);
        }
        return sanitized;
    }
}
