package com.csd.leadscore.service;

import com.csd.leadscore.exception.InvalidLeadException;
import com.csd.leadscore.model.ExportScope;
import com.csd.leadscore.model.LeadRecord;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LeadFileServiceTest {

    private final LeadFileService service = new LeadFileService();

    @Test
    void parsesQuotedFieldsAndKeepsExtraColumns() {
        String csv = "Full_Name,Email,Role,Company Size,Message\r\n"
                + "Ada Park,ada@corp.com,CTO,1000+,\"Urgent, \"\"critical\"\" migration\nfor 500 users\"\r\n"
                + "Bo Lee,bo@corp.com,Analyst,10-50,just looking\n";

        List<LeadRecord> records = service.parseCsv(csv);

        assertEquals(2, records.size());
        LeadRecord first = records.get(0);
        assertEquals("CTO", first.getRole());
        assertEquals("1000+", first.getCompanySize());
        assertEquals("Urgent, \"critical\" migration\nfor 500 users", first.getMessage());
        assertEquals("Ada Park", first.getAttributes().get("full_name"));
        assertEquals("ada@corp.com", first.getAttributes().get("email"));
        assertNull(first.getError());
        assertEquals("just looking", records.get(1).getMessage());
    }

    @Test
    void shortRowIsMarkedFailed() {
        List<LeadRecord> records = service.parseCsv("role,company_size,message\nCEO\n");
        assertEquals(1, records.size());
        assertNotNull(records.get(0).getError());
        assertEquals("CEO", records.get(0).getRole());
    }

    @Test
    void rowWithExtraFieldsIsMarkedFailed() {
        List<LeadRecord> records = service.parseCsv("role,company_size,message\nCTO,1000+,Need it now, budget approved\n");
        assertEquals(1, records.size());
        assertEquals("Row 2 has 4 of 3 columns", records.get(0).getError());
    }

    @Test
    void missingRequiredColumnIsRejected() {
        assertThrows(InvalidLeadException.class, () -> service.parseCsv("role,message\nCEO,hi\n"));
        assertThrows(InvalidLeadException.class, () -> service.parseCsv("  "));
    }

    @Test
    void blankLinesAreSkipped() {
        assertEquals(1, service.parseCsv("role,company_size,message\n\nCEO,1-10,hello\n\n").size());
    }

    @Test
    void csvExportSortsByScoreAndEscapes() {
        String csv = service.exportCsv(List.of(
                scored("Low Lead", 20, "Low Priority", "say \"hi\""),
                scored("Top Lead", 95, "High Priority", "a, b")), ExportScope.ALL);

        String[] lines = csv.split("\n");
        assertEquals("full_name,role,company_size,message,score,priority,justification", lines[0]);
        assertTrue(lines[1].startsWith("Top Lead,"));
        assertTrue(lines[1].contains("\"a, b\""));
        assertTrue(lines[2].contains("\"say \"\"hi\"\"\""));
    }

    @Test
    void csvExportPerPriorityGroupsSections() {
        String csv = service.exportCsv(List.of(
                scored("A", 90, "High Priority", "x"),
                scored("B", 0, "Junk/Error", "y")), ExportScope.PER_PRIORITY);

        assertTrue(csv.indexOf("=== High Priority ===") < csv.indexOf("=== Junk/Error ==="));
        assertFalse(csv.contains("=== Medium Priority ==="));
    }

    @Test
    void excelExportWritesSheets() throws Exception {
        List<LeadRecord> leads = List.of(
                scored("A", 90, "High Priority", "x"),
                scored("B", 0, "Junk/Error", "y"));

        try (Workbook single = new XSSFWorkbook(new ByteArrayInputStream(service.exportExcel(leads, ExportScope.ALL)))) {
            Sheet sheet = single.getSheet("Scored Leads");
            assertNotNull(sheet);
            assertEquals("full_name", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals(90, (int) sheet.getRow(1).getCell(4).getNumericCellValue());
        }
        try (Workbook grouped = new XSSFWorkbook(new ByteArrayInputStream(service.exportExcel(leads, ExportScope.PER_PRIORITY)))) {
            assertEquals(2, grouped.getNumberOfSheets());
            assertNotNull(grouped.getSheet("Junk_Error"));
        }
    }

    @Test
    void perPriorityExportGroupsByScoreNotLabel() throws Exception {
        List<LeadRecord> leads = List.of(
                scored("A", 95, "High Priority", "x"),
                scored("B", 90, "\uD83D\uDD25 High Priority", "y"),
                scored("C", 85, null, "z"));

        long allRows = service.exportCsv(leads, ExportScope.ALL).lines().filter(l -> l.contains(",CEO,")).count();
        String grouped = service.exportCsv(leads, ExportScope.PER_PRIORITY);
        long groupedRows = grouped.lines().filter(l -> l.contains(",CEO,")).count();
        assertEquals(3, allRows);
        assertEquals(allRows, groupedRows);
        assertTrue(grouped.startsWith("=== High Priority ==="));

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(service.exportExcel(leads, ExportScope.PER_PRIORITY)))) {
            assertEquals(1, workbook.getNumberOfSheets());
            assertEquals(3, workbook.getSheet("High Priority").getLastRowNum());
        }
    }

    private static LeadRecord scored(String name, int score, String priority, String justification) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("full_name", name);
        return LeadRecord.builder()
                .role("CEO").companySize("1-10").message("m")
                .score(score).priorityLabel(priority).justification(justification)
                .success(true).attributes(attributes)
                .build();
    }
}
