package com.ClaimFlow.expense_backend.util;

import com.ClaimFlow.expense_backend.model.BillAnalysis;
import com.ClaimFlow.expense_backend.model.ExpenseClaim;
import com.ClaimFlow.expense_backend.model.User;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Slf4j
public class ReportGenerator {

    static final String[] CLAIM_COLUMNS = {
            "Expense Number", "Employee", "Employee Code", "Department", "Grade", "Category",
            "Amount", "Currency", "Expense Date", "Status", "Within Limits", "Limit Reason",
            "AI Recommendation", "Confidence", "Submitted At"
    };

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private ReportGenerator() {
        // Utility class, no instantiation
    }

    public static byte[] generateClaimsExcel(List<ExpenseClaim> claims, String title) {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            Sheet sheet = workbook.createSheet("Expense Claims");

            CellStyle titleStyle = createTitleStyle(workbook);
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle currencyStyle = createCurrencyStyle(workbook);
            CellStyle dateStyle = createDateStyle(workbook);

            int rowNum = 0;
            Row titleRow = sheet.createRow(rowNum++);
            titleRow.createCell(0).setCellValue(title);
            titleRow.getCell(0).setCellStyle(titleStyle);

            rowNum++; // Empty row

            Row headerRow = sheet.createRow(rowNum++);
            for (int i = 0; i < CLAIM_COLUMNS.length; i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(CLAIM_COLUMNS[i]);
                cell.setCellStyle(headerStyle);
            }

            BigDecimal total = BigDecimal.ZERO;
            for (ExpenseClaim claim : claims) {
                Row row = sheet.createRow(rowNum++);
                User owner = claim.getOwner();
                BillAnalysis analysis = claim.isAnalysisPresent() ? claim.getBillAnalysis() : null;

                row.createCell(0).setCellValue(claim.getExpenseNumber());
                row.createCell(1).setCellValue(claim.getOwnerName());
                row.createCell(2).setCellValue(owner != null ? owner.getEmployeeCode() : "");
                row.createCell(3).setCellValue(owner != null && owner.getDepartment() != null ? owner.getDepartment() : "");
                row.createCell(4).setCellValue(owner != null ? owner.getGrade().name() : "");
                row.createCell(5).setCellValue(claim.getCategory().getValue());

                Cell amountCell = row.createCell(6);
                amountCell.setCellValue(claim.getAmount().doubleValue());
                amountCell.setCellStyle(currencyStyle);

                row.createCell(7).setCellValue(claim.getCurrency());

                Cell dateCell = row.createCell(8);
                dateCell.setCellValue(claim.getExpenseDate());
                dateCell.setCellStyle(dateStyle);

                row.createCell(9).setCellValue(claim.getStatus().getValue());
                row.createCell(10).setCellValue(claim.isWithinLimits() ? "Yes" : "No");
                row.createCell(11).setCellValue(claim.getLimitReason() != null ? claim.getLimitReason() : "");
                row.createCell(12).setCellValue(analysis != null && analysis.getRecommendation() != null
                        ? analysis.getRecommendation().toValue() : "");
                if (analysis != null && analysis.getConfidenceScore() != null) {
                    row.createCell(13).setCellValue(analysis.getConfidenceScore());
                }
                row.createCell(14).setCellValue(claim.getSubmittedAt() != null
                        ? claim.getSubmittedAt().format(TIMESTAMP_FORMAT) : "");

                total = total.add(claim.getAmount());
            }

            rowNum++; // Empty row

            Row totalRow = sheet.createRow(rowNum);
            totalRow.createCell(5).setCellValue("Total (" + claims.size() + " claims):");
            totalRow.getCell(5).setCellStyle(headerStyle);
            totalRow.createCell(6).setCellValue(total.doubleValue());
            totalRow.getCell(6).setCellStyle(currencyStyle);

            for (int i = 0; i < CLAIM_COLUMNS.length; i++) {
                sheet.autoSizeColumn(i);
            }

            workbook.write(out);
            log.debug("Generated claims workbook with {} rows", claims.size());
            return out.toByteArray();

        } catch (IOException e) {
            log.error("Failed to generate claims Excel export", e);
            throw new UncheckedIOException("Failed to generate report", e);
        }
    }

    private static CellStyle createTitleStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints((short) 14);
        style.setFont(font);
        return style;
    }

    private static CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return style;
    }

    private static CellStyle createCurrencyStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        DataFormat format = workbook.createDataFormat();
        style.setDataFormat(format.getFormat("#,##0.00"));
        return style;
    }

    private static CellStyle createDateStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        DataFormat format = workbook.createDataFormat();
        style.setDataFormat(format.getFormat("yyyy-mm-dd"));
        return style;
    }
}
