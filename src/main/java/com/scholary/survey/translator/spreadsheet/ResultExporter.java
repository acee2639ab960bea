package com.scholary.survey.translator.spreadsheet;

import com.scholary.survey.translator.batch.BatchValidationException;
import com.scholary.survey.translator.batch.ItemResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

/**
 * Writes translation results as an Excel workbook.
 *
 * <p>Columns: Original Question, Detected Language, Confidence (%), Confidence Reason, English
 * Translation, Processed At. One data row per result, in the order given. Cell values are
 * written verbatim.
 */
@Component
public class ResultExporter {

  public static final String SHEET_NAME = "Translation Results";

  public static final String CONTENT_TYPE =
      "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

  static final List<String> HEADERS =
      List.of(
          "Original Question",
          "Detected Language",
          "Confidence (%)",
          "Confidence Reason",
          "English Translation",
          "Processed At");

  private static final int[] COLUMN_WIDTHS = {60, 20, 15, 40, 60, 20};

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  /**
   * Export results to an xlsx workbook.
   *
   * @param results the results to write
   * @param processedAt the timestamp written into every row
   * @return the workbook bytes
   * @throws BatchValidationException if there are no results
   */
  public byte[] export(List<ItemResult> results, LocalDateTime processedAt) {
    if (results == null || results.isEmpty()) {
      throw new BatchValidationException("No results to download");
    }

    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      Sheet sheet = workbook.createSheet(SHEET_NAME);
      writeHeader(workbook, sheet);

      String timestamp = processedAt.format(TIMESTAMP);
      for (int i = 0; i < results.size(); i++) {
        ItemResult result = results.get(i);
        Row row = sheet.createRow(i + 1);
        row.createCell(0).setCellValue(Objects.toString(result.originalQuestion(), ""));
        row.createCell(1).setCellValue(Objects.toString(result.detectedLanguage(), ""));
        row.createCell(2).setCellValue(result.confidence());
        row.createCell(3).setCellValue(Objects.toString(result.confidenceReason(), ""));
        row.createCell(4).setCellValue(Objects.toString(result.englishTranslation(), ""));
        row.createCell(5).setCellValue(timestamp);
      }

      workbook.write(out);
      return out.toByteArray();

    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write results workbook", e);
    }
  }

  /** Download name for an export, e.g. {@code survey_translation_results_20240101_120000.xlsx}. */
  public String fileName(LocalDateTime processedAt) {
    return "survey_translation_results_" + processedAt.format(FILE_TIMESTAMP) + ".xlsx";
  }

  private void writeHeader(XSSFWorkbook workbook, Sheet sheet) {
    Font bold = workbook.createFont();
    bold.setBold(true);
    CellStyle headerStyle = workbook.createCellStyle();
    headerStyle.setFont(bold);

    Row header = sheet.createRow(0);
    for (int column = 0; column < HEADERS.size(); column++) {
      Cell cell = header.createCell(column);
      cell.setCellValue(HEADERS.get(column));
      cell.setCellStyle(headerStyle);
      sheet.setColumnWidth(column, COLUMN_WIDTHS[column] * 256);
    }
  }
}
