package com.scholary.survey.translator.spreadsheet;

import com.scholary.survey.translator.batch.BatchValidationException;
import com.scholary.survey.translator.batch.Item;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads survey questions from an uploaded spreadsheet.
 *
 * <p>Questions are taken from the first column of the first sheet. There is no header row. Blank
 * cells are skipped, but every question keeps the number of the spreadsheet row it came from so
 * that repeated question texts stay bound to their own rows.
 */
@Component
public class QuestionReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(QuestionReader.class);

  private static final Set<String> ALLOWED_EXTENSIONS = Set.of("xlsx", "xls");

  private final DataFormatter formatter = new DataFormatter();

  public static boolean isAllowedFile(String filename) {
    if (filename == null) {
      return false;
    }
    int dot = filename.lastIndexOf('.');
    return dot >= 0
        && ALLOWED_EXTENSIONS.contains(filename.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  /**
   * Read the questions of a workbook.
   *
   * @param filename the uploaded file name, used for the extension check
   * @param input the workbook content
   * @return the questions with their 1-based row numbers, possibly empty
   * @throws BatchValidationException if the file type is not allowed or the workbook is unreadable
   */
  public List<Item> read(String filename, InputStream input) {
    if (!isAllowedFile(filename)) {
      throw new BatchValidationException(
          "Invalid file type. Please upload an Excel file (.xlsx or .xls)");
    }

    try (Workbook workbook = WorkbookFactory.create(input)) {
      Sheet sheet = workbook.getSheetAt(0);
      List<Item> items = new ArrayList<>();
      for (Row row : sheet) {
        Cell cell = row.getCell(0);
        if (cell == null) {
          continue;
        }
        String text = formatter.formatCellValue(cell);
        if (!text.isBlank()) {
          items.add(new Item(row.getRowNum() + 1, text));
        }
      }

      LOGGER.info("Read {} questions from {}", items.size(), filename);
      return items;

    } catch (IOException | EncryptedDocumentException | UnsupportedFileFormatException e) {
      throw new BatchValidationException("Could not read Excel file: " + e.getMessage(), e);
    }
  }
}
