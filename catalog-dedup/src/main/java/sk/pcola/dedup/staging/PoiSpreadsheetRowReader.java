package sk.pcola.dedup.staging;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.CellValue;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Apache POI čítačka pre xlsx/xls cenníky.
 * Bunky sa prevádzajú na text cez DataFormatter, takže číselný artikel 100 príde ako "100".
 * Čísla vo formáte General idú cez NumberToTextConverter - DataFormatter by 13-miestny
 * EAN skrátil na 4.00638E+12.
 */
@Component
public class PoiSpreadsheetRowReader implements SpreadsheetRowReader {

    private static final Logger log = LoggerFactory.getLogger(PoiSpreadsheetRowReader.class);

    private static final short GENERAL_FORMAT = 0;

    @Override
    public int read(Path file, Consumer<List<String>> consumer) throws IOException {
        log.debug("Reading spreadsheet {}", file);

        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            int sheetCount = workbook.getNumberOfSheets();
            if (sheetCount == 0) {
                throw new IllegalStateException("Spreadsheet " + file.getFileName() + " has no sheets");
            }

            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            int count = 0;

            for (int s = 0; s < sheetCount; s++) {
                Sheet sheet = workbook.getSheetAt(s);
                for (Row row : sheet) {
                    consumer.accept(toValues(row, formatter, evaluator));
                    count++;
                }
            }

            log.debug("Read {} rows from {} sheets of {}", count, sheetCount, file.getFileName());
            return count;
        }
    }

    private List<String> toValues(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
        int lastCell = row.getLastCellNum();
        if (lastCell <= 0) {
            return List.of();
        }

        List<String> values = new ArrayList<>(lastCell);
        for (int c = 0; c < lastCell; c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            values.add(cell == null ? "" : toText(cell, formatter, evaluator));
        }
        return values;
    }

    private String toText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell.getCellStyle().getDataFormat() == GENERAL_FORMAT) {
            if (cell.getCellType() == CellType.NUMERIC) {
                return NumberToTextConverter.toText(cell.getNumericCellValue());
            }
            if (cell.getCellType() == CellType.FORMULA) {
                CellValue value = evaluator.evaluate(cell);
                if (value != null && value.getCellType() == CellType.NUMERIC) {
                    return NumberToTextConverter.toText(value.getNumberValue());
                }
            }
        }
        return formatter.formatCellValue(cell, evaluator);
    }
}
