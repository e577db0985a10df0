package infra.xlsx;

import domain.grid.CellArea;
import domain.grid.NamedRegion;
import domain.grid.TableRegion;
import infra.grid.MemoryCellStore;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFName;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;
import org.apache.poi.xssf.usermodel.XSSFTableColumn;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes an .xlsx workbook into a {@link MemoryCellStore}.
 *
 * <ul>
 *   <li>cells: string, numeric (as Double), boolean; formula cells contribute their cached
 *   value; blank and error cells are skipped</li>
 *   <li>tables: area, header/totals row counts and declared column names</li>
 *   <li>named ranges: workbook-scoped names whose formula is a single contiguous area.
 *   Built-in names ({@code _xlnm.*}), sheet-scoped names and anything else are skipped</li>
 * </ul>
 */
public final class XlsxCellStoreReader {

    private static final Logger log = LoggerFactory.getLogger(XlsxCellStoreReader.class);

    public MemoryCellStore read(Path path) {
        if (path == null) throw new IllegalArgumentException("path is null");
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Workbook not found: " + path.toAbsolutePath());
        }

        try (InputStream is = Files.newInputStream(path);
             XSSFWorkbook wb = new XSSFWorkbook(is)) {

            MemoryCellStore store = new MemoryCellStore();

            for (int i = 0; i < wb.getNumberOfSheets(); i++) {
                XSSFSheet sheet = wb.getSheetAt(i);
                readSheet(store, sheet);
            }

            for (XSSFName name : wb.getAllNames()) {
                readName(store, name);
            }

            log.info("Read workbook {}: {} sheets, {} named ranges",
                    path.getFileName(), store.sheetNames().size(), store.namedRanges().size());
            return store;

        } catch (IOException e) {
            throw new IllegalStateException("Failed to read workbook: " + path.toAbsolutePath(), e);
        }
    }

    private void readSheet(MemoryCellStore store, XSSFSheet sheet) {
        String sheetName = sheet.getSheetName();
        store.addSheet(sheetName);

        for (Row row : sheet) {
            for (Cell cell : row) {
                Object v = valueOf(cell);
                if (v != null) store.setCell(sheetName, cell.getRowIndex() + 1, cell.getColumnIndex() + 1, v);
            }
        }

        for (XSSFTable t : sheet.getTables()) {
            CellReference start = t.getStartCellReference();
            CellReference end = t.getEndCellReference();
            CellArea area = new CellArea(start.getRow() + 1, start.getCol() + 1, end.getRow() + 1, end.getCol() + 1);

            List<String> columnNames = new ArrayList<>();
            for (XSSFTableColumn c : t.getColumns()) {
                columnNames.add(c.getName());
            }

            store.addTable(new TableRegion(t.getName(), sheetName, area,
                    Math.min(1, t.getHeaderRowCount()), Math.min(1, t.getTotalsRowCount()), columnNames));
            log.debug("Table '{}' on sheet '{}' at {}", t.getName(), sheetName, area);
        }
    }

    private void readName(MemoryCellStore store, XSSFName name) {
        String nameName = name.getNameName();
        if (nameName == null || nameName.startsWith("_xlnm.")) return;
        if (name.getSheetIndex() != -1 || name.isFunctionName()) {
            log.debug("Skipping non workbook-scoped name '{}'", nameName);
            return;
        }

        String formula = name.getRefersToFormula();
        NamedRegion region = NamedRegion.parse(nameName, formula);
        if (region == null) {
            log.warn("Named range '{}' does not refer to a contiguous area ({}), skipped", nameName, formula);
            return;
        }
        store.addNamedRange(region);
    }

    private static Object valueOf(Cell cell) {
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) type = cell.getCachedFormulaResultType();

        switch (type) {
            case STRING:
                String s = cell.getStringCellValue();
                return (s == null || s.isEmpty()) ? null : s;
            case NUMERIC:
                return cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }
}
