package infra.xlsx;

import domain.grid.CellArea;
import domain.grid.CellStore;
import domain.grid.NamedRegion;
import domain.grid.TableRegion;
import domain.grid.WorkbookSaver;
import org.apache.poi.ooxml.POIXMLTypeLoader;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFName;
import org.apache.poi.xssf.usermodel.XSSFRelation;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;
import org.apache.poi.xssf.usermodel.XSSFTableColumn;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTTable;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTTableColumn;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.TableDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes a whole {@link CellStore} to a new .xlsx file: sheets, cell values, tables
 * (name, area, header/totals rows, column names) and workbook-scoped named ranges.
 * Styling is not written.
 */
public final class XlsxCellStoreWriter implements WorkbookSaver {

    private static final Logger log = LoggerFactory.getLogger(XlsxCellStoreWriter.class);

    @Override
    public void save(CellStore store, Path destination) {
        if (store == null) throw new IllegalArgumentException("store is null");
        if (destination == null) throw new IllegalArgumentException("destination is null");

        try {
            Path parent = destination.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create workbook parent dir: " + destination, e);
        }

        Map<String, List<String>> headerless = new LinkedHashMap<>();
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            for (String sheetName : store.sheetNames()) {
                XSSFSheet sheet = wb.createSheet(sheetName);
                writeCells(sheet, store.cells(sheetName));
                for (TableRegion t : store.tables(sheetName)) {
                    writeTable(sheet, t);
                    if (t.getHeaderRowCount() == 0) headerless.put(t.getName(), t.getColumnNames());
                }
            }

            for (NamedRegion n : store.namedRanges()) {
                XSSFName name = wb.createName();
                name.setNameName(n.getName());
                name.setRefersToFormula(n.getAddress());
            }

            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            wb.write(buffer);
            byte[] bytes = headerless.isEmpty()
                    ? buffer.toByteArray()
                    : restoreColumnNames(buffer.toByteArray(), headerless);

            try (OutputStream os = Files.newOutputStream(destination)) {
                os.write(bytes);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + destination, e);
        }

        log.info("Wrote workbook {}", destination.toAbsolutePath());
    }

    private static void writeCells(XSSFSheet sheet, Map<Integer, Map<Integer, Object>> cells) {
        for (Map.Entry<Integer, Map<Integer, Object>> r : cells.entrySet()) {
            XSSFRow row = sheet.createRow(r.getKey() - 1);
            for (Map.Entry<Integer, Object> c : r.getValue().entrySet()) {
                writeCell(row.createCell(c.getKey() - 1), c.getValue());
            }
        }
    }

    private static void writeCell(XSSFCell cell, Object value) {
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value != null) {
            cell.setCellValue(value.toString());
        }
    }

    private static void writeTable(XSSFSheet sheet, TableRegion t) {
        CellArea a = t.getArea();
        AreaReference ref = new AreaReference(
                new CellReference(a.getFirstRow() - 1, a.getFirstColumn() - 1),
                new CellReference(a.getLastRow() - 1, a.getLastColumn() - 1),
                SpreadsheetVersion.EXCEL2007);

        XSSFTable table = sheet.createTable(ref);
        table.setName(t.getName());
        table.setDisplayName(t.getName());

        CTTable ct = table.getCTTable();
        if (t.getHeaderRowCount() == 0) ct.setHeaderRowCount(0);
        if (t.getTotalsRowCount() > 0) ct.setTotalsRowCount(t.getTotalsRowCount());

        List<XSSFTableColumn> columns = table.getColumns();
        List<String> names = t.getColumnNames();
        for (int i = 0; i < columns.size() && i < names.size(); i++) {
            columns.get(i).setName(names.get(i));
        }
    }

    /**
     * POI renames table columns from the first row of the area when the table part is
     * written, also for tables without a header row. Header-less tables get their declared
     * column names back by editing the written table parts directly.
     */
    private static byte[] restoreColumnNames(byte[] xlsx, Map<String, List<String>> columnNamesByTable) throws Exception {
        try (OPCPackage pkg = OPCPackage.open(new ByteArrayInputStream(xlsx))) {
            for (PackagePart part : pkg.getPartsByContentType(XSSFRelation.TABLE.getContentType())) {
                TableDocument doc;
                try (InputStream in = part.getInputStream()) {
                    doc = TableDocument.Factory.parse(in, POIXMLTypeLoader.DEFAULT_XML_OPTIONS);
                }
                CTTable ct = doc.getTable();
                List<String> names = columnNamesByTable.get(ct.getName());
                if (names == null || ct.getTableColumns() == null) continue;

                List<CTTableColumn> columns = ct.getTableColumns().getTableColumnList();
                for (int i = 0; i < columns.size() && i < names.size(); i++) {
                    columns.get(i).setName(names.get(i));
                }
                try (OutputStream out = part.getOutputStream()) {
                    doc.save(out, POIXMLTypeLoader.DEFAULT_XML_OPTIONS);
                }
                log.debug("Restored column names of header-less table '{}'", ct.getName());
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            pkg.save(out);
            return out.toByteArray();
        }
    }
}
