package com.ogt.loadmap.util;

import com.ogt.loadmap.exception.InputReadException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lectura de tablas de supuestos en Excel (.xlsx o .xls) con Apache POI.
 * Devuelve las filas como texto, igual que {@link CsvTables#readRows(Path)}.
 */
public final class SpreadsheetTables {

    private SpreadsheetTables() {}

    public static List<List<String>> readRows(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new InputReadException(path, "el archivo no existe");
        }
        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(in)) {

            Sheet sheet = workbook.getSheetAt(0);

            // Primera fila con celdas = encabezado
            int headerRowIndex = -1;
            for (int i = 0; i <= sheet.getLastRowNum() && i < 50; i++) {
                Row row = sheet.getRow(i);
                if (row != null && row.getPhysicalNumberOfCells() > 0) {
                    headerRowIndex = i;
                    break;
                }
            }
            if (headerRowIndex == -1) {
                throw new InputReadException(path, "la hoja está vacía o no tiene encabezados");
            }

            int width = sheet.getRow(headerRowIndex).getLastCellNum();
            List<List<String>> rows = new ArrayList<>();
            for (int i = headerRowIndex; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;
                List<String> values = new ArrayList<>(width);
                boolean empty = true;
                for (int c = 0; c < width; c++) {
                    String value = getCellValueAsString(row.getCell(c));
                    if (value != null && !value.isBlank()) empty = false;
                    values.add(value != null ? value.trim() : "");
                }
                if (!empty) rows.add(values);
            }
            return rows;
        } catch (InputReadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            // POI informa formatos inválidos o cifrados con excepciones no chequeadas
            throw new InputReadException(path, e);
        }
    }

    static String getCellValueAsString(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        switch (type) {
            case STRING: return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) return cell.getDateCellValue().toString();
                double num = cell.getNumericCellValue();
                return (num == (long) num) ? String.valueOf((long) num) : String.valueOf(num);
            case BOOLEAN: return String.valueOf(cell.getBooleanCellValue());
            default: return null;
        }
    }
}
