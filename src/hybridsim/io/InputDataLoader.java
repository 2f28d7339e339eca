package hybridsim.io;

import hybridsim.model.TimeSeries;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Загрузка входных данных: цены, выработка ФЭС, потребление (по одной книге Excel на ряд).
 *
 * Сетку времени задаёт книга цен; выработка и потребление присоединяются по метке времени.
 * Пропуски не заполняются: метка сетки без строки выработки или потребления - ошибка.
 * Выработка масштабируется коэффициентом pvMw / pvReferenceMw.
 */
public class InputDataLoader {

    private static final Logger log = LoggerFactory.getLogger(InputDataLoader.class);

    /** Текстовые даты: ISO (с 'T' или пробелом), dd.MM.yyyy HH:mm, dd/MM/yyyy HH:mm. */
    private static final DateTimeFormatter TEXT_FORMAT = DateTimeFormatter.ofPattern(
            "[yyyy-MM-dd'T'HH:mm[:ss]][yyyy-MM-dd HH:mm[:ss]][dd.MM.yyyy HH:mm][dd/MM/yyyy HH:mm]");

    private final String datetimeColumn;
    private final String priceColumn;
    private final String pvColumn;
    private final String consumptionColumn;
    private final double pvScale;

    public InputDataLoader(String datetimeColumn,
                           String priceColumn,
                           String pvColumn,
                           String consumptionColumn,
                           double pvScale) {
        this.datetimeColumn = datetimeColumn;
        this.priceColumn = priceColumn;
        this.pvColumn = pvColumn;
        this.consumptionColumn = consumptionColumn;
        this.pvScale = pvScale;
    }

    public TimeSeries load(Path pricesPath, Path solarPath, Path consumptionPath) throws IOException {

        List<Sample> prices = readColumn(pricesPath, priceColumn);
        Map<LocalDateTime, Double> solar = index(readColumn(solarPath, pvColumn), solarPath);
        Map<LocalDateTime, Double> consumption = index(readColumn(consumptionPath, consumptionColumn), consumptionPath);

        int n = prices.size();
        LocalDateTime[] ts = new LocalDateTime[n];
        double[] price = new double[n];
        double[] load = new double[n];
        double[] pv = new double[n];

        for (int i = 0; i < n; i++) {
            Sample p = prices.get(i);
            Double s = solar.get(p.timestamp);
            Double c = consumption.get(p.timestamp);
            if (s == null) {
                throw new IOException("Нет выработки ФЭС для " + p.timestamp + " (" + solarPath + ")");
            }
            if (c == null) {
                throw new IOException("Нет потребления для " + p.timestamp + " (" + consumptionPath + ")");
            }
            ts[i] = p.timestamp;
            price[i] = p.value;
            pv[i] = s * pvScale;
            load[i] = c;
        }

        log.info("Загружено {} шагов: {} .. {}, масштаб ФЭС {}",
                n, n > 0 ? ts[0] : "-", n > 0 ? ts[n - 1] : "-", pvScale);
        return new TimeSeries(ts, price, load, pv);
    }

    private List<Sample> readColumn(Path path, String valueColumn) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Файл не найден: " + path);
        }

        List<Sample> out = new ArrayList<>();
        DataFormatter formatter = new DataFormatter();

        try (Workbook wb = WorkbookFactory.create(path.toFile(), null, true)) {
            Sheet sheet = wb.getSheetAt(0);
            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) {
                throw new IOException("Пустой лист (" + path + ")");
            }

            int dtIdx = findColumn(header, datetimeColumn, formatter, path);
            int valIdx = findColumn(header, valueColumn, formatter, path);

            for (int r = header.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;
                Cell dtCell = row.getCell(dtIdx);
                if (dtCell == null || dtCell.getCellType() == CellType.BLANK) continue;

                LocalDateTime ts = readTimestamp(dtCell, formatter, path, r);
                double v = readNumber(row.getCell(valIdx), formatter, path, r);
                out.add(new Sample(ts, v));
            }
        }
        return out;
    }

    private static Map<LocalDateTime, Double> index(List<Sample> samples, Path path) throws IOException {
        Map<LocalDateTime, Double> m = new HashMap<>(samples.size() * 2);
        for (Sample s : samples) {
            if (m.put(s.timestamp, s.value) != null) {
                throw new IOException("Повтор метки времени " + s.timestamp + " (" + path + ")");
            }
        }
        return m;
    }

    private static int findColumn(Row header, String name, DataFormatter formatter, Path path) throws IOException {
        for (Cell cell : header) {
            if (name.equals(formatter.formatCellValue(cell).trim())) {
                return cell.getColumnIndex();
            }
        }
        throw new IOException("Колонка '" + name + "' не найдена (" + path + ")");
    }

    private static LocalDateTime readTimestamp(Cell cell, DataFormatter formatter, Path path, int r) throws IOException {
        if (cell.getCellType() == CellType.NUMERIC) {
            return cell.getLocalDateTimeCellValue();
        }
        String text = formatter.formatCellValue(cell).trim();
        try {
            return LocalDateTime.parse(text, TEXT_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IOException("Неверная дата '" + text + "' в строке " + (r + 1) + " (" + path + ")", e);
        }
    }

    private static double readNumber(Cell cell, DataFormatter formatter, Path path, int r) throws IOException {
        if (cell == null) {
            throw new IOException("Пустое значение в строке " + (r + 1) + " (" + path + ")");
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC) {
            return cell.getNumericCellValue();
        }
        String text = formatter.formatCellValue(cell).trim();
        try {
            return Double.parseDouble(text.replace(",", "."));
        } catch (NumberFormatException e) {
            throw new IOException("Неверное число '" + text + "' в строке " + (r + 1) + " (" + path + ")", e);
        }
    }

    private record Sample(LocalDateTime timestamp, double value) {}
}
