package hybridsim.io;

import hybridsim.TestData;
import hybridsim.config.DispatchParameters;
import hybridsim.config.FinancialParameters;
import hybridsim.engine.DispatchResult;
import hybridsim.engine.DispatchScheduler;
import hybridsim.kpi.KpiCalculator;
import hybridsim.kpi.KpiReport;
import hybridsim.model.TimeSeries;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ResultsExcelWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesHourlyAndKpiSheets() throws IOException {
        DispatchParameters dp = TestData.smallBatteryParams();
        FinancialParameters fp = TestData.financial();
        TimeSeries s = TimeSeries.hourly(
                new double[]{10, 20, 5, 30, 15},
                new double[]{1, 1, 1, 1, 1},
                new double[]{0, 0, 3, 0, 0});
        DispatchResult r = new DispatchScheduler(dp).run(s);
        KpiReport k = KpiCalculator.calculate(s, r, dp, fp);

        Path out = dir.resolve("sub/results.xlsx");
        ResultsExcelWriter.writeXlsx(out, s, r, k, dp, fp);

        try (Workbook wb = WorkbookFactory.create(out.toFile())) {
            Sheet hourly = wb.getSheet(ResultsExcelWriter.HOURLY_SHEET);
            assertNotNull(hourly);
            assertEquals(s.size(), hourly.getLastRowNum());

            Row hdr = hourly.getRow(0);
            assertEquals(ResultsExcelWriter.HOURLY_HEADERS.length, hdr.getLastCellNum());
            assertEquals("soc", hdr.getCell(11).getStringCellValue());

            // t=3: импорт = дефицит - разряд
            Row r3 = hourly.getRow(4);
            assertEquals(s.getTimestamp(3), r3.getCell(0).getLocalDateTimeCellValue());
            assertEquals(1.0 - r.getDischarge()[3], r3.getCell(9).getNumericCellValue(), 1e-9);
            assertEquals(r.getSoc()[3] * dp.getBatteryCapacity(), r3.getCell(12).getNumericCellValue(), 1e-9);

            Sheet kpi = wb.getSheet(ResultsExcelWriter.KPI_SHEET);
            assertNotNull(kpi);
            assertEquals("cost_grid_only_eur", kpi.getRow(1).getCell(0).getStringCellValue());
            assertEquals(k.costGridOnly, kpi.getRow(1).getCell(1).getNumericCellValue(), 1e-9);
        }
    }
}
