package hybridsim.io;

import hybridsim.config.DispatchParameters;
import hybridsim.config.FinancialParameters;
import hybridsim.engine.DerivedSeries;
import hybridsim.engine.DispatchResult;
import hybridsim.kpi.KpiCalculator;
import hybridsim.kpi.KpiReport;
import hybridsim.model.TimeSeries;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Книга результатов: лист HOURLY (почасовой баланс) и лист KPI (показатели и параметры прогона).
 */
public final class ResultsExcelWriter {

    public static final String HOURLY_SHEET = "HOURLY";
    public static final String KPI_SHEET = "KPI";

    static final String[] HOURLY_HEADERS = {
            "datetime", "price_eur_mwh", "load_mwh", "pv_mwh", "excess_mwh", "deficit_mwh",
            "direct_use_mwh", "charge_mwh", "discharge_mwh", "grid_import_mwh", "curtailment_mwh",
            "soc", "battery_energy_mwh", "cost_eur"
    };

    private ResultsExcelWriter() {}

    public static void writeXlsx(Path path,
                                 TimeSeries series,
                                 DispatchResult result,
                                 KpiReport kpi,
                                 DispatchParameters dp,
                                 FinancialParameters fp) throws IOException {

        if (series.size() != result.size()) {
            throw new IllegalArgumentException("series.size != result.size");
        }

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle numberStyle = wb.createCellStyle();
            numberStyle.setAlignment(HorizontalAlignment.CENTER);
            numberStyle.setDataFormat(df.getFormat("0.000"));

            CellStyle intStyle = wb.createCellStyle();
            intStyle.setAlignment(HorizontalAlignment.CENTER);
            intStyle.setDataFormat(df.getFormat("0"));

            CellStyle dateStyle = wb.createCellStyle();
            dateStyle.setDataFormat(df.getFormat("yyyy-mm-dd hh:mm"));

            writeHourly(wb.createSheet(HOURLY_SHEET), series, result, kpi, dp, headerStyle, numberStyle, dateStyle);
            writeKpi(wb.createSheet(KPI_SHEET), result, kpi, dp, fp, headerStyle, numberStyle, intStyle);

            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream os = Files.newOutputStream(path)) {
                wb.write(os);
            }
        }
    }

    private static void writeHourly(Sheet sh,
                                    TimeSeries series,
                                    DispatchResult result,
                                    KpiReport kpi,
                                    DispatchParameters dp,
                                    CellStyle headerStyle,
                                    CellStyle numberStyle,
                                    CellStyle dateStyle) {

        Row hdr = sh.createRow(0);
        int c = 0;
        for (String h : HOURLY_HEADERS) {
            c = writeHeader(hdr, c, h, headerStyle);
        }
        sh.createFreezePane(0, 1);

        double[] price = series.getPrice();
        double[] load = series.getLoad();
        double[] pv = series.getProduction();

        DerivedSeries derived = result.getDerived();
        double[] excess = derived.getExcess();
        double[] deficit = derived.getDeficit();
        double[] direct = derived.getDirectUse();

        double[] ch = result.getCharge();
        double[] dis = result.getDischarge();
        double[] grid = result.getGridImport();
        double[] curt = result.getCurtailment();
        double[] soc = result.getSoc();

        final double cap = dp.getBatteryCapacity();

        for (int t = 0; t < series.size(); t++) {
            Row row = sh.createRow(t + 1);
            int cc = 0;

            writeDate(row, cc++, series.getTimestamp(t), dateStyle);
            writeNumber(row, cc++, price[t], numberStyle);
            writeNumber(row, cc++, load[t], numberStyle);
            writeNumber(row, cc++, pv[t], numberStyle);
            writeNumber(row, cc++, excess[t], numberStyle);
            writeNumber(row, cc++, deficit[t], numberStyle);
            writeNumber(row, cc++, direct[t], numberStyle);
            writeNumber(row, cc++, ch[t], numberStyle);
            writeNumber(row, cc++, dis[t], numberStyle);
            writeNumber(row, cc++, grid[t], numberStyle);
            writeNumber(row, cc++, curt[t], numberStyle);
            writeNumber(row, cc++, soc[t], numberStyle);
            writeNumber(row, cc++, soc[t] * cap, numberStyle);
            writeNumber(row, cc++,
                    KpiCalculator.hourlyCost(price[t], grid[t], direct[t], dis[t], kpi.lcoePv, kpi.lcoeBattery),
                    numberStyle);
        }

        sh.setColumnWidth(0, 18 * 256);
        for (int i = 1; i < HOURLY_HEADERS.length; i++) {
            sh.setColumnWidth(i, 16 * 256);
        }
    }

    private static void writeKpi(Sheet sh,
                                 DispatchResult result,
                                 KpiReport kpi,
                                 DispatchParameters dp,
                                 FinancialParameters fp,
                                 CellStyle headerStyle,
                                 CellStyle numberStyle,
                                 CellStyle intStyle) {

        int r = 0;
        Row hdr = sh.createRow(r++);
        writeHeader(hdr, 0, "metric", headerStyle);
        writeHeader(hdr, 1, "value", headerStyle);

        r = kv(sh, r, "cost_grid_only_eur", kpi.costGridOnly, numberStyle);
        r = kv(sh, r, "cost_pv_grid_eur", kpi.costPvGrid, numberStyle);
        r = kv(sh, r, "cost_pv_battery_grid_eur", kpi.costPvBatteryGrid, numberStyle);
        r = kv(sh, r, "pv_share_pct", kpi.pvSharePct, numberStyle);
        r = kv(sh, r, "pv_battery_share_pct", kpi.pvBatterySharePct, numberStyle);
        r = kv(sh, r, "pv_equivalent_hours", kpi.pvEquivalentHours, numberStyle);
        r = kv(sh, r, "lcoe_pv_eur_mwh", kpi.lcoePv, numberStyle);
        r = kv(sh, r, "curtailment_pct", kpi.curtailmentPct, numberStyle);
        r = kv(sh, r, "battery_cycles_per_year", kpi.batteryCyclesPerYear, numberStyle);
        if (kpi.batteryLifetimeYears == Integer.MAX_VALUE) {
            r = kv(sh, r, "battery_lifetime_years", "-");
        } else {
            r = kv(sh, r, "battery_lifetime_years", kpi.batteryLifetimeYears, intStyle);
        }
        r = kv(sh, r, "lcoe_battery_eur_mwh", kpi.lcoeBattery, numberStyle);
        r = kv(sh, r, "eta_roundtrip", kpi.roundTripEfficiency, numberStyle);
        r = kv(sh, r, "simulated_years", kpi.simulatedYears, numberStyle);

        r++;
        r = kv(sh, r, "candidates", result.getCandidateCount(), intStyle);
        r = kv(sh, r, "cycles", result.getCycles().size(), intStyle);
        r = kv(sh, r, "solver_calls", result.getSolverCalls(), intStyle);
        r = kv(sh, r, "fallback_cycles", result.getFallbackCycles(), intStyle);

        r++;
        r = kv(sh, r, "battery_mwh", dp.getBatteryCapacity(), numberStyle);
        r = kv(sh, r, "battery_mw", dp.getBatteryPowerLimit(), numberStyle);
        r = kv(sh, r, "eta_ch", dp.getChargeEfficiency(), numberStyle);
        r = kv(sh, r, "eta_dis", dp.getDischargeEfficiency(), numberStyle);
        r = kv(sh, r, "soc_min", dp.getSocMin(), numberStyle);
        r = kv(sh, r, "soc_max", dp.getSocMax(), numberStyle);
        r = kv(sh, r, "soc_ini", dp.getSocInitial(), numberStyle);
        r = kv(sh, r, "end_soc_target", dp.getEndSocTarget(), numberStyle);
        r = kv(sh, r, "max_extension_steps", dp.getMaxExtensionSteps(), intStyle);
        r = kv(sh, r, "pv_mw", fp.getPvMw(), numberStyle);
        r = kv(sh, r, "capex_pv_eur_per_kwp", fp.getCapexPvEurPerKwp(), numberStyle);
        r = kv(sh, r, "capex_bat_eur_per_kwh", fp.getCapexBatteryEurPerKwh(), numberStyle);
        r = kv(sh, r, "pv_lifetime_years", fp.getPvLifetimeYears(), intStyle);
        r = kv(sh, r, "discount_rate", fp.getDiscountRate(), numberStyle);
        kv(sh, r, "guaranteed_cycles", fp.getGuaranteedCycles(), intStyle);

        sh.setColumnWidth(0, 28 * 256);
        sh.setColumnWidth(1, 18 * 256);
    }

    private static int kv(Sheet sh, int r, String key, double value, CellStyle style) {
        Row row = sh.createRow(r);
        row.createCell(0).setCellValue(key);
        writeNumber(row, 1, value, style);
        return r + 1;
    }

    private static int kv(Sheet sh, int r, String key, String value) {
        Row row = sh.createRow(r);
        row.createCell(0).setCellValue(key);
        row.createCell(1).setCellValue(value);
        return r + 1;
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(numStyle);
    }

    private static void writeDate(Row row, int col, LocalDateTime value, CellStyle dateStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(dateStyle);
    }
}
