package hybridsim;

import hybridsim.config.DispatchParameters;
import hybridsim.config.FinancialParameters;
import hybridsim.config.ScenarioConfig;
import hybridsim.config.ScenarioConfigLoader;
import hybridsim.engine.DispatchResult;
import hybridsim.engine.DispatchScheduler;
import hybridsim.io.DispatchTraceExporter;
import hybridsim.io.ResultsExcelWriter;
import hybridsim.kpi.KpiCalculator;
import hybridsim.kpi.KpiReport;
import hybridsim.model.TimeSeries;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public class Main {

    private static final String DEFAULT_CONFIG = "config.yaml";

    public static void main(String[] args) {
        Path configPath = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG);

        try {
            // 1) сценарий: YAML, если есть, иначе значения по умолчанию
            ScenarioConfig cfg;
            if (Files.isRegularFile(configPath)) {
                cfg = new ScenarioConfigLoader().load(configPath);
            } else if (args.length > 0) {
                throw new IllegalArgumentException("Файл сценария не найден: " + configPath);
            } else {
                cfg = ScenarioFactory.defaultScenario();
            }

            DispatchParameters dp = ScenarioFactory.dispatchParameters(cfg);
            FinancialParameters fp = ScenarioFactory.financialParameters(cfg);

            // 2) входные ряды
            TimeSeries series = ScenarioFactory.loadInput(cfg);

            // 3) диспетчеризация и KPI
            DispatchResult result = new DispatchScheduler(dp).run(series);
            KpiReport kpi = KpiCalculator.calculate(series, result, dp, fp);
            printKpi(kpi);

            // 4) выгрузка
            ResultsExcelWriter.writeXlsx(Path.of(cfg.outputXlsx), series, result, kpi, dp, fp);
            System.out.println("Saved: " + cfg.outputXlsx);

            if (cfg.traceCsv != null && !cfg.traceCsv.isBlank() && result.size() > 0) {
                DispatchTraceExporter.exportToCsv(Path.of(cfg.traceCsv), series, result);
                System.out.println("Saved: " + cfg.traceCsv);
            }
        } catch (Exception e) {
            System.err.println("Ошибка: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static void printKpi(KpiReport k) {
        System.out.println("===== KPI =====");
        line("Стоимость, только сеть, €", k.costGridOnly);
        line("Стоимость, ФЭС + сеть, €", k.costPvGrid);
        line("Стоимость, ФЭС + АКБ + сеть, €", k.costPvBatteryGrid);
        line("Доля ФЭС в нагрузке, %", k.pvSharePct);
        line("Доля ФЭС + АКБ в нагрузке, %", k.pvBatterySharePct);
        line("Эквивалентные часы ФЭС, ч/год", k.pvEquivalentHours);
        line("LCOE ФЭС, €/МВт·ч", k.lcoePv);
        line("Сброс ФЭС, %", k.curtailmentPct);
        line("Циклы АКБ в год", k.batteryCyclesPerYear);
        System.out.println(String.format(Locale.ROOT, "  %-34s %s", "Срок службы АКБ, лет",
                k.batteryLifetimeYears == Integer.MAX_VALUE ? "-" : String.valueOf(k.batteryLifetimeYears)));
        line("LCOE АКБ, €/МВт·ч", k.lcoeBattery);
        line("КПД цикла АКБ", k.roundTripEfficiency);
    }

    private static void line(String name, double value) {
        System.out.println(String.format(Locale.ROOT, "  %-34s %.2f", name, value));
    }
}
