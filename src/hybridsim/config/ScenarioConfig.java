package hybridsim.config;

/**
 * Конфигурация сценария, как она лежит в YAML (ключи в snake_case).
 * Поля, отсутствующие в файле, сохраняют значения по умолчанию из {@link hybridsim.ScenarioFactory#defaultScenario()}.
 */
public class ScenarioConfig {

    // ---------- Входные данные ----------

    public String filePrices;
    public String fileSolar;
    public String fileConsumption;

    public String datetimeColumn;
    public String priceColumn;
    public String pvColumn;
    public String consumptionColumn;

    /** Установленная мощность ФЭС и мощность, для которой записан ряд выработки, МВт. */
    public double pvMw;
    public double pvReferenceMw;

    // ---------- АКБ ----------

    public double batteryMwh;
    public double batteryMw;
    public double etaCh;
    public double etaDis;
    public double socMin;
    public double socMax;
    public double socIni;
    public double socFullEpsilon = SimulationConstants.SOC_FULL_EPSILON;

    // ---------- Диспетчеризация ----------

    public double excessThresholdMwh = SimulationConstants.EXCESS_THRESHOLD;
    /** null -> socMin */
    public Double endSocTarget;
    public double endSocPenaltyEurPerMwh = SimulationConstants.END_SOC_PENALTY;
    public double chargeEarlyBonusEurPerMwh = SimulationConstants.CHARGE_EARLY_BONUS;
    public String chargeEarlyShape = "linear";
    public int maxExtensionSteps = SimulationConstants.MAX_EXTENSION_STEPS;
    public int solverMaxIterations = SimulationConstants.SOLVER_MAX_ITERATIONS;
    public boolean allowExport;

    // ---------- Экономика ----------

    public double capexPvEurPerKwp;
    public double capexBatEurPerKwh;
    public int pvLifetimeYears;
    public double discountRate;
    public int guaranteedCycles;
    /** null -> etaCh * etaDis */
    public Double etaRoundtripBat;

    // ---------- Результаты ----------

    public String outputXlsx;
    /** null -> CSV трассировка не пишется */
    public String traceCsv;
}
