package hybridsim;

import hybridsim.config.*;
import hybridsim.engine.lp.ChargeWeighting;
import hybridsim.io.InputDataLoader;
import hybridsim.model.TimeSeries;

import java.io.IOException;
import java.nio.file.Path;

public final class ScenarioFactory {

    private ScenarioFactory() {}

    /**
     * Сценарий по умолчанию: ФЭС 49 МВт, АКБ 20 МВт·ч / 10 МВт.
     */
    public static ScenarioConfig defaultScenario() {
        ScenarioConfig c = new ScenarioConfig();

        c.filePrices = "data/prices.xlsx";
        c.fileSolar = "data/solar.xlsx";
        c.fileConsumption = "data/consumption.xlsx";
        c.datetimeColumn = "datetime";
        c.priceColumn = "price_eur_mwh";
        c.pvColumn = "pv_mwh";
        c.consumptionColumn = "load_mwh";
        c.pvMw = 49.0;
        c.pvReferenceMw = 49.0;

        c.batteryMwh = 20.0;
        c.batteryMw = 10.0;
        c.etaCh = 0.95;
        c.etaDis = 0.95;
        c.socMin = 0.10;
        c.socMax = 0.90;
        c.socIni = 0.50;

        c.capexPvEurPerKwp = 600.0;
        c.capexBatEurPerKwh = 250.0;
        c.pvLifetimeYears = 25;
        c.discountRate = 0.06;
        c.guaranteedCycles = 6000;

        c.outputXlsx = "results.xlsx";
        return c;
    }

    public static DispatchParameters dispatchParameters(ScenarioConfig c) {
        return new DispatchParametersBuilder()
                .setBatteryCapacity(c.batteryMwh)
                .setBatteryPowerLimit(c.batteryMw)
                .setChargeEfficiency(c.etaCh)
                .setDischargeEfficiency(c.etaDis)
                .setSocMin(c.socMin)
                .setSocMax(c.socMax)
                .setSocInitial(c.socIni)
                .setSocFullEpsilon(c.socFullEpsilon)
                .setExcessThreshold(c.excessThresholdMwh)
                .setMaxExtensionSteps(c.maxExtensionSteps)
                .setEndSocTarget(c.endSocTarget)
                .setEndSocPenalty(c.endSocPenaltyEurPerMwh)
                .setChargeEarlyBonus(c.chargeEarlyBonusEurPerMwh)
                .setChargeWeighting(ChargeWeighting.fromShape(c.chargeEarlyShape))
                .setSolverMaxIterations(c.solverMaxIterations)
                .setAllowExport(c.allowExport)
                .build();
    }

    public static FinancialParameters financialParameters(ScenarioConfig c) {
        return new FinancialParameters(
                c.pvMw,
                c.capexPvEurPerKwp,
                c.capexBatEurPerKwh,
                c.pvLifetimeYears,
                c.discountRate,
                c.guaranteedCycles,
                c.etaRoundtripBat != null ? c.etaRoundtripBat : Double.NaN
        );
    }

    public static TimeSeries loadInput(ScenarioConfig c) throws IOException {
        if (c.pvReferenceMw <= 0.0) {
            throw new IllegalArgumentException("pv_reference_mw должна быть > 0: " + c.pvReferenceMw);
        }
        InputDataLoader loader = new InputDataLoader(
                c.datetimeColumn,
                c.priceColumn,
                c.pvColumn,
                c.consumptionColumn,
                c.pvMw / c.pvReferenceMw
        );
        return loader.load(Path.of(c.filePrices), Path.of(c.fileSolar), Path.of(c.fileConsumption));
    }
}
