package hybridsim.kpi;

import hybridsim.config.DispatchParameters;
import hybridsim.config.FinancialParameters;
import hybridsim.config.SimulationConstants;
import hybridsim.engine.DispatchResult;
import hybridsim.model.TimeSeries;

/**
 * Расчёт KPI по результату диспетчеризации.
 *
 * LCOE ФЭС считается по использованной энергии (выработка минус сброс),
 * LCOE АКБ - по отданной в нагрузку энергии с учётом КПД цикла.
 * Неопределённый LCOE (нет энергии) в стоимостях учитывается как 0.
 */
public final class KpiCalculator {

    private KpiCalculator() {}

    /**
     * Коэффициент аннуитета: сумма дисконтированных единичных потоков за n лет.
     * FA = (1 - (1+r)^-n) / r, при r == 0 равен n.
     */
    public static double annuityFactor(double r, int years) {
        if (r == 0.0) {
            return years;
        }
        return (1.0 - Math.pow(1.0 + r, -years)) / r;
    }

    public static KpiReport calculate(TimeSeries series,
                                      DispatchResult result,
                                      DispatchParameters dp,
                                      FinancialParameters fp) {

        if (series.size() != result.size()) {
            throw new IllegalArgumentException("series.size != result.size: " + series.size() + " vs " + result.size());
        }

        final double[] load = series.getLoad();
        final double[] price = series.getPrice();
        final double[] pv = series.getProduction();
        final double[] directUse = result.getDirectUse();
        final double[] gridImport = result.getGridImport();
        final double[] discharge = result.getDischarge();
        final double[] curtail = result.getCurtailment();

        final int n = series.size();
        final double years = n / SimulationConstants.HOURS_PER_YEAR;
        final double etaRt = fp.roundTripEfficiency(dp);

        double pvTotal = 0.0, curtailTotal = 0.0, dischargeTotal = 0.0;
        double loadTotal = 0.0, directTotal = 0.0;
        for (int t = 0; t < n; t++) {
            pvTotal += pv[t];
            curtailTotal += curtail[t];
            dischargeTotal += discharge[t];
            loadTotal += load[t];
            directTotal += directUse[t];
        }

        // ---- ФЭС ----
        double curtailmentPct = pvTotal > 0.0 ? curtailTotal / pvTotal * 100.0 : 0.0;
        double pvUsed = pvTotal - curtailTotal;

        double pvEquivalentHours = years > 0.0 ? pvTotal / years / fp.getPvMw() : 0.0;
        double pvUsedHours = years > 0.0 ? pvUsed / years / fp.getPvMw() : 0.0;

        double afPv = annuityFactor(fp.getDiscountRate(), fp.getPvLifetimeYears());
        double lcoePv = pvUsedHours > 0.0
                ? fp.getCapexPvEurPerKwp() / pvUsedHours / afPv * 1000.0
                : Double.NaN;

        // ---- АКБ ----
        double cyclesPerYear = years > 0.0 ? dischargeTotal / dp.getBatteryCapacity() / years : 0.0;

        int lifetimeYears;
        if (cyclesPerYear > 0.0) {
            double life = Math.floor(fp.getGuaranteedCycles() / cyclesPerYear);
            lifetimeYears = life >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) life;
        } else {
            lifetimeYears = Integer.MAX_VALUE;
        }

        double afBat = (lifetimeYears > 0 && lifetimeYears != Integer.MAX_VALUE)
                ? annuityFactor(fp.getDiscountRate(), lifetimeYears)
                : 1.0;
        double lcoeBattery = (cyclesPerYear > 0.0 && afBat > 0.0)
                ? fp.getCapexBatteryEurPerKwh() / (cyclesPerYear * etaRt * afBat) * 1000.0
                : Double.NaN;

        double lcoePvSafe = Double.isNaN(lcoePv) ? 0.0 : lcoePv;
        double lcoeBatSafe = Double.isNaN(lcoeBattery) ? 0.0 : lcoeBattery;

        // ---- стоимости ----
        double costGridOnly = 0.0, costPvGrid = 0.0, costPvBatteryGrid = 0.0;
        for (int t = 0; t < n; t++) {
            costGridOnly += load[t] * price[t];
            costPvGrid += Math.max(load[t] - directUse[t], 0.0) * price[t] + directUse[t] * lcoePvSafe;
            costPvBatteryGrid += hourlyCost(price[t], gridImport[t], directUse[t], discharge[t], lcoePvSafe, lcoeBatSafe);
        }

        double pvShare = loadTotal > 0.0 ? directTotal / loadTotal * 100.0 : 0.0;
        double pvBatteryShare = loadTotal > 0.0 ? (directTotal + dischargeTotal) / loadTotal * 100.0 : 0.0;

        return new KpiReport(
                costGridOnly,
                costPvGrid,
                costPvBatteryGrid,
                pvShare,
                pvBatteryShare,
                pvEquivalentHours,
                lcoePvSafe,
                curtailmentPct,
                cyclesPerYear,
                lifetimeYears,
                lcoeBatSafe,
                etaRt,
                years
        );
    }

    /**
     * Стоимость часа: импорт по цене сети + ФЭС и разряд АКБ по их LCOE.
     */
    public static double hourlyCost(double price,
                                    double gridImport,
                                    double directUse,
                                    double discharge,
                                    double lcoePv,
                                    double lcoeBattery) {
        return gridImport * price + directUse * lcoePv + discharge * lcoeBattery;
    }
}
