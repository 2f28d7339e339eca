package hybridsim.config;

import hybridsim.engine.lp.ChargeWeighting;

import java.util.Locale;

/**
 * Параметры АКБ и диспетчеризации (immutable).
 * Создаются только через {@link DispatchParametersBuilder}, который проверяет допустимость значений.
 */
public class DispatchParameters {

    // ---------- Параметры АКБ ----------

    /**
     * Ёмкость АКБ, МВт·ч.
     */
    private final double batteryCapacity;

    /**
     * Максимальная мощность заряда/разряда, МВт (энергия за шаг).
     */
    private final double batteryPowerLimit;

    /**
     * КПД заряда и разряда.
     */
    private final double chargeEfficiency;
    private final double dischargeEfficiency;

    /**
     * Допустимый диапазон SOC и начальный SOC (доли от ёмкости).
     */
    private final double socMin;
    private final double socMax;
    private final double socInitial;

    /**
     * Допуск "полной" АКБ.
     */
    private final double socFullEpsilon;

    // ---------- Циклы ----------

    /**
     * Порог избытка ФЭС для кандидата на границу цикла.
     */
    private final double excessThreshold;

    /**
     * Максимальное число расширений горизонта.
     */
    private final int maxExtensionSteps;

    // ---------- ЛП ----------

    /**
     * Мягкая цель SOC на конец окна и штраф за её превышение.
     */
    private final double endSocTarget;
    private final double endSocPenalty;

    private final double chargeEarlyBonus;
    private final ChargeWeighting chargeWeighting;

    private final int solverMaxIterations;

    /**
     * Разрешён ли экспорт в сеть. Планировщик экспорт не моделирует.
     */
    private final boolean allowExport;

    DispatchParameters(double batteryCapacity,
                       double batteryPowerLimit,
                       double chargeEfficiency,
                       double dischargeEfficiency,
                       double socMin,
                       double socMax,
                       double socInitial,
                       double socFullEpsilon,
                       double excessThreshold,
                       int maxExtensionSteps,
                       double endSocTarget,
                       double endSocPenalty,
                       double chargeEarlyBonus,
                       ChargeWeighting chargeWeighting,
                       int solverMaxIterations,
                       boolean allowExport) {

        this.batteryCapacity = batteryCapacity;
        this.batteryPowerLimit = batteryPowerLimit;
        this.chargeEfficiency = chargeEfficiency;
        this.dischargeEfficiency = dischargeEfficiency;
        this.socMin = socMin;
        this.socMax = socMax;
        this.socInitial = socInitial;
        this.socFullEpsilon = socFullEpsilon;

        this.excessThreshold = excessThreshold;
        this.maxExtensionSteps = maxExtensionSteps;

        this.endSocTarget = endSocTarget;
        this.endSocPenalty = endSocPenalty;
        this.chargeEarlyBonus = chargeEarlyBonus;
        this.chargeWeighting = chargeWeighting;
        this.solverMaxIterations = solverMaxIterations;
        this.allowExport = allowExport;
    }

    // --------- Геттеры ---------

    public double getBatteryCapacity() {
        return batteryCapacity;
    }

    public double getBatteryPowerLimit() {
        return batteryPowerLimit;
    }

    public double getChargeEfficiency() {
        return chargeEfficiency;
    }

    public double getDischargeEfficiency() {
        return dischargeEfficiency;
    }

    public double getSocMin() {
        return socMin;
    }

    public double getSocMax() {
        return socMax;
    }

    public double getSocInitial() {
        return socInitial;
    }

    public double getSocFullEpsilon() {
        return socFullEpsilon;
    }

    public double getExcessThreshold() {
        return excessThreshold;
    }

    public int getMaxExtensionSteps() {
        return maxExtensionSteps;
    }

    public double getEndSocTarget() {
        return endSocTarget;
    }

    public double getEndSocPenalty() {
        return endSocPenalty;
    }

    public double getChargeEarlyBonus() {
        return chargeEarlyBonus;
    }

    public ChargeWeighting getChargeWeighting() {
        return chargeWeighting;
    }

    public int getSolverMaxIterations() {
        return solverMaxIterations;
    }

    public boolean isAllowExport() {
        return allowExport;
    }

    /** Уровень SOC, начиная с которого АКБ считается полной. */
    public double fullSocLevel() {
        return socMax - socFullEpsilon;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "BT=%.3f/%.3f eta=%.3f/%.3f soc=[%.3f..%.3f] ini=%.3f end=%.3f penalty=%.1f bonus=%.3f shape=%s ext=%d",
                batteryCapacity, batteryPowerLimit, chargeEfficiency, dischargeEfficiency,
                socMin, socMax, socInitial, endSocTarget, endSocPenalty, chargeEarlyBonus,
                chargeWeighting, maxExtensionSteps);
    }
}
