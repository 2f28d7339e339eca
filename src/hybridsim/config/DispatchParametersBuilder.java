package hybridsim.config;

import hybridsim.engine.lp.ChargeWeighting;

/**
 * Builder для DispatchParameters.
 * Необязательные поля получают значения по умолчанию из {@link SimulationConstants};
 * цель SOC на конец окна по умолчанию равна socMin.
 */
public class DispatchParametersBuilder {

    private double batteryCapacity = Double.NaN;
    private double batteryPowerLimit = Double.NaN;
    private double chargeEfficiency = Double.NaN;
    private double dischargeEfficiency = Double.NaN;
    private double socMin = Double.NaN;
    private double socMax = Double.NaN;
    private double socInitial = Double.NaN;

    private double socFullEpsilon = SimulationConstants.SOC_FULL_EPSILON;
    private double excessThreshold = SimulationConstants.EXCESS_THRESHOLD;
    private int maxExtensionSteps = SimulationConstants.MAX_EXTENSION_STEPS;

    /** null -> socMin */
    private Double endSocTarget;
    private double endSocPenalty = SimulationConstants.END_SOC_PENALTY;
    private double chargeEarlyBonus = SimulationConstants.CHARGE_EARLY_BONUS;
    private ChargeWeighting chargeWeighting = ChargeWeighting.LINEAR;
    private int solverMaxIterations = SimulationConstants.SOLVER_MAX_ITERATIONS;
    private boolean allowExport;

    public DispatchParametersBuilder() {
    }

    /**
     * Создать builder на основе уже существующих параметров.
     */
    public static DispatchParametersBuilder from(DispatchParameters base) {
        DispatchParametersBuilder b = new DispatchParametersBuilder();
        b.batteryCapacity = base.getBatteryCapacity();
        b.batteryPowerLimit = base.getBatteryPowerLimit();
        b.chargeEfficiency = base.getChargeEfficiency();
        b.dischargeEfficiency = base.getDischargeEfficiency();
        b.socMin = base.getSocMin();
        b.socMax = base.getSocMax();
        b.socInitial = base.getSocInitial();
        b.socFullEpsilon = base.getSocFullEpsilon();
        b.excessThreshold = base.getExcessThreshold();
        b.maxExtensionSteps = base.getMaxExtensionSteps();
        b.endSocTarget = base.getEndSocTarget();
        b.endSocPenalty = base.getEndSocPenalty();
        b.chargeEarlyBonus = base.getChargeEarlyBonus();
        b.chargeWeighting = base.getChargeWeighting();
        b.solverMaxIterations = base.getSolverMaxIterations();
        b.allowExport = base.isAllowExport();
        return b;
    }

    public DispatchParameters build() {
        double target = (endSocTarget != null) ? endSocTarget : socMin;
        validate(target);
        return new DispatchParameters(
                batteryCapacity,
                batteryPowerLimit,
                chargeEfficiency,
                dischargeEfficiency,
                socMin,
                socMax,
                socInitial,
                socFullEpsilon,
                excessThreshold,
                maxExtensionSteps,
                target,
                endSocPenalty,
                chargeEarlyBonus,
                chargeWeighting,
                solverMaxIterations,
                allowExport
        );
    }

    private void validate(double target) {
        require(batteryCapacity > 0.0, "batteryCapacity должна быть > 0: " + batteryCapacity);
        require(batteryPowerLimit >= 0.0, "batteryPowerLimit должна быть >= 0: " + batteryPowerLimit);
        require(chargeEfficiency > 0.0 && chargeEfficiency <= 1.0,
                "chargeEfficiency вне (0,1]: " + chargeEfficiency);
        require(dischargeEfficiency > 0.0 && dischargeEfficiency <= 1.0,
                "dischargeEfficiency вне (0,1]: " + dischargeEfficiency);
        require(socMin >= 0.0 && socMax <= 1.0, "socMin/socMax вне [0,1]: " + socMin + "/" + socMax);
        require(socMin < socMax, "socMin должен быть < socMax: " + socMin + " >= " + socMax);
        require(socInitial >= socMin && socInitial <= socMax,
                "socInitial вне [socMin, socMax]: " + socInitial);
        require(socFullEpsilon > 0.0, "socFullEpsilon должен быть > 0: " + socFullEpsilon);
        require(excessThreshold > 0.0, "excessThreshold должен быть > 0: " + excessThreshold);
        require(maxExtensionSteps >= 0, "maxExtensionSteps должен быть >= 0: " + maxExtensionSteps);
        require(target >= 0.0 && target <= 1.0, "endSocTarget вне [0,1]: " + target);
        require(endSocPenalty >= 0.0, "endSocPenalty должен быть >= 0: " + endSocPenalty);
        require(chargeEarlyBonus >= 0.0, "chargeEarlyBonus должен быть >= 0: " + chargeEarlyBonus);
        require(chargeWeighting != null, "chargeWeighting не задан");
        require(solverMaxIterations > 0, "solverMaxIterations должен быть > 0: " + solverMaxIterations);
    }

    // NaN не проходит ни одно сравнение, поэтому незаданные обязательные поля тоже отсекаются здесь
    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    // --------- сеттеры ---------

    public DispatchParametersBuilder setBatteryCapacity(double batteryCapacity) {
        this.batteryCapacity = batteryCapacity;
        return this;
    }

    public DispatchParametersBuilder setBatteryPowerLimit(double batteryPowerLimit) {
        this.batteryPowerLimit = batteryPowerLimit;
        return this;
    }

    public DispatchParametersBuilder setChargeEfficiency(double chargeEfficiency) {
        this.chargeEfficiency = chargeEfficiency;
        return this;
    }

    public DispatchParametersBuilder setDischargeEfficiency(double dischargeEfficiency) {
        this.dischargeEfficiency = dischargeEfficiency;
        return this;
    }

    public DispatchParametersBuilder setSocMin(double socMin) {
        this.socMin = socMin;
        return this;
    }

    public DispatchParametersBuilder setSocMax(double socMax) {
        this.socMax = socMax;
        return this;
    }

    public DispatchParametersBuilder setSocInitial(double socInitial) {
        this.socInitial = socInitial;
        return this;
    }

    public DispatchParametersBuilder setSocFullEpsilon(double socFullEpsilon) {
        this.socFullEpsilon = socFullEpsilon;
        return this;
    }

    public DispatchParametersBuilder setExcessThreshold(double excessThreshold) {
        this.excessThreshold = excessThreshold;
        return this;
    }

    public DispatchParametersBuilder setMaxExtensionSteps(int maxExtensionSteps) {
        this.maxExtensionSteps = maxExtensionSteps;
        return this;
    }

    public DispatchParametersBuilder setEndSocTarget(Double endSocTarget) {
        this.endSocTarget = endSocTarget;
        return this;
    }

    public DispatchParametersBuilder setEndSocPenalty(double endSocPenalty) {
        this.endSocPenalty = endSocPenalty;
        return this;
    }

    public DispatchParametersBuilder setChargeEarlyBonus(double chargeEarlyBonus) {
        this.chargeEarlyBonus = chargeEarlyBonus;
        return this;
    }

    public DispatchParametersBuilder setChargeWeighting(ChargeWeighting chargeWeighting) {
        this.chargeWeighting = chargeWeighting;
        return this;
    }

    public DispatchParametersBuilder setSolverMaxIterations(int solverMaxIterations) {
        this.solverMaxIterations = solverMaxIterations;
        return this;
    }

    public DispatchParametersBuilder setAllowExport(boolean allowExport) {
        this.allowExport = allowExport;
        return this;
    }
}
