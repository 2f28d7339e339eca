package hybridsim.config;

/**
 * Параметры инвестиций и финансирования для расчёта KPI (immutable).
 */
public final class FinancialParameters {

    /** Установленная мощность ФЭС, МВт. */
    private final double pvMw;

    /** CAPEX ФЭС, €/кВт пик. */
    private final double capexPvEurPerKwp;

    /** CAPEX АКБ, €/кВт·ч. */
    private final double capexBatteryEurPerKwh;

    /** Срок службы ФЭС, лет. */
    private final int pvLifetimeYears;

    /** Ставка дисконтирования (доля, например 0.06). */
    private final double discountRate;

    /** Гарантированное производителем число циклов АКБ. */
    private final int guaranteedCycles;

    /** КПД цикла заряд-разряд; NaN -> etaCh * etaDis. */
    private final double roundTripEfficiency;

    public FinancialParameters(double pvMw,
                               double capexPvEurPerKwp,
                               double capexBatteryEurPerKwh,
                               int pvLifetimeYears,
                               double discountRate,
                               int guaranteedCycles,
                               double roundTripEfficiency) {
        if (pvMw <= 0.0) {
            throw new IllegalArgumentException("pvMw должна быть > 0: " + pvMw);
        }
        if (pvLifetimeYears <= 0) {
            throw new IllegalArgumentException("pvLifetimeYears должен быть > 0: " + pvLifetimeYears);
        }
        if (discountRate <= -1.0) {
            throw new IllegalArgumentException("discountRate должна быть > -1: " + discountRate);
        }
        if (guaranteedCycles < 0) {
            throw new IllegalArgumentException("guaranteedCycles должен быть >= 0: " + guaranteedCycles);
        }
        this.pvMw = pvMw;
        this.capexPvEurPerKwp = capexPvEurPerKwp;
        this.capexBatteryEurPerKwh = capexBatteryEurPerKwh;
        this.pvLifetimeYears = pvLifetimeYears;
        this.discountRate = discountRate;
        this.guaranteedCycles = guaranteedCycles;
        this.roundTripEfficiency = roundTripEfficiency;
    }

    public double getPvMw() {
        return pvMw;
    }

    public double getCapexPvEurPerKwp() {
        return capexPvEurPerKwp;
    }

    public double getCapexBatteryEurPerKwh() {
        return capexBatteryEurPerKwh;
    }

    public int getPvLifetimeYears() {
        return pvLifetimeYears;
    }

    public double getDiscountRate() {
        return discountRate;
    }

    public int getGuaranteedCycles() {
        return guaranteedCycles;
    }

    /**
     * КПД цикла: явно заданный или произведение КПД заряда и разряда.
     */
    public double roundTripEfficiency(DispatchParameters dp) {
        if (Double.isNaN(roundTripEfficiency)) {
            return dp.getChargeEfficiency() * dp.getDischargeEfficiency();
        }
        return roundTripEfficiency;
    }
}
