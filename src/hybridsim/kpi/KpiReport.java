package hybridsim.kpi;

/**
 * Энергетические и экономические KPI одного прогона.
 */
public final class KpiReport {

    // ---- стоимость, € ----
    public final double costGridOnly;          // 1) вся нагрузка из сети
    public final double costPvGrid;            // 2) ФЭС + сеть, без АКБ
    public final double costPvBatteryGrid;     // 3) ФЭС + АКБ + сеть (результат диспетчеризации)

    // ---- доля покрытия нагрузки, % ----
    public final double pvSharePct;            // 4) ФЭС напрямую
    public final double pvBatterySharePct;     // 5) ФЭС напрямую + разряд АКБ

    // ---- ФЭС ----
    public final double pvEquivalentHours;     // 6) эквивалентные часы, ч/год (по всей выработке)
    public final double lcoePv;                // 7) LCOE ФЭС по использованной энергии, €/МВт·ч (0 если не определён)
    public final double curtailmentPct;        // 11) сброшенная доля выработки, %

    // ---- АКБ ----
    public final double batteryCyclesPerYear;  // 8) эквивалентные циклы в год
    public final int batteryLifetimeYears;     // 9) оценка срока службы, лет (Integer.MAX_VALUE если АКБ не разряжалась)
    public final double lcoeBattery;           // 10) €/МВт·ч отданной энергии (0 если не определён)

    // ---- использованные параметры ----
    public final double roundTripEfficiency;
    public final double simulatedYears;

    public KpiReport(double costGridOnly,
                     double costPvGrid,
                     double costPvBatteryGrid,
                     double pvSharePct,
                     double pvBatterySharePct,
                     double pvEquivalentHours,
                     double lcoePv,
                     double curtailmentPct,
                     double batteryCyclesPerYear,
                     int batteryLifetimeYears,
                     double lcoeBattery,
                     double roundTripEfficiency,
                     double simulatedYears) {
        this.costGridOnly = costGridOnly;
        this.costPvGrid = costPvGrid;
        this.costPvBatteryGrid = costPvBatteryGrid;
        this.pvSharePct = pvSharePct;
        this.pvBatterySharePct = pvBatterySharePct;
        this.pvEquivalentHours = pvEquivalentHours;
        this.lcoePv = lcoePv;
        this.curtailmentPct = curtailmentPct;
        this.batteryCyclesPerYear = batteryCyclesPerYear;
        this.batteryLifetimeYears = batteryLifetimeYears;
        this.lcoeBattery = lcoeBattery;
        this.roundTripEfficiency = roundTripEfficiency;
        this.simulatedYears = simulatedYears;
    }
}
