// File: hybridsim/model/Battery.java
package hybridsim.model;

import hybridsim.config.DispatchParameters;

/**
 * Аккумуляторная батарея для почасового моделирования.
 *
 * Хранит только SOC (доля ёмкости). Каждый шаг применяет заряд/разряд с учётом КПД
 * и ограничивает SOC диапазоном [socMin, socMax], даже если решение ЛП
 * из-за округлений выходит за границы на величину порядка погрешности.
 */
public class Battery {

    private final double capacity;
    private final double etaCh;
    private final double etaDis;
    private final double socMin;
    private final double socMax;
    private final double fullLevel;

    private double soc;

    public Battery(DispatchParameters dp) {
        this(dp, dp.getSocInitial());
    }

    public Battery(DispatchParameters dp, double soc) {
        this.capacity = dp.getBatteryCapacity();
        this.etaCh = dp.getChargeEfficiency();
        this.etaDis = dp.getDischargeEfficiency();
        this.socMin = dp.getSocMin();
        this.socMax = dp.getSocMax();
        this.fullLevel = dp.fullSocLevel();
        this.soc = soc;
    }

    private Battery(Battery other) {
        this.capacity = other.capacity;
        this.etaCh = other.etaCh;
        this.etaDis = other.etaDis;
        this.socMin = other.socMin;
        this.socMax = other.socMax;
        this.fullLevel = other.fullLevel;
        this.soc = other.soc;
    }

    public double getStateOfCharge() {
        return soc;
    }

    /** Копия для "пробного" прогона решений, не затрагивающая исходную АКБ. */
    public Battery copy() {
        return new Battery(this);
    }

    /**
     * Есть ли место для заряда: soc < socMax - eps.
     */
    public boolean hasHeadroom() {
        return hasHeadroom(soc);
    }

    public boolean hasHeadroom(double socValue) {
        return socValue < fullLevel;
    }

    /**
     * Один шаг: chargeMwh (до КПД) заряжается, dischargeMwh (после КПД) отдаётся в нагрузку.
     *
     * @return SOC после шага
     */
    public double applyStep(double chargeMwh, double dischargeMwh) {
        double next = soc + (chargeMwh * etaCh - dischargeMwh / etaDis) / capacity;
        soc = clamp(next, socMin, socMax);
        return soc;
    }

    private static double clamp(double v, double lo, double hi) {
        if (v < lo) return lo;
        if (v > hi) return hi;
        return v;
    }
}
