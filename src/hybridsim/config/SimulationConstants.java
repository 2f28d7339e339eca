// File: hybridsim/config/SimulationConstants.java
package hybridsim.config;

/**
 * Глобальные константы симуляции.
 * Значения по умолчанию для параметров диспетчеризации должны находиться здесь.
 */
public final class SimulationConstants {

    /** Количество часов в году (для пересчёта в годовые показатели) */
    public static final double HOURS_PER_YEAR = 8760.0;

    // =========================================================================
    // ===========================   АККУМУЛЯТОР (Battery)  ====================
    // =========================================================================

    /** Допуск "полной" АКБ: есть место для заряда, если soc < socMax - eps */
    public static final double SOC_FULL_EPSILON = 1e-4;

    // =========================================================================
    // ===========================   ЦИКЛЫ  ====================================
    // =========================================================================

    /** Минимальный избыток ФЭС, МВт·ч, чтобы час считался частью блока избытка */
    public static final double EXCESS_THRESHOLD = 1e-6;

    /** Максимальное число расширений горизонта одного цикла */
    public static final int MAX_EXTENSION_STEPS = 10;

    // =========================================================================
    // ===========================   ЛП (целевая функция)  =====================
    // =========================================================================

    /** Штраф за превышение целевого SOC в конце цикла, €/МВт·ч */
    public static final double END_SOC_PENALTY = 2000.0;

    /** Бонус за ранний заряд, €/МВт·ч */
    public static final double CHARGE_EARLY_BONUS = 0.01;

    /** Ограничение числа итераций симплекс-метода на одно окно */
    public static final int SOLVER_MAX_ITERATIONS = 100_000;

    private SimulationConstants() {}
}
