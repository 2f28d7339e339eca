package hybridsim.model;

import java.time.LocalDateTime;

/**
 * Один шаг временного ряда вместе с производными величинами.
 */
public record TimeStep(int index, LocalDateTime timestamp, double price, double load, double production) {

    /** Избыток ФЭС над нагрузкой, >= 0. */
    public double excess() {
        return Math.max(production - load, 0.0);
    }

    /** Дефицит (нагрузка сверх выработки), >= 0. */
    public double deficit() {
        return Math.max(load - production, 0.0);
    }

    /** Выработка ФЭС, потреблённая нагрузкой напрямую. */
    public double directUse() {
        return Math.min(production, load);
    }
}
