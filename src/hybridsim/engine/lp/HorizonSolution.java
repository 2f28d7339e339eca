package hybridsim.engine.lp;

/**
 * Результат решения ЛП на одном окне [start, end).
 */
public final class HorizonSolution {

    public enum Outcome {
        /** Решение найдено симплекс-методом. */
        OPTIMAL,
        /** Решатель не справился; решения нулевые (АКБ на окне не используется). */
        FALLBACK_ZERO,
        /** Окно нулевой длины, решатель не вызывался. */
        EMPTY
    }

    private static final double[] NONE = new double[0];

    private final Outcome outcome;
    private final double[] charge;
    private final double[] discharge;
    private final double objective;

    private HorizonSolution(Outcome outcome, double[] charge, double[] discharge, double objective) {
        this.outcome = outcome;
        this.charge = charge;
        this.discharge = discharge;
        this.objective = objective;
    }

    static HorizonSolution optimal(double[] charge, double[] discharge, double objective) {
        return new HorizonSolution(Outcome.OPTIMAL, charge, discharge, objective);
    }

    static HorizonSolution fallbackZero(int n) {
        return new HorizonSolution(Outcome.FALLBACK_ZERO, new double[n], new double[n], Double.NaN);
    }

    static HorizonSolution empty() {
        return new HorizonSolution(Outcome.EMPTY, NONE, NONE, 0.0);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isFallback() {
        return outcome == Outcome.FALLBACK_ZERO;
    }

    public int length() {
        return charge.length;
    }

    public double chargeAt(int i) {
        return charge[i];
    }

    public double dischargeAt(int i) {
        return discharge[i];
    }

    /** Значение целевой функции (NaN для FALLBACK_ZERO). */
    public double getObjective() {
        return objective;
    }
}
