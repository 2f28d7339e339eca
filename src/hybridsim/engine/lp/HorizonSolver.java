package hybridsim.engine.lp;

import hybridsim.config.DispatchParameters;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.PivotSelectionRule;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * ЛП одного окна [start, end) с начальным SOC soc0.
 *
 * Переменные: заряд ch_i и разряд dis_i на каждом шаге окна + slack мягкого ограничения на конечный SOC.
 * Переменные с нулевой верхней границей (нет избытка / нет дефицита / нулевая мощность) в задачу
 * не включаются и остаются нулевыми.
 *
 * Ограничения:
 *  - 0 <= ch_i <= min(excess_i, pMax), 0 <= dis_i <= min(deficit_i, pMax), slack >= 0;
 *  - накопленный SOC после шага k: socMin - soc0 <= sum_{i<=k} (ch_i*etaCh - dis_i/etaDis)/cap <= socMax - soc0;
 *  - мягкое: sum_{i<n} (...)/cap - slack/cap <= endSocTarget - soc0.
 *
 * Цель (минимизация): -bonus * w_i * ch_i - price_i * dis_i + penalty * slack.
 *
 * Решатель без состояния между вызовами; при любом отказе симплекс-метода возвращает нулевые решения.
 */
public final class HorizonSolver {

    private static final Logger log = LoggerFactory.getLogger(HorizonSolver.class);

    private final DispatchParameters dp;
    private final double[] excess;
    private final double[] deficit;
    private final double[] price;

    public HorizonSolver(DispatchParameters dp, double[] excess, double[] deficit, double[] price) {
        if (excess.length != deficit.length || excess.length != price.length) {
            throw new IllegalArgumentException("excess/deficit/price разной длины");
        }
        this.dp = dp;
        this.excess = excess;
        this.deficit = deficit;
        this.price = price;
    }

    public HorizonSolution solve(int start, int end, double soc0) {
        final int n = end - start;
        if (n <= 0) {
            return HorizonSolution.empty();
        }
        if (start < 0 || end > excess.length) {
            throw new IndexOutOfBoundsException("Окно [" + start + ", " + end + ") вне ряда длины " + excess.length);
        }

        final double cap = dp.getBatteryCapacity();
        final double pMax = dp.getBatteryPowerLimit();
        final double chCoef = dp.getChargeEfficiency() / cap;
        final double disCoef = -1.0 / (dp.getDischargeEfficiency() * cap);

        // ---- активные переменные ----
        final double[] chUb = new double[n];
        final double[] disUb = new double[n];
        final int[] chVar = new int[n];
        final int[] disVar = new int[n];
        int vars = 0;
        for (int i = 0; i < n; i++) {
            chUb[i] = Math.min(excess[start + i], pMax);
            disUb[i] = Math.min(deficit[start + i], pMax);
            chVar[i] = chUb[i] > 0.0 ? vars++ : -1;
            disVar[i] = disUb[i] > 0.0 ? vars++ : -1;
        }

        if (vars == 0) {
            // допустимо только нулевое решение
            return HorizonSolution.optimal(new double[n], new double[n], 0.0);
        }

        final int slackVar = vars++;

        // ---- целевая функция ----
        final double bonus = dp.getChargeEarlyBonus();
        final double[] w = dp.getChargeWeighting().weights(n);
        final double[] c = new double[vars];
        for (int i = 0; i < n; i++) {
            if (chVar[i] >= 0) c[chVar[i]] = -bonus * w[i];
            if (disVar[i] >= 0) c[disVar[i]] = -price[start + i];
        }
        c[slackVar] = dp.getEndSocPenalty();

        // ---- ограничения ----
        final List<LinearConstraint> constraints = new ArrayList<>(4 * n + 1);

        for (int i = 0; i < n; i++) {
            if (chVar[i] >= 0) constraints.add(bound(vars, chVar[i], chUb[i]));
            if (disVar[i] >= 0) constraints.add(bound(vars, disVar[i], disUb[i]));
        }

        // нижнетреугольное суммирование: строка k содержит все переменные шагов 0..k
        final double[] cumulative = new double[vars];
        final double upper = dp.getSocMax() - soc0;
        final double lower = dp.getSocMin() - soc0;
        for (int k = 0; k < n; k++) {
            if (chVar[k] >= 0) cumulative[chVar[k]] = chCoef;
            if (disVar[k] >= 0) cumulative[disVar[k]] = disCoef;

            constraints.add(new LinearConstraint(cumulative.clone(), Relationship.LEQ, upper));
            constraints.add(new LinearConstraint(cumulative.clone(), Relationship.GEQ, lower));
        }

        final double[] terminal = cumulative.clone();
        terminal[slackVar] = -1.0 / cap;
        constraints.add(new LinearConstraint(terminal, Relationship.LEQ, dp.getEndSocTarget() - soc0));

        // ---- решение ----
        final PointValuePair sol;
        try {
            sol = new SimplexSolver().optimize(
                    new MaxIter(dp.getSolverMaxIterations()),
                    new LinearObjectiveFunction(c, 0.0),
                    new LinearConstraintSet(constraints),
                    GoalType.MINIMIZE,
                    new NonNegativeConstraint(true),
                    PivotSelectionRule.BLAND
            );
        } catch (MathIllegalStateException e) {
            log.warn("ЛП окна [{}, {}) не решена ({}): {}; АКБ на окне не используется",
                    start, end, e.getClass().getSimpleName(), e.getMessage());
            return HorizonSolution.fallbackZero(n);
        }

        final double[] x = sol.getPoint();
        final double[] ch = new double[n];
        final double[] dis = new double[n];
        for (int i = 0; i < n; i++) {
            // срезаем погрешность симплекса до границ переменных
            if (chVar[i] >= 0) ch[i] = clamp(x[chVar[i]], chUb[i]);
            if (disVar[i] >= 0) dis[i] = clamp(x[disVar[i]], disUb[i]);
        }
        return HorizonSolution.optimal(ch, dis, sol.getValue());
    }

    private static LinearConstraint bound(int vars, int var, double ub) {
        double[] a = new double[vars];
        a[var] = 1.0;
        return new LinearConstraint(a, Relationship.LEQ, ub);
    }

    private static double clamp(double v, double ub) {
        if (v < 0.0) return 0.0;
        return Math.min(v, ub);
    }
}
