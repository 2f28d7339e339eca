package hybridsim.engine.lp;

import hybridsim.TestData;
import hybridsim.config.DispatchParameters;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HorizonSolverTest {

    private static final double TOL = 1e-6;

    // load = 1, pv = [0,0,3,0,0]
    private static final double[] EXCESS = {0, 0, 2, 0, 0};
    private static final double[] DEFICIT = {1, 1, 0, 1, 1};
    private static final double[] PRICE = {10, 20, 5, 30, 15};

    @Test
    // заряд до socMax на избытке, разряд в самый дорогой час
    void chargesOnSurplusAndDischargesAtPeak() {
        HorizonSolver solver = new HorizonSolver(TestData.smallBatteryParams(), EXCESS, DEFICIT, PRICE);

        HorizonSolution sol = solver.solve(2, 5, 0.1);

        assertEquals(HorizonSolution.Outcome.OPTIMAL, sol.getOutcome());
        assertEquals(3, sol.length());
        assertEquals(0.8 / 0.95, sol.chargeAt(0), TOL);
        assertEquals(0.76, sol.dischargeAt(1), TOL);
        assertEquals(0.0, sol.dischargeAt(2), TOL);
        assertEquals(0.0, sol.dischargeAt(0), TOL);
        assertEquals(0.0, sol.chargeAt(1), TOL);
    }

    @Test
    // без избытка в окне АКБ может отдать только то, что выше socMin
    void dischargeLimitedByStoredEnergy() {
        HorizonSolver solver = new HorizonSolver(TestData.smallBatteryParams(), EXCESS, DEFICIT, PRICE);

        HorizonSolution sol = solver.solve(3, 5, 0.5);

        assertEquals(HorizonSolution.Outcome.OPTIMAL, sol.getOutcome());
        assertEquals(0.4 * 0.95, sol.dischargeAt(0) + sol.dischargeAt(1), TOL);
        assertEquals(0.38, sol.dischargeAt(0), TOL);
    }

    @Test
    // решения в пределах min(excess, pMax) и min(deficit, pMax)
    void respectsPowerLimit() {
        DispatchParameters dp = TestData.smallBattery()
                .setBatteryCapacity(10.0)
                .setBatteryPowerLimit(0.5)
                .build();
        HorizonSolver solver = new HorizonSolver(dp, EXCESS, DEFICIT, PRICE);

        HorizonSolution sol = solver.solve(2, 5, 0.1);

        for (int i = 0; i < sol.length(); i++) {
            assertTrue(sol.chargeAt(i) <= 0.5 + TOL);
            assertTrue(sol.dischargeAt(i) <= 0.5 + TOL);
        }
        assertEquals(0.5, sol.chargeAt(0), TOL);
    }

    @Test
    void emptyWindow() {
        HorizonSolver solver = new HorizonSolver(TestData.smallBatteryParams(), EXCESS, DEFICIT, PRICE);

        HorizonSolution sol = solver.solve(3, 3, 0.5);

        assertEquals(HorizonSolution.Outcome.EMPTY, sol.getOutcome());
        assertEquals(0, sol.length());
    }

    @Test
    void windowOutsideSeriesRejected() {
        HorizonSolver solver = new HorizonSolver(TestData.smallBatteryParams(), EXCESS, DEFICIT, PRICE);

        assertThrows(IndexOutOfBoundsException.class, () -> solver.solve(3, 7, 0.5));
    }

    @Test
    // SOC ниже socMin и только дефицит: ЛП недопустима, подставляются нули
    void infeasibleFallsBackToZero() {
        HorizonSolver solver = new HorizonSolver(TestData.smallBatteryParams(), EXCESS, DEFICIT, PRICE);

        HorizonSolution sol = solver.solve(3, 5, 0.0);

        assertEquals(HorizonSolution.Outcome.FALLBACK_ZERO, sol.getOutcome());
        assertTrue(sol.isFallback());
        assertEquals(2, sol.length());
        assertEquals(0.0, sol.dischargeAt(0));
        assertEquals(0.0, sol.dischargeAt(1));
        assertTrue(Double.isNaN(sol.getObjective()));
    }

    @Test
    // исчерпан лимит итераций симплекс-метода
    void iterationLimitFallsBackToZero() {
        DispatchParameters dp = TestData.smallBattery().setSolverMaxIterations(1).build();
        HorizonSolver solver = new HorizonSolver(dp, EXCESS, DEFICIT, PRICE);

        HorizonSolution sol = solver.solve(2, 5, 0.1);

        assertEquals(HorizonSolution.Outcome.FALLBACK_ZERO, sol.getOutcome());
        assertEquals(0.0, sol.chargeAt(0));
    }

    @Test
    // нулевая мощность: переменных нет, решение нулевое без вызова симплекса
    void zeroPowerGivesZeroSolution() {
        DispatchParameters dp = TestData.smallBattery().setBatteryPowerLimit(0.0).build();
        HorizonSolver solver = new HorizonSolver(dp, EXCESS, DEFICIT, PRICE);

        HorizonSolution sol = solver.solve(0, 5, 0.1);

        assertEquals(HorizonSolution.Outcome.OPTIMAL, sol.getOutcome());
        assertFalse(sol.isFallback());
        for (int i = 0; i < 5; i++) {
            assertEquals(0.0, sol.chargeAt(i));
            assertEquals(0.0, sol.dischargeAt(i));
        }
    }
}
