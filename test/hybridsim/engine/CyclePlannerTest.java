package hybridsim.engine;

import hybridsim.TestData;
import hybridsim.config.DispatchParameters;
import hybridsim.engine.lp.HorizonSolver;
import hybridsim.model.Battery;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CyclePlannerTest {

    private static final double TOL = 1e-6;

    // load = 1, pv = [3,1,3,1,0,0]: кандидаты 0 и 2, дефицит только в конце ряда
    private static final double[] LOAD = {1, 1, 1, 1, 1, 1};
    private static final double[] PV = {3, 1, 3, 1, 0, 0};
    private static final double[] PRICE = {10, 10, 10, 10, 50, 20};

    private static DispatchParameters fullBattery() {
        return TestData.smallBattery()
                .setChargeEfficiency(1.0)
                .setDischargeEfficiency(1.0)
                .setSocInitial(0.9)
                .build();
    }

    private static CyclePlanner planner(DispatchParameters dp, int maxExtensions) {
        DerivedSeries ds = DerivedSeriesBuilder.build(LOAD, PV);
        int[] candidates = CycleBoundaryDetector.detect(ds.excess, dp.getExcessThreshold());
        HorizonSolver solver = new HorizonSolver(dp, ds.excess, ds.deficit, PRICE);
        return new CyclePlanner(solver, candidates, LOAD.length, maxExtensions);
    }

    @Test
    // АКБ полна на границе [0,2): окно сливается со следующим периодом и решается заново
    void extendsWindowWhenBatteryFullAtBoundary() {
        DispatchParameters dp = fullBattery();
        Battery battery = new Battery(dp);

        CyclePlan plan = planner(dp, 10).plan(0, battery, 1);

        assertEquals(0, plan.getStart());
        assertEquals(0.9, plan.getStartSoc(), TOL);
        assertEquals(LOAD.length, plan.getEnd());
        assertEquals(1, plan.getExtensions());
        assertEquals(2, plan.getSolverCalls());
        assertFalse(plan.isExtensionCapReached());

        // после расширения разряд в дорогой час t=4
        assertEquals(0.8, plan.getSolution().dischargeAt(4), TOL);
        assertEquals(0.1, plan.getEndSoc(), TOL);
    }

    @Test
    void extensionCapRespected() {
        DispatchParameters dp = fullBattery();
        Battery battery = new Battery(dp);

        CyclePlan plan = planner(dp, 0).plan(0, battery, 1);

        assertEquals(2, plan.getEnd());
        assertEquals(0, plan.getExtensions());
        assertTrue(plan.isExtensionCapReached());
        assertEquals(0.9, plan.getEndSoc(), TOL);
    }

    @Test
    // планирование идёт на копии АКБ
    void batteryNotMutated() {
        DispatchParameters dp = TestData.smallBattery().setSocInitial(0.5).build();
        Battery battery = new Battery(dp);

        planner(dp, 10).plan(0, battery, 1);

        assertEquals(0.5, battery.getStateOfCharge());
    }

    @Test
    // есть место для заряда: цикл заканчивается на следующем кандидате
    void stopsAtNextCandidateWithHeadroom() {
        DispatchParameters dp = TestData.smallBattery().setSocInitial(0.1).build();
        Battery battery = new Battery(dp);

        CyclePlan plan = planner(dp, 10).plan(0, battery, 1);

        assertEquals(2, plan.getEnd());
        assertEquals(0, plan.getExtensions());
        assertEquals(1, plan.getSolverCalls());
    }
}
