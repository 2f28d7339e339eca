package hybridsim.model;

import hybridsim.TestData;
import hybridsim.config.DispatchParameters;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatteryTest {

    private final DispatchParameters dp = TestData.smallBattery().setSocInitial(0.5).build();

    @Test
    void chargeAndDischargeUseEfficiencies() {
        Battery b = new Battery(dp);

        assertEquals(0.5 + 0.2 * 0.95, b.applyStep(0.2, 0.0), 1e-12);
        assertEquals(0.69 - 0.19 / 0.95, b.applyStep(0.0, 0.19), 1e-12);
    }

    @Test
    // SOC не выходит за [socMin, socMax]
    void socClampedToRange() {
        Battery b = new Battery(dp);

        assertEquals(0.9, b.applyStep(10.0, 0.0), 1e-12);
        assertEquals(0.1, b.applyStep(0.0, 10.0), 1e-12);
    }

    @Test
    void headroomUsesFullEpsilon() {
        assertTrue(new Battery(dp, 0.5).hasHeadroom());
        assertFalse(new Battery(dp, 0.9).hasHeadroom());
        assertFalse(new Battery(dp, 0.9 - dp.getSocFullEpsilon() / 2).hasHeadroom());
        assertTrue(new Battery(dp, 0.9 - dp.getSocFullEpsilon() * 2).hasHeadroom());
    }

    @Test
    void copyIsIndependent() {
        Battery b = new Battery(dp);
        Battery trial = b.copy();

        trial.applyStep(0.3, 0.0);

        assertEquals(0.5, b.getStateOfCharge(), 1e-12);
        assertTrue(trial.getStateOfCharge() > 0.5);
    }
}
