package hybridsim.config;

import hybridsim.TestData;
import hybridsim.engine.lp.ChargeWeighting;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchParametersBuilderTest {

    @Test
    // необязательные поля берутся из SimulationConstants, цель SOC = socMin
    void defaultsApplied() {
        DispatchParameters dp = TestData.smallBatteryParams();

        assertEquals(SimulationConstants.SOC_FULL_EPSILON, dp.getSocFullEpsilon());
        assertEquals(SimulationConstants.EXCESS_THRESHOLD, dp.getExcessThreshold());
        assertEquals(SimulationConstants.MAX_EXTENSION_STEPS, dp.getMaxExtensionSteps());
        assertEquals(SimulationConstants.END_SOC_PENALTY, dp.getEndSocPenalty());
        assertEquals(SimulationConstants.CHARGE_EARLY_BONUS, dp.getChargeEarlyBonus());
        assertEquals(ChargeWeighting.LINEAR, dp.getChargeWeighting());
        assertEquals(0.1, dp.getEndSocTarget());
        assertFalse(dp.isAllowExport());
        assertEquals(0.9 - SimulationConstants.SOC_FULL_EPSILON, dp.fullSocLevel(), 1e-12);
    }

    @Test
    void fromCopiesAndOverrides() {
        DispatchParameters base = TestData.smallBattery().setEndSocTarget(0.3).build();
        DispatchParameters changed = DispatchParametersBuilder.from(base)
                .setBatteryCapacity(5.0)
                .build();

        assertEquals(5.0, changed.getBatteryCapacity());
        assertEquals(base.getBatteryPowerLimit(), changed.getBatteryPowerLimit());
        assertEquals(0.3, changed.getEndSocTarget());
        assertEquals(base.getSocInitial(), changed.getSocInitial());
    }

    @Test
    void missingRequiredFieldRejected() {
        DispatchParametersBuilder b = new DispatchParametersBuilder()
                .setBatteryPowerLimit(1.0)
                .setChargeEfficiency(0.95)
                .setDischargeEfficiency(0.95)
                .setSocMin(0.1)
                .setSocMax(0.9)
                .setSocInitial(0.5);

        assertThrows(IllegalArgumentException.class, b::build);
    }

    @Test
    void invalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setBatteryCapacity(0.0).build());
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setBatteryPowerLimit(-1.0).build());
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setChargeEfficiency(1.2).build());
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setDischargeEfficiency(0.0).build());
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setSocMin(0.95).build());
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setSocInitial(0.95).build());
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setMaxExtensionSteps(-1).build());
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setEndSocTarget(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setChargeWeighting(null).build());
        assertThrows(IllegalArgumentException.class, () -> TestData.smallBattery().setSolverMaxIterations(0).build());
    }

    @Test
    // нулевая мощность допустима: АКБ просто не участвует
    void zeroPowerAllowed() {
        DispatchParameters dp = TestData.smallBattery().setBatteryPowerLimit(0.0).build();
        assertTrue(dp.getBatteryPowerLimit() == 0.0);
    }
}
