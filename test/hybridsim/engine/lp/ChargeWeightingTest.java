package hybridsim.engine.lp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ChargeWeightingTest {

    @Test
    void linearFromOneToZero() {
        assertArrayEquals(new double[]{1.0, 0.75, 0.5, 0.25, 0.0}, ChargeWeighting.LINEAR.weights(5), 1e-12);
        assertArrayEquals(new double[]{1.0}, ChargeWeighting.LINEAR.weights(1), 1e-12);
        assertArrayEquals(new double[0], ChargeWeighting.LINEAR.weights(0), 1e-12);
    }

    @Test
    void uniformAllOnes() {
        assertArrayEquals(new double[]{1.0, 1.0, 1.0}, ChargeWeighting.UNIFORM.weights(3), 1e-12);
    }

    @Test
    void fromShape() {
        assertEquals(ChargeWeighting.LINEAR, ChargeWeighting.fromShape("linear"));
        assertEquals(ChargeWeighting.LINEAR, ChargeWeighting.fromShape(" Linear "));
        assertEquals(ChargeWeighting.UNIFORM, ChargeWeighting.fromShape("flat"));
        assertEquals(ChargeWeighting.UNIFORM, ChargeWeighting.fromShape(null));
    }
}
