package hybridsim.engine.lp;

import java.util.Arrays;

/**
 * Форма весов бонуса раннего заряда внутри окна оптимизации.
 */
public enum ChargeWeighting {

    /** Вес линейно убывает от 1 в начале окна до 0 в конце. */
    LINEAR {
        @Override
        public double[] weights(int n) {
            double[] w = new double[Math.max(n, 0)];
            if (n == 1) {
                w[0] = 1.0;
                return w;
            }
            for (int i = 0; i < n; i++) {
                w[i] = 1.0 - (double) i / (n - 1);
            }
            return w;
        }
    },

    /** Одинаковый вес 1 для всех шагов. */
    UNIFORM {
        @Override
        public double[] weights(int n) {
            double[] w = new double[Math.max(n, 0)];
            Arrays.fill(w, 1.0);
            return w;
        }
    };

    public abstract double[] weights(int n);

    /**
     * "linear" (без учёта регистра) -> LINEAR, всё остальное -> UNIFORM.
     */
    public static ChargeWeighting fromShape(String shape) {
        if (shape != null && shape.trim().equalsIgnoreCase("linear")) {
            return LINEAR;
        }
        return UNIFORM;
    }
}
