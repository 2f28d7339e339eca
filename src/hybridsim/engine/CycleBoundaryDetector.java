package hybridsim.engine;

import java.util.Arrays;

/**
 * Кандидаты на границу цикла: начала блоков избытка ФЭС (передний фронт).
 * i - кандидат, если excess[i] > threshold и (i == 0 или excess[i-1] <= threshold).
 */
public final class CycleBoundaryDetector {

    private CycleBoundaryDetector() {}

    public static int[] detect(double[] excess, double threshold) {
        int[] buf = new int[excess.length];
        int count = 0;
        boolean prevInBlock = false;
        for (int i = 0; i < excess.length; i++) {
            boolean inBlock = excess[i] > threshold;
            if (inBlock && !prevInBlock) {
                buf[count++] = i;
            }
            prevInBlock = inBlock;
        }
        return Arrays.copyOf(buf, count);
    }
}
