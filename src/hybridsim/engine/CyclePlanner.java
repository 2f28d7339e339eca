package hybridsim.engine;

import hybridsim.engine.lp.HorizonSolution;
import hybridsim.engine.lp.HorizonSolver;
import hybridsim.model.Battery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Построение одного цикла от заданного начала.
 *
 * Конец цикла - следующий кандидат (начало блока избытка ФЭС) или конец ряда.
 * Если при пробном прогоне решений АКБ приходит к кандидату полной (нет места для заряда),
 * горизонт расширяется до следующего кандидата и ЛП решается заново от исходного начала.
 * Число расширений ограничено maxExtensionSteps.
 *
 * Состояние АКБ не меняется: пробный прогон идёт на копии.
 */
public final class CyclePlanner {

    private static final Logger log = LoggerFactory.getLogger(CyclePlanner.class);

    private final HorizonSolver solver;
    private final int[] candidates;
    private final int seriesLength;
    private final int maxExtensionSteps;

    public CyclePlanner(HorizonSolver solver, int[] candidates, int seriesLength, int maxExtensionSteps) {
        this.solver = solver;
        this.candidates = candidates.clone();
        this.seriesLength = seriesLength;
        this.maxExtensionSteps = maxExtensionSteps;
    }

    /**
     * @param start            начало цикла
     * @param battery          АКБ в начале цикла (не изменяется)
     * @param candidatePointer первый ещё не использованный кандидат
     */
    public CyclePlan plan(int start, Battery battery, int candidatePointer) {
        if (start < 0 || start >= seriesLength) {
            throw new IllegalArgumentException("start вне ряда: " + start);
        }

        int ptr = candidatePointer;
        while (ptr < candidates.length && candidates[ptr] <= start) {
            ptr++;
        }
        int end = endAt(ptr);
        int extensions = 0;
        final double soc0 = battery.getStateOfCharge();

        while (true) {
            HorizonSolution sol = solver.solve(start, end, soc0);
            double socAtEnd = replay(sol, battery.copy());

            boolean atSeriesEnd = end >= seriesLength;
            boolean hasSpace = atSeriesEnd || battery.hasHeadroom(socAtEnd);

            if (hasSpace || extensions >= maxExtensionSteps) {
                boolean capped = !hasSpace;
                if (capped) {
                    log.debug("Цикл [{}, {}): лимит расширений {} исчерпан, SOC на границе {}",
                            start, end, maxExtensionSteps, socAtEnd);
                }
                return new CyclePlan(start, end, soc0, socAtEnd, sol, extensions, capped, ptr);
            }

            // нет места для заряда на границе -> сливаем окно со следующим периодом
            ptr++;
            end = endAt(ptr);
            extensions++;
        }
    }

    private int endAt(int ptr) {
        return ptr < candidates.length ? candidates[ptr] : seriesLength;
    }

    private static double replay(HorizonSolution sol, Battery trial) {
        double soc = trial.getStateOfCharge();
        for (int i = 0; i < sol.length(); i++) {
            soc = trial.applyStep(sol.chargeAt(i), sol.dischargeAt(i));
        }
        return soc;
    }
}
