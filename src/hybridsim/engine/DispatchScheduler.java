package hybridsim.engine;

import hybridsim.config.DispatchParameters;
import hybridsim.engine.lp.HorizonSolver;
import hybridsim.model.Battery;
import hybridsim.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Почасовая диспетчеризация ФЭС + АКБ + сеть по циклам.
 *
 * Фазы:
 *  1) до первого цикла - АКБ не используется (импорт = дефицит, сброс = избыток, SOC постоянен);
 *  2) циклы от кандидата до следующего кандидата с расширением горизонта, пока на границе нет места для заряда;
 *  3) после последнего цикла (нет кандидата с местом для заряда) - снова без АКБ до конца ряда.
 *
 * Циклы строго последовательны: SOC в начале цикла равен SOC в конце предыдущего.
 */
public final class DispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    private final DispatchParameters dp;

    public DispatchScheduler(DispatchParameters dp) {
        this.dp = dp;
        log.debug("Параметры диспетчеризации: {}", dp);
        if (dp.isAllowExport()) {
            log.warn("allowExport=true: экспорт в сеть планировщиком не моделируется, импорт всегда >= 0");
        }
    }

    public DispatchResult run(TimeSeries series) {
        final DerivedSeries ds = DerivedSeriesBuilder.build(series);
        final int n = ds.size();
        final int[] candidates = CycleBoundaryDetector.detect(ds.excess, dp.getExcessThreshold());

        final DispatchBuffer buffer = new DispatchBuffer(ds);
        final Battery battery = new Battery(dp);
        final List<CyclePlan> cycles = new ArrayList<>();

        if (candidates.length == 0) {
            log.info("Блоков избытка ФЭС нет ({} ч): АКБ не используется", n);
            buffer.writePassive(0, n, battery.getStateOfCharge());
            return buffer.toResult(cycles, 0);
        }

        final HorizonSolver solver = new HorizonSolver(dp, ds.excess, ds.deficit, series.getPrice());
        final CyclePlanner planner = new CyclePlanner(solver, candidates, n, dp.getMaxExtensionSteps());

        // До первого цикла SOC постоянен, поэтому "первый кандидат с местом для заряда" - это либо
        // первый кандидат, либо ни один; во втором случае всё равно стартуем с первого.
        int current = candidates[0];
        int ptr = 1;
        buffer.writePassive(0, current, battery.getStateOfCharge());

        while (true) {
            CyclePlan plan = planner.plan(current, battery, ptr);
            buffer.writeCycle(plan, battery);
            cycles.add(plan);
            log.debug("{}", plan);

            current = plan.getEnd();
            if (current >= n) {
                break;
            }

            ptr = plan.getEndCandidatePointer();
            while (ptr < candidates.length && candidates[ptr] < current) {
                ptr++;
            }

            int next = nextCycleStart(candidates, ptr, battery);
            if (next < 0) {
                log.debug("После t={} нет кандидата с местом для заряда (SOC={}), остаток ряда без АКБ",
                        current, battery.getStateOfCharge());
                buffer.writePassive(current, n, battery.getStateOfCharge());
                break;
            }

            // между концом цикла и следующим началом АКБ простаивает
            buffer.writePassive(current, candidates[next], battery.getStateOfCharge());
            current = candidates[next];
            ptr = next + 1;
        }

        DispatchResult result = buffer.toResult(cycles, candidates.length);
        log.info("Диспетчеризация: {} ч, кандидатов {}, циклов {}, вызовов ЛП {}, отказов ЛП {}",
                n, candidates.length, cycles.size(), result.getSolverCalls(), result.getFallbackCycles());
        return result;
    }

    /**
     * Первый кандидат начиная с ptr, на котором у АКБ есть место для заряда.
     * До него АКБ простаивает, SOC не меняется, поэтому достаточно проверить первый оставшийся.
     *
     * @return индекс в списке кандидатов или -1
     */
    private static int nextCycleStart(int[] candidates, int ptr, Battery battery) {
        if (ptr < candidates.length && battery.hasHeadroom()) {
            return ptr;
        }
        return -1;
    }
}
