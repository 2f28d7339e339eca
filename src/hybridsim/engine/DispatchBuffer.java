package hybridsim.engine;

import hybridsim.model.Battery;

import java.util.List;

/**
 * Предвыделенный буфер результата, индексируемый временем.
 * Пишется строго последовательно, каждый индекс ровно один раз.
 */
final class DispatchBuffer {

    private final DerivedSeries ds;

    private final double[] charge;
    private final double[] discharge;
    private final double[] gridImport;
    private final double[] curtailment;
    private final double[] soc;

    /** Первый ещё не записанный индекс. */
    private int cursor;

    DispatchBuffer(DerivedSeries ds) {
        int n = ds.size();
        this.ds = ds;
        this.charge = new double[n];
        this.discharge = new double[n];
        this.gridImport = new double[n];
        this.curtailment = new double[n];
        this.soc = new double[n];
    }

    /**
     * [from, to) без АКБ: импорт = дефицит, сброс = избыток, SOC постоянен.
     */
    void writePassive(int from, int to, double socValue) {
        checkRange(from, to);
        for (int t = from; t < to; t++) {
            charge[t] = 0.0;
            discharge[t] = 0.0;
            gridImport[t] = ds.deficit[t];
            curtailment[t] = ds.excess[t];
            soc[t] = socValue;
        }
        cursor = to;
    }

    /**
     * Записать принятый цикл, применяя решения к АКБ шаг за шагом.
     */
    void writeCycle(CyclePlan plan, Battery battery) {
        int from = plan.getStart();
        int to = plan.getEnd();
        checkRange(from, to);

        for (int t = from; t < to; t++) {
            int i = t - from;
            double ch = plan.getSolution().chargeAt(i);
            double dis = plan.getSolution().dischargeAt(i);

            charge[t] = ch;
            discharge[t] = dis;
            gridImport[t] = ds.deficit[t] - dis;
            curtailment[t] = ds.excess[t] - ch;
            soc[t] = battery.applyStep(ch, dis);
        }
        cursor = to;
    }

    DispatchResult toResult(List<CyclePlan> cycles, int candidateCount) {
        if (cursor != soc.length) {
            throw new IllegalStateException("Буфер заполнен не полностью: " + cursor + " из " + soc.length);
        }
        return new DispatchResult(ds, charge, discharge, gridImport, curtailment, soc, cycles, candidateCount);
    }

    private void checkRange(int from, int to) {
        if (from != cursor) {
            throw new IllegalStateException("Запись с индекса " + from + ", ожидался " + cursor);
        }
        if (to < from || to > soc.length) {
            throw new IllegalArgumentException("Неверный диапазон [" + from + ", " + to + ")");
        }
    }
}
