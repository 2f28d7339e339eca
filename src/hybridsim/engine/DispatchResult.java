package hybridsim.engine;

import hybridsim.engine.lp.HorizonSolution;

import java.util.Collections;
import java.util.List;

/**
 * Почасовой результат диспетчеризации и список принятых циклов.
 * Все массивы наружу отдаются копиями.
 */
public final class DispatchResult {

    private final DerivedSeries derived;

    private final double[] charge;
    private final double[] discharge;
    private final double[] gridImport;
    private final double[] curtailment;
    private final double[] soc;

    private final List<CyclePlan> cycles;
    private final int candidateCount;

    DispatchResult(DerivedSeries derived,
                   double[] charge,
                   double[] discharge,
                   double[] gridImport,
                   double[] curtailment,
                   double[] soc,
                   List<CyclePlan> cycles,
                   int candidateCount) {
        this.derived = derived;
        this.charge = charge;
        this.discharge = discharge;
        this.gridImport = gridImport;
        this.curtailment = curtailment;
        this.soc = soc;
        this.cycles = Collections.unmodifiableList(cycles);
        this.candidateCount = candidateCount;
    }

    public int size() {
        return soc.length;
    }

    public DerivedSeries getDerived() {
        return derived;
    }

    public double[] getCharge() {
        return charge.clone();
    }

    public double[] getDischarge() {
        return discharge.clone();
    }

    public double[] getGridImport() {
        return gridImport.clone();
    }

    public double[] getCurtailment() {
        return curtailment.clone();
    }

    /** SOC после решения шага t. */
    public double[] getSoc() {
        return soc.clone();
    }

    public double[] getDirectUse() {
        return derived.getDirectUse();
    }

    public List<CyclePlan> getCycles() {
        return cycles;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public int getSolverCalls() {
        int calls = 0;
        for (CyclePlan c : cycles) calls += c.getSolverCalls();
        return calls;
    }

    /** Число принятых циклов, для которых ЛП не решена и подставлены нулевые решения. */
    public int getFallbackCycles() {
        int count = 0;
        for (CyclePlan c : cycles) {
            if (c.getSolution().getOutcome() == HorizonSolution.Outcome.FALLBACK_ZERO) count++;
        }
        return count;
    }
}
