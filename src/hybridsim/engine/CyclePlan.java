package hybridsim.engine;

import hybridsim.engine.lp.HorizonSolution;

/**
 * Принятый цикл [start, end): решения ЛП, SOC на границах и число расширений горизонта.
 */
public final class CyclePlan {

    private final int start;
    private final int end;
    private final double startSoc;
    private final double endSoc;
    private final HorizonSolution solution;
    private final int extensions;
    private final boolean extensionCapReached;

    /** Индекс в списке кандидатов, соответствующий end (или длина списка, если end - конец ряда). */
    private final int endCandidatePointer;

    CyclePlan(int start,
              int end,
              double startSoc,
              double endSoc,
              HorizonSolution solution,
              int extensions,
              boolean extensionCapReached,
              int endCandidatePointer) {
        this.start = start;
        this.end = end;
        this.startSoc = startSoc;
        this.endSoc = endSoc;
        this.solution = solution;
        this.extensions = extensions;
        this.extensionCapReached = extensionCapReached;
        this.endCandidatePointer = endCandidatePointer;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public double getStartSoc() {
        return startSoc;
    }

    public double getEndSoc() {
        return endSoc;
    }

    public HorizonSolution getSolution() {
        return solution;
    }

    public int getExtensions() {
        return extensions;
    }

    /** Решатель вызывается один раз на исходное окно и ещё раз на каждое расширение. */
    public int getSolverCalls() {
        return extensions + 1;
    }

    /** Цикл принят по лимиту расширений, хотя на границе АКБ всё ещё полная. */
    public boolean isExtensionCapReached() {
        return extensionCapReached;
    }

    int getEndCandidatePointer() {
        return endCandidatePointer;
    }

    @Override
    public String toString() {
        return "Cycle[" + start + ", " + end + ") soc " + startSoc + " -> " + endSoc
                + ", ext=" + extensions + (extensionCapReached ? " (cap)" : "")
                + ", " + solution.getOutcome();
    }
}
