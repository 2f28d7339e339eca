package hybridsim.engine;

/**
 * Производные ряды: избыток ФЭС, дефицит, прямое потребление ФЭС.
 * Массивы доступны пакету напрямую, наружу - копиями.
 */
public final class DerivedSeries {

    final double[] excess;
    final double[] deficit;
    final double[] directUse;

    DerivedSeries(double[] excess, double[] deficit, double[] directUse) {
        this.excess = excess;
        this.deficit = deficit;
        this.directUse = directUse;
    }

    public int size() {
        return excess.length;
    }

    public double[] getExcess() {
        return excess.clone();
    }

    public double[] getDeficit() {
        return deficit.clone();
    }

    public double[] getDirectUse() {
        return directUse.clone();
    }
}
