package hybridsim.engine;

import hybridsim.model.TimeSeries;

/**
 * excess = max(pv - load, 0), deficit = max(load - pv, 0), directUse = min(pv, load).
 */
public final class DerivedSeriesBuilder {

    private DerivedSeriesBuilder() {}

    public static DerivedSeries build(TimeSeries series) {
        return build(series.getLoad(), series.getProduction());
    }

    public static DerivedSeries build(double[] load, double[] production) {
        if (load.length != production.length) {
            throw new IllegalArgumentException(
                    "load.length != production.length: " + load.length + " vs " + production.length);
        }

        int n = load.length;
        double[] excess = new double[n];
        double[] deficit = new double[n];
        double[] directUse = new double[n];

        for (int t = 0; t < n; t++) {
            double pv = production[t];
            double l = load[t];
            excess[t] = Math.max(pv - l, 0.0);
            deficit[t] = Math.max(l - pv, 0.0);
            directUse[t] = Math.min(pv, l);
        }
        return new DerivedSeries(excess, deficit, directUse);
    }
}
