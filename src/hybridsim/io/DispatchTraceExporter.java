package hybridsim.io;

import hybridsim.engine.DerivedSeries;
import hybridsim.engine.DispatchResult;
import hybridsim.model.TimeSeries;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Почасовая трассировка диспетчеризации в CSV (разделитель ';', десятичная запятая).
 */
public final class DispatchTraceExporter {

    private static final Locale RU = Locale.forLanguageTag("ru-RU");

    static final String HEADER = "t;ts;price;load;pv;excess;deficit;ch;dis;grid;curt;soc";

    private DispatchTraceExporter() {}

    public static void exportToCsv(Path path, TimeSeries series, DispatchResult result)
            throws IOException {

        if (result.size() == 0) {
            throw new IllegalArgumentException("Empty trace");
        }
        if (series.size() != result.size()) {
            throw new IllegalArgumentException("series.size != result.size");
        }

        double[] price = series.getPrice();
        double[] load = series.getLoad();
        double[] pv = series.getProduction();

        DerivedSeries derived = result.getDerived();
        double[] excess = derived.getExcess();
        double[] deficit = derived.getDeficit();

        double[] ch = result.getCharge();
        double[] dis = result.getDischarge();
        double[] grid = result.getGridImport();
        double[] curt = result.getCurtailment();
        double[] soc = result.getSoc();

        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {

            w.write(HEADER);
            w.newLine();

            for (int t = 0; t < result.size(); t++) {
                StringBuilder s = new StringBuilder();
                s.append(t).append(';')
                        .append(series.getTimestamp(t)).append(';')
                        .append(f(price[t])).append(';')
                        .append(f(load[t])).append(';')
                        .append(f(pv[t])).append(';')
                        .append(f(excess[t])).append(';')
                        .append(f(deficit[t])).append(';')
                        .append(f(ch[t])).append(';')
                        .append(f(dis[t])).append(';')
                        .append(f(grid[t])).append(';')
                        .append(f(curt[t])).append(';')
                        .append(String.format(RU, "%.4f", soc[t]));

                w.write(s.toString());
                w.newLine();
            }
        }
    }

    private static String f(double v) {
        if (!Double.isFinite(v)) return "";
        return String.format(RU, "%.3f", v);
    }
}
