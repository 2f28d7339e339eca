package hybridsim.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Выровненные по общей временной сетке входные ряды: цена, нагрузка, выработка ФЭС.
 * Метки времени строго возрастают. Массивы наружу отдаются копиями.
 */
public final class TimeSeries {

    /** Начало синтетической сетки для рядов без меток времени. */
    public static final LocalDateTime DEFAULT_START = LocalDateTime.of(2000, 1, 1, 0, 0);

    private final LocalDateTime[] timestamps;
    private final double[] price;
    private final double[] load;
    private final double[] production;

    public TimeSeries(LocalDateTime[] timestamps, double[] price, double[] load, double[] production) {
        Objects.requireNonNull(timestamps, "timestamps");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(load, "load");
        Objects.requireNonNull(production, "production");

        int n = timestamps.length;
        if (price.length != n || load.length != n || production.length != n) {
            throw new IllegalArgumentException(
                    "Ряды разной длины: ts=" + n + ", price=" + price.length
                            + ", load=" + load.length + ", pv=" + production.length);
        }
        for (int t = 1; t < n; t++) {
            if (!timestamps[t].isAfter(timestamps[t - 1])) {
                throw new IllegalArgumentException(
                        "Метки времени не возрастают: [" + (t - 1) + "]=" + timestamps[t - 1]
                                + ", [" + t + "]=" + timestamps[t]);
            }
        }

        this.timestamps = timestamps.clone();
        this.price = price.clone();
        this.load = load.clone();
        this.production = production.clone();
    }

    /**
     * Ряд с почасовой сеткой от {@link #DEFAULT_START}.
     */
    public static TimeSeries hourly(double[] price, double[] load, double[] production) {
        LocalDateTime[] ts = new LocalDateTime[price.length];
        for (int t = 0; t < ts.length; t++) {
            ts[t] = DEFAULT_START.plusHours(t);
        }
        return new TimeSeries(ts, price, load, production);
    }

    public int size() {
        return timestamps.length;
    }

    public TimeStep step(int t) {
        return new TimeStep(t, timestamps[t], price[t], load[t], production[t]);
    }

    public LocalDateTime getTimestamp(int t) {
        return timestamps[t];
    }

    public double[] getPrice() {
        return price.clone();
    }

    public double[] getLoad() {
        return load.clone();
    }

    public double[] getProduction() {
        return production.clone();
    }
}
