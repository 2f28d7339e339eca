package hybridsim.io;

import hybridsim.TestData;
import hybridsim.engine.DispatchResult;
import hybridsim.engine.DispatchScheduler;
import hybridsim.model.TimeSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchTraceExporterTest {

    @TempDir
    Path dir;

    @Test
    void writesHeaderAndRowPerStep() throws IOException {
        TimeSeries s = TimeSeries.hourly(new double[]{10, 20, 30}, new double[]{1, 1, 1}, new double[]{0, 0, 0});
        DispatchResult r = new DispatchScheduler(TestData.smallBatteryParams()).run(s);

        Path out = dir.resolve("trace.csv");
        DispatchTraceExporter.exportToCsv(out, s, r);

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(4, lines.size());
        assertEquals(DispatchTraceExporter.HEADER, lines.get(0));

        String[] row = lines.get(1).split(";");
        assertEquals(12, row.length);
        assertEquals("0", row[0]);
        // десятичная запятая
        assertEquals("10,000", row[2]);
        assertEquals("1,000", row[9]);
        assertTrue(row[11].startsWith("0,1"));
    }

    @Test
    void emptyTraceRejected() {
        TimeSeries s = TimeSeries.hourly(new double[0], new double[0], new double[0]);
        DispatchResult r = new DispatchScheduler(TestData.smallBatteryParams()).run(s);

        assertThrows(IllegalArgumentException.class,
                () -> DispatchTraceExporter.exportToCsv(dir.resolve("trace.csv"), s, r));
    }
}
