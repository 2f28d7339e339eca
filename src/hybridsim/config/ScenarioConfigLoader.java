package hybridsim.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import hybridsim.ScenarioFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Чтение сценария из YAML поверх значений по умолчанию.
 * Относительные пути к файлам считаются от каталога, в котором лежит YAML.
 */
public final class ScenarioConfigLoader {

    private final ObjectMapper mapper;

    public ScenarioConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ScenarioConfig load(Path yamlPath) throws IOException {
        if (!Files.isRegularFile(yamlPath)) {
            throw new IOException("Файл сценария не найден: " + yamlPath);
        }

        ScenarioConfig cfg = ScenarioFactory.defaultScenario();
        mapper.readerForUpdating(cfg).readValue(yamlPath.toFile());

        Path baseDir = yamlPath.toAbsolutePath().getParent();
        cfg.filePrices = resolve(baseDir, cfg.filePrices);
        cfg.fileSolar = resolve(baseDir, cfg.fileSolar);
        cfg.fileConsumption = resolve(baseDir, cfg.fileConsumption);
        cfg.outputXlsx = resolve(baseDir, cfg.outputXlsx);
        cfg.traceCsv = resolve(baseDir, cfg.traceCsv);
        return cfg;
    }

    private static String resolve(Path baseDir, String file) {
        if (file == null || file.isBlank() || baseDir == null) {
            return file;
        }
        Path p = Path.of(file);
        return p.isAbsolute() ? file : baseDir.resolve(p).normalize().toString();
    }
}
