package im.arun.treeinterval.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads {@link KindTableSchema} tables from YAML, looking on the classpath first and then
 * on the file system.
 */
public class LabelSchemaLoader {
    private static final Logger logger = LoggerFactory.getLogger(LabelSchemaLoader.class);

    public static final String PYTHON_SCHEMA = "label-schema/python.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public KindTableSchema loadPython() {
        return load(PYTHON_SCHEMA);
    }

    public KindTableSchema load(String location) {
        try {
            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(location);
            if (resourceStream != null) {
                try (InputStream in = resourceStream) {
                    KindTableSchema schema = yamlMapper.readValue(in, KindTableSchema.class);
                    logger.debug("Loaded label schema {} with {} kinds from classpath", schema.getName(), schema.getKinds().size());
                    return schema;
                }
            }

            Path path = Paths.get(location);
            if (Files.exists(path)) {
                KindTableSchema schema = yamlMapper.readValue(path.toFile(), KindTableSchema.class);
                logger.debug("Loaded label schema {} with {} kinds from {}", schema.getName(), schema.getKinds().size(), path);
                return schema;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read label schema " + location, e);
        }

        throw new IllegalArgumentException("Label schema not found: " + location);
    }
}
