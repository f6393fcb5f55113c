package im.arun.docsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.docsync.exception.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the optional {@code metadata.yaml} that names the project and points at its index topic.
 */
public class MetadataReader {
    private static final Logger logger = LoggerFactory.getLogger(MetadataReader.class);

    public static final String METADATA_FILE_NAME = "metadata.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public Optional<ProjectMetadata> read(Path metadataFile) {
        if (metadataFile == null || !Files.isRegularFile(metadataFile)) {
            logger.debug("No metadata file at {}", metadataFile);
            return Optional.empty();
        }
        try {
            ProjectMetadata metadata = yamlMapper.readValue(metadataFile.toFile(), ProjectMetadata.class);
            return Optional.ofNullable(metadata);
        } catch (IOException e) {
            throw new InputException("Invalid metadata file " + metadataFile + ": " + e.getMessage(), e);
        }
    }
}
