package io.github.drompincen.labseed.runtime.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.github.drompincen.labseed.protocol.document.SeedDocument;
import io.github.drompincen.labseed.runtime.error.DocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a YAML seed document and validates it before anything is sent to the platform.
 */
@Component
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private final ObjectMapper yamlMapper;
    private final DocumentValidator validator;

    public DocumentLoader() {
        this(new DocumentValidator());
    }

    DocumentLoader(DocumentValidator validator) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();
        this.validator = validator;
    }

    public SeedDocument load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new DocumentException("Seed document not found: " + path, null);
        }
        try (InputStream in = Files.newInputStream(path)) {
            SeedDocument document = read(in, path.toString());
            log.info("Loaded seed document {}: {} user(s), {} top-level group(s)",
                    path, document.users().size(), document.groups().size());
            return document;
        } catch (IOException e) {
            throw new DocumentException("Cannot read seed document " + path + ": " + e.getMessage(), e);
        }
    }

    public SeedDocument read(InputStream in, String source) {
        SeedDocument document;
        try {
            document = yamlMapper.readValue(in, SeedDocument.class);
        } catch (JsonProcessingException e) {
            throw new DocumentException("Cannot parse " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DocumentException("Cannot read " + source + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new DocumentException(List.of(source + " is empty"));
        }
        List<String> problems = validator.validate(document);
        if (!problems.isEmpty()) {
            throw new DocumentException(problems);
        }
        return document;
    }
}
