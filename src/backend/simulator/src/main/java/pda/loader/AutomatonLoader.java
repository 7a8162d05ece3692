package pda.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pda.automaton.Automaton;
import pda.automaton.DefinitionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads automaton definitions from files.
 *
 * {@link #read} stops at the candidate builder, so callers that want to list every structural
 * problem (the {@code validate} command) can do so; {@link #load} also validates and builds.
 *
 * Usage:
 *   AutomatonLoader loader = new AutomatonLoader();
 *   Automaton pda = loader.load(Paths.get("anbn.yaml"));
 */
public class AutomatonLoader {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonLoader.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Parse {@code path} into a candidate definition without validating it.
     *
     * @throws LoadException if the file is missing, unreadable, of an unknown format or malformed
     */
    public Automaton.Builder read(Path path) throws LoadException {
        DefinitionFormat format = DefinitionFormat.of(path);
        if (!Files.isRegularFile(path)) {
            throw new LoadException("Definition file not found: " + path);
        }
        String content;
        try {
            content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LoadException("Cannot read " + path + ": " + ex.getMessage(), ex);
        }
        logger.debug("Reading {} as {}", path, format);
        return read(content, format, path.toString());
    }

    /**
     * Parse definition text in the given format; {@code source} only appears in messages.
     */
    public Automaton.Builder read(String content, DefinitionFormat format, String source) throws LoadException {
        AutomatonDocument doc;
        switch (format) {
            case YAML:
                doc = bind(yamlMapper, content, source);
                break;
            case JSON:
                doc = bind(jsonMapper, content, source);
                break;
            case TEXT:
                doc = TextFormatParser.parse(lines(content), source);
                break;
            case CSV:
                doc = CsvFormatParser.parse(lines(content), source);
                break;
            default:
                throw new LoadException("Unsupported format " + format);
        }
        if (doc == null) {
            throw new LoadException(source + " is empty");
        }
        return doc.toBuilder();
    }

    /**
     * Read, validate and build.
     *
     * @throws DefinitionException if the file parses but describes an invalid automaton
     */
    public Automaton load(Path path) throws LoadException, DefinitionException {
        Automaton automaton = read(path).build();
        logger.debug("Loaded {}", automaton);
        return automaton;
    }

    private AutomatonDocument bind(ObjectMapper mapper, String content, String source) throws LoadException {
        if (content.trim().isEmpty()) {
            throw new LoadException(source + " is empty");
        }
        try {
            return mapper.readValue(content, AutomatonDocument.class);
        } catch (JsonProcessingException ex) {
            throw new LoadException("Malformed definition in " + source + ": " + ex.getOriginalMessage(), ex);
        }
    }

    private static List<String> lines(String content) {
        return Arrays.asList(content.split("\\r?\\n", -1));
    }
}
