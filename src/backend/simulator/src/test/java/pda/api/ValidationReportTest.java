package pda.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;
import pda.automaton.Automaton;
import pda.loader.AutomatonLoader;
import pda.validation.Violation;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.Assert.*;

public class ValidationReportTest {

    private final AutomatonLoader loader = new AutomatonLoader();
    private final ObjectMapper mapper = new ObjectMapper();

    private Automaton.Builder candidate(String name) throws Exception {
        return loader.read(Paths.get(ValidationReportTest.class.getResource("/automata/" + name).toURI()));
    }

    @Test
    public void invalidDefinitionListsEachViolation() throws Exception {
        Automaton.Builder candidate = candidate("bad-target.yaml");
        List<Violation> violations = candidate.validate();
        JsonNode json = mapper.readTree(ValidationReport.from("bad-target.yaml", candidate, violations).toJson());

        assertEquals("bad-target.yaml", json.get("source").asText());
        assertFalse(json.get("valid").asBoolean());
        assertEquals(2, json.get("states").asInt());
        assertEquals(2, json.get("transitions").asInt());
        assertEquals(violations.size(), json.get("violations").size());

        JsonNode first = json.get("violations").get(0);
        assertEquals("UNKNOWN_STATE", first.get("kind").asText());
        assertEquals("q9", first.get("subject").asText());
        assertTrue(first.get("message").asText().contains("'q9'"));
    }

    @Test
    public void validDefinitionHasNoViolations() throws Exception {
        Automaton.Builder candidate = candidate("unreachable-final.yaml");
        ValidationReport report = ValidationReport.from("unreachable-final.yaml", candidate, candidate.validate());
        JsonNode json = mapper.readTree(report.toJson());

        assertTrue(report.isValid());
        assertTrue(json.get("valid").asBoolean());
        assertEquals(0, json.get("violations").size());
    }

    @Test
    public void violationWithoutSubjectOmitsIt() throws Exception {
        JsonNode json = mapper.valueToTree(new Violation(Violation.Kind.EMPTY_STATES, null, "No states declared"));

        assertEquals("EMPTY_STATES", json.get("kind").asText());
        assertFalse(json.has("subject"));
    }
}
