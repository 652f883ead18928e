package work.labs.witness.symbols;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.labs.witness.support.WitnessTestSupport;

class SymbolTableLoaderTest {
    @Test
    void loadsToml() {
        assertMatchesFixture(SymbolTableLoader.load(WitnessTestSupport.resource("symbols", "agents.toml")));
    }

    @Test
    void loadsYaml() {
        assertMatchesFixture(SymbolTableLoader.load(WitnessTestSupport.resource("symbols", "agents.yaml")));
    }

    @Test
    void loadsJsonWithVariablesKeyedByName() {
        assertMatchesFixture(SymbolTableLoader.load(WitnessTestSupport.resource("symbols", "agents.json")));
    }

    @Test
    void readsRunConventions() {
        var table = SymbolTableLoader.fromToml("""
            scheduler_variable = "scheduled"
            spurious_marker = "__sim_spurious"

            [[variables]]
            name = "scheduled"
            scope = "global"
            type = "u8"
            """);
        assertEquals("scheduled", table.schedulerVariable().orElseThrow());
        assertEquals("__sim_spurious", table.spuriousMarker().orElseThrow());
    }

    @Test
    void rejectsIdsOutsideTheIntRange() {
        var tooLarge = assertThrows(SymbolTableException.class, () -> SymbolTableLoader.fromToml("""
            [threads]
            "4294967297" = 0
            """));
        assertTrue(tooLarge.getMessage().contains("thread id"));
        assertThrows(SymbolTableException.class, () -> SymbolTableLoader.fromToml("""
            [threads]
            "1" = 4294967297
            """));
        assertThrows(SymbolTableException.class, () -> SymbolTableLoader.fromJson("{\"threads\": {\"1\": 1.5}}"));
        assertEquals(2, SymbolTableLoader.fromJson("{\"threads\": {\"1\": 2}}").agentForThread(1).orElseThrow());
    }

    @Test
    void reportsInvalidDeclarations() {
        assertThrows(SymbolTableException.class, () -> SymbolTableLoader.fromJson(
            "{\"variables\": [{\"name\": \"x\", \"scope\": \"agent\", \"type\": \"float\"}]}"));
        assertThrows(SymbolTableException.class, () -> SymbolTableLoader.fromJson(
            "{\"variables\": [{\"name\": \"x\", \"scope\": \"heap\", \"type\": \"u8\"}]}"));
        assertThrows(SymbolTableException.class, () -> SymbolTableLoader.fromJson(
            "{\"threads\": {\"a\": 1}}"));
        assertThrows(SymbolTableException.class, () -> SymbolTableLoader.fromToml("variables = ["));
        assertThrows(SymbolTableException.class, () -> SymbolTableLoader.load(Path.of("missing.toml")));
    }

    private static void assertMatchesFixture(SymbolTable table) {
        var expected = WitnessTestSupport.agentSymbols();
        assertEquals(List.copyOf(expected.entries()), List.copyOf(table.entries()));
        assertEquals(expected.threadAgents(), table.threadAgents());
        assertEquals(expected.roundMarker(), table.roundMarker());
    }
}
