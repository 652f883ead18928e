package work.labs.witness.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.labs.witness.assemble.Snapshot;
import work.labs.witness.assemble.Witness;
import work.labs.witness.decode.DecodedValue;
import work.labs.witness.decode.Diagnostic;
import work.labs.witness.steps.Assignment;
import work.labs.witness.steps.LogicalStep;
import work.labs.witness.trace.TraceTrailer;

/**
 * Deterministic JSON rendering of a {@link Witness} for golden files and presentation layers.
 * Uninitialized variables render as {@code null}; values that could not be typed as
 * {@code {"unknown": reason}}. The simulation sentinel is never reported as a violated property.
 */
public final class WitnessJson {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private WitnessJson() {}

    public static String toPrettyJson(Witness witness) {
        try {
            return WRITER.writeValueAsString(toSerializableMap(witness));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize witness: " + ex.getOriginalMessage(), ex);
        }
    }

    public static Map<String, Object> toSerializableMap(Witness witness) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("complete", witness.complete());
        root.put("spurious", witness.spurious());
        root.put("violatedProperty", witness.violatedProperty().orElse(null));
        root.put("assumptions", witness.trailer().map(TraceTrailer::assumptions).orElse(List.of()));
        List<Object> snapshots = new ArrayList<>();
        for (Snapshot snapshot : witness.snapshots()) {
            snapshots.add(snapshot(snapshot));
        }
        root.put("snapshots", snapshots);
        List<Object> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : witness.diagnostics()) {
            diagnostics.add(diagnostic(diagnostic));
        }
        root.put("diagnostics", diagnostics);
        return root;
    }

    private static Map<String, Object> snapshot(Snapshot snapshot) {
        LogicalStep step = snapshot.step();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("index", step.index());
        map.put("round", step.round());
        map.put("originator", step.originator().toString());
        map.put("thread", step.threadId());
        map.put("complete", step.complete());
        List<Object> assignments = new ArrayList<>();
        for (Assignment assignment : step.assignments()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("sequence", assignment.sequence());
            entry.put("variable", assignment.variable());
            entry.put("value", value(assignment.value()));
            assignments.add(entry);
        }
        map.put("assignments", assignments);
        map.put("changed", new ArrayList<>(snapshot.changed()));
        Map<String, Object> values = new LinkedHashMap<>();
        snapshot.values().forEach((name, state) -> values.put(name, state.value().map(WitnessJson::value).orElse(null)));
        map.put("values", values);
        return map;
    }

    private static Map<String, Object> diagnostic(Diagnostic diagnostic) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind", diagnostic.kind().name().toLowerCase(Locale.ROOT));
        map.put("sequence", diagnostic.sequence());
        map.put("variable", diagnostic.variable());
        map.put("message", diagnostic.message());
        return map;
    }

    private static Object value(DecodedValue value) {
        if (value instanceof DecodedValue.IntegerValue integer) {
            return integer.value();
        }
        if (value instanceof DecodedValue.BooleanValue bool) {
            return bool.value();
        }
        if (value instanceof DecodedValue.OpaqueValue opaque) {
            return opaque.text();
        }
        if (value instanceof DecodedValue.ArrayValue array) {
            List<Object> elements = new ArrayList<>();
            for (DecodedValue element : array.elements()) {
                elements.add(value(element));
            }
            return elements;
        }
        return Map.of("unknown", ((DecodedValue.UnknownValue) value).reason());
    }
}
