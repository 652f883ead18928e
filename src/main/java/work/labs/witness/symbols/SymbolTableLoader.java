package work.labs.witness.symbols;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Loads symbol tables exported by the DSL compiler from TOML, JSON or YAML files.
 *
 * <p>All three formats share one layout:
 * <pre>
 * round_marker = "__labs_round"
 * scheduler_variable = "scheduled"   # optional
 * spurious_marker = "__sim_spurious"  # optional
 *
 * [threads]
 * "0" = 0
 *
 * [[variables]]
 * name = "x"
 * scope = "agent"
 * type = "u8"
 * </pre>
 * {@code variables} may also be a table keyed by variable name.
 */
public final class SymbolTableLoader {
    private static final Logger LOG = LoggerFactory.getLogger(SymbolTableLoader.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private SymbolTableLoader() {}

    public static SymbolTable load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new SymbolTableException("Symbol table not found: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            String text = Files.readString(path);
            SymbolTable table;
            if (fileName.endsWith(".toml")) {
                table = fromToml(text);
            } else if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
                table = fromMap(YAML.readValue(text, MAP_TYPE));
            } else {
                table = fromMap(JSON.readValue(text, MAP_TYPE));
            }
            LOG.debug("Loaded {} variables from {}", table.entries().size(), path);
            return table;
        } catch (IOException ex) {
            throw new SymbolTableException("Failed to read symbol table: " + path, ex);
        }
    }

    public static SymbolTable fromToml(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new SymbolTableException("toml parse error: " + result.errors().get(0).toString());
        }
        return fromMap(convertTomlTable(result));
    }

    public static SymbolTable fromJson(String text) {
        try {
            return fromMap(JSON.readValue(text, MAP_TYPE));
        } catch (IOException ex) {
            throw new SymbolTableException("json parse error: " + ex.getMessage(), ex);
        }
    }

    public static SymbolTable fromMap(Map<String, Object> root) {
        if (root == null) {
            throw new SymbolTableException("Symbol table is empty");
        }
        var builder = SymbolTable.builder()
            .roundMarker(asString(root.get("round_marker")))
            .schedulerVariable(asString(root.get("scheduler_variable")))
            .spuriousMarker(asString(root.get("spurious_marker")));

        Object threads = root.get("threads");
        if (threads instanceof Map<?, ?> threadMap) {
            for (var entry : threadMap.entrySet()) {
                builder.thread(asInt(entry.getKey(), "thread id"), asInt(entry.getValue(), "agent id"));
            }
        } else if (threads != null) {
            throw new SymbolTableException("'threads' must be a table of thread id to agent id");
        }

        Object variables = root.get("variables");
        if (variables instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> map)) {
                    throw new SymbolTableException("Variable declaration must be a table: " + item);
                }
                builder.variable(toEntry(asString(map.get("name")), map));
            }
        } else if (variables instanceof Map<?, ?> byName) {
            for (var entry : byName.entrySet()) {
                if (!(entry.getValue() instanceof Map<?, ?> map)) {
                    throw new SymbolTableException("Variable declaration must be a table: " + entry.getKey());
                }
                builder.variable(toEntry(String.valueOf(entry.getKey()), map));
            }
        } else if (variables != null) {
            throw new SymbolTableException("'variables' must be a list or a table");
        }
        return builder.build();
    }

    private static SymbolEntry toEntry(String name, Map<?, ?> declaration) {
        if (name == null || name.isBlank()) {
            throw new SymbolTableException("Variable declaration without a name: " + declaration);
        }
        try {
            Scope scope = Scope.from(asString(declaration.get("scope")));
            DeclaredType type = TypeDescriptor.parse(asString(declaration.get("type")));
            return new SymbolEntry(name, scope, type);
        } catch (IllegalArgumentException ex) {
            throw new SymbolTableException("Invalid declaration for '" + name + "': " + ex.getMessage(), ex);
        }
    }

    private static String asString(Object raw) {
        return raw == null ? null : String.valueOf(raw);
    }

    private static int asInt(Object raw, String what) {
        String text;
        if (raw instanceof Number num) {
            text = num.toString();
        } else if (raw instanceof String str) {
            text = str.trim();
        } else {
            throw new SymbolTableException("Invalid " + what + ": " + raw);
        }
        try {
            return new BigDecimal(text).intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new SymbolTableException("Invalid " + what + ": " + raw, ex);
        }
    }

    private static Map<String, Object> convertTomlTable(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, convertTomlValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertTomlValue(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
