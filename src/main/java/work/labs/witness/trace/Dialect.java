package work.labs.witness.trace;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual trace dialects printed by the supported backend versions. Both dialects share the
 * entry layout and only disagree on the order of the {@code function} and {@code line} header fields.
 */
public enum Dialect {
    /** {@code State <seq> file <f> function <fn> line <n> thread <t>} */
    CURRENT(Pattern.compile(
        "^State\\s+(\\d+)\\s+file\\s+(\\S+)\\s+function\\s+(\\S+)\\s+line\\s+(\\d+)\\s+thread\\s+(\\d+)\\s*$"), 3, 4),
    /** {@code State <seq> file <f> line <n> function <fn> thread <t>} (backends up to 5.4) */
    LEGACY(Pattern.compile(
        "^State\\s+(\\d+)\\s+file\\s+(\\S+)\\s+line\\s+(\\d+)\\s+function\\s+(\\S+)\\s+thread\\s+(\\d+)\\s*$"), 4, 3);

    private final Pattern header;
    private final int functionGroup;
    private final int lineGroup;

    Dialect(Pattern header, int functionGroup, int lineGroup) {
        this.header = header;
        this.functionGroup = functionGroup;
        this.lineGroup = lineGroup;
    }

    public static Dialect from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Dialect is required");
        }
        try {
            return Dialect.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported dialect: " + value);
        }
    }

    /**
     * Maps a backend version string such as {@code 5.4} or {@code 5.95.1} to the dialect it prints.
     */
    public static Dialect forBackendVersion(String version) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Backend version is required");
        }
        String[] parts = version.trim().split("[.\\s]");
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return major < 5 || (major == 5 && minor <= 4) ? LEGACY : CURRENT;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unsupported backend version: " + version, ex);
        }
    }

    Optional<Header> matchHeader(String line) {
        Matcher m = header.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Header(
            Long.parseLong(m.group(1)),
            m.group(2),
            m.group(functionGroup),
            Integer.parseInt(m.group(lineGroup)),
            Integer.parseInt(m.group(5))
        ));
    }

    Dialect other() {
        return this == CURRENT ? LEGACY : CURRENT;
    }

    record Header(long sequence, String file, String function, int line, int thread) {}
}
