package work.labs.witness.symbols;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses compact type descriptors such as {@code u8}, {@code i16}, {@code bool},
 * {@code u8[4]} or {@code (u8, i16[2])}.
 */
public final class TypeDescriptor {
    private final String text;
    private int pos;

    private TypeDescriptor(String text) {
        this.text = text;
    }

    public static DeclaredType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new SymbolTableException("Type descriptor is required");
        }
        var parser = new TypeDescriptor(raw.trim().toLowerCase(Locale.ROOT));
        DeclaredType type = parser.type();
        parser.skipSpaces();
        if (parser.pos != parser.text.length()) {
            throw parser.error("unexpected trailing input");
        }
        return type;
    }

    private DeclaredType type() {
        skipSpaces();
        DeclaredType base = peek() == '(' ? tuple() : scalar();
        var dims = new ArrayList<Integer>();
        skipSpaces();
        while (peek() == '[') {
            pos++;
            dims.add(number());
            skipSpaces();
            expect(']');
            skipSpaces();
        }
        for (int i = dims.size() - 1; i >= 0; i--) {
            base = new DeclaredType.ArrayType(base, dims.get(i));
        }
        return base;
    }

    private DeclaredType tuple() {
        expect('(');
        List<DeclaredType> components = new ArrayList<>();
        components.add(type());
        skipSpaces();
        while (peek() == ',') {
            pos++;
            components.add(type());
            skipSpaces();
        }
        expect(')');
        return new DeclaredType.TupleType(components);
    }

    private DeclaredType scalar() {
        int start = pos;
        while (pos < text.length() && Character.isLetter(text.charAt(pos))) {
            pos++;
        }
        String prefix = text.substring(start, pos);
        if ("bool".equals(prefix)) {
            return new DeclaredType.ScalarType(1, false);
        }
        boolean signed;
        switch (prefix) {
            case "i":
            case "int":
                signed = true;
                break;
            case "u":
            case "uint":
                signed = false;
                break;
            default:
                throw error("unknown scalar kind '" + prefix + "'");
        }
        int width = number();
        if (width < 1) {
            throw error("scalar width must be positive");
        }
        return new DeclaredType.ScalarType(width, signed);
    }

    private int number() {
        skipSpaces();
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw error("number expected");
        }
        try {
            return Integer.parseInt(text.substring(start, pos));
        } catch (NumberFormatException ex) {
            throw error("number out of range");
        }
    }

    private void expect(char c) {
        skipSpaces();
        if (peek() != c) {
            throw error("'" + c + "' expected");
        }
        pos++;
    }

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private SymbolTableException error(String message) {
        return new SymbolTableException("Invalid type descriptor '" + text + "' at " + pos + ": " + message);
    }
}
