package work.labs.witness.trace;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recursive-descent reader for one {@code <name> = <rhs> (<bits>)} assignment line.
 */
final class AssignmentLexer {
    private static final Pattern NUMBER = Pattern.compile(
        "[+-]?(?:0[xX][0-9a-fA-F]+|\\d+(?:\\.\\d*)?(?:[eE][+-]?\\d+)?|\\.\\d+(?:[eE][+-]?\\d+)?)[uUlLfF]*");

    private final String text;
    private final int lineNumber;
    private int pos;

    private AssignmentLexer(String text, int lineNumber) {
        this.text = text;
        this.lineNumber = lineNumber;
    }

    static Assignment read(String line, int lineNumber) {
        return new AssignmentLexer(line, lineNumber).assignment();
    }

    record Assignment(String name, RawValue value, Optional<RawBits> bits) {}

    private Assignment assignment() {
        int eq = text.indexOf('=');
        if (eq < 0) {
            throw error("assignment expected");
        }
        String name = text.substring(0, eq).trim();
        if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace) || name.startsWith("-")) {
            throw error("invalid variable name '" + name + "'");
        }
        pos = eq + 1;
        RawValue value = value();
        skipSpaces();
        Optional<RawBits> bits = Optional.empty();
        if (peek() == '(') {
            pos++;
            skipSpaces();
            if (peek() != ')') {
                bits = Optional.of(bits());
                skipSpaces();
            }
            expect(')');
            skipSpaces();
        }
        if (pos != text.length()) {
            throw error("unexpected input after assignment");
        }
        return new Assignment(name, value, bits);
    }

    private RawValue value() {
        skipSpaces();
        char c = peek();
        if (c == '{') {
            pos++;
            var elements = new ArrayList<RawValue>();
            skipSpaces();
            if (peek() == '}') {
                pos++;
                return new RawValue.Group(elements);
            }
            do {
                skipDesignator();
                elements.add(value());
                skipSpaces();
            } while (consume(','));
            expect('}');
            return new RawValue.Group(elements);
        }
        if (c == '"') {
            return new RawValue.Literal(RawValue.Kind.STRING, string());
        }
        String token = token();
        if (token.isEmpty()) {
            throw error("value expected");
        }
        if ("TRUE".equalsIgnoreCase(token) || "FALSE".equalsIgnoreCase(token)) {
            return new RawValue.Literal(RawValue.Kind.BOOLEAN, token.toUpperCase(Locale.ROOT));
        }
        if (NUMBER.matcher(token).matches()) {
            return new RawValue.Literal(RawValue.Kind.NUMBER, token);
        }
        return new RawValue.Literal(RawValue.Kind.SYMBOL, token);
    }

    private RawBits bits() {
        skipSpaces();
        if (consume('{')) {
            List<RawBits> elements = new ArrayList<>();
            skipSpaces();
            if (consume('}')) {
                return new RawBits.Group(elements);
            }
            do {
                elements.add(bits());
                skipSpaces();
            } while (consume(','));
            expect('}');
            return new RawBits.Group(elements);
        }
        var digits = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '0' || c == '1') {
                digits.append(c);
            } else if (c != ' ') {
                break;
            }
            pos++;
        }
        if (digits.length() == 0) {
            throw error("bit pattern expected");
        }
        return new RawBits.Run(digits.toString());
    }

    private String string() {
        expect('"');
        var out = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                return out.toString();
            }
            if (c == '\\' && pos < text.length()) {
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n':
                        out.append('\n');
                        break;
                    case 't':
                        out.append('\t');
                        break;
                    case 'r':
                        out.append('\r');
                        break;
                    case '0':
                        out.append('\0');
                        break;
                    default:
                        out.append(escaped);
                        break;
                }
            } else {
                out.append(c);
            }
        }
        throw error("unterminated string literal");
    }

    private String token() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c) || c == ',' || c == '{' || c == '}' || c == '(' || c == ')') {
                break;
            }
            pos++;
        }
        return text.substring(start, pos);
    }

    /**
     * Struct members may be printed as {@code .name=value}; only the value is kept.
     */
    private void skipDesignator() {
        skipSpaces();
        if (peek() != '.') {
            return;
        }
        int eq = text.indexOf('=', pos);
        if (eq > pos + 1 && text.substring(pos + 1, eq).trim().matches("[A-Za-z_$][\\w$]*")) {
            pos = eq + 1;
        }
    }

    private boolean consume(char c) {
        skipSpaces();
        if (peek() == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char c) {
        if (!consume(c)) {
            throw error("'" + c + "' expected");
        }
    }

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private LexException error(String message) {
        return new LexException(lineNumber, message + " at column " + (pos + 1));
    }
}
