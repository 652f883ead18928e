package work.labs.witness.trace;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls one state entry at a time out of the trace text. Holds at most the current entry in
 * memory and never looks behind it. The {@link #trailer()} becomes available once exhausted.
 */
public final class StateEventIterator implements Iterator<StateEvent>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StateEventIterator.class);
    private static final String HEADER_PREFIX = "State ";
    private static final String FOOTER = "Violated property:";
    private static final String ASSUMPTION = "Assumption:";
    private static final String SIMULATION = "(SIMULATION):";

    private final BufferedReader reader;
    private final Dialect dialect;
    private final List<String> assumptions = new ArrayList<>();
    private int lineNumber = 0;
    private boolean lineTerminated = true;
    private long lastSequence = Long.MIN_VALUE;
    private boolean started = false;
    private StateEvent next;
    private TraceTrailer trailer;
    private RuntimeException failure;

    StateEventIterator(Reader source, Dialect dialect) {
        this.reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        this.dialect = dialect;
    }

    @Override
    public boolean hasNext() {
        if (failure != null) {
            throw failure;
        }
        if (next == null && trailer == null) {
            next = readEntry();
        }
        return next != null;
    }

    @Override
    public StateEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        StateEvent current = next;
        next = null;
        return current;
    }

    /**
     * Present once {@link #hasNext()} has returned {@code false}.
     */
    public Optional<TraceTrailer> trailer() {
        return Optional.ofNullable(trailer);
    }

    /**
     * Stops reading because the run was flagged spurious. Events after the flag are never
     * parsed; the trailer records the stop and the source is closed.
     */
    public void stopSpurious() {
        if (failure != null) {
            throw failure;
        }
        next = null;
        if (trailer != null) {
            trailer = new TraceTrailer(trailer.terminated(), trailer.truncated(), true,
                trailer.violatedProperty(), trailer.assumptions());
            return;
        }
        trailer = new TraceTrailer(false, false, true, Optional.empty(), assumptions);
        LOG.debug("Spurious run flagged before line {}", lineNumber + 1);
        close();
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to close trace source", ex);
        }
    }

    private StateEvent readEntry() {
        try {
            String line;
            while (true) {
                line = significantLine();
                if (line == null) {
                    return finish(false, false, null);
                }
                if (line.trim().equals(FOOTER)) {
                    return finish(true, false, readProperty());
                }
                if (line.startsWith(HEADER_PREFIX)) {
                    break;
                }
                if (started) {
                    throw new LexException(lineNumber, "state header expected");
                }
                LOG.trace("Skipping preamble line {}", lineNumber);
            }
            started = true;
            int headerLine = lineNumber;
            Dialect.Header header;
            try {
                header = header(line, headerLine);
            } catch (DialectMismatchException ex) {
                throw ex;
            } catch (LexException ex) {
                if (atEndOfInput()) {
                    return finish(false, true, null);
                }
                throw ex;
            }

            String separator = significantLine();
            if (separator == null) {
                return finish(false, true, null);
            }
            if (!isSeparator(separator)) {
                throw new LexException(lineNumber, "separator line expected after state header");
            }

            String assignmentLine = significantLine();
            if (assignmentLine == null || cutOff(assignmentLine)) {
                return finish(false, true, null);
            }
            AssignmentLexer.Assignment assignment;
            try {
                assignment = AssignmentLexer.read(assignmentLine.trim(), lineNumber);
            } catch (LexException ex) {
                if (atEndOfInput()) {
                    return finish(false, true, null);
                }
                throw ex;
            }

            if (header.sequence() <= lastSequence) {
                throw new LexException(headerLine, "state number " + header.sequence()
                    + " does not follow " + lastSequence);
            }
            lastSequence = header.sequence();
            return new StateEvent(
                header.sequence(),
                header.thread(),
                new SourceLocation(header.file(), header.function(), header.line()),
                assignment.name(),
                assignment.value(),
                assignment.bits(),
                headerLine
            );
        } catch (LexException ex) {
            throw fail(ex);
        } catch (IOException ex) {
            throw fail(new IllegalStateException("Failed to read trace at line " + lineNumber, ex));
        }
    }

    private Dialect.Header header(String line, int headerLine) {
        try {
            Optional<Dialect.Header> header = dialect.matchHeader(line.trim());
            if (header.isPresent()) {
                return header.get();
            }
            if (dialect.other().matchHeader(line.trim()).isPresent()) {
                throw new DialectMismatchException(headerLine, dialect);
            }
        } catch (NumberFormatException ex) {
            throw new LexException(headerLine, "numeric header field out of range", ex);
        }
        throw new LexException(headerLine, "malformed state header");
    }

    private String readProperty() throws IOException {
        var property = new StringBuilder();
        String line;
        while ((line = rawLine()) != null && !line.isBlank()) {
            if (property.length() > 0) {
                property.append('\n');
            }
            property.append(line.trim());
        }
        return property.length() == 0 ? null : property.toString();
    }

    /**
     * Next line that is neither blank nor backend noise.
     */
    private String significantLine() throws IOException {
        String line;
        while ((line = rawLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.equals(ASSUMPTION)) {
                int blockStart = lineNumber;
                var block = new StringBuilder(trimmed);
                for (int i = 0; i < 2; i++) {
                    String extra = rawLine();
                    if (extra == null) {
                        break;
                    }
                    block.append('\n').append(extra.trim());
                }
                assumptions.add(block.toString());
                LOG.debug("Discarded assumption block at line {}", blockStart);
                continue;
            }
            if (trimmed.startsWith(SIMULATION)) {
                LOG.trace("Discarded simulation line {}", lineNumber);
                continue;
            }
            return line;
        }
        return null;
    }

    /**
     * The last line of input is only a whole assignment when it is newline-terminated and
     * closes its bit group. Anything else may be a cut-off prefix that happens to lex.
     */
    private boolean cutOff(String assignmentLine) throws IOException {
        return atEndOfInput() && (!lineTerminated || !assignmentLine.trim().endsWith(")"));
    }

    /**
     * A line cut off by the end of input reads as truncation, not as a malformed entry.
     */
    private boolean atEndOfInput() throws IOException {
        reader.mark(1);
        int c = reader.read();
        if (c < 0) {
            return true;
        }
        reader.reset();
        return false;
    }

    private String rawLine() throws IOException {
        var line = new StringBuilder();
        int c;
        while ((c = reader.read()) >= 0) {
            if (c == '\n') {
                lineNumber++;
                lineTerminated = true;
                return withoutCarriageReturn(line);
            }
            line.append((char) c);
        }
        if (line.length() == 0) {
            return null;
        }
        lineNumber++;
        lineTerminated = false;
        return withoutCarriageReturn(line);
    }

    private static String withoutCarriageReturn(StringBuilder line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }

    private static boolean isSeparator(String line) {
        String trimmed = line.trim();
        return trimmed.length() >= 3 && trimmed.chars().allMatch(c -> c == '-');
    }

    private StateEvent finish(boolean terminated, boolean truncated, String property) {
        trailer = new TraceTrailer(terminated, truncated, false, Optional.ofNullable(property), assumptions);
        if (truncated) {
            LOG.debug("Trace ends inside a state entry at line {}", lineNumber);
        }
        close();
        return null;
    }

    private RuntimeException fail(RuntimeException error) {
        failure = error;
        try {
            reader.close();
        } catch (IOException closeFailure) {
            error.addSuppressed(closeFailure);
        }
        return error;
    }
}
