package work.labs.witness.decode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import work.labs.witness.shared.IntegerLiterals;
import work.labs.witness.symbols.DeclaredType;
import work.labs.witness.trace.RawBits;
import work.labs.witness.trace.RawValue;

/**
 * Types raw trace values against their declarations. Pure and stateless: failures turn the
 * affected value into {@link DecodedValue.UnknownValue} and are reported in the outcome.
 */
public final class ValueDecoder {

    public DecodeOutcome decode(DeclaredType type, RawValue raw, Optional<RawBits> bits) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        DecodedValue value = decode(type, raw, bits, "", errors, warnings);
        return new DecodeOutcome(value, errors, warnings);
    }

    private DecodedValue decode(
        DeclaredType type,
        RawValue raw,
        Optional<RawBits> bits,
        String path,
        List<String> errors,
        List<String> warnings
    ) {
        if (raw instanceof RawValue.Literal literal) {
            if (!(type instanceof DeclaredType.ScalarType scalar)) {
                return fail(errors, path, literal.kind().name().toLowerCase(Locale.ROOT) + " literal '"
                    + literal.text() + "' cannot be read as " + type.describe());
            }
            switch (literal.kind()) {
                case BOOLEAN:
                    return new DecodedValue.BooleanValue("TRUE".equals(literal.text()));
                case STRING:
                case SYMBOL:
                    return new DecodedValue.OpaqueValue(literal.text());
                default:
                    return scalar(scalar, literal.text(), bits, path, errors, warnings);
            }
        }

        var group = (RawValue.Group) raw;
        List<DeclaredType> elementTypes;
        if (type instanceof DeclaredType.ArrayType array) {
            elementTypes = Collections.nCopies(array.length(), array.element());
        } else if (type instanceof DeclaredType.TupleType tuple) {
            elementTypes = tuple.components();
        } else {
            return fail(errors, path, "brace list cannot be read as " + type.describe());
        }
        if (group.elements().size() != elementTypes.size()) {
            return fail(errors, path, "expected " + elementTypes.size() + " elements for "
                + type.describe() + ", found " + group.elements().size());
        }
        List<RawBits> elementBits = null;
        if (bits.isPresent()) {
            if (!(bits.get() instanceof RawBits.Group bitGroup)) {
                return fail(errors, path, "bit pattern is a flat run but the value is a brace list");
            }
            if (bitGroup.elements().size() != elementTypes.size()) {
                return fail(errors, path, "bit pattern has " + bitGroup.elements().size()
                    + " elements, value has " + elementTypes.size());
            }
            elementBits = bitGroup.elements();
        }
        var elements = new ArrayList<DecodedValue>(elementTypes.size());
        for (int i = 0; i < elementTypes.size(); i++) {
            Optional<RawBits> b = elementBits == null ? Optional.empty() : Optional.of(elementBits.get(i));
            elements.add(decode(elementTypes.get(i), group.elements().get(i), b, path + "[" + i + "]", errors, warnings));
        }
        return new DecodedValue.ArrayValue(elements);
    }

    private DecodedValue scalar(
        DeclaredType.ScalarType type,
        String text,
        Optional<RawBits> bits,
        String path,
        List<String> errors,
        List<String> warnings
    ) {
        Optional<BigInteger> literal = IntegerLiterals.parse(text);
        BigInteger fromBits = null;
        if (bits.isPresent()) {
            if (bits.get() instanceof RawBits.Run run && run.digits().length() == type.width()) {
                fromBits = BitPatterns.decode(run.digits(), type.signed());
            } else if (bits.get() instanceof RawBits.Run shortRun) {
                warnings.add(at(path, "bit pattern has " + shortRun.digits().length() + " bits, declared width is "
                    + type.width() + "; using the literal"));
            } else {
                warnings.add(at(path, "brace-list bit pattern ignored for scalar " + type.describe()));
            }
        }
        if (fromBits != null) {
            if (literal.isPresent()) {
                BigInteger reduced = BitPatterns.reduce(literal.get(), type.width(), type.signed());
                if (!reduced.equals(fromBits)) {
                    warnings.add(at(path, "literal " + text + " disagrees with bit pattern value " + fromBits
                        + "; using the bit pattern"));
                }
            }
            return new DecodedValue.IntegerValue(type.width(), type.signed(), fromBits);
        }
        if (literal.isPresent()) {
            BigInteger reduced = BitPatterns.reduce(literal.get(), type.width(), type.signed());
            return new DecodedValue.IntegerValue(type.width(), type.signed(), reduced);
        }
        return fail(errors, path, "'" + text + "' is not an integer literal and no usable bit pattern is present");
    }

    private static DecodedValue fail(List<String> errors, String path, String reason) {
        String message = at(path, reason);
        errors.add(message);
        return DecodedValue.unknown(message);
    }

    private static String at(String path, String message) {
        return path.isEmpty() ? message : path + ": " + message;
    }
}
