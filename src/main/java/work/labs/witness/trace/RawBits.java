package work.labs.witness.trace;

import java.util.List;

/**
 * Bit-level rendering printed next to an assignment; mirrors the nesting of the {@link RawValue}.
 */
public interface RawBits {

    /**
     * @param digits the {@code 0}/{@code 1} digits with the grouping spaces removed, MSB first
     */
    record Run(String digits) implements RawBits {}

    record Group(List<RawBits> elements) implements RawBits {
        public Group {
            elements = List.copyOf(elements);
        }
    }
}
