package work.labs.witness.trace;

public record SourceLocation(String file, String function, int line) {}
