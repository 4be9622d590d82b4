package uz.sonic.continuum.provider;

public sealed interface ParseResult<P> {

    record Parsed<P>(P payload) implements ParseResult<P> {}

    record Failed<P>(String reason) implements ParseResult<P> {}

    static <P> ParseResult<P> parsed(P payload) {
        return new Parsed<>(payload);
    }

    static <P> ParseResult<P> failed(String reason) {
        return new Failed<>(reason);
    }
}
