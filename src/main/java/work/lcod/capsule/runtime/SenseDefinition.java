package work.lcod.capsule.runtime;

/**
 * Declared sense, listed by {@code describe()} for introspection. Emitting is not restricted to declared senses.
 */
public record SenseDefinition(String name, String docs, String signature) {}
