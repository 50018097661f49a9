package io.github.flameyossnowy.buildable;

/**
 * The capability to build a default value of one exact type.
 * <p>
 * A type opts in by exposing exactly one {@code public static final Build<Self>} witness,
 * conventionally named {@code BUILD}, and annotating itself with
 * {@link io.github.flameyossnowy.buildable.annotations.Buildable}:
 * <pre>{@code
 * public record Port(int number) {
 *     public static final Build<Port> BUILD = () -> new Port(8080);
 * }
 * }</pre>
 * There is no default implementation. A type without a witness simply cannot be passed
 * to {@link BuildResolver#produce(Build)}, so the call does not compile. A witness initialized
 * to a {@code null} literal is rejected by the compile-time checker; a witness that is null
 * for any other reason fails only when {@code produce} is called.
 *
 * @param <T> the type this capability builds
 * @author FlameyosFlow
 */
@FunctionalInterface
public interface Build<T> {
    /**
     * Builds a value of type {@code T}.
     * <p>
     * Implementations are pure and total: no side effects, no dependency on external state,
     * and the same value every time.
     *
     * @return the built value, never null
     */
    T build();
}
