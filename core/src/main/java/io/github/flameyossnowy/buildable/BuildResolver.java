package io.github.flameyossnowy.buildable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Generic entry point bounded by the {@link Build} capability.
 * <p>
 * The compiler fixes {@code T} from the witness passed in and checks it against the
 * call site's target type, so each call site is bound to exactly one implementation
 * before the program runs:
 * <pre>{@code
 * U32 value = BuildResolver.produce(U32.BUILD);   // 31
 * U64 wide  = BuildResolver.produce(U32.BUILD);   // does not compile
 * }</pre>
 *
 * @author FlameyosFlow
 */
public final class BuildResolver {
    private BuildResolver() {
        throw new AssertionError("No instances");
    }

    /**
     * Produces a value of type {@code T} by delegating to its capability.
     * The result is returned unchanged and nothing is cached.
     *
     * @param capability the witness of {@code T}
     * @param <T> the requested type
     * @return exactly what {@code capability.build()} returns
     * @throws NullPointerException if {@code capability} is null
     */
    public static <T> T produce(@NotNull Build<T> capability) {
        Objects.requireNonNull(capability, "capability");
        return capability.build();
    }

    /**
     * Adapts a witness to a {@link Supplier}; every {@code get()} goes through {@link #produce(Build)}.
     *
     * @param capability the witness of {@code T}
     * @param <T> the requested type
     * @return a supplier of {@code T}
     */
    @Contract("_ -> new")
    public static <T> @NotNull Supplier<T> supplier(@NotNull Build<T> capability) {
        Objects.requireNonNull(capability, "capability");
        return () -> produce(capability);
    }
}
