package io.github.flameyossnowy.buildable.example;

import io.github.flameyossnowy.buildable.BuildResolver;
import io.github.flameyossnowy.buildable.types.U32;
import io.github.flameyossnowy.buildable.utils.Logging;

public class Main {
    public static void main(String[] args) {
        Logging.ENABLED = true;
        //Logging.DEEP = true;

        boolean success;
        try {
            success = run();
        } catch (RuntimeException e) {
            Logging.error("Failed to produce a value", e);
            success = false;
        }

        if (!success) System.exit(1);
    }

    /**
     * Produces a {@link U32} through a typed local binding.
     * @return always {@code true}
     */
    public static boolean run() {
        U32 value = produceValue();
        Logging.info("Produced U32 " + value);
        Logging.deepInfo("U32", value);
        return true;
    }

    static U32 produceValue() {
        return BuildResolver.produce(U32.BUILD);
    }
}
