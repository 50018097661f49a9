package io.github.flameyossnowy.buildable.example;

import io.github.flameyossnowy.buildable.Build;
import io.github.flameyossnowy.buildable.annotations.Buildable;

/**
 * A TCP port number. Binds itself to {@link Build} without touching the resolver.
 *
 * @param number the port, 1 to 65535
 */
@Buildable
public record Port(int number) {
    public static final Build<Port> BUILD = () -> new Port(8080);

    public Port {
        if (number < 1 || number > 65535) {
            throw new IllegalArgumentException("Port " + number + " is out of range [1, 65535]");
        }
    }
}
