package io.github.flameyossnowy.buildable.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type as claiming the {@link io.github.flameyossnowy.buildable.Build} capability.
 * <p>
 * The compile-time checker verifies that the type is concrete and declares exactly one
 * {@code public static final Build<Self>} witness.
 * @author FlameyosFlow
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.TYPE)
public @interface Buildable {
}
