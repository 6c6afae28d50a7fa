package com.questrail.tao.protocol.command;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * CommandSerializer
 * -----------------------------------------------------------------------------
 * Joins typed command arguments into one engine command string.
 *
 * <h2>Encoding rules</h2>
 * <ul>
 *   <li>Arguments are joined by single spaces, in order.</li>
 *   <li>{@link Double} and {@link Float} arguments are written in scientific
 *       notation with 15 significant digits so they survive the text round trip
 *       ({@code 0.1} becomes {@code 1.00000000000000e-01}).</li>
 *   <li>Every other argument is written with {@link String#valueOf(Object)}.</li>
 * </ul>
 *
 * <p>Arguments are not quoted or escaped: a string argument containing spaces
 * is passed through as several engine tokens.</p>
 */
public final class CommandSerializer
{
    /** 1 digit before the point + 14 after = 15 significant digits. */
    private static final String FLOAT_FORMAT = "%.14e";

    private CommandSerializer() {}

    /**
     * Serializes {@code args} into a single command string.
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public static String join(Object... args) {
        Objects.requireNonNull(args, "args");
        return join(Arrays.asList(args));
    }

    public static String join(List<?> args) {
        Objects.requireNonNull(args, "args");
        return args.stream()
                .map(CommandSerializer::format)
                .collect(Collectors.joining(" "));
    }

    /**
     * Formats a single argument.
     */
    public static String format(Object arg) {
        Objects.requireNonNull(arg, "command argument");
        if (arg instanceof Double || arg instanceof Float) {
            return String.format(Locale.ROOT, FLOAT_FORMAT, ((Number) arg).doubleValue());
        }
        return String.valueOf(arg);
    }
}
