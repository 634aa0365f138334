package org.scharp.stataxml;

import java.nio.charset.Charset;
import java.util.Collection;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ArgumentUtil() {
    }

    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is {@code null} or has a {@code null} element.
     *
     * @param argument
     *     The collection to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null} or contains {@code null}.
     */
    static void checkNoNullElements(Collection<?> argument, String argumentName) {
        checkNotNull(argument, argumentName);
        for (Object element : argument) {
            if (element == null) {
                throw new NullPointerException(argumentName + " must not contain a null entry");
            }
        }
    }

    /**
     * Throws an exception if {@code argument} is longer than a given number of bytes when encoded.
     *
     * @param argument
     *     The string to check
     * @param charset
     *     The character set in which to encode {@code argument}.
     * @param maximumLengthInBytes
     *     The maximum length that {@code argument} may be when encoded with {@code charset}.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is longer than {@code maximumLengthInBytes}.
     */
    static void checkMaximumLength(String argument, Charset charset, int maximumLengthInBytes, String argumentName) {
        assert charset != null : "charset must not be null";
        assert 0 < maximumLengthInBytes : "maximumLengthInBytes must be positive";

        if (maximumLengthInBytes < argument.getBytes(charset).length) {
            throw new IllegalArgumentException(
                argumentName + " must not be longer than " + maximumLengthInBytes + " bytes when encoded with " +
                    charset.name());
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(int argument, String argumentName) {
        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }
}
