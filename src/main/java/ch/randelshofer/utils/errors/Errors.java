/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.utils.errors;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.util.Objects;

/**
 * Creates and renders {@link ChainedError}s.
 * <p>
 * Every factory captures the stack of its caller. The {@code Formatted}
 * variants build the message with {@link String#format(String, Object...)}.
 */
public final class Errors {

    /**
     * The code of an error that was created without one.
     */
    public static final int DEFAULT_CODE = -1;

    static final String NON_ERROR_MESSAGE = "Passed a non-error to message";

    // frames between the ChainedException constructor and the caller of a factory
    private static final int FACTORY_SKIP = 1;

    private Errors() {
    }

    public static ChainedException newError(String message) {
        return new ChainedException(DEFAULT_CODE, message, null, FACTORY_SKIP);
    }

    public static ChainedException newError(int code, String message) {
        return new ChainedException(code, message, null, FACTORY_SKIP);
    }

    public static ChainedException newFormatted(String format, Object... args) {
        return new ChainedException(DEFAULT_CODE, String.format(format, args), null, FACTORY_SKIP);
    }

    public static ChainedException newFormatted(int code, String format, Object... args) {
        return new ChainedException(code, String.format(format, args), null, FACTORY_SKIP);
    }

    /**
     * Wraps another error in a new {@link ChainedException}.
     *
     * @param cause   the wrapped error, may be null
     * @param message the message of the new error
     * @return a new error
     */
    public static ChainedException wrap(Throwable cause, String message) {
        return new ChainedException(DEFAULT_CODE, message, cause, FACTORY_SKIP);
    }

    public static ChainedException wrap(int code, Throwable cause, String message) {
        return new ChainedException(code, message, cause, FACTORY_SKIP);
    }

    public static ChainedException wrapFormatted(Throwable cause, String format, Object... args) {
        return new ChainedException(DEFAULT_CODE, String.format(format, args), cause, FACTORY_SKIP);
    }

    public static ChainedException wrapFormatted(int code, Throwable cause, String format, Object... args) {
        return new ChainedException(code, String.format(format, args), cause, FACTORY_SKIP);
    }

    /**
     * Returns the stack of the caller.
     *
     * @return the captured stack
     */
    public static CapturedStack stackTrace() {
        // 0 is StackCapture.capture, 1 is this method
        return StackCapture.capture(2);
    }

    /**
     * Returns the message of an error without stack trace information.
     * <p>
     * For a {@link ChainedError} the messages of the whole chain are joined
     * with single spaces, outermost first. If the chain ends in a throwable
     * that is not a {@code ChainedError}, its message is the last one.
     *
     * @param value an error
     * @return the message, or a fixed diagnostic if {@code value} is not an
     * error
     */
    public static String message(Object value) {
        if (value instanceof ChainedError) {
            final Tuple2<Vector<ChainedError>, Option<Throwable>> chain = chain((ChainedError) value);
            return chain._1.map(Errors::ownMessageOf)
                    .appendAll(chain._2.map(Errors::messageOf))
                    .mkString(" ");
        } else if (value instanceof Throwable) {
            return messageOf((Throwable) value);
        } else {
            return NON_ERROR_MESSAGE;
        }
    }

    /**
     * Renders the messages of the whole chain, followed by the stack of the
     * innermost {@link ChainedError}:
     * <pre>
     * ERROR:
     * outer message
     * inner message
     *
     * ORIGINAL STACK TRACE:
     * Thread "main":
     *     at ...
     * </pre>
     *
     * @param error an error
     * @return the rendered text, lines separated by {@code '\n'}
     */
    public static String formatDefault(ChainedError error) {
        Objects.requireNonNull(error, "error is null");
        final Tuple2<Vector<ChainedError>, Option<Throwable>> chain = chain(error);
        return Vector.of("ERROR:")
                .appendAll(chain._1.map(Errors::ownMessageOf))
                .appendAll(chain._2.map(Errors::messageOf))
                .append("")
                .append("ORIGINAL STACK TRACE:")
                .append(chain._1.last().stack())
                .mkString("\n");
    }

    /**
     * Walks the chain. Returns the chained errors, outermost first, and the
     * throwable that ends the chain if it is not a {@code ChainedError}.
     */
    private static Tuple2<Vector<ChainedError>, Option<Throwable>> chain(ChainedError error) {
        Vector<ChainedError> errors = Vector.empty();
        ChainedError current = error;
        while (true) {
            errors = errors.append(current);
            final Throwable inner = current.inner().getOrNull();
            if (inner == null) {
                return Tuple.of(errors, Option.none());
            }
            if (!(inner instanceof ChainedError)) {
                return Tuple.of(errors, Option.some(inner));
            }
            current = (ChainedError) inner;
        }
    }

    private static String ownMessageOf(ChainedError error) {
        final String message = error.message();
        return message != null ? message : "";
    }

    private static String messageOf(Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }
}
