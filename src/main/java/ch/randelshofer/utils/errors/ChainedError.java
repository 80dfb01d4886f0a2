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

import io.vavr.control.Option;

/**
 * An error that carries a code, the stack at which it was created, and
 * optionally the error it wraps.
 * <p>
 * Errors form a chain through {@link #inner()}, outermost first. The chain
 * may end in a throwable that is not a {@code ChainedError}.
 *
 * @see Errors
 */
public interface ChainedError {

    /**
     * Returns the error message without the stack trace.
     *
     * @return the message of this error only, not of the errors it wraps
     */
    String message();

    /**
     * Returns the stack trace without the error message.
     *
     * @return a header line followed by one line per frame
     */
    String stack();

    /**
     * Returns the stack trace's context, the part of the stack that did not
     * fit into {@link #stack()}.
     *
     * @return the context, may be empty
     */
    String context();

    /**
     * Returns the error code, or {@link Errors#DEFAULT_CODE} if none was
     * given.
     *
     * @return the code
     */
    int code();

    /**
     * Returns the wrapped error.
     *
     * @return the wrapped error, or {@code None} if this error does not wrap
     * another one
     */
    Option<Throwable> inner();
}
