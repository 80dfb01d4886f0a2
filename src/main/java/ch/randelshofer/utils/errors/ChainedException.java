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
 * Default {@link ChainedError}.
 * <p>
 * The stack is captured exactly once, by the constructor, and is also used
 * as the stack trace of this throwable. The JVM does not fill in a second
 * one. {@link #getMessage()} returns the plain message; {@link #toString()}
 * renders the whole chain with {@link Errors#formatDefault(ChainedError)}.
 * <p>
 * Instances are immutable, except for the {@linkplain #setCode(int) code}.
 */
public class ChainedException extends RuntimeException implements ChainedError {

    private static final long serialVersionUID = 1L;

    private final String stack;
    private final String context;
    private int code;

    public ChainedException(String message) {
        this(Errors.DEFAULT_CODE, message, null, 1);
    }

    public ChainedException(int code, String message, Throwable inner) {
        this(code, message, inner, 1);
    }

    /**
     * Creates a new error and captures the current stack.
     *
     * @param code    the error code
     * @param message the message
     * @param inner   the wrapped error, may be null
     * @param skip    the number of frames between this constructor and the
     *                frame that the captured stack starts with, minus one;
     *                0 starts at the direct caller of this constructor
     */
    protected ChainedException(int code, String message, Throwable inner, int skip) {
        super(message, inner);
        if (skip < 0) {
            throw new IllegalArgumentException("skip: " + skip);
        }
        // 0 is StackCapture.capture, 1 is this constructor
        final CapturedStack captured = StackCapture.capture(2 + skip);
        this.stack = captured.stack();
        this.context = captured.context();
        this.code = code;
        setStackTrace(captured.frames().toArray(new StackTraceElement[0]));
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    @Override
    public String message() {
        return getMessage();
    }

    @Override
    public String stack() {
        return stack;
    }

    @Override
    public String context() {
        return context;
    }

    @Override
    public int code() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    @Override
    public Option<Throwable> inner() {
        return Option.of(getCause());
    }

    /**
     * Returns the messages of the whole chain and the stack of the innermost
     * chained error.
     *
     * @see Errors#formatDefault(ChainedError)
     */
    @Override
    public String toString() {
        return Errors.formatDefault(this);
    }
}
