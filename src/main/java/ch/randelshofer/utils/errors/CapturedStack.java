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

import java.util.List;

/**
 * A snapshot of a thread's call stack, taken by {@link StackCapture}.
 * <p>
 * The snapshot is split in two parts: the {@linkplain #stack() stack}
 * proper, which starts with a header line naming the thread, and the
 * {@linkplain #context() context}, which holds the frames beyond the
 * configured maximum depth.
 */
public final class CapturedStack {

    private final List<StackTraceElement> frames;
    private final String stack;
    private final String context;

    CapturedStack(List<StackTraceElement> frames, String stack, String context) {
        this.frames = frames;
        this.stack = stack;
        this.context = context;
    }

    /**
     * Returns all captured frames, innermost first, including the frames
     * that were moved to the context.
     *
     * @return an unmodifiable list of frames
     */
    public List<StackTraceElement> frames() {
        return frames;
    }

    public String stack() {
        return stack;
    }

    /**
     * Returns the frames beyond the maximum depth, one {@code "\tat "} line
     * per frame, or the empty string if the stack was not truncated.
     *
     * @return the context text
     */
    public String context() {
        return context;
    }

    @Override
    public String toString() {
        return context.isEmpty() ? stack : stack + "\n" + context;
    }
}
