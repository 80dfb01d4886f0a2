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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Captures the call stack of the current thread as text.
 * <p>
 * The number of frames kept in {@link CapturedStack#stack()} is limited by
 * the system property {@value #MAX_DEPTH_PROPERTY} (default
 * {@value #DEFAULT_MAX_DEPTH}). The property is read once, when this class
 * is initialized.
 */
public final class StackCapture {

    private static final Logger LOG = LoggerFactory.getLogger(StackCapture.class);

    public static final String MAX_DEPTH_PROPERTY = "ch.randelshofer.utils.errors.maxStackDepth";
    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final int MAX_DEPTH = maxDepthFromProperty();
    private static final StackWalker WALKER = StackWalker.getInstance();

    private StackCapture() {
    }

    /**
     * Captures the stack of the current thread.
     * <p>
     * Frame 0 is the invocation of this method, frame 1 its caller, and so
     * on. {@code capture(1)} therefore starts the stack at the method that
     * calls {@code capture}.
     *
     * @param skip the number of innermost frames to leave out
     * @return the captured stack
     * @throws IllegalArgumentException if {@code skip} is negative
     */
    public static CapturedStack capture(int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip: " + skip);
        }
        // 0 is the overload below
        return capture(skip + 1, MAX_DEPTH);
    }

    /**
     * Captures the stack of the current thread, keeping at most
     * {@code maxDepth} frames in {@link CapturedStack#stack()}. Frames are
     * numbered as in {@link #capture(int)}: frame 0 is this method.
     */
    static CapturedStack capture(int skip, int maxDepth) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip: " + skip);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth: " + maxDepth);
        }
        // frame 0 of the walk is this method
        final List<StackTraceElement> frames = WALKER.walk(s -> s.skip(skip)
                .map(StackWalker.StackFrame::toStackTraceElement)
                .collect(Collectors.toList()));
        final int depth = Math.min(frames.size(), maxDepth);

        final StringBuilder stack = new StringBuilder()
                .append("Thread \"").append(Thread.currentThread().getName()).append("\":");
        for (StackTraceElement frame : frames.subList(0, depth)) {
            stack.append("\n\tat ").append(frame);
        }
        final String context = frames.subList(depth, frames.size()).stream()
                .map(frame -> "\tat " + frame)
                .collect(Collectors.joining("\n"));

        LOG.trace("Captured {} frames, {} moved to context", frames.size(), frames.size() - depth);
        return new CapturedStack(Collections.unmodifiableList(frames), stack.toString(), context);
    }

    private static int maxDepthFromProperty() {
        final int value = Integer.getInteger(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH);
        if (value < 1) {
            LOG.warn("Ignoring {}={}, using {}", MAX_DEPTH_PROPERTY, value, DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
        return value;
    }
}
