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
package ch.randelshofer.utils.seq;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Higher-order operations over indexable sequences.
 * <p>
 * All operations visit the elements with a single pass of the list's
 * iterator, in forward order unless the operation name says otherwise
 * ({@code lastIndexOf}, {@code findLast}), so they run in linear time on
 * linked lists as well as on array-backed lists.
 * Operations that return a sequence always return a new, modifiable
 * {@link ArrayList}; the argument is never modified.
 * <p>
 * Passing {@code null} as sequence or function is a programming error and
 * throws {@link NullPointerException}.
 */
public final class Sequences {

    private Sequences() {
    }

    /**
     * Creates a linked list of the given elements, in order.
     *
     * @param elements the elements
     * @param <T>      the element type
     * @return a new linked list
     */
    @SafeVarargs
    public static <T> LinkedList<T> asLinkedList(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return new LinkedList<>(Arrays.asList(elements));
    }

    /**
     * Copies the elements of an indexable sequence into a linked list,
     * preserving order.
     *
     * @param seq a sequence
     * @param <T> the element type
     * @return a new linked list
     */
    public static <T> LinkedList<T> toLinkedList(List<? extends T> seq) {
        Objects.requireNonNull(seq, "seq is null");
        final LinkedList<T> result = new LinkedList<>();
        for (T element : seq) {
            result.addLast(element);
        }
        return result;
    }

    /**
     * Copies the elements of an array into a linked list, preserving order.
     *
     * @param array an array
     * @param <T>   the element type
     * @return a new linked list
     */
    public static <T> LinkedList<T> toLinkedList(T[] array) {
        Objects.requireNonNull(array, "array is null");
        return toLinkedList(Arrays.asList(array));
    }

    /**
     * Copies a linked list into an indexable sequence, in forward iteration
     * order.
     *
     * @param list a linked list, may be null
     * @param <T>  the element type
     * @return a new list, empty if {@code list} is null or empty
     */
    public static <T> List<T> fromLinkedList(Deque<? extends T> list) {
        if (list == null || list.isEmpty()) {
            return new ArrayList<>(0);
        }
        final List<T> result = new ArrayList<>(list.size());
        for (T element : list) {
            result.add(element);
        }
        return result;
    }

    public static <T> void forEach(List<? extends T> seq, Consumer<? super T> action) {
        Objects.requireNonNull(seq, "seq is null");
        Objects.requireNonNull(action, "action is null");
        for (T element : seq) {
            action.accept(element);
        }
    }

    /**
     * Applies {@code mapper} to every element.
     *
     * @param seq    a sequence
     * @param mapper the mapping function
     * @param <T>    the element type
     * @param <R>    the result element type
     * @return a list of the same length, {@code result[i] = mapper(seq[i])}
     */
    public static <T, R> List<R> map(List<? extends T> seq, Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(seq, "seq is null");
        Objects.requireNonNull(mapper, "mapper is null");
        final List<R> result = new ArrayList<>(seq.size());
        for (T element : seq) {
            result.add(mapper.apply(element));
        }
        return result;
    }

    public static <T> boolean exists(List<? extends T> seq, Predicate<? super T> predicate) {
        return indexOf(seq, predicate) >= 0;
    }

    /**
     * Returns the elements that satisfy {@code predicate}, in their original
     * order.
     *
     * @param seq       a sequence
     * @param predicate the predicate
     * @param <T>       the element type
     * @return the matching elements, an empty list if none match
     */
    public static <T> List<T> filter(List<? extends T> seq, Predicate<? super T> predicate) {
        Objects.requireNonNull(seq, "seq is null");
        Objects.requireNonNull(predicate, "predicate is null");
        final List<T> result = new ArrayList<>();
        for (T element : seq) {
            if (predicate.test(element)) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * Splits a sequence into the elements that satisfy {@code predicate} and
     * those that don't, in a single pass. Both lists keep the original order.
     *
     * @param seq       a sequence
     * @param predicate the predicate
     * @param <T>       the element type
     * @return a tuple of (matching, non-matching) elements
     */
    public static <T> Tuple2<List<T>, List<T>> partition(List<? extends T> seq, Predicate<? super T> predicate) {
        Objects.requireNonNull(seq, "seq is null");
        Objects.requireNonNull(predicate, "predicate is null");
        final List<T> accepted = new ArrayList<>();
        final List<T> rejected = new ArrayList<>();
        for (T element : seq) {
            (predicate.test(element) ? accepted : rejected).add(element);
        }
        return Tuple.of(accepted, rejected);
    }

    /**
     * Returns the index of the first element that satisfies
     * {@code predicate}.
     *
     * @param seq       a sequence
     * @param predicate the predicate
     * @param <T>       the element type
     * @return the index, or -1 if no element matches
     */
    public static <T> int indexOf(List<? extends T> seq, Predicate<? super T> predicate) {
        Objects.requireNonNull(seq, "seq is null");
        Objects.requireNonNull(predicate, "predicate is null");
        for (ListIterator<? extends T> it = seq.listIterator(); it.hasNext(); ) {
            if (predicate.test(it.next())) {
                return it.previousIndex();
            }
        }
        return -1;
    }

    /**
     * Returns the index of the last element that satisfies
     * {@code predicate}. The scan runs backwards and includes index 0.
     *
     * @param seq       a sequence
     * @param predicate the predicate
     * @param <T>       the element type
     * @return the index, or -1 if no element matches
     */
    public static <T> int lastIndexOf(List<? extends T> seq, Predicate<? super T> predicate) {
        Objects.requireNonNull(seq, "seq is null");
        Objects.requireNonNull(predicate, "predicate is null");
        for (ListIterator<? extends T> it = seq.listIterator(seq.size()); it.hasPrevious(); ) {
            if (predicate.test(it.previous())) {
                return it.nextIndex();
            }
        }
        return -1;
    }

    /**
     * Finds the first element that satisfies {@code predicate}.
     * <p>
     * A matching {@code null} element is returned as {@code Some(null)}.
     *
     * @param seq       a sequence
     * @param predicate the predicate
     * @param <T>       the element type
     * @return the element, or {@code None} if no element matches
     */
    public static <T> Option<T> find(List<? extends T> seq, Predicate<? super T> predicate) {
        Objects.requireNonNull(seq, "seq is null");
        Objects.requireNonNull(predicate, "predicate is null");
        for (T element : seq) {
            if (predicate.test(element)) {
                return Option.some(element);
            }
        }
        return Option.none();
    }

    /**
     * Finds the last element that satisfies {@code predicate}.
     *
     * @param seq       a sequence
     * @param predicate the predicate
     * @param <T>       the element type
     * @return the element, or {@code None} if no element matches
     * @see #lastIndexOf(List, Predicate)
     */
    public static <T> Option<T> findLast(List<? extends T> seq, Predicate<? super T> predicate) {
        Objects.requireNonNull(seq, "seq is null");
        Objects.requireNonNull(predicate, "predicate is null");
        for (ListIterator<? extends T> it = seq.listIterator(seq.size()); it.hasPrevious(); ) {
            final T element = it.previous();
            if (predicate.test(element)) {
                return Option.some(element);
            }
        }
        return Option.none();
    }
}
