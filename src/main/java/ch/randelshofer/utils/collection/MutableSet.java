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
package ch.randelshofer.utils.collection;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A mutable collection that contains no duplicate elements.
 * <p>
 * Elements are compared with {@link Object#equals(Object)} and
 * {@link Object#hashCode()}. The iteration order is unspecified and may
 * change between calls.
 * <p>
 * The set algebra operations ({@link #union}, {@link #intersect},
 * {@link #subtract}) modify this set in place. The transforms
 * ({@link #copy}, {@link #map}, {@link #filter}) return new sets that do not
 * share storage with this set.
 * <p>
 * Implementations are not thread-safe. Callers that share a set between
 * threads must synchronize access externally.
 *
 * @param <T> the element type
 */
public interface MutableSet<T> extends Iterable<T> {

    /**
     * Returns the number of elements in this set (its cardinality).
     *
     * @return the size
     */
    int size();

    boolean isEmpty();

    boolean contains(Object element);

    /**
     * Returns a list containing all elements of this set. The caller is free
     * to modify the returned list.
     *
     * @return a new list, in unspecified order
     */
    List<T> toList();

    /**
     * Returns a {@link java.util.Set} containing all elements of this set.
     * The caller is free to modify the returned set.
     *
     * @return a new java set
     */
    java.util.Set<T> toJavaSet();

    /**
     * Adds the specified element to this set.
     *
     * @param element an element
     * @return true if this set <em>already</em> contained the element
     */
    boolean add(T element);

    /**
     * Removes the specified element from this set.
     *
     * @param element an element
     * @return true if this set contained the element
     */
    boolean remove(Object element);

    /**
     * Removes all elements from this set.
     */
    void clear();

    /**
     * Adds all elements of {@code other} to this set.
     * Does nothing if {@code other} is null.
     *
     * @param other another set, may be null
     */
    void union(MutableSet<? extends T> other);

    /**
     * Removes all elements from this set that are not in {@code other}.
     * Does nothing if {@code other} is null.
     *
     * @param other another set, may be null
     */
    void intersect(MutableSet<?> other);

    /**
     * Removes all elements from this set that are in {@code other}.
     * Does nothing if {@code other} is null.
     *
     * @param other another set, may be null
     */
    void subtract(MutableSet<?> other);

    /**
     * Returns true if all elements of this set are in {@code other}.
     *
     * @param other another set, may be null
     * @return false if {@code other} is null or smaller than this set
     */
    boolean isSubset(MutableSet<?> other);

    /**
     * Returns true if this set and {@code other} have the same elements.
     *
     * @param other another set, may be null
     * @return false if {@code other} is null or differs in size
     */
    boolean isEqual(MutableSet<?> other);

    /**
     * Creates a new set with the same elements as this set.
     *
     * @return a copy with its own storage
     */
    MutableSet<T> copy();

    /**
     * Invokes {@code action} once for every element, in unspecified order.
     */
    @Override
    void forEach(Consumer<? super T> action);

    /**
     * Creates a new set with the results of applying {@code mapper} to the
     * elements of this set. Results that are equal collapse into one
     * element.
     *
     * @param mapper the mapping function
     * @param <R>    the element type of the new set
     * @return a new set
     */
    <R> MutableSet<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Creates a new set with the elements of this set that satisfy
     * {@code predicate}.
     *
     * @param predicate the predicate
     * @return a new set
     */
    MutableSet<T> filter(Predicate<? super T> predicate);
}
