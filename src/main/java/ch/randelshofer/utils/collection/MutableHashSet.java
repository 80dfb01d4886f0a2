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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collector;

/**
 * Implements a mutable set on top of a {@link HashSet}.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null elements</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>does not guarantee a specific iteration order</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>add: O(1)</li>
 *     <li>remove: O(1)</li>
 *     <li>contains: O(1)</li>
 *     <li>copy: O(N)</li>
 *     <li>union, subtract: O(M), where M is the size of the other set</li>
 *     <li>intersect, isSubset, isEqual: O(N)</li>
 * </ul>
 *
 * @param <T> the element type
 */
public final class MutableHashSet<T> implements MutableSet<T>, Serializable {

    private static final long serialVersionUID = 1L;

    private HashSet<T> elements;

    private MutableHashSet(HashSet<T> elements) {
        this.elements = elements;
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain a {@link MutableHashSet}.
     *
     * @param <T> Component type of the MutableHashSet.
     * @return A MutableHashSet Collector.
     */
    public static <T> Collector<T, ArrayList<T>, MutableHashSet<T>> collector() {
        return Collections.toListAndThen(MutableHashSet::ofAll);
    }

    /**
     * Returns a new, empty set.
     *
     * @param <T> the element type
     * @return a new set
     */
    public static <T> MutableHashSet<T> empty() {
        return new MutableHashSet<>(new HashSet<>());
    }

    /**
     * Creates a set of the given elements. Duplicates collapse.
     *
     * @param elements the elements
     * @param <T>      the element type
     * @return a new set
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <T> MutableHashSet<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return new MutableHashSet<>(new HashSet<>(Arrays.asList(elements)));
    }

    /**
     * Creates a set of the given elements. Duplicates collapse.
     *
     * @param elements the elements
     * @param <T>      the element type
     * @return a new set
     */
    public static <T> MutableHashSet<T> ofAll(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        final MutableHashSet<T> set = empty();
        for (T element : elements) {
            set.elements.add(element);
        }
        return set;
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public boolean contains(Object element) {
        return elements.contains(element);
    }

    @Override
    public List<T> toList() {
        return new ArrayList<>(elements);
    }

    @Override
    public java.util.Set<T> toJavaSet() {
        return new HashSet<>(elements);
    }

    @Override
    public boolean add(T element) {
        return !elements.add(element);
    }

    @Override
    public boolean remove(Object element) {
        return elements.remove(element);
    }

    @Override
    public void clear() {
        elements = new HashSet<>();
    }

    @Override
    public void union(MutableSet<? extends T> other) {
        if (other == null || other == this) {
            return;
        }
        other.forEach(elements::add);
    }

    @Override
    public void intersect(MutableSet<?> other) {
        if (other == null || other == this) {
            return;
        }
        elements.removeIf(e -> !other.contains(e));
    }

    @Override
    public void subtract(MutableSet<?> other) {
        if (other == null) {
            return;
        }
        if (other == this) {
            clear();
            return;
        }
        other.forEach(elements::remove);
    }

    @Override
    public boolean isSubset(MutableSet<?> other) {
        if (other == null || size() > other.size()) {
            return false;
        }
        return containsAllIn(other);
    }

    @Override
    public boolean isEqual(MutableSet<?> other) {
        if (other == null || size() != other.size()) {
            return false;
        }
        return containsAllIn(other);
    }

    private boolean containsAllIn(MutableSet<?> other) {
        for (T element : elements) {
            if (!other.contains(element)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public MutableHashSet<T> copy() {
        return new MutableHashSet<>(new HashSet<>(elements));
    }

    @Override
    public void forEach(Consumer<? super T> action) {
        Objects.requireNonNull(action, "action is null");
        elements.forEach(action);
    }

    @Override
    public <R> MutableHashSet<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        final MutableHashSet<R> result = empty();
        for (T element : elements) {
            result.elements.add(mapper.apply(element));
        }
        return result;
    }

    @Override
    public MutableHashSet<T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        final MutableHashSet<T> result = empty();
        for (T element : elements) {
            if (predicate.test(element)) {
                result.elements.add(element);
            }
        }
        return result;
    }

    /**
     * Returns an iterator over the elements of this set. The iterator
     * supports {@link Iterator#remove()}.
     */
    @Override
    public Iterator<T> iterator() {
        return elements.iterator();
    }

    @Override
    public Spliterator<T> spliterator() {
        return elements.spliterator();
    }

    @Override
    public boolean equals(Object o) {
        return Collections.equals(this, o);
    }

    @Override
    public int hashCode() {
        return Collections.hashUnordered(this);
    }

    @Override
    public String toString() {
        return Collections.mkString("MutableHashSet", this);
    }
}
