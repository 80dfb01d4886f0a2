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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

public abstract class AbstractMutableSetTest {

    abstract protected <T> MutableSet<T> empty();

    @SuppressWarnings("unchecked")
    abstract protected <T> MutableSet<T> of(T... elements);

    // -- construction

    @Test
    public void shouldContainInitialElements() {
        final MutableSet<Integer> set = of(1, 2, 3);
        assertThat(set.size()).isEqualTo(3);
        assertThat(set.contains(1)).isTrue();
        assertThat(set.contains(2)).isTrue();
        assertThat(set.contains(3)).isTrue();
        assertThat(set.contains(4)).isFalse();
        assertThat(set.isEmpty()).isFalse();
    }

    @Test
    public void shouldCollapseDuplicates() {
        assertThat(of(1, 1, 2, 2, 2).size()).isEqualTo(2);
    }

    @Test
    public void shouldBeEmpty() {
        final MutableSet<Integer> set = empty();
        assertThat(set.isEmpty()).isTrue();
        assertThat(set.size()).isZero();
        assertThat(set.contains(1)).isFalse();
    }

    // -- toList

    @Test
    public void shouldReturnIndependentList() {
        final MutableSet<Integer> set = of(1, 2, 3);
        final List<Integer> list = set.toList();
        assertThat(list).containsExactlyInAnyOrder(1, 2, 3);
        list.add(4);
        assertThat(set.contains(4)).isFalse();
        assertThat(empty().toList()).isEmpty();
    }

    @Test
    public void shouldReturnIndependentJavaSet() {
        final MutableSet<Integer> set = of(1, 2);
        final java.util.Set<Integer> javaSet = set.toJavaSet();
        javaSet.remove(1);
        assertThat(set.contains(1)).isTrue();
    }

    // -- add

    @Test
    public void shouldTellWhetherElementWasAlreadyPresent() {
        final MutableSet<Integer> set = empty();
        assertThat(set.add(1)).isFalse();
        assertThat(set.size()).isEqualTo(1);
        assertThat(set.contains(1)).isTrue();
        assertThat(set.add(1)).isTrue();
        assertThat(set.size()).isEqualTo(1);
    }

    @Test
    public void shouldAddNull() {
        final MutableSet<Integer> set = of(1);
        assertThat(set.add(null)).isFalse();
        assertThat(set.contains(null)).isTrue();
        assertThat(set.add(null)).isTrue();
    }

    // -- remove

    @Test
    public void shouldRemoveElement() {
        final MutableSet<Integer> set = of(1, 2, 3);
        assertThat(set.remove(2)).isTrue();
        assertThat(set.contains(2)).isFalse();
        assertThat(set.remove(2)).isFalse();
        assertThat(set.remove(5)).isFalse();
        assertThat(set.size()).isEqualTo(2);
    }

    // -- clear

    @Test
    public void shouldClear() {
        final MutableSet<Integer> set = of(1, 2, 3);
        set.clear();
        assertThat(set.isEmpty()).isTrue();
        assertThat(set.add(1)).isFalse();
    }

    // -- union

    @Test
    public void shouldCalculateUnion() {
        final MutableSet<Integer> set = of(1, 2, 3);
        set.union(of(2, 3, 4));
        assertThat(set.size()).isEqualTo(4);
        assertThat(set.toList()).containsExactlyInAnyOrder(1, 2, 3, 4);
    }

    @Test
    public void shouldContainOtherAfterUnion() {
        final MutableSet<Integer> set = of(1, 5);
        final MutableSet<Integer> other = of(2, 5, 9);
        set.union(other);
        assertThat(other.isSubset(set)).isTrue();
        assertThat(set.isSubset(set)).isTrue();
    }

    @Test
    public void shouldIgnoreNullInUnion() {
        final MutableSet<Integer> set = of(1, 2);
        set.union(null);
        assertThat(set.isEqual(of(1, 2))).isTrue();
    }

    @Test
    public void shouldUnionWithItself() {
        final MutableSet<Integer> set = of(1, 2);
        set.union(set);
        assertThat(set.isEqual(of(1, 2))).isTrue();
    }

    // -- intersect

    @Test
    public void shouldCalculateIntersect() {
        final MutableSet<Integer> set = of(1, 2, 3);
        set.intersect(of(2, 3, 4));
        assertThat(set.toList()).containsExactlyInAnyOrder(2, 3);

        final MutableSet<Integer> disjoint = of(1, 2, 3);
        disjoint.intersect(of(5));
        assertThat(disjoint.isEmpty()).isTrue();
    }

    @Test
    public void shouldBeSubsetOfBothAfterIntersect() {
        final MutableSet<Integer> original = of(1, 2, 3, 7, 8);
        final MutableSet<Integer> other = of(2, 3, 4, 8, 10);
        final MutableSet<Integer> set = original.copy();
        set.intersect(other);
        assertThat(set.isSubset(original)).isTrue();
        assertThat(set.isSubset(other)).isTrue();
    }

    @Test
    public void shouldIgnoreNullInIntersect() {
        final MutableSet<Integer> set = of(1, 2);
        set.intersect(null);
        assertThat(set.isEqual(of(1, 2))).isTrue();
    }

    // -- subtract

    @Test
    public void shouldSubtract() {
        final MutableSet<Integer> set = of(1, 2, 3);
        set.subtract(of(2, 3, 4));
        assertThat(set.toList()).containsExactly(1);
    }

    @Test
    public void shouldIgnoreNullInSubtract() {
        final MutableSet<Integer> set = of(1, 2);
        set.subtract(null);
        assertThat(set.isEqual(of(1, 2))).isTrue();
    }

    @Test
    public void shouldBeEmptyAfterSubtractingItself() {
        final MutableSet<Integer> set = of(1, 2);
        set.subtract(set);
        assertThat(set.isEmpty()).isTrue();
    }

    // -- isSubset

    @Test
    public void shouldTellIfSubset() {
        assertThat(of(1, 2).isSubset(of(1, 2, 3))).isTrue();
        assertThat(of(1, 2, 3).isSubset(of(1, 2, 3))).isTrue();
        assertThat(of(1, 2, 3).isSubset(of(1, 2))).isFalse();
        assertThat(of(1, 4).isSubset(of(1, 2, 3))).isFalse();
        assertThat(empty().isSubset(of(1))).isTrue();
        assertThat(of(1).isSubset(null)).isFalse();
    }

    // -- isEqual

    @Test
    public void shouldTellIfEqual() {
        final MutableSet<Integer> a = of(1, 2, 3);
        final MutableSet<Integer> b = of(3, 2, 1);
        assertThat(a.isEqual(a)).isTrue();
        assertThat(a.isEqual(b)).isTrue();
        assertThat(b.isEqual(a)).isTrue();
        assertThat(a.isEqual(of(1, 2))).isFalse();
        assertThat(a.isEqual(of(1, 2, 4))).isFalse();
        assertThat(a.isEqual(null)).isFalse();
    }

    @Test
    public void shouldObeyEqualityConstraints() {
        assertThat(of(1, 2, 3)).isEqualTo(of(3, 1, 2));
        assertThat(of(1, 2, 3).hashCode()).isEqualTo(of(3, 1, 2).hashCode());
        assertThat(of(1, 2, 3)).isNotEqualTo(of(1, 2));
        assertThat(of(1, 2, 3)).isNotEqualTo(Arrays.asList(1, 2, 3));
    }

    // -- copy

    @Test
    public void shouldCopyIntoIndependentSet() {
        final MutableSet<Integer> set = of(1, 2, 3);
        final MutableSet<Integer> copy = set.copy();
        assertThat(copy.isEqual(set)).isTrue();
        copy.add(4);
        set.remove(1);
        assertThat(set.contains(4)).isFalse();
        assertThat(copy.contains(1)).isTrue();
    }

    // -- forEach

    @Test
    public void shouldVisitEveryElementOnce() {
        final List<Integer> visited = new ArrayList<>();
        of(1, 2, 3).forEach(visited::add);
        assertThat(visited).containsExactlyInAnyOrder(1, 2, 3);
    }

    @Test
    public void shouldRemoveThroughIterator() {
        final MutableSet<Integer> set = of(1, 2, 3);
        for (Iterator<Integer> it = set.iterator(); it.hasNext(); ) {
            if (it.next() == 2) {
                it.remove();
            }
        }
        assertThat(set.isEqual(of(1, 3))).isTrue();
    }

    // -- map

    @Test
    public void shouldMapIntoNewSet() {
        final MutableSet<Integer> set = of(1, 2, 3);
        final MutableSet<String> mapped = set.map(i -> "#" + i);
        assertThat(mapped.toList()).containsExactlyInAnyOrder("#1", "#2", "#3");
        assertThat(set.size()).isEqualTo(3);
    }

    @Test
    public void shouldMapDistinctElementsToOneElement() {
        assertThat(of(1, 2, 3).map(i -> 0).isEqual(of(0))).isTrue();
    }

    // -- filter

    @Test
    public void shouldFilterIntoNewSet() {
        final Predicate<Integer> isEven = i -> i % 2 == 0;
        final MutableSet<Integer> set = of(1, 2, 3, 4);
        final MutableSet<Integer> filtered = set.filter(isEven);
        assertThat(filtered.toList()).containsExactlyInAnyOrder(2, 4);
        filtered.add(6);
        assertThat(set.contains(6)).isFalse();
        assertThat(set.filter(i -> i > 10).isEmpty()).isTrue();
    }
}
