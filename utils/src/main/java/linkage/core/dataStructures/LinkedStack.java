/**
 * Copyright 2010 - 2018 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package linkage.core.dataStructures;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Singly-linked stack in which every node has exactly one owner: the stack's top slot or the node above it.
 */
public class LinkedStack<T> implements Iterable<T> {

    @Nullable
    private Node<T> top;

    public boolean isEmpty() {
        return top == null;
    }

    @SuppressWarnings("ConstantConditions")
    public void push(@NotNull final T element) {
        if (element == null) {
            throw new IllegalArgumentException("LinkedStack can't hold null");
        }
        top = new Node<>(element, top);
    }

    @Nullable
    public T pop() {
        final Node<T> node = popNode();
        return node == null ? null : node.element;
    }

    /**
     * Detaches the top node as a whole.
     *
     * @return former top node, no longer linked to the rest of the stack, or {@code null} if the stack is empty
     */
    @Nullable
    public Node<T> popNode() {
        final Node<T> result = top;
        if (result != null) {
            top = result.next;
            result.next = null;
        }
        return result;
    }

    @Nullable
    public T peek() {
        final Node<T> top = this.top;
        return top == null ? null : top.element;
    }

    /**
     * Replaces the top element in place.
     *
     * @return previous top element or {@code null} if the stack is empty, in which case nothing changes
     */
    @Nullable
    public T setPeek(@NotNull final T element) {
        final Node<T> top = this.top;
        if (top == null) {
            return null;
        }
        final T result = top.element;
        top.setElement(element);
        return result;
    }

    /**
     * Iterates from top to bottom without consuming the stack.
     */
    @NotNull
    @Override
    public Iterator<T> iterator() {
        return new NodeIterator<>(top);
    }

    /**
     * Iterates from top to bottom allowing to replace elements in place.
     */
    @NotNull
    public MutatingIterator<T> mutatingIterator() {
        return new MutatingNodeIterator<>(top);
    }

    /**
     * Iterator popping the elements of this stack. The stack shrinks as the iterator advances.
     */
    @NotNull
    public Iterator<T> intoIter() {
        return new Iterator<T>() {
            @Override
            public boolean hasNext() {
                return !isEmpty();
            }

            @Override
            public T next() {
                final T result = pop();
                if (result == null) {
                    throw new NoSuchElementException();
                }
                return result;
            }
        };
    }

    /**
     * Unlinks nodes one by one starting from the top.
     */
    public void clear() {
        Node<T> node = top;
        top = null;
        while (node != null) {
            final Node<T> next = node.next;
            node.next = null;
            node = next;
        }
    }

    public interface MutatingIterator<T> extends Iterator<T> {

        /**
         * Replaces the element last returned by {@link #next()}.
         */
        void set(@NotNull T element);
    }

    public static final class Node<T> {

        @NotNull
        private T element;
        @Nullable
        private Node<T> next;

        private Node(@NotNull final T element, @Nullable final Node<T> next) {
            this.element = element;
            this.next = next;
        }

        @NotNull
        public T getElement() {
            return element;
        }

        @SuppressWarnings("ConstantConditions")
        private void setElement(@NotNull final T element) {
            if (element == null) {
                throw new IllegalArgumentException("LinkedStack can't hold null");
            }
            this.element = element;
        }
    }

    private static class NodeIterator<T> implements Iterator<T> {

        @Nullable
        private Node<T> next;
        @Nullable
        Node<T> last;

        NodeIterator(@Nullable final Node<T> top) {
            next = top;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            final Node<T> result = next;
            if (result == null) {
                throw new NoSuchElementException();
            }
            next = result.next;
            last = result;
            return result.element;
        }
    }

    private static final class MutatingNodeIterator<T> extends NodeIterator<T> implements MutatingIterator<T> {

        private MutatingNodeIterator(@Nullable final Node<T> top) {
            super(top);
        }

        @Override
        public void set(@NotNull final T element) {
            final Node<T> last = this.last;
            if (last == null) {
                throw new IllegalStateException("next() wasn't called");
            }
            last.setElement(element);
        }
    }
}
