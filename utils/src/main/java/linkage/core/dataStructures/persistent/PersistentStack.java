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
package linkage.core.dataStructures.persistent;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Immutable singly-linked list. {@link #prepend(Object)} shares the whole receiver as the tail of the
 * result, so any number of stacks may share a common suffix.
 */
public class PersistentStack<T> implements Iterable<T> {

    @SuppressWarnings({"RawUseOfParameterizedType", "rawtypes"})
    public static final PersistentStack EMPTY_STACK = new PersistentStack();

    private final T head;
    private final int size;
    private final PersistentStack<T> tail;

    private PersistentStack() {
        head = null;
        size = 0;
        tail = null;
    }

    private PersistentStack(@NotNull T head, @NotNull PersistentStack<T> tail) {
        this.head = head;
        size = tail.size + 1;
        this.tail = tail;
    }

    @SuppressWarnings("unchecked")
    public static <T> PersistentStack<T> emptyStack() {
        return EMPTY_STACK;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    @SuppressWarnings("ConstantConditions")
    public PersistentStack<T> prepend(@NotNull T e) {
        if (e == null) {
            throw new IllegalArgumentException("PersistentStack can't hold null");
        }
        return new PersistentStack<>(e, this);
    }

    /**
     * @return first element or {@code null} if the stack is empty
     */
    @Nullable
    public T head() {
        return head;
    }

    /**
     * @return stack without its first element, the empty stack is its own tail
     */
    public PersistentStack<T> tail() {
        return isEmpty() ? this : tail;
    }

    public PersistentStack<T> reverse() {
        PersistentStack<T> result = emptyStack();
        for (PersistentStack<T> stack = this; !stack.isEmpty(); stack = stack.tail) {
            //noinspection ObjectAllocationInLoop
            result = new PersistentStack<>(stack.head, result);
        }
        return result;
    }

    @NotNull
    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private PersistentStack<T> current = PersistentStack.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public T next() {
                if (current.isEmpty()) {
                    throw new NoSuchElementException();
                }
                final T result = current.head;
                current = current.tail;
                return result;
            }
        };
    }

    @Override
    public int hashCode() {
        int result = 271828182;
        for (PersistentStack<T> stack = this; !stack.isEmpty(); stack = stack.tail) {
            result = result * 31 + stack.head.hashCode();
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PersistentStack)) {
            return false;
        }
        PersistentStack<?> left = this;
        PersistentStack<?> right = (PersistentStack<?>) obj;
        if (left.size != right.size) {
            return false;
        }
        // suffixes shared by both stacks are equal by identity
        while (left != right) {
            if (!left.head.equals(right.head)) {
                return false;
            }
            left = left.tail;
            right = right.tail;
        }
        return true;
    }
}
