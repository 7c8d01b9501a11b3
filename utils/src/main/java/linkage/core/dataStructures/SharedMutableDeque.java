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

import linkage.LinkageConfig;
import linkage.LinkageException;
import linkage.core.dataStructures.cell.CellTracker;
import linkage.core.dataStructures.cell.RcCell;
import linkage.core.dataStructures.cell.Ref;
import linkage.core.dataStructures.cell.RefMut;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;

/**
 * Doubly-linked deque whose nodes are jointly owned by reference counting. Each node lives in its own
 * {@linkplain RcCell}, and every link ({@code head}, {@code tail}, {@code next}, {@code prev}) holds one
 * unit of the strong count of the node it designates. Node contents are read and written only under
 * runtime-checked borrows.
 *
 * <p>Adjacent nodes own each other, so the chain is a reference cycle. {@link #close()} breaks it by
 * detaching nodes one by one from the front until every node is released.
 *
 * <p>Peek guards borrow the endpoint node. While a caller holds one, an operation that needs to borrow
 * the same node throws {@linkplain linkage.core.dataStructures.cell.BorrowException} and leaves the deque
 * unchanged:
 * <pre>
 *     try (RefMut&lt;Integer&gt; front = deque.peekFrontMut()) {
 *         front.set(front.get() + 1);
 *     }
 * </pre>
 *
 * <p>Not thread-safe.
 */
public class SharedMutableDeque<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SharedMutableDeque.class);

    private static final LinkageConfig SYSTEM_CONFIG = new LinkageConfig().setMutable(false);

    @NotNull
    private final CellTracker tracker;
    private final boolean debugBorrows;
    private final boolean checkInvariants;
    private final int teardownLogThreshold;
    @Nullable
    private RcCell<Node<T>> head;
    @Nullable
    private RcCell<Node<T>> tail;

    public SharedMutableDeque() {
        this(SYSTEM_CONFIG);
    }

    public SharedMutableDeque(@NotNull final LinkageConfig config) {
        this(config, CellTracker.NONE);
    }

    public SharedMutableDeque(@NotNull final LinkageConfig config, @NotNull final CellTracker tracker) {
        this.tracker = tracker;
        debugBorrows = config.isDebugBorrows();
        checkInvariants = config.isCheckInvariants();
        teardownLogThreshold = config.getTeardownLogThreshold();
    }

    // takes over the nodes of source, leaving it empty
    private SharedMutableDeque(@NotNull final SharedMutableDeque<T> source) {
        tracker = source.tracker;
        debugBorrows = source.debugBorrows;
        checkInvariants = source.checkInvariants;
        teardownLogThreshold = source.teardownLogThreshold;
        head = source.head;
        tail = source.tail;
        source.head = null;
        source.tail = null;
    }

    public boolean isEmpty() {
        return head == null;
    }

    public void pushFront(@NotNull final T element) {
        final RcCell<Node<T>> oldHead = head;
        if (oldHead == null) {
            final RcCell<Node<T>> node = newNode(element, null, null);
            tail = node.share();
            head = node;
        } else {
            try (RefMut<Node<T>> old = oldHead.borrowMut()) {
                // the new node takes over the head slot's ownership of the old head
                final RcCell<Node<T>> newHead = newNode(element, oldHead, null);
                old.get().prev = newHead.share();
                head = newHead;
            }
        }
        afterMutation();
    }

    public void pushBack(@NotNull final T element) {
        final RcCell<Node<T>> oldTail = tail;
        if (oldTail == null) {
            final RcCell<Node<T>> node = newNode(element, null, null);
            head = node.share();
            tail = node;
        } else {
            try (RefMut<Node<T>> old = oldTail.borrowMut()) {
                final RcCell<Node<T>> newTail = newNode(element, null, oldTail);
                old.get().next = newTail.share();
                tail = newTail;
            }
        }
        afterMutation();
    }

    /**
     * @return front element or {@code null} if the deque is empty
     * @throws linkage.core.dataStructures.cell.BorrowException the front node or its successor is borrowed
     */
    @Nullable
    public T popFront() {
        final RcCell<Node<T>> oldHead = head;
        if (oldHead == null) {
            return null;
        }
        try (RefMut<Node<T>> old = oldHead.borrowMut()) {
            final RcCell<Node<T>> next = old.get().next;
            if (next == null) {
                releaseLink(tail);
                tail = null;
            } else {
                try (RefMut<Node<T>> following = next.borrowMut()) {
                    releaseLink(following.get().prev);
                    following.get().prev = null;
                }
                old.get().next = null;
            }
            // the head slot passes ownership of the old head to this method
            head = next;
        }
        final T result = oldHead.tryUnwrap().element;
        afterMutation();
        return result;
    }

    /**
     * @return back element or {@code null} if the deque is empty
     * @throws linkage.core.dataStructures.cell.BorrowException the back node or its predecessor is borrowed
     */
    @Nullable
    public T popBack() {
        final RcCell<Node<T>> oldTail = tail;
        if (oldTail == null) {
            return null;
        }
        try (RefMut<Node<T>> old = oldTail.borrowMut()) {
            final RcCell<Node<T>> prev = old.get().prev;
            if (prev == null) {
                releaseLink(head);
                head = null;
            } else {
                try (RefMut<Node<T>> preceding = prev.borrowMut()) {
                    releaseLink(preceding.get().next);
                    preceding.get().next = null;
                }
                old.get().prev = null;
            }
            tail = prev;
        }
        final T result = oldTail.tryUnwrap().element;
        afterMutation();
        return result;
    }

    /**
     * @return shared borrow of the front element or {@code null} if the deque is empty
     */
    @Nullable
    public Ref<T> peekFront() {
        final RcCell<Node<T>> head = this.head;
        return head == null ? null : head.borrow().map(Node::getElement);
    }

    @Nullable
    public Ref<T> peekBack() {
        final RcCell<Node<T>> tail = this.tail;
        return tail == null ? null : tail.borrow().map(Node::getElement);
    }

    /**
     * @return exclusive borrow of the front element or {@code null} if the deque is empty
     */
    @Nullable
    public RefMut<T> peekFrontMut() {
        final RcCell<Node<T>> head = this.head;
        return head == null ? null : head.borrowMut().map(Node::getElement, Node::setElement);
    }

    @Nullable
    public RefMut<T> peekBackMut() {
        final RcCell<Node<T>> tail = this.tail;
        return tail == null ? null : tail.borrowMut().map(Node::getElement, Node::setElement);
    }

    /**
     * Moves the contents of this deque into a consuming iterator. This deque becomes empty.
     */
    public IntoIter<T> intoIter() {
        return new IntoIter<>(new SharedMutableDeque<>(this));
    }

    /**
     * Detaches and releases all nodes starting from the front.
     */
    public void clear() {
        int released = 0;
        while (popFront() != null) {
            ++released;
        }
        if (released >= teardownLogThreshold && logger.isDebugEnabled()) {
            logger.debug("SharedMutableDeque released " + released + " nodes on teardown");
        }
    }

    @Override
    public void close() {
        clear();
    }

    /**
     * Walks the deque from head to tail and back, checking that the links of adjacent nodes designate
     * each other and that endpoints have no outer links.
     */
    @Nullable
    RcCell<Node<T>> getHead() {
        return head;
    }

    boolean isConsistent() {
        final RcCell<Node<T>> head = this.head;
        final RcCell<Node<T>> tail = this.tail;
        if (head == null || tail == null) {
            if (head != tail) {
                return inconsistent("only one of head and tail is present");
            }
            return true;
        }
        int forward = 0;
        RcCell<Node<T>> prev = null;
        RcCell<Node<T>> current = head;
        while (current != null) {
            final RcCell<Node<T>> next;
            try (Ref<Node<T>> node = current.borrow()) {
                if (node.get().prev != prev) {
                    return inconsistent("prev link of node #" + forward + " doesn't designate its predecessor");
                }
                next = node.get().next;
            }
            prev = current;
            current = next;
            ++forward;
        }
        if (prev != tail) {
            return inconsistent("tail isn't the last node reachable from head");
        }
        int backward = 0;
        RcCell<Node<T>> following = null;
        current = tail;
        while (current != null) {
            if (++backward > forward) {
                return inconsistent("walk from tail is longer than walk from head");
            }
            final RcCell<Node<T>> preceding;
            try (Ref<Node<T>> node = current.borrow()) {
                if (node.get().next != following) {
                    return inconsistent("next link of node #" + (forward - backward) + " doesn't designate its successor");
                }
                preceding = node.get().prev;
            }
            following = current;
            current = preceding;
        }
        if (following != head || backward != forward) {
            return inconsistent("walk from tail doesn't end at head");
        }
        return true;
    }

    private RcCell<Node<T>> newNode(@NotNull final T element,
                                    @Nullable final RcCell<Node<T>> next,
                                    @Nullable final RcCell<Node<T>> prev) {
        return RcCell.allocate(new Node<>(element, next, prev), tracker, debugBorrows);
    }

    private void afterMutation() {
        if (checkInvariants) {
            final RcCell<Node<T>> head = this.head;
            final RcCell<Node<T>> tail = this.tail;
            // a caller's exclusive peek guard keeps the endpoint unreadable
            if ((head != null && head.isBorrowedMut()) || (tail != null && tail.isBorrowedMut())) {
                return;
            }
            if (!isConsistent()) {
                throw new LinkageException("SharedMutableDeque is inconsistent");
            }
        }
    }

    private static boolean inconsistent(@NotNull final String message) {
        logger.error("SharedMutableDeque is inconsistent: " + message, new Throwable());
        return false;
    }

    private static void releaseLink(@Nullable final RcCell<?> link) {
        if (link == null) {
            throw new LinkageException("SharedMutableDeque is inconsistent: missing reciprocal link");
        }
        link.release();
    }

    static final class Node<T> {

        @NotNull
        private T element;
        @Nullable
        RcCell<Node<T>> next;
        @Nullable
        RcCell<Node<T>> prev;

        private Node(@NotNull final T element, @Nullable final RcCell<Node<T>> next, @Nullable final RcCell<Node<T>> prev) {
            setElement(element);
            this.next = next;
            this.prev = prev;
        }

        @NotNull
        private T getElement() {
            return element;
        }

        @SuppressWarnings("ConstantConditions")
        private void setElement(@NotNull final T element) {
            if (element == null) {
                throw new IllegalArgumentException("SharedMutableDeque can't hold null");
            }
            this.element = element;
        }
    }

    /**
     * Consuming iterator over a deque. {@link #next()} pops the front, {@link #nextBack()} pops the back,
     * so both ends stop together once the deque runs empty.
     */
    public static final class IntoIter<T> implements DoubleEndedIterator<T>, AutoCloseable {

        @NotNull
        private final SharedMutableDeque<T> deque;

        private IntoIter(@NotNull final SharedMutableDeque<T> deque) {
            this.deque = deque;
        }

        @Override
        public boolean hasNext() {
            return !deque.isEmpty();
        }

        @Override
        public T next() {
            final T result = deque.popFront();
            if (result == null) {
                throw new NoSuchElementException();
            }
            return result;
        }

        @Override
        public boolean hasNextBack() {
            return !deque.isEmpty();
        }

        @Override
        public T nextBack() {
            final T result = deque.popBack();
            if (result == null) {
                throw new NoSuchElementException();
            }
            return result;
        }

        @Override
        public void close() {
            deque.close();
        }
    }
}
