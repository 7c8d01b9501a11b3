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
package linkage.core.dataStructures.cell;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single allocation shared by several owners, with contents guarded by borrows checked at runtime.
 *
 * <p>The strong count is the number of owning links designating the cell. {@link #share()} registers one
 * more owner, {@link #release()} drops one. The value is dropped and the cell is reported to its
 * {@linkplain CellTracker} once the count reaches zero; any later access throws {@linkplain OwnershipException}.
 *
 * <p>At any instant the contents are either free, under any number of shared borrows ({@link #borrow()}),
 * or under exactly one exclusive borrow ({@link #borrowMut()}). A conflicting borrow throws
 * {@linkplain BorrowException} rather than waiting. Borrow guards are meant for try-with-resources:
 * <pre>
 *     try (RefMut&lt;Node&gt; node = cell.borrowMut()) {
 *         node.get().next = null;
 *     }
 * </pre>
 *
 * <p>Counts and borrow state are plain fields: a cell must not be shared between threads.
 */
public final class RcCell<T> {

    private static final Logger logger = LoggerFactory.getLogger(RcCell.class);

    private static final int UNUSED = 0;
    private static final int WRITING = -1;

    @NotNull
    private final CellTracker tracker;
    private final boolean debugBorrows;
    private T value;
    private int strongCount;
    // WRITING, UNUSED or the number of shared borrows
    private int borrowState;
    // site of the borrow that took the cell from UNUSED, kept until the cell is UNUSED again
    @Nullable
    private Throwable borrowSite;

    private RcCell(@NotNull final T value, @NotNull final CellTracker tracker, final boolean debugBorrows) {
        this.tracker = tracker;
        this.debugBorrows = debugBorrows;
        this.value = value;
        strongCount = 1;
        borrowState = UNUSED;
    }

    public static <T> RcCell<T> allocate(@NotNull final T value) {
        return allocate(value, CellTracker.NONE, false);
    }

    /**
     * @param value        initial contents
     * @param tracker      receives allocation and release events of the new cell
     * @param debugBorrows whether to record the stack trace of each borrow
     * @return new cell owned by the caller, its strong count is 1
     */
    @SuppressWarnings("ConstantConditions")
    public static <T> RcCell<T> allocate(@NotNull final T value,
                                         @NotNull final CellTracker tracker,
                                         final boolean debugBorrows) {
        if (value == null) {
            throw new IllegalArgumentException("RcCell can't hold null");
        }
        final RcCell<T> result = new RcCell<>(value, tracker, debugBorrows);
        tracker.allocated(result);
        return result;
    }

    /**
     * Registers one more owner of the cell.
     *
     * @return this cell
     */
    public RcCell<T> share() {
        checkNotReleased();
        ++strongCount;
        return this;
    }

    /**
     * Drops one owner of the cell. Dropping the last one releases the cell.
     */
    public void release() {
        checkNotReleased();
        if (strongCount > 1) {
            --strongCount;
            return;
        }
        if (borrowState != UNUSED) {
            throw new OwnershipException("Can't release the last owner of a borrowed cell: " + this);
        }
        free();
    }

    /**
     * Takes the contents out of the cell if the caller is its only owner and nothing borrows it. The cell
     * is released then. Otherwise nothing changes.
     *
     * @return contents of the cell
     * @throws OwnershipException the cell has other owners, is borrowed or is released
     */
    public T tryUnwrap() {
        checkNotReleased();
        if (strongCount != 1) {
            throw new OwnershipException("Can't unwrap a cell having " + strongCount + " owners");
        }
        if (borrowState != UNUSED) {
            throw new OwnershipException("Can't unwrap a borrowed cell: " + this);
        }
        final T result = value;
        free();
        return result;
    }

    public Ref<T> borrow() {
        checkNotReleased();
        if (borrowState == WRITING) {
            throw conflict("RcCell is already mutably borrowed");
        }
        ++borrowState;
        recordBorrowSite("RcCell is borrowed here");
        return new Ref<>(this, this::getValue);
    }

    public RefMut<T> borrowMut() {
        checkNotReleased();
        if (borrowState == WRITING) {
            throw conflict("RcCell is already mutably borrowed");
        }
        if (borrowState != UNUSED) {
            throw conflict("RcCell is already borrowed " + borrowState + " time(s)");
        }
        borrowState = WRITING;
        recordBorrowSite("RcCell is mutably borrowed here");
        return new RefMut<>(this, this::getValue, this::setValue);
    }

    public int getStrongCount() {
        return strongCount;
    }

    public boolean isReleased() {
        return strongCount == 0;
    }

    public boolean isBorrowed() {
        return borrowState != UNUSED;
    }

    public boolean isBorrowedMut() {
        return borrowState == WRITING;
    }

    @Override
    public String toString() {
        final String borrows;
        if (borrowState == WRITING) {
            borrows = "exclusive";
        } else if (borrowState == UNUSED) {
            borrows = "none";
        } else {
            borrows = borrowState + " shared";
        }
        return "RcCell{owners=" + strongCount + ", borrows=" + borrows + '}';
    }

    void releaseShared() {
        if (--borrowState == UNUSED) {
            borrowSite = null;
        }
    }

    void releaseExclusive() {
        borrowState = UNUSED;
        borrowSite = null;
    }

    T getValue() {
        checkNotReleased();
        return value;
    }

    @SuppressWarnings("ConstantConditions")
    void setValue(@NotNull final T value) {
        checkNotReleased();
        if (value == null) {
            throw new IllegalArgumentException("RcCell can't hold null");
        }
        this.value = value;
    }

    private void free() {
        value = null;
        strongCount = 0;
        borrowSite = null;
        tracker.released(this);
    }

    private void checkNotReleased() {
        if (strongCount == 0) {
            throw new OwnershipException("RcCell is used after release");
        }
    }

    private void recordBorrowSite(@NotNull final String description) {
        if (debugBorrows && borrowSite == null) {
            borrowSite = new Throwable(description);
        }
    }

    private BorrowException conflict(@NotNull final String message) {
        final Throwable site = borrowSite;
        if (site == null) {
            return new BorrowException(message);
        }
        if (logger.isDebugEnabled()) {
            logger.debug(message + ", holder's borrow site:", site);
        }
        return new BorrowException(message, site);
    }
}
