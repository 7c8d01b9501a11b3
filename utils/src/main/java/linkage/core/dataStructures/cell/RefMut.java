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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Exclusive borrow of an {@linkplain RcCell}. While it is open, no other borrow of the same cell
 * succeeds. The borrow lasts until {@link #close()}.
 */
public final class RefMut<T> implements AutoCloseable {

    @NotNull
    private final RcCell<?> cell;
    @NotNull
    private final Supplier<T> getter;
    @NotNull
    private final Consumer<T> setter;
    private boolean closed;

    RefMut(@NotNull final RcCell<?> cell, @NotNull final Supplier<T> getter, @NotNull final Consumer<T> setter) {
        this.cell = cell;
        this.getter = getter;
        this.setter = setter;
    }

    public T get() {
        checkOpen();
        return getter.get();
    }

    public void set(@NotNull final T value) {
        checkOpen();
        setter.accept(value);
    }

    /**
     * Narrows the borrow to a part of the borrowed value. The borrow moves to the returned guard, this
     * one becomes closed.
     *
     * @param getter reads the part from the whole value
     * @param setter writes the part into the whole value
     */
    public <U> RefMut<U> map(@NotNull final Function<? super T, ? extends U> getter,
                             @NotNull final BiConsumer<? super T, ? super U> setter) {
        checkOpen();
        closed = true;
        final Supplier<T> whole = this.getter;
        return new RefMut<>(cell, () -> getter.apply(whole.get()), part -> setter.accept(whole.get(), part));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            cell.releaseExclusive();
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new BorrowException("Exclusive borrow is already closed");
        }
    }
}
