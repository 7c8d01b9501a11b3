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

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Shared borrow of an {@linkplain RcCell}. The borrow lasts until {@link #close()}.
 */
public final class Ref<T> implements AutoCloseable {

    @NotNull
    private final RcCell<?> cell;
    @NotNull
    private final Supplier<T> getter;
    private boolean closed;

    Ref(@NotNull final RcCell<?> cell, @NotNull final Supplier<T> getter) {
        this.cell = cell;
        this.getter = getter;
    }

    public T get() {
        checkOpen();
        return getter.get();
    }

    /**
     * Narrows the borrow to a part of the borrowed value. The borrow moves to the returned guard, this
     * one becomes closed.
     */
    public <U> Ref<U> map(@NotNull final Function<? super T, ? extends U> part) {
        checkOpen();
        closed = true;
        final Supplier<T> whole = getter;
        return new Ref<>(cell, () -> part.apply(whole.get()));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            cell.releaseShared();
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new BorrowException("Shared borrow is already closed");
        }
    }
}
