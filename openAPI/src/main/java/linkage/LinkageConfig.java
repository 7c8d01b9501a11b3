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
package linkage;

import linkage.core.dataStructures.Pair;
import org.jetbrains.annotations.NotNull;

/**
 * Specifies settings of reference-counted cells and of the linked structures built on them. Default
 * settings are specified by {@linkplain #DEFAULT} which is immutable. A config created with the no-arg
 * constructor starts from the defaults overridden by system properties.
 * <pre>
 *     final LinkageConfig config = new LinkageConfig().setDebugBorrows(true);
 *     final SharedMutableDeque&lt;String&gt; deque = new SharedMutableDeque&lt;&gt;(config);
 * </pre>
 * Settings are read when a structure is created, changing them afterwards has no effect on existing
 * instances.
 */
@SuppressWarnings({"WeakerAccess", "AutoBoxing", "AutoUnboxing"})
public class LinkageConfig extends AbstractConfig {

    public static final LinkageConfig DEFAULT = new LinkageConfig(ConfigurationStrategy.IGNORE) {
        @Override
        public LinkageConfig setMutable(boolean isMutable) {
            if (!this.isMutable() && isMutable) {
                throw new LinkageException("Can't make LinkageConfig.DEFAULT mutable");
            }
            return super.setMutable(isMutable);
        }
    }.setMutable(false);

    /**
     * If {@code true}, each cell borrow records the stack trace of the code acquiring it. A conflicting
     * borrow then reports where the cell is held. Default value is {@code false}.
     */
    public static final String CELL_DEBUG_BORROWS = "linkage.cell.debugBorrows";

    /**
     * If {@code true}, a deque verifies its link invariants after each mutation and throws
     * {@linkplain LinkageException} once they are broken. Default value is {@code false}.
     */
    public static final String DEQUE_CHECK_INVARIANTS = "linkage.deque.checkInvariants";

    /**
     * Number of nodes starting from which teardown of a deque is logged. Default value is {@code 10000}.
     */
    public static final String DEQUE_TEARDOWN_LOG_THRESHOLD = "linkage.deque.teardownLogThreshold";

    private static final int DEFAULT_TEARDOWN_LOG_THRESHOLD = 10000;

    public LinkageConfig() {
        this(ConfigurationStrategy.SYSTEM_PROPERTY);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public LinkageConfig(@NotNull final ConfigurationStrategy strategy) {
        super(new Pair[]{
                new Pair(CELL_DEBUG_BORROWS, false),
                new Pair(DEQUE_CHECK_INVARIANTS, false),
                new Pair(DEQUE_TEARDOWN_LOG_THRESHOLD, DEFAULT_TEARDOWN_LOG_THRESHOLD)
        }, strategy);
        if (getTeardownLogThreshold() < 1) {
            setSetting(DEQUE_TEARDOWN_LOG_THRESHOLD, DEFAULT_TEARDOWN_LOG_THRESHOLD);
        }
    }

    /**
     * @throws InvalidSettingException {@code value} of {@linkplain #DEQUE_TEARDOWN_LOG_THRESHOLD} is not positive
     */
    @Override
    public LinkageConfig setSetting(@NotNull final String key, @NotNull final Object value) {
        if (DEQUE_TEARDOWN_LOG_THRESHOLD.equals(key) && (Integer) value < 1) {
            throw new InvalidSettingException("Invalid teardown log threshold: " + value + ", key = " + key);
        }
        return (LinkageConfig) super.setSetting(key, value);
    }

    @Override
    public LinkageConfig setMutable(boolean isMutable) {
        return (LinkageConfig) super.setMutable(isMutable);
    }

    public boolean isDebugBorrows() {
        return (Boolean) getSetting(CELL_DEBUG_BORROWS);
    }

    public LinkageConfig setDebugBorrows(final boolean debugBorrows) {
        return setSetting(CELL_DEBUG_BORROWS, debugBorrows);
    }

    public boolean isCheckInvariants() {
        return (Boolean) getSetting(DEQUE_CHECK_INVARIANTS);
    }

    public LinkageConfig setCheckInvariants(final boolean checkInvariants) {
        return setSetting(DEQUE_CHECK_INVARIANTS, checkInvariants);
    }

    public int getTeardownLogThreshold() {
        return (Integer) getSetting(DEQUE_TEARDOWN_LOG_THRESHOLD);
    }

    /**
     * @param threshold number of nodes starting from which teardown is logged
     * @return this {@code LinkageConfig} instance
     * @throws InvalidSettingException {@code threshold} is not positive
     */
    public LinkageConfig setTeardownLogThreshold(final int threshold) throws InvalidSettingException {
        return setSetting(DEQUE_TEARDOWN_LOG_THRESHOLD, threshold);
    }
}
