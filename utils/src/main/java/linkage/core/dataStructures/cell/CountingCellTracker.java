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

public class CountingCellTracker implements CellTracker {

    private long allocated;
    private long released;

    @Override
    public void allocated(@NotNull RcCell<?> cell) {
        ++allocated;
    }

    @Override
    public void released(@NotNull RcCell<?> cell) {
        ++released;
    }

    public long getAllocatedCount() {
        return allocated;
    }

    public long getReleasedCount() {
        return released;
    }

    public long getLiveCount() {
        return allocated - released;
    }

    @Override
    public String toString() {
        return "CountingCellTracker{allocated=" + allocated + ", released=" + released + '}';
    }
}
