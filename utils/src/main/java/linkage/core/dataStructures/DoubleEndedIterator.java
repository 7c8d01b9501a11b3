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

import java.util.Iterator;

/**
 * Iterator yielding elements from both ends of a sequence. {@link #next()} takes from the front,
 * {@link #nextBack()} from the back. Each element is yielded once, whichever end it is taken from.
 */
public interface DoubleEndedIterator<T> extends Iterator<T> {

    boolean hasNextBack();

    /**
     * @return element at the back of the remaining sequence
     * @throws java.util.NoSuchElementException nothing remains
     */
    T nextBack();
}
