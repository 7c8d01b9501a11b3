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

import linkage.LinkageException;

/**
 * Thrown on a violation of the borrow discipline of an {@linkplain RcCell}: a conflicting shared or
 * exclusive borrow, or use of a guard that was already closed.
 */
public class BorrowException extends LinkageException {

    public BorrowException(String message) {
        super(message);
    }

    public BorrowException(String message, Throwable borrowSite) {
        super(message, borrowSite);
    }
}
