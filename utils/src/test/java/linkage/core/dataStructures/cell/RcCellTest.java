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

import linkage.TestUtil;
import org.junit.Assert;
import org.junit.Test;

public class RcCellTest {

    @Test
    public void shareAndRelease() {
        final CountingCellTracker tracker = new CountingCellTracker();
        final RcCell<String> cell = RcCell.allocate("value", tracker, false);
        Assert.assertEquals(1, cell.getStrongCount());
        Assert.assertEquals(1, tracker.getLiveCount());
        Assert.assertSame(cell, cell.share());
        Assert.assertSame(cell, cell.share());
        Assert.assertEquals(3, cell.getStrongCount());
        cell.release();
        cell.release();
        Assert.assertFalse(cell.isReleased());
        Assert.assertEquals(0, tracker.getReleasedCount());
        cell.release();
        Assert.assertTrue(cell.isReleased());
        Assert.assertEquals(1, tracker.getReleasedCount());
        Assert.assertEquals(0, tracker.getLiveCount());
    }

    @Test
    public void useAfterRelease() {
        final RcCell<String> cell = RcCell.allocate("value");
        cell.release();
        TestUtil.runWithExpectedException(cell::release, OwnershipException.class);
        TestUtil.runWithExpectedException(cell::share, OwnershipException.class);
        TestUtil.runWithExpectedException(cell::borrow, OwnershipException.class);
        TestUtil.runWithExpectedException(cell::borrowMut, OwnershipException.class);
        TestUtil.runWithExpectedException(cell::tryUnwrap, OwnershipException.class);
    }

    @Test
    public void nullValue() {
        TestUtil.runWithExpectedException(() -> RcCell.allocate(null), IllegalArgumentException.class);
        final RcCell<String> cell = RcCell.allocate("value");
        try (RefMut<String> value = cell.borrowMut()) {
            TestUtil.runWithExpectedException(() -> value.set(null), IllegalArgumentException.class);
            Assert.assertEquals("value", value.get());
        }
    }

    @Test
    public void manySharedBorrows() {
        final RcCell<Integer> cell = RcCell.allocate(42);
        try (Ref<Integer> first = cell.borrow(); Ref<Integer> second = cell.borrow()) {
            Assert.assertEquals(Integer.valueOf(42), first.get());
            Assert.assertEquals(Integer.valueOf(42), second.get());
            Assert.assertTrue(cell.isBorrowed());
            Assert.assertFalse(cell.isBorrowedMut());
            TestUtil.runWithExpectedException(cell::borrowMut, BorrowException.class);
        }
        Assert.assertFalse(cell.isBorrowed());
        try (RefMut<Integer> value = cell.borrowMut()) {
            value.set(43);
        }
        try (Ref<Integer> value = cell.borrow()) {
            Assert.assertEquals(Integer.valueOf(43), value.get());
        }
    }

    @Test
    public void exclusiveBorrowBlocksAll() {
        final RcCell<Integer> cell = RcCell.allocate(1);
        final RefMut<Integer> value = cell.borrowMut();
        Assert.assertTrue(cell.isBorrowedMut());
        TestUtil.runWithExpectedException(cell::borrow, BorrowException.class);
        TestUtil.runWithExpectedException(cell::borrowMut, BorrowException.class);
        // failed attempts leave the holder's borrow intact
        value.set(2);
        value.close();
        Assert.assertFalse(cell.isBorrowed());
        try (Ref<Integer> ref = cell.borrow()) {
            Assert.assertEquals(Integer.valueOf(2), ref.get());
        }
    }

    @Test
    public void closedGuard() {
        final RcCell<Integer> cell = RcCell.allocate(1);
        final Ref<Integer> ref = cell.borrow();
        ref.close();
        ref.close();
        Assert.assertTrue(ref.isClosed());
        Assert.assertFalse(cell.isBorrowed());
        TestUtil.runWithExpectedException(ref::get, BorrowException.class);
        final RefMut<Integer> refMut = cell.borrowMut();
        refMut.close();
        refMut.close();
        Assert.assertFalse(cell.isBorrowed());
        TestUtil.runWithExpectedException(() -> refMut.set(5), BorrowException.class);
    }

    @Test
    public void mapTransfersBorrow() {
        final RcCell<StringBuilder> cell = RcCell.allocate(new StringBuilder("abc"));
        final Ref<StringBuilder> whole = cell.borrow();
        final Ref<Integer> length = whole.map(StringBuilder::length);
        Assert.assertTrue(whole.isClosed());
        Assert.assertEquals(Integer.valueOf(3), length.get());
        Assert.assertTrue(cell.isBorrowed());
        length.close();
        Assert.assertFalse(cell.isBorrowed());

        final RcCell<int[]> array = RcCell.allocate(new int[]{1, 2});
        try (RefMut<Integer> second = array.borrowMut().map(a -> a[1], (a, v) -> a[1] = v)) {
            Assert.assertTrue(array.isBorrowedMut());
            second.set(second.get() * 10);
        }
        try (Ref<int[]> ref = array.borrow()) {
            Assert.assertArrayEquals(new int[]{1, 20}, ref.get());
        }
    }

    @Test
    public void tryUnwrap() {
        final CountingCellTracker tracker = new CountingCellTracker();
        final RcCell<String> cell = RcCell.allocate("value", tracker, false);
        cell.share();
        TestUtil.runWithExpectedException(cell::tryUnwrap, OwnershipException.class);
        Assert.assertEquals(2, cell.getStrongCount());
        cell.release();
        try (Ref<String> ignored = cell.borrow()) {
            TestUtil.runWithExpectedException(cell::tryUnwrap, OwnershipException.class);
            TestUtil.runWithExpectedException(cell::release, OwnershipException.class);
        }
        Assert.assertEquals("value", cell.tryUnwrap());
        Assert.assertTrue(cell.isReleased());
        Assert.assertEquals(0, tracker.getLiveCount());
    }

    @Test
    public void debugBorrowSite() {
        final RcCell<String> cell = RcCell.allocate("value", CellTracker.NONE, true);
        try (RefMut<String> ignored = cell.borrowMut()) {
            final BorrowException e = TestUtil.catchException(cell::borrow, BorrowException.class);
            Assert.assertNotNull(e.getCause());
            Assert.assertEquals("RcCell is mutably borrowed here", e.getCause().getMessage());
        }
        final RcCell<String> plain = RcCell.allocate("value");
        try (RefMut<String> ignored = plain.borrowMut()) {
            Assert.assertNull(TestUtil.catchException(plain::borrow, BorrowException.class).getCause());
        }
    }

    @Test
    public void debugBorrowSiteOfSharedBorrows() {
        final RcCell<String> cell = RcCell.allocate("value", CellTracker.NONE, true);
        try (Ref<String> first = borrowFirst(cell); Ref<String> second = cell.borrow()) {
            final BorrowException e = TestUtil.catchException(cell::borrowMut, BorrowException.class);
            Assert.assertNotNull(e.getCause());
            Assert.assertEquals("RcCell is borrowed here", e.getCause().getMessage());
            Assert.assertTrue(calledFrom(e.getCause(), "borrowFirst"));
        }
        try (Ref<String> ignored = cell.borrow()) {
            final BorrowException e = TestUtil.catchException(cell::borrowMut, BorrowException.class);
            Assert.assertFalse(calledFrom(e.getCause(), "borrowFirst"));
        }
    }

    @Test
    public void describeState() {
        final RcCell<String> cell = RcCell.allocate("value");
        Assert.assertEquals("RcCell{owners=1, borrows=none}", cell.toString());
        try (Ref<String> ignored = cell.borrow(); Ref<String> ignored2 = cell.borrow()) {
            Assert.assertEquals("RcCell{owners=1, borrows=2 shared}", cell.toString());
        }
        cell.share();
        try (RefMut<String> ignored = cell.borrowMut()) {
            Assert.assertEquals("RcCell{owners=2, borrows=exclusive}", cell.toString());
        }
    }

    private static Ref<String> borrowFirst(RcCell<String> cell) {
        return cell.borrow();
    }

    private static boolean calledFrom(Throwable site, String methodName) {
        for (final StackTraceElement element : site.getStackTrace()) {
            if (methodName.equals(element.getMethodName())) {
                return true;
            }
        }
        return false;
    }
}
