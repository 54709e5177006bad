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
package org.kairos.history.window;

import org.kairos.ConfigurationStrategy;
import org.kairos.history.HistoryConfig;
import org.kairos.history.OrderingViolationException;
import org.kairos.history.RevisionHistory;
import org.kairos.history.RevisionNotFoundException;
import org.kairos.core.dataStructures.LongObjectPair;
import org.junit.Assert;
import org.junit.Test;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

public class RevisionWindowMapTest {

    @Test
    public void getEffectiveValue() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.set(5, "a");
        window.set(10, "b");
        Assert.assertEquals("a", window.get(7));
        Assert.assertEquals("b", window.get(10));
        Assert.assertEquals("b", window.get(1000));
        Assert.assertEquals("a", window.get(5));
        assertNotFound(window, 4);
    }

    @Test
    public void truncateFrom() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.set(5, "a");
        window.set(10, "b");
        window.truncateFrom(8);
        Assert.assertEquals("a", window.get(7));
        Assert.assertNull(window.get(8));
        Assert.assertNull(window.get(10));
        Assert.assertFalse(window.contains(10));
        Assert.assertTrue(window.contains(7));
        Assert.assertEquals("{5=a, 8=null}", window.toString());
        assertNotFound(window, 4);
    }

    @Test
    public void truncateAtRecordedRevision() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.update(orderedMap(1, "a", 2, "b", 3, "c"));
        window.get(1);
        window.truncateFrom(2);
        Assert.assertEquals("{1=a, 2=null}", window.toString());
        window.truncateFrom(0);
        Assert.assertEquals("{0=null}", window.toString());
        assertNotFound(window, -1);
        Assert.assertNull(window.get(0));
    }

    @Test
    public void truncateEmpty() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.truncateFrom(3);
        Assert.assertEquals(1, window.size());
        Assert.assertNull(window.get(3));
        window.set(4, "d");
        Assert.assertEquals("d", window.get(4));
    }

    @Test
    public void revBeforeAfter() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.set(1, "x");
        window.set(2, "y");
        window.set(3, "z");
        Assert.assertEquals(2, window.revBefore(2));
        Assert.assertEquals(3, window.revBefore(3));
        Assert.assertEquals(3, window.revBefore(100));
        Assert.assertEquals(2, window.revAfter(1));
        Assert.assertEquals(RevisionHistory.NO_REVISION, window.revAfter(3));
        Assert.assertEquals(1, window.revAfter(0));
        try {
            window.revBefore(0);
            Assert.fail();
        } catch (RevisionNotFoundException e) {
            Assert.assertEquals(0, e.getRevision());
        }
    }

    @Test
    public void equalityIgnoresWindowPosition() {
        final RevisionWindowMap<String> first = new RevisionWindowMap<>();
        final RevisionWindowMap<String> second = new RevisionWindowMap<>();
        first.set(1, "a");
        first.set(3, "b");
        second.set(1, "a");
        second.set(3, "b");
        first.get(0);
        first.seek(2);
        second.get(100);
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.hashCode(), second.hashCode());
        second.set(3, "c");
        Assert.assertNotEquals(first, second);
        Assert.assertEquals(new RevisionWindowMap<>(), new RevisionWindowMap<String>());
    }

    @Test
    public void overwriteInPlace() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.set(1, "a");
        window.set(2, "b");
        window.set(1, "A");
        Assert.assertEquals(2, window.size());
        Assert.assertEquals("A", window.get(1));
        Assert.assertEquals("b", window.get(2));
        window.set(2, null);
        Assert.assertNull(window.get(3));
        window.set(4, "d");
        Assert.assertEquals("d", window.get(4));
        Assert.assertNull(window.get(3));
    }

    @Test
    public void insertBeforeEverything() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.set(3, "b");
        window.set(1, "a");
        Assert.assertEquals("{1=a, 3=b}", window.toString());
        window.set(2, "ab");
        Assert.assertEquals("{1=a, 2=ab, 3=b}", window.toString());
    }

    @Test
    public void strictOrdering() {
        final HistoryConfig config = checked().setStrictOrdering(true);
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(config);
        window.set(1, "a");
        window.set(3, "b");
        window.set(3, "B");
        try {
            window.set(2, "c");
            Assert.fail();
        } catch (OrderingViolationException e) {
            Assert.assertEquals(2, e.getRevision());
            Assert.assertEquals(3, e.getLastRevision());
        }
        Assert.assertEquals("{1=a, 3=B}", window.toString());
        window.truncateFrom(2);
        window.set(2, "c");
        Assert.assertEquals("{1=a, 2=c}", window.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void reservedRevision() {
        new RevisionWindowMap<String>().set(RevisionHistory.NO_REVISION, "a");
    }

    @Test
    public void constructFromUnorderedMap() {
        final Map<Long, String> data = new HashMap<>();
        for (long rev = 100; rev > 0; rev -= 7) {
            data.put(rev, "v" + rev);
        }
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(data, checked());
        Assert.assertEquals(data.size(), window.size());
        Assert.assertEquals(new ArrayList<>(new TreeMap<>(data).keySet()), new ArrayList<>(window.keys()));
        Assert.assertEquals("v93", window.get(95));
        Assert.assertEquals(2, window.firstRevision());
        Assert.assertEquals(100, window.lastRevision());
    }

    @Test
    public void readsMatchFloorLookup() {
        final Random rnd = new Random(7);
        final TreeMap<Long, Integer> reference = new TreeMap<>();
        final RevisionWindowMap<Integer> window = new RevisionWindowMap<>(checked());
        long rev = 0;
        for (int i = 0; i < 300; ++i) {
            rev += 1 + rnd.nextInt(5);
            final Integer value = rnd.nextInt(10) == 0 ? null : i;
            reference.put(rev, value);
            window.set(rev, value);
            // random reads in between assignments
            final long target = rnd.nextInt((int) rev + 10) - 5;
            assertFloor(reference, window, target);
        }
        for (int i = 0; i < 3000; ++i) {
            assertFloor(reference, window, rnd.nextInt((int) rev + 20) - 10);
        }
        for (int i = 0; i < 300; ++i) {
            final long target = rnd.nextInt((int) rev + 20) - 10;
            final Long before = reference.floorKey(target);
            final Long after = reference.higherKey(target);
            if (before == null) {
                assertNotFound(window, target);
            } else {
                Assert.assertEquals(before.longValue(), window.revBefore(target));
            }
            Assert.assertEquals(after == null ? RevisionHistory.NO_REVISION : after, window.revAfter(target));
        }
        Assert.assertEquals(new ArrayList<>(reference.keySet()), new ArrayList<>(window.keys()));
        Assert.assertEquals(new ArrayList<>(reference.values()), new ArrayList<>(window.values()));
    }

    @Test
    public void truncateKeepsEarlierReads() {
        final Random rnd = new Random(11);
        final RevisionWindowMap<Integer> window = new RevisionWindowMap<>(checked());
        for (int rev = 0; rev < 200; rev += 2) {
            window.set(rev, rev);
        }
        final List<Integer> before = new ArrayList<>();
        for (int rev = 0; rev < 210; ++rev) {
            before.add(window.get(rev));
        }
        window.get(rnd.nextInt(200));
        window.truncateFrom(101);
        for (int rev = 0; rev < 210; ++rev) {
            if (rev < 101) {
                Assert.assertEquals(before.get(rev), window.get(rev));
            } else {
                Assert.assertNull(window.get(rev));
            }
        }
        Assert.assertEquals(101, window.lastRevision());
        Assert.assertEquals(52, window.size());
    }

    @Test
    public void updateKeepsSuppliedOrder() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.update(orderedMap(5, "e", 1, "a", 3, "c"));
        Assert.assertEquals("{1=a, 3=c, 5=e}", window.toString());
        final RevisionWindowMap<String> strict = new RevisionWindowMap<>(checked().setStrictOrdering(true));
        try {
            strict.update(orderedMap(5, "e", 1, "a"));
            Assert.fail();
        } catch (OrderingViolationException e) {
            Assert.assertEquals("{5=e}", strict.toString());
        }
    }

    @Test
    public void views() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.update(orderedMap(2, "a", 4, null, 6, "b"));
        window.get(3);
        Assert.assertEquals(Arrays.asList(2L, 4L, 6L), new ArrayList<>(window.keys()));
        Assert.assertEquals(Arrays.asList("a", null, "b"), new ArrayList<>(window.values()));
        Assert.assertEquals(Arrays.asList(
                new LongObjectPair<>(2, "a"),
                new LongObjectPair<>(4, (String) null),
                new LongObjectPair<>(6, "b")), new ArrayList<>(window.items()));
        Assert.assertEquals(3, window.items().size());

        Assert.assertTrue(window.keys().contains(2L));
        Assert.assertTrue(window.keys().contains(3L));
        Assert.assertFalse(window.keys().contains(5L));
        Assert.assertFalse(window.keys().contains(1L));
        Assert.assertFalse(window.keys().contains("2"));

        Assert.assertTrue(window.values().contains("b"));
        Assert.assertTrue(window.values().contains(null));
        Assert.assertFalse(window.values().contains("c"));

        Assert.assertTrue(window.items().contains(new AbstractMap.SimpleEntry<>(3L, "a")));
        Assert.assertTrue(window.items().contains(new LongObjectPair<>(5, (String) null)));
        Assert.assertTrue(window.items().contains(new LongObjectPair<>(100, "b")));
        Assert.assertFalse(window.items().contains(new LongObjectPair<>(1, (String) null)));
        Assert.assertFalse(window.items().contains(new LongObjectPair<>(6, "a")));
        Assert.assertFalse(window.items().contains("a"));
    }

    @Test
    public void viewsDoNotMoveWindow() {
        final RevisionWindowMap<Integer> window = new RevisionWindowMap<>(checked());
        for (int rev = 0; rev < 10; ++rev) {
            window.set(rev, rev);
        }
        window.seek(4);
        int count = 0;
        for (final Map.Entry<Long, Integer> entry : window.items()) {
            Assert.assertTrue(window.items().contains(entry));
            Assert.assertTrue(window.keys().contains(entry.getKey()));
            ++count;
        }
        Assert.assertEquals(10, count);
        window.checkInvariants();
    }

    @Test
    public void seekBeyondThresholdKeepsWindowConsistent() {
        final RevisionWindowMap<Integer> window = new RevisionWindowMap<>(checked().setLongSeekThreshold(10));
        for (int rev = 0; rev < 100; ++rev) {
            window.set(rev, rev);
        }
        window.seek(0);
        window.checkInvariants();
        Assert.assertEquals(Integer.valueOf(0), window.get(0));
        window.seek(99);
        window.checkInvariants();
        Assert.assertEquals(Integer.valueOf(99), window.get(99));
        Assert.assertEquals(RevisionHistory.NO_REVISION, window.revAfter(99));
        window.seek(-1);
        window.checkInvariants();
        Assert.assertEquals(0, window.revAfter(-1));
        Assert.assertEquals(100, window.size());
    }

    @Test
    public void viewsSeeFutureWhenWindowIsBeforeEverything() {
        final RevisionWindowMap<String> window = new RevisionWindowMap<>(checked());
        window.set(5, "a");
        window.set(10, "b");
        window.seek(1);
        Assert.assertFalse(window.keys().contains(1L));
        Assert.assertTrue(window.keys().contains(5L));
        Assert.assertTrue(window.keys().contains(7L));
        Assert.assertTrue(window.keys().contains(100L));
        Assert.assertTrue(window.items().contains(new LongObjectPair<>(7, "a")));
        Assert.assertTrue(window.items().contains(new LongObjectPair<>(10, "b")));
        Assert.assertFalse(window.items().contains(new LongObjectPair<>(10, "a")));
        Assert.assertFalse(window.items().contains(new LongObjectPair<>(4, (String) null)));
        window.checkInvariants();
        Assert.assertEquals("a", window.get(7));
    }

    private static void assertFloor(TreeMap<Long, Integer> reference, RevisionWindowMap<Integer> window, long revision) {
        final Map.Entry<Long, Integer> floor = reference.floorEntry(revision);
        if (floor == null) {
            assertNotFound(window, revision);
        } else {
            Assert.assertEquals(floor.getValue(), window.get(revision));
            Assert.assertEquals(floor.getValue() != null, window.contains(revision));
        }
    }

    private static void assertNotFound(RevisionWindowMap<?> window, long revision) {
        try {
            window.get(revision);
            Assert.fail("Revision " + revision + " shouldn't be found");
        } catch (RevisionNotFoundException e) {
            Assert.assertEquals(revision, e.getRevision());
        }
        Assert.assertFalse(window.contains(revision));
    }

    private static Map<Long, String> orderedMap(Object... revisionsAndValues) {
        final Map<Long, String> result = new LinkedHashMap<>();
        for (int i = 0; i < revisionsAndValues.length; i += 2) {
            result.put(((Integer) revisionsAndValues[i]).longValue(), (String) revisionsAndValues[i + 1]);
        }
        return result;
    }

    private static HistoryConfig checked() {
        return new HistoryConfig(ConfigurationStrategy.IGNORE).setCheckInvariants(true);
    }
}
