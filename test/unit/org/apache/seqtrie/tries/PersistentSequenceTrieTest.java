/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.seqtrie.tries;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.primitives.Ints;
import org.junit.Test;

import static org.apache.seqtrie.tries.CountingSequenceTrieTest.APRIORI_TRANSACTIONS;
import static org.apache.seqtrie.tries.CountingSequenceTrieTest.WIDE_CHAIN;
import static org.apache.seqtrie.tries.CountingSequenceTrieTest.assertAprioriStructure;
import static org.apache.seqtrie.tries.TrieTestUtil.assertNode;
import static org.apache.seqtrie.tries.TrieTestUtil.generateKeys;
import static org.apache.seqtrie.tries.TrieTestUtil.key;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class PersistentSequenceTrieTest
{
    Random rand = new Random(3);

    @Test
    public void testEmpty()
    {
        PersistentSequenceTrie<String> trie = PersistentSequenceTrie.empty();
        assertTrue(trie.isEmpty());
        assertNull(trie.find(key(1)));
        assertNull(trie.find(key()));
        assertTrue(trie.index().isEmpty());
    }

    @Test
    public void testAppendDoesNotModifyReceiver()
    {
        PersistentSequenceTrie<String> t0 = PersistentSequenceTrie.<String>empty().append(key(3, 137, 2), "a");
        String before = t0.dump();

        PersistentSequenceTrie<String> t1 = t0.append(key(3, 137, 99, 22), "b");

        assertNull(t0.find(key(3, 137, 99, 22)));
        assertEquals("b", t1.get(key(3, 137, 99, 22)));
        assertEquals(before, t0.dump());
        assertNode(t0.root(), key(3, 137, 2), "a");
        assertNull(t0.root().child());

        SequenceTrieNode<String> root = t1.root();
        assertNode(root, key(3, 137), null);
        assertNode(root.child(), key(2), "a");
        assertNode(root.child().sibling(), key(99, 22), "b");
        assertNull(root.child().sibling().sibling());
    }

    @Test
    public void testAppendToEmptyLeavesEmpty()
    {
        PersistentSequenceTrie<String> empty = PersistentSequenceTrie.empty();
        PersistentSequenceTrie<String> t1 = empty.append(key(5), "x");
        assertTrue(empty.isEmpty());
        assertEquals("x", t1.get(key(5)));
    }

    @Test
    public void testUntouchedSubtreesAreShared()
    {
        PersistentSequenceTrie<String> t0 = PersistentSequenceTrie.<String>empty()
                                                                  .append(key(3, 137, 2), "a")
                                                                  .append(key(3, 137, 99), "b")
                                                                  .append(key(5, 6), "c");
        PersistentSequenceTrie<String> t1 = t0.append(key(5, 7), "d");

        // the [3, 137] node is on the path to the [5] sibling and is rebuilt, its children are not
        assertNotSame(t0.root(), t1.root());
        assertSame(t0.root().child(), t1.root().child());
        assertNotSame(t0.root().sibling(), t1.root().sibling());

        PersistentSequenceTrie<String> t2 = t1.append(key(3, 137, 2), "a2");
        assertSame(t1.root().sibling(), t2.root().sibling());
        assertSame(t1.root().child().sibling(), t2.root().child().sibling());
        assertEquals("a", t1.get(key(3, 137, 2)));
        assertEquals("a2", t2.get(key(3, 137, 2)));
    }

    @Test
    public void testAllSnapshotsRemainValid()
    {
        int[][] generated = generateKeys(rand, 300, 5, 6);
        Set<List<Integer>> distinct = new LinkedHashSet<>();
        for (int[] k : generated)
            distinct.add(Ints.asList(k));
        List<int[]> keys = new ArrayList<>();
        for (List<Integer> k : distinct)
            keys.add(Ints.toArray(k));

        List<PersistentSequenceTrie<Integer>> snapshots = new ArrayList<>();
        PersistentSequenceTrie<Integer> trie = PersistentSequenceTrie.empty();
        snapshots.add(trie);
        for (int i = 0; i < keys.size(); ++i)
        {
            trie = trie.append(keys.get(i), i);
            snapshots.add(trie);
        }

        for (int s = 0; s < snapshots.size(); ++s)
        {
            PersistentSequenceTrie<Integer> snapshot = snapshots.get(s);
            snapshot.verify();
            for (int i = 0; i < keys.size(); ++i)
            {
                if (i < s)
                    assertEquals(Integer.valueOf(i), snapshot.get(keys.get(i)));
                else
                    assertNull(snapshot.get(keys.get(i)));
            }
        }
    }

    @Test
    public void testMatchesMutableTrie()
    {
        int[][] keys = generateKeys(rand, 1000, 4, 7);
        InMemorySequenceTrie<Integer> mutable = new InMemorySequenceTrie<>();
        PersistentSequenceTrie<Integer> persistent = PersistentSequenceTrie.empty();
        for (int i = 0; i < keys.length; ++i)
        {
            mutable.insert(keys[i], i);
            persistent = persistent.append(keys[i], i);
        }
        assertEquals(mutable.dump(), persistent.dump());
        assertEquals(mutable.nodeCount(), persistent.nodeCount());
    }

    @Test
    public void testUpsert()
    {
        UpsertTransformer<Integer, Integer> sum = (existing, update) -> existing == null ? update : existing + update;
        PersistentSequenceTrie<Integer> t0 = PersistentSequenceTrie.<Integer>empty().append(key(1, 2), 5, sum);
        PersistentSequenceTrie<Integer> t1 = t0.append(key(1, 2), 7, sum);
        assertEquals(Integer.valueOf(5), t0.get(key(1, 2)));
        assertEquals(Integer.valueOf(12), t1.get(key(1, 2)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAppendEmptyKey()
    {
        PersistentSequenceTrie.<String>empty().append(key(), "x");
    }

    @Test
    public void testCountingApriori()
    {
        PersistentCountingTrie trie = new PersistentCountingTrie();
        List<PersistentCountingTrie> snapshots = new ArrayList<>();
        for (int[] transaction : APRIORI_TRANSACTIONS)
        {
            trie = trie.append(transaction);
            snapshots.add(trie);
        }
        assertAprioriStructure(trie);
        assertEquals(CountingSequenceTrieTest.sampleAprioriTrie().dump(), trie.dump());

        // earlier snapshots keep their counts
        assertEquals(1, snapshots.get(0).count(key(8, 5, 1, 3)));
        assertEquals(2, snapshots.get(2).count(key(8)));
        assertEquals(0, snapshots.get(2).count(key(8, 5)));
        assertEquals(6, trie.count(key(8)));
        assertEquals(2, trie.count(key(8, 5)));
    }

    @Test
    public void testCountingSplit()
    {
        PersistentCountingTrie t0 = new PersistentCountingTrie().append(key(3, 137, 2));
        PersistentCountingTrie t1 = t0.append(key(3, 137, 99, 2));

        assertNode(t0.root(), key(3, 137, 2), 1);
        assertNode(t1.root(), key(3, 137), 2);
        assertNode(t1.root().child(), key(2), 1);
        assertNode(t1.root().child().sibling(), key(99, 2), 1);
    }

    @Test
    public void testCountingMatchesMutableRandom()
    {
        int[][] keys = generateKeys(rand, 1000, 3, 6);
        CountingSequenceTrie mutable = new CountingSequenceTrie();
        PersistentCountingTrie persistent = new PersistentCountingTrie();
        for (int[] k : keys)
        {
            mutable.insertAndCount(k);
            persistent = persistent.append(k);
        }
        assertEquals(mutable.dump(), persistent.dump());
    }

    @Test
    public void testWideBranchingPoint()
    {
        // appending one key at a time copies the chain every time, so build the wide snapshot directly
        AtomicInteger nodeIds = new AtomicInteger();
        NodeStrategy.CopyOnWrite<Integer> strategy = new NodeStrategy.CopyOnWrite<>(nodeIds, ElementIndex.<Integer>empty());
        SequenceTrieNode<Integer> chain = null;
        for (int i = WIDE_CHAIN - 1; i >= 0; --i)
            chain = strategy.create(key(i), i, null, chain);
        PersistentSequenceTrie<Integer> wide = new PersistentSequenceTrie<>(chain, strategy.index(), nodeIds);

        PersistentSequenceTrie<Integer> appended = wide.append(key(WIDE_CHAIN), -1);
        PersistentSequenceTrie<Integer> extended = appended.append(key(WIDE_CHAIN - 1, 1), -2);
        PersistentSequenceTrie<Integer> replaced = extended.append(key(0), -3);

        assertEquals(WIDE_CHAIN, wide.nodeCount());
        assertNull(wide.find(key(WIDE_CHAIN)));
        assertEquals(Integer.valueOf(-1), appended.get(key(WIDE_CHAIN)));
        assertNull(appended.find(key(WIDE_CHAIN - 1, 1)));
        assertEquals(Integer.valueOf(-2), extended.get(key(WIDE_CHAIN - 1, 1)));
        assertEquals(Integer.valueOf(WIDE_CHAIN - 1), extended.get(key(WIDE_CHAIN - 1)));
        assertEquals(WIDE_CHAIN + 2, extended.nodeCount());
        assertEquals(Integer.valueOf(0), extended.get(key(0)));
        assertEquals(Integer.valueOf(-3), replaced.get(key(0)));

        // nodes after the changed one stay shared, nodes in front of it are rebuilt
        assertSame(appended.find(key(WIDE_CHAIN)), extended.find(key(WIDE_CHAIN)));
        assertNotSame(appended.find(key(WIDE_CHAIN / 2)), extended.find(key(WIDE_CHAIN / 2)));
        assertNotSame(extended.root(), replaced.root());
        assertSame(extended.root().sibling(), replaced.root().sibling());

        ElementIndexTest.assertIndexExact(extended);
        ElementIndexTest.assertIndexExact(replaced);
        replaced.verify();
    }

    @Test
    public void testConcurrentReadersOfOldSnapshot() throws ExecutionException, InterruptedException
    {
        int[][] keys = generateKeys(rand, 500, 5, 6);
        PersistentSequenceTrie<Integer> base = PersistentSequenceTrie.empty();
        for (int i = 0; i < keys.length; ++i)
            base = base.append(keys[i], i);
        final PersistentSequenceTrie<Integer> snapshot = base;
        final String expected = snapshot.dump();

        CompletableFuture<String> reader = CompletableFuture.supplyAsync(() -> {
            for (int r = 0; r < 20; ++r)
                for (int[] k : keys)
                    if (snapshot.find(k) == null)
                        throw new AssertionError("Missing key in snapshot");
            return snapshot.dump();
        });

        PersistentSequenceTrie<Integer> writer = snapshot;
        for (int[] k : generateKeys(new Random(11), 500, 7, 6))
            writer = writer.append(k, -1);

        assertEquals(expected, reader.get());
        assertEquals(expected, snapshot.dump());
    }
}
