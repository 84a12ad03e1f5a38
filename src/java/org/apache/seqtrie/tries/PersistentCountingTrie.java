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

import java.util.List;
import javax.annotation.concurrent.Immutable;

/**
 * Persistent version of {@link CountingSequenceTrie}. Counts are accumulated exactly as in the mutable trie, so
 * appending the same keys in the same order yields the same structure and counts.
 */
@Immutable
public class PersistentCountingTrie extends CompressedTrie<Integer>
{
    private static final Integer ONE = 1;

    private final PersistentSequenceTrie<Integer> trie;

    /**
     * Creates an empty counting trie, the first snapshot of a new lineage.
     */
    public PersistentCountingTrie()
    {
        this(PersistentSequenceTrie.empty());
    }

    private PersistentCountingTrie(PersistentSequenceTrie<Integer> trie)
    {
        this.trie = trie;
    }

    @Override
    public SequenceTrieNode<Integer> root()
    {
        return trie.root();
    }

    public ElementIndex<Integer> index()
    {
        return trie.index();
    }

    public List<SequenceTrieNode<Integer>> nodesContaining(int element)
    {
        return trie.nodesContaining(element);
    }

    /**
     * Returns a snapshot in which the count of every node on the path of the key is one higher.
     */
    public PersistentCountingTrie append(int[] key)
    {
        return new PersistentCountingTrie(trie.appendWith(key, ONE, InsertPolicy.counting()));
    }

    public int count(int[] key)
    {
        Integer count = get(key);
        return count == null ? 0 : count;
    }
}
