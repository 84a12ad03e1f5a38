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

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Mutable sequence trie used as a compressed prefix frequency counter.
 * <p>
 * Every node counts the insertions whose key passes through or ends at it, so after all insertions the count of a
 * node is the support of the path ending in it among the inserted sequences. The only way to change the trie is
 * {@link #insertAndCount}, which keeps every node counted.
 */
@NotThreadSafe
public class CountingSequenceTrie extends CompressedTrie<Integer>
{
    private static final Integer ONE = 1;

    private final InMemorySequenceTrie<Integer> trie = new InMemorySequenceTrie<>();

    @Override
    public SequenceTrieNode<Integer> root()
    {
        return trie.root();
    }

    public void insertAndCount(int[] key)
    {
        trie.insertWith(key, ONE, InsertPolicy.counting());
    }

    /**
     * Returns the count stored at the node whose path is exactly the given key, or 0 if there is no such node.
     */
    public int count(int[] key)
    {
        Integer count = get(key);
        return count == null ? 0 : count;
    }
}
