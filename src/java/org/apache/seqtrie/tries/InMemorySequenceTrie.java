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

import com.google.common.base.Preconditions;

/**
 * Mutable in-memory sequence trie. Insertions change the existing nodes in place, splitting labels where a new key
 * diverges from a stored one.
 * <p>
 * The trie must be accessed by one thread at a time; it provides no internal synchronization.
 */
@NotThreadSafe
public class InMemorySequenceTrie<T> extends CompressedTrie<T>
{
    private final NodeStrategy<T> strategy = new NodeStrategy.InPlace<>();
    private SequenceTrieNode<T> root;

    @Override
    public SequenceTrieNode<T> root()
    {
        return root;
    }

    /**
     * Map-like insertion: associates the value with the key, replacing any value already stored for it.
     */
    public void insert(int[] key, T value)
    {
        Preconditions.checkNotNull(value, "Sequence trie values cannot be null");
        insertWith(key, value, InsertPolicy.overwrite());
    }

    /**
     * Inserts the key, combining the update with any existing value using the given transformer. The transformer is
     * applied even if there's no pre-existing value.
     */
    public <R> void insert(int[] key, R update, UpsertTransformer<T, R> transformer)
    {
        insertWith(key, update, InsertPolicy.upsert(transformer));
    }

    /**
     * Inserts the key, letting the given policy decide the values of all nodes on the insertion path.
     */
    public <R> void insertWith(int[] key, R update, InsertPolicy<T, ? super R> policy)
    {
        checkKey(key);
        Preconditions.checkNotNull(policy, "policy");
        root = new TrieMutation<T, R>(strategy, policy, key, update).applyTo(root);
        completeMutation(key);
    }
}
