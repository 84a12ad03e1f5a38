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
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.concurrent.Immutable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Persistent sequence trie. Every append returns a new snapshot and leaves the receiver unchanged: the nodes on the
 * path of the appended key are rebuilt and all other nodes are shared with the previous snapshot.
 * <p>
 * A snapshot never changes after it has been created, so any number of threads can read old snapshots while a
 * writer produces new ones. Appends to different snapshots of the same lineage may also run concurrently.
 * <p>
 * Each snapshot carries an {@link ElementIndex} mapping every key element to the nodes of the snapshot whose label
 * contains it, which can be used to start lookups from a known element rather than from the root.
 */
@Immutable
public class PersistentSequenceTrie<T> extends CompressedTrie<T>
{
    private final SequenceTrieNode<T> root;
    private final ElementIndex<T> index;
    private final AtomicInteger nodeIds;

    @VisibleForTesting
    PersistentSequenceTrie(SequenceTrieNode<T> root, ElementIndex<T> index, AtomicInteger nodeIds)
    {
        this.root = root;
        this.index = index;
        this.nodeIds = nodeIds;
    }

    public static <T> PersistentSequenceTrie<T> empty()
    {
        return new PersistentSequenceTrie<>(null, ElementIndex.empty(), new AtomicInteger());
    }

    @Override
    public SequenceTrieNode<T> root()
    {
        return root;
    }

    public ElementIndex<T> index()
    {
        return index;
    }

    /**
     * Returns the nodes of this snapshot whose label contains the given element.
     */
    public List<SequenceTrieNode<T>> nodesContaining(int element)
    {
        return index.nodesContaining(element);
    }

    /**
     * Returns a snapshot that also maps the key to the given value, replacing any value stored for it.
     */
    public PersistentSequenceTrie<T> append(int[] key, T value)
    {
        Preconditions.checkNotNull(value, "Sequence trie values cannot be null");
        return appendWith(key, value, InsertPolicy.overwrite());
    }

    /**
     * Returns a snapshot with the key inserted, combining the update with any existing value using the given
     * transformer.
     */
    public <R> PersistentSequenceTrie<T> append(int[] key, R update, UpsertTransformer<T, R> transformer)
    {
        return appendWith(key, update, InsertPolicy.upsert(transformer));
    }

    /**
     * Returns a snapshot with the key inserted, letting the given policy decide the values of all nodes on the
     * insertion path.
     */
    public <R> PersistentSequenceTrie<T> appendWith(int[] key, R update, InsertPolicy<T, ? super R> policy)
    {
        checkKey(key);
        Preconditions.checkNotNull(policy, "policy");
        NodeStrategy.CopyOnWrite<T> strategy = new NodeStrategy.CopyOnWrite<>(nodeIds, index);
        SequenceTrieNode<T> newRoot = new TrieMutation<T, R>(strategy, policy, key, update).applyTo(root);
        PersistentSequenceTrie<T> snapshot = new PersistentSequenceTrie<>(newRoot, strategy.index(), nodeIds);
        snapshot.completeMutation(key);
        return snapshot;
    }
}
