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

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import javax.annotation.concurrent.Immutable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.agrona.collections.Hashing;
import org.agrona.collections.Int2ObjectHashMap;
import org.agrona.collections.IntHashSet;
import org.apache.seqtrie.config.SeqTrieRelevantProperties;

/**
 * Reverse index from key elements to the nodes of a persistent trie whose label contains them.
 * <p>
 * An index belongs to one trie snapshot and holds exactly the nodes reachable from its root. It is never modified
 * once built; the index of the next snapshot is produced by a {@link Builder} that copies only the buckets it
 * changes and shares the rest. Bucket membership is keyed by {@link SequenceTrieNode#id()}, not by node content.
 * <p>
 * The top-level element map is not shared: a builder that changes anything copies it whole, so building the index of
 * a new snapshot costs time linear in the number of distinct elements, on top of the buckets of the nodes the
 * mutation replaced. This is of the same order as the path copy of the trie itself, which rebuilds every node of the
 * sibling chains in front of the changed node.
 * <p>
 * All maps are created without allocation avoidance, so that their iterators are not shared and any number of
 * threads can read an index concurrently.
 */
@Immutable
public final class ElementIndex<T>
{
    private static final Logger logger = LoggerFactory.getLogger(ElementIndex.class);

    @VisibleForTesting
    static final int BUCKET_INITIAL_CAPACITY = SeqTrieRelevantProperties.INDEX_BUCKET_INITIAL_CAPACITY.getInt();

    private static final ElementIndex<?> EMPTY = new ElementIndex<>(newMap(BUCKET_INITIAL_CAPACITY));

    private final Int2ObjectHashMap<Int2ObjectHashMap<SequenceTrieNode<T>>> buckets;

    private ElementIndex(Int2ObjectHashMap<Int2ObjectHashMap<SequenceTrieNode<T>>> buckets)
    {
        this.buckets = buckets;
    }

    @SuppressWarnings("unchecked")
    static <T> ElementIndex<T> empty()
    {
        return (ElementIndex<T>) EMPTY;
    }

    private static <V> Int2ObjectHashMap<V> newMap(int initialCapacity)
    {
        return new Int2ObjectHashMap<>(initialCapacity, Hashing.DEFAULT_LOAD_FACTOR, false);
    }

    /**
     * Returns the nodes whose label contains the given element, ordered by id.
     */
    @SuppressWarnings("unchecked")
    public List<SequenceTrieNode<T>> nodesContaining(int element)
    {
        Int2ObjectHashMap<SequenceTrieNode<T>> bucket = buckets.get(element);
        if (bucket == null)
            return ImmutableList.of();

        SequenceTrieNode<T>[] nodes = bucket.values().toArray(new SequenceTrieNode[0]);
        Arrays.sort(nodes, Comparator.comparingInt(SequenceTrieNode::id));
        return ImmutableList.copyOf(nodes);
    }

    public boolean contains(int element, SequenceTrieNode<T> node)
    {
        Int2ObjectHashMap<SequenceTrieNode<T>> bucket = buckets.get(element);
        return bucket != null && bucket.get(node.id) == node;
    }

    /**
     * Returns the elements that have at least one node in the index, in ascending unsigned order.
     */
    public int[] elements()
    {
        int[] elements = new int[buckets.size()];
        int i = 0;
        for (Integer element : buckets.keySet())
            elements[i++] = element;
        // sort as unsigned by flipping the sign bit around a signed sort
        for (int j = 0; j < elements.length; ++j)
            elements[j] ^= Integer.MIN_VALUE;
        Arrays.sort(elements);
        for (int j = 0; j < elements.length; ++j)
            elements[j] ^= Integer.MIN_VALUE;
        return elements;
    }

    public boolean isEmpty()
    {
        return buckets.isEmpty();
    }

    Builder<T> builder()
    {
        return new Builder<>(this);
    }

    /**
     * Produces the index of a new snapshot from the index of the one it is derived from. Not thread-safe; used by
     * the single mutation that produces the snapshot.
     */
    static final class Builder<T>
    {
        private final ElementIndex<T> base;
        private Int2ObjectHashMap<Int2ObjectHashMap<SequenceTrieNode<T>>> buckets;
        private final IntHashSet copiedBuckets = new IntHashSet();

        private Builder(ElementIndex<T> base)
        {
            this.base = base;
        }

        /**
         * Registers the node under every element of its label.
         */
        void add(SequenceTrieNode<T> node)
        {
            for (int element : node.label)
                writableBucket(element, true).put(node.id, node);
        }

        void remove(SequenceTrieNode<T> node)
        {
            for (int element : node.label)
            {
                Int2ObjectHashMap<SequenceTrieNode<T>> bucket = writableBucket(element, false);
                if (bucket == null)
                    continue;
                bucket.remove(node.id);
                if (bucket.isEmpty())
                    buckets.remove(element);
            }
        }

        private Int2ObjectHashMap<SequenceTrieNode<T>> writableBucket(int element, boolean create)
        {
            if (buckets == null)
            {
                buckets = newMap(Math.max(BUCKET_INITIAL_CAPACITY, base.buckets.size() * 2));
                buckets.putAll(base.buckets);
            }

            Int2ObjectHashMap<SequenceTrieNode<T>> bucket = buckets.get(element);
            if (copiedBuckets.contains(element))
            {
                if (bucket == null && create)
                {
                    bucket = newMap(BUCKET_INITIAL_CAPACITY);
                    buckets.put(element, bucket);
                }
                return bucket;
            }

            if (bucket == null && !create)
                return null;

            Int2ObjectHashMap<SequenceTrieNode<T>> copy = newMap(bucket == null ? BUCKET_INITIAL_CAPACITY
                                                                                : Math.max(BUCKET_INITIAL_CAPACITY, bucket.size() * 2));
            if (bucket != null)
                copy.putAll(bucket);
            buckets.put(element, copy);
            copiedBuckets.add(element);
            return copy;
        }

        ElementIndex<T> build()
        {
            if (buckets == null)
                return base;
            if (logger.isTraceEnabled())
                logger.trace("Built element index with {} elements, {} buckets copied", buckets.size(), copiedBuckets.size());
            return new ElementIndex<>(buckets);
        }
    }
}
