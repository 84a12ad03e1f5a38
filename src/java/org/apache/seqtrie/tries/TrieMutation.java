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
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.seqtrie.utils.IntSequences;

/**
 * A single insertion into a sequence trie.
 * <p>
 * The walk matches the key against the labels it meets, moving along sibling chains while nothing matches and
 * descending into children while whole labels match. A label that only partially matches is split, the remainder
 * moving into a new child together with the old value and children. How node values change is decided by the
 * {@link InsertPolicy}, and how nodes are changed (in place or by copying) by the {@link NodeStrategy}.
 * <p>
 * Every step returns the node that takes the place of the one it was given, so that callers can relink it. Sibling
 * chains are walked iteratively; the walk only recurses when it descends into a child, so its stack depth is bounded
 * by the key length.
 */
final class TrieMutation<T, U>
{
    private static final Logger logger = LoggerFactory.getLogger(TrieMutation.class);

    private final NodeStrategy<T> strategy;
    private final InsertPolicy<T, ? super U> policy;
    private final int[] key;
    private final U update;

    TrieMutation(NodeStrategy<T> strategy, InsertPolicy<T, ? super U> policy, int[] key, U update)
    {
        this.strategy = strategy;
        this.policy = policy;
        this.key = key;
        this.update = update;
    }

    /**
     * Applies the insertion to the trie rooted at the given node (null for an empty trie) and returns the new root.
     */
    SequenceTrieNode<T> applyTo(SequenceTrieNode<T> root)
    {
        return root == null ? createTail(0) : apply(root, 0);
    }

    /**
     * Applies the insertion to the sibling chain starting at {@code first}, matching the key from {@code offset}.
     * Returns the node that replaces {@code first}.
     */
    private SequenceTrieNode<T> apply(SequenceTrieNode<T> first, int offset)
    {
        List<SequenceTrieNode<T>> passed = null;
        SequenceTrieNode<T> node = first;
        int prefix = IntSequences.commonPrefixLength(node.label, 0, key, offset);
        while (prefix == 0 && node.sibling != null)
        {
            if (passed == null)
                passed = new ArrayList<>();
            passed.add(node);
            node = node.sibling;
            prefix = IntSequences.commonPrefixLength(node.label, 0, key, offset);
        }

        SequenceTrieNode<T> replacement = prefix == 0
                                          ? strategy.update(node, node.label, node.value, node.child, createTail(offset))
                                          : applyMatching(node, prefix, offset);
        if (passed == null)
            return replacement;

        // relink the nodes before the changed one, stopping at the first that stays as it is
        SequenceTrieNode<T> current = node;
        for (int i = passed.size() - 1; i >= 0 && replacement != current; --i)
        {
            current = passed.get(i);
            replacement = strategy.update(current, current.label, current.value, current.child, replacement);
        }
        return current == first ? replacement : first;
    }

    /**
     * Applies the insertion to a node whose label shares the first {@code prefix} elements with the key tail.
     */
    private SequenceTrieNode<T> applyMatching(SequenceTrieNode<T> node, int prefix, int offset)
    {
        int[] label = node.label;
        T value = node.value;
        SequenceTrieNode<T> child = node.child;
        if (prefix < label.length)
        {
            if (logger.isTraceEnabled())
                logger.trace("Splitting {} after {} elements to insert {}", node, prefix, IntSequences.toString(key));
            child = strategy.create(Arrays.copyOfRange(label, prefix, label.length), value, child, null);
            label = Arrays.copyOf(label, prefix);
            value = policy.split(value);
        }

        int remaining = key.length - offset;
        if (prefix < remaining)
        {
            child = child == null ? createTail(offset + prefix) : apply(child, offset + prefix);
            value = policy.traverse(value, update);
        }
        else
        {
            assert prefix == remaining;
            value = policy.resolve(value, update);
        }

        return strategy.update(node, label, value, child, node.sibling);
    }

    private SequenceTrieNode<T> createTail(int offset)
    {
        if (offset >= key.length)
            throw new AssertionError("Cannot create a node for an empty key tail of " + IntSequences.toString(key));
        return strategy.create(Arrays.copyOfRange(key, offset, key.length), policy.create(update), null, null);
    }
}
