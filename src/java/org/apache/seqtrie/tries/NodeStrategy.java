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

import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.agrona.collections.IntHashSet;

/**
 * Node production strategy for sequence tries. Controls whether a mutation changes the nodes it walks through or
 * builds new ones, leaving the originals to any other trie that references them.
 */
public interface NodeStrategy<T>
{
    /**
     * Creates a new node with the given content. The label must not be empty.
     */
    SequenceTrieNode<T> create(int[] label, T value, SequenceTrieNode<T> child, SequenceTrieNode<T> sibling);

    /**
     * Returns a node with the given content that replaces {@code node} in the trie being mutated. The returned node
     * may be the given one, changed in place.
     */
    SequenceTrieNode<T> update(SequenceTrieNode<T> node,
                               int[] label,
                               T value,
                               SequenceTrieNode<T> child,
                               SequenceTrieNode<T> sibling);

    /**
     * Strategy for tries that are exclusively owned by their writer: nodes are modified where they are.
     */
    class InPlace<T> implements NodeStrategy<T>
    {
        private int nextId = 0;

        @Override
        public SequenceTrieNode<T> create(int[] label, T value, SequenceTrieNode<T> child, SequenceTrieNode<T> sibling)
        {
            return new SequenceTrieNode<>(nextId++, label, value, child, sibling);
        }

        @Override
        public SequenceTrieNode<T> update(SequenceTrieNode<T> node,
                                          int[] label,
                                          T value,
                                          SequenceTrieNode<T> child,
                                          SequenceTrieNode<T> sibling)
        {
            assert label.length > 0 : "Trie nodes cannot have an empty label";
            node.label = label;
            node.value = value;
            node.child = child;
            node.sibling = sibling;
            return node;
        }
    }

    /**
     * Path-copying strategy for persistent tries. Nodes that existed before the mutation are never changed; each one
     * that needs to change is replaced by a new node, and everything not on the mutation path stays shared. Nodes
     * created by this same mutation are not visible to anyone else yet and are updated in place.
     * <p>
     * The strategy also maintains the element index of the resulting trie: created nodes are registered under all
     * elements of their label, replaced ones are removed.
     */
    class CopyOnWrite<T> implements NodeStrategy<T>
    {
        private static final Logger logger = LoggerFactory.getLogger(CopyOnWrite.class);

        private final AtomicInteger nodeIds;
        private final ElementIndex.Builder<T> index;
        private final IntHashSet created = new IntHashSet();

        CopyOnWrite(AtomicInteger nodeIds, ElementIndex<T> index)
        {
            this.nodeIds = nodeIds;
            this.index = index.builder();
        }

        @Override
        public SequenceTrieNode<T> create(int[] label, T value, SequenceTrieNode<T> child, SequenceTrieNode<T> sibling)
        {
            SequenceTrieNode<T> node = new SequenceTrieNode<>(nodeIds.getAndIncrement(), label, value, child, sibling);
            created.add(node.id);
            index.add(node);
            return node;
        }

        @Override
        public SequenceTrieNode<T> update(SequenceTrieNode<T> node,
                                          int[] label,
                                          T value,
                                          SequenceTrieNode<T> child,
                                          SequenceTrieNode<T> sibling)
        {
            if (label == node.label && value == node.value && child == node.child && sibling == node.sibling)
                return node;

            if (created.contains(node.id))
            {
                if (label != node.label)
                {
                    index.remove(node);
                    node.label = label;
                    index.add(node);
                }
                node.value = value;
                node.child = child;
                node.sibling = sibling;
                return node;
            }

            index.remove(node);
            SequenceTrieNode<T> copy = create(label, value, child, sibling);
            if (logger.isTraceEnabled())
                logger.trace("Replaced node {} (id {}) with {} (id {})", node, node.id, copy, copy.id);
            return copy;
        }

        /**
         * Returns the element index of the trie produced by the mutation. Must be called once, after the mutation
         * has completed.
         */
        ElementIndex<T> index()
        {
            return index.build();
        }
    }
}
