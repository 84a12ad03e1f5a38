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

import org.apache.seqtrie.utils.IntSequences;

/**
 * A node of a compressed sequence trie, i.e. one edge of the trie together with the node it leads to.
 * <p>
 * The node stores the compressed segment of key elements on the edge (its label), an optional value, and two links:
 * {@code child}, the first of the edges that extend the path ending in this node, and {@code sibling}, the next
 * alternative edge at the same branching point. Arbitrary branching is thus represented as a binary
 * left-child, right-sibling tree. Labels in one sibling chain never share a first element.
 * <p>
 * Nodes are only modified by the {@link NodeStrategy} of the trie that owns them; callers get read-only access.
 * Nodes of persistent tries are never modified after the append that created them has completed.
 *
 * @param <T> The content type of the trie.
 */
public final class SequenceTrieNode<T>
{
    final int id;
    int[] label;
    T value;
    SequenceTrieNode<T> child;
    SequenceTrieNode<T> sibling;

    SequenceTrieNode(int id, int[] label, T value, SequenceTrieNode<T> child, SequenceTrieNode<T> sibling)
    {
        if (label.length == 0)
            throw new AssertionError("Trie nodes cannot have an empty label");
        this.id = id;
        this.label = label;
        this.value = value;
        this.child = child;
        this.sibling = sibling;
    }

    /**
     * Identity of the node, unique among the nodes created by one trie (or, for persistent tries, by all snapshots
     * derived from the same empty trie). Unrelated to the content of the node.
     */
    public int id()
    {
        return id;
    }

    /**
     * Returns a copy of the compressed segment stored on this node.
     */
    public int[] label()
    {
        return label.clone();
    }

    public int labelLength()
    {
        return label.length;
    }

    public int labelAt(int index)
    {
        return label[index];
    }

    /**
     * The value associated with the path ending in this node, or null if the node is only a branching point.
     */
    public T value()
    {
        return value;
    }

    public SequenceTrieNode<T> child()
    {
        return child;
    }

    public SequenceTrieNode<T> sibling()
    {
        return sibling;
    }

    @Override
    public String toString()
    {
        String labelString = IntSequences.toString(label);
        return value == null ? labelString : labelString + " -> " + value;
    }
}
