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
import java.util.function.BiConsumer;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.agrona.collections.IntArrayList;
import org.agrona.collections.IntHashSet;
import org.apache.seqtrie.config.SeqTrieRelevantProperties;
import org.apache.seqtrie.utils.IntSequences;

/**
 * Base class of the sequence tries, implementing the read operations shared by all of them.
 */
public abstract class CompressedTrie<T> implements SequenceTrie<T>
{
    private static final Logger logger = LoggerFactory.getLogger(CompressedTrie.class);

    static final boolean DEBUG = SeqTrieRelevantProperties.TRIE_DEBUG.getBoolean();

    @Override
    public SequenceTrieNode<T> find(int[] key)
    {
        Preconditions.checkNotNull(key, "key");
        SequenceTrieNode<T> node = root();
        int offset = 0;
        while (node != null)
        {
            int prefix = IntSequences.commonPrefixLength(node.label, 0, key, offset);
            if (prefix == 0)
            {
                node = node.sibling;
                continue;
            }
            // key diverges inside the label
            if (prefix < node.label.length)
                return null;

            offset += prefix;
            if (offset == key.length)
                return node;
            node = node.child;
        }
        return null;
    }

    @Override
    public void forEachEntry(BiConsumer<int[], T> consumer)
    {
        forEachEntry(root(), new IntArrayList(), consumer);
    }

    private static <T> void forEachEntry(SequenceTrieNode<T> node, IntArrayList path, BiConsumer<int[], T> consumer)
    {
        for (; node != null; node = node.sibling)
        {
            int depth = path.size();
            for (int element : node.label)
                path.addInt(element);
            if (node.value != null)
                consumer.accept(path.toIntArray(), node.value);
            forEachEntry(node.child, path, consumer);
            while (path.size() > depth)
                path.removeAt(path.size() - 1);
        }
    }

    @Override
    public List<T> values()
    {
        ImmutableList.Builder<T> builder = ImmutableList.builder();
        forEachEntry((path, value) -> builder.add(value));
        return builder.build();
    }

    @Override
    public int nodeCount()
    {
        return nodeCount(root());
    }

    private static int nodeCount(SequenceTrieNode<?> node)
    {
        int count = 0;
        for (; node != null; node = node.sibling)
            count += 1 + nodeCount(node.child);
        return count;
    }

    @Override
    public String dump(Function<T, String> contentToString)
    {
        if (isEmpty())
            return "<empty>\n";
        StringBuilder sb = new StringBuilder();
        dump(root(), 0, contentToString, sb);
        return sb.toString();
    }

    private static <T> void dump(SequenceTrieNode<T> node, int depth, Function<T, String> contentToString, StringBuilder sb)
    {
        for (; node != null; node = node.sibling)
        {
            for (int i = 0; i < depth; ++i)
                sb.append("  ");
            sb.append(IntSequences.toString(node.label));
            if (node.value != null)
                sb.append(" -> ").append(contentToString.apply(node.value));
            sb.append('\n');
            dump(node.child, depth + 1, contentToString, sb);
        }
    }

    /**
     * Checks the structural invariants of the trie: no node has an empty label, and no two labels in a sibling chain
     * share a common prefix.
     *
     * @throws AssertionError if an invariant is broken.
     */
    public void verify()
    {
        verify(root());
    }

    private static void verify(SequenceTrieNode<?> node)
    {
        IntHashSet firstElements = new IntHashSet();
        for (; node != null; node = node.sibling)
        {
            if (node.label.length == 0)
                throw new AssertionError("Node " + node.id + " has an empty label");
            if (!firstElements.add(node.label[0]))
                throw new AssertionError("Sibling chain has more than one label starting with " +
                                         Integer.toUnsignedString(node.label[0]) + ", at node " + node);
            verify(node.child);
        }
    }

    /**
     * Validates a key passed to an insertion.
     */
    static int[] checkKey(int[] key)
    {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkArgument(key.length > 0, "Cannot insert an empty key into a sequence trie");
        return key;
    }

    /**
     * To be called after every completed mutation.
     */
    void completeMutation(int[] key)
    {
        if (DEBUG)
        {
            verify();
            logger.debug("Trie after inserting {}:\n{}", IntSequences.toString(key), dump());
        }
    }

    @Override
    public String toString()
    {
        return dump();
    }
}
