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

/**
 * Read interface of compressed tries keyed by sequences of unsigned 32-bit integers.
 * <p>
 * Keys are stored along paths of nodes whose labels hold runs of key elements shared by every key passing through
 * them. Lookups are exact: a key matches only if it ends exactly at the end of a node's label. Keys are passed as
 * {@code int[]}; the arrays are never retained or modified by the trie.
 * <p>
 * See {@link InMemorySequenceTrie} for the mutable implementation and {@link PersistentSequenceTrie} for the
 * snapshot-producing one.
 *
 * @param <T> The content type of the trie.
 */
public interface SequenceTrie<T>
{
    /**
     * The first node of the top-level sibling chain, or null if the trie is empty.
     */
    SequenceTrieNode<T> root();

    default boolean isEmpty()
    {
        return root() == null;
    }

    /**
     * Returns the node whose path from the root is exactly the given key, or null if there is no such node. The
     * returned node may carry no value if it is only a branching point. The empty key never matches.
     */
    SequenceTrieNode<T> find(int[] key);

    /**
     * Returns the value stored for the given key, or null if the key is not present.
     */
    default T get(int[] key)
    {
        SequenceTrieNode<T> node = find(key);
        return node == null ? null : node.value();
    }

    default boolean contains(int[] key)
    {
        return get(key) != null;
    }

    /**
     * Call the given consumer on all (path, value) pairs with non-null value in the trie, depth-first, visiting the
     * children of a node before its siblings. The path array is a fresh copy for every call.
     */
    void forEachEntry(BiConsumer<int[], T> consumer);

    /**
     * Returns the values of the trie in the order of {@link #forEachEntry}.
     */
    List<T> values();

    int nodeCount();

    /**
     * Constructs a textual representation of the trie using the given content-to-string mapper.
     */
    String dump(Function<T, String> contentToString);

    default String dump()
    {
        return dump(value -> String.valueOf(value));
    }
}
