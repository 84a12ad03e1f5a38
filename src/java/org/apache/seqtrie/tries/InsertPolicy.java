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

import com.google.common.base.Preconditions;

/**
 * Decides the values of the nodes touched by an insertion. The structural part of the insertion (matching, splitting
 * and linking nodes) is the same for all tries and is done by {@link TrieMutation}; the policy is consulted at every
 * node whose value may change:
 * <list>
 * <li> {@link #create} for a node created to hold the unmatched tail of the key;
 * <li> {@link #resolve} for the node whose path is exactly the inserted key;
 * <li> {@link #traverse} for every existing node whose path is a strict prefix of the inserted key;
 * <li> {@link #split} for a node whose label is shortened because the key diverges inside it. The old value of such
 *      a node always moves to the new child that takes the rest of the label; the result of this method is what the
 *      shortened node keeps before {@link #resolve} or {@link #traverse} is applied to it.
 * </list>
 *
 * @param <T> The content type of the trie.
 * @param <U> The type of the update being inserted.
 */
public interface InsertPolicy<T, U>
{
    T resolve(T existing, U update);

    default T create(U update)
    {
        return resolve(null, update);
    }

    default T traverse(T existing, U update)
    {
        return existing;
    }

    default T split(T existing)
    {
        return null;
    }

    /**
     * Map-like policy: the inserted value replaces any existing one, branching points carry no value.
     */
    static <T> InsertPolicy<T, T> overwrite()
    {
        return (existing, update) -> update;
    }

    /**
     * Policy combining the existing value of the exact match with the update using the given transformer. The
     * transformer is also used, with a null existing value, to produce the value of newly created nodes.
     */
    static <T, U> InsertPolicy<T, U> upsert(UpsertTransformer<T, U> transformer)
    {
        Preconditions.checkNotNull(transformer, "transformer");
        return transformer::apply;
    }

    /**
     * Counting policy: the update is an increment that is added to the count of every node on the insertion path.
     */
    static InsertPolicy<Integer, Integer> counting()
    {
        return Counting.INSTANCE;
    }

    /**
     * The count of a node is the number of insertions whose key passes through or ends at the node. Splitting a node
     * leaves the count of both halves unchanged, as every key that went through the full label also went through
     * its prefix.
     */
    enum Counting implements InsertPolicy<Integer, Integer>
    {
        INSTANCE;

        @Override
        public Integer create(Integer increment)
        {
            return increment;
        }

        @Override
        public Integer resolve(Integer existing, Integer increment)
        {
            if (existing == null)
                throw new AssertionError("Count may not be missing on a node of a counting trie");
            return Math.addExact(existing, increment);
        }

        @Override
        public Integer traverse(Integer existing, Integer increment)
        {
            return resolve(existing, increment);
        }

        @Override
        public Integer split(Integer existing)
        {
            return existing;
        }
    }
}
