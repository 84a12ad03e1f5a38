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

/**
 * Encapsulates logic to be applied whenever new content is being upserted into a sequence trie. It is applied no
 * matter if there's pre-existing content for the key or not.
 *
 * @param <T> The content type of the trie.
 * @param <U> The type of the new content being applied to the trie.
 */
@FunctionalInterface
public interface UpsertTransformer<T, U>
{
    /**
     * Called when the insertion reaches the node matching its key exactly.
     *
     * @param existing Existing content for this key, or null if there isn't any.
     * @param update   The update, always non-null.
     * @return The combined value to use.
     */
    T apply(T existing, U update);
}
