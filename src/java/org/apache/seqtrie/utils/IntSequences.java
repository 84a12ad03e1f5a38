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
package org.apache.seqtrie.utils;

/**
 * Helpers for the integer sequences used as trie keys. Elements are unsigned 32-bit values stored in {@code int}s;
 * only equality is used to compare them, so the sign bit needs no special treatment except when printing.
 */
public final class IntSequences
{
    private IntSequences()
    {
    }

    /**
     * Returns the length of the longest common prefix of {@code a[aOffset:]} and {@code b[bOffset:]}.
     */
    public static int commonPrefixLength(int[] a, int aOffset, int[] b, int bOffset)
    {
        int limit = Math.min(a.length - aOffset, b.length - bOffset);
        int i = 0;
        while (i < limit && a[aOffset + i] == b[bOffset + i])
            ++i;
        return i;
    }

    public static int commonPrefixLength(int[] a, int[] b)
    {
        return commonPrefixLength(a, 0, b, 0);
    }

    public static String toString(int[] sequence)
    {
        return toString(sequence, 0, sequence.length);
    }

    /**
     * Formats {@code sequence[from:to]} as a list of unsigned values, e.g. {@code [3, 137, 4294967295]}.
     */
    public static String toString(int[] sequence, int from, int to)
    {
        StringBuilder sb = new StringBuilder("[");
        for (int i = from; i < to; ++i)
        {
            if (i > from)
                sb.append(", ");
            sb.append(Integer.toUnsignedString(sequence[i]));
        }
        return sb.append(']').toString();
    }
}
