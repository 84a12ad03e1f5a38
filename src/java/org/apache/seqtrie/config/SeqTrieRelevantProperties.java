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
package org.apache.seqtrie.config;

/**
 * System properties that control the behaviour of the sequence tries. Values are read from the JVM system
 * properties ({@code -Dkey=value}) and fall back to the default given with each constant.
 */
public enum SeqTrieRelevantProperties
{
    /** Verify the trie invariants after every mutation and log the resulting trie at debug level. */
    TRIE_DEBUG("seqtrie.trie.debug", "false"),

    /** Initial capacity of the per-element buckets of the element index of persistent tries. */
    INDEX_BUCKET_INITIAL_CAPACITY("seqtrie.trie.index_bucket_capacity", "8");

    SeqTrieRelevantProperties(String key, String defaultVal)
    {
        this.key = key;
        this.defaultVal = defaultVal;
    }

    private final String key;
    private final String defaultVal;

    public String getKey()
    {
        return key;
    }

    public String getDefaultValue()
    {
        return defaultVal;
    }

    /**
     * Gets the value of the system property, or the default if it is not set.
     */
    public String getString()
    {
        String value = System.getProperty(key);
        return value == null ? defaultVal : value;
    }

    public boolean getBoolean()
    {
        return Boolean.parseBoolean(getString());
    }

    public int getInt()
    {
        String value = getString();
        try
        {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException(String.format("Invalid value for system property %s: expected integer value but got '%s'",
                                                             key, value), e);
        }
    }

    /**
     * Gets the value of an integer system property, or the given override if it is not set.
     */
    public int getInt(int overrideDefaultValue)
    {
        return System.getProperty(key) == null ? overrideDefaultValue : getInt();
    }

    public void setBoolean(boolean value)
    {
        System.setProperty(key, Boolean.toString(value));
    }

    public void setInt(int value)
    {
        System.setProperty(key, Integer.toString(value));
    }

    public void clearValue()
    {
        System.clearProperty(key);
    }
}
