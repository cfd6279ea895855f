/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.tagtree.core.model;

import org.opensearch.common.hash.MurmurHash3;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * ByteLabels is the canonical {@link Labels} implementation. Pairs are sorted by name and stored in a flat byte array, so two label sets
 * with the same pairs supplied in any order have identical bytes, identical hashes and compare equal.
 *
 * <h2>Encoding Format</h2>
 * <pre>
 * [name1_len][name1_bytes][value1_len][value1_bytes][name2_len][name2_bytes]...
 * </pre>
 *
 * <h2>Length Encoding</h2>
 * <ul>
 * <li><strong>Short strings (0-254 bytes):</strong> 1 byte containing the length directly</li>
 * <li><strong>Long strings (255+ bytes):</strong> 4 bytes total - first byte is 255 (marker),
 *     followed by 3 bytes containing the actual length in little-endian format (max 16MB)</li>
 * </ul>
 */
public class ByteLabels implements Labels {
    private final byte[] data;

    private long hash = Long.MIN_VALUE;

    private static final ByteLabels EMPTY = new ByteLabels(new byte[0]);

    private static final String EMPTY_STRING = "";
    private static final char SPACE_SEPARATOR = ' ';
    private static final char COLON_SEPARATOR = ':';
    private static final int LONG_LENGTH_MARKER = 255;
    private static final int MAX_STRING_LENGTH = 0xFFFFFF;

    /** ThreadLocal cache for TreeMap instances to reduce object allocation during label creation. */
    private static final ThreadLocal<TreeMap<String, String>> TREE_MAP_CACHE = ThreadLocal.withInitial(TreeMap::new);

    private ByteLabels(byte[] data) {
        this.data = data;
    }

    /**
     * Creates a ByteLabels instance from an array of alternating name-value strings.
     *
     * @param labels an array where even indices are names and odd indices are values
     *               (e.g., "name1", "value1", "name2", "value2")
     * @return a new ByteLabels instance with the given labels
     * @throws IllegalArgumentException if the array length is odd, a name is empty, or a name appears more than once
     */
    public static ByteLabels fromStrings(String... labels) {
        if (labels.length % 2 != 0) {
            throw new IllegalArgumentException("Labels must be in pairs");
        }

        TreeMap<String, String> sorted = TREE_MAP_CACHE.get();
        sorted.clear();
        for (int i = 0; i < labels.length; i += 2) {
            putUnique(sorted, labels[i], labels[i + 1]);
        }

        return encodeLabels(sorted);
    }

    /**
     * Creates a ByteLabels instance from a collection of labels.
     *
     * @param labels the labels, in any order
     * @return a new ByteLabels instance sorted by name
     * @throws IllegalArgumentException if a name appears more than once
     */
    public static ByteLabels fromLabels(Collection<Label> labels) {
        TreeMap<String, String> sorted = TREE_MAP_CACHE.get();
        sorted.clear();
        for (Label label : labels) {
            putUnique(sorted, label.name(), label.value());
        }
        return encodeLabels(sorted);
    }

    /**
     * Creates a ByteLabels instance from a map of label names to values.
     *
     * @param labelMap a map containing label names as keys and label values as values
     * @return a new ByteLabels instance with the given labels, sorted by name
     */
    public static ByteLabels fromMap(Map<String, String> labelMap) {
        TreeMap<String, String> sorted = TREE_MAP_CACHE.get();
        sorted.clear();
        for (Map.Entry<String, String> entry : labelMap.entrySet()) {
            putUnique(sorted, entry.getKey(), entry.getValue());
        }
        return encodeLabels(sorted);
    }

    /**
     * Returns a shared empty ByteLabels instance.
     *
     * @return an empty ByteLabels instance
     */
    public static ByteLabels emptyLabels() {
        return EMPTY;
    }

    /**
     * Converts any {@link Labels} implementation to the canonical encoding.
     *
     * @param labels labels to convert
     * @return the same instance if already canonical, otherwise an encoded copy
     */
    public static ByteLabels canonical(Labels labels) {
        if (labels instanceof ByteLabels byteLabels) {
            return byteLabels;
        }
        return fromMap(labels.toMapView());
    }

    private static void putUnique(TreeMap<String, String> sorted, String name, String value) {
        // validates name and value
        Label label = new Label(name, value);
        if (sorted.put(label.name(), label.value()) != null) {
            throw new IllegalArgumentException("Duplicate label name: " + name);
        }
    }

    private static ByteLabels encodeLabels(TreeMap<String, String> labels) {
        if (labels.isEmpty()) {
            return EMPTY;
        }

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            appendEncodedString(baos, entry.getKey());
            appendEncodedString(baos, entry.getValue());
        }
        labels.clear();
        return new ByteLabels(baos.toByteArray());
    }

    /**
     * Encodes a string using variable-length encoding and appends it to the output stream.
     *
     * @param baos the output stream to append to
     * @param str the string to encode
     * @throws IllegalArgumentException if the string exceeds 16MB (0xFFFFFF bytes)
     */
    private static void appendEncodedString(ByteArrayOutputStream baos, String str) {
        byte[] strBytes = str.getBytes(StandardCharsets.UTF_8);
        int length = strBytes.length;

        if (length < LONG_LENGTH_MARKER) {
            baos.write(length);
        } else if (length <= MAX_STRING_LENGTH) {
            baos.write(LONG_LENGTH_MARKER);
            baos.write(length & 0xFF);
            baos.write((length >> 8) & 0xFF);
            baos.write((length >> 16) & 0xFF);
        } else {
            throw new IllegalArgumentException("String too long: " + length);
        }
        baos.write(strBytes, 0, length);
    }

    /**
     * Parses string length information without decoding the actual string content.
     *
     * @param data the byte array containing encoded data
     * @param pos the position to parse from
     * @return a StringPosition containing the length, data start position, and next position
     */
    private static StringPosition parseStringPos(byte[] data, int pos) {
        int length, nextPos = pos + 1;
        int firstByte = data[pos] & 0xFF;
        if (firstByte == LONG_LENGTH_MARKER) {
            length = (data[pos + 1] & 0xFF) | ((data[pos + 2] & 0xFF) << 8) | ((data[pos + 3] & 0xFF) << 16);
            nextPos = pos + 4;
        } else {
            length = firstByte;
        }

        return new StringPosition(length, nextPos, nextPos + length);
    }

    private static String decode(byte[] data, StringPosition position) {
        return new String(data, position.dataStart(), position.length(), StandardCharsets.UTF_8);
    }

    /**
     * Compares a portion of the data array with a target byte array lexicographically.
     * This avoids string creation during label lookups.
     *
     * @param data the source byte array
     * @param pos the starting position in the source array
     * @param len the length of data to compare
     * @param target the target byte array to compare against
     * @return negative if data &lt; target, zero if equal, positive if data &gt; target
     */
    private static int compareBytes(byte[] data, int pos, int len, byte[] target) {
        int minLen = Math.min(len, target.length);
        for (int i = 0; i < minLen; i++) {
            int diff = (data[pos + i] & 0xFF) - (target[i] & 0xFF);
            if (diff != 0) return diff;
        }
        return len - target.length;
    }

    /**
     * Record representing the position information for a string in the byte array.
     *
     * @param length the decoded length of the string in bytes
     * @param dataStart the position where the string data begins
     * @param nextPos the position after the string data ends
     */
    private record StringPosition(int length, int dataStart, int nextPos) {
    }

    @Override
    public void forEach(BiConsumer<String, String> consumer) {
        int pos = 0;
        while (pos < data.length) {
            StringPosition namePos = parseStringPos(data, pos);
            StringPosition valuePos = parseStringPos(data, namePos.nextPos());
            pos = valuePos.nextPos();
            consumer.accept(decode(data, namePos), decode(data, valuePos));
        }
    }

    @Override
    public String toKeyValueString() {
        if (data.length == 0) return EMPTY_STRING;

        StringBuilder sb = new StringBuilder();
        forEach((name, value) -> {
            if (sb.length() > 0) sb.append(SPACE_SEPARATOR);
            sb.append(name).append(COLON_SEPARATOR).append(value);
        });
        return sb.toString();
    }

    @Override
    public Map<String, String> toMapView() {
        LinkedHashMap<String, String> result = new LinkedHashMap<>();
        forEach(result::put);
        return Collections.unmodifiableMap(result);
    }

    @Override
    public List<Label> toLabelList() {
        List<Label> result = new ArrayList<>();
        forEach((name, value) -> result.add(new Label(name, value)));
        return result;
    }

    @Override
    public boolean isEmpty() {
        return data.length == 0;
    }

    @Override
    public int size() {
        int count = 0;
        int pos = 0;
        while (pos < data.length) {
            StringPosition namePos = parseStringPos(data, pos);
            pos = parseStringPos(data, namePos.nextPos()).nextPos();
            count++;
        }
        return count;
    }

    @Override
    public String get(String name) {
        StringPosition valuePos = findValue(name);
        return valuePos == null ? EMPTY_STRING : decode(data, valuePos);
    }

    @Override
    public boolean has(String name) {
        return findValue(name) != null;
    }

    private StringPosition findValue(String name) {
        if (name == null || name.isEmpty()) return null;

        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        int pos = 0;

        while (pos < data.length) {
            StringPosition namePos = parseStringPos(data, pos);
            StringPosition valuePos = parseStringPos(data, namePos.nextPos());
            pos = valuePos.nextPos();

            int cmp = compareBytes(data, namePos.dataStart(), namePos.length(), nameBytes);
            if (cmp == 0) {
                return valuePos;
            }
        }
        return null;
    }

    @Override
    public long stableHash() {
        if (hash != Long.MIN_VALUE) return hash;

        hash = MurmurHash3.hash128(data, 0, data.length, 0, new MurmurHash3.Hash128()).hashCode();
        return hash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteLabels other)) return false;
        return Arrays.equals(this.data, other.data);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(stableHash());
    }

    @Override
    public String toString() {
        return toKeyValueString();
    }
}
