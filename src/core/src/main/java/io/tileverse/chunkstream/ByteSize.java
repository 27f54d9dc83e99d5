/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chunkstream;

import java.util.Locale;

/**
 * 1024-based byte size constants, convenient for configuring buffer sizes.
 */
public final class ByteSize {

    /** One byte. */
    public static final int B = 1;

    /** One kibibyte (1024 bytes). */
    public static final int KB = 1024 * B;

    /** One mebibyte (1024 KB). */
    public static final int MB = 1024 * KB;

    /** One gibibyte (1024 MB). */
    public static final int GB = 1024 * MB;

    private ByteSize() {}

    /**
     * Parses a byte size such as {@code "4096"}, {@code "64KB"}, {@code "1 MB"} or {@code "2g"}.
     * <p>
     * Units are case insensitive, the trailing {@code B} is optional and all units are
     * 1024-based.
     *
     * @param value the text to parse
     * @return the number of bytes
     * @throws IllegalArgumentException if the value can't be parsed, is negative or does not fit in an {@code int}
     */
    public static int parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Byte size cannot be empty");
        }
        String text = value.trim().toUpperCase(Locale.ROOT);
        if (text.endsWith("B")) {
            text = text.substring(0, text.length() - 1);
        }
        long multiplier = B;
        if (!text.isEmpty()) {
            switch (text.charAt(text.length() - 1)) {
                case 'K' -> multiplier = KB;
                case 'M' -> multiplier = MB;
                case 'G' -> multiplier = GB;
                default -> multiplier = B;
            }
            if (multiplier != B) {
                text = text.substring(0, text.length() - 1);
            }
        }
        text = text.trim();
        try {
            long amount = Long.parseLong(text);
            if (amount < 0) {
                throw new IllegalArgumentException("Byte size cannot be negative: " + value);
            }
            return Math.toIntExact(Math.multiplyExact(amount, multiplier));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid byte size: " + value, e);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Byte size too large: " + value, e);
        }
    }
}
