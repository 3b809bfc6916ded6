/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.scan.core.cache;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * SHA-256 отпечаток всего содержимого входа.
 *
 * Хеш зависит только от последовательности байтов, а не от того, как она разбита на чанки.
 * Строковая форма - 64 шестнадцатеричных символа в нижнем регистре; она же служит ключом кэша.
 */
public final class ContentDigest {

    public static final String ALGORITHM = "SHA-256";
    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();
    private static final Pattern HEX_KEY = Pattern.compile("[0-9a-f]{" + (LENGTH * 2) + "}");

    private final byte[] value;

    private ContentDigest(byte[] value) {
        this.value = value;
    }

    /**
     * Накопитель хеша, обновляемый по мере чтения чанков.
     */
    public static final class Accumulator {

        private final MessageDigest digest = newMessageDigest();
        private long bytes;

        public Accumulator update(byte[] chunk) {
            return update(chunk, 0, chunk.length);
        }

        public Accumulator update(byte[] chunk, int offset, int length) {
            digest.update(chunk, offset, length);
            bytes += length;
            return this;
        }

        public long bytes() {
            return bytes;
        }

        /**
         * Завершает вычисление. Накопитель после этого сбрасывается.
         */
        public ContentDigest finish() {
            return new ContentDigest(digest.digest());
        }
    }

    public static Accumulator accumulator() {
        return new Accumulator();
    }

    public static ContentDigest of(byte[] content) {
        return accumulator().update(content).finish();
    }

    /**
     * Хеширует поток целиком, читая его чанками заданного размера. Поток не закрывается.
     */
    public static ContentDigest of(InputStream input, int chunkSize) throws IOException {
        Accumulator acc = accumulator();
        byte[] buffer = new byte[chunkSize];
        int read;
        while ((read = input.read(buffer)) != -1) {
            acc.update(buffer, 0, read);
        }
        return acc.finish();
    }

    /**
     * Разбирает ключ кэша.
     *
     * @throws IllegalArgumentException если строка не является 64-символьным hex.
     */
    public static ContentDigest fromHex(String hex) {
        if (!isValidHex(hex)) {
            throw new IllegalArgumentException("Not a " + ALGORITHM + " hex digest: " + hex);
        }
        return new ContentDigest(HEX.parseHex(hex));
    }

    public static boolean isValidHex(String hex) {
        return hex != null && HEX_KEY.matcher(hex).matches();
    }

    public String hex() {
        return HEX.formatHex(value);
    }

    public byte[] bytes() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ContentDigest other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return hex();
    }

    private static MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " digest unavailable", e);
        }
    }
}
