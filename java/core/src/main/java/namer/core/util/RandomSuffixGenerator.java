/*
 * Copyright 2022-2025 Crown Copyright
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
package namer.core.util;

import java.util.Random;

/**
 * Generates the random part of resource names. The output depends only on the length and seed, so the same name can
 * be generated again from the same inputs.
 */
public class RandomSuffixGenerator {

    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz".toCharArray();

    private RandomSuffixGenerator() {
        // Prevents instantiation
    }

    /**
     * Generates a string of lowercase letters from a seed. Note that a seed of 0 is not treated specially here. Callers
     * that use 0 to mean that no seed was set must pick a seed themselves.
     *
     * @param  length the number of characters to generate, or 0 or less for an empty string
     * @param  seed   the seed for the random generator
     * @return        the random string
     */
    public static String randomSuffix(int length, long seed) {
        if (length <= 0) {
            return "";
        }
        Random random = new Random(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(chars);
    }
}
