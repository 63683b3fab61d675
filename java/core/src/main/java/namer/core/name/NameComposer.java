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
package namer.core.name;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Assembles a name from its components within a maximum length. Components are admitted in order of precedence, and
 * each is either kept whole or dropped. A component that does not fit is skipped, but later components are still
 * tried.
 * <p>
 * Each component has a fixed position regardless of precedence: the slug and prefixes go at the front, the name,
 * random suffix and suffixes go at the end. Prefixes are admitted from last to first and suffixes from first to last,
 * so the order of each list is preserved in the output.
 */
public class NameComposer {

    private NameComposer() {
        // Prevents instantiation
    }

    /**
     * Assembles a name from its components. The result is never longer than the maximum length.
     *
     * @param  request the components and constraints
     * @return         the components that fit, joined by the separator
     */
    public static String compose(CompositionRequest request) {
        NameParts parts = new NameParts(request.getSeparator(), request.getMaxLength());
        Deque<String> prefixes = new ArrayDeque<>(request.getPrefixes());
        Deque<String> suffixes = new ArrayDeque<>(request.getSuffixes());
        for (NameComponent component : request.getPrecedence()) {
            switch (component) {
                case NAME:
                    parts.addLast(request.getName());
                    break;
                case SLUG:
                    parts.addFirst(request.getSlug());
                    break;
                case RANDOM:
                    parts.addLast(request.getRandomSuffix());
                    break;
                case SUFFIXES:
                    while (!suffixes.isEmpty()) {
                        parts.addLast(suffixes.removeFirst());
                    }
                    break;
                case PREFIXES:
                    while (!prefixes.isEmpty()) {
                        parts.addFirst(prefixes.removeLast());
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Unrecognised name component: " + component);
            }
        }
        return parts.join();
    }

    /**
     * The components admitted so far, and their length when joined.
     */
    private static class NameParts {
        private final Deque<String> contents = new ArrayDeque<>();
        private final String separator;
        private final int maxLength;
        private int currentLength;

        NameParts(String separator, int maxLength) {
            this.separator = separator;
            this.maxLength = maxLength;
        }

        void addFirst(String part) {
            if (admit(part)) {
                contents.addFirst(part);
            }
        }

        void addLast(String part) {
            if (admit(part)) {
                contents.addLast(part);
            }
        }

        private boolean admit(String part) {
            if (part == null || part.isEmpty()) {
                return false;
            }
            int newLength = currentLength + part.length() + separatorLength();
            if (newLength > maxLength) {
                return false;
            }
            currentLength = newLength;
            return true;
        }

        private int separatorLength() {
            if (contents.isEmpty()) {
                return 0;
            }
            return separator.length();
        }

        String join() {
            return String.join(separator, contents);
        }
    }
}
