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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The kinds of component that make up a generated name. A precedence list of these sets which components are kept
 * first when the name would be too long.
 */
public enum NameComponent {
    NAME("name"),
    SLUG("slug"),
    RANDOM("random"),
    SUFFIXES("suffixes"),
    PREFIXES("prefixes");

    /**
     * The precedence used when generating names for a request: the name is kept over everything else, and prefixes are
     * the first to be dropped.
     */
    public static final List<NameComponent> DEFAULT_PRECEDENCE = List.of(NAME, SLUG, RANDOM, SUFFIXES, PREFIXES);

    private final String tag;

    NameComponent(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Finds the component for a tag in a precedence list.
     *
     * @param  tag the tag, e.g. "name" or "suffixes"
     * @return     the component
     */
    public static NameComponent fromTag(String tag) {
        for (NameComponent component : values()) {
            if (component.tag.equals(tag)) {
                return component;
            }
        }
        throw new IllegalArgumentException("Unrecognised name component: " + tag);
    }

    /**
     * Reads a precedence list from tags.
     *
     * @param  tags the tags in order of precedence
     * @return      the components in order of precedence
     */
    public static List<NameComponent> parsePrecedence(List<String> tags) {
        Objects.requireNonNull(tags, "tags must not be null");
        return tags.stream()
                .map(NameComponent::fromTag)
                .collect(Collectors.toUnmodifiableList());
    }
}
