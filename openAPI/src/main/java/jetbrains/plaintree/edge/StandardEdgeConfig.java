/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package jetbrains.plaintree.edge;

import jetbrains.plaintree.InvalidSettingException;
import org.jetbrains.annotations.NotNull;

/**
 * Predefined edge configs, the same as the UNIX {@code tree} command draws.
 */
public enum StandardEdgeConfig implements EdgeConfig {

    /**
     * The {@code tree} command's style with {@code LANG=C}:
     * <pre>
     * .
     * |-- foo
     * |   |-- bar
     * |   |   `-- baz
     * |   |
     * |   |       baz2
     * |   `-- qux
     * |       `-- quux
     * |-- corge
     * `-- grault
     * </pre>
     */
    ASCII("ascii", new EdgeTable("|--", "`--", "|", "    ")),

    /**
     * The {@code tree} command's style with UTF-8 locale, assumes ruled lines are half width. CJK fonts
     * usually have full width ruled lines, consider {@linkplain #UNICODE_DOUBLE_WIDTH} for them.
     * <pre>
     * .
     * ├── foo
     * │   ├── bar
     * │   │   └── baz
     * │   │
     * │   │       baz2
     * │   └── qux
     * │       └── quux
     * ├── corge
     * └── grault
     * </pre>
     */
    UNICODE_SINGLE_WIDTH("unicode", new EdgeTable("\u251c\u2500\u2500", "\u2514\u2500\u2500", "\u2502", "    ")),

    /**
     * Assumes ruled lines are full width. A single indentation level is 5 columns wide, not 4.
     * <pre>
     * .
     * ├─ foo
     * │   ├─ bar
     * │   │   └─ baz
     * │   │
     * │   │        baz2
     * │   └─ qux
     * │        └─ quux
     * ├─ corge
     * └─ grault
     * </pre>
     */
    UNICODE_DOUBLE_WIDTH("unicode-wide", new EdgeTable("\u251c\u2500", "\u2514\u2500", "\u2502", "     "));

    @NotNull
    private final String name;
    @NotNull
    private final EdgeTable table;

    StandardEdgeConfig(@NotNull final String name, @NotNull final EdgeTable table) {
        this.name = name;
        this.table = table;
    }

    /**
     * @return user-facing name of the config, accepted by {@linkplain #forName(String)}
     */
    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    @Override
    public String getEdge(final boolean lastChild, final boolean firstLine, @NotNull final PrefixPart part) {
        return table.get(lastChild, firstLine, part);
    }

    @NotNull
    public static StandardEdgeConfig forName(@NotNull final String name) {
        for (final StandardEdgeConfig config : values()) {
            if (config.name.equalsIgnoreCase(name.trim())) {
                return config;
            }
        }
        throw new InvalidSettingException("Unknown edge config: " + name);
    }
}
