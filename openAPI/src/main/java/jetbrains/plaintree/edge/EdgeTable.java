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

import org.jetbrains.annotations.NotNull;

/**
 * Prefixes and paddings for all positions of an item, computed once.
 */
final class EdgeTable {

    private static final String FIRST_LINE_PADDING = " ";
    private static final String PRECEDING_SUCCEEDING_PADDING = "   ";
    private static final String LAST_SUCCEEDING_PREFIX = "";

    @NotNull
    private final String precedingFirstPrefix;
    @NotNull
    private final String lastFirstPrefix;
    @NotNull
    private final String precedingSucceedingPrefix;
    @NotNull
    private final String lastSucceedingPadding;

    EdgeTable(@NotNull final String precedingFirstPrefix,
              @NotNull final String lastFirstPrefix,
              @NotNull final String precedingSucceedingPrefix,
              @NotNull final String lastSucceedingPadding) {
        this.precedingFirstPrefix = precedingFirstPrefix;
        this.lastFirstPrefix = lastFirstPrefix;
        this.precedingSucceedingPrefix = precedingSucceedingPrefix;
        this.lastSucceedingPadding = lastSucceedingPadding;
    }

    @NotNull
    String get(final boolean lastChild, final boolean firstLine, @NotNull final PrefixPart part) {
        if (firstLine) {
            if (part == PrefixPart.PADDING) {
                return FIRST_LINE_PADDING;
            }
            return lastChild ? lastFirstPrefix : precedingFirstPrefix;
        }
        if (lastChild) {
            return part == PrefixPart.PREFIX ? LAST_SUCCEEDING_PREFIX : lastSucceedingPadding;
        }
        return part == PrefixPart.PREFIX ? precedingSucceedingPrefix : PRECEDING_SUCCEEDING_PADDING;
    }
}
