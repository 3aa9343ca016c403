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

import java.io.IOException;

/**
 * Edge config defines characters drawn before the content of a tree item at its depth. For each line
 * of the item, a {@linkplain PrefixPart#PREFIX prefix} and a {@linkplain PrefixPart#PADDING padding}
 * are drawn. They depend on whether the item is the last child of its parent and on whether the line
 * is the first line of the item:
 * <pre>
 * .
 * |-- foo      &lt;- first line of non-last item: prefix "|--", padding " "
 * |   foo2     &lt;- succeeding line of non-last item: prefix "|", padding "   "
 * `-- bar      &lt;- first line of last item: prefix "`--", padding " "
 *     bar2     &lt;- succeeding line of last item: prefix "", padding "    "
 * </pre>
 * Implementations are immutable, so the same arguments always produce the same characters.
 *
 * @see StandardEdgeConfig
 * @see UnicodeEdgeConfigBuilder
 */
public interface EdgeConfig {

    /**
     * @return characters to draw for the item at the specified position
     */
    @NotNull
    String getEdge(boolean lastChild, boolean firstLine, @NotNull PrefixPart part);

    default void writeEdge(@NotNull final Appendable out,
                           final boolean lastChild,
                           final boolean firstLine,
                           @NotNull final PrefixPart part) throws IOException {
        out.append(getEdge(lastChild, firstLine, part));
    }

    /**
     * Returns {@code true} if both prefix and padding at the specified position consist of whitespaces
     * only. Empty string is considered whitespace. Only a succeeding line of the last child has no
     * vertical line, this holds as long as no visible glyph renders blank.
     */
    default boolean isPrefixWhitespace(final boolean lastChild, final boolean firstLine) {
        return lastChild && !firstLine;
    }
}
