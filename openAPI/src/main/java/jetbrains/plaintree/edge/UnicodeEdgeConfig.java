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
 * Edge config drawn with custom Unicode box drawing characters. Created by
 * {@linkplain UnicodeEdgeConfigBuilder#build()}.
 */
public final class UnicodeEdgeConfig implements EdgeConfig {

    @NotNull
    private final AmbiWidth ambiWidth;
    private final char precedingFirstFirst;
    private final char lastFirstFirst;
    private final char anyFirstSucceeding;
    private final char precedingSucceedingFirst;
    @NotNull
    private final EdgeTable table;

    UnicodeEdgeConfig(@NotNull final AmbiWidth ambiWidth,
                      final char precedingFirstFirst,
                      final char lastFirstFirst,
                      final char anyFirstSucceeding,
                      final char precedingSucceedingFirst) {
        this.ambiWidth = ambiWidth;
        this.precedingFirstFirst = precedingFirstFirst;
        this.lastFirstFirst = lastFirstFirst;
        this.anyFirstSucceeding = anyFirstSucceeding;
        this.precedingSucceedingFirst = precedingSucceedingFirst;
        // full width horizontal line fills two columns with a single character
        final String horizontalLine = ambiWidth == AmbiWidth.SINGLE ?
            new String(new char[]{anyFirstSucceeding, anyFirstSucceeding}) : String.valueOf(anyFirstSucceeding);
        table = new EdgeTable(
            precedingFirstFirst + horizontalLine,
            lastFirstFirst + horizontalLine,
            String.valueOf(precedingSucceedingFirst),
            ambiWidth == AmbiWidth.SINGLE ? "    " : "     ");
    }

    @NotNull
    public AmbiWidth getAmbiWidth() {
        return ambiWidth;
    }

    /**
     * @return the junction in the first line of a non-last item
     */
    public char getPrecedingFirstFirst() {
        return precedingFirstFirst;
    }

    /**
     * @return the corner in the first line of the last item
     */
    public char getLastFirstFirst() {
        return lastFirstFirst;
    }

    /**
     * @return the horizontal line following the junction or the corner
     */
    public char getAnyFirstSucceeding() {
        return anyFirstSucceeding;
    }

    /**
     * @return the vertical line in succeeding lines of a non-last item
     */
    public char getPrecedingSucceedingFirst() {
        return precedingSucceedingFirst;
    }

    @NotNull
    @Override
    public String getEdge(final boolean lastChild, final boolean firstLine, @NotNull final PrefixPart part) {
        return table.get(lastChild, firstLine, part);
    }

    @Override
    public String toString() {
        return "UnicodeEdgeConfig{" + getEdge(false, true, PrefixPart.PREFIX) + ", " +
            getEdge(true, true, PrefixPart.PREFIX) + ", " + ambiWidth + '}';
    }
}
