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
package jetbrains.plaintree.printer;

import jetbrains.plaintree.edge.EdgeConfig;
import jetbrains.plaintree.edge.PrefixPart;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;

/**
 * Decoration state of a single open item, one per depth of the {@linkplain ItemWriter}'s stack.
 */
public class ItemWriterState {

    private final boolean lastChild;
    @NotNull
    private final EdgeConfig edge;
    private boolean atFirstLine;
    @NotNull
    private LineEdgeStatus edgeStatus;

    public ItemWriterState(@NotNull final ItemStyle style) {
        this(style.isLastChild(), style.getEdge());
    }

    public ItemWriterState(final boolean lastChild, @NotNull final EdgeConfig edge) {
        this.lastChild = lastChild;
        this.edge = edge;
        atFirstLine = true;
        edgeStatus = LineEdgeStatus.LINE_START;
    }

    public boolean isLastChild() {
        return lastChild;
    }

    @NotNull
    public EdgeConfig getEdge() {
        return edge;
    }

    public boolean isAtFirstLine() {
        return atFirstLine;
    }

    /**
     * @return {@code true} if nothing is written on the current line at this depth
     */
    public boolean isAtLineHead() {
        return edgeStatus == LineEdgeStatus.LINE_START;
    }

    @NotNull
    LineEdgeStatus getEdgeStatus() {
        return edgeStatus;
    }

    boolean isPrefixWhitespace() {
        return edge.isPrefixWhitespace(lastChild, atFirstLine);
    }

    void writePrefix(@NotNull final Appendable out) throws IOException {
        if (edgeStatus != LineEdgeStatus.LINE_START) {
            throw new IllegalStateException("Prefix should be emitted only once for each line, status: " + edgeStatus);
        }
        edgeStatus = LineEdgeStatus.PREFIX_EMITTED;
        edge.writeEdge(out, lastChild, atFirstLine, PrefixPart.PREFIX);
    }

    void writePadding(@NotNull final Appendable out) throws IOException {
        if (edgeStatus != LineEdgeStatus.PREFIX_EMITTED) {
            throw new IllegalStateException("Padding should be emitted only once after each line prefix, status: " + edgeStatus);
        }
        edgeStatus = LineEdgeStatus.PADDING_EMITTED;
        edge.writeEdge(out, lastChild, atFirstLine, PrefixPart.PADDING);
    }

    void resetLineState() {
        atFirstLine = false;
        edgeStatus = LineEdgeStatus.LINE_START;
    }

    @Override
    public String toString() {
        return "ItemWriterState{lastChild=" + lastChild + ", atFirstLine=" + atFirstLine + ", " + edgeStatus + '}';
    }
}
