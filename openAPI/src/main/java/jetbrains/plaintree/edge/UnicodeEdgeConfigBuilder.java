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
import org.jetbrains.annotations.Nullable;

/**
 * Builds {@linkplain UnicodeEdgeConfig} from independent line styles:
 * <ul>
 * <li>vertical backward: the vertical line above the junction, towards the previous sibling;</li>
 * <li>vertical forward: the vertical line below the junction, towards the next sibling;</li>
 * <li>horizontal: the line between the junction and the item content;</li>
 * <li>corner: the shape of the junction of the last item.</li>
 * </ul>
 * By default, all lines are narrow solid and the corner is angle, that is the same as
 * {@linkplain StandardEdgeConfig#UNICODE_SINGLE_WIDTH} (or {@linkplain StandardEdgeConfig#UNICODE_DOUBLE_WIDTH}
 * with {@linkplain AmbiWidth#DOUBLE}).
 * <pre>
 *     final EdgeConfig edge = new UnicodeEdgeConfigBuilder(AmbiWidth.SINGLE)
 *         .vertical(EdgeStyle.solid(EdgeWidth.BOLD))
 *         .horizontal(EdgeStyle.dashed(EdgeWidth.BOLD, DashLevel.TRIPLE))
 *         .build();
 * </pre>
 * Not every combination has box drawing characters, in that case {@linkplain #build()} fails.
 */
public class UnicodeEdgeConfigBuilder {

    @NotNull
    private final AmbiWidth ambiWidth;
    @NotNull
    private EdgeStyle verticalBackward;
    @NotNull
    private EdgeStyle verticalForward;
    @NotNull
    private EdgeStyle horizontal;
    @NotNull
    private CornerStyle corner;

    public UnicodeEdgeConfigBuilder() {
        this(AmbiWidth.SINGLE);
    }

    public UnicodeEdgeConfigBuilder(@NotNull final AmbiWidth ambiWidth) {
        this.ambiWidth = ambiWidth;
        verticalBackward = EdgeStyle.solid(EdgeWidth.NARROW);
        verticalForward = verticalBackward;
        horizontal = verticalBackward;
        corner = CornerStyle.ANGLE;
    }

    /**
     * Sets both backward and forward vertical line style.
     */
    public UnicodeEdgeConfigBuilder vertical(@NotNull final EdgeStyle style) {
        verticalBackward = style;
        verticalForward = style;
        return this;
    }

    public UnicodeEdgeConfigBuilder verticalBackward(@NotNull final EdgeStyle style) {
        verticalBackward = style;
        return this;
    }

    public UnicodeEdgeConfigBuilder verticalForward(@NotNull final EdgeStyle style) {
        verticalForward = style;
        return this;
    }

    public UnicodeEdgeConfigBuilder horizontal(@NotNull final EdgeStyle style) {
        horizontal = style;
        return this;
    }

    public UnicodeEdgeConfigBuilder corner(@NotNull final CornerStyle corner) {
        this.corner = corner;
        return this;
    }

    /**
     * @return edge config drawing the configured lines
     * @throws UnsupportedEdgeCombinationException if Unicode has no character for some position
     */
    @NotNull
    public UnicodeEdgeConfig build() throws UnsupportedEdgeCombinationException {
        final Character precedingFirstFirst =
            UnicodeGlyphs.precedingFirstFirst(verticalBackward, verticalForward, horizontal);
        if (precedingFirstFirst == null) {
            throw unsupported("junction of vertical backward " + verticalBackward +
                ", vertical forward " + verticalForward + " and horizontal " + horizontal);
        }
        final Character lastFirstFirst = UnicodeGlyphs.lastFirstFirst(verticalBackward, horizontal, corner);
        if (lastFirstFirst == null) {
            throw unsupported(corner + " corner of vertical " + verticalBackward + " and horizontal " + horizontal);
        }
        final Character precedingSucceedingFirst = UnicodeGlyphs.precedingSucceedingFirst(verticalForward);
        if (precedingSucceedingFirst == null) {
            throw unsupported("vertical line " + verticalForward);
        }
        final Character anyFirstSucceeding = UnicodeGlyphs.anyFirstSucceeding(horizontal);
        if (anyFirstSucceeding == null) {
            throw unsupported("horizontal line " + horizontal);
        }
        return new UnicodeEdgeConfig(ambiWidth,
            precedingFirstFirst, lastFirstFirst, anyFirstSucceeding, precedingSucceedingFirst);
    }

    /**
     * @return edge config drawing the configured lines, or {@code null} if Unicode has no character for
     * some position
     */
    @Nullable
    public UnicodeEdgeConfig tryBuild() {
        try {
            return build();
        } catch (UnsupportedEdgeCombinationException e) {
            return null;
        }
    }

    private static UnsupportedEdgeCombinationException unsupported(@NotNull final String what) {
        return new UnsupportedEdgeCombinationException("No box drawing character for " + what);
    }
}
