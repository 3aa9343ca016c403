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

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Box drawing characters by role. Roles are named {@code <item>_<line>_<char>}:
 * <ul>
 * <li>item: {@code PRECEDING} is a non-last item, {@code LAST} is the last item, {@code ANY} is any;</li>
 * <li>line: {@code FIRST} is the first line of the item, {@code SUCCEEDING} is any other line;</li>
 * <li>char: {@code FIRST} is the first character of the prefix, {@code SUCCEEDING} is any other.</li>
 * </ul>
 * <pre>
 * root
 * |-- foo    &lt;- '|' is PRECEDING_FIRST_FIRST, '-' is ANY_FIRST_SUCCEEDING
 * |   foo2   &lt;- '|' is PRECEDING_SUCCEEDING_FIRST
 * `-- bar    &lt;- '`' is LAST_FIRST_FIRST
 *     bar2
 * </pre>
 * Unicode has no junctions of dashed lines, so dashed lines are looked up as solid lines of the same
 * width in junction tables. Combinations missing in a table have no glyph.
 */
final class UnicodeGlyphs {

    /**
     * Line style as it appears in a junction.
     */
    enum LineKind {
        NARROW,
        BOLD,
        DOUBLE;

        static LineKind of(@NotNull final EdgeStyle style) {
            if (style.isDouble()) {
                return DOUBLE;
            }
            return style.getWidth() == EdgeWidth.BOLD ? BOLD : NARROW;
        }
    }

    // (vertical backward, vertical forward, horizontal)
    private static final Map<List<Object>, Character> PRECEDING_FIRST_FIRST = new HashMap<>();
    // (vertical backward, horizontal, corner)
    private static final Map<List<Object>, Character> LAST_FIRST_FIRST = new HashMap<>();
    // vertical forward
    private static final Map<EdgeStyle, Character> PRECEDING_SUCCEEDING_FIRST = new HashMap<>();
    // horizontal
    private static final Map<EdgeStyle, Character> ANY_FIRST_SUCCEEDING = new HashMap<>();

    static {
        final LineKind narrow = LineKind.NARROW;
        final LineKind bold = LineKind.BOLD;
        final LineKind dbl = LineKind.DOUBLE;

        PRECEDING_FIRST_FIRST.put(key(narrow, narrow, narrow), '\u251c'); // ├
        PRECEDING_FIRST_FIRST.put(key(narrow, narrow, bold), '\u251d'); // ┝
        PRECEDING_FIRST_FIRST.put(key(narrow, narrow, dbl), '\u255e'); // ╞
        PRECEDING_FIRST_FIRST.put(key(narrow, bold, narrow), '\u251f'); // ┟
        PRECEDING_FIRST_FIRST.put(key(narrow, bold, bold), '\u2522'); // ┢
        PRECEDING_FIRST_FIRST.put(key(bold, narrow, narrow), '\u251e'); // ┞
        PRECEDING_FIRST_FIRST.put(key(bold, narrow, bold), '\u2521'); // ┡
        PRECEDING_FIRST_FIRST.put(key(bold, bold, narrow), '\u2520'); // ┠
        PRECEDING_FIRST_FIRST.put(key(bold, bold, bold), '\u2523'); // ┣
        PRECEDING_FIRST_FIRST.put(key(dbl, dbl, narrow), '\u255f'); // ╟
        PRECEDING_FIRST_FIRST.put(key(dbl, dbl, dbl), '\u2560'); // ╠

        LAST_FIRST_FIRST.put(key(narrow, narrow, CornerStyle.ANGLE), '\u2514'); // └
        LAST_FIRST_FIRST.put(key(narrow, narrow, CornerStyle.ROUND), '\u2570'); // ╰
        LAST_FIRST_FIRST.put(key(narrow, bold, CornerStyle.ANGLE), '\u2515'); // ┕
        LAST_FIRST_FIRST.put(key(narrow, dbl, CornerStyle.ANGLE), '\u2558'); // ╘
        LAST_FIRST_FIRST.put(key(bold, narrow, CornerStyle.ANGLE), '\u2516'); // ┖
        LAST_FIRST_FIRST.put(key(bold, bold, CornerStyle.ANGLE), '\u2517'); // ┗
        LAST_FIRST_FIRST.put(key(dbl, narrow, CornerStyle.ANGLE), '\u2559'); // ╙
        LAST_FIRST_FIRST.put(key(dbl, dbl, CornerStyle.ANGLE), '\u255a'); // ╚

        line(EdgeStyle.solid(EdgeWidth.NARROW), '\u2502', '\u2500'); // │ ─
        line(EdgeStyle.solid(EdgeWidth.BOLD), '\u2503', '\u2501'); // ┃ ━
        line(EdgeStyle.dashed(EdgeWidth.NARROW, DashLevel.DOUBLE), '\u254e', '\u254c'); // ╎ ╌
        line(EdgeStyle.dashed(EdgeWidth.NARROW, DashLevel.TRIPLE), '\u2506', '\u2504'); // ┆ ┄
        line(EdgeStyle.dashed(EdgeWidth.NARROW, DashLevel.QUADRUPLE), '\u250a', '\u2508'); // ┊ ┈
        line(EdgeStyle.dashed(EdgeWidth.BOLD, DashLevel.DOUBLE), '\u254f', '\u254d'); // ╏ ╍
        line(EdgeStyle.dashed(EdgeWidth.BOLD, DashLevel.TRIPLE), '\u2507', '\u2505'); // ┇ ┅
        line(EdgeStyle.dashed(EdgeWidth.BOLD, DashLevel.QUADRUPLE), '\u250b', '\u2509'); // ┋ ┉
        line(EdgeStyle.doubleLine(), '\u2551', '\u2550'); // ║ ═
    }

    private UnicodeGlyphs() {
    }

    /**
     * @return junction drawn in the first line of a non-last item, {@code null} if none exists
     */
    @Nullable
    static Character precedingFirstFirst(@NotNull final EdgeStyle verticalBackward,
                                         @NotNull final EdgeStyle verticalForward,
                                         @NotNull final EdgeStyle horizontal) {
        return PRECEDING_FIRST_FIRST.get(
            key(LineKind.of(verticalBackward), LineKind.of(verticalForward), LineKind.of(horizontal)));
    }

    /**
     * @return corner drawn in the first line of the last item, {@code null} if none exists
     */
    @Nullable
    static Character lastFirstFirst(@NotNull final EdgeStyle verticalBackward,
                                    @NotNull final EdgeStyle horizontal,
                                    @NotNull final CornerStyle corner) {
        return LAST_FIRST_FIRST.get(key(LineKind.of(verticalBackward), LineKind.of(horizontal), corner));
    }

    /**
     * @return vertical line drawn in succeeding lines of a non-last item
     */
    @Nullable
    static Character precedingSucceedingFirst(@NotNull final EdgeStyle verticalForward) {
        return PRECEDING_SUCCEEDING_FIRST.get(verticalForward);
    }

    /**
     * @return horizontal line drawn after the junction in the first line of any item
     */
    @Nullable
    static Character anyFirstSucceeding(@NotNull final EdgeStyle horizontal) {
        return ANY_FIRST_SUCCEEDING.get(horizontal);
    }

    private static List<Object> key(@NotNull final Object... parts) {
        return Arrays.asList(parts);
    }

    private static void line(@NotNull final EdgeStyle style, final char vertical, final char horizontal) {
        PRECEDING_SUCCEEDING_FIRST.put(style, vertical);
        ANY_FIRST_SUCCEEDING.put(style, horizontal);
    }
}
