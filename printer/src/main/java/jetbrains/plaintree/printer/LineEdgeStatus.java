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

/**
 * Progress of drawing the decoration of the current line at a single depth. Advances in declaration
 * order once per line and returns to {@linkplain #LINE_START} on the next line.
 */
enum LineEdgeStatus {

    /**
     * Nothing is drawn yet on the current line.
     */
    LINE_START,
    /**
     * The prefix is drawn, the padding is not.
     */
    PREFIX_EMITTED,
    /**
     * Both the prefix and the padding are drawn.
     */
    PADDING_EMITTED
}
