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
import jetbrains.plaintree.edge.StandardEdgeConfig;
import org.jetbrains.annotations.NotNull;

/**
 * Style of a tree item: whether it is the last child of its parent and which {@linkplain EdgeConfig}
 * draws its edges. Siblings may have different edge configs.
 */
public final class ItemStyle {

    private final boolean lastChild;
    @NotNull
    private final EdgeConfig edge;

    public ItemStyle(final boolean lastChild) {
        this(lastChild, StandardEdgeConfig.ASCII);
    }

    public ItemStyle(final boolean lastChild, @NotNull final EdgeConfig edge) {
        this.lastChild = lastChild;
        this.edge = edge;
    }

    public boolean isLastChild() {
        return lastChild;
    }

    @NotNull
    public EdgeConfig getEdge() {
        return edge;
    }

    @Override
    public String toString() {
        return "ItemStyle{lastChild=" + lastChild + ", edge=" + edge + '}';
    }
}
