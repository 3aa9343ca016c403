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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Style of a single ruled line: solid, dashed or double. Solid and dashed lines are either narrow or
 * bold, double lines have no width.
 *
 * @see UnicodeEdgeConfigBuilder
 */
public final class EdgeStyle {

    private static final EdgeStyle DOUBLE_LINE = new EdgeStyle(null, null);
    private static final List<EdgeStyle> ALL;

    static {
        final List<EdgeStyle> all = new ArrayList<>();
        for (final EdgeWidth width : EdgeWidth.values()) {
            all.add(solid(width));
            for (final DashLevel level : DashLevel.values()) {
                all.add(dashed(width, level));
            }
        }
        all.add(DOUBLE_LINE);
        ALL = Collections.unmodifiableList(all);
    }

    @Nullable
    private final EdgeWidth width;
    @Nullable
    private final DashLevel dashLevel;

    private EdgeStyle(@Nullable final EdgeWidth width, @Nullable final DashLevel dashLevel) {
        this.width = width;
        this.dashLevel = dashLevel;
    }

    public static EdgeStyle solid(@NotNull final EdgeWidth width) {
        return new EdgeStyle(width, null);
    }

    public static EdgeStyle dashed(@NotNull final EdgeWidth width, @NotNull final DashLevel dashLevel) {
        return new EdgeStyle(width, dashLevel);
    }

    public static EdgeStyle doubleLine() {
        return DOUBLE_LINE;
    }

    /**
     * @return all distinct edge styles: solid and dashed lines of every width and dash level, and the
     * double line
     */
    public static List<EdgeStyle> values() {
        return ALL;
    }

    public boolean isSolid() {
        return width != null && dashLevel == null;
    }

    public boolean isDashed() {
        return dashLevel != null;
    }

    public boolean isDouble() {
        return width == null;
    }

    /**
     * @return width of solid or dashed line, {@code null} for double line
     */
    @Nullable
    public EdgeWidth getWidth() {
        return width;
    }

    @Nullable
    public DashLevel getDashLevel() {
        return dashLevel;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EdgeStyle)) {
            return false;
        }
        final EdgeStyle that = (EdgeStyle) obj;
        return width == that.width && dashLevel == that.dashLevel;
    }

    @Override
    public int hashCode() {
        return (width == null ? 0 : width.hashCode() * 31) + (dashLevel == null ? 0 : dashLevel.hashCode());
    }

    @Override
    public String toString() {
        if (width == null) {
            return "Double";
        }
        return dashLevel == null ? "Solid(" + width + ')' : "Dashed(" + width + ", " + dashLevel + ')';
    }
}
