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
package jetbrains.plaintree.util;

import org.jetbrains.annotations.NotNull;

/**
 * A single line of text yielded by {@linkplain LineIterator}: the line content without the line
 * feed and the flag telling if there are no more lines after it.
 */
public final class Line {

    @NotNull
    private final CharSequence content;
    private final boolean last;

    public Line(@NotNull final CharSequence content, final boolean last) {
        this.content = content;
        this.last = last;
    }

    @NotNull
    public CharSequence getContent() {
        return content;
    }

    public boolean isLast() {
        return last;
    }

    public boolean isEmpty() {
        return content.length() == 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Line)) {
            return false;
        }
        final Line that = (Line) obj;
        return last == that.last && content.toString().equals(that.content.toString());
    }

    @Override
    public int hashCode() {
        return content.toString().hashCode() * 31 + (last ? 1 : 0);
    }

    @Override
    public String toString() {
        return "Line{'" + content + "', last=" + last + '}';
    }
}
