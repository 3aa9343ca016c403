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

import jetbrains.plaintree.PlainTreeException;

/**
 * Thrown by {@linkplain UnicodeEdgeConfigBuilder#build()} if there is no Unicode box drawing character
 * for the requested combination of line styles. The builder's settings can't be used to draw a tree.
 */
public class UnsupportedEdgeCombinationException extends PlainTreeException {

    public UnsupportedEdgeCombinationException(String message) {
        super(message);
    }
}
