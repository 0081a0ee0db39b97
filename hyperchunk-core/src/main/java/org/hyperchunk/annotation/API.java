/*
 * API.java
 *
 * This source file is part of the Hyperchunk open source project
 *
 * Copyright 2026 the Hyperchunk project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.hyperchunk.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, constructor, field or method of Hyperchunk is for code outside of this library.
 *
 * <p>
 * Members of an annotated type inherit the type's status unless they carry their own annotation. A status may be
 * raised at any time but may only be lowered as the description of the current status allows.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that another Hyperchunk package can reach it. May change without notice.
         */
        INTERNAL,

        /**
         * Kept for existing callers only. May be removed in the next minor release.
         */
        DEPRECATED,

        /**
         * Still being designed. May change or disappear in any release.
         */
        EXPERIMENTAL,

        /**
         * Will not change before the next minor release.
         */
        UNSTABLE,

        /**
         * Used by code outside of the library. Will not change incompatibly before the next major release.
         */
        MAINTAINED,

        /**
         * Will not change incompatibly or be removed before the next major release.
         */
        STABLE
    }
}
