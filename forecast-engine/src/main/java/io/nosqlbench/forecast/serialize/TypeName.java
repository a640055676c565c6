package io.nosqlbench.forecast.serialize;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the serialization type name of an implementation of a polymorphic engine
 * type, such as a likelihood family or an event profile.
 *
 * <p>The value appears as the {@code "type"} field of the JSON object:
 *
 * <pre>{@code
 * { "type": "binomial", "capacity": 40 }
 * }</pre>
 *
 * @see TypeNameAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface TypeName {
    /**
     * The type name; lowercase with underscores, unique within one base type.
     * @return the type name
     */
    String value();
}
