/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.complexsvd.math.csvd;

/**
 * Shape precondition of {@link ComplexSVD} violated. Raised before anything
 * is mutated; retrying with the same arguments fails the same way.
 *
 */
public class InvalidDimensionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        N_LESS_THAN_ONE, N_OVER_CAPACITY, M_LESS_THAN_ONE, M_LESS_THAN_N
    }

    private final Kind m_kind;

    public InvalidDimensionException(Kind kind, String message) {
        super(message);
        m_kind = kind;
    }

    public Kind getKind() {
        return m_kind;
    }

}
