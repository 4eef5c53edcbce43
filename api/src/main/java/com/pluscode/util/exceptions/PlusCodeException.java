/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.pluscode.util.exceptions;

import java.util.Map;

/**
 * Base of all errors the codec reports. Every subclass stands for exactly one {@link Reason}.
 */
public abstract class PlusCodeException extends IllegalArgumentException {

    public enum Reason {
        INVALID_CODE,
        FULL_CODE_EXPECTED,
        CANNOT_SHORTEN_PADDED_CODES,
        CODE_LENGTH_TOO_SMALL,
        INVALID_CODE_LENGTH
    }

    protected PlusCodeException(String message) {
        super(message);
    }

    public abstract Reason getReason();

    /**
     * @return the offending input, keyed by parameter name
     */
    public abstract Map<String, Object> getDetails();
}
