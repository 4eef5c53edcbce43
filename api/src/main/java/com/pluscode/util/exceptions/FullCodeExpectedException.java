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

import java.util.Collections;
import java.util.Map;

/**
 * Thrown if a short or otherwise non-full code is passed where only a full code can be handled.
 */
public class FullCodeExpectedException extends PlusCodeException {

    private final String code;

    public FullCodeExpectedException(String code) {
        super("Full code expected but was: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public Reason getReason() {
        return Reason.FULL_CODE_EXPECTED;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Collections.<String, Object>singletonMap("code", code);
    }
}
