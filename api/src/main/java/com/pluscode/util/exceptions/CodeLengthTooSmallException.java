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

import java.util.LinkedHashMap;
import java.util.Map;

public class CodeLengthTooSmallException extends PlusCodeException {

    private final String code;
    private final int codeLength;

    public CodeLengthTooSmallException(String code, int codeLength, int minCodeLength) {
        super("Code " + code + " has only " + codeLength + " digits but at least " + minCodeLength + " are necessary to shorten it");
        this.code = code;
        this.codeLength = codeLength;
    }

    public String getCode() {
        return code;
    }

    public int getCodeLength() {
        return codeLength;
    }

    @Override
    public Reason getReason() {
        return Reason.CODE_LENGTH_TOO_SMALL;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>(2);
        details.put("code", code);
        details.put("code_length", codeLength);
        return details;
    }
}
