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
package com.pluscode;

import com.pluscode.util.exceptions.PlusCodeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Wrapper containing the value or the error output of a codec operation.
 * <p>
 *
 * @author Peter Karich
 */
public class CodeResponse<T> {
    private final List<Throwable> errors = new ArrayList<>(2);
    private T value;

    public CodeResponse() {
    }

    public static <T> CodeResponse<T> of(T value) {
        return new CodeResponse<T>().setValue(value);
    }

    public static <T> CodeResponse<T> failed(Throwable error) {
        return new CodeResponse<T>().addError(error);
    }

    public CodeResponse<T> setValue(T value) {
        this.value = value;
        return this;
    }

    /**
     * Returns the value of this response.
     *
     * @throws IllegalStateException if this response is erroneous
     */
    public T get() {
        if (hasErrors())
            throw new IllegalStateException("Cannot fetch value of an erroneous response: " + errors, errors.get(0));

        return value;
    }

    public T orElse(T other) {
        return hasErrors() ? other : value;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<Throwable> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * @return the reason of the first codec error or null if there is none
     */
    public PlusCodeException.Reason getReason() {
        for (Throwable t : errors) {
            if (t instanceof PlusCodeException)
                return ((PlusCodeException) t).getReason();
        }
        return null;
    }

    public CodeResponse<T> addError(Throwable error) {
        this.errors.add(error);
        return this;
    }

    @Override
    public String toString() {
        if (hasErrors())
            return "errors: " + errors;

        return String.valueOf(value);
    }
}
