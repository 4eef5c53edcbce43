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
package com.pluscode.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.pluscode.CodeArea;
import com.pluscode.util.shapes.BBox;

import java.io.IOException;

/**
 * The center is not read, it is derived from the bounds.
 */
class CodeAreaDeserializer extends JsonDeserializer<CodeArea> {
    @Override
    public CodeArea deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        JsonNode json = jsonParser.readValueAsTree();
        if (!json.has("bbox") || !json.has("code_length"))
            throw new IllegalArgumentException("code area needs 'bbox' and 'code_length' but was " + json);

        JsonNode bboxNode = json.get("bbox");
        double[] coords = new double[bboxNode.size()];
        for (int i = 0; i < coords.length; i++) {
            coords[i] = bboxNode.get(i).asDouble();
        }
        BBox bounds = BBox.fromGeoJson(coords);
        return new CodeArea(bounds.minLat, bounds.minLon, bounds.maxLat, bounds.maxLon, json.get("code_length").asInt());
    }
}
