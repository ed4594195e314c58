/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.windowedensemble.serialize;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.state.DetectionMapper;
import com.amazon.windowedensemble.state.DetectionRequest;
import com.amazon.windowedensemble.state.DetectionResponse;
import com.amazon.windowedensemble.state.WindowSummaryState;
import com.amazon.windowedensemble.testutils.NormalMixtureTestData;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;

public class DetectionSerDeTest {

    private DetectionSerDe serDe;
    private DetectionRequest request;

    @BeforeEach
    public void setUp() {
        serDe = new DetectionSerDe();
        request = new DetectionRequest();
        request.setFeatures(new NormalMixtureTestData().generateWithPlantedOutliers(90, 2, new int[] { 44 }, 17L)
                .getData());
        request.setWindowSize(45);
        request.getPrimaryGrid().put("numberOfTrees", Collections.singletonList(25.0));
        request.getPrimaryGrid().put("contamination", Arrays.asList(0.02, 0.05));
        request.getSecondaryGrid().put("nu", Arrays.asList(0.05, 0.1));
        request.getSecondaryGrid().put("gamma", Collections.singletonList(0.1));
    }

    @Test
    public void testRequestRoundTrip() {
        String json = serDe.toJson(request);
        DetectionRequest copy = serDe.requestFromJson(json);
        assertEquals(request, copy);
    }

    @Test
    public void testHandle() {
        String responseJson = serDe.handle(serDe.toJson(request));
        DetectionResponse response = serDe.responseFromJson(responseJson);
        DetectionResponse expected = new DetectionMapper().detect(request);

        assertArrayEquals(expected.getLabels(), response.getLabels());
        assertEquals(expected.getPrimaryScores(), response.getPrimaryScores());
        assertEquals(expected.getSecondaryScores(), response.getSecondaryScores());
        assertEquals(expected.getWindows(), response.getWindows());
        assertEquals(2, response.getWindows().size());
        assertEquals(90, response.getLabels().length);
    }

    @Test
    public void testMissingFieldsTakeDefaults() {
        DetectionRequest parsed = serDe.requestFromJson("{\"features\": [[0.1, 1.0], [0.3, 2.0], [5.0, 0.5]]}");
        assertEquals(150, parsed.getWindowSize());
        assertTrue(parsed.isStandardize());
        assertEquals(0.6, parsed.getPrimaryWeight());
        assertEquals(0.5, parsed.getDecisionThreshold());
        assertTrue(parsed.getSecondaryGrid().isEmpty());
    }

    @Test
    public void testFallbackParametersSurviveSerialization() {
        DetectionRequest tiny = new DetectionRequest();
        tiny.setFeatures(new double[][] { { 1.0, 2.0 } });
        DetectionResponse response = serDe.responseFromJson(serDe.handle(serDe.toJson(tiny)));

        WindowSummaryState window = response.getWindows().get(0);
        assertEquals("INSUFFICIENT_WINDOW_SIZE", window.getPrimaryFallbackReason());
        assertTrue(Double.isNaN(window.getPrimaryParameters().get("contamination")));
        assertTrue(Double.isNaN(window.getSecondaryParameters().get("gamma")));
        assertEquals(-1.0, response.getPrimaryScores().get(0));
    }

    @Test
    public void testCustomGson() {
        DetectionSerDe pretty = new DetectionSerDe(new DetectionMapper(),
                new GsonBuilder().serializeSpecialFloatingPointValues().setPrettyPrinting().create());
        String json = pretty.toJson(request);
        assertTrue(json.contains("\n"));
        assertEquals(request, pretty.requestFromJson(json));
    }

    @Test
    public void testInvalidRequests() {
        assertThrows(IllegalArgumentException.class, () -> serDe.handle(""));
        assertThrows(JsonSyntaxException.class, () -> serDe.handle("{\"windowSize\": \"many\"}"));
        assertThrows(IllegalArgumentException.class,
                () -> serDe.handle("{\"features\": [[1.0]], \"windowSize\": 0}"));
        assertThrows(IllegalArgumentException.class,
                () -> serDe.handle("{\"features\": [[1.0]], \"decisionThreshold\": 1.5}"));
        assertThrows(IllegalArgumentException.class,
                () -> serDe.handle("{\"features\": [[1.0]], \"primaryGrid\": {\"nu\": [0.1]}}"));
        assertThrows(NullPointerException.class, () -> serDe.handle("{\"windowSize\": 10}"));
    }

    @Test
    public void testGridPointValuesAreDoubles() {
        GridPoint point = GridPoint.builder().put("numberOfTrees", 50).build();
        assertEquals("{\"numberOfTrees\":50.0}", serDe.getGson().toJson(point.asMap()));
    }
}
