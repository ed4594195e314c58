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

package com.amazon.windowedensemble.examples.serialization;

import java.util.Arrays;

import com.amazon.windowedensemble.examples.Example;
import com.amazon.windowedensemble.isolation.IsolationForestFamily;
import com.amazon.windowedensemble.serialize.DetectionSerDe;
import com.amazon.windowedensemble.state.DetectionMapper;
import com.amazon.windowedensemble.state.DetectionRequest;
import com.amazon.windowedensemble.state.DetectionResponse;
import com.amazon.windowedensemble.testutils.NormalMixtureTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Send a detection request as JSON. The request is written with
 * <a href="https://github.com/FasterXML/jackson">Jackson</a> and handled by the
 * Gson based {@link DetectionSerDe}; the answer is compared with a direct call
 * to the {@link DetectionMapper}.
 */
public class JsonRequestExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonRequestExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "run a detection request given as a JSON string";
    }

    @Override
    public void run() throws Exception {
        DetectionRequest request = new DetectionRequest();
        request.setFeatures(new NormalMixtureTestData().generateTestData(300, 2, 5L));
        request.getPrimaryGrid().put(IsolationForestFamily.CONTAMINATION, Arrays.asList(0.01, 0.05, 0.1));

        ObjectMapper jsonMapper = new ObjectMapper();
        String requestJson = jsonMapper.writeValueAsString(request);
        System.out.printf("request size = %d bytes%n", requestJson.getBytes().length);

        DetectionSerDe serDe = new DetectionSerDe();
        String responseJson = serDe.handle(requestJson);
        System.out.printf("response size = %d bytes%n", responseJson.getBytes().length);

        DetectionResponse response = serDe.responseFromJson(responseJson);
        DetectionResponse direct = new DetectionMapper()
                .detect(jsonMapper.readValue(requestJson, DetectionRequest.class));

        System.out.printf("flagged = %d, anomaly indices = %s%n", response.getAnomalyIndices().length,
                Arrays.toString(response.getAnomalyIndices()));

        if (!Arrays.equals(response.getLabels(), direct.getLabels())) {
            throw new IllegalStateException("JSON round trip changed the labels");
        }

        System.out.println("Looks good!");
    }
}
