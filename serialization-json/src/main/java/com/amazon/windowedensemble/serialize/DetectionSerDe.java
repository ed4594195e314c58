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

import lombok.Getter;

import com.amazon.windowedensemble.state.DetectionMapper;
import com.amazon.windowedensemble.state.DetectionRequest;
import com.amazon.windowedensemble.state.DetectionResponse;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * JSON adapter for the request/response boundary of the detector. Internally we
 * use the {@link DetectionMapper} class to run a detection pass for a
 * {@link DetectionRequest}, and we use
 * <a href="https://github.com/google/gson">Gson</a> to read requests and write
 * responses. The Gson instance is exposed so users can customize the output
 * (e.g., by enabling pretty printing).
 */
@Getter
public class DetectionSerDe {

    private final DetectionMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization. Fallback
     * parameters may hold NaN, which the default Gson instance writes as a bare
     * {@code NaN} token.
     */
    public DetectionSerDe() {
        this(new DetectionMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper A DetectionMapper instance, used to run requests.
     * @param gson   A Gson instance used to read requests and write responses.
     */
    public DetectionSerDe(DetectionMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    public DetectionRequest requestFromJson(String json) {
        return gson.fromJson(json, DetectionRequest.class);
    }

    public String toJson(DetectionRequest request) {
        return gson.toJson(request);
    }

    public DetectionResponse responseFromJson(String json) {
        return gson.fromJson(json, DetectionResponse.class);
    }

    public String toJson(DetectionResponse response) {
        return gson.toJson(response);
    }

    /**
     * Reads a request, runs it and writes the response.
     *
     * @param requestJson a JSON encoded {@link DetectionRequest}
     * @return a JSON encoded {@link DetectionResponse}
     * @throws IllegalArgumentException if the request is not a valid configuration
     */
    public String handle(String requestJson) {
        DetectionRequest request = requestFromJson(requestJson);
        if (request == null) {
            throw new IllegalArgumentException("empty request");
        }
        return toJson(mapper.detect(request));
    }
}
