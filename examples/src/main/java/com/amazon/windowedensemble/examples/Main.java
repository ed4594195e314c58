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

package com.amazon.windowedensemble.examples;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.amazon.windowedensemble.examples.detection.AgreementExample;
import com.amazon.windowedensemble.examples.detection.DualModelDetectionExample;
import com.amazon.windowedensemble.examples.detection.ParallelDetectionExample;
import com.amazon.windowedensemble.examples.serialization.JsonRequestExample;

public class Main {

    public static final String ARCHIVE_NAME = "windowedensemble-examples-1.0.jar";

    /**
     * Runs every registered example in command order.
     */
    public static final String RUN_ALL = "all";

    public static void main(String[] args) throws Exception {
        new Main().run(args);
    }

    private final Map<String, Example> examplesByCommand = new TreeMap<>();

    public Main() {
        register(new DualModelDetectionExample());
        register(new AgreementExample());
        register(new ParallelDetectionExample());
        register(new JsonRequestExample());
    }

    private void register(Example example) {
        Example previous = examplesByCommand.put(example.command(), example);
        if (previous != null) {
            throw new IllegalStateException("duplicate example command " + example.command());
        }
    }

    /**
     * @param args one or more example commands, or {@value #RUN_ALL}
     * @throws Exception if an example fails
     */
    public void run(String[] args) throws Exception {
        if (args == null || args.length < 1 || "-h".equals(args[0]) || "--help".equals(args[0])) {
            printUsage();
            return;
        }

        List<Example> selected = new ArrayList<>();
        for (String command : args) {
            if (RUN_ALL.equals(command)) {
                selected.addAll(examplesByCommand.values());
            } else if (examplesByCommand.containsKey(command)) {
                selected.add(examplesByCommand.get(command));
            } else {
                throw new IllegalArgumentException("No such example: " + command);
            }
        }

        for (Example example : selected) {
            System.out.printf("== %s ==%n", example.command());
            example.run();
        }
    }

    public void printUsage() {
        System.out.printf("Usage: java -cp %s %s [example ...]%n", ARCHIVE_NAME, Main.class.getName());
        int width = examplesByCommand.keySet().stream().mapToInt(String::length).max().orElse(RUN_ALL.length());
        String row = "  %-" + Math.max(width, RUN_ALL.length()) + "s  %s%n";
        System.out.println("Examples:");
        examplesByCommand.values().forEach(e -> System.out.printf(row, e.command(), e.description()));
        System.out.printf(row, RUN_ALL, "run every example");
    }
}
