package com.mystery.case_model;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Stored cases used across the tests.
 * Sample case: Emma killed by James (jealousy), Lisa saw him with the wine bottle.
 * Test case: Nick killed by Lisa (revenge), David has no alibi, one clue belongs to nobody on the roster.
 */
public final class CaseFixtures {
    public static final String SAMPLE = "cases/sample-case.json";
    public static final String TEST = "cases/test-case.json";

    private CaseFixtures() {
    }

    public static CaseModel sampleCase() {
        return CaseGenerator.fromResource(SAMPLE);
    }

    public static CaseModel testCase() {
        return CaseGenerator.fromResource(TEST);
    }

    public static String json(String resource) {
        try (InputStream in = CaseFixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("missing fixture " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonObject jsonObject(String resource) {
        return JsonParser.parseString(json(resource)).getAsJsonObject();
    }
}
