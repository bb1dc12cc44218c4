package com.demoBank.atmDemo.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading JSON files from the classpath.
 * Used for the bank seed data that is loaded once at process start.
 */
public class JsonFileLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonFileLoader() {}

    /**
     * Loads a JSON file from the classpath as a String.
     *
     * @param resourcePath The path to the JSON file (e.g., "data/bank-seed.json")
     * @return The JSON content as a String
     * @throws IOException if the file cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a JSON file from the classpath and deserializes it to the specified type.
     *
     * @param resourcePath The path to the JSON file
     * @param clazz The class to deserialize the JSON into
     * @param <T> The type to deserialize to
     * @return An instance of the specified type
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> T loadAsObject(String resourcePath, Class<T> clazz) throws IOException {
        return objectMapper.readValue(loadAsString(resourcePath), clazz);
    }
}
