package com.foamcase.dict.testing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public final class TestResources {

    private TestResources() {}

    /** Reads a dictionary fixture from {@code src/test/resources/dictionaries}. */
    public static String dictionary(String name) throws IOException {
        String resourceName = "dictionaries/" + name;
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("Missing classpath resource: " + resourceName);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
