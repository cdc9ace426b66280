package io.hearthwarrio.formweaver.examples;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Paths;

final class Pages {

    private Pages() {
        // utility class
    }

    /**
     * File URL of a fixture page under {@code src/test/resources/pages}.
     */
    static String url(String name) {
        URL resource = Pages.class.getResource("/pages/" + name);
        if (resource == null) {
            throw new IllegalStateException("Fixture page not found: " + name);
        }
        try {
            return Paths.get(resource.toURI()).toUri().toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Bad fixture URL: " + resource, e);
        }
    }
}
