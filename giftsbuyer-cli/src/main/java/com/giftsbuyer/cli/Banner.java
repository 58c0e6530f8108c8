package com.giftsbuyer.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/** Startup banner with name/version from app.properties. */
final class Banner {

    private static final Logger log = LoggerFactory.getLogger(Banner.class);

    private static final String RESOURCE = "/app.properties";

    private Banner() {}

    static String render() {
        Properties p = new Properties();
        try (InputStream in = Banner.class.getResourceAsStream(RESOURCE)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            log.debug("Could not read {}, using default banner", RESOURCE, e);
            p.clear();
        }
        String name = p.getProperty("app.name", "Gifts Buyer");
        String version = p.getProperty("app.version", "dev");
        String line = "=".repeat(name.length() + version.length() + 7);
        return line + "\n  " + name + " v" + version + "\n" + line;
    }
}
