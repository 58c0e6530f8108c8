package com.giftsbuyer.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * .env reader.
 *
 * <pre>
 *   # comment
 *   export TELEGRAM_BOT_TOKEN=123:abc
 *   gifts.ranges="1-100: 1000 x 1: @alice"   # trailing comments are allowed after unquoted or quoted values
 *   bot.language='ru'
 * </pre>
 * Double-quoted values understand \n, \" and \\. Malformed lines are logged and skipped.
 */
public final class DotEnv {

    private static final Logger log = LoggerFactory.getLogger(DotEnv.class);

    private DotEnv() {}

    public static Map<String, String> loadIfExists(Path envFile) throws IOException {
        if (envFile == null || !Files.isRegularFile(envFile)) return Map.of();
        return parse(Files.readAllLines(envFile, StandardCharsets.UTF_8), envFile.toString());
    }

    static Map<String, String> parse(List<String> lines, String source) {
        Map<String, String> out = new LinkedHashMap<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.strip();
            if (line.isEmpty() || line.charAt(0) == '#') continue;
            if (line.startsWith("export ")) line = line.substring(7).stripLeading();

            int eq = line.indexOf('=');
            String key = (eq < 0) ? "" : line.substring(0, eq).strip();
            if (key.isEmpty()) {
                log.warn("{}:{}: ignoring line without KEY=value", source, lineNo);
                continue;
            }
            out.put(key, value(line.substring(eq + 1).strip()));
        }
        return out;
    }

    private static String value(String v) {
        if (v.isEmpty()) return v;
        char q = v.charAt(0);
        if (q == '"' || q == '\'') {
            int end = v.indexOf(q, 1);
            while (q == '"' && end > 0 && v.charAt(end - 1) == '\\') end = v.indexOf(q, end + 1);
            if (end > 0) {
                String inner = v.substring(1, end);
                return (q == '"') ? unescape(inner) : inner;
            }
        }
        int hash = v.indexOf(" #");
        return (hash < 0) ? v : v.substring(0, hash).stripTrailing();
    }

    private static String unescape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char n = s.charAt(++i);
                sb.append(n == 'n' ? '\n' : n);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
