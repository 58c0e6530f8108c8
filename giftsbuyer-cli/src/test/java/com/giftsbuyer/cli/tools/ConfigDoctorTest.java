package com.giftsbuyer.cli.tools;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigDoctorTest {

    private static String run(StubConfig cfg, int expectedCode) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int code = ConfigDoctor.run(cfg, new PrintStream(buf, true, StandardCharsets.UTF_8));
        assertThat(code).isEqualTo(expectedCode);
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void validConfigListsRangesAndMasksTheToken() {
        String out = run(new StubConfig()
                .with("TELEGRAM_BOT_TOKEN", "123456:ABCDEFGH")
                .with("gifts.ranges", "1-100: 1000 x 2: @alice"), 0);

        assertThat(out).contains("TELEGRAM_BOT_TOKEN = 12***GH")
                .doesNotContain("ABCDEFGH")
                .contains("1-100 (supply<=1000) x2 -> [@alice]")
                .contains("Config OK");
    }

    @Test
    void problemsAreListed() {
        String out = run(new StubConfig().with("gifts.ranges", "oops"), 2);

        assertThat(out).contains("Missing required secret: TELEGRAM_BOT_TOKEN")
                .contains("Invalid gift range format: 'oops'");
    }

    @Test
    void masking() {
        assertThat(ConfigDoctor.mask(null)).isEqualTo("<empty>");
        assertThat(ConfigDoctor.mask("abc")).isEqualTo("***");
    }
}
