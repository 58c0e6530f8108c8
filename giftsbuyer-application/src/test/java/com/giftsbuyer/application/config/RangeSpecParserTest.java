package com.giftsbuyer.application.config;

import com.giftsbuyer.domain.acquisition.AcquisitionRange;
import com.giftsbuyer.domain.acquisition.Recipient;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RangeSpecParserTest {

    private final RangeSpecParser parser = new RangeSpecParser();

    @Test
    void parsesRangesInDeclaredOrder() {
        RangeSpecParser.Result r = parser.parse("1-1000: 500000 x 2: @alice, 123456789; 1001-5000: 10000 X 1: bob");

        assertThat(r.errors()).isEmpty();
        assertThat(r.ranges()).hasSize(2);

        AcquisitionRange first = r.ranges().get(0);
        assertThat(first.minPrice()).isEqualTo(1);
        assertThat(first.maxPrice()).isEqualTo(1000);
        assertThat(first.supplyLimit()).isEqualTo(500_000);
        assertThat(first.quantity()).isEqualTo(2);
        assertThat(first.recipients()).containsExactly(Recipient.ofHandle("alice"), Recipient.ofId(123456789L));

        assertThat(r.ranges().get(1).recipients()).containsExactly(Recipient.ofHandle("bob"));
    }

    @Test
    void invalidEntriesAreReportedAndSkipped() {
        RangeSpecParser.Result r = parser.parse("10-1: 5 x 1: @a; 1-10 5 x 1 @b; 1-10: five x 1: @c; 1-10: 5 x 1: @ok");

        assertThat(r.ranges()).extracting(AcquisitionRange::recipients)
                .containsExactly(java.util.List.of(Recipient.ofHandle("ok")));
        assertThat(r.errors()).hasSize(3)
                .allSatisfy(e -> assertThat(e).startsWith("Invalid gift range format"));
        assertThat(r.errors().get(2)).contains("supply limit is not a number");
    }

    @Test
    void missingRecipientsIsAnError() {
        RangeSpecParser.Result r = parser.parse("1-10: 5 x 1:  ");

        assertThat(r.ranges()).isEmpty();
        assertThat(r.errors()).singleElement().asString().contains("at least one recipient");
    }

    @Test
    void blankInputYieldsNothing() {
        assertThat(parser.parse("  ").ranges()).isEmpty();
        assertThat(parser.parse(null).errors()).isEmpty();
    }
}
