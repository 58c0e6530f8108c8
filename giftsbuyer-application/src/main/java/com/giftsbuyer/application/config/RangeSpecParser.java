package com.giftsbuyer.application.config;

import com.giftsbuyer.domain.acquisition.AcquisitionRange;
import com.giftsbuyer.domain.acquisition.Recipient;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the gifts.ranges value.
 *
 * Format (ranges separated by ';', recipients by ','):
 * <pre>
 *   min-max: supplyLimit x quantity: recipient[, recipient...]
 *   1-1000: 500000 x 2: @alice, 123456789; 1001-5000: 10000 x 1: @bob
 * </pre>
 * Invalid entries are skipped and reported; valid ones keep their declared order.
 */
public final class RangeSpecParser {

    private static final Pattern SUPPLY_QTY = Pattern.compile("\\s+[xX]\\s+");

    public record Result(List<AcquisitionRange> ranges, List<String> errors) {
        public Result {
            ranges = List.copyOf(ranges);
            errors = List.copyOf(errors);
        }
    }

    public Result parse(String raw) {
        List<AcquisitionRange> ranges = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        if (raw == null || raw.isBlank()) return new Result(ranges, errors);

        for (String item : raw.split(";")) {
            String t = item.trim();
            if (t.isEmpty()) continue;
            try {
                ranges.add(parseSingle(t));
            } catch (IllegalArgumentException e) {
                errors.add("Invalid gift range format: '" + t + "' (" + e.getMessage() + ")");
            }
        }
        return new Result(ranges, errors);
    }

    AcquisitionRange parseSingle(String item) {
        String[] parts = item.split(":", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException("expected 'min-max: supply x qty: recipients'");
        }

        String[] prices = parts[0].trim().split("-");
        if (prices.length != 2) throw new IllegalArgumentException("price band must be 'min-max'");
        int minPrice = parseInt(prices[0], "min price");
        int maxPrice = parseInt(prices[1], "max price");

        String[] sq = SUPPLY_QTY.split(parts[1].trim());
        if (sq.length != 2) throw new IllegalArgumentException("supply/quantity must be 'supply x qty'");
        int supply = parseInt(sq[0], "supply limit");
        int quantity = parseInt(sq[1], "quantity");

        List<Recipient> recipients = new ArrayList<>();
        for (String r : parts[2].split(",")) {
            if (!r.isBlank()) recipients.add(Recipient.parse(r));
        }

        return new AcquisitionRange(minPrice, maxPrice, supply, quantity, recipients);
    }

    private static int parseInt(String s, String what) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " is not a number: '" + s.trim() + "'", e);
        }
    }
}
