package com.giftsbuyer.infrastructure.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.giftsbuyer.domain.gift.Gift;

/** On-disk form of one snapshot entry. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
record GiftRecord(@JsonProperty("id") String id,
                  @JsonProperty("price") int price,
                  @JsonProperty("is_limited") boolean limited,
                  @JsonProperty("is_sold_out") boolean soldOut,
                  @JsonProperty("total_amount") Integer totalAmount,
                  @JsonProperty("remaining_amount") Integer remainingAmount,
                  @JsonProperty("upgrade_price") Integer upgradePrice) {

    static GiftRecord from(Gift g) {
        return new GiftRecord(g.id(), g.price(), g.limited(), g.soldOut(),
                g.totalAmount(), g.remainingAmount(), g.upgradePrice());
    }

    Gift toGift() {
        return new Gift(id, price, limited, soldOut, totalAmount, remainingAmount, upgradePrice);
    }
}
