package com.giftsbuyer.application.purchase;

import com.giftsbuyer.application.ports.RecipientInfo;
import com.giftsbuyer.domain.acquisition.Recipient;
import com.giftsbuyer.domain.purchase.PurchaseOutcome;

public record RecipientResult(Recipient recipient, RecipientInfo info, PurchaseOutcome outcome) {}
