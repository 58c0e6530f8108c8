package com.giftsbuyer.domain.purchase;

import java.util.List;
import java.util.Locale;

/**
 * Maps a purchase failure to {@link PurchaseErrorKind}.
 *
 * Order:
 *  1) exact match on the structured error code (when the failure carries one)
 *  2) substring match on the failure message (fallback for uncoded errors)
 *  3) UNCLASSIFIED
 *
 * Never throws.
 */
public final class PurchaseErrorClassifier {

    private static final List<PurchaseErrorKind> CANDIDATES = List.of(
            PurchaseErrorKind.BALANCE_TOO_LOW,
            PurchaseErrorKind.USAGE_LIMITED,
            PurchaseErrorKind.INVALID_RECIPIENT
    );

    public PurchaseErrorKind classify(Throwable failure) {
        if (failure == null) return PurchaseErrorKind.UNCLASSIFIED;
        String code = (failure instanceof CodedFailure cf) ? cf.errorCode() : null;
        return classify(code, describe(failure));
    }

    public PurchaseErrorKind classify(String errorCode, String message) {
        if (errorCode != null && !errorCode.isBlank()) {
            String normalized = errorCode.trim().toUpperCase(Locale.ROOT);
            for (PurchaseErrorKind kind : CANDIDATES) {
                if (kind.platformCodes().contains(normalized)) return kind;
            }
        }

        if (message != null && !message.isBlank()) {
            for (PurchaseErrorKind kind : CANDIDATES) {
                for (String token : kind.platformCodes()) {
                    if (message.contains(token)) return kind;
                }
            }
        }
        return PurchaseErrorKind.UNCLASSIFIED;
    }

    /** Message text used for matching and for the raw error shown to the operator. */
    public static String describe(Throwable failure) {
        if (failure == null) return "";
        String msg = failure.getMessage();
        if (msg == null || msg.isBlank()) return failure.getClass().getSimpleName();
        return msg;
    }
}
