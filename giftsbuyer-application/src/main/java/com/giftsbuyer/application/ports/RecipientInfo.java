package com.giftsbuyer.application.ports;

/**
 * Resolved recipient: a display reference ("@name" or the numeric id) and the handle
 * (empty when the account has none).
 */
public record RecipientInfo(String displayReference, String handle) {

    public RecipientInfo {
        displayReference = (displayReference == null) ? "" : displayReference;
        handle = (handle == null) ? "" : handle;
    }
}
