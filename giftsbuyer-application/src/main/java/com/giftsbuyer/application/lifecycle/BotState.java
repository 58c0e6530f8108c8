package com.giftsbuyer.application.lifecycle;

public enum BotState {
    RUNNING,
    STOPPED
}
