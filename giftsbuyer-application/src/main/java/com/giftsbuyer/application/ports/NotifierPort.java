package com.giftsbuyer.application.ports;

public interface NotifierPort {
    void send(String message);
}
