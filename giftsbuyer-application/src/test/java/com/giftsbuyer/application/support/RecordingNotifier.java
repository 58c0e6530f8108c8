package com.giftsbuyer.application.support;

import com.giftsbuyer.application.ports.NotifierPort;

import java.util.ArrayList;
import java.util.List;

public class RecordingNotifier implements NotifierPort {

    public final List<String> messages = new ArrayList<>();

    @Override
    public synchronized void send(String message) {
        messages.add(message);
    }

    public synchronized List<String> containing(String fragment) {
        return messages.stream().filter(m -> m.contains(fragment)).toList();
    }
}
