package com.sitecrawler.scheduler.executor;

import com.sitecrawler.scheduler.notify.Notifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingNotifier implements Notifier {

    record Message(String subject, String body) {
    }

    final List<Message> messages = new CopyOnWriteArrayList<>();

    @Override
    public void send(String subject, String body) {
        messages.add(new Message(subject, body));
    }

    List<String> subjects() {
        return messages.stream().map(Message::subject).toList();
    }
}
