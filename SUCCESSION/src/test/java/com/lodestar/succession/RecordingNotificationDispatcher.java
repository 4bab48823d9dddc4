package com.lodestar.succession;

import com.lodestar.succession.notification.NotificationDispatcher;
import com.lodestar.succession.notification.NotificationRequest;
import com.lodestar.succession.notification.NotificationTemplate;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keeps every dispatched notification for assertions.
 */
public class RecordingNotificationDispatcher implements NotificationDispatcher {

    private final List<NotificationRequest> sent = new CopyOnWriteArrayList<>();

    @Override
    public void dispatch(NotificationRequest request) {
        sent.add(request);
    }

    public List<NotificationRequest> sent() {
        return List.copyOf(sent);
    }

    public List<NotificationRequest> sent(NotificationTemplate template) {
        return sent.stream()
                .filter(request -> request.templateKey().equals(template.key()))
                .collect(Collectors.toList());
    }

    public List<String> recipients(NotificationTemplate template) {
        return sent(template).stream()
                .map(NotificationRequest::recipientId)
                .collect(Collectors.toList());
    }

    public void clear() {
        sent.clear();
    }
}
