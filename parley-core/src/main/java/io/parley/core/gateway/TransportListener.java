package io.parley.core.gateway;

public interface TransportListener {
    void onMessage(String frame);

    void onClosed(String reason, Throwable cause);
}
