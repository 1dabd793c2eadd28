package io.parley.core.gateway;

@FunctionalInterface
public interface GatewayStatusListener {
    void onStatusChange(GatewayStatus previous, GatewayStatus current);
}
