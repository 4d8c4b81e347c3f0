package io.tracebridge.core.backend;

public record DeliveryResult(boolean success, String message) {

    public static DeliveryResult ok() {
        return new DeliveryResult(true, "");
    }

    public static DeliveryResult error(String message) {
        return new DeliveryResult(false, message == null ? "" : message);
    }
}
