package com.cycletrade.engine.order;

/**
 * Outcome of an order request. Refusals are values, not exceptions.
 */
public record OrderResult(
    Status status,
    PendingOrder order,     // Null unless created
    String message
) {
    public enum Status {
        CREATED,
        INSUFFICIENT_CAPITAL,
        INVALID_REQUEST
    }

    public static OrderResult created(PendingOrder order) {
        return new OrderResult(Status.CREATED, order, null);
    }

    public static OrderResult insufficientCapital(String message) {
        return new OrderResult(Status.INSUFFICIENT_CAPITAL, null, message);
    }

    public static OrderResult invalid(String message) {
        return new OrderResult(Status.INVALID_REQUEST, null, message);
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }
}
