package com.example.routex.service.delivery;

/**
 * Aggregate result of one broadcast run.
 *
 * @param queued recipients that got a delivery row (dedup skips are not counted)
 */
public record DeliveryReport(int queued, int sent, int failed) {

    public static final DeliveryReport EMPTY = new DeliveryReport(0, 0, 0);
}
