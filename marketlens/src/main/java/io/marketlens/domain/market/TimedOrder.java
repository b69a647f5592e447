package io.marketlens.domain.market;

import java.time.Instant;

/**
 * Order annotated with the time of the block that recorded it. blockTime is null when the
 * block is not yet replicated to the record store.
 */
public record TimedOrder(Order order, Instant blockTime) {
}
