package io.marketlens.domain.ledger;

import io.marketlens.domain.asset.CallbackEvent;
import io.marketlens.domain.market.Order;
import io.marketlens.domain.market.OrderFilter;

import java.util.List;

/**
 * Read-only view of the live ledger daemon.
 */
public interface LedgerService {

    /**
     * Open orders matching all filters, unexpired, ordered by block index ascending.
     */
    List<Order> getOpenOrders(List<OrderFilter> filters);

    /**
     * Callbacks of an asset ordered by block index ascending.
     */
    List<CallbackEvent> getCallbacks(String asset);

    /**
     * Total XCP in existence, raw units.
     */
    long getXcpSupply();

    LedgerStatus getStatus();
}
