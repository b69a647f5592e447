package io.marketlens.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketlens.domain.asset.AssetHistoryEvent;
import io.marketlens.domain.common.ServiceContext;
import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.MarketInfo;
import io.marketlens.domain.market.OhlcBucket;
import io.marketlens.domain.market.Order;
import io.marketlens.domain.market.OrderBook;
import io.marketlens.domain.market.PriceLevel;
import io.marketlens.domain.market.PriceSummary;
import io.marketlens.domain.market.ReferenceAsset;
import io.marketlens.domain.market.ReferenceQuote;
import io.marketlens.domain.market.TimedOrder;
import io.marketlens.domain.market.Trade;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Domain to JSON mapping of API responses. Decimals leave as JSON numbers (doubles), times as
 * epoch milliseconds, absent values as null.
 */
public final class MarketJson {

    private final ObjectMapper mapper;

    public MarketJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode ready(ServiceContext ctx) {
        ObjectNode node = mapper.createObjectNode();
        node.put("caught_up", ctx.caughtUp());
        node.put("last_message_index", ctx.lastMessageIndex());
        node.put("block_index", ctx.currentBlockIndex());
        node.put("testnet", ctx.testnet());
        return node;
    }

    public ObjectNode baseQuote(AssetPair pair) {
        ObjectNode node = mapper.createObjectNode();
        node.put("base_asset", pair.base());
        node.put("quote_asset", pair.quote());
        node.put("pair_name", pair.name());
        return node;
    }

    /**
     * A missing summary is the literal {@code false}, never a zero price.
     */
    public JsonNode priceSummary(Optional<PriceSummary> summary) {
        if (summary.isEmpty()) {
            return BooleanNode.FALSE;
        }
        PriceSummary s = summary.get();
        ObjectNode node = mapper.createObjectNode();
        putDecimal(node, "market_price", s.marketPrice());
        node.put("base_asset", s.pair().base());
        node.put("quote_asset", s.pair().quote());
        if (!s.lastTrades().isEmpty()) {
            ArrayNode trades = node.putArray("last_trades");
            for (Trade t : s.lastTrades()) {
                ArrayNode row = trades.addArray();
                row.add(millis(t.blockTime()));
                row.add(t.unitPrice().doubleValue());
                row.add(t.baseQuantityNormalized().doubleValue());
                row.add(t.quoteQuantityNormalized().doubleValue());
                row.add(t.blockIndex());
            }
        }
        return node;
    }

    public ObjectNode marketInfo(Map<String, MarketInfo> infos) {
        ObjectNode root = mapper.createObjectNode();
        for (MarketInfo info : infos.values()) {
            ObjectNode node = root.putObject(info.asset());
            node.put("asset", info.asset());
            putDecimal(node, "total_supply", info.totalSupply());

            ObjectNode summary = node.putObject("24h_summary");
            putDecimal(summary, "vol", info.volume24h().volume());
            summary.put("count", info.volume24h().count());

            for (ReferenceAsset reference : ReferenceAsset.values()) {
                ReferenceQuote quote = info.in(reference);
                String x = reference.suffix();
                putDecimal(node, "price_in_" + x, quote.priceIn());
                putDecimal(node, "price_as_" + x, quote.priceAs());
                putDecimal(node, "aggregated_price_in_" + x, quote.aggregatedPriceIn());
                putDecimal(node, "aggregated_price_as_" + x, quote.aggregatedPriceAs());
                putDecimal(node, "market_cap_in_" + x, quote.marketCap());
                if (quote.ohlc24h() != null) {
                    node.set("24h_ohlc_in_" + x, ohlc(quote.ohlc24h()));
                } else {
                    node.putNull("24h_ohlc_in_" + x);
                }
                putDecimal(node, "24h_vol_price_change_in_" + x, quote.change24h());

                ArrayNode history = node.putArray("7d_history_in_" + x);
                for (OhlcBucket bucket : quote.history7d()) {
                    ArrayNode point = history.addArray();
                    point.add(bucket.periodKey());
                    point.add(bucket.averagePrice().doubleValue());
                }
            }
        }
        return root;
    }

    public ArrayNode marketPriceHistory(List<OhlcBucket> rows) {
        ArrayNode array = mapper.createArrayNode();
        for (OhlcBucket row : rows) {
            ObjectNode node = ohlc(row);
            node.put("block_time", millis(row.periodStart()));
            node.put("block_index", row.periodKey());
            array.add(node);
        }
        return array;
    }

    public ArrayNode trades(List<Trade> trades) {
        ArrayNode array = mapper.createArrayNode();
        for (Trade t : trades) {
            ObjectNode node = array.addObject();
            node.put("block_index", t.blockIndex());
            node.put("block_time", millis(t.blockTime()));
            node.put("base_asset", t.baseAsset());
            node.put("quote_asset", t.quoteAsset());
            node.put("unit_price", t.unitPrice().doubleValue());
            node.put("base_quantity_normalized", t.baseQuantityNormalized().doubleValue());
            node.put("quote_quantity_normalized", t.quoteQuantityNormalized().doubleValue());
        }
        return array;
    }

    public ObjectNode orderBook(OrderBook book) {
        ObjectNode node = mapper.createObjectNode();
        node.put("base_asset", book.pair().base());
        node.put("quote_asset", book.pair().quote());
        node.set("base_bid_book", levels(book.bids()));
        node.set("base_ask_book", levels(book.asks()));
        putDecimal(node, "bid_depth", book.bidDepth());
        putDecimal(node, "ask_depth", book.askDepth());
        putDecimal(node, "bid_ask_spread", book.spread());
        putDecimal(node, "bid_ask_median", book.median());
        node.set("raw_orders", orders(book.rawOrders()));
        node.set("open_sell_orders", orders(book.openCounterOrders()));
        return node;
    }

    public ArrayNode assetHistory(List<AssetHistoryEvent> events) {
        ArrayNode array = mapper.createArrayNode();
        for (AssetHistoryEvent event : events) {
            ObjectNode node = array.addObject();
            node.put("type", event.type());
            node.put("at_block", event.atBlock());
            node.put("at_block_time", millis(event.atBlockTime()));

            if (event instanceof AssetHistoryEvent.Created e) {
                node.put("owner", e.owner());
                node.put("description", e.description());
                node.put("divisible", e.divisible());
                node.put("locked", e.locked());
                node.put("total_issued", e.totalIssued());
                putDecimal(node, "total_issued_normalized", e.totalIssuedNormalized());
            } else if (event instanceof AssetHistoryEvent.IssuedMore e) {
                node.put("additional", e.additional());
                putDecimal(node, "additional_normalized", e.additionalNormalized());
                node.put("total_issued", e.totalIssued());
                putDecimal(node, "total_issued_normalized", e.totalIssuedNormalized());
            } else if (event instanceof AssetHistoryEvent.DescriptionChanged e) {
                node.put("prev_description", e.prevDescription());
                node.put("new_description", e.newDescription());
            } else if (event instanceof AssetHistoryEvent.Transferred e) {
                node.put("prev_owner", e.prevOwner());
                node.put("new_owner", e.newOwner());
            } else if (event instanceof AssetHistoryEvent.CalledBack e) {
                putDecimal(node, "percentage", e.percentage());
            }
        }
        return array;
    }

    public ObjectNode error(String message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", message);
        return node;
    }

    private ObjectNode ohlc(OhlcBucket bucket) {
        ObjectNode node = mapper.createObjectNode();
        node.put("open", bucket.open().doubleValue());
        node.put("high", bucket.high().doubleValue());
        node.put("low", bucket.low().doubleValue());
        node.put("close", bucket.close().doubleValue());
        node.put("vol", bucket.volume().doubleValue());
        node.put("count", bucket.count());
        return node;
    }

    private ArrayNode levels(List<PriceLevel> levels) {
        ArrayNode array = mapper.createArrayNode();
        for (PriceLevel level : levels) {
            ObjectNode node = array.addObject();
            node.put("unit_price", level.unitPrice().doubleValue());
            node.put("quantity", level.quantity().doubleValue());
            node.put("count", level.count());
            node.put("depth", level.depth().doubleValue());
        }
        return array;
    }

    private ArrayNode orders(List<TimedOrder> orders) {
        ArrayNode array = mapper.createArrayNode();
        for (TimedOrder timed : orders) {
            Order o = timed.order();
            ObjectNode node = array.addObject();
            node.put("tx_hash", o.txHash());
            node.put("source", o.source());
            node.put("give_asset", o.giveAsset());
            node.put("give_quantity", o.giveQuantity());
            node.put("give_remaining", o.giveRemaining());
            node.put("get_asset", o.getAsset());
            node.put("get_quantity", o.getQuantity());
            node.put("get_remaining", o.getRemaining());
            node.put("fee_required", o.feeRequired());
            node.put("fee_provided", o.feeProvided());
            node.put("block_index", o.blockIndex());
            node.put("expiration", o.expiration());
            node.put("status", o.status());
            if (timed.blockTime() != null) {
                node.put("block_time", millis(timed.blockTime()));
            } else {
                node.putNull("block_time");
            }
        }
        return array;
    }

    private static void putDecimal(ObjectNode node, String field, BigDecimal value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value.doubleValue());
        }
    }

    private static long millis(Instant instant) {
        return instant.toEpochMilli();
    }
}
