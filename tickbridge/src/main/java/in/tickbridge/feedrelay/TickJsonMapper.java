package in.tickbridge.feedrelay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tickbridge.domain.feed.FeedClass;
import in.tickbridge.domain.feed.SymbolIdentity;
import in.tickbridge.infrastructure.broker.flattrade.FeedProtocol;

/**
 * Converts an upstream tick frame into the viewer-facing tick schema:
 * <pre>
 * {"symbol":"TCS","token":"22","exchange":"NSE","timestamp":1700000000,
 *  "data":{"open":..,"high":..,"low":..,"close":..,"last_price":..,"volume":..,"time":1700000000},
 *  "feed_type":"touchline"}
 * </pre>
 * Prices arrive as strings or numbers. Missing {@code lp} falls back to {@code c};
 * missing {@code o}/{@code h}/{@code l} fall back to the last price; missing
 * {@code v} is 0.
 */
public final class TickJsonMapper {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TickJsonMapper() {}

    public static ObjectNode toNode(JsonNode frame, SymbolIdentity symbol, long epochSeconds) {
        double ltp = num(frame, "lp", num(frame, "c", 0.0));

        ObjectNode o = MAPPER.createObjectNode();
        o.put("symbol", symbol.displaySymbol());
        o.put("token", symbol.wireToken());
        o.put("exchange", symbol.exchange());
        o.put("timestamp", epochSeconds);

        ObjectNode data = o.putObject("data");
        data.put("open", num(frame, "o", ltp));
        data.put("high", num(frame, "h", ltp));
        data.put("low", num(frame, "l", ltp));
        data.put("close", ltp);
        data.put("last_price", ltp);
        data.put("volume", (long) num(frame, "v", 0.0));
        data.put("time", epochSeconds);

        o.put("feed_type", FeedClass.fromTickType(FeedProtocol.frameType(frame)).label());
        return o;
    }

    public static String toJson(JsonNode frame, SymbolIdentity symbol, long epochSeconds) {
        return toNode(frame, symbol, epochSeconds).toString();
    }

    private static double num(JsonNode frame, String key, double fallback) {
        JsonNode v = frame.get(key);
        if (v == null || v.isNull()) {
            return fallback;
        }
        if (v.isNumber()) {
            return v.asDouble();
        }
        String s = v.asText().trim();
        if (s.isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
