package in.tickbridge.infrastructure.broker.flattrade;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tickbridge.domain.feed.FeedClass;
import in.tickbridge.domain.feed.SymbolIdentity;

import java.util.Collection;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * FlatTrade (Noren) streaming frames.
 *
 * <pre>
 * connect:     {"t":"c","uid":..,"actid":..,"source":"API","susertoken":..}
 * connect ack: {"t":"ck","s":"OK"}
 * subscribe:   {"t":"d"|"t","k":"NSE|22#NSE|2885"}
 * tick:        {"t":"df"|"tf"|"d"|"t","tk":"22","lp":..,"o":..,"h":..,"l":..,"c":..,"v":..}
 * </pre>
 */
public final class FeedProtocol {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String TYPE_CONNECT = "c";
    public static final String TYPE_CONNECT_ACK = "ck";
    public static final String KEY_SEPARATOR = "#";

    private FeedProtocol() {}

    public static String handshake(String userId, String credential) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("t", TYPE_CONNECT);
        o.put("uid", userId);
        o.put("actid", userId);
        o.put("source", "API");
        o.put("susertoken", credential);
        return o.toString();
    }

    /**
     * Replace-the-set subscription frame carrying every member of the class.
     */
    public static String subscription(FeedClass feedClass, Collection<SymbolIdentity> members) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("t", feedClass.wireCode());
        o.put("k", members.stream()
            .map(SymbolIdentity::subscriptionKey)
            .collect(Collectors.joining(KEY_SEPARATOR)));
        return o.toString();
    }

    public static HandshakeOutcome evaluateAck(String raw) {
        Optional<JsonNode> ack = parse(raw);
        if (ack.isEmpty()) {
            return HandshakeOutcome.REJECTED;
        }
        JsonNode a = ack.get();
        boolean ok = TYPE_CONNECT_ACK.equals(frameType(a))
            && "ok".equalsIgnoreCase(a.path("s").asText(""));
        return ok ? HandshakeOutcome.ACCEPTED : HandshakeOutcome.REJECTED;
    }

    /**
     * @return the parsed object, or empty if the text is not a JSON object
     */
    public static Optional<JsonNode> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(raw);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public static String frameType(JsonNode frame) {
        return frame.path("t").asText("");
    }

    public static String token(JsonNode frame) {
        return frame.path("tk").asText("");
    }
}
