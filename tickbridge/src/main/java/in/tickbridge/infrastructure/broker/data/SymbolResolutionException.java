package in.tickbridge.infrastructure.broker.data;

/**
 * Exception thrown when a human symbol cannot be mapped to a wire token.
 */
public class SymbolResolutionException extends RuntimeException {

    private final String brokerCode;
    private final String userId;
    private final String symbol;
    private final String exchange;

    public SymbolResolutionException(String brokerCode, String userId,
                                     String symbol, String exchange, String message) {
        super(String.format("[%s:%s] %s:%s %s", brokerCode, userId, exchange, symbol, message));
        this.brokerCode = brokerCode;
        this.userId = userId;
        this.symbol = symbol;
        this.exchange = exchange;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public String getUserId() {
        return userId;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getExchange() {
        return exchange;
    }
}
