package in.tickbridge.infrastructure.broker.flattrade;

/**
 * Result of one upstream connect handshake.
 */
public enum HandshakeOutcome {
    /** {@code {t:"ck", s:"OK"}} received in time. */
    ACCEPTED,
    /** No frame arrived within the ack timeout. */
    TIMEOUT,
    /** Ack was negative, malformed, or not an ack at all. */
    REJECTED,
    /** Open, send, or receive failed at the transport level. */
    TRANSPORT_ERROR
}
