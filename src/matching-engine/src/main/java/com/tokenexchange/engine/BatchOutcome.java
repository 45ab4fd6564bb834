package com.tokenexchange.engine;

import com.tokenexchange.engine.domain.Trade;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Result of one batch. A {@link OutcomeType#NOTICE} carries the encoded trades; a
 * {@link OutcomeType#REPORT} carries an error message and no trades.
 */
public final class BatchOutcome {

    public enum OutcomeType {
        NOTICE,
        REPORT
    }

    private final OutcomeType type;
    private final byte[] tradePayload;
    private final List<Trade> trades;
    private final ErrorKind errorKind;
    private final String message;
    private final String configWarning;
    private final List<InstrumentFailure> failures;
    private final BatchStatistics statistics;

    private BatchOutcome(OutcomeType type, byte[] tradePayload, List<Trade> trades,
                         ErrorKind errorKind, String message, String configWarning,
                         List<InstrumentFailure> failures, BatchStatistics statistics) {
        this.type = type;
        this.tradePayload = tradePayload;
        this.trades = trades;
        this.errorKind = errorKind;
        this.message = message;
        this.configWarning = configWarning;
        this.failures = failures;
        this.statistics = statistics;
    }

    public static BatchOutcome notice(byte[] tradePayload, List<Trade> trades, String configWarning,
                                      List<InstrumentFailure> failures, BatchStatistics statistics) {
        return new BatchOutcome(OutcomeType.NOTICE, tradePayload.clone(), List.copyOf(trades),
            null, null, configWarning, List.copyOf(failures), statistics);
    }

    public static BatchOutcome report(ErrorKind errorKind, String message, BatchStatistics statistics) {
        return new BatchOutcome(OutcomeType.REPORT, null, List.of(), errorKind, message,
            null, List.of(), statistics);
    }

    public OutcomeType getType() {
        return type;
    }

    public boolean isNotice() {
        return type == OutcomeType.NOTICE;
    }

    /**
     * @return the ABI-encoded trades of a notice, or {@code null} for a report
     */
    public byte[] getTradePayload() {
        return tradePayload == null ? null : tradePayload.clone();
    }

    /**
     * Bytes to hand to the rollup: the trade payload of a notice, or the UTF-8
     * report message.
     */
    public byte[] getResponsePayload() {
        if (isNotice()) {
            return getTradePayload();
        }
        return getReportMessage().getBytes(StandardCharsets.UTF_8);
    }

    public List<Trade> getTrades() {
        return trades;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return {@code "<kind>: <message>"} for a report, {@code null} for a notice
     */
    public String getReportMessage() {
        return errorKind == null ? null : errorKind.label() + ": " + message;
    }

    public Optional<String> getConfigWarning() {
        return Optional.ofNullable(configWarning);
    }

    public List<InstrumentFailure> getFailures() {
        return failures;
    }

    public BatchStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "BatchOutcome{" +
                "type=" + type +
                ", trades=" + trades.size() +
                ", errorKind=" + errorKind +
                ", message='" + message + '\'' +
                ", failures=" + failures.size() +
                ", statistics=" + statistics +
                '}';
    }
}
