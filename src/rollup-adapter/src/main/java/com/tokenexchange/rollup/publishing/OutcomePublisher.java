package com.tokenexchange.rollup.publishing;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.tokenexchange.engine.BatchOutcome;
import com.tokenexchange.engine.BatchStatistics;
import com.tokenexchange.engine.InstrumentFailure;
import com.tokenexchange.engine.codec.HexPayloads;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Async Kafka producer wrapper for publishing batch outcomes to downstream observers.
 *
 * max.block.ms=1 keeps send() from ever blocking the sequencer thread. If the broker
 * is unreachable or the buffer is full, errors are logged and never propagated.
 */
public class OutcomePublisher {

    private static final Logger logger = LoggerFactory.getLogger(OutcomePublisher.class);
    static final String NOTICES_TOPIC = "batch-notices";
    static final String REPORTS_TOPIC = "batch-reports";

    private final Producer<String, String> producer;
    private final Gson gson;

    public OutcomePublisher(String kafkaBootstrap) {
        this(createProducer(kafkaBootstrap));
    }

    OutcomePublisher(Producer<String, String> producer) {
        this.producer = producer;
        this.gson = new Gson();
    }

    private static Producer<String, String> createProducer(String kafkaBootstrap) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrap);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "0");                  // fire-and-forget
        props.put(ProducerConfig.LINGER_MS_CONFIG, "5");
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, "16384");
        props.put(ProducerConfig.BUFFER_MEMORY_CONFIG, "33554432");
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, "1");          // never block the sequencer

        try {
            KafkaProducer<String, String> producer = new KafkaProducer<>(props);
            logger.info("Kafka producer initialized. Bootstrap: {}", kafkaBootstrap);
            return producer;
        } catch (Exception e) {
            logger.error("Failed to initialize Kafka producer: {}. "
                    + "Outcomes will not be published.", e.getMessage());
            return null;
        }
    }

    /**
     * Publish a notice to "batch-notices" or a report to "batch-reports".
     * Non-blocking; errors are logged but never propagated.
     */
    public void publish(String source, BatchOutcome outcome) {
        if (producer == null) {
            return;
        }
        try {
            String topic = outcome.isNotice() ? NOTICES_TOPIC : REPORTS_TOPIC;
            String value = gson.toJson(toJson(source, outcome));
            ProducerRecord<String, String> record = new ProducerRecord<>(topic, source, value);
            producer.send(record, (metadata, exception) -> {
                if (exception != null) {
                    logger.warn("Failed to publish batch outcome: {}", exception.getMessage());
                }
            });
        } catch (Exception e) {
            logger.warn("Error publishing batch outcome: {}", e.getMessage());
        }
    }

    JsonObject toJson(String source, BatchOutcome outcome) {
        BatchStatistics statistics = outcome.getStatistics();
        JsonObject json = new JsonObject();
        json.addProperty("type", outcome.isNotice() ? "BATCH_NOTICE" : "BATCH_REPORT");
        json.addProperty("source", source);
        if (outcome.isNotice()) {
            json.addProperty("payload", HexPayloads.toHex(outcome.getTradePayload()));
            json.addProperty("trades", statistics.tradesEmitted());
            json.addProperty("truncated", statistics.tradesTruncated());
            outcome.getConfigWarning().ifPresent(w -> json.addProperty("warning", w));
            if (!outcome.getFailures().isEmpty()) {
                JsonArray failures = new JsonArray();
                for (InstrumentFailure failure : outcome.getFailures()) {
                    failures.add(failure.describe());
                }
                json.add("failures", failures);
            }
        } else {
            json.addProperty("errorKind", outcome.getErrorKind().label());
            json.addProperty("message", outcome.getMessage());
        }
        json.addProperty("orders", statistics.ordersDecoded());
        json.addProperty("instruments", statistics.instruments());
        return json;
    }

    public void close() {
        if (producer != null) {
            try {
                producer.flush();
                producer.close();
                logger.info("Kafka producer closed.");
            } catch (Exception e) {
                logger.warn("Error closing Kafka producer: {}", e.getMessage());
            }
        }
    }
}
