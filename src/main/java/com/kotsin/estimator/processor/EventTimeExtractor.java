package com.kotsin.estimator.processor;

import com.kotsin.estimator.model.KeyedInput;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.streams.processor.TimestampExtractor;

/**
 * Uses an input's {@code eventTime} when present, otherwise the record (or partition) time.
 */
public class EventTimeExtractor implements TimestampExtractor {

    @Override
    public long extract(ConsumerRecord<Object, Object> record, long partitionTime) {
        if (record.value() instanceof KeyedInput input) {
            Long eventTime = input.getEventTime();
            if (eventTime != null && eventTime > 0) {
                return eventTime;
            }
        }
        long rt = record.timestamp();
        return rt > 0 ? rt : Math.max(partitionTime, 0L);
    }
}
