package com.questrail.edgecontrol.evaluation;

import com.questrail.edgecontrol.api.SensorRef;
import com.questrail.edgecontrol.api.SensorSample;
import com.questrail.edgecontrol.store.BoundedStore;

import java.util.Optional;

/**
 * Latest sample per local sensor, fed by the transport's sample stream.
 * An older sample never replaces a newer one.
 */
public final class SampleCache {

    private final BoundedStore<SensorRef, SensorSample> samples;

    public SampleCache(int capacity) {
        this.samples = new BoundedStore<>("samples", capacity);
    }

    public void accept(SensorSample sample) {
        synchronized (samples) {
            Optional<SensorSample> current = samples.peek(sample.sensor());
            if (current.isPresent() && current.get().timestamp().isAfter(sample.timestamp())) {
                return;
            }
            samples.put(sample.sensor(), sample);
        }
    }

    public Optional<SensorSample> latest(SensorRef sensor) {
        return samples.get(sensor);
    }

    public int size() {
        return samples.size();
    }
}
