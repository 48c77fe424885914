package fr.lapetina.pixelator.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating StripeEvent instances in the Disruptor ring buffer.
 *
 * The ring buffer of a call is sized to hold every stripe of that call,
 * so all slots are allocated once, before the first task is published.
 */
public final class StripeEventFactory implements EventFactory<StripeEvent> {

    @Override
    public StripeEvent newInstance() {
        return new StripeEvent();
    }
}
