package com.example.rabbitwatch.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans an alert batch out to a workspace's channels.
 *
 * Each channel gets the part of the batch matching its severity and
 * server filters; channels left with nothing are skipped. Deliveries run
 * concurrently on the delivery pool and are joined settle-all: one
 * channel failing, hanging in its retry loop, or throwing never changes
 * another channel's result.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final Map<ChannelType, ChannelTransport<?>> transports = new EnumMap<>(ChannelType.class);
    private final DeliveryRetrier retrier;
    private final Executor deliveryExecutor;

    public NotificationDispatcher(List<ChannelTransport<?>> transports,
                                  DeliveryRetrier retrier,
                                  @Qualifier("deliveryExecutor") Executor deliveryExecutor) {
        for (ChannelTransport<?> transport : transports) {
            this.transports.put(transport.type(), transport);
        }
        this.retrier = retrier;
        this.deliveryExecutor = deliveryExecutor;
    }

    /**
     * Deliver {@code batch} to every target that wants part of it.
     *
     * @return one entry per target that received a delivery attempt, in target order
     */
    public List<ChannelDelivery> dispatchAll(List<ChannelTarget> targets, AlertBatch batch) {
        List<CompletableFuture<ChannelDelivery>> futures = new ArrayList<>();
        for (ChannelTarget target : targets) {
            AlertBatch selected = target.select(batch);
            if (selected.isEmpty()) {
                log.debug("Skipping {}: no alerts match its filters", target.describe());
                continue;
            }
            CompletableFuture<ChannelDelivery> future;
            try {
                future = CompletableFuture.supplyAsync(() -> deliver(target, selected), deliveryExecutor);
            } catch (RejectedExecutionException e) {
                log.error("Delivery to {} rejected: {}", target.describe(), e.getMessage());
                future = CompletableFuture.completedFuture(new ChannelDelivery(target.channelId(), target.type(),
                        DeliveryResult.failure(null, 0, "Delivery rejected: delivery pool saturated")));
            }
            futures.add(future.exceptionally(e -> {
                log.error("Delivery to {} aborted: {}", target.describe(), e.getMessage());
                return new ChannelDelivery(target.channelId(), target.type(),
                        DeliveryResult.failure(null, 0, "Delivery aborted"));
            }));
        }

        List<ChannelDelivery> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ChannelDelivery> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    /** Format a batch for one channel without sending it. */
    public Object buildChannelPayload(ChannelTarget target, AlertBatch batch) {
        return transportFor(target.type()).buildPayload(target, batch);
    }

    private ChannelDelivery deliver(ChannelTarget target, AlertBatch batch) {
        ChannelTransport<?> transport = transports.get(target.type());
        if (transport == null) {
            return new ChannelDelivery(target.channelId(), target.type(),
                    DeliveryResult.failure(null, 0, "No transport for channel type " + target.type().getValue()));
        }
        return new ChannelDelivery(target.channelId(), target.type(), deliverWith(transport, target, batch));
    }

    private <P> DeliveryResult deliverWith(ChannelTransport<P> transport, ChannelTarget target, AlertBatch batch) {
        P payload;
        try {
            payload = transport.buildPayload(target, batch);
        } catch (RuntimeException e) {
            log.error("Could not build {} payload for {}", target.type().getValue(), target.describe(), e);
            return DeliveryResult.failure(null, 0, "Could not build payload");
        }
        return retrier.execute(target.describe(), () -> transport.send(target, payload));
    }

    private ChannelTransport<?> transportFor(ChannelType type) {
        ChannelTransport<?> transport = transports.get(type);
        if (transport == null) {
            throw new IllegalStateException("No transport registered for " + type.getValue());
        }
        return transport;
    }
}
