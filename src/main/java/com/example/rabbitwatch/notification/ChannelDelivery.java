package com.example.rabbitwatch.notification;

/**
 * A delivery result tagged with the channel it belongs to.
 */
public record ChannelDelivery(String channelId, ChannelType type, DeliveryResult result) {
}
