package com.incidentmigrator.common.marker;

/**
 * One piece of a tokenised monitor message. Concatenating the {@link #text()} of every segment
 * reproduces the message.
 */
public sealed interface MessageSegment
        permits MessageSegment.Literal, MessageSegment.ProviderMarker, MessageSegment.DestinationMarker {

    String text();

    record Literal(String text) implements MessageSegment {}

    record ProviderMarker(Provider provider, String serviceKey, String text) implements MessageSegment {}

    record DestinationMarker(String text) implements MessageSegment {}
}
