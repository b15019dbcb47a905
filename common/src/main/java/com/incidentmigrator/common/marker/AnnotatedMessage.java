package com.incidentmigrator.common.marker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A monitor message held as an ordered list of literal and marker segments.
 *
 * <p>Instances are immutable; every edit returns a new message. Removing markers joins the
 * neighbouring text with a single space and keeps line breaks.
 */
public final class AnnotatedMessage {

    private final Provider provider;
    private final List<MessageSegment> segments;

    private AnnotatedMessage(Provider provider, List<MessageSegment> segments) {
        this.provider = provider;
        this.segments = Collections.unmodifiableList(segments);
    }

    public static AnnotatedMessage parse(String message, Provider provider) {
        return new AnnotatedMessage(provider, new ArrayList<>(MarkerGrammar.tokenize(message, provider)));
    }

    public List<String> providerServiceKeys() {
        return segments.stream()
                .filter(MessageSegment.ProviderMarker.class::isInstance)
                .map(segment -> ((MessageSegment.ProviderMarker) segment).serviceKey())
                .toList();
    }

    public List<String> destinationMarkers() {
        return segments.stream()
                .filter(MessageSegment.DestinationMarker.class::isInstance)
                .map(MessageSegment::text)
                .toList();
    }

    public AnnotatedMessage withoutDestinationMarkers() {
        return without(MessageSegment.DestinationMarker.class::isInstance);
    }

    public AnnotatedMessage withoutProviderMarkers() {
        return without(MessageSegment.ProviderMarker.class::isInstance);
    }

    /**
     * Appends a marker, separated from the existing text by one space.
     */
    public AnnotatedMessage append(String marker) {
        var base = render().stripTrailing();
        return parse(base.isEmpty() ? marker : base + " " + marker, provider);
    }

    public String render() {
        return segments.stream().map(MessageSegment::text).collect(Collectors.joining());
    }

    @Override
    public String toString() {
        return render();
    }

    private AnnotatedMessage without(Predicate<MessageSegment> removed) {
        var kept = new ArrayList<MessageSegment>();
        var seam = false;
        for (var segment : segments) {
            if (removed.test(segment)) {
                seam = true;
                continue;
            }
            if (!seam || kept.isEmpty()) {
                kept.add(segment);
                continue;
            }
            var lastIndex = kept.size() - 1;
            var previous = kept.get(lastIndex);
            var literal = segment instanceof MessageSegment.Literal;
            if (previous instanceof MessageSegment.Literal previousLiteral) {
                var joined = join(previousLiteral.text(), literal ? segment.text() : "", lastIndex == 0);
                kept.set(lastIndex, new MessageSegment.Literal(joined));
                if (!literal) {
                    kept.add(segment);
                }
            } else {
                kept.add(new MessageSegment.Literal(join("", literal ? segment.text() : "", false)));
                if (!literal) {
                    kept.add(segment);
                }
            }
            seam = false;
        }
        return new AnnotatedMessage(provider, trimEnds(kept));
    }

    private static String join(String left, String right, boolean atStart) {
        var head = stripTrailingBlanks(left);
        var tail = stripLeadingBlanks(right);
        if (atStart && head.isEmpty()) {
            return tail;
        }
        if (head.endsWith("\n") && tail.startsWith("\n")) {
            return head + tail.substring(1);
        }
        if (head.endsWith("\n") || tail.startsWith("\n")) {
            return head + tail;
        }
        return head + " " + tail;
    }

    private static List<MessageSegment> trimEnds(List<MessageSegment> kept) {
        if (kept.isEmpty()) {
            return kept;
        }
        if (kept.get(0) instanceof MessageSegment.Literal first) {
            kept.set(0, new MessageSegment.Literal(first.text().stripLeading()));
        }
        var lastIndex = kept.size() - 1;
        if (kept.get(lastIndex) instanceof MessageSegment.Literal last) {
            kept.set(lastIndex, new MessageSegment.Literal(last.text().stripTrailing()));
        }
        kept.removeIf(segment -> segment instanceof MessageSegment.Literal && segment.text().isEmpty());
        return kept;
    }

    private static String stripLeadingBlanks(String text) {
        var index = 0;
        while (index < text.length() && isBlank(text.charAt(index))) {
            index++;
        }
        return text.substring(index);
    }

    private static String stripTrailingBlanks(String text) {
        var end = text.length();
        while (end > 0 && isBlank(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }
}
