package org.dxworks.jovialframe.model.query;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.jovialframe.model.Span;

import java.util.Objects;

@JsonPropertyOrder({"uri", "span"})
public final class Location {

    private final String uri;
    private final Span span;

    public Location(String uri, Span span) {
        this.uri = uri;
        this.span = span;
    }

    public String getUri() {
        return uri;
    }

    public Span getSpan() {
        return span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location location = (Location) o;
        return Objects.equals(uri, location.uri) && span.equals(location.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uri, span);
    }

    @Override
    public String toString() {
        return uri + "@" + span;
    }
}
