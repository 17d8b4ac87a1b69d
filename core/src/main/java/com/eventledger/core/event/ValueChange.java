package com.eventledger.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Before/after pair carried by edit and rename events.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ValueChange<T> {

    private final T previous;
    private final T current;

    @JsonCreator
    public ValueChange(@JsonProperty("previous") T previous, @JsonProperty("current") T current) {
        this.previous = previous;
        this.current = current;
    }

    @JsonIgnore
    public boolean isChanged() {
        return !Objects.equals(previous, current);
    }
}
