package com.enumerant.core;

import lombok.Value;

import java.util.List;

/**
 * One named constant of a value set. Tags are in declaration order, except that the
 * preferred textual tag (if any) is moved to the front.
 */
@Value
public class Member<T extends Number> {
    T value;
    String name;
    List<Object> tags;
    // Text of the preferred tag, null when the member has none
    String description;
    // Text of the first member-value tag, null when the member has none
    String memberValue;

    /**
     * First tag of the given type, or null.
     */
    public <A> A getTag(Class<A> tagType) {
        for (var tag : tags) {
            if (tagType.isInstance(tag))
                return tagType.cast(tag);
        }
        return null;
    }

    public boolean hasTag(Class<?> tagType) {
        return getTag(tagType) != null;
    }
}
