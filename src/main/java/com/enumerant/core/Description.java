package com.enumerant.core;

import lombok.NonNull;
import lombok.Value;

/**
 * Human-readable text attached to a member; the default preferred textual tag.
 */
@Value
public class Description {
    @NonNull
    String text;
}
