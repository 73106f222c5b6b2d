package com.enumerant.core;

import lombok.NonNull;
import lombok.Value;

/**
 * Serialized name of a member, used when the member travels under a different spelling than its own
 * name. Formatted and parsed through {@link com.enumerant.format.Selector#MEMBER_VALUE}.
 */
@Value
public class MemberValue {
    @NonNull
    String value;
}
