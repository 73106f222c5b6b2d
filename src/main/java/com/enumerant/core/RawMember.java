package com.enumerant.core;

import lombok.Value;

import java.util.List;

/**
 * A constant as the host declares it, before duplicate resolution and tag hoisting.
 */
@Value
public class RawMember<T extends Number> {
    String name;
    T value;
    List<Object> tags;
}
