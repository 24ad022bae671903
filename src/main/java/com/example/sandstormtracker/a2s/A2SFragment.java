package com.example.sandstormtracker.a2s;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One packet of a split response.
 */
@Getter
@ToString(exclude = "payload")
@AllArgsConstructor
public class A2SFragment {
    private final int requestId;
    private final int total;
    private final int number;
    private final byte[] payload;
}
