package com.example.collab.session.protocol;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OutboundFrame {
    private final String text;
    private final byte[] binary;

    public static OutboundFrame text(String text) {
        return new OutboundFrame(text, null);
    }

    public static OutboundFrame binary(byte[] binary) {
        return new OutboundFrame(null, binary);
    }

    public boolean isText() {
        return text != null;
    }
}
