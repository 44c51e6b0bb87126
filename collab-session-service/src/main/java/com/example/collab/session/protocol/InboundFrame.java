package com.example.collab.session.protocol;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InboundFrame {
    private final String text;
    private final byte[] binary;

    public static InboundFrame text(String text) {
        return new InboundFrame(text, null);
    }

    public static InboundFrame binary(byte[] binary) {
        return new InboundFrame(null, binary);
    }

    public boolean isText() {
        return text != null;
    }
}
