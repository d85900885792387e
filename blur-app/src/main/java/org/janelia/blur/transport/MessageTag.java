package org.janelia.blur.transport;

/**
 * Logical channels between two ranks.  Each tile field travels on its own channel
 * so that scalar fields never interleave with pixel payloads.
 */
public enum MessageTag {

    SIZE(0),
    WIDTH(1),
    HEIGHT(2),
    DEPTH(3),
    DATA(4);

    private final int code;

    MessageTag(final int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
