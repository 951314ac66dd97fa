package com.umitunal.egserial.padding;

/**
 * Allowed total sizes of a padded block. Every block spends
 * {@link PaddingCodec#INDICATOR_SIZE} bytes on the padding indicator, so the
 * payload capacity is two bytes less than the total size.
 */
public enum PaddedDataSize {
    BYTES_512(512),
    BYTES_1024(1024);

    private final int totalSize;

    PaddedDataSize(int totalSize) {
        this.totalSize = totalSize;
    }

    /**
     * Length of the encoded block, indicator included.
     */
    public int totalSize() {
        return totalSize;
    }

    /**
     * Maximum payload length that fits without truncation.
     */
    public int capacity() {
        return totalSize - PaddingCodec.INDICATOR_SIZE;
    }
}
