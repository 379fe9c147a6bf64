package com.inferdispatch.core.model;

/**
 * Naming conventions carried by serving instance identifiers.
 */
public final class InstanceIds {
    private InstanceIds() {
    }

    /**
     * Marker embedded in the id of instances that only continue migrated or decoding work.
     */
    public static final String DECODE_MARKER = "decode";

    /**
     * Returns whether the instance is reserved for decode work and must never receive fresh requests.
     *
     * @param instanceId Instance identifier
     * @return true if the id carries the decode marker
     */
    public static boolean isDecodeOnly(String instanceId) {
        return instanceId != null && instanceId.contains(DECODE_MARKER);
    }
}
