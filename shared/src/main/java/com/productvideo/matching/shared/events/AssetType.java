package com.productvideo.matching.shared.events;

public enum AssetType {
    IMAGE("image"),
    VIDEO("video");

    private final String wireName;

    AssetType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AssetType fromWireName(String value) {
        for (AssetType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown asset type: " + value);
    }
}
