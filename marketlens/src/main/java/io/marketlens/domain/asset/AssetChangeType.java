package io.marketlens.domain.asset;

/**
 * Tag recorded on each asset snapshot naming the change that produced it.
 */
public enum AssetChangeType {
    CREATED("created"),
    ISSUED_MORE("issued_more"),
    CHANGED_DESCRIPTION("changed_description"),
    LOCKED("locked"),
    TRANSFERRED("transferred");

    private final String tag;

    AssetChangeType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Any tag other than the four structural ones is an issuance.
     */
    public static AssetChangeType fromTag(String tag) {
        for (AssetChangeType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        return ISSUED_MORE;
    }
}
