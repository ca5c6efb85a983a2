package com.ryuqq.viewstore.core.config;

/**
 * Store settings (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>idProperty: top-level property holding the item id (default {@code "id"})</li>
 *   <li>generateIds: assign a generated id to added items that lack one (default true)</li>
 *   <li>copyOnRead: hand out deep copies from {@code get} so callers cannot alias stored items (default true)</li>
 * </ul>
 *
 * @author ViewStore Team
 * @since 1.0.0
 * @param idProperty id property name (non-blank)
 * @param generateIds whether missing ids are generated
 * @param copyOnRead whether reads return deep copies
 */
public record StoreConfig(String idProperty, boolean generateIds, boolean copyOnRead) {

    public static final String DEFAULT_ID_PROPERTY = "id";

    /**
     * Default settings: idProperty="id", generateIds=true, copyOnRead=true.
     */
    public StoreConfig() {
        this(DEFAULT_ID_PROPERTY, true, true);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if idProperty is null or blank
     */
    public StoreConfig {
        if (idProperty == null || idProperty.isBlank()) {
            throw new IllegalArgumentException("idProperty cannot be null or blank");
        }
    }

    /**
     * Copy with another id property.
     *
     * @param idProperty property holding the item id
     * @return new configuration
     * @throws IllegalArgumentException if idProperty is null or blank
     */
    public StoreConfig withIdProperty(String idProperty) {
        return new StoreConfig(idProperty, this.generateIds, this.copyOnRead);
    }

    /**
     * Copy with id generation switched.
     *
     * @param generateIds whether items added without an id receive one
     * @return new configuration
     */
    public StoreConfig withGenerateIds(boolean generateIds) {
        return new StoreConfig(this.idProperty, generateIds, this.copyOnRead);
    }

    /**
     * Copy with copy-on-read switched.
     *
     * @param copyOnRead whether stored items are isolated from caller-held instances
     * @return new configuration
     */
    public StoreConfig withCopyOnRead(boolean copyOnRead) {
        return new StoreConfig(this.idProperty, this.generateIds, copyOnRead);
    }
}
